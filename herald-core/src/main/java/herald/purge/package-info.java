/**
 * Scheduled deletion of finished jobs and old metrics samples.
 *
 * @see herald.purge.PurgeScheduler
 * @see herald.spi.Purger
 */
package herald.purge;
