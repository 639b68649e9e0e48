/**
 * Cron expressions and the scheduler that turns them into queued jobs.
 */
package herald.schedule;
