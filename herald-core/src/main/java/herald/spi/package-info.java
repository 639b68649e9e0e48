/**
 * Service Provider Interfaces for storage, connections and metrics.
 *
 * <p>Store SPIs take an explicit {@link java.sql.Connection} and leave its lifecycle to the
 * caller; {@code herald-jdbc} implements them.
 *
 * @see herald.spi.ConnectionProvider
 * @see herald.spi.QueueStore
 * @see herald.spi.MetricsExporter
 */
package herald.spi;
