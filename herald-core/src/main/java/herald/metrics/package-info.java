/**
 * Delivery metrics: in-process meters through {@link herald.spi.MetricsExporter} and durable
 * samples aggregated into reports.
 */
package herald.metrics;
