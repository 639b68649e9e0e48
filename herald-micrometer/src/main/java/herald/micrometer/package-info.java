/**
 * Micrometer bridge for exporting Herald delivery metrics to Prometheus, Grafana, and other
 * backends.
 *
 * @see herald.micrometer.MicrometerMetricsExporter
 */
package herald.micrometer;
