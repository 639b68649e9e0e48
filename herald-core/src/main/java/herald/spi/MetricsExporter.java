package herald.spi;

import herald.NotifyType;

/**
 * In-process meters fed by {@link herald.metrics.MetricsRecorder}.
 *
 * <p>Implementations keep Prometheus-style counters labelled {@code {service_id, type, status}},
 * latency histograms labelled {@code {service_id, type}} and named gauges. The {@link #NOOP}
 * instance discards everything; {@code herald-micrometer} bridges to Micrometer.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records one finished delivery attempt to a single endpoint.
   *
   * @param serviceId  endpoint service id, e.g. {@code discord}
   * @param type       notification type
   * @param success    whether the endpoint accepted the notification
   * @param durationMs time spent in the endpoint, in milliseconds
   */
  void recordDelivery(String serviceId, NotifyType type, boolean success, long durationMs);

  /**
   * Records one outbound HTTP request made by an endpoint.
   *
   * @param method     HTTP method
   * @param endpoint   host or logical endpoint name (never a full URL with credentials)
   * @param statusCode response status, or {@code 0} when no response was received
   * @param durationMs round-trip time in milliseconds
   */
  default void recordHttpRequest(String method, String endpoint, int statusCode, long durationMs) {
  }

  /**
   * Sets a named gauge, e.g. {@code queue.depth} or {@code active.connections}.
   *
   * @param name  gauge name
   * @param value current value
   */
  void setGauge(String name, double value);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void recordDelivery(String serviceId, NotifyType type, boolean success, long durationMs) {
    }

    @Override
    public void setGauge(String name, double value) {
    }
  }
}
