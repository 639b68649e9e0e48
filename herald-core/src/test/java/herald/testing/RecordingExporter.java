package herald.testing;

import herald.NotifyType;
import herald.spi.MetricsExporter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link MetricsExporter} that keeps what it was told.
 */
public final class RecordingExporter implements MetricsExporter {
  public final List<String> deliveries = new CopyOnWriteArrayList<>();
  public final List<String> httpRequests = new CopyOnWriteArrayList<>();
  public final Map<String, Double> gauges = new ConcurrentHashMap<>();

  @Override
  public void recordDelivery(String serviceId, NotifyType type, boolean success, long durationMs) {
    deliveries.add(serviceId + ":" + type.code() + ":" + (success ? "success" : "failed"));
  }

  @Override
  public void recordHttpRequest(String method, String endpoint, int statusCode, long durationMs) {
    httpRequests.add(method + " " + endpoint + " " + statusCode);
  }

  @Override
  public void setGauge(String name, double value) {
    gauges.put(name, value);
  }
}
