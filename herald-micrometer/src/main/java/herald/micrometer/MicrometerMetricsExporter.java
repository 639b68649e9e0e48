package herald.micrometer;

import herald.NotifyType;
import herald.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are created lazily per label combination and registered with the given
 * {@link MeterRegistry}, so any Micrometer backend (Prometheus, Datadog, ...) can scrape them.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code herald.notifications{service_id,type,status}}: delivery attempts per endpoint</li>
 *   <li>{@code herald.notifications.failed{service_id,type}}: failed attempts</li>
 *   <li>{@code herald.http.requests{method,endpoint,status}}: outbound HTTP requests</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code herald.notification.duration{service_id,type}}</li>
 *   <li>{@code herald.http.request.duration{method,endpoint}}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * Every {@link #setGauge} name becomes {@code herald.<name>}, e.g. {@code herald.queue.depth}.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "herald";

  static final String STATUS_SUCCESS = "success";
  static final String STATUS_FAILED = "failed";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<Meter.Id, Meter> meters = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "herald"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.herald"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void recordDelivery(String serviceId, NotifyType type, boolean success, long durationMs) {
    if (closed) return;
    String typeCode = type.code();
    track(Counter.builder(namePrefix + ".notifications")
        .description("Notification delivery attempts per endpoint")
        .tag("service_id", serviceId)
        .tag("type", typeCode)
        .tag("status", success ? STATUS_SUCCESS : STATUS_FAILED)
        .register(registry)).increment();
    track(Timer.builder(namePrefix + ".notification.duration")
        .description("Time spent delivering to one endpoint")
        .tag("service_id", serviceId)
        .tag("type", typeCode)
        .publishPercentileHistogram()
        .register(registry)).record(Duration.ofMillis(Math.max(0, durationMs)));
    if (!success) {
      track(Counter.builder(namePrefix + ".notifications.failed")
          .description("Failed notification deliveries")
          .tag("service_id", serviceId)
          .tag("type", typeCode)
          .register(registry)).increment();
    }
  }

  @Override
  public void recordHttpRequest(String method, String endpoint, int statusCode, long durationMs) {
    if (closed) return;
    track(Counter.builder(namePrefix + ".http.requests")
        .description("Outbound HTTP requests made by endpoints")
        .tag("method", method)
        .tag("endpoint", endpoint)
        .tag("status", Integer.toString(statusCode))
        .register(registry)).increment();
    track(Timer.builder(namePrefix + ".http.request.duration")
        .description("Outbound HTTP round-trip time")
        .tag("method", method)
        .tag("endpoint", endpoint)
        .register(registry)).record(Math.max(0, durationMs), TimeUnit.MILLISECONDS);
  }

  @Override
  public void setGauge(String name, double value) {
    if (closed) return;
    AtomicLong bits = gaugeValues.computeIfAbsent(name, n -> {
      AtomicLong holder = new AtomicLong(Double.doubleToLongBits(0.0));
      track(Gauge.builder(namePrefix + "." + n, holder, h -> Double.longBitsToDouble(h.get()))
          .register(registry));
      return holder;
    });
    bits.set(Double.doubleToLongBits(value));
  }

  private <M extends Meter> M track(M meter) {
    meters.putIfAbsent(meter.getId(), meter);
    return meter;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link herald.Herald#close()} calls this when the exporter was handed to its builder.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters.values()) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    gaugeValues.clear();
    if (first != null) throw first;
  }
}
