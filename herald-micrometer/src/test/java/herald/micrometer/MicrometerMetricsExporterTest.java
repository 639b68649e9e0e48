package herald.micrometer;

import herald.NotifyType;
import herald.metrics.MetricsRecorder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void successfulDeliveryCountsAndTimes() {
    exporter.recordDelivery("discord", NotifyType.INFO, true, 120);
    exporter.recordDelivery("discord", NotifyType.INFO, true, 80);

    Counter counter = registry.get("herald.notifications")
        .tags("service_id", "discord", "type", "info", "status", "success").counter();
    assertEquals(2.0, counter.count());
    Timer timer = registry.get("herald.notification.duration")
        .tags("service_id", "discord", "type", "info").timer();
    assertEquals(2, timer.count());
    assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    assertNull(registry.find("herald.notifications.failed").counter());
  }

  @Test
  void failedDeliveryAlsoCountsFailures() {
    exporter.recordDelivery("json", NotifyType.ERROR, false, 15);

    assertEquals(1.0, registry.get("herald.notifications")
        .tags("service_id", "json", "status", "failed").counter().count());
    assertEquals(1.0, registry.get("herald.notifications.failed")
        .tags("service_id", "json", "type", "error").counter().count());
  }

  @Test
  void httpRequestsAreTaggedByStatus() {
    exporter.recordHttpRequest("POST", "hooks.example.com", 200, 30);
    exporter.recordHttpRequest("POST", "hooks.example.com", 503, 45);
    exporter.recordHttpRequest("POST", "hooks.example.com", 503, 50);

    assertEquals(2.0, registry.get("herald.http.requests")
        .tags("endpoint", "hooks.example.com", "status", "503").counter().count());
    assertEquals(3, registry.get("herald.http.request.duration")
        .tags("method", "POST").timer().count());
  }

  @Test
  void gaugesFollowLatestValue() {
    exporter.setGauge("queue.depth", 42);
    Gauge gauge = registry.get("herald.queue.depth").gauge();
    assertEquals(42.0, gauge.value());

    exporter.setGauge("queue.depth", 3);
    assertEquals(3.0, gauge.value());
  }

  @Test
  void customPrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "billing.herald");
    custom.setGauge("active.connections", 5);

    assertEquals(5.0, registry.get("billing.herald.active.connections").gauge().value());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "herald."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void recorderFeedsExporter() {
    MetricsRecorder recorder = MetricsRecorder.builder().exporter(exporter).build();

    recorder.recordHttpRequest("PUT", "api.example.com", 201, Duration.ofMillis(12));
    recorder.updateGauge("services.configured", 4);

    assertEquals(1.0, registry.get("herald.http.requests").tags("method", "PUT").counter().count());
    assertEquals(4.0, registry.get("herald.services.configured").gauge().value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.recordDelivery("discord", NotifyType.INFO, true, 10);
    exporter.setGauge("queue.depth", 1);

    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.recordDelivery("discord", NotifyType.INFO, true, 10);
    exporter.setGauge("queue.depth", 2);
    assertTrue(registry.getMeters().isEmpty());
  }
}
