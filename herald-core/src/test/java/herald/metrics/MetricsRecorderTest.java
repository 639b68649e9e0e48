package herald.metrics;

import herald.NotifyType;
import herald.QueueBackendException;
import herald.testing.FakeConnections;
import herald.testing.InMemoryMetricsSampleStore;
import herald.testing.MutableClock;
import herald.testing.RecordingExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsRecorderTest {
  private MutableClock clock;
  private RecordingExporter exporter;
  private InMemoryMetricsSampleStore store;
  private MetricsRecorder recorder;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-01-10T12:00:00Z");
    exporter = new RecordingExporter();
    store = new InMemoryMetricsSampleStore();
    recorder = MetricsRecorder.builder()
        .exporter(exporter)
        .connectionProvider(FakeConnections.provider())
        .sampleStore(store)
        .clock(clock)
        .build();
  }

  private MetricsSample sample(boolean ok, Instant at) {
    return new MetricsSample(null, 7L, null, "json", "json://host", NotifyType.WARNING,
        SampleStatus.of(ok), 25, ok ? null : "HTTP 503", Map.of(), at);
  }

  @Test
  void recordDeliveryFeedsExporterAndStore() {
    MetricsSample stored = recorder.recordDelivery(sample(true, clock.instant()));

    assertNotNull(stored.id());
    assertEquals(List.of("json:warning:success"), exporter.deliveries);
    assertEquals(1, store.all().size());
    assertTrue(recorder.isDurable());
  }

  @Test
  void reportCoversHalfOpenWindow() {
    recorder.recordDelivery(sample(true, Instant.parse("2024-01-10T11:00:00Z")));
    recorder.recordDelivery(sample(false, Instant.parse("2024-01-10T11:30:00Z")));
    recorder.recordDelivery(sample(true, Instant.parse("2024-01-10T12:00:00Z")));
    recorder.recordDelivery(sample(true, Instant.parse("2024-01-09T11:00:00Z")));

    AggregatedReport report = recorder.report(Duration.ofHours(1));

    assertEquals(Instant.parse("2024-01-10T11:00:00Z"), report.periodStart());
    assertEquals(2, report.totalNotifications());
    assertEquals(1, report.failedCount());
    assertEquals("HTTP 503", report.topErrors().get(0).message());
  }

  @Test
  void reportRejectsReversedWindow() {
    assertThrows(IllegalArgumentException.class,
        () -> recorder.report(clock.instant(), clock.instant().minusSeconds(1)));
  }

  @Test
  void purgeDeletesOldSamplesInBatches() {
    for (int i = 0; i < 5; i++) {
      recorder.recordDelivery(sample(true, Instant.parse("2023-12-01T00:00:00Z").plusSeconds(i)));
    }
    recorder.recordDelivery(sample(true, clock.instant()));

    assertEquals(5, recorder.purge(Duration.ofDays(30), 2));
    assertEquals(1, store.all().size());
  }

  @Test
  void inMemoryRecorderOnlyFeedsExporter() {
    MetricsRecorder memory = MetricsRecorder.inMemory(exporter);
    MetricsSample sample = sample(false, clock.instant());

    assertSame(sample, memory.recordDelivery(sample));
    assertFalse(memory.isDurable());
    assertEquals(List.of("json:warning:failed"), exporter.deliveries);
    assertThrows(IllegalStateException.class, () -> memory.report(Duration.ofHours(1)));
    assertThrows(IllegalStateException.class, () -> memory.purge(Duration.ofDays(1), 10));
  }

  @Test
  void gaugesAndHttpRequestsReachExporter() {
    recorder.updateGauge("queue.depth", 3);
    recorder.recordHttpRequest("POST", "hooks.example.com", 200, Duration.ofMillis(15));

    assertEquals(3.0, exporter.gauges.get("queue.depth"));
    assertEquals(List.of("POST hooks.example.com 200"), exporter.httpRequests);
  }

  @Test
  void storeFailureSurfacesAfterMetersUpdated() {
    MetricsRecorder broken = MetricsRecorder.builder()
        .exporter(exporter)
        .connectionProvider(FakeConnections.failing())
        .sampleStore(store)
        .build();

    assertThrows(QueueBackendException.class, () -> broken.recordDelivery(sample(true, clock.instant())));
    assertEquals(1, exporter.deliveries.size());
  }

  @Test
  void storeRequiresConnectionProvider() {
    assertThrows(NullPointerException.class,
        () -> MetricsRecorder.builder().sampleStore(store).build());
  }
}
