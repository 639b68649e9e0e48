package herald.metrics;

import herald.spi.ConnectionProvider;
import herald.spi.MetricsExporter;
import herald.spi.MetricsSampleStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records deliveries to in-process meters and to the durable sample table, and builds reports
 * from the samples.
 *
 * <p>Meters go to the configured {@link MetricsExporter}. When a {@link MetricsSampleStore} is
 * configured every delivery is also appended as a {@link MetricsSample}; without one,
 * {@link #report} and {@link #purge} are unavailable.
 */
public final class MetricsRecorder {
  private static final Logger logger = Logger.getLogger(MetricsRecorder.class.getName());

  private final MetricsExporter exporter;
  private final ConnectionProvider connectionProvider;
  private final MetricsSampleStore sampleStore;
  private final Clock clock;

  private MetricsRecorder(Builder builder) {
    this.exporter = builder.exporter != null ? builder.exporter : MetricsExporter.NOOP;
    this.sampleStore = builder.sampleStore;
    this.connectionProvider = builder.connectionProvider;
    if (sampleStore != null) {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
    }
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Recorder that only feeds {@code exporter} and keeps no samples. */
  public static MetricsRecorder inMemory(MetricsExporter exporter) {
    return builder().exporter(exporter).build();
  }

  public MetricsExporter exporter() {
    return exporter;
  }

  public boolean isDurable() {
    return sampleStore != null;
  }

  /**
   * Counts the delivery in the exporter and appends it to the sample table.
   *
   * @return the stored sample, or {@code sample} itself when no store is configured
   * @throws herald.QueueBackendException if the sample cannot be stored; the meters have
   *                                      already been updated by then
   */
  public MetricsSample recordDelivery(MetricsSample sample) {
    Objects.requireNonNull(sample, "sample");
    exporter.recordDelivery(sample.serviceId(), sample.notificationType(), sample.isSuccess(),
        sample.durationMs());
    if (sampleStore == null) {
      return sample;
    }
    return connectionProvider.execute("append metrics sample", conn -> sampleStore.append(conn, sample));
  }

  /**
   * Counts one outbound HTTP request.
   *
   * @param endpoint host or logical name, never a URL with credentials
   */
  public void recordHttpRequest(String method, String endpoint, int statusCode, Duration duration) {
    exporter.recordHttpRequest(method, endpoint, statusCode, duration.toMillis());
  }

  /** Sets a named gauge such as {@code queue.depth} or {@code active.connections}. */
  public void updateGauge(String name, double value) {
    exporter.setGauge(Objects.requireNonNull(name, "name"), value);
  }

  /**
   * Builds a report over samples with {@code start <= timestamp < end}.
   *
   * @throws IllegalStateException if no sample store is configured
   * @throws IllegalArgumentException if {@code end} is before {@code start}
   */
  public AggregatedReport report(Instant start, Instant end) {
    requireStore();
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("end must not be before start");
    }
    List<MetricsSample> samples = connectionProvider.execute("load metrics samples",
        conn -> sampleStore.findBetween(conn, start, end));
    return ReportAggregator.aggregate(start, end, samples);
  }

  /** Report over the {@code period} that ends now. */
  public AggregatedReport report(Duration period) {
    Instant end = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    return report(end.minus(period), end);
  }

  /**
   * Deletes samples older than {@code olderThan} in batches.
   *
   * @return rows deleted
   */
  public int purge(Duration olderThan, int batchSize) {
    requireStore();
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    Instant cutoff = clock.instant().minus(olderThan);
    int total = 0;
    int deleted;
    do {
      deleted = connectionProvider.execute("purge metrics samples",
          conn -> sampleStore.purge(conn, cutoff, batchSize));
      total += deleted;
    } while (deleted >= batchSize);
    if (total > 0) {
      logger.log(Level.INFO, "Purged {0} metrics samples older than {1}", new Object[]{total, cutoff});
    }
    return total;
  }

  private void requireStore() {
    if (sampleStore == null) {
      throw new IllegalStateException("No MetricsSampleStore configured");
    }
  }

  /**
   * Builder for {@link MetricsRecorder}.
   */
  public static final class Builder {
    private MetricsExporter exporter;
    private ConnectionProvider connectionProvider;
    private MetricsSampleStore sampleStore;
    private Clock clock;

    private Builder() {
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder exporter(MetricsExporter exporter) {
      this.exporter = exporter;
      return this;
    }

    /** Required when a sample store is set. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Optional. Enables durable samples, reports and purging. */
    public Builder sampleStore(MetricsSampleStore sampleStore) {
      this.sampleStore = sampleStore;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public MetricsRecorder build() {
      return new MetricsRecorder(this);
    }
  }
}
