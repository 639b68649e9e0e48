package herald.metrics;

import herald.NotifyType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Delivery statistics over {@code [periodStart, periodEnd)}, built by {@link ReportAggregator}.
 *
 * @param periodStart       inclusive start
 * @param periodEnd         exclusive end
 * @param totalNotifications deliveries in the period
 * @param successCount      successful deliveries
 * @param failedCount       failed deliveries
 * @param successRate       success percentage, {@code 0} when there were no deliveries
 * @param averageDurationMs mean endpoint time
 * @param latency           latency percentiles over all deliveries
 * @param services          per-service breakdown, keyed and ordered by service id
 * @param typeCounts        deliveries per notification type
 * @param hourly            per-hour counts (UTC), oldest first, hours without deliveries omitted
 * @param topErrors         the ten most frequent error messages
 */
public record AggregatedReport(
    Instant periodStart,
    Instant periodEnd,
    long totalNotifications,
    long successCount,
    long failedCount,
    double successRate,
    double averageDurationMs,
    Latency latency,
    Map<String, ServiceMetrics> services,
    Map<NotifyType, Long> typeCounts,
    List<HourlyBucket> hourly,
    List<ErrorSummary> topErrors) {

  /** Nearest-rank latency percentiles in milliseconds. */
  public record Latency(long p50, long p90, long p95, long p99, long max) {
    public static final Latency EMPTY = new Latency(0, 0, 0, 0, 0);
  }

  public record ServiceMetrics(
      String serviceId,
      long total,
      long successCount,
      long failedCount,
      double successRate,
      double averageDurationMs,
      long p95DurationMs) {
  }

  public record HourlyBucket(Instant hourStart, long total, long successCount, long failedCount) {
  }

  public record ErrorSummary(String message, long count, Instant lastOccurrence) {
  }
}
