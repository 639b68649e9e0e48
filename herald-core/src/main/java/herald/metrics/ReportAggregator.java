package herald.metrics;

import herald.NotifyType;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds durable samples into an {@link AggregatedReport}.
 */
public final class ReportAggregator {
  static final int TOP_ERRORS = 10;

  private ReportAggregator() {
  }

  public static AggregatedReport aggregate(Instant start, Instant end, List<MetricsSample> samples) {
    long success = samples.stream().filter(MetricsSample::isSuccess).count();
    long total = samples.size();

    Map<String, List<MetricsSample>> byService = new TreeMap<>();
    Map<NotifyType, Long> typeCounts = new EnumMap<>(NotifyType.class);
    Map<Instant, long[]> hours = new TreeMap<>();
    Map<String, ErrorAccumulator> errors = new HashMap<>();

    for (MetricsSample sample : samples) {
      byService.computeIfAbsent(sample.serviceId(), k -> new ArrayList<>()).add(sample);
      typeCounts.merge(sample.notificationType(), 1L, Long::sum);
      long[] hour = hours.computeIfAbsent(sample.timestamp().truncatedTo(ChronoUnit.HOURS), k -> new long[2]);
      hour[sample.isSuccess() ? 0 : 1]++;
      if (!sample.isSuccess() && sample.errorMessage() != null && !sample.errorMessage().isBlank()) {
        errors.computeIfAbsent(sample.errorMessage(), ErrorAccumulator::new).add(sample.timestamp());
      }
    }

    Map<String, AggregatedReport.ServiceMetrics> services = new LinkedHashMap<>();
    byService.forEach((serviceId, list) -> {
      long ok = list.stream().filter(MetricsSample::isSuccess).count();
      services.put(serviceId, new AggregatedReport.ServiceMetrics(serviceId, list.size(), ok,
          list.size() - ok, rate(ok, list.size()), average(list), percentiles(list).p95()));
    });

    List<AggregatedReport.HourlyBucket> hourly = new ArrayList<>();
    hours.forEach((hour, counts) ->
        hourly.add(new AggregatedReport.HourlyBucket(hour, counts[0] + counts[1], counts[0], counts[1])));

    List<AggregatedReport.ErrorSummary> topErrors = errors.values().stream()
        .sorted(Comparator.comparingLong((ErrorAccumulator e) -> e.count).reversed()
            .thenComparing(e -> e.last, Comparator.reverseOrder()))
        .limit(TOP_ERRORS)
        .map(e -> new AggregatedReport.ErrorSummary(e.message, e.count, e.last))
        .toList();

    return new AggregatedReport(start, end, total, success, total - success, rate(success, total),
        average(samples), percentiles(samples), services, typeCounts, hourly, topErrors);
  }

  static AggregatedReport.Latency percentiles(List<MetricsSample> samples) {
    if (samples.isEmpty()) {
      return AggregatedReport.Latency.EMPTY;
    }
    long[] sorted = samples.stream().mapToLong(MetricsSample::durationMs).sorted().toArray();
    return new AggregatedReport.Latency(nearestRank(sorted, 50), nearestRank(sorted, 90),
        nearestRank(sorted, 95), nearestRank(sorted, 99), sorted[sorted.length - 1]);
  }

  static long nearestRank(long[] sorted, int percentile) {
    int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
    return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
  }

  private static double rate(long part, long total) {
    return total == 0 ? 0.0 : part * 100.0 / total;
  }

  private static double average(List<MetricsSample> samples) {
    return samples.stream().mapToLong(MetricsSample::durationMs).average().orElse(0.0);
  }

  private static final class ErrorAccumulator {
    final String message;
    long count;
    Instant last;

    ErrorAccumulator(String message) {
      this.message = message;
    }

    void add(Instant at) {
      count++;
      if (last == null || at.isAfter(last)) {
        last = at;
      }
    }
  }
}
