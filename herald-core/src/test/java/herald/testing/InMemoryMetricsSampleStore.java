package herald.testing;

import herald.metrics.MetricsSample;
import herald.spi.MetricsSampleStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only {@link MetricsSampleStore} over a list.
 */
public final class InMemoryMetricsSampleStore implements MetricsSampleStore {
  private final List<MetricsSample> rows = new ArrayList<>();
  private final AtomicLong ids = new AtomicLong();

  public synchronized List<MetricsSample> all() {
    return new ArrayList<>(rows);
  }

  @Override
  public synchronized MetricsSample append(Connection conn, MetricsSample sample) {
    MetricsSample stored = sample.withId(ids.incrementAndGet());
    rows.add(stored);
    return stored;
  }

  @Override
  public synchronized List<MetricsSample> findBetween(Connection conn, Instant start, Instant end) {
    return rows.stream()
        .filter(s -> !s.timestamp().isBefore(start) && s.timestamp().isBefore(end))
        .sorted(Comparator.comparing(MetricsSample::timestamp))
        .toList();
  }

  @Override
  public synchronized int purge(Connection conn, Instant before, int limit) {
    List<MetricsSample> doomed = rows.stream()
        .filter(s -> s.timestamp().isBefore(before))
        .limit(limit)
        .toList();
    rows.removeAll(doomed);
    return doomed.size();
  }
}
