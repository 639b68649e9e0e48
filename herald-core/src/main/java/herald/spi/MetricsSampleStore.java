package herald.spi;

import herald.metrics.MetricsSample;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Append-only persistence for the {@code notification_metrics} table.
 *
 * @see herald.jdbc.store.JdbcMetricsSampleStore
 */
public interface MetricsSampleStore extends Purger {

  /** Appends a sample and returns it with its generated id. */
  MetricsSample append(Connection conn, MetricsSample sample) throws SQLException;

  /** Samples with {@code start <= timestamp < end}, oldest first. */
  List<MetricsSample> findBetween(Connection conn, Instant start, Instant end) throws SQLException;

  /** Deletes up to {@code limit} samples older than {@code before}. */
  @Override
  int purge(Connection conn, Instant before, int limit) throws SQLException;
}
