package herald.jdbc.store;

import herald.NotifyType;
import herald.jdbc.HeraldStoreException;
import herald.jdbc.JdbcTemplate;
import herald.jdbc.TableNames;
import herald.metrics.MetricsSample;
import herald.metrics.SampleStatus;
import herald.spi.MetricsSampleStore;
import herald.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only {@link MetricsSampleStore} over the {@code notification_metrics} table.
 *
 * <p>{@link #purge} selects a batch of ids and deletes them by id, which every supported
 * database accepts.
 */
public final class JdbcMetricsSampleStore implements MetricsSampleStore {
  private static final String COLUMNS = "id, job_id, scheduled_job_id, service_id, service_url, "
      + "notification_type, status, duration_ms, error_message, metadata, recorded_at";
  private static final int MAX_ERROR_LENGTH = 4000;

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<MetricsSample> rowMapper;

  public JdbcMetricsSampleStore() {
    this(TableNames.NOTIFICATION_METRICS, JsonCodec.getDefault());
  }

  public JdbcMetricsSampleStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> {
      try {
        return new MetricsSample(
            rs.getLong("id"),
            JdbcTemplate.nullableLong(rs, "job_id"),
            JdbcTemplate.nullableLong(rs, "scheduled_job_id"),
            rs.getString("service_id"),
            rs.getString("service_url"),
            NotifyType.fromCode(rs.getString("notification_type")),
            SampleStatus.fromCode(rs.getString("status")),
            rs.getLong("duration_ms"),
            rs.getString("error_message"),
            this.jsonCodec.parseObject(rs.getString("metadata")),
            JdbcTemplate.instant(rs, "recorded_at"));
      } catch (IllegalArgumentException e) {
        throw new HeraldStoreException("Corrupt metrics row " + rs.getLong("id"), e);
      }
    };
  }

  @Override
  public MetricsSample append(Connection conn, MetricsSample sample) {
    String sql = "INSERT INTO " + tableName + " (job_id, scheduled_job_id, service_id, service_url, " +
        "notification_type, status, duration_ms, error_message, metadata, recorded_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    long id = JdbcTemplate.insert(conn, sql,
        sample.jobId(), sample.scheduledJobId(), sample.serviceId(), sample.serviceUrl(),
        sample.notificationType().code(), sample.status().code(), sample.durationMs(),
        truncateError(sample.errorMessage()), jsonCodec.toJson(sample.metadata()), sample.timestamp());
    return sample.withId(id);
  }

  @Override
  public List<MetricsSample> findBetween(Connection conn, Instant start, Instant end) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE recorded_at >= ? AND recorded_at < ? ORDER BY recorded_at, id";
    return JdbcTemplate.query(conn, sql, rowMapper, start, end);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    List<Long> ids = JdbcTemplate.query(conn,
        "SELECT id FROM " + tableName + " WHERE recorded_at < ? ORDER BY recorded_at, id LIMIT ?",
        rs -> rs.getLong("id"), before, limit);
    if (ids.isEmpty()) {
      return 0;
    }
    String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE id IN (" + placeholders + ")",
        ids.toArray());
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
