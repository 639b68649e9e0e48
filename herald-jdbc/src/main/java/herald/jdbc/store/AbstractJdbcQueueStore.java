package herald.jdbc.store;

import herald.NotifyType;
import herald.jdbc.HeraldStoreException;
import herald.jdbc.JdbcTemplate;
import herald.jdbc.TableNames;
import herald.queue.JobPayload;
import herald.queue.JobStatus;
import herald.queue.QueuedJob;
import herald.spi.QueueStore;
import herald.util.JsonCodec;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC queue store with standard SQL implementations.
 *
 * <p>The default {@link #leaseDue} selects due rows and then claims each one with a guarded
 * single-row {@code UPDATE}; a row another worker claimed first updates nothing and is
 * skipped. A {@code running} row whose {@code started_at} is before the lease expiry is due
 * again, and the guard on {@code started_at} lets only one caller take it over. Subclasses
 * override it with database-specific strategies. Register custom
 * implementations via {@code META-INF/services/herald.jdbc.store.AbstractJdbcQueueStore}.
 *
 * @see JdbcQueueStores
 */
public abstract class AbstractJdbcQueueStore implements QueueStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String LEASABLE_STATUS_IN =
      "('" + JobStatus.PENDING.code() + "','" + JobStatus.RETRYING.code() + "')";
  protected static final String TERMINAL_STATUS_IN =
      "('" + JobStatus.COMPLETED.code() + "','" + JobStatus.FAILED.code() + "')";
  /** Due-row predicate; binds {@code now} then the lease expiry. */
  protected static final String DUE_CONDITION = "((status IN " + LEASABLE_STATUS_IN +
      " AND (next_retry_at IS NULL OR next_retry_at <= ?))" +
      " OR (status='" + JobStatus.RUNNING.code() + "' AND started_at < ?))";
  protected static final String DUE_ORDER = " ORDER BY priority DESC, created_at, id";

  protected static final String COLUMNS = "id, scheduled_id, title, body, notify_type, services, tags, "
      + "metadata, template, priority, max_retries, retry_count, retry_delay_ns, status, error_message, "
      + "created_at, scheduled_at, started_at, completed_at, next_retry_at";

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<QueuedJob> rowMapper;

  protected AbstractJdbcQueueStore() {
    this(TableNames.NOTIFICATION_QUEUE, JsonCodec.getDefault());
  }

  protected AbstractJdbcQueueStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcQueueStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> {
      try {
        JobPayload payload = new JobPayload(
            rs.getString("title"),
            rs.getString("body"),
            NotifyType.fromCode(rs.getString("notify_type")),
            this.jsonCodec.parseArray(rs.getString("services")),
            this.jsonCodec.parseArray(rs.getString("tags")),
            this.jsonCodec.parseObject(rs.getString("metadata")),
            rs.getString("template"));
        return new QueuedJob(
            rs.getLong("id"),
            JdbcTemplate.nullableLong(rs, "scheduled_id"),
            payload,
            rs.getInt("priority"),
            rs.getInt("max_retries"),
            rs.getInt("retry_count"),
            Duration.ofNanos(rs.getLong("retry_delay_ns")),
            JobStatus.fromCode(rs.getString("status")),
            rs.getString("error_message"),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "scheduled_at"),
            JdbcTemplate.instant(rs, "started_at"),
            JdbcTemplate.instant(rs, "completed_at"),
            JdbcTemplate.instant(rs, "next_retry_at"));
      } catch (IllegalArgumentException e) {
        throw new HeraldStoreException("Corrupt queue row " + rs.getLong("id"), e);
      }
    };
  }

  /**
   * Unique identifier for this queue store (e.g., "mysql", "postgresql", "h2"). Also names the
   * schema resource {@code herald/schema-<name>.sql}.
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this queue store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /** Returns a copy of this store that encodes JSON columns with {@code jsonCodec}. */
  public abstract AbstractJdbcQueueStore withJsonCodec(JsonCodec jsonCodec);

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  protected JdbcTemplate.RowMapper<QueuedJob> rowMapper() {
    return rowMapper;
  }

  @Override
  public QueuedJob insert(Connection conn, QueuedJob job) {
    JobPayload p = job.payload();
    String sql = "INSERT INTO " + tableName() + " (" +
        "scheduled_id, title, body, notify_type, services, tags, metadata, template, " +
        "priority, max_retries, retry_count, retry_delay_ns, status, error_message, " +
        "created_at, scheduled_at, started_at, completed_at, next_retry_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    long id = JdbcTemplate.insert(conn, sql,
        job.scheduledId(), p.title(), p.body(), p.notifyType().code(),
        jsonCodec.toJsonArray(p.services()), jsonCodec.toJsonArray(p.tags()),
        jsonCodec.toJson(p.metadata()), p.templateName(),
        job.priority(), job.maxRetries(), job.retryCount(),
        job.retryDelay() == null ? 0L : job.retryDelay().toNanos(),
        job.status().code(), truncateError(job.errorMessage()),
        job.createdAt(), job.scheduledAt(), job.startedAt(), job.completedAt(), job.nextRetryAt());
    return job.toBuilder().id(id).build();
  }

  @Override
  public Optional<QueuedJob> findById(Connection conn, long id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, id);
  }

  @Override
  public List<QueuedJob> selectDue(Connection conn, Instant now, Instant leaseExpiry, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE " + DUE_CONDITION + DUE_ORDER + " LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, now, leaseExpiry, limit);
  }

  @Override
  public List<QueuedJob> leaseDue(Connection conn, Instant now, Instant leaseExpiry, int limit) {
    List<QueuedJob> leased = new ArrayList<>();
    for (QueuedJob candidate : selectDue(conn, now, leaseExpiry, limit)) {
      if (markRunning(conn, candidate.id(), now, leaseExpiry) == 1) {
        leased.add(candidate.toBuilder().status(JobStatus.RUNNING).startedAt(now).build());
      }
    }
    return leased;
  }

  @Override
  public int markRunning(Connection conn, long id, Instant startedAt, Instant leaseExpiry) {
    String sql = "UPDATE " + tableName() + " SET status=?, started_at=?" +
        " WHERE id=? AND (status IN " + LEASABLE_STATUS_IN + " OR (status=? AND started_at < ?))";
    return JdbcTemplate.update(conn, sql, JobStatus.RUNNING.code(), startedAt, id,
        JobStatus.RUNNING.code(), leaseExpiry);
  }

  @Override
  public int markCompleted(Connection conn, long id, Instant completedAt, String message) {
    String sql = "UPDATE " + tableName() +
        " SET status=?, completed_at=?, error_message=?, next_retry_at=NULL" +
        " WHERE id=? AND status=?";
    return JdbcTemplate.update(conn, sql, JobStatus.COMPLETED.code(), completedAt,
        truncateError(message), id, JobStatus.RUNNING.code());
  }

  @Override
  public int markRetrying(Connection conn, long id, int expectedRetryCount, Instant nextRetryAt,
      String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=?, retry_count=retry_count+1, next_retry_at=?, error_message=?" +
        " WHERE id=? AND status=? AND retry_count=? AND retry_count < max_retries";
    return JdbcTemplate.update(conn, sql, JobStatus.RETRYING.code(), nextRetryAt,
        truncateError(error), id, JobStatus.RUNNING.code(), expectedRetryCount);
  }

  @Override
  public int markFailed(Connection conn, long id, Instant completedAt, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=?, completed_at=?, error_message=?, next_retry_at=NULL" +
        " WHERE id=? AND status=?";
    return JdbcTemplate.update(conn, sql, JobStatus.FAILED.code(), completedAt,
        truncateError(error), id, JobStatus.RUNNING.code());
  }

  @Override
  public boolean delete(Connection conn, long id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE id=?", id) > 0;
  }

  @Override
  public Map<JobStatus, Long> countByStatus(Connection conn) {
    String sql = "SELECT status, COUNT(*) AS n FROM " + tableName() + " GROUP BY status";
    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    JdbcTemplate.query(conn, sql, rs -> counts.put(JobStatus.fromCode(rs.getString("status")), rs.getLong("n")));
    return counts;
  }

  @Override
  public List<QueuedJob> findByStatus(Connection conn, JobStatus status, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=? ORDER BY created_at DESC, id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, status.code(), limit);
  }

  /**
   * Deletes terminal jobs completed before {@code before}, up to {@code limit} rows.
   *
   * <p>Default implementation uses a subquery to limit the batch size, which works for H2 and
   * PostgreSQL. MySQL overrides with {@code DELETE ... ORDER BY ... LIMIT}.
   */
  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN + " AND completed_at < ?" +
        " ORDER BY completed_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, before, limit);
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
