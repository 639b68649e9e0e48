package herald.jdbc.store;

import herald.NotifyType;
import herald.jdbc.HeraldStoreException;
import herald.jdbc.JdbcTemplate;
import herald.jdbc.TableNames;
import herald.queue.JobPayload;
import herald.schedule.ScheduledJob;
import herald.spi.ScheduledJobStore;
import herald.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ScheduledJobStore} over the {@code scheduled_jobs} table. Plain SQL, portable across
 * H2, MySQL and PostgreSQL.
 */
public final class JdbcScheduledJobStore implements ScheduledJobStore {
  private static final String COLUMNS = "id, name, cron_expression, title, body, notify_type, "
      + "services, tags, metadata, template, enabled, created_at, updated_at, next_run, last_run, "
      + "last_status, run_count";
  private static final int MAX_STATUS_LENGTH = 4000;

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<ScheduledJob> rowMapper;

  public JdbcScheduledJobStore() {
    this(TableNames.SCHEDULED_JOBS, JsonCodec.getDefault());
  }

  public JdbcScheduledJobStore(String tableName, JsonCodec jsonCodec) {
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
        return new ScheduledJob(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("cron_expression"),
            payload,
            rs.getBoolean("enabled"),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "updated_at"),
            JdbcTemplate.instant(rs, "next_run"),
            JdbcTemplate.instant(rs, "last_run"),
            rs.getString("last_status"),
            rs.getLong("run_count"));
      } catch (IllegalArgumentException e) {
        throw new HeraldStoreException("Corrupt scheduled job row " + rs.getLong("id"), e);
      }
    };
  }

  @Override
  public ScheduledJob insert(Connection conn, ScheduledJob job) {
    JobPayload p = job.payload();
    String sql = "INSERT INTO " + tableName + " (" +
        "name, cron_expression, title, body, notify_type, services, tags, metadata, template, " +
        "enabled, created_at, updated_at, next_run, last_run, last_status, run_count" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    long id = JdbcTemplate.insert(conn, sql,
        job.name(), job.cronExpression(), p.title(), p.body(), p.notifyType().code(),
        jsonCodec.toJsonArray(p.services()), jsonCodec.toJsonArray(p.tags()),
        jsonCodec.toJson(p.metadata()), p.templateName(),
        job.enabled(), job.createdAt(), job.updatedAt(), job.nextRun(), job.lastRun(),
        truncate(job.lastStatus()), job.runCount());
    return job.toBuilder().id(id).build();
  }

  @Override
  public Optional<ScheduledJob> findById(Connection conn, long id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?", rowMapper, id);
  }

  @Override
  public Optional<ScheduledJob> findByName(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE name=?", rowMapper, name);
  }

  @Override
  public List<ScheduledJob> findAll(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY created_at DESC, id DESC", rowMapper);
  }

  @Override
  public List<ScheduledJob> findEnabled(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE enabled=? ORDER BY id", rowMapper, true);
  }

  @Override
  public int update(Connection conn, ScheduledJob job) {
    JobPayload p = job.payload();
    String sql = "UPDATE " + tableName + " SET name=?, cron_expression=?, title=?, body=?, " +
        "notify_type=?, services=?, tags=?, metadata=?, template=?, enabled=?, updated_at=?, " +
        "next_run=? WHERE id=?";
    return JdbcTemplate.update(conn, sql,
        job.name(), job.cronExpression(), p.title(), p.body(), p.notifyType().code(),
        jsonCodec.toJsonArray(p.services()), jsonCodec.toJsonArray(p.tags()),
        jsonCodec.toJson(p.metadata()), p.templateName(), job.enabled(), job.updatedAt(),
        job.nextRun(), job.id());
  }

  @Override
  public int recordRun(Connection conn, long id, Instant lastRun, Instant nextRun, String lastStatus) {
    String sql = "UPDATE " + tableName +
        " SET last_run=?, next_run=?, last_status=?, run_count=run_count+1 WHERE id=?";
    return JdbcTemplate.update(conn, sql, lastRun, nextRun, truncate(lastStatus), id);
  }

  @Override
  public int updateStatus(Connection conn, long id, Instant nextRun, String lastStatus) {
    String sql = "UPDATE " + tableName + " SET next_run=?, last_status=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, nextRun, truncate(lastStatus), id);
  }

  @Override
  public int setEnabled(Connection conn, long id, boolean enabled, Instant nextRun, Instant updatedAt) {
    String sql = "UPDATE " + tableName + " SET enabled=?, next_run=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, enabled, nextRun, updatedAt, id);
  }

  @Override
  public boolean delete(Connection conn, long id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE id=?", id) > 0;
  }

  private static String truncate(String status) {
    if (status == null || status.length() <= MAX_STATUS_LENGTH) {
      return status;
    }
    return status.substring(0, MAX_STATUS_LENGTH - 3) + "...";
  }
}
