package herald.spi;

import herald.schedule.ScheduledJob;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for the {@code scheduled_jobs} table.
 *
 * @see herald.jdbc.store.JdbcScheduledJobStore
 */
public interface ScheduledJobStore {

  /** Inserts a job whose timestamps are set and returns it with its generated id. */
  ScheduledJob insert(Connection conn, ScheduledJob job) throws SQLException;

  Optional<ScheduledJob> findById(Connection conn, long id) throws SQLException;

  Optional<ScheduledJob> findByName(Connection conn, String name) throws SQLException;

  /** All jobs, newest first. */
  List<ScheduledJob> findAll(Connection conn) throws SQLException;

  List<ScheduledJob> findEnabled(Connection conn) throws SQLException;

  /**
   * Rewrites the definition columns (name, cron, payload, enabled, updated_at, next_run).
   * Run-tracking columns are left alone.
   */
  int update(Connection conn, ScheduledJob job) throws SQLException;

  /** Records a tick: sets last_run, next_run and last_status and increments run_count. */
  int recordRun(Connection conn, long id, Instant lastRun, Instant nextRun, String lastStatus)
      throws SQLException;

  /** Sets last_status (and next_run) without counting a run. */
  int updateStatus(Connection conn, long id, Instant nextRun, String lastStatus) throws SQLException;

  int setEnabled(Connection conn, long id, boolean enabled, Instant nextRun, Instant updatedAt)
      throws SQLException;

  boolean delete(Connection conn, long id) throws SQLException;
}
