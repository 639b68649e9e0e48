package herald.spi;

import herald.queue.JobStatus;
import herald.queue.QueuedJob;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence operations for the {@code notification_queue} table.
 *
 * <p>All methods receive an explicit {@link Connection}; the caller owns its lifecycle.
 * State-changing methods are guarded single-row updates and return the number of rows changed,
 * so a {@code 0} means the row was missing or not in the expected state.
 * {@link herald.queue.NotificationQueue} turns those results into exceptions.
 *
 * @see herald.jdbc.store.AbstractJdbcQueueStore
 */
public interface QueueStore extends Purger {

  /**
   * Inserts a fully populated job (status and timestamps already set) and returns it with its
   * generated id.
   */
  QueuedJob insert(Connection conn, QueuedJob job) throws SQLException;

  Optional<QueuedJob> findById(Connection conn, long id) throws SQLException;

  /**
   * Returns due jobs without leasing them, ordered by priority descending then creation
   * ascending. A job is due when it is pending or retrying with {@code next_retry_at} null or not
   * after {@code now}, or when it is running with a lease taken before {@code leaseExpiry}.
   */
  List<QueuedJob> selectDue(Connection conn, Instant now, Instant leaseExpiry, int limit)
      throws SQLException;

  /**
   * Leases up to {@code limit} due jobs: each returned job has been moved to
   * {@link JobStatus#RUNNING} with {@code started_at = now} by this call, and no concurrent
   * caller receives the same job. Results keep the {@link #selectDue} order.
   */
  List<QueuedJob> leaseDue(Connection conn, Instant now, Instant leaseExpiry, int limit)
      throws SQLException;

  /** pending|retrying → running, or running → running when the lease began before {@code leaseExpiry}. */
  int markRunning(Connection conn, long id, Instant startedAt, Instant leaseExpiry) throws SQLException;

  /** running → completed; {@code message} is the partial-success warning or {@code null}. */
  int markCompleted(Connection conn, long id, Instant completedAt, String message) throws SQLException;

  /**
   * running → retrying, incrementing {@code retry_count}. Only applies while the stored
   * {@code retry_count} equals {@code expectedRetryCount} and is below {@code max_retries}.
   */
  int markRetrying(Connection conn, long id, int expectedRetryCount, Instant nextRetryAt, String error)
      throws SQLException;

  /** running → failed. */
  int markFailed(Connection conn, long id, Instant completedAt, String error) throws SQLException;

  boolean delete(Connection conn, long id) throws SQLException;

  /** Counts jobs grouped by status; statuses without jobs may be absent. */
  Map<JobStatus, Long> countByStatus(Connection conn) throws SQLException;

  /** Lists jobs in one state, newest first. */
  List<QueuedJob> findByStatus(Connection conn, JobStatus status, int limit) throws SQLException;

  /**
   * Deletes up to {@code limit} completed or failed jobs whose {@code completed_at} is before
   * {@code before}.
   */
  @Override
  int purge(Connection conn, Instant before, int limit) throws SQLException;
}
