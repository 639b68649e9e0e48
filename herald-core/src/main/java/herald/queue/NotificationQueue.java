package herald.queue;

import herald.dispatch.ExponentialBackoffRetryPolicy;
import herald.dispatch.RetryPolicy;
import herald.spi.ConnectionProvider;
import herald.spi.QueueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable priority queue of {@link QueuedJob}s.
 *
 * <p>Every operation borrows a connection from the {@link ConnectionProvider}, runs one or two
 * single-row statements in auto-commit mode and returns the connection. State changes are
 * guarded by the expected current state in SQL, so concurrent workers and processes sharing the
 * table never both lease or both complete a job.
 *
 * <p>A {@code running} job whose lease is older than {@code leaseTimeout} is due again, so a job
 * whose worker died is picked up by the next poll.
 *
 * <p>This class is thread-safe.
 *
 * @see QueueProcessor
 */
public final class NotificationQueue {
  private static final Logger logger = Logger.getLogger(NotificationQueue.class.getName());

  public static final int DEFAULT_PRIORITY = 1;
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMinutes(5);
  public static final Duration DEFAULT_LEASE_TIMEOUT = Duration.ofMinutes(5);

  private final ConnectionProvider connectionProvider;
  private final QueueStore store;
  private final RetryPolicy retryPolicy;
  private final Clock clock;
  private final int defaultPriority;
  private final int defaultMaxRetries;
  private final Duration defaultRetryDelay;
  private final Duration leaseTimeout;

  private NotificationQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.defaultMaxRetries < 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
    }
    if (builder.defaultRetryDelay == null || builder.defaultRetryDelay.isNegative()
        || builder.defaultRetryDelay.isZero()) {
      throw new IllegalArgumentException("defaultRetryDelay must be positive");
    }
    this.defaultPriority = builder.defaultPriority;
    this.defaultMaxRetries = builder.defaultMaxRetries;
    this.defaultRetryDelay = builder.defaultRetryDelay;
    if (builder.leaseTimeout == null || builder.leaseTimeout.isNegative() || builder.leaseTimeout.isZero()) {
      throw new IllegalArgumentException("leaseTimeout must be positive");
    }
    this.leaseTimeout = builder.leaseTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** How long a {@code running} job may stay leased before another poll may take it over. */
  public Duration leaseTimeout() {
    return leaseTimeout;
  }

  /**
   * Stores a new job as {@code pending}. The queue assigns id, status and
   * {@code createdAt = scheduledAt = now}; zero priority, zero max retries and a missing or zero
   * retry delay take the queue defaults.
   *
   * @return the stored job
   */
  public QueuedJob enqueue(QueuedJob job) {
    Objects.requireNonNull(job, "job");
    Instant now = now();
    QueuedJob toStore = job.toBuilder()
        .id(null)
        .priority(job.priority() == 0 ? defaultPriority : job.priority())
        .maxRetries(job.maxRetries() == 0 ? defaultMaxRetries : job.maxRetries())
        .retryCount(0)
        .retryDelay(job.retryDelay() == null || job.retryDelay().isZero() ? defaultRetryDelay : job.retryDelay())
        .status(JobStatus.PENDING)
        .errorMessage(null)
        .createdAt(now)
        .scheduledAt(now)
        .startedAt(null)
        .completedAt(null)
        .nextRetryAt(null)
        .build();
    QueuedJob stored = connectionProvider.execute("enqueue job", conn -> store.insert(conn, toStore));
    logger.log(Level.FINE, "Enqueued job {0} priority={1}", new Object[]{stored.id(), stored.priority()});
    return stored;
  }

  /**
   * Leases up to {@code limit} due jobs, moving each to {@code running}. Results are ordered
   * by priority descending, then creation time ascending; no job is returned to two callers.
   */
  public List<QueuedJob> leaseDue(int limit) {
    requirePositive(limit);
    Instant now = now();
    return connectionProvider.execute("lease due jobs",
        conn -> store.leaseDue(conn, now, now.minus(leaseTimeout), limit));
  }

  /** Due jobs in lease order, without leasing them. */
  public List<QueuedJob> peekDue(int limit) {
    requirePositive(limit);
    Instant now = now();
    return connectionProvider.execute("select due jobs",
        conn -> store.selectDue(conn, now, now.minus(leaseTimeout), limit));
  }

  /**
   * Moves job {@code id} to {@code newStatus}.
   *
   * <ul>
   *   <li>{@code running}: from pending or retrying, or from running once the lease expired;
   *       sets {@code startedAt}</li>
   *   <li>{@code completed}: from running; {@code error} is kept as a warning</li>
   *   <li>{@code retrying}: from running while attempts remain; increments the retry count and
   *       sets {@code nextRetryAt} from the retry policy</li>
   *   <li>{@code failed}: from running</li>
   * </ul>
   *
   * @return the job after the change
   * @throws JobNotFoundException          if the job does not exist
   * @throws IllegalJobTransitionException if the job's state does not allow the change
   */
  public QueuedJob transition(long id, JobStatus newStatus, String error) {
    Objects.requireNonNull(newStatus, "newStatus");
    return connectionProvider.execute("transition job " + id, conn -> {
      Instant now = now();
      int updated;
      switch (newStatus) {
        case RUNNING -> updated = store.markRunning(conn, id, now, now.minus(leaseTimeout));
        case COMPLETED -> updated = store.markCompleted(conn, id, now, error);
        case FAILED -> updated = store.markFailed(conn, id, now, error);
        case RETRYING -> {
          QueuedJob current = store.findById(conn, id).orElseThrow(() -> notFound(id));
          if (current.status() != JobStatus.RUNNING) {
            throw new IllegalJobTransitionException(id, current.status(), newStatus, null);
          }
          if (!current.hasAttemptsLeft()) {
            throw new IllegalJobTransitionException(id, current.status(), newStatus,
                "retries exhausted (" + current.retryCount() + "/" + current.maxRetries() + ")");
          }
          Duration delay = retryPolicy.computeDelay(current.retryDelay(), current.retryCount() + 1);
          Instant nextRetryAt = now.plus(delay);
          if (!nextRetryAt.isAfter(now)) {
            nextRetryAt = now.plusMillis(1);
          }
          updated = store.markRetrying(conn, id, current.retryCount(), nextRetryAt, error);
        }
        default -> {
          QueuedJob current = store.findById(conn, id).orElseThrow(() -> notFound(id));
          throw new IllegalJobTransitionException(id, current.status(), newStatus,
              "jobs never return to " + newStatus.code());
        }
      }
      QueuedJob after = store.findById(conn, id).orElseThrow(() -> notFound(id));
      if (updated == 0) {
        throw new IllegalJobTransitionException(id, after.status(), newStatus, null);
      }
      return after;
    });
  }

  public Optional<QueuedJob> get(long id) {
    return connectionProvider.execute("load job " + id, conn -> store.findById(conn, id));
  }

  public boolean delete(long id) {
    return connectionProvider.execute("delete job " + id, conn -> store.delete(conn, id));
  }

  public QueueStats stats() {
    return new QueueStats(connectionProvider.execute("count jobs", store::countByStatus));
  }

  /** Jobs in {@code status}, newest first. */
  public List<QueuedJob> list(JobStatus status, int limit) {
    Objects.requireNonNull(status, "status");
    requirePositive(limit);
    return connectionProvider.execute("list jobs", conn -> store.findByStatus(conn, status, limit));
  }

  /**
   * Deletes completed and failed jobs that finished more than {@code olderThan} ago, in batches
   * of {@code batchSize}.
   *
   * @return total rows deleted
   */
  public int purge(Duration olderThan, int batchSize) {
    Objects.requireNonNull(olderThan, "olderThan");
    requirePositive(batchSize);
    Instant cutoff = now().minus(olderThan);
    int total = 0;
    int deleted;
    do {
      deleted = connectionProvider.execute("purge jobs", conn -> store.purge(conn, cutoff, batchSize));
      total += deleted;
    } while (deleted >= batchSize);
    if (total > 0) {
      logger.log(Level.INFO, "Purged {0} finished jobs older than {1}", new Object[]{total, cutoff});
    }
    return total;
  }

  /** {@link #purge(Duration, int)} with batches of 500. */
  public int purge(Duration olderThan) {
    return purge(olderThan, 500);
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private static JobNotFoundException notFound(long id) {
    return new JobNotFoundException("Queued job not found: " + id);
  }

  private static void requirePositive(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
  }

  /**
   * Builder for {@link NotificationQueue}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private int defaultPriority = DEFAULT_PRIORITY;
    private int defaultMaxRetries = DEFAULT_MAX_RETRIES;
    private Duration defaultRetryDelay = DEFAULT_RETRY_DELAY;
    private Duration leaseTimeout = DEFAULT_LEASE_TIMEOUT;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Usually detected from the DataSource by {@code JdbcQueueStores}. */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /** Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 64x cap. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Priority for jobs enqueued with priority 0. Defaults to {@code 1}. */
    public Builder defaultPriority(int defaultPriority) {
      this.defaultPriority = defaultPriority;
      return this;
    }

    /** Max retries for jobs enqueued with 0. Defaults to {@code 3}. */
    public Builder defaultMaxRetries(int defaultMaxRetries) {
      this.defaultMaxRetries = defaultMaxRetries;
      return this;
    }

    /** Base retry delay for jobs enqueued without one. Defaults to five minutes. */
    public Builder defaultRetryDelay(Duration defaultRetryDelay) {
      this.defaultRetryDelay = defaultRetryDelay;
      return this;
    }

    /**
     * Age after which a {@code running} job counts as abandoned and is leased again. Must exceed
     * the processor's job timeout. Defaults to five minutes.
     */
    public Builder leaseTimeout(Duration leaseTimeout) {
      this.leaseTimeout = leaseTimeout;
      return this;
    }

    public NotificationQueue build() {
      return new NotificationQueue(this);
    }
  }
}
