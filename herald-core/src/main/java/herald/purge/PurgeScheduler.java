package herald.purge;

import herald.spi.ConnectionProvider;
import herald.spi.Purger;
import herald.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic cleanup of finished queue jobs and old metrics samples.
 *
 * <p>Each registered target pairs a {@link Purger} with a retention. A cycle visits every target
 * and deletes in batches (default 500), each on its own auto-committed connection, until a batch
 * comes back short. A failing target is logged and does not stop the others.
 *
 * <pre>{@code
 * PurgeScheduler purge = PurgeScheduler.builder()
 *     .connectionProvider(connections)
 *     .target("jobs", queueStore, Duration.ofDays(7))
 *     .target("metrics", sampleStore, Duration.ofDays(30))
 *     .build();
 * purge.start();
 * }</pre>
 */
public final class PurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final List<Target> targets;
  private final int batchSize;
  private final Duration interval;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private PurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    if (builder.targets.isEmpty()) {
      throw new IllegalArgumentException("at least one purge target is required");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval == null || builder.interval.getSeconds() <= 0) {
      throw new IllegalArgumentException("interval must be >= 1s");
    }
    this.targets = List.copyOf(builder.targets);
    this.batchSize = builder.batchSize;
    this.interval = builder.interval;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("herald-purge-"));
    long seconds = interval.getSeconds();
    purgeTask = scheduler.scheduleWithFixedDelay(this::runOnce, seconds, seconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one cycle over every target. May be invoked directly.
   *
   * @return rows deleted per target name
   */
  public Map<String, Integer> runOnce() {
    Map<String, Integer> result = new LinkedHashMap<>();
    if (closed) {
      return result;
    }
    for (Target target : targets) {
      try {
        result.put(target.name(), purge(target));
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Purge of " + target.name() + " failed", t);
      }
    }
    return result;
  }

  private int purge(Target target) throws SQLException {
    Instant cutoff = clock.instant().minus(target.retention());
    int total = 0;
    int deleted;
    do {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        deleted = target.purger().purge(conn, cutoff, batchSize);
      }
      total += deleted;
    } while (deleted >= batchSize);
    if (total > 0) {
      logger.log(Level.INFO, "Purged {0} {1} rows older than {2}",
          new Object[]{total, target.name(), cutoff});
    }
    return total;
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private record Target(String name, Purger purger, Duration retention) {
  }

  /** Builder for {@link PurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private final List<Target> targets = new ArrayList<>();
    private int batchSize = 500;
    private Duration interval = Duration.ofHours(24);
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Adds a table to clean. At least one target is required.
     *
     * @param name      label used in logs and {@link #runOnce()} results
     * @param purger    deletes one batch of expired rows
     * @param retention rows older than this are deleted; must be &ge; 0
     */
    public Builder target(String name, Purger purger, Duration retention) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(purger, "purger");
      Objects.requireNonNull(retention, "retention");
      if (retention.isNegative()) {
        throw new IllegalArgumentException("retention must be >= 0");
      }
      targets.add(new Target(name, purger, retention));
      return this;
    }

    /** Max rows per batch. Optional; defaults to {@code 500}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Time between cycles. Optional; defaults to 24 hours. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public PurgeScheduler build() {
      return new PurgeScheduler(this);
    }
  }
}
