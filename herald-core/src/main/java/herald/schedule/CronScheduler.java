package herald.schedule;

import herald.QueueBackendException;
import herald.endpoint.EndpointRegistry;
import herald.queue.JobNotFoundException;
import herald.queue.JobPayload;
import herald.queue.NotificationQueue;
import herald.queue.QueuedJob;
import herald.spi.ConnectionProvider;
import herald.spi.ScheduledJobStore;
import herald.template.RenderedTemplate;
import herald.template.TemplateEngine;
import herald.template.TemplateException;
import herald.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires {@link ScheduledJob}s on their cron schedules by enqueueing a {@link QueuedJob} per tick.
 *
 * <p>One daemon ticker thread wakes every {@code tickResolution} and fires each registered job
 * whose next occurrence has passed, then moves that job's next occurrence to the first one after
 * now. Occurrences missed while the scheduler was stopped or the ticker was late are not replayed:
 * a job fires at most once per tick.
 *
 * <p>When a job fires it is re-read from the store and skipped if it was deleted or disabled
 * meanwhile. Its template is rendered with the job's metadata as variables; the queued job
 * carries the rendered text. {@code metadata["priority"]} and {@code metadata["max_retries"]}
 * override the queue priority and retry budget, {@code metadata["retry_delay"]} (ISO-8601,
 * e.g. {@code PT1M}) the base retry delay.
 *
 * <p>The registration table is guarded by a read/write lock: ticks fire under the read lock;
 * add, update, delete, enable and disable change registrations under the write lock.
 */
public final class CronScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CronScheduler.class.getName());

  public static final String PRIORITY_KEY = "priority";
  public static final String MAX_RETRIES_KEY = "max_retries";
  public static final String RETRY_DELAY_KEY = "retry_delay";
  public static final String STATUS_QUEUED = "queued";

  private final ConnectionProvider connectionProvider;
  private final ScheduledJobStore store;
  private final NotificationQueue queue;
  private final TemplateEngine templateEngine;
  private final EndpointRegistry registry;
  private final Clock clock;
  private final ZoneId zone;
  private final Duration tickResolution;
  private final int defaultMaxRetries;
  private final Duration defaultRetryDelay;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<Long, Registration> registrations = new HashMap<>();

  private ScheduledExecutorService ticker;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private CronScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.templateEngine = builder.templateEngine;
    this.registry = builder.registry;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.zone = builder.zone != null ? builder.zone : ZoneOffset.UTC;
    if (builder.tickResolution == null || builder.tickResolution.toMillis() <= 0) {
      throw new IllegalArgumentException("tickResolution must be >= 1ms");
    }
    if (builder.defaultMaxRetries < 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
    }
    this.tickResolution = builder.tickResolution;
    this.defaultMaxRetries = builder.defaultMaxRetries;
    this.defaultRetryDelay = Objects.requireNonNull(builder.defaultRetryDelay, "defaultRetryDelay");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers every enabled job and starts the ticker. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("CronScheduler has been closed");
    }
    if (tickTask != null) {
      return;
    }
    int loaded = reload();
    ticker = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("herald-cron-"));
    long millis = tickResolution.toMillis();
    tickTask = ticker.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Cron scheduler started with {0} enabled jobs", loaded);
  }

  /**
   * Replaces all registrations with the enabled jobs currently stored.
   *
   * @return number of jobs registered
   */
  public int reload() {
    List<ScheduledJob> enabled = connectionProvider.execute("load enabled scheduled jobs", store::findEnabled);
    Instant now = now();
    lock.writeLock().lock();
    try {
      registrations.clear();
      for (ScheduledJob job : enabled) {
        try {
          register(job, now);
        } catch (InvalidCronExpressionException e) {
          logger.log(Level.WARNING, "Skipping scheduled job " + job.name() + " with invalid cron expression", e);
        }
      }
      return registrations.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Fires every registration whose next occurrence is at or before now. Called by the ticker;
   * may be invoked directly.
   *
   * @return number of jobs fired
   */
  public int tick() {
    if (closed) {
      return 0;
    }
    try {
      Instant now = now();
      int fired = 0;
      lock.readLock().lock();
      try {
        List<Claim> due = new ArrayList<>();
        for (Registration registration : registrations.values()) {
          Instant next = registration.claim(now);
          if (next != null) {
            due.add(new Claim(registration.jobId, next));
          }
        }
        for (Claim claim : due) {
          try {
            if (fire(claim.jobId, now, claim.nextRun, false).isPresent()) {
              fired++;
            }
          } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fire scheduled job " + claim.jobId, e);
          }
        }
      } finally {
        lock.readLock().unlock();
      }
      return fired;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Cron tick failed", t);
      return 0;
    }
  }

  /**
   * Fires job {@code id} once, now, whether or not it is enabled or due. Its schedule is
   * unchanged apart from {@code lastRun} and {@code runCount}.
   *
   * @return the queued job, or empty when the template could not be rendered
   * @throws JobNotFoundException if no such job exists
   */
  public Optional<QueuedJob> fireNow(long id) {
    ScheduledJob job = get(id).orElseThrow(() -> notFound(id));
    Instant now = now();
    Instant nextRun = job.enabled() ? CronExpression.parse(job.cronExpression()).next(now, zone) : null;
    return fire(id, now, nextRun, true);
  }

  private Optional<QueuedJob> fire(long id, Instant now, Instant nextRun, boolean force) {
    ScheduledJob job = connectionProvider.execute("load scheduled job " + id,
        conn -> store.findById(conn, id)).orElse(null);
    if (job == null || (!job.enabled() && !force)) {
      logger.log(Level.FINE, "Scheduled job {0} is gone or disabled, not firing", id);
      return Optional.empty();
    }

    JobPayload payload;
    try {
      payload = rendered(job.payload());
    } catch (TemplateException e) {
      logger.log(Level.WARNING, "Scheduled job {0} not queued: {1}", new Object[]{job.name(), e.getMessage()});
      recordFailure(job, nextRun, "template_error: " + e.getMessage());
      return Optional.empty();
    }

    QueuedJob queued;
    try {
      queued = queue.enqueue(QueuedJob.builder(payload)
          .scheduledId(job.id())
          .priority(payload.metadataInt(PRIORITY_KEY, NotificationQueue.DEFAULT_PRIORITY))
          .maxRetries(maxRetries(payload))
          .retryDelay(retryDelay(payload))
          .build());
    } catch (QueueBackendException e) {
      logger.log(Level.SEVERE, "Failed to enqueue scheduled job " + job.name(), e);
      recordFailure(job, nextRun, "enqueue_error: " + e.getMessage());
      return Optional.empty();
    }

    connectionProvider.execute("record run of scheduled job " + id,
        conn -> store.recordRun(conn, id, now, nextRun, STATUS_QUEUED));
    logger.log(Level.FINE, "Scheduled job {0} queued as job {1}, next run {2}",
        new Object[]{job.name(), queued.id(), nextRun});
    return Optional.of(queued);
  }

  private JobPayload rendered(JobPayload payload) {
    if (!payload.hasTemplate()) {
      return payload;
    }
    if (templateEngine == null) {
      throw new TemplateException("Template engine not configured for template " + payload.templateName());
    }
    RenderedTemplate result = templateEngine.render(payload.templateName(), payload.metadata());
    return payload.rendered(result.title(), result.body());
  }

  private int maxRetries(JobPayload payload) {
    int value = payload.metadataInt(MAX_RETRIES_KEY, defaultMaxRetries);
    if (value < 0) {
      logger.log(Level.WARNING, "Ignoring negative max_retries {0}", value);
      return defaultMaxRetries;
    }
    return value;
  }

  private Duration retryDelay(JobPayload payload) {
    String raw = payload.metadata().get(RETRY_DELAY_KEY);
    if (raw == null || raw.isBlank()) {
      return defaultRetryDelay;
    }
    try {
      Duration parsed = Duration.parse(raw.trim());
      return parsed.isNegative() || parsed.isZero() ? defaultRetryDelay : parsed;
    } catch (DateTimeParseException e) {
      logger.log(Level.WARNING, "Ignoring malformed retry_delay ''{0}''", raw);
      return defaultRetryDelay;
    }
  }

  private void recordFailure(ScheduledJob job, Instant nextRun, String status) {
    try {
      connectionProvider.execute("update scheduled job status",
          conn -> store.updateStatus(conn, job.id(), nextRun, status));
    } catch (QueueBackendException e) {
      logger.log(Level.SEVERE, "Failed to record status of scheduled job " + job.name(), e);
    }
  }

  // ── CRUD ─────────────────────────────────────────────────────────

  /**
   * Stores a new job and registers it when enabled.
   *
   * @return the stored job with id, timestamps and {@code nextRun}
   * @throws InvalidCronExpressionException if the cron expression does not parse
   * @throws DuplicateJobNameException      if the name is taken
   * @throws IllegalArgumentException       if the job has no services or a service URL is invalid
   */
  public ScheduledJob add(ScheduledJob job) {
    Objects.requireNonNull(job, "job");
    CronExpression cron = validate(job);
    Instant now = now();
    ScheduledJob toStore = job.toBuilder()
        .id(null)
        .createdAt(now)
        .updatedAt(now)
        .nextRun(job.enabled() ? cron.next(now, zone) : null)
        .lastRun(null)
        .lastStatus(null)
        .runCount(0)
        .build();
    lock.writeLock().lock();
    try {
      ScheduledJob stored = connectionProvider.execute("add scheduled job " + job.name(), conn -> {
        if (store.findByName(conn, job.name()).isPresent()) {
          throw new DuplicateJobNameException(job.name());
        }
        return store.insert(conn, toStore);
      });
      if (stored.enabled()) {
        registrations.put(stored.id(), new Registration(stored.id(), cron, stored.nextRun()));
      }
      logger.log(Level.INFO, "Added scheduled job {0} ({1})", new Object[]{stored.name(), stored.cronExpression()});
      return stored;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<ScheduledJob> get(long id) {
    return connectionProvider.execute("load scheduled job " + id, conn -> store.findById(conn, id));
  }

  public Optional<ScheduledJob> getByName(String name) {
    Objects.requireNonNull(name, "name");
    return connectionProvider.execute("load scheduled job " + name, conn -> store.findByName(conn, name));
  }

  /** All jobs, newest first. */
  public List<ScheduledJob> list() {
    return connectionProvider.execute("list scheduled jobs", store::findAll);
  }

  /**
   * Replaces the definition of job {@code job.id()} and re-registers it.
   *
   * @throws JobNotFoundException      if the job does not exist
   * @throws DuplicateJobNameException if the new name belongs to another job
   */
  public ScheduledJob update(ScheduledJob job) {
    Objects.requireNonNull(job, "job");
    long id = Objects.requireNonNull(job.id(), "job.id");
    CronExpression cron = validate(job);
    Instant now = now();
    lock.writeLock().lock();
    try {
      ScheduledJob updated = connectionProvider.execute("update scheduled job " + id, conn -> {
        ScheduledJob existing = store.findById(conn, id).orElseThrow(() -> notFound(id));
        Optional<ScheduledJob> sameName = store.findByName(conn, job.name());
        if (sameName.isPresent() && !sameName.get().id().equals(id)) {
          throw new DuplicateJobNameException(job.name());
        }
        ScheduledJob next = job.toBuilder()
            .createdAt(existing.createdAt())
            .updatedAt(now)
            .nextRun(job.enabled() ? cron.next(now, zone) : null)
            .lastRun(existing.lastRun())
            .lastStatus(existing.lastStatus())
            .runCount(existing.runCount())
            .build();
        if (store.update(conn, next) == 0) {
          throw notFound(id);
        }
        return next;
      });
      registrations.remove(id);
      if (updated.enabled()) {
        registrations.put(id, new Registration(id, cron, updated.nextRun()));
      }
      return updated;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Unregisters and deletes job {@code id}.
   *
   * @throws JobNotFoundException if the job does not exist
   */
  public void delete(long id) {
    lock.writeLock().lock();
    try {
      registrations.remove(id);
      if (!connectionProvider.execute("delete scheduled job " + id, conn -> store.delete(conn, id))) {
        throw notFound(id);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** @throws JobNotFoundException if the job does not exist */
  public ScheduledJob enable(long id) {
    return setEnabled(id, true);
  }

  /** @throws JobNotFoundException if the job does not exist */
  public ScheduledJob disable(long id) {
    return setEnabled(id, false);
  }

  private ScheduledJob setEnabled(long id, boolean enabled) {
    Instant now = now();
    lock.writeLock().lock();
    try {
      ScheduledJob job = get(id).orElseThrow(() -> notFound(id));
      CronExpression cron = CronExpression.parse(job.cronExpression());
      Instant nextRun = enabled ? cron.next(now, zone) : null;
      connectionProvider.execute("set enabled on scheduled job " + id,
          conn -> store.setEnabled(conn, id, enabled, nextRun, now));
      registrations.remove(id);
      if (enabled) {
        registrations.put(id, new Registration(id, cron, nextRun));
      }
      return job.toBuilder().enabled(enabled).nextRun(nextRun).updatedAt(now).build();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Number of jobs currently registered with the ticker. */
  public int registeredCount() {
    lock.readLock().lock();
    try {
      return registrations.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private CronExpression validate(ScheduledJob job) {
    if (job.name().isBlank()) {
      throw new IllegalArgumentException("name cannot be blank");
    }
    CronExpression cron = CronExpression.parse(job.cronExpression());
    if (job.payload().services().isEmpty()) {
      throw new IllegalArgumentException("Scheduled job " + job.name() + " has no services");
    }
    if (registry != null) {
      registry.validateAll(job.payload().services());
    }
    return cron;
  }

  private void register(ScheduledJob job, Instant now) {
    CronExpression cron = CronExpression.parse(job.cronExpression());
    registrations.put(job.id(), new Registration(job.id(), cron, cron.next(now, zone)));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private static JobNotFoundException notFound(long id) {
    return new JobNotFoundException("Scheduled job not found: " + id);
  }

  /**
   * Stops the ticker. Jobs stay stored and are registered again by the next {@link #start()}
   * of a new scheduler.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (ticker != null) {
      ticker.shutdownNow();
      try {
        ticker.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private record Claim(long jobId, Instant nextRun) {
  }

  private final class Registration {
    final long jobId;
    final CronExpression cron;
    final AtomicReference<Instant> nextFire;

    Registration(long jobId, CronExpression cron, Instant nextFire) {
      this.jobId = jobId;
      this.cron = cron;
      this.nextFire = new AtomicReference<>(nextFire != null ? nextFire : cron.next(now(), zone));
    }

    /** Claims the pending occurrence if it is due; returns the following one, or null. */
    Instant claim(Instant now) {
      Instant due = nextFire.get();
      if (due.isAfter(now)) {
        return null;
      }
      Instant following = cron.next(now, zone);
      return nextFire.compareAndSet(due, following) ? following : null;
    }
  }

  /**
   * Builder for {@link CronScheduler}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ScheduledJobStore jobStore;
    private NotificationQueue queue;
    private TemplateEngine templateEngine;
    private EndpointRegistry registry;
    private Clock clock;
    private ZoneId zone;
    private Duration tickResolution = Duration.ofSeconds(1);
    private int defaultMaxRetries = NotificationQueue.DEFAULT_MAX_RETRIES;
    private Duration defaultRetryDelay = NotificationQueue.DEFAULT_RETRY_DELAY;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder jobStore(ScheduledJobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /** <b>Required.</b> Receives one job per tick. */
    public Builder queue(NotificationQueue queue) {
      this.queue = queue;
      return this;
    }

    /** Optional. Without it, jobs that name a template record a template error when they fire. */
    public Builder templateEngine(TemplateEngine templateEngine) {
      this.templateEngine = templateEngine;
      return this;
    }

    /** Optional. When set, service URLs are validated on add and update. */
    public Builder registry(EndpointRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Zone cron expressions are evaluated in. Defaults to UTC. */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /** How often the ticker checks for due jobs. Defaults to one second. */
    public Builder tickResolution(Duration tickResolution) {
      this.tickResolution = tickResolution;
      return this;
    }

    public Builder defaultMaxRetries(int defaultMaxRetries) {
      this.defaultMaxRetries = defaultMaxRetries;
      return this;
    }

    public Builder defaultRetryDelay(Duration defaultRetryDelay) {
      this.defaultRetryDelay = defaultRetryDelay;
      return this;
    }

    public CronScheduler build() {
      return new CronScheduler(this);
    }
  }
}
