package herald.queue;

import herald.Notification;
import herald.QueueBackendException;
import herald.dispatch.Aggregation;
import herald.dispatch.FanOutDispatcher;
import herald.dispatch.Outcome;
import herald.dispatch.OutcomeAggregator;
import herald.endpoint.EndpointRegistry;
import herald.metrics.MetricsRecorder;
import herald.metrics.MetricsSample;
import herald.metrics.SampleStatus;
import herald.template.RenderedTemplate;
import herald.template.TemplateEngine;
import herald.template.TemplateException;
import herald.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker loop that drains the {@link NotificationQueue}.
 *
 * <p>Every {@code interval} the processor leases up to {@code batchSize} due jobs (never more
 * than it has free workers for) and hands each to a worker. A worker renders the job's template
 * when it names one, resolves its service URLs, fans the notification out with a
 * {@code jobTimeout} deadline, records one metrics sample per endpoint and moves the job to
 * {@code completed}, {@code retrying} or {@code failed}.
 *
 * <p>Template errors and jobs with no resolvable service fail immediately, without sending and
 * without retry. Unresolvable URLs among good ones are skipped with a warning. Any other error
 * while processing a job counts as a failed attempt: the job moves to {@code retrying} while it
 * has attempts left and to {@code failed} after that. A job left {@code running} by a worker that
 * died is leased again once the queue's lease timeout passes.
 *
 * <p>{@link #processOnce()} may be called directly; with {@code workerCount(0)} jobs run on the
 * calling thread, which keeps tests deterministic.
 */
public final class QueueProcessor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueProcessor.class.getName());

  public static final String QUEUE_DEPTH_GAUGE = "queue.depth";

  private final NotificationQueue queue;
  private final EndpointRegistry registry;
  private final FanOutDispatcher dispatcher;
  private final TemplateEngine templateEngine;
  private final MetricsRecorder metrics;
  private final int batchSize;
  private final Duration interval;
  private final int workerCount;
  private final Duration jobTimeout;
  private final Clock clock;
  private final Semaphore slots;

  private ScheduledExecutorService scheduler;
  private ExecutorService workers;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private QueueProcessor(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.templateEngine = builder.templateEngine;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsRecorder.builder().build();
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    requirePositive(builder.interval, "interval");
    requirePositive(builder.jobTimeout, "jobTimeout");
    if (builder.jobTimeout.compareTo(queue.leaseTimeout()) >= 0) {
      throw new IllegalArgumentException("jobTimeout must be shorter than the queue's leaseTimeout "
          + queue.leaseTimeout());
    }
    this.batchSize = builder.batchSize;
    this.interval = builder.interval;
    this.workerCount = builder.workerCount;
    this.jobTimeout = builder.jobTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.slots = new Semaphore(workerCount > 0 ? workerCount : batchSize);
    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("herald-worker-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the polling loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueueProcessor has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("herald-processor-"));
    long millis = interval.toMillis();
    pollTask = scheduler.scheduleWithFixedDelay(this::processOnce, millis, millis, TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Queue processor started: interval={0}, batchSize={1}, workers={2}",
        new Object[]{interval, batchSize, workerCount});
  }

  /**
   * Runs one poll cycle: leases due jobs and processes them (asynchronously when workers are
   * configured). Errors are logged, never thrown.
   *
   * @return number of jobs leased
   */
  public int processOnce() {
    if (closed) {
      return 0;
    }
    try {
      int limit = Math.min(batchSize, slots.availablePermits());
      if (limit <= 0 || !slots.tryAcquire(limit)) {
        return 0;
      }
      List<QueuedJob> jobs;
      try {
        jobs = queue.leaseDue(limit);
      } catch (RuntimeException e) {
        slots.release(limit);
        throw e;
      }
      slots.release(limit - jobs.size());
      for (QueuedJob job : jobs) {
        submit(job);
      }
      publishDepth();
      return jobs.size();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Queue poll cycle failed", t);
      return 0;
    }
  }

  private void submit(QueuedJob job) {
    if (workers == null) {
      runJob(job);
      return;
    }
    try {
      workers.execute(() -> runJob(job));
    } catch (RejectedExecutionException e) {
      slots.release();
      logger.log(Level.WARNING, "Worker pool closed, job {0} stays running until its lease expires", job.id());
    }
  }

  private void runJob(QueuedJob job) {
    try {
      process(job);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Failed to process job " + job.id(), t);
      abandon(job, t);
    } finally {
      slots.release();
    }
  }

  /**
   * Ends the attempt of a job whose processing threw. If the job cannot be moved either, it stays
   * {@code running} until its lease expires.
   */
  private void abandon(QueuedJob job, Throwable cause) {
    JobStatus next = job.hasAttemptsLeft() ? JobStatus.RETRYING : JobStatus.FAILED;
    String error = "Processing error: " + (cause.getMessage() != null
        ? cause.getMessage() : cause.getClass().getName());
    try {
      queue.transition(job.id(), next, error);
      logger.log(Level.WARNING, "Job {0} {1} after processing error", new Object[]{job.id(), next.code()});
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Job " + job.id() + " stays running until its lease expires", e);
    }
  }

  /**
   * Processes one leased job to its next state.
   *
   * @return the job after its transition
   */
  QueuedJob process(QueuedJob job) {
    JobPayload payload = job.payload();
    if (payload.hasTemplate()) {
      if (templateEngine == null) {
        return fail(job, "Template engine not configured for template " + payload.templateName());
      }
      try {
        RenderedTemplate rendered = templateEngine.render(payload.templateName(), payload.metadata());
        payload = payload.rendered(rendered.title(), rendered.body());
      } catch (TemplateException e) {
        return fail(job, "Template error: " + e.getMessage());
      }
    }

    List<EndpointRegistry.Resolved> targets = registry.resolveLenient(payload.services(),
        (url, e) -> logger.log(Level.WARNING, "Skipping service {0} for job {1}: {2}",
            new Object[]{url, job.id(), e.getMessage()}));
    if (targets.isEmpty()) {
      return fail(job, "No valid services could be resolved");
    }

    Notification notification = payload.toNotification();
    List<Outcome> outcomes = dispatcher.dispatch(notification, targets, clock.instant().plus(jobTimeout));
    for (Outcome outcome : outcomes) {
      record(job, payload, outcome);
    }

    Aggregation aggregation = OutcomeAggregator.aggregate(outcomes, job.retryCount(), job.maxRetries());
    QueuedJob after = queue.transition(job.id(), aggregation.status(), aggregation.message());
    if (aggregation.status() == JobStatus.COMPLETED) {
      logger.log(Level.FINE, "Job {0} completed: {1}/{2} services succeeded",
          new Object[]{job.id(), outcomes.stream().filter(Outcome::success).count(), outcomes.size()});
    } else {
      logger.log(Level.WARNING, "Job {0} {1}: {2}",
          new Object[]{job.id(), aggregation.status().code(), aggregation.message()});
    }
    return after;
  }

  private QueuedJob fail(QueuedJob job, String reason) {
    logger.log(Level.WARNING, "Job {0} failed without sending: {1}", new Object[]{job.id(), reason});
    return queue.transition(job.id(), JobStatus.FAILED, reason);
  }

  private void record(QueuedJob job, JobPayload payload, Outcome outcome) {
    MetricsSample sample = new MetricsSample(null, job.id(), job.scheduledId(), outcome.serviceId(),
        outcome.serviceUrl(), payload.notifyType(), SampleStatus.of(outcome.success()),
        outcome.duration().toMillis(), outcome.error(), payload.metadata(),
        clock.instant().truncatedTo(ChronoUnit.MILLIS));
    try {
      metrics.recordDelivery(sample);
    } catch (QueueBackendException e) {
      logger.log(Level.WARNING, "Failed to store metrics sample for job " + job.id(), e);
    }
  }

  private void publishDepth() {
    try {
      metrics.updateGauge(QUEUE_DEPTH_GAUGE, queue.stats().backlog());
    } catch (QueueBackendException e) {
      logger.log(Level.WARNING, "Failed to read queue depth", e);
    }
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  /**
   * Stops polling and waits briefly for running jobs to finish. Jobs still running afterwards
   * keep their {@code running} state in the table.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      awaitQuietly(scheduler);
    }
    if (workers != null) {
      workers.shutdown();
      awaitQuietly(workers);
    }
  }

  private static void awaitQuietly(ExecutorService executor) {
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for {@link QueueProcessor}.
   */
  public static final class Builder {
    private NotificationQueue queue;
    private EndpointRegistry registry;
    private FanOutDispatcher dispatcher;
    private TemplateEngine templateEngine;
    private MetricsRecorder metrics;
    private int batchSize = 10;
    private Duration interval = Duration.ofSeconds(10);
    private int workerCount = 4;
    private Duration jobTimeout = Duration.ofSeconds(30);
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder queue(NotificationQueue queue) {
      this.queue = queue;
      return this;
    }

    /** <b>Required.</b> Resolves each job's service URLs. */
    public Builder registry(EndpointRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** <b>Required.</b> */
    public Builder dispatcher(FanOutDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /** Optional. Without it, jobs that name a template fail. */
    public Builder templateEngine(TemplateEngine templateEngine) {
      this.templateEngine = templateEngine;
      return this;
    }

    /** Optional. Defaults to a recorder that discards everything. */
    public Builder metrics(MetricsRecorder metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Max jobs leased per cycle. Defaults to {@code 10}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Delay between cycles. Defaults to 10 seconds. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /** Worker threads; {@code 0} runs jobs on the polling thread. Defaults to {@code 4}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Deadline for one job's fan-out. Must be shorter than the queue's lease timeout. Defaults to
     * 30 seconds.
     */
    public Builder jobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public QueueProcessor build() {
      return new QueueProcessor(this);
    }
  }
}
