package herald;

import herald.dispatch.FanOutDispatcher;
import herald.dispatch.RetryPolicy;
import herald.endpoint.EndpointRegistry;
import herald.metrics.MetricsRecorder;
import herald.purge.PurgeScheduler;
import herald.queue.NotificationQueue;
import herald.queue.QueueProcessor;
import herald.schedule.BatchScheduler;
import herald.schedule.CronScheduler;
import herald.spi.ConnectionProvider;
import herald.spi.MetricsExporter;
import herald.spi.MetricsSampleStore;
import herald.spi.QueueStore;
import herald.spi.ScheduledJobStore;
import herald.spi.TemplateStore;
import herald.template.TemplateEngine;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the queue, processor, cron scheduler, template engine,
 * metrics recorder and purge scheduler into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Herald herald = Herald.builder()
 *     .connectionProvider(connections)
 *     .queueStore(JdbcQueueStores.detect(dataSource))
 *     .jobStore(new JdbcScheduledJobStore())
 *     .templateStore(new JdbcTemplateStore())
 *     .sampleStore(new JdbcMetricsSampleStore())
 *     .registry(registry)
 *     .build()) {
 *   herald.scheduler().add(ScheduledJob.builder("nightly", "0 2 * * *")
 *       .templateName("backup-status")
 *       .service("json://ops.example.com/hooks/backup")
 *       .build());
 * }
 * }</pre>
 *
 * <p>Only the connection provider, queue store and registry are required. Without a job store
 * there is no scheduler; without a template store jobs cannot name templates; without a sample
 * store metrics stay in memory and the purge scheduler only cleans the queue.
 */
public final class Herald implements AutoCloseable {
  /** Gauge holding the number of schemes the endpoint registry resolves. */
  public static final String SERVICES_CONFIGURED_GAUGE = "services.configured";

  private static final Logger logger = Logger.getLogger(Herald.class.getName());

  private final NotificationQueue queue;
  private final EndpointRegistry registry;
  private final TemplateEngine templates;
  private final MetricsRecorder metrics;
  private final FanOutDispatcher dispatcher;
  private final QueueProcessor processor;
  private final CronScheduler scheduler;
  private final PurgeScheduler purgeScheduler;
  private final MetricsExporter exporter;

  private Herald(NotificationQueue queue, EndpointRegistry registry, TemplateEngine templates,
      MetricsRecorder metrics, FanOutDispatcher dispatcher, QueueProcessor processor,
      CronScheduler scheduler, PurgeScheduler purgeScheduler, MetricsExporter exporter) {
    this.queue = queue;
    this.registry = registry;
    this.templates = templates;
    this.metrics = metrics;
    this.dispatcher = dispatcher;
    this.processor = processor;
    this.scheduler = scheduler;
    this.purgeScheduler = purgeScheduler;
    this.exporter = exporter;
  }

  public static Builder builder() {
    return new Builder();
  }

  public NotificationQueue queue() {
    return queue;
  }

  public EndpointRegistry registry() {
    return registry;
  }

  /** @throws IllegalStateException if no template store was configured */
  public TemplateEngine templates() {
    if (templates == null) {
      throw new IllegalStateException("Herald was built without a template store");
    }
    return templates;
  }

  public MetricsRecorder metrics() {
    return metrics;
  }

  /** The processor, or {@code null} when processing is disabled. */
  public QueueProcessor processor() {
    return processor;
  }

  /** @throws IllegalStateException if no scheduled job store was configured */
  public CronScheduler scheduler() {
    if (scheduler == null) {
      throw new IllegalStateException("Herald was built without a scheduled job store");
    }
    return scheduler;
  }

  public BatchScheduler batch() {
    return new BatchScheduler(scheduler(), queue);
  }

  /**
   * Shuts down components in order: purge scheduler, cron scheduler, processor, dispatcher,
   * then the metrics exporter when it is closeable. Null components are skipped.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    first = closeCollecting(purgeScheduler, first);
    first = closeCollecting(scheduler, first);
    first = closeCollecting(processor, first);
    first = closeCollecting(dispatcher, first);
    if (exporter instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeCollecting(AutoCloseable component, RuntimeException first) {
    if (component == null) {
      return first;
    }
    try {
      component.close();
    } catch (Exception e) {
      RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
      if (first == null) return re;
      first.addSuppressed(re);
    }
    return first;
  }

  /**
   * Builder for {@link Herald}. Single use.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private ScheduledJobStore jobStore;
    private TemplateStore templateStore;
    private MetricsSampleStore sampleStore;
    private EndpointRegistry registry;
    private MetricsExporter metricsExporter;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private ZoneId zone;
    private boolean processorEnabled = true;
    private Duration processingInterval = Duration.ofSeconds(10);
    private int batchSize = 10;
    private int workerCount = 4;
    private Duration jobTimeout = Duration.ofSeconds(30);
    private Duration leaseTimeout = NotificationQueue.DEFAULT_LEASE_TIMEOUT;
    private int maxConcurrency = 32;
    private int maxRetries = NotificationQueue.DEFAULT_MAX_RETRIES;
    private Duration retryDelay = NotificationQueue.DEFAULT_RETRY_DELAY;
    private boolean schedulerEnabled = true;
    private boolean purgeEnabled = true;
    private Duration purgeInterval = Duration.ofHours(24);
    private Duration jobRetention = Duration.ofDays(7);
    private Duration metricsRetention = Duration.ofDays(30);
    private int purgeBatchSize = 500;
    private boolean installDefaultTemplates;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /** Optional. Enables the cron scheduler. */
    public Builder jobStore(ScheduledJobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /** Optional. Enables templates. */
    public Builder templateStore(TemplateStore templateStore) {
      this.templateStore = templateStore;
      return this;
    }

    /** Optional. Enables durable metrics samples and reports. */
    public Builder sampleStore(MetricsSampleStore sampleStore) {
      this.sampleStore = sampleStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder registry(EndpointRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}; closed with Herald when closeable. */
    public Builder metricsExporter(MetricsExporter metricsExporter) {
      this.metricsExporter = metricsExporter;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Zone for cron evaluation and template date variables. Defaults to UTC. */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /** Whether to run the queue processor. Defaults to {@code true}. */
    public Builder processorEnabled(boolean processorEnabled) {
      this.processorEnabled = processorEnabled;
      return this;
    }

    public Builder processingInterval(Duration processingInterval) {
      this.processingInterval = processingInterval;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder jobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
      return this;
    }

    /** Age after which a job left running is leased again. Defaults to five minutes. */
    public Builder leaseTimeout(Duration leaseTimeout) {
      this.leaseTimeout = leaseTimeout;
      return this;
    }

    /** Max parallel endpoints per dispatch. Defaults to {@code 32}. */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    /** Whether to start the cron ticker when a job store is configured. Defaults to {@code true}. */
    public Builder schedulerEnabled(boolean schedulerEnabled) {
      this.schedulerEnabled = schedulerEnabled;
      return this;
    }

    public Builder purgeEnabled(boolean purgeEnabled) {
      this.purgeEnabled = purgeEnabled;
      return this;
    }

    public Builder purgeInterval(Duration purgeInterval) {
      this.purgeInterval = purgeInterval;
      return this;
    }

    /** Age after which completed and failed jobs are purged. Defaults to 7 days. */
    public Builder jobRetention(Duration jobRetention) {
      this.jobRetention = jobRetention;
      return this;
    }

    /** Age after which metrics samples are purged. Defaults to 30 days. */
    public Builder metricsRetention(Duration metricsRetention) {
      this.metricsRetention = metricsRetention;
      return this;
    }

    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    /** Install the built-in templates on build. Defaults to {@code false}. */
    public Builder installDefaultTemplates(boolean installDefaultTemplates) {
      this.installDefaultTemplates = installDefaultTemplates;
      return this;
    }

    /**
     * Builds and starts every configured component. If any component fails to start, the ones
     * already started are closed before the exception propagates.
     *
     * @throws NullPointerException  if a required collaborator is missing
     * @throws IllegalStateException if the builder was already used
     */
    public Herald build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(queueStore, "queueStore");
      Objects.requireNonNull(registry, "registry");
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
      MetricsExporter effectiveExporter = metricsExporter != null ? metricsExporter : MetricsExporter.NOOP;

      NotificationQueue queue = NotificationQueue.builder()
          .connectionProvider(connectionProvider)
          .queueStore(queueStore)
          .retryPolicy(retryPolicy)
          .clock(effectiveClock)
          .defaultMaxRetries(maxRetries)
          .defaultRetryDelay(retryDelay)
          .leaseTimeout(leaseTimeout)
          .build();
      TemplateEngine templates = templateStore == null ? null : TemplateEngine.builder()
          .connectionProvider(connectionProvider)
          .templateStore(templateStore)
          .clock(effectiveClock)
          .zone(zone)
          .build();
      MetricsRecorder metrics = MetricsRecorder.builder()
          .exporter(effectiveExporter)
          .connectionProvider(connectionProvider)
          .sampleStore(sampleStore)
          .clock(effectiveClock)
          .build();
      metrics.updateGauge(SERVICES_CONFIGURED_GAUGE, registry.schemes().size());

      FanOutDispatcher dispatcher = null;
      QueueProcessor processor = null;
      CronScheduler scheduler = null;
      PurgeScheduler purgeScheduler = null;
      try {
        if (templates != null && installDefaultTemplates) {
          templates.installDefaults();
        }
        dispatcher = FanOutDispatcher.builder()
            .maxConcurrency(maxConcurrency)
            .clock(effectiveClock)
            .build();
        if (processorEnabled) {
          processor = QueueProcessor.builder()
              .queue(queue)
              .registry(registry)
              .dispatcher(dispatcher)
              .templateEngine(templates)
              .metrics(metrics)
              .batchSize(batchSize)
              .interval(processingInterval)
              .workerCount(workerCount)
              .jobTimeout(jobTimeout)
              .clock(effectiveClock)
              .build();
          processor.start();
        }
        if (jobStore != null) {
          scheduler = CronScheduler.builder()
              .connectionProvider(connectionProvider)
              .jobStore(jobStore)
              .queue(queue)
              .templateEngine(templates)
              .registry(registry)
              .clock(effectiveClock)
              .zone(zone)
              .defaultMaxRetries(maxRetries)
              .defaultRetryDelay(retryDelay)
              .build();
          if (schedulerEnabled) {
            scheduler.start();
          }
        }
        if (purgeEnabled) {
          PurgeScheduler.Builder purge = PurgeScheduler.builder()
              .connectionProvider(connectionProvider)
              .target("jobs", queueStore, jobRetention)
              .batchSize(purgeBatchSize)
              .interval(purgeInterval)
              .clock(effectiveClock);
          if (sampleStore != null) {
            purge.target("metrics", sampleStore, metricsRetention);
          }
          purgeScheduler = purge.build();
          purgeScheduler.start();
        }
      } catch (RuntimeException e) {
        closeOnFailure(e, purgeScheduler, scheduler, processor, dispatcher);
        throw e;
      }
      logger.log(Level.INFO, "Herald started (processor={0}, scheduler={1}, purge={2})",
          new Object[]{processor != null, scheduler != null && schedulerEnabled, purgeScheduler != null});
      return new Herald(queue, registry, templates, metrics, dispatcher, processor, scheduler,
          purgeScheduler, effectiveExporter);
    }

    private static void closeOnFailure(RuntimeException failure, AutoCloseable... components) {
      for (AutoCloseable component : components) {
        if (component == null) {
          continue;
        }
        try {
          component.close();
        } catch (Exception e) {
          failure.addSuppressed(e);
        }
      }
    }
  }
}
