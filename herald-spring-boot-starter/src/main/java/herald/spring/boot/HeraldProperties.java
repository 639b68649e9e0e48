package herald.spring.boot;

import herald.queue.NotificationQueue;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for Herald.
 *
 * @see HeraldAutoConfiguration
 */
@ConfigurationProperties(prefix = "herald")
public class HeraldProperties {

  private final Jdbc jdbc = new Jdbc();
  private final Processor processor = new Processor();
  private final Retry retry = new Retry();
  private final Scheduler scheduler = new Scheduler();
  private final Purge purge = new Purge();
  private final Metrics metrics = new Metrics();
  private final Templates templates = new Templates();

  public Jdbc getJdbc() {
    return jdbc;
  }

  public Processor getProcessor() {
    return processor;
  }

  public Retry getRetry() {
    return retry;
  }

  public Scheduler getScheduler() {
    return scheduler;
  }

  public Purge getPurge() {
    return purge;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Templates getTemplates() {
    return templates;
  }

  public static class Jdbc {
    /**
     * Create the Herald tables on startup. Every statement is {@code IF NOT EXISTS}.
     */
    private boolean initializeSchema;

    public boolean isInitializeSchema() {
      return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
      this.initializeSchema = initializeSchema;
    }
  }

  public static class Processor {
    private boolean enabled = true;
    /**
     * Pause between processing cycles.
     */
    private Duration interval = Duration.ofSeconds(10);
    private int batchSize = 10;
    /**
     * Threads running jobs of one batch; 0 runs them on the processing thread.
     */
    private int workerCount = 4;
    /**
     * Deadline for delivering one job to all of its endpoints.
     */
    private Duration jobTimeout = Duration.ofSeconds(30);
    /**
     * Age after which a job still marked running is leased again. Must exceed job-timeout.
     */
    private Duration leaseTimeout = Duration.ofMinutes(5);
    /**
     * Max endpoints contacted in parallel for one job.
     */
    private int maxConcurrency = 32;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public Duration getJobTimeout() {
      return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
    }

    public Duration getLeaseTimeout() {
      return leaseTimeout;
    }

    public void setLeaseTimeout(Duration leaseTimeout) {
      this.leaseTimeout = leaseTimeout;
    }

    public int getMaxConcurrency() {
      return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
    }
  }

  public static class Retry {
    private int maxRetries = NotificationQueue.DEFAULT_MAX_RETRIES;
    /**
     * Base delay; retry n waits {@code retry-delay * 2^(n-1)}, capped at 64 times the base.
     */
    private Duration retryDelay = NotificationQueue.DEFAULT_RETRY_DELAY;

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getRetryDelay() {
      return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
    }
  }

  public static class Scheduler {
    private boolean enabled = true;
    /**
     * Zone cron expressions and template dates are evaluated in.
     */
    private ZoneId zone = ZoneId.of("UTC");

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public ZoneId getZone() {
      return zone;
    }

    public void setZone(ZoneId zone) {
      this.zone = zone;
    }
  }

  public static class Purge {
    private boolean enabled = true;
    private Duration interval = Duration.ofHours(24);
    /**
     * Completed and failed jobs older than this are deleted.
     */
    private Duration jobRetention = Duration.ofDays(7);
    private Duration metricsRetention = Duration.ofDays(30);
    private int batchSize = 500;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public Duration getJobRetention() {
      return jobRetention;
    }

    public void setJobRetention(Duration jobRetention) {
      this.jobRetention = jobRetention;
    }

    public Duration getMetricsRetention() {
      return metricsRetention;
    }

    public void setMetricsRetention(Duration metricsRetention) {
      this.metricsRetention = metricsRetention;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "herald";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  public static class Templates {
    /**
     * Install the built-in templates on startup when missing.
     */
    private boolean installDefaults = true;

    public boolean isInstallDefaults() {
      return installDefaults;
    }

    public void setInstallDefaults(boolean installDefaults) {
      this.installDefaults = installDefaults;
    }
  }
}
