package herald.schedule;

import herald.NotifyType;
import herald.queue.JobPayload;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, cron-triggered notification.
 *
 * <p>{@code lastRun}, {@code nextRun}, {@code runCount} and {@code lastStatus} belong to the
 * {@link CronScheduler}; values supplied on {@link CronScheduler#add} or
 * {@link CronScheduler#update} are ignored.
 */
public record ScheduledJob(
    Long id,
    String name,
    String cronExpression,
    JobPayload payload,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt,
    Instant nextRun,
    Instant lastRun,
    String lastStatus,
    long runCount) {

  public ScheduledJob {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(cronExpression, "cronExpression");
    Objects.requireNonNull(payload, "payload");
    if (runCount < 0) {
      throw new IllegalArgumentException("runCount must be >= 0");
    }
  }

  public static Builder builder(String name, String cronExpression) {
    return new Builder(name, cronExpression);
  }

  public Builder toBuilder() {
    Builder b = new Builder(name, cronExpression);
    b.id = id;
    b.title = payload.title();
    b.body = payload.body();
    b.notifyType = payload.notifyType();
    b.services.addAll(payload.services());
    b.tags.addAll(payload.tags());
    b.metadata.putAll(payload.metadata());
    b.templateName = payload.templateName();
    b.enabled = enabled;
    b.createdAt = createdAt;
    b.updatedAt = updatedAt;
    b.nextRun = nextRun;
    b.lastRun = lastRun;
    b.lastStatus = lastStatus;
    b.runCount = runCount;
    return b;
  }

  /** Builder for {@link ScheduledJob}. Jobs are enabled unless told otherwise. */
  public static final class Builder {
    private Long id;
    private String name;
    private String cronExpression;
    private String title;
    private String body;
    private NotifyType notifyType;
    private final List<String> services = new ArrayList<>();
    private final List<String> tags = new ArrayList<>();
    private final Map<String, String> metadata = new LinkedHashMap<>();
    private String templateName;
    private boolean enabled = true;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant nextRun;
    private Instant lastRun;
    private String lastStatus;
    private long runCount;

    private Builder(String name, String cronExpression) {
      this.name = name;
      this.cronExpression = cronExpression;
    }

    public Builder id(Long id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder cronExpression(String cronExpression) {
      this.cronExpression = cronExpression;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder body(String body) {
      this.body = body;
      return this;
    }

    public Builder notifyType(NotifyType notifyType) {
      this.notifyType = notifyType;
      return this;
    }

    public Builder service(String url) {
      this.services.add(Objects.requireNonNull(url, "url"));
      return this;
    }

    public Builder services(List<String> urls) {
      this.services.clear();
      urls.forEach(this::service);
      return this;
    }

    public Builder tag(String tag) {
      this.tags.add(Objects.requireNonNull(tag, "tag"));
      return this;
    }

    public Builder metadata(String key, String value) {
      this.metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder metadata(Map<String, String> values) {
      values.forEach(this::metadata);
      return this;
    }

    /** Shortcut for {@code metadata("priority", ...)}, read when the job fires. */
    public Builder priority(int priority) {
      return metadata(CronScheduler.PRIORITY_KEY, Integer.toString(priority));
    }

    public Builder templateName(String templateName) {
      this.templateName = templateName;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder nextRun(Instant nextRun) {
      this.nextRun = nextRun;
      return this;
    }

    public Builder lastRun(Instant lastRun) {
      this.lastRun = lastRun;
      return this;
    }

    public Builder lastStatus(String lastStatus) {
      this.lastStatus = lastStatus;
      return this;
    }

    public Builder runCount(long runCount) {
      this.runCount = runCount;
      return this;
    }

    public ScheduledJob build() {
      JobPayload payload = new JobPayload(title, body, notifyType, services, tags, metadata, templateName);
      return new ScheduledJob(id, name, cronExpression, payload, enabled, createdAt, updatedAt,
          nextRun, lastRun, lastStatus, runCount);
    }
  }
}
