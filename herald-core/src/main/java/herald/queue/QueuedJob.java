package herald.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A materialized notification in the durable queue.
 *
 * <p>Callers build a job with {@link #builder(JobPayload)} and hand it to
 * {@link NotificationQueue#enqueue}; identity, timestamps and status are assigned by the queue.
 * Zero or unset {@code priority}, {@code maxRetries} and {@code retryDelay} take the queue's
 * defaults (1, 3 and five minutes).
 */
public record QueuedJob(
    Long id,
    Long scheduledId,
    JobPayload payload,
    int priority,
    int maxRetries,
    int retryCount,
    Duration retryDelay,
    JobStatus status,
    String errorMessage,
    Instant createdAt,
    Instant scheduledAt,
    Instant startedAt,
    Instant completedAt,
    Instant nextRetryAt) {

  public QueuedJob {
    Objects.requireNonNull(payload, "payload");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (retryDelay != null && retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must be >= 0");
    }
  }

  public static Builder builder(JobPayload payload) {
    return new Builder(payload);
  }

  public Builder toBuilder() {
    Builder b = new Builder(payload);
    b.id = id;
    b.scheduledId = scheduledId;
    b.priority = priority;
    b.maxRetries = maxRetries;
    b.retryCount = retryCount;
    b.retryDelay = retryDelay;
    b.status = status;
    b.errorMessage = errorMessage;
    b.createdAt = createdAt;
    b.scheduledAt = scheduledAt;
    b.startedAt = startedAt;
    b.completedAt = completedAt;
    b.nextRetryAt = nextRetryAt;
    return b;
  }

  /** Whether another failed attempt would still move the job to {@code retrying}. */
  public boolean hasAttemptsLeft() {
    return retryCount < maxRetries;
  }

  /** Builder for {@link QueuedJob}. */
  public static final class Builder {
    private Long id;
    private Long scheduledId;
    private JobPayload payload;
    private int priority;
    private int maxRetries;
    private int retryCount;
    private Duration retryDelay;
    private JobStatus status;
    private String errorMessage;
    private Instant createdAt;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant nextRetryAt;

    private Builder(JobPayload payload) {
      this.payload = payload;
    }

    public Builder id(Long id) {
      this.id = id;
      return this;
    }

    public Builder scheduledId(Long scheduledId) {
      this.scheduledId = scheduledId;
      return this;
    }

    public Builder payload(JobPayload payload) {
      this.payload = payload;
      return this;
    }

    /** Higher runs first. Optional; 0 means the queue default (1). */
    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    /** Optional; 0 means the queue default (3). */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    /** Base backoff delay. Optional; {@code null} or zero means the queue default (5 minutes). */
    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder status(JobStatus status) {
      this.status = status;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder scheduledAt(Instant scheduledAt) {
      this.scheduledAt = scheduledAt;
      return this;
    }

    public Builder startedAt(Instant startedAt) {
      this.startedAt = startedAt;
      return this;
    }

    public Builder completedAt(Instant completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    public Builder nextRetryAt(Instant nextRetryAt) {
      this.nextRetryAt = nextRetryAt;
      return this;
    }

    public QueuedJob build() {
      return new QueuedJob(id, scheduledId, payload, priority, maxRetries, retryCount, retryDelay,
          status, errorMessage, createdAt, scheduledAt, startedAt, completedAt, nextRetryAt);
    }
  }
}
