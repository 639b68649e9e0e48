package herald.queue;

/**
 * Lifecycle states of a {@link QueuedJob}.
 *
 * <pre>
 * pending ──lease──► running ──all ok / partial──► completed
 *                      │
 *                      ├──all failed, attempts left──► retrying ──lease when due──► running
 *                      └──all failed, exhausted──────► failed
 * </pre>
 */
public enum JobStatus {
  PENDING("pending"),
  RUNNING("running"),
  RETRYING("retrying"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String code;

  JobStatus(String code) {
    this.code = code;
  }

  /** Value stored in the {@code status} column. */
  public String code() {
    return code;
  }

  /** Whether jobs in this state may be leased (subject to {@code next_retry_at}). */
  public boolean isLeasable() {
    return this == PENDING || this == RETRYING;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static JobStatus fromCode(String code) {
    for (JobStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + code);
  }
}
