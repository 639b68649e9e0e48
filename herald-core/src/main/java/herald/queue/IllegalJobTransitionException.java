package herald.queue;

/**
 * Thrown by {@link NotificationQueue#transition} when the job's current state does not allow
 * the requested one (for example completing a job nobody leased, or retrying a job whose
 * attempts are exhausted).
 */
public class IllegalJobTransitionException extends RuntimeException {
  private final long jobId;
  private final JobStatus from;
  private final JobStatus to;

  public IllegalJobTransitionException(long jobId, JobStatus from, JobStatus to, String detail) {
    super("Cannot move job " + jobId + " from " + from.code() + " to " + to.code()
        + (detail == null ? "" : ": " + detail));
    this.jobId = jobId;
    this.from = from;
    this.to = to;
  }

  public long jobId() {
    return jobId;
  }

  public JobStatus from() {
    return from;
  }

  public JobStatus to() {
    return to;
  }
}
