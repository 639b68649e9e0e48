package herald.dispatch;

import herald.queue.JobStatus;

/**
 * Job-level verdict derived from per-endpoint outcomes.
 *
 * @param status  {@link JobStatus#COMPLETED}, {@link JobStatus#RETRYING} or {@link JobStatus#FAILED}
 * @param message warning or error text to store on the job; {@code null} on full success
 */
public record Aggregation(JobStatus status, String message) {
}
