package herald.dispatch;

import herald.queue.JobStatus;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps a job's endpoint outcomes to its next state.
 *
 * <ul>
 *   <li>every endpoint succeeded: {@code completed}, no message</li>
 *   <li>some succeeded: {@code completed} with a partial-success warning; never retried, so
 *       endpoints that already received the notification do not get it twice</li>
 *   <li>none succeeded and attempts remain: {@code retrying}</li>
 *   <li>none succeeded and attempts are exhausted: {@code failed}</li>
 * </ul>
 *
 * <p>Error content is not inspected: permanent and transient failures retry alike.
 */
public final class OutcomeAggregator {

  private OutcomeAggregator() {
  }

  public static Aggregation aggregate(List<Outcome> outcomes, int retryCount, int maxRetries) {
    long failed = outcomes.stream().filter(o -> !o.success()).count();
    if (!outcomes.isEmpty() && failed == 0) {
      return new Aggregation(JobStatus.COMPLETED, null);
    }
    if (failed < outcomes.size()) {
      return new Aggregation(JobStatus.COMPLETED,
          "Partial success: " + failed + "/" + outcomes.size() + " services failed: " + describeFailures(outcomes));
    }
    String message = outcomes.isEmpty()
        ? "No deliverable services"
        : "All services failed: " + describeFailures(outcomes);
    return retryCount < maxRetries
        ? new Aggregation(JobStatus.RETRYING, message)
        : new Aggregation(JobStatus.FAILED, message);
  }

  private static String describeFailures(List<Outcome> outcomes) {
    return outcomes.stream()
        .filter(o -> !o.success())
        .map(o -> o.serviceId() + ": " + o.error())
        .collect(Collectors.joining("; ", "[", "]"));
  }
}
