package herald.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of delivering one notification to one endpoint.
 *
 * @param serviceId        endpoint service id
 * @param serviceUrl       redacted service URL (no credentials)
 * @param success          whether the endpoint accepted the notification
 * @param error            failure description, {@link #CANCELLED} when the deadline cut it short,
 *                         {@code null} on success
 * @param transientFailure whether the failure was transient (cancellations count as transient)
 * @param duration         time spent in the endpoint
 */
public record Outcome(String serviceId, String serviceUrl, boolean success, String error,
    boolean transientFailure, Duration duration) {
  public static final String CANCELLED = "cancelled";

  public Outcome {
    Objects.requireNonNull(serviceId, "serviceId");
    serviceUrl = serviceUrl == null ? "" : serviceUrl;
    duration = duration == null ? Duration.ZERO : duration;
  }

  public static Outcome success(String serviceId, String serviceUrl, Duration duration) {
    return new Outcome(serviceId, serviceUrl, true, null, false, duration);
  }

  public static Outcome failure(String serviceId, String serviceUrl, String error,
      boolean transientFailure, Duration duration) {
    return new Outcome(serviceId, serviceUrl, false, error == null ? "unknown error" : error,
        transientFailure, duration);
  }

  public static Outcome cancelled(String serviceId, String serviceUrl, Duration duration) {
    return new Outcome(serviceId, serviceUrl, false, CANCELLED, true, duration);
  }

  public boolean isCancelled() {
    return !success && CANCELLED.equals(error);
  }
}
