package herald.dispatch;

import java.time.Duration;

/**
 * Computes how long a job waits in {@code retrying} before it is due again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay before the next attempt.
   *
   * @param baseDelay  the job's configured base delay
   * @param retryCount the job's retry count after this failure was counted (1 for the first retry)
   * @return a delay, strictly positive when {@code baseDelay} is positive
   */
  Duration computeDelay(Duration baseDelay, int retryCount);
}
