package herald.dispatch;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * min(2^(retryCount-1), maxMultiplier)}.
 *
 * <p>With the default multiplier cap of 64 a five-minute base never waits more than 320 minutes,
 * however large {@code max_retries} is. Optional jitter scales the result by a random factor in
 * {@code [1 - jitter, 1 + jitter)}; it is off by default so delays are exact.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final int DEFAULT_MAX_MULTIPLIER = 64;

  private final long maxMultiplier;
  private final double jitter;

  /** Policy with a 64x cap and no jitter. */
  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_MAX_MULTIPLIER, 0.0);
  }

  /**
   * @param maxMultiplier cap applied to {@code 2^(retryCount-1)}; must be &ge; 1
   * @param jitter        relative jitter in {@code [0, 1)}
   */
  public ExponentialBackoffRetryPolicy(long maxMultiplier, double jitter) {
    if (maxMultiplier < 1) {
      throw new IllegalArgumentException("maxMultiplier must be >= 1, got: " + maxMultiplier);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.maxMultiplier = maxMultiplier;
    this.jitter = jitter;
  }

  /** Returns the multiplier for {@code retryCount}: {@code min(2^(retryCount-1), cap)}, 1 when below 1. */
  public long multiplier(int retryCount) {
    if (retryCount <= 1) {
      return 1L;
    }
    // shifts of 62+ overflow; any cap we accept is reached long before that
    if (retryCount - 1 >= 62) {
      return maxMultiplier;
    }
    return Math.min(1L << (retryCount - 1), maxMultiplier);
  }

  @Override
  public Duration computeDelay(Duration baseDelay, int retryCount) {
    if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
      return Duration.ZERO;
    }
    Duration delay;
    try {
      delay = baseDelay.multipliedBy(multiplier(retryCount));
    } catch (ArithmeticException e) {
      delay = Duration.ofSeconds(Long.MAX_VALUE / 2);
    }
    if (jitter == 0.0) {
      return delay;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    long nanos;
    try {
      nanos = delay.toNanos();
    } catch (ArithmeticException e) {
      return delay;
    }
    return Duration.ofNanos(Math.max(1L, (long) (nanos * factor)));
  }
}
