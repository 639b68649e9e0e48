package herald.http;

import java.time.Duration;

/**
 * Connection pool profiles. Endpoints pick the profile that matches the API they call.
 */
public enum ServiceCategory {
  /** Large cloud provider APIs: slow responses, high fan-out. */
  CLOUD(Duration.ofSeconds(60), 200, 50, Duration.ofSeconds(120)),
  /** User-supplied webhooks: fail fast. */
  WEBHOOK(Duration.ofSeconds(15), 50, 20, Duration.ofSeconds(60)),
  DEFAULT(Duration.ofSeconds(30), 100, 30, Duration.ofSeconds(90));

  private final Duration timeout;
  private final int maxTotal;
  private final int maxPerRoute;
  private final Duration idleEviction;

  ServiceCategory(Duration timeout, int maxTotal, int maxPerRoute, Duration idleEviction) {
    this.timeout = timeout;
    this.maxTotal = maxTotal;
    this.maxPerRoute = maxPerRoute;
    this.idleEviction = idleEviction;
  }

  /** Connect and response timeout for a single request. */
  public Duration timeout() {
    return timeout;
  }

  public int maxTotal() {
    return maxTotal;
  }

  public int maxPerRoute() {
    return maxPerRoute;
  }

  /** Idle connections older than this are closed by the pool's evictor. */
  public Duration idleEviction() {
    return idleEviction;
  }
}
