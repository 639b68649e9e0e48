package herald.dispatch;

import herald.Notification;
import herald.endpoint.DeliveryContext;
import herald.endpoint.DeliveryEndpoint;
import herald.endpoint.DeliveryException;
import herald.endpoint.EndpointRegistry;
import herald.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends one notification to many endpoints concurrently and collects one {@link Outcome} per
 * endpoint, in the order the endpoints were given.
 *
 * <p>Up to {@code maxConcurrency} lanes run on the delivery pool; each lane takes the next
 * unsent endpoint until none are left. All lanes share one {@link DeliveryContext}. When the
 * deadline passes the context is cancelled, running sends are interrupted and every endpoint
 * without a result is reported as {@linkplain Outcome#cancelled cancelled}. A dispatch never
 * retries; that is the queue's job.
 *
 * <p>This class is thread-safe; one instance serves every worker of a
 * {@link herald.queue.QueueProcessor}.
 */
public final class FanOutDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FanOutDispatcher.class.getName());

  private final int maxConcurrency;
  private final Clock clock;
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  private FanOutDispatcher(Builder builder) {
    if (builder.maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be > 0");
    }
    this.maxConcurrency = builder.maxConcurrency;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.ownsExecutor = builder.executor == null;
    this.executor = ownsExecutor
        ? Executors.newCachedThreadPool(new DaemonThreadFactory("herald-delivery-"))
        : builder.executor;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers {@code notification} to every target.
   *
   * @param notification the notification; bodies are truncated per endpoint
   * @param targets      resolved endpoints, typically from {@link EndpointRegistry#resolveLenient}
   * @param deadline     instant after which unfinished deliveries are cancelled
   * @return one outcome per target, same order as {@code targets}
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public List<Outcome> dispatch(Notification notification, List<EndpointRegistry.Resolved> targets,
      Instant deadline) {
    Objects.requireNonNull(notification, "notification");
    Objects.requireNonNull(deadline, "deadline");
    int n = targets.size();
    if (n == 0) {
      return List.of();
    }

    DeliveryContext ctx = new DeliveryContext(deadline, clock);
    AtomicReferenceArray<Outcome> results = new AtomicReferenceArray<>(n);
    AtomicInteger cursor = new AtomicInteger();
    int lanes = Math.min(n, maxConcurrency);
    CountDownLatch finished = new CountDownLatch(lanes);
    long started = System.nanoTime();

    List<Future<?>> futures = new ArrayList<>(lanes);
    try {
      for (int lane = 0; lane < lanes; lane++) {
        futures.add(executor.submit(() -> {
          try {
            runLane(notification, targets, ctx, cursor, results);
          } finally {
            finished.countDown();
          }
        }));
      }
    } catch (RejectedExecutionException e) {
      ctx.cancel();
      futures.forEach(f -> f.cancel(true));
      throw new IllegalStateException("FanOutDispatcher has been closed", e);
    }

    boolean interrupted = false;
    boolean completed;
    try {
      completed = finished.await(nanosUntil(deadline), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      interrupted = true;
      completed = false;
    }
    if (!completed) {
      ctx.cancel();
      futures.forEach(f -> f.cancel(true));
      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
      int cancelled = 0;
      for (int i = 0; i < n; i++) {
        EndpointRegistry.Resolved target = targets.get(i);
        if (results.compareAndSet(i, null,
            Outcome.cancelled(target.endpoint().serviceId(), target.url().redacted(), elapsed))) {
          cancelled++;
        }
      }
      logger.log(Level.WARNING, "Dispatch deadline reached, cancelled {0} of {1} deliveries",
          new Object[]{cancelled, n});
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }

    List<Outcome> outcomes = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      outcomes.add(results.get(i));
    }
    return outcomes;
  }

  private void runLane(Notification notification, List<EndpointRegistry.Resolved> targets,
      DeliveryContext ctx, AtomicInteger cursor, AtomicReferenceArray<Outcome> results) {
    int i;
    while ((i = cursor.getAndIncrement()) < targets.size()) {
      EndpointRegistry.Resolved target = targets.get(i);
      Outcome outcome = ctx.isCancelled()
          ? Outcome.cancelled(target.endpoint().serviceId(), target.url().redacted(), Duration.ZERO)
          : deliver(notification, target, ctx);
      results.compareAndSet(i, null, outcome);
    }
  }

  private Outcome deliver(Notification notification, EndpointRegistry.Resolved target,
      DeliveryContext ctx) {
    DeliveryEndpoint endpoint = target.endpoint();
    String serviceId = endpoint.serviceId();
    String serviceUrl = target.url().redacted();
    long start = System.nanoTime();
    try {
      endpoint.send(notification.truncatedTo(endpoint.maxBodyLength()), ctx);
      return Outcome.success(serviceId, serviceUrl, Duration.ofNanos(System.nanoTime() - start));
    } catch (DeliveryException e) {
      Duration took = Duration.ofNanos(System.nanoTime() - start);
      if (ctx.isCancelled() && Thread.interrupted()) {
        return Outcome.cancelled(serviceId, serviceUrl, took);
      }
      logger.log(Level.FINE, "Delivery to {0} failed: {1}", new Object[]{serviceUrl, e.getMessage()});
      return Outcome.failure(serviceId, serviceUrl, e.getMessage(), e.isTransient(), took);
    } catch (RuntimeException e) {
      Duration took = Duration.ofNanos(System.nanoTime() - start);
      logger.log(Level.WARNING, "Endpoint " + serviceId + " threw unexpectedly", e);
      return Outcome.failure(serviceId, serviceUrl, describe(e), true, took);
    }
  }

  private long nanosUntil(Instant deadline) {
    Duration left = Duration.between(clock.instant(), deadline);
    if (left.isNegative()) {
      return 0L;
    }
    try {
      return left.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static String describe(Throwable t) {
    return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
  }

  /**
   * Shuts down the delivery pool when this dispatcher created it. An executor supplied through
   * {@link Builder#executor} is left to its owner.
   */
  @Override
  public void close() {
    if (!ownsExecutor) {
      return;
    }
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for {@link FanOutDispatcher}.
   */
  public static final class Builder {
    private int maxConcurrency = 32;
    private Clock clock;
    private ExecutorService executor;

    private Builder() {
    }

    /**
     * Maximum endpoints sent to in parallel within one dispatch.
     *
     * <p>Optional. Defaults to {@code 32}. Must be &gt; 0.
     */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /** Clock the deadline is measured against. Optional; defaults to UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Runs deliveries on {@code executor} instead of a private cached pool. The executor must
     * be able to run {@code maxConcurrency} tasks at once.
     */
    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public FanOutDispatcher build() {
      return new FanOutDispatcher(this);
    }
  }
}
