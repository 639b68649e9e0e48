package herald.endpoint;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative cancellation token shared by every delivery task of one dispatch.
 *
 * <p>The dispatcher cancels the context when the deadline passes. Endpoints should check
 * {@link #isCancelled()} between steps, bound their own I/O by {@link #remaining()}, and may
 * register a {@linkplain #onCancel(Runnable) hook} that aborts an in-flight request.
 */
public final class DeliveryContext {
  private static final Logger logger = Logger.getLogger(DeliveryContext.class.getName());

  private final Instant deadline;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

  public DeliveryContext(Instant deadline, Clock clock) {
    this.deadline = Objects.requireNonNull(deadline, "deadline");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Creates a context that expires {@code timeout} from now on the system clock. */
  public static DeliveryContext withTimeout(Duration timeout) {
    Clock clock = Clock.systemUTC();
    return new DeliveryContext(clock.instant().plus(timeout), clock);
  }

  public Instant deadline() {
    return deadline;
  }

  /** Time left before the deadline; {@link Duration#ZERO} once it has passed. */
  public Duration remaining() {
    Duration left = Duration.between(clock.instant(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public boolean isCancelled() {
    return cancelled.get() || !clock.instant().isBefore(deadline);
  }

  /**
   * Registers a hook run once on cancellation, e.g. aborting an HTTP request. Runs immediately
   * when the context is already cancelled.
   */
  public void onCancel(Runnable hook) {
    Objects.requireNonNull(hook, "hook");
    cancelHooks.add(hook);
    if (cancelled.get() && cancelHooks.remove(hook)) {
      runHook(hook);
    }
  }

  /**
   * Cancels the context and runs registered hooks. Later calls are no-ops.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    for (Runnable hook : cancelHooks) {
      if (cancelHooks.remove(hook)) {
        runHook(hook);
      }
    }
  }

  private static void runHook(Runnable hook) {
    try {
      hook.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cancellation hook failed", e);
    }
  }
}
