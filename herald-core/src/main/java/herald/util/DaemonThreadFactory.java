package herald.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for Herald's background threads (processor loop, delivery lanes,
 * cron ticker, purge).
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. and are daemons, so an
 * application that forgets to close its {@link herald.Herald} still exits.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    return thread;
  }
}
