package herald.schedule;

import herald.queue.NotificationQueue;
import herald.queue.QueuedJob;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adds several scheduled jobs, or enqueues several one-off jobs, in one call. Each item is
 * handled independently: a failure is reported at its index and does not stop the rest.
 */
public final class BatchScheduler {
  private static final Logger logger = Logger.getLogger(BatchScheduler.class.getName());

  private final CronScheduler scheduler;
  private final NotificationQueue queue;

  public BatchScheduler(CronScheduler scheduler, NotificationQueue queue) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.queue = Objects.requireNonNull(queue, "queue");
  }

  public Result<ScheduledJob> scheduleAll(List<ScheduledJob> jobs) {
    return each(jobs, scheduler::add, ScheduledJob::name);
  }

  public Result<QueuedJob> enqueueAll(List<QueuedJob> jobs) {
    return each(jobs, queue::enqueue, job -> job.payload().title());
  }

  private static <T> Result<T> each(List<T> items, Function<T, T> action, Function<T, String> label) {
    List<T> results = new ArrayList<>(items.size());
    List<RuntimeException> errors = new ArrayList<>(items.size());
    for (T item : items) {
      try {
        results.add(action.apply(item));
        errors.add(null);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Batch item ''{0}'' rejected: {1}",
            new Object[]{label.apply(item), e.getMessage()});
        results.add(null);
        errors.add(e);
      }
    }
    return new Result<>(results, errors);
  }

  /**
   * Per-item results. For each index exactly one of {@code results.get(i)} and
   * {@code errors.get(i)} is non-null.
   */
  public static final class Result<T> {
    private final List<T> results;
    private final List<RuntimeException> errors;

    Result(List<T> results, List<RuntimeException> errors) {
      this.results = Collections.unmodifiableList(results);
      this.errors = Collections.unmodifiableList(errors);
    }

    public List<T> results() {
      return results;
    }

    public List<RuntimeException> errors() {
      return errors;
    }

    public List<T> succeeded() {
      return results.stream().filter(Objects::nonNull).toList();
    }

    public long failureCount() {
      return errors.stream().filter(Objects::nonNull).count();
    }

    public boolean allSucceeded() {
      return failureCount() == 0;
    }
  }
}
