package herald.schedule;

import herald.NotifyType;
import herald.queue.JobPayload;
import herald.queue.NotificationQueue;
import herald.queue.QueuedJob;
import herald.testing.FakeConnections;
import herald.testing.InMemoryQueueStore;
import herald.testing.InMemoryScheduledJobStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchSchedulerTest {

  @Test
  void reportsPerItemResults() {
    NotificationQueue queue = NotificationQueue.builder()
        .connectionProvider(FakeConnections.provider())
        .queueStore(new InMemoryQueueStore())
        .build();
    try (CronScheduler scheduler = CronScheduler.builder()
        .connectionProvider(FakeConnections.provider())
        .jobStore(new InMemoryScheduledJobStore())
        .queue(queue)
        .build()) {
      BatchScheduler batch = new BatchScheduler(scheduler, queue);

      BatchScheduler.Result<ScheduledJob> result = batch.scheduleAll(List.of(
          ScheduledJob.builder("ok", "@hourly").service("json://a").build(),
          ScheduledJob.builder("bad", "not cron").service("json://a").build(),
          ScheduledJob.builder("ok", "@daily").service("json://a").build()));

      assertEquals(1, result.succeeded().size());
      assertEquals(2, result.failureCount());
      assertFalse(result.allSucceeded());
      assertNull(result.errors().get(0));
      assertInstanceOf(InvalidCronExpressionException.class, result.errors().get(1));
      assertInstanceOf(DuplicateJobNameException.class, result.errors().get(2));
      assertNull(result.results().get(2));
    }
  }

  @Test
  void enqueuesEveryJob() {
    InMemoryQueueStore store = new InMemoryQueueStore();
    NotificationQueue queue = NotificationQueue.builder()
        .connectionProvider(FakeConnections.provider())
        .queueStore(store)
        .build();
    try (CronScheduler scheduler = CronScheduler.builder()
        .connectionProvider(FakeConnections.provider())
        .jobStore(new InMemoryScheduledJobStore())
        .queue(queue)
        .build()) {
      BatchScheduler batch = new BatchScheduler(scheduler, queue);

      BatchScheduler.Result<QueuedJob> result = batch.enqueueAll(List.of(
          QueuedJob.builder(JobPayload.of("a", "b", NotifyType.INFO, List.of("json://a"))).build(),
          QueuedJob.builder(JobPayload.of("c", "d", NotifyType.WARNING, List.of("json://b"))).build()));

      assertTrue(result.allSucceeded());
      assertEquals(2, store.all().size());
    }
  }
}
