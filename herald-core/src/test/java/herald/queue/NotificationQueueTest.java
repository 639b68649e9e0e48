package herald.queue;

import herald.NotifyType;
import herald.testing.FakeConnections;
import herald.testing.InMemoryQueueStore;
import herald.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotificationQueueTest {
  private MutableClock clock;
  private InMemoryQueueStore store;
  private NotificationQueue queue;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-01-01T00:00:00Z");
    store = new InMemoryQueueStore();
    queue = NotificationQueue.builder()
        .connectionProvider(FakeConnections.provider())
        .queueStore(store)
        .clock(clock)
        .build();
  }

  private static QueuedJob.Builder job(String title) {
    return QueuedJob.builder(JobPayload.of(title, "body", NotifyType.INFO, List.of("json://host")));
  }

  @Test
  void enqueueAppliesDefaults() {
    QueuedJob stored = queue.enqueue(job("a").build());

    assertNotNull(stored.id());
    assertEquals(JobStatus.PENDING, stored.status());
    assertEquals(NotificationQueue.DEFAULT_PRIORITY, stored.priority());
    assertEquals(NotificationQueue.DEFAULT_MAX_RETRIES, stored.maxRetries());
    assertEquals(NotificationQueue.DEFAULT_RETRY_DELAY, stored.retryDelay());
    assertEquals(0, stored.retryCount());
    assertEquals(clock.instant(), stored.createdAt());
    assertEquals(clock.instant(), stored.scheduledAt());
  }

  @Test
  void enqueueIgnoresCallerState() {
    QueuedJob stored = queue.enqueue(job("a").id(99L).status(JobStatus.FAILED).retryCount(2)
        .priority(5).maxRetries(1).retryDelay(Duration.ofSeconds(30)).build());

    assertNotEquals(99L, stored.id());
    assertEquals(JobStatus.PENDING, stored.status());
    assertEquals(0, stored.retryCount());
    assertEquals(5, stored.priority());
    assertEquals(1, stored.maxRetries());
    assertEquals(Duration.ofSeconds(30), stored.retryDelay());
  }

  @Test
  void higherPriorityLeasesFirst() {
    QueuedJob low = queue.enqueue(job("p1").priority(1).build());
    clock.advance(Duration.ofSeconds(1));
    QueuedJob high = queue.enqueue(job("p10").priority(10).build());

    List<QueuedJob> leased = queue.leaseDue(2);

    assertEquals(List.of(high.id(), low.id()), leased.stream().map(QueuedJob::id).toList());
    assertTrue(leased.stream().allMatch(j -> j.status() == JobStatus.RUNNING));
    assertTrue(queue.leaseDue(2).isEmpty());
  }

  @Test
  void equalPriorityIsFifo() {
    QueuedJob first = queue.enqueue(job("a").build());
    clock.advance(Duration.ofMillis(5));
    QueuedJob second = queue.enqueue(job("b").build());

    assertEquals(List.of(first.id(), second.id()),
        queue.peekDue(10).stream().map(QueuedJob::id).toList());
  }

  @Test
  void exponentialBackoffUntilFailed() {
    QueuedJob job = queue.enqueue(job("flaky").maxRetries(5).retryDelay(Duration.ofMinutes(1)).build());
    List<Duration> delays = new ArrayList<>();

    for (int attempt = 1; attempt <= 5; attempt++) {
      QueuedJob leased = queue.leaseDue(1).get(0);
      Instant failedAt = clock.instant();
      QueuedJob retrying = queue.transition(leased.id(), JobStatus.RETRYING, "HTTP 503");
      assertEquals(JobStatus.RETRYING, retrying.status());
      assertEquals(attempt, retrying.retryCount());
      Duration delay = Duration.between(failedAt, retrying.nextRetryAt());
      delays.add(delay);

      clock.advance(delay.minusSeconds(1));
      assertTrue(queue.leaseDue(1).isEmpty(), "job leased before its retry time");
      clock.advance(Duration.ofSeconds(1));
    }

    assertEquals(List.of(Duration.ofMinutes(1), Duration.ofMinutes(2), Duration.ofMinutes(4),
        Duration.ofMinutes(8), Duration.ofMinutes(16)), delays);

    QueuedJob last = queue.leaseDue(1).get(0);
    assertThrows(IllegalJobTransitionException.class,
        () -> queue.transition(last.id(), JobStatus.RETRYING, "HTTP 503"));
    QueuedJob failed = queue.transition(job.id(), JobStatus.FAILED, "HTTP 503");
    assertEquals(JobStatus.FAILED, failed.status());
    assertEquals(5, failed.retryCount());
    assertEquals(clock.instant(), failed.completedAt());
  }

  @Test
  void completedKeepsPartialSuccessWarning() {
    QueuedJob job = queue.enqueue(job("a").build());
    queue.transition(job.id(), JobStatus.RUNNING, null);

    QueuedJob done = queue.transition(job.id(), JobStatus.COMPLETED, "Partial success: 1/2 services failed");

    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(0, done.retryCount());
    assertEquals("Partial success: 1/2 services failed", done.errorMessage());
  }

  @Test
  void illegalTransitionsAreRejected() {
    QueuedJob job = queue.enqueue(job("a").build());

    assertThrows(IllegalJobTransitionException.class,
        () -> queue.transition(job.id(), JobStatus.COMPLETED, null));
    assertThrows(IllegalJobTransitionException.class,
        () -> queue.transition(job.id(), JobStatus.RETRYING, null));
    assertThrows(IllegalJobTransitionException.class,
        () -> queue.transition(job.id(), JobStatus.PENDING, null));

    queue.transition(job.id(), JobStatus.RUNNING, null);
    queue.transition(job.id(), JobStatus.COMPLETED, null);
    IllegalJobTransitionException e = assertThrows(IllegalJobTransitionException.class,
        () -> queue.transition(job.id(), JobStatus.RUNNING, null));
    assertTrue(e.getMessage().contains("completed"));
  }

  @Test
  void unknownJobIsReported() {
    assertThrows(JobNotFoundException.class, () -> queue.transition(404L, JobStatus.RUNNING, null));
    assertThrows(JobNotFoundException.class, () -> queue.transition(404L, JobStatus.RETRYING, null));
    assertTrue(queue.get(404L).isEmpty());
    assertFalse(queue.delete(404L));
  }

  @Test
  void statsCountByStatus() {
    queue.enqueue(job("a").build());
    queue.enqueue(job("b").build());
    QueuedJob c = queue.enqueue(job("c").build());
    queue.transition(c.id(), JobStatus.RUNNING, null);

    QueueStats stats = queue.stats();

    assertEquals(2, stats.count(JobStatus.PENDING));
    assertEquals(1, stats.count(JobStatus.RUNNING));
    assertEquals(0, stats.count(JobStatus.FAILED));
    assertEquals(3, stats.total());
  }

  @Test
  void listNewestFirst() {
    QueuedJob a = queue.enqueue(job("a").build());
    clock.advance(Duration.ofSeconds(1));
    QueuedJob b = queue.enqueue(job("b").build());

    assertEquals(List.of(b.id(), a.id()),
        queue.list(JobStatus.PENDING, 10).stream().map(QueuedJob::id).toList());
  }

  @Test
  void purgeRemovesOnlyOldFinishedJobs() {
    for (int i = 0; i < 3; i++) {
      QueuedJob old = queue.enqueue(job("old" + i).build());
      queue.transition(old.id(), JobStatus.RUNNING, null);
      queue.transition(old.id(), JobStatus.COMPLETED, null);
    }
    queue.enqueue(job("pending").build());
    clock.advance(Duration.ofDays(8));
    QueuedJob recent = queue.enqueue(job("recent").build());
    queue.transition(recent.id(), JobStatus.RUNNING, null);
    queue.transition(recent.id(), JobStatus.FAILED, "x");

    assertEquals(3, queue.purge(Duration.ofDays(7), 2));
    assertEquals(2, store.all().size());
  }

  @Test
  void rejectsNonPositiveLimits() {
    assertThrows(IllegalArgumentException.class, () -> queue.leaseDue(0));
    assertThrows(IllegalArgumentException.class, () -> queue.purge(Duration.ofDays(1), 0));
  }
}
