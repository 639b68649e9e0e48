package herald.jdbc.store;

import herald.NotifyType;
import herald.queue.JobPayload;
import herald.queue.JobStatus;
import herald.queue.QueuedJob;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queue store behaviour every dialect must share. Subclasses provide an empty schema.
 */
abstract class AbstractQueueStoreIntegrationTest {
  static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");
  /** Lease expiry older than every lease in these tests. */
  static final Instant NO_EXPIRY = T0.minus(Duration.ofDays(1));

  abstract DataSource dataSource();

  abstract AbstractJdbcQueueStore store();

  static QueuedJob pending(String title, int priority, Instant createdAt) {
    return QueuedJob.builder(JobPayload.of(title, "body of " + title, NotifyType.INFO, List.of("json://ops")))
        .priority(priority)
        .maxRetries(3)
        .retryDelay(Duration.ofMinutes(5))
        .status(JobStatus.PENDING)
        .createdAt(createdAt)
        .scheduledAt(createdAt)
        .build();
  }

  QueuedJob insert(Connection conn, QueuedJob job) throws Exception {
    return store().insert(conn, job);
  }

  @Test
  void insertAndFindKeepsEveryColumn() throws Exception {
    JobPayload payload = new JobPayload("Backup", "done", NotifyType.WARNING,
        List.of("json://a", "jsons://b/path?x=1"), List.of("ops", "db"),
        Map.of("database", "orders", "quote", "say \"hi\""), "backup-status");
    QueuedJob job = QueuedJob.builder(payload)
        .priority(7)
        .maxRetries(5)
        .retryDelay(Duration.ofSeconds(90))
        .status(JobStatus.PENDING)
        .createdAt(T0)
        .scheduledAt(T0)
        .build();

    try (Connection conn = dataSource().getConnection()) {
      QueuedJob stored = insert(conn, job);
      assertNotNull(stored.id());

      QueuedJob loaded = store().findById(conn, stored.id()).orElseThrow();
      assertEquals(payload, loaded.payload());
      assertNull(loaded.scheduledId());
      assertEquals(7, loaded.priority());
      assertEquals(5, loaded.maxRetries());
      assertEquals(0, loaded.retryCount());
      assertEquals(Duration.ofSeconds(90), loaded.retryDelay());
      assertEquals(JobStatus.PENDING, loaded.status());
      assertEquals(T0, loaded.createdAt());
      assertEquals(T0, loaded.scheduledAt());
      assertNull(loaded.startedAt());
      assertNull(loaded.completedAt());
      assertNull(loaded.nextRetryAt());
    }
  }

  @Test
  void payloadWithNullMetadataValueRoundTrips() throws Exception {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("host", null);
    metadata.put("disk", "/var");
    JobPayload payload = new JobPayload("Disk", "full", NotifyType.WARNING, List.of("json://ops"),
        List.of(), metadata, null);

    try (Connection conn = dataSource().getConnection()) {
      QueuedJob stored = insert(conn, pending("x", 1, T0).toBuilder().payload(payload).build());

      assertEquals(payload, store().findById(conn, stored.id()).orElseThrow().payload());
    }
  }

  @Test
  void findByIdIsEmptyForUnknownJob() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      assertTrue(store().findById(conn, 424242L).isEmpty());
    }
  }

  @Test
  void selectDueOrdersByPriorityThenAge() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob old = insert(conn, pending("old-low", 1, T0));
      QueuedJob high = insert(conn, pending("new-high", 9, T0.plusSeconds(30)));
      QueuedJob young = insert(conn, pending("new-low", 1, T0.plusSeconds(60)));

      List<QueuedJob> due = store().selectDue(conn, T0.plusSeconds(120), NO_EXPIRY, 10);

      assertEquals(List.of(high.id(), old.id(), young.id()), due.stream().map(QueuedJob::id).toList());
    }
  }

  @Test
  void selectDueSkipsRetriesNotYetDueAndNonLeasableJobs() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob waiting = insert(conn, pending("waiting", 1, T0).toBuilder()
          .status(JobStatus.RETRYING).retryCount(1).nextRetryAt(T0.plusSeconds(300)).build());
      insert(conn, pending("running", 1, T0).toBuilder()
          .status(JobStatus.RUNNING).startedAt(T0).build());
      insert(conn, pending("done", 1, T0).toBuilder()
          .status(JobStatus.COMPLETED).completedAt(T0).build());

      assertTrue(store().selectDue(conn, T0.plusSeconds(299), NO_EXPIRY, 10).isEmpty());
      assertEquals(List.of(waiting.id()),
          store().selectDue(conn, T0.plusSeconds(300), NO_EXPIRY, 10).stream().map(QueuedJob::id).toList());
    }
  }

  @Test
  void leaseDueClaimsEachJobOnce() throws Exception {
    Instant now = T0.plusSeconds(10);
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob a = insert(conn, pending("a", 1, T0));
      QueuedJob b = insert(conn, pending("b", 5, T0));
      insert(conn, pending("c", 1, T0.plusSeconds(1)));

      List<QueuedJob> leased = store().leaseDue(conn, now, NO_EXPIRY, 2);

      assertEquals(List.of(b.id(), a.id()), leased.stream().map(QueuedJob::id).toList());
      for (QueuedJob job : leased) {
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals(now, job.startedAt());
        QueuedJob stored = store().findById(conn, job.id()).orElseThrow();
        assertEquals(JobStatus.RUNNING, stored.status());
        assertEquals(now, stored.startedAt());
      }

      assertEquals(1, store().leaseDue(conn, now, NO_EXPIRY, 10).size());
      assertTrue(store().leaseDue(conn, now, NO_EXPIRY, 10).isEmpty());
    }
  }

  @Test
  void markRunningOnlyFromLeasableStates() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob job = insert(conn, pending("x", 1, T0));

      assertEquals(1, store().markRunning(conn, job.id(), T0, NO_EXPIRY));
      assertEquals(0, store().markRunning(conn, job.id(), T0, NO_EXPIRY));
    }
  }

  @Test
  void expiredLeaseIsTakenOverOnce() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob stale = insert(conn, pending("stale", 1, T0).toBuilder()
          .status(JobStatus.RUNNING).startedAt(T0).build());
      insert(conn, pending("fresh", 1, T0).toBuilder()
          .status(JobStatus.RUNNING).startedAt(T0.plusSeconds(600)).build());
      Instant now = T0.plusSeconds(900);
      Instant expiry = T0.plusSeconds(300);

      assertEquals(List.of(stale.id()),
          store().selectDue(conn, now, expiry, 10).stream().map(QueuedJob::id).toList());
      List<QueuedJob> leased = store().leaseDue(conn, now, expiry, 10);

      assertEquals(List.of(stale.id()), leased.stream().map(QueuedJob::id).toList());
      assertEquals(now, store().findById(conn, stale.id()).orElseThrow().startedAt());
      assertTrue(store().leaseDue(conn, now, expiry, 10).isEmpty());
      assertEquals(0, store().markRunning(conn, stale.id(), now, expiry));
    }
  }

  @Test
  void markRetryingIsGuardedByExpectedCountAndBudget() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob job = insert(conn, pending("x", 1, T0).toBuilder().maxRetries(1).build());
      store().markRunning(conn, job.id(), T0, NO_EXPIRY);

      assertEquals(0, store().markRetrying(conn, job.id(), 1, T0.plusSeconds(60), "stale"));
      assertEquals(1, store().markRetrying(conn, job.id(), 0, T0.plusSeconds(60), "boom"));

      QueuedJob retrying = store().findById(conn, job.id()).orElseThrow();
      assertEquals(JobStatus.RETRYING, retrying.status());
      assertEquals(1, retrying.retryCount());
      assertEquals(T0.plusSeconds(60), retrying.nextRetryAt());
      assertEquals("boom", retrying.errorMessage());

      store().markRunning(conn, job.id(), T0.plusSeconds(60), NO_EXPIRY);
      assertEquals(0, store().markRetrying(conn, job.id(), 1, T0.plusSeconds(180), "exhausted"));
      assertEquals(1, store().markFailed(conn, job.id(), T0.plusSeconds(61), "exhausted"));

      QueuedJob failed = store().findById(conn, job.id()).orElseThrow();
      assertEquals(JobStatus.FAILED, failed.status());
      assertEquals(T0.plusSeconds(61), failed.completedAt());
      assertNull(failed.nextRetryAt());
    }
  }

  @Test
  void terminalTransitionsRequireRunning() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob job = insert(conn, pending("x", 1, T0));

      assertEquals(0, store().markCompleted(conn, job.id(), T0, null));
      assertEquals(0, store().markFailed(conn, job.id(), T0, "nope"));

      store().markRunning(conn, job.id(), T0, NO_EXPIRY);
      assertEquals(1, store().markCompleted(conn, job.id(), T0.plusSeconds(2), "1/2 endpoints failed"));
      assertEquals(0, store().markCompleted(conn, job.id(), T0.plusSeconds(3), null));

      QueuedJob done = store().findById(conn, job.id()).orElseThrow();
      assertEquals(JobStatus.COMPLETED, done.status());
      assertEquals("1/2 endpoints failed", done.errorMessage());
      assertEquals(T0.plusSeconds(2), done.completedAt());
    }
  }

  @Test
  void longErrorsAreTruncated() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob job = insert(conn, pending("x", 1, T0));
      store().markRunning(conn, job.id(), T0, NO_EXPIRY);
      store().markFailed(conn, job.id(), T0, "e".repeat(5000));

      String error = store().findById(conn, job.id()).orElseThrow().errorMessage();
      assertEquals(4000, error.length());
      assertTrue(error.endsWith("..."));
    }
  }

  @Test
  void countsAndListsByStatus() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob first = insert(conn, pending("first", 1, T0));
      QueuedJob second = insert(conn, pending("second", 1, T0.plusSeconds(1)));
      QueuedJob third = insert(conn, pending("third", 1, T0.plusSeconds(2)));
      store().markRunning(conn, third.id(), T0, NO_EXPIRY);

      Map<JobStatus, Long> counts = store().countByStatus(conn);
      assertEquals(2L, counts.get(JobStatus.PENDING));
      assertEquals(1L, counts.get(JobStatus.RUNNING));
      assertNull(counts.get(JobStatus.FAILED));

      assertEquals(List.of(second.id(), first.id()),
          store().findByStatus(conn, JobStatus.PENDING, 10).stream().map(QueuedJob::id).toList());
      assertEquals(1, store().findByStatus(conn, JobStatus.PENDING, 1).size());
    }
  }

  @Test
  void purgeRemovesOnlyOldTerminalJobsInBatches() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      for (int i = 0; i < 3; i++) {
        insert(conn, pending("old-" + i, 1, T0).toBuilder()
            .status(JobStatus.COMPLETED).completedAt(T0.plusSeconds(i)).build());
      }
      QueuedJob recent = insert(conn, pending("recent", 1, T0).toBuilder()
          .status(JobStatus.FAILED).completedAt(T0.plusSeconds(3600)).build());
      QueuedJob open = insert(conn, pending("open", 1, T0));

      Instant cutoff = T0.plusSeconds(60);
      assertEquals(2, store().purge(conn, cutoff, 2));
      assertEquals(1, store().purge(conn, cutoff, 2));
      assertEquals(0, store().purge(conn, cutoff, 2));

      assertTrue(store().findById(conn, recent.id()).isPresent());
      assertTrue(store().findById(conn, open.id()).isPresent());
    }
  }

  @Test
  void deleteRemovesRow() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      QueuedJob job = insert(conn, pending("x", 1, T0));

      assertTrue(store().delete(conn, job.id()));
      assertFalse(store().delete(conn, job.id()));
      assertTrue(store().findById(conn, job.id()).isEmpty());
    }
  }
}
