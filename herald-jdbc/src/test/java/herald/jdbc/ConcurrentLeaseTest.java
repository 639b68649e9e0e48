package herald.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import herald.NotifyType;
import herald.jdbc.store.H2QueueStore;
import herald.queue.JobPayload;
import herald.queue.JobStatus;
import herald.queue.NotificationQueue;
import herald.queue.QueuedJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Several workers leasing from one pooled database must never share a job.
 */
class ConcurrentLeaseTest {
  private static final int JOBS = 200;
  private static final int WORKERS = 4;

  private HikariDataSource hikariDs;
  private NotificationQueue queue;

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(TestDatabases.h2Url("hikari"));
    config.setMaximumPoolSize(WORKERS + 1);
    config.setMinimumIdle(1);
    config.setPoolName("herald-test-pool");
    hikariDs = new HikariDataSource(config);
    HeraldSchema.install(hikariDs);

    queue = NotificationQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .queueStore(new H2QueueStore())
        .build();
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void everyJobIsLeasedExactlyOnce() throws Exception {
    for (int i = 0; i < JOBS; i++) {
      queue.enqueue(QueuedJob.builder(
          JobPayload.of("job-" + i, "body", NotifyType.INFO, List.of("json://ops"))).build());
    }

    Map<Long, Integer> leases = new ConcurrentHashMap<>();
    AtomicInteger duplicates = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int w = 0; w < WORKERS; w++) {
        futures.add(pool.submit(() -> {
          start.await();
          List<QueuedJob> batch;
          while (!(batch = queue.leaseDue(7)).isEmpty()) {
            for (QueuedJob job : batch) {
              if (leases.merge(job.id(), 1, Integer::sum) > 1) {
                duplicates.incrementAndGet();
              }
            }
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(0, duplicates.get());
    assertEquals(JOBS, leases.size());
    assertEquals(JOBS, queue.stats().count(JobStatus.RUNNING));
    assertEquals(0, queue.stats().backlog());
  }
}
