package herald.benchmarks;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import herald.NotifyType;
import herald.jdbc.DataSourceConnectionProvider;
import herald.jdbc.HeraldSchema;
import herald.jdbc.TableNames;
import herald.jdbc.store.JdbcQueueStores;
import herald.queue.JobPayload;
import herald.queue.JobStatus;
import herald.queue.NotificationQueue;
import herald.queue.QueuedJob;
import org.openjdk.jmh.annotations.*;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Measures the queue hot path on in-memory H2: lease a batch of due jobs and complete them.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar QueueLeaseBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class QueueLeaseBenchmark {

  private HikariDataSource dataSource;
  private NotificationQueue queue;

  @Param({"10", "50", "200"})
  private int batchSize;

  @Setup(Level.Trial)
  public void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:bench_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(4);
    dataSource = new HikariDataSource(config);
    HeraldSchema.install(dataSource);
    queue = NotificationQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .queueStore(JdbcQueueStores.detect(dataSource))
        .build();
  }

  @Setup(Level.Invocation)
  public void seedJobs() throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("DELETE FROM " + TableNames.NOTIFICATION_QUEUE);
    }
    for (int i = 0; i < batchSize; i++) {
      queue.enqueue(QueuedJob.builder(JobPayload.of("Bench " + i, "body", NotifyType.INFO,
          List.of("json://hooks.example.com/bench"))).build());
    }
  }

  @Benchmark
  public int leaseAndComplete() {
    List<QueuedJob> leased = queue.leaseDue(batchSize);
    for (QueuedJob job : leased) {
      queue.transition(job.id(), JobStatus.COMPLETED, null);
    }
    return leased.size();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    dataSource.close();
  }
}
