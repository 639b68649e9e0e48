package herald.jdbc.store;

import herald.jdbc.JdbcTemplate;
import herald.queue.JobStatus;
import herald.queue.QueuedJob;
import herald.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL queue store.
 *
 * <p>Leases in one round-trip with {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING}, so
 * concurrent workers never wait on each other's rows.
 */
public final class PostgresQueueStore extends AbstractJdbcQueueStore {
  private static final Comparator<QueuedJob> DUE_ORDER_COMPARATOR =
      Comparator.comparingInt(QueuedJob::priority).reversed()
          .thenComparing(QueuedJob::createdAt)
          .thenComparing(QueuedJob::id);

  public PostgresQueueStore() {
    super();
  }

  public PostgresQueueStore(String tableName) {
    super(tableName);
  }

  public PostgresQueueStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcQueueStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresQueueStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<QueuedJob> leaseDue(Connection conn, Instant now, Instant leaseExpiry, int limit) {
    String sql = "UPDATE " + tableName() + " SET status=?, started_at=? " +
        "WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE " + DUE_CONDITION +
        DUE_ORDER + " LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    List<QueuedJob> leased = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, rowMapper(),
        JobStatus.RUNNING.code(), now, now, leaseExpiry, limit));
    // RETURNING does not preserve the subquery order
    leased.sort(DUE_ORDER_COMPARATOR);
    return leased;
  }
}
