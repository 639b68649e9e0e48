package herald.jdbc.store;

import herald.jdbc.JdbcTemplate;
import herald.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL queue store. Also compatible with TiDB and MariaDB.
 *
 * <p>Leases with the default select-then-claim strategy. Purges with
 * {@code DELETE ... ORDER BY ... LIMIT}, which MySQL supports natively and which avoids the
 * self-referencing subquery MySQL rejects.
 */
public final class MySqlQueueStore extends AbstractJdbcQueueStore {

  public MySqlQueueStore() {
    super();
  }

  public MySqlQueueStore(String tableName) {
    super(tableName);
  }

  public MySqlQueueStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcQueueStore withJsonCodec(JsonCodec jsonCodec) {
    return new MySqlQueueStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN + " AND completed_at < ?" +
        " ORDER BY completed_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, before, limit);
  }
}
