package herald.spi;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Deletes one batch of expired rows. Implemented by the queue store (terminal jobs) and the
 * metrics store (old samples) and driven by {@link herald.purge.PurgeScheduler}.
 */
@FunctionalInterface
public interface Purger {

  /**
   * Deletes up to {@code limit} rows that expired before {@code before}.
   *
   * @param conn   the JDBC connection (auto-commit)
   * @param before rows older than this instant are eligible
   * @param limit  maximum rows to delete in this batch
   * @return number of rows deleted
   */
  int purge(Connection conn, Instant before, int limit) throws SQLException;
}
