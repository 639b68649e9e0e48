package herald.spi;

import herald.QueueBackendException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for every Herald store operation.
 *
 * <p>Each operation borrows a connection in auto-commit mode and returns it immediately, so
 * no connection is held while endpoints perform network I/O.
 *
 * @see herald.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * Runs {@code work} on a fresh auto-commit connection and closes it afterwards.
   *
   * @param action short description used in the error message, e.g. {@code "enqueue job"}
   * @param work   the statement(s) to run
   * @param <T>    result type
   * @return the result of {@code work}
   * @throws QueueBackendException if the connection cannot be obtained or the work fails
   *                               with an {@link SQLException}
   */
  default <T> T execute(String action, SqlWork<T> work) {
    try (Connection conn = getConnection()) {
      conn.setAutoCommit(true);
      return work.apply(conn);
    } catch (SQLException e) {
      throw new QueueBackendException("Failed to " + action, e);
    }
  }

  /**
   * Unit of JDBC work executed by {@link #execute(String, SqlWork)}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface SqlWork<T> {
    T apply(Connection conn) throws SQLException;
  }
}
