package herald.jdbc;

import herald.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} over a {@link DataSource}, normally a connection pool.
 * JDBC failures surface as {@link HeraldStoreException}.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public <T> T execute(String action, SqlWork<T> work) {
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.getAutoCommit()) {
        conn.setAutoCommit(true);
      }
      return work.apply(conn);
    } catch (SQLException e) {
      throw new HeraldStoreException("Failed to " + action, e);
    }
  }
}
