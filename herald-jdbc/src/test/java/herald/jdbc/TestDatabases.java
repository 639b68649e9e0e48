package herald.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.util.UUID;

/**
 * Fresh H2 databases with the Herald schema installed.
 */
public final class TestDatabases {
  private TestDatabases() {}

  public static String h2Url(String prefix) {
    return "jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1";
  }

  public static JdbcDataSource h2() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL(h2Url("herald"));
    HeraldSchema.install(dataSource);
    return dataSource;
  }
}
