package herald.jdbc.store;

import com.mysql.cj.jdbc.MysqlDataSource;
import herald.jdbc.DockerAvailable;
import herald.jdbc.HeraldSchema;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

@DockerAvailable
@Testcontainers
class MySqlQueueStoreIntegrationTest extends AbstractQueueStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("herald_test");

  private static final MySqlQueueStore STORE = new MySqlQueueStore();
  private static MysqlDataSource dataSource;

  @BeforeAll
  static void initSchema() {
    dataSource = new MysqlDataSource();
    dataSource.setURL(mysql.getJdbcUrl());
    dataSource.setUser(mysql.getUsername());
    dataSource.setPassword(mysql.getPassword());
    HeraldSchema.install(dataSource);
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("DELETE FROM notification_queue");
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcQueueStore store() {
    return STORE;
  }
}
