package herald.jdbc.store;

import herald.jdbc.DockerAvailable;
import herald.jdbc.HeraldSchema;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

@DockerAvailable
@Testcontainers
class PostgresQueueStoreIntegrationTest extends AbstractQueueStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("herald_test");

  private static final PostgresQueueStore STORE = new PostgresQueueStore();
  private static PGSimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() {
    dataSource = new PGSimpleDataSource();
    dataSource.setURL(postgres.getJdbcUrl());
    dataSource.setUser(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
    HeraldSchema.install(dataSource);
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("TRUNCATE TABLE notification_queue");
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
