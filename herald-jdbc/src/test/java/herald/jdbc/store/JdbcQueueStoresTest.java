package herald.jdbc.store;

import herald.jdbc.TestDatabases;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQueueStoresTest {

  @Test
  void loadsBuiltInStores() {
    Set<String> names = JdbcQueueStores.all().stream()
        .map(AbstractJdbcQueueStore::name)
        .collect(Collectors.toSet());

    assertEquals(Set.of("h2", "mysql", "postgresql"), names);
  }

  @Test
  void detectsFromJdbcUrl() {
    assertInstanceOf(H2QueueStore.class, JdbcQueueStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("jdbc:mysql://localhost/herald"));
    assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("jdbc:mariadb://localhost/herald"));
    assertInstanceOf(PostgresQueueStore.class, JdbcQueueStores.detect("JDBC:POSTGRESQL://localhost/herald"));
  }

  @Test
  void detectsFromDataSource() {
    assertInstanceOf(H2QueueStore.class, JdbcQueueStores.detect(TestDatabases.h2()));
  }

  @Test
  void unknownUrlIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcQueueStores.detect("jdbc:oracle:thin:@localhost"));
    assertTrue(e.getMessage().contains("jdbc:h2:"));
    assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.detect(""));
  }

  @Test
  void lookupByNameIgnoresCase() {
    assertEquals("postgresql", JdbcQueueStores.get("PostgreSQL").name());
    assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.get("sqlite"));
  }
}
