package herald.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC queue stores with auto-detection support.
 *
 * <p>Queue stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/herald.jdbc.store.AbstractJdbcQueueStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect("jdbc:mysql://localhost/herald");
 *
 * // Get by name
 * AbstractJdbcQueueStore store = JdbcQueueStores.get("postgresql");
 * }</pre>
 */
public final class JdbcQueueStores {

  private static final List<AbstractJdbcQueueStore> STORES;
  private static final Map<String, AbstractJdbcQueueStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcQueueStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcQueueStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcQueueStores() {
  }

  /**
   * Returns all registered queue stores.
   */
  public static List<AbstractJdbcQueueStore> all() {
    return STORES;
  }

  /**
   * Gets a queue store by name.
   *
   * @param name queue store name (case-insensitive)
   * @return the queue store
   * @throws IllegalArgumentException if no queue store is registered under that name
   */
  public static AbstractJdbcQueueStore get(String name) {
    AbstractJdbcQueueStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown queue store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the queue store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected queue store
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no queue store matches the JDBC URL
   */
  public static AbstractJdbcQueueStore detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect queue store from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the queue store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected queue store
   * @throws IllegalArgumentException if no matching queue store is found
   */
  public static AbstractJdbcQueueStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcQueueStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No queue store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
