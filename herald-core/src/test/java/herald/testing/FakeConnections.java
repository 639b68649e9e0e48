package herald.testing;

import herald.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection providers for tests whose stores keep state in memory.
 */
public final class FakeConnections {

  private FakeConnections() {
  }

  /** Provider handing out inert proxy connections. */
  public static ConnectionProvider provider() {
    return FakeConnections::connection;
  }

  /** Provider counting how many connections were opened. */
  public static ConnectionProvider counting(AtomicInteger opened) {
    return () -> {
      opened.incrementAndGet();
      return connection();
    };
  }

  /** Provider whose every connection attempt fails. */
  public static ConnectionProvider failing() {
    return () -> {
      throw new SQLException("database unavailable");
    };
  }

  public static Connection connection() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          Class<?> returnType = method.getReturnType();
          if (returnType == boolean.class) {
            return "getAutoCommit".equals(method.getName());
          }
          if (returnType == int.class) {
            return 0;
          }
          if (returnType == long.class) {
            return 0L;
          }
          if ("toString".equals(method.getName())) {
            return "FakeConnection";
          }
          if ("hashCode".equals(method.getName())) {
            return System.identityHashCode(proxy);
          }
          return null;
        });
  }
}
