package io.hookbox.support;

import io.hookbox.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection providers for tests whose stores never touch JDBC.
 */
public final class StubConnections {

  private StubConnections() {
  }

  /** Every call on the returned connection is a no-op. */
  public static Connection dummyConnection() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  public static ConnectionProvider dummyProvider() {
    return StubConnections::dummyConnection;
  }

  public static ConnectionProvider failingProvider() {
    return () -> {
      throw new SQLException("connection failed");
    };
  }

  /** Counts commits and rollbacks so transactional paths can be checked. */
  public static final class CountingProvider implements ConnectionProvider {
    public final AtomicInteger commits = new AtomicInteger();
    public final AtomicInteger rollbacks = new AtomicInteger();

    @Override
    public Connection getConnection() {
      return (Connection) Proxy.newProxyInstance(
          Connection.class.getClassLoader(),
          new Class<?>[]{Connection.class},
          (proxy, method, args) -> {
            if (method.getName().equals("commit")) {
              commits.incrementAndGet();
            } else if (method.getName().equals("rollback")) {
              rollbacks.incrementAndGet();
            }
            return null;
          });
    }
  }
}
