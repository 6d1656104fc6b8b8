package reaper;

import reaper.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection providers for core tests: proxies that accept every call and count
 * commits and rollbacks.
 */
public final class StubConnections {
  public final AtomicInteger commits = new AtomicInteger();
  public final AtomicInteger rollbacks = new AtomicInteger();

  public ConnectionProvider provider() {
    return () -> (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "commit" -> commits.incrementAndGet();
            case "rollback" -> rollbacks.incrementAndGet();
            default -> {
            }
          }
          return null;
        });
  }

  public static ConnectionProvider failing() {
    return () -> {
      throw new SQLException("database unreachable");
    };
  }
}
