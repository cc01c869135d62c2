package mailqueue.testing;

import java.lang.reflect.Proxy;
import java.sql.Connection;

import mailqueue.spi.ConnectionProvider;

/** JDBC connection stand-ins for facades exercised against in-memory stores. */
public final class StubConnections {
  private StubConnections() {
  }

  public static Connection dummyConnection() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          if (method.getReturnType() == boolean.class) {
            return false;
          }
          return null;
        });
  }

  public static ConnectionProvider dummyProvider() {
    return StubConnections::dummyConnection;
  }
}
