package mailqueue.jdbc.repository;

import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.JobStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Base for repositories that own their connections. Each call borrows a connection from the
 * provider and runs in auto-commit mode.
 */
abstract class AbstractJdbcRepository {

  @FunctionalInterface
  interface ConnectionCallback<T> {
    T doInConnection(Connection conn);
  }

  private final ConnectionProvider connectionProvider;

  AbstractJdbcRepository(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  <T> T withConnection(String action, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new JobStoreException("Failed to " + action, e);
    }
  }
}
