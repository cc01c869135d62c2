package mailqueue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for queue and repository operations.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * <p>The JDBC module backs this with a {@code DataSource}.
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
