package mailqueue.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/** Fresh in-memory H2 databases with the mail queue schema applied. */
public final class H2Databases {

  public static JdbcDataSource newDatabase() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("RUNSCRIPT FROM 'classpath:db/schema-h2.sql'");
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to create schema", e);
    }
    return dataSource;
  }

  public static void execute(JdbcDataSource dataSource, String sql) {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to execute " + sql, e);
    }
  }

  private H2Databases() {}
}
