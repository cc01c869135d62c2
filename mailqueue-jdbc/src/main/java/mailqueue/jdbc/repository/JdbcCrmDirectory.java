package mailqueue.jdbc.repository;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.CrmDirectory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link CrmDirectory} reading the host CRM's {@code conversations}, {@code customer_enquiries}
 * and {@code leads} tables. Address matching is case-insensitive; the lowest id wins.
 */
public final class JdbcCrmDirectory extends AbstractJdbcRepository implements CrmDirectory {

  public JdbcCrmDirectory(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  @Override
  public OptionalLong findConversationId(String emailAddress) {
    return lookup("conversations", "contact_email", emailAddress);
  }

  @Override
  public OptionalLong findEnquiryId(String emailAddress) {
    return lookup("customer_enquiries", "email", emailAddress);
  }

  @Override
  public OptionalLong findLeadId(String emailAddress) {
    return lookup("leads", "email", emailAddress);
  }

  private OptionalLong lookup(String table, String column, String emailAddress) {
    if (emailAddress == null || emailAddress.isEmpty()) {
      return OptionalLong.empty();
    }
    String sql = "SELECT id FROM " + table + " WHERE LOWER(" + column + ")=LOWER(?) ORDER BY id LIMIT 1";
    Optional<Long> id = withConnection("look up " + table,
        conn -> JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong("id"), emailAddress));
    return id.map(OptionalLong::of).orElseGet(OptionalLong::empty);
  }
}
