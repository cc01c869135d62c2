package mailqueue.jdbc.repository;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.ConnectionStatus;
import mailqueue.model.EmailConnection;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.EmailConnectionRepository;

import java.time.Instant;
import java.util.Optional;

/**
 * {@link EmailConnectionRepository} over the {@code email_connection} table.
 */
public final class JdbcEmailConnectionRepository extends AbstractJdbcRepository
    implements EmailConnectionRepository {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final JdbcTemplate.RowMapper<EmailConnection> ROW_MAPPER = rs -> new EmailConnection(
      rs.getLong("id"),
      rs.getLong("user_id"),
      rs.getString("provider"),
      rs.getString("tenant_id"),
      rs.getString("mailbox_upn"),
      rs.getString("microsoft_user_id"),
      rs.getString("access_token"),
      rs.getString("refresh_token"),
      JdbcTemplate.instant(rs, "token_expires_at"),
      ConnectionStatus.fromCode(rs.getString("status")),
      rs.getBoolean("sync_enabled"),
      JdbcTemplate.instant(rs, "last_sync_at"),
      rs.getString("last_error"),
      rs.getInt("error_count"));

  public JdbcEmailConnectionRepository(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  @Override
  public Optional<EmailConnection> findById(long connectionId) {
    return withConnection("load connection " + connectionId, conn -> JdbcTemplate.queryOne(conn,
        "SELECT id, user_id, provider, tenant_id, mailbox_upn, microsoft_user_id, access_token, refresh_token, " +
            "token_expires_at, status, sync_enabled, last_sync_at, last_error, error_count " +
            "FROM email_connection WHERE id=?", ROW_MAPPER, connectionId));
  }

  @Override
  public void updateTokens(long connectionId, String encryptedAccessToken, String encryptedRefreshToken,
      Instant expiresAt) {
    withConnection("update tokens of connection " + connectionId, conn -> JdbcTemplate.update(conn,
        "UPDATE email_connection SET access_token=?, refresh_token=?, token_expires_at=?, " +
            "updated_at=CURRENT_TIMESTAMP WHERE id=?",
        encryptedAccessToken, encryptedRefreshToken, expiresAt, connectionId));
  }

  @Override
  public void markSyncSuccess(long connectionId, Instant now) {
    withConnection("mark sync of connection " + connectionId, conn -> JdbcTemplate.update(conn,
        "UPDATE email_connection SET last_sync_at=?, error_count=0, last_error=NULL, updated_at=? WHERE id=?",
        now, now, connectionId));
  }

  @Override
  public void recordError(long connectionId, String error) {
    String truncated = error != null && error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    withConnection("record error on connection " + connectionId, conn -> JdbcTemplate.update(conn,
        "UPDATE email_connection SET last_error=?, error_count=error_count+1, updated_at=CURRENT_TIMESTAMP " +
            "WHERE id=?", truncated, connectionId));
  }
}
