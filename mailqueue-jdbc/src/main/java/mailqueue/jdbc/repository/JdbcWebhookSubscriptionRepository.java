package mailqueue.jdbc.repository;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.SubscriptionStatus;
import mailqueue.model.WebhookSubscription;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.WebhookSubscriptionRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link WebhookSubscriptionRepository} over the {@code email_webhook_subscription} table.
 */
public final class JdbcWebhookSubscriptionRepository extends AbstractJdbcRepository
    implements WebhookSubscriptionRepository {

  private static final String SELECT = "SELECT id, connection_id, user_id, subscription_id, resource, " +
      "change_type, notification_url, expires_at, client_state, status, last_notification_at, " +
      "renewal_attempts, last_error FROM email_webhook_subscription";

  private static final JdbcTemplate.RowMapper<WebhookSubscription> ROW_MAPPER = rs -> new WebhookSubscription(
      rs.getLong("id"),
      rs.getLong("connection_id"),
      rs.getLong("user_id"),
      rs.getString("subscription_id"),
      rs.getString("resource"),
      rs.getString("change_type"),
      rs.getString("notification_url"),
      JdbcTemplate.instant(rs, "expires_at"),
      rs.getString("client_state"),
      SubscriptionStatus.fromCode(rs.getString("status")),
      JdbcTemplate.instant(rs, "last_notification_at"),
      rs.getInt("renewal_attempts"),
      rs.getString("last_error"));

  public JdbcWebhookSubscriptionRepository(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  @Override
  public Optional<WebhookSubscription> findById(long id) {
    return withConnection("load subscription " + id,
        conn -> JdbcTemplate.queryOne(conn, SELECT + " WHERE id=?", ROW_MAPPER, id));
  }

  @Override
  public Optional<WebhookSubscription> findBySubscriptionId(String subscriptionId) {
    return withConnection("load subscription " + subscriptionId,
        conn -> JdbcTemplate.queryOne(conn, SELECT + " WHERE subscription_id=?", ROW_MAPPER, subscriptionId));
  }

  @Override
  public List<WebhookSubscription> findByConnectionId(long connectionId) {
    return withConnection("list subscriptions of connection " + connectionId,
        conn -> JdbcTemplate.query(conn, SELECT + " WHERE connection_id=? ORDER BY id", ROW_MAPPER, connectionId));
  }

  @Override
  public List<WebhookSubscription> findActiveExpiringBefore(Instant cutoff) {
    return withConnection("list expiring subscriptions", conn -> JdbcTemplate.query(conn,
        SELECT + " WHERE status=? AND expires_at <= ? ORDER BY expires_at",
        ROW_MAPPER, SubscriptionStatus.ACTIVE.code(), cutoff));
  }

  @Override
  public WebhookSubscription insert(WebhookSubscription s) {
    long id = withConnection("insert subscription " + s.subscriptionId(), conn -> JdbcTemplate.insert(conn,
        "INSERT INTO email_webhook_subscription (connection_id, user_id, subscription_id, resource, " +
            "change_type, notification_url, expires_at, client_state, status, last_notification_at, " +
            "renewal_attempts, last_error, created_at, updated_at) " +
            "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,CURRENT_TIMESTAMP,CURRENT_TIMESTAMP)",
        s.connectionId(), s.userId(), s.subscriptionId(), s.resource(), s.changeType(), s.notificationUrl(),
        s.expiresAt(), s.clientState(), s.status().code(), s.lastNotificationAt(), s.renewalAttempts(),
        s.lastError()));
    return new WebhookSubscription(id, s.connectionId(), s.userId(), s.subscriptionId(), s.resource(),
        s.changeType(), s.notificationUrl(), s.expiresAt(), s.clientState(), s.status(),
        s.lastNotificationAt(), s.renewalAttempts(), s.lastError());
  }

  @Override
  public void touchLastNotification(long id, Instant at) {
    withConnection("touch subscription " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE email_webhook_subscription SET last_notification_at=?, updated_at=? WHERE id=?", at, at, id));
  }

  @Override
  public void markRenewed(long id, Instant expiresAt) {
    withConnection("mark subscription renewed " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE email_webhook_subscription SET expires_at=?, status=?, renewal_attempts=0, last_error=NULL, " +
            "updated_at=CURRENT_TIMESTAMP WHERE id=?", expiresAt, SubscriptionStatus.ACTIVE.code(), id));
  }

  @Override
  public void recordRenewalFailure(long id, String error) {
    withConnection("record renewal failure " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE email_webhook_subscription SET renewal_attempts=renewal_attempts+1, last_error=?, " +
            "updated_at=CURRENT_TIMESTAMP WHERE id=?", error, id));
  }

  @Override
  public void updateStatus(long id, SubscriptionStatus status, String lastError) {
    withConnection("update subscription status " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE email_webhook_subscription SET status=?, last_error=?, updated_at=CURRENT_TIMESTAMP WHERE id=?",
        status.code(), lastError, id));
  }

  @Override
  public void delete(long id) {
    withConnection("delete subscription " + id,
        conn -> JdbcTemplate.update(conn, "DELETE FROM email_webhook_subscription WHERE id=?", id));
  }
}
