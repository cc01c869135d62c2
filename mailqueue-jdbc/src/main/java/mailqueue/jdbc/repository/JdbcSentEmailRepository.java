package mailqueue.jdbc.repository;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.OutboundAttachment;
import mailqueue.model.SentEmail;
import mailqueue.model.SentEmailStatus;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.SentEmailRepository;
import mailqueue.util.JsonCodec;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SentEmailRepository} over the {@code sent_email} table.
 */
public final class JdbcSentEmailRepository extends AbstractJdbcRepository implements SentEmailRepository {

  private static final String SELECT = "SELECT id, connection_id, user_id, to_addresses, cc_addresses, " +
      "bcc_addresses, reply_to, subject, body_text, body_html, importance, attachments, status, sent_at, " +
      "failed_at, failure_reason, in_reply_to, linked_conversation_id, linked_contact_id, linked_property_id, " +
      "template_used, created_at FROM sent_email";

  private final JsonCodec jsonCodec;

  public JdbcSentEmailRepository(ConnectionProvider connectionProvider) {
    this(connectionProvider, JsonCodec.getDefault());
  }

  public JdbcSentEmailRepository(ConnectionProvider connectionProvider, JsonCodec jsonCodec) {
    super(connectionProvider);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public long insert(SentEmail e) {
    Instant createdAt = e.createdAt() != null ? e.createdAt() : Instant.now();
    return withConnection("insert sent email", conn -> JdbcTemplate.insert(conn,
        "INSERT INTO sent_email (connection_id, user_id, to_addresses, cc_addresses, bcc_addresses, reply_to, " +
            "subject, body_text, body_html, importance, has_attachments, attachments, status, in_reply_to, " +
            "linked_conversation_id, linked_contact_id, linked_property_id, template_used, created_at, updated_at) " +
            "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        e.connectionId(), e.userId(), jsonCodec.toJson(e.toAddresses()), jsonCodec.toJson(e.ccAddresses()),
        jsonCodec.toJson(e.bccAddresses()), jsonCodec.toJson(e.replyTo()), e.subject(), e.bodyText(),
        e.bodyHtml(), e.importance(), e.hasAttachments(), jsonCodec.toJson(e.attachments()), e.status().code(),
        e.inReplyTo(), e.linkedConversationId(), e.linkedContactId(), e.linkedPropertyId(), e.templateUsed(),
        createdAt, createdAt));
  }

  @Override
  public Optional<SentEmail> findById(long id) {
    return withConnection("load sent email " + id,
        conn -> JdbcTemplate.queryOne(conn, SELECT + " WHERE id=?", this::map, id));
  }

  @Override
  public List<SentEmail> findByUserId(long userId, SentEmailStatus status, int limit, int offset) {
    List<Object> params = new ArrayList<>();
    params.add(userId);
    String where = " WHERE user_id=?";
    if (status != null) {
      where += " AND status=?";
      params.add(status.code());
    }
    params.add(limit);
    params.add(offset);
    String sql = SELECT + where + " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
    return withConnection("list sent emails of user " + userId,
        conn -> JdbcTemplate.query(conn, sql, this::map, params.toArray()));
  }

  @Override
  public void markSending(long id) {
    withConnection("mark sent email sending " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE sent_email SET status=?, updated_at=CURRENT_TIMESTAMP WHERE id=?",
        SentEmailStatus.SENDING.code(), id));
  }

  @Override
  public void markSent(long id, Instant sentAt) {
    withConnection("mark sent email sent " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE sent_email SET status=?, sent_at=?, failure_reason=NULL, updated_at=? WHERE id=?",
        SentEmailStatus.SENT.code(), sentAt, sentAt, id));
  }

  @Override
  public void markFailed(long id, String failureReason, Instant failedAt) {
    withConnection("mark sent email failed " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE sent_email SET status=?, failed_at=?, failure_reason=?, updated_at=? WHERE id=?",
        SentEmailStatus.FAILED.code(), failedAt, failureReason, failedAt, id));
  }

  @Override
  public void resetToQueued(long id) {
    withConnection("re-queue sent email " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE sent_email SET status=?, failed_at=NULL, failure_reason=NULL, updated_at=CURRENT_TIMESTAMP " +
            "WHERE id=?", SentEmailStatus.QUEUED.code(), id));
  }

  private SentEmail map(ResultSet rs) throws SQLException {
    return new SentEmail(
        rs.getLong("id"),
        rs.getLong("connection_id"),
        rs.getLong("user_id"),
        jsonCodec.parseList(rs.getString("to_addresses"), String.class),
        jsonCodec.parseList(rs.getString("cc_addresses"), String.class),
        jsonCodec.parseList(rs.getString("bcc_addresses"), String.class),
        jsonCodec.parseList(rs.getString("reply_to"), String.class),
        rs.getString("subject"),
        rs.getString("body_text"),
        rs.getString("body_html"),
        rs.getString("importance"),
        jsonCodec.parseList(rs.getString("attachments"), OutboundAttachment.class),
        SentEmailStatus.fromCode(rs.getString("status")),
        JdbcTemplate.instant(rs, "sent_at"),
        JdbcTemplate.instant(rs, "failed_at"),
        rs.getString("failure_reason"),
        rs.getString("in_reply_to"),
        JdbcTemplate.nullableLong(rs, "linked_conversation_id"),
        JdbcTemplate.nullableLong(rs, "linked_contact_id"),
        JdbcTemplate.nullableLong(rs, "linked_property_id"),
        rs.getString("template_used"),
        JdbcTemplate.instant(rs, "created_at"));
  }
}
