package mailqueue.jdbc.repository;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.AttachmentInfo;
import mailqueue.model.CrmLinks;
import mailqueue.model.EmailAnalysis;
import mailqueue.model.ProcessedEmail;
import mailqueue.model.ProcessingStatus;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.ProcessedEmailRepository;
import mailqueue.util.JsonCodec;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ProcessedEmailRepository} over the {@code processed_email} table.
 *
 * <p>Address lists, categories, attachment metadata and AI entity/action lists are stored as JSON
 * text. The full analysis is kept in {@code ai_classification} and is what {@link #findById}
 * reads back; the flat {@code ai_*} columns exist for querying.
 */
public final class JdbcProcessedEmailRepository extends AbstractJdbcRepository implements ProcessedEmailRepository {

  private static final String SELECT = "SELECT id, connection_id, user_id, graph_message_id, " +
      "graph_conversation_id, internet_message_id, from_address, from_name, to_addresses, cc_addresses, " +
      "bcc_addresses, subject, body_preview, body_text, body_html, has_attachments, attachments, received_at, " +
      "sent_at, importance, categories, is_read, is_draft, folder_id, processing_status, ai_processed, " +
      "ai_processed_at, ai_classification, linked_conversation_id, linked_enquiry_id, linked_contact_id " +
      "FROM processed_email";

  private final JsonCodec jsonCodec;

  public JdbcProcessedEmailRepository(ConnectionProvider connectionProvider) {
    this(connectionProvider, JsonCodec.getDefault());
  }

  public JdbcProcessedEmailRepository(ConnectionProvider connectionProvider, JsonCodec jsonCodec) {
    super(connectionProvider);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Optional<ProcessedEmail> findById(long id) {
    return withConnection("load processed email " + id,
        conn -> JdbcTemplate.queryOne(conn, SELECT + " WHERE id=?", this::map, id));
  }

  @Override
  public Optional<ProcessedEmail> findByGraphMessageId(long connectionId, String graphMessageId) {
    return withConnection("load processed email " + graphMessageId, conn -> JdbcTemplate.queryOne(conn,
        SELECT + " WHERE connection_id=? AND graph_message_id=?", this::map, connectionId, graphMessageId));
  }

  @Override
  public long insert(ProcessedEmail e) {
    return withConnection("insert processed email " + e.graphMessageId(), conn -> JdbcTemplate.insert(conn,
        "INSERT INTO processed_email (connection_id, user_id, graph_message_id, graph_conversation_id, " +
            "internet_message_id, from_address, from_name, to_addresses, cc_addresses, bcc_addresses, subject, " +
            "body_preview, body_text, body_html, has_attachments, attachments, received_at, sent_at, importance, " +
            "categories, is_read, is_draft, folder_id, processing_status, ai_processed, created_at, updated_at) " +
            "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,CURRENT_TIMESTAMP,CURRENT_TIMESTAMP)",
        e.connectionId(), e.userId(), e.graphMessageId(), e.graphConversationId(), e.internetMessageId(),
        e.fromAddress(), e.fromName(), jsonCodec.toJson(e.toAddresses()), jsonCodec.toJson(e.ccAddresses()),
        jsonCodec.toJson(e.bccAddresses()), e.subject(), e.bodyPreview(), e.bodyText(), e.bodyHtml(),
        e.hasAttachments(), jsonCodec.toJson(e.attachments()), e.receivedAt(), e.sentAt(), e.importance(),
        jsonCodec.toJson(e.categories()), e.read(), e.draft(), e.folderId(), e.processingStatus().code(),
        e.aiProcessed()));
  }

  @Override
  public void updateLinks(long id, CrmLinks links) {
    withConnection("link processed email " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE processed_email SET linked_conversation_id=?, linked_enquiry_id=?, linked_contact_id=?, " +
            "updated_at=CURRENT_TIMESTAMP WHERE id=?",
        links.conversationId(), links.enquiryId(), links.contactId(), id));
  }

  @Override
  public void updateAnalysis(long id, EmailAnalysis analysis, Instant analyzedAt) {
    withConnection("store analysis of processed email " + id, conn -> JdbcTemplate.update(conn,
        "UPDATE processed_email SET processing_status=?, ai_processed=?, ai_processed_at=?, ai_category=?, " +
            "ai_sentiment=?, ai_priority=?, ai_summary=?, ai_extracted_entities=?, ai_suggested_actions=?, " +
            "ai_classification=?, updated_at=? WHERE id=?",
        ProcessingStatus.PROCESSED.code(), true, analyzedAt, analysis.category(), analysis.sentiment(),
        analysis.priority(), analysis.summary(), jsonCodec.toJson(analysis.extractedEntities()),
        jsonCodec.toJson(analysis.suggestedActions()), jsonCodec.toJson(analysis), analyzedAt, id));
  }

  private ProcessedEmail map(ResultSet rs) throws SQLException {
    return new ProcessedEmail(
        rs.getLong("id"),
        rs.getLong("connection_id"),
        rs.getLong("user_id"),
        rs.getString("graph_message_id"),
        rs.getString("graph_conversation_id"),
        rs.getString("internet_message_id"),
        rs.getString("from_address"),
        rs.getString("from_name"),
        jsonCodec.parseList(rs.getString("to_addresses"), String.class),
        jsonCodec.parseList(rs.getString("cc_addresses"), String.class),
        jsonCodec.parseList(rs.getString("bcc_addresses"), String.class),
        rs.getString("subject"),
        rs.getString("body_preview"),
        rs.getString("body_text"),
        rs.getString("body_html"),
        rs.getBoolean("has_attachments"),
        jsonCodec.parseList(rs.getString("attachments"), AttachmentInfo.class),
        JdbcTemplate.instant(rs, "received_at"),
        JdbcTemplate.instant(rs, "sent_at"),
        rs.getString("importance"),
        jsonCodec.parseList(rs.getString("categories"), String.class),
        rs.getBoolean("is_read"),
        rs.getBoolean("is_draft"),
        rs.getString("folder_id"),
        ProcessingStatus.fromCode(rs.getString("processing_status")),
        rs.getBoolean("ai_processed"),
        JdbcTemplate.instant(rs, "ai_processed_at"),
        jsonCodec.parse(rs.getString("ai_classification"), EmailAnalysis.class),
        new CrmLinks(
            JdbcTemplate.nullableLong(rs, "linked_conversation_id"),
            JdbcTemplate.nullableLong(rs, "linked_enquiry_id"),
            JdbcTemplate.nullableLong(rs, "linked_contact_id")));
  }
}
