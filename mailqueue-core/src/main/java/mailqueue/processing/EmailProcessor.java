package mailqueue.processing;

import mailqueue.auth.AccessTokenManager;
import mailqueue.model.AttachmentInfo;
import mailqueue.model.CrmLinks;
import mailqueue.model.EmailAnalysis;
import mailqueue.model.EmailConnection;
import mailqueue.model.MailMessage;
import mailqueue.model.ProcessedEmail;
import mailqueue.spi.CrmDirectory;
import mailqueue.spi.EmailAnalyzer;
import mailqueue.spi.EmailConnectionRepository;
import mailqueue.spi.MailProvider;
import mailqueue.spi.MailProviderException;
import mailqueue.spi.ProcessedEmailRepository;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches an inbound message, stores it once, links it to CRM records and classifies it.
 *
 * <p>Processing is idempotent per (connection, message): a message that is already stored is
 * reported as success without touching the provider. Failures are caught here, counted against
 * the connection and returned as an unsuccessful result; the caller decides whether to retry.
 * AI analysis is best effort and never fails the message.
 */
public final class EmailProcessor {
  private static final Logger logger = Logger.getLogger(EmailProcessor.class.getName());

  private final EmailConnectionRepository connections;
  private final ProcessedEmailRepository processedEmails;
  private final AccessTokenManager tokens;
  private final MailProvider mailProvider;
  private final CrmDirectory crmDirectory;
  private final EmailAnalyzer analyzer;
  private final Clock clock;

  private EmailProcessor(Builder builder) {
    this.connections = Objects.requireNonNull(builder.connections, "connections");
    this.processedEmails = Objects.requireNonNull(builder.processedEmails, "processedEmails");
    this.tokens = Objects.requireNonNull(builder.tokens, "tokens");
    this.mailProvider = Objects.requireNonNull(builder.mailProvider, "mailProvider");
    this.crmDirectory = builder.crmDirectory != null ? builder.crmDirectory : CrmDirectory.NONE;
    this.analyzer = builder.analyzer;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ProcessEmailResult processEmail(String graphMessageId, long connectionId, long userId) {
    try {
      Optional<ProcessedEmail> existing = processedEmails.findByGraphMessageId(connectionId, graphMessageId);
      if (existing.isPresent()) {
        logger.log(Level.FINE, "Message {0} already processed", graphMessageId);
        return ProcessEmailResult.alreadyProcessed(existing.get().id());
      }

      Optional<EmailConnection> found = connections.findById(connectionId);
      if (found.isEmpty()) {
        return ProcessEmailResult.failure("Connection not found");
      }
      EmailConnection connection = found.get();
      if (!connection.isActive()) {
        return ProcessEmailResult.failure("Connection is " + connection.status().code());
      }

      String accessToken = tokens.getValidAccessToken(connection);
      MailMessage message = fetchMessage(accessToken, graphMessageId);

      long processedEmailId = processedEmails.insert(ProcessedEmail.fromMessage(message, connectionId, userId));

      CrmLinks links = linkToCrm(message.fromAddress());
      if (!links.isEmpty()) {
        processedEmails.updateLinks(processedEmailId, links);
      }

      EmailAnalysis analysis = analyze(processedEmailId, message);

      connections.markSyncSuccess(connectionId, clock.instant());
      logger.log(Level.INFO, "Processed message {0} for connection {1} as email {2}",
          new Object[]{graphMessageId, connectionId, processedEmailId});
      return new ProcessEmailResult(true, processedEmailId, null,
          links.conversationId(), contactIdOf(links), analysis);
    } catch (RuntimeException e) {
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      logger.log(Level.WARNING, "Failed to process message " + graphMessageId, e);
      recordConnectionError(connectionId, error);
      return ProcessEmailResult.failure(error);
    }
  }

  private MailMessage fetchMessage(String accessToken, String graphMessageId) {
    MailMessage message = mailProvider.getMessage(accessToken, graphMessageId);
    if (!message.hasAttachments()) {
      return message;
    }
    try {
      List<AttachmentInfo> attachments = mailProvider.getAttachments(accessToken, graphMessageId);
      return message.withAttachments(attachments);
    } catch (MailProviderException e) {
      logger.log(Level.WARNING, "Could not fetch attachments of message " + graphMessageId, e);
      return message;
    }
  }

  /**
   * Conversation and enquiry matches are independent; a lead match overrides the enquiry as
   * the contact.
   */
  private CrmLinks linkToCrm(String fromAddress) {
    if (fromAddress == null || fromAddress.isBlank()) {
      return CrmLinks.NONE;
    }
    OptionalLong conversation = crmDirectory.findConversationId(fromAddress);
    OptionalLong enquiry = crmDirectory.findEnquiryId(fromAddress);
    OptionalLong lead = crmDirectory.findLeadId(fromAddress);
    return new CrmLinks(
        conversation.isPresent() ? conversation.getAsLong() : null,
        enquiry.isPresent() ? enquiry.getAsLong() : null,
        lead.isPresent() ? lead.getAsLong() : null);
  }

  private static Long contactIdOf(CrmLinks links) {
    return links.contactId() != null ? links.contactId() : links.enquiryId();
  }

  private EmailAnalysis analyze(long processedEmailId, MailMessage message) {
    if (analyzer == null || message.bodyContent() == null || message.bodyContent().isBlank()) {
      return null;
    }
    try {
      EmailAnalysis analysis = analyzer.analyze(message);
      processedEmails.updateAnalysis(processedEmailId, analysis, clock.instant());
      return analysis;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "AI analysis failed for email " + processedEmailId, e);
      return null;
    }
  }

  private void recordConnectionError(long connectionId, String error) {
    try {
      connections.recordError(connectionId, error);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record error on connection " + connectionId, e);
    }
  }

  /**
   * Builder for {@link EmailProcessor}.
   */
  public static final class Builder {
    private EmailConnectionRepository connections;
    private ProcessedEmailRepository processedEmails;
    private AccessTokenManager tokens;
    private MailProvider mailProvider;
    private CrmDirectory crmDirectory;
    private EmailAnalyzer analyzer;
    private Clock clock;

    private Builder() {
    }

    public Builder connections(EmailConnectionRepository connections) {
      this.connections = connections;
      return this;
    }

    public Builder processedEmails(ProcessedEmailRepository processedEmails) {
      this.processedEmails = processedEmails;
      return this;
    }

    public Builder tokens(AccessTokenManager tokens) {
      this.tokens = tokens;
      return this;
    }

    public Builder mailProvider(MailProvider mailProvider) {
      this.mailProvider = mailProvider;
      return this;
    }

    /**
     * Optional. Defaults to {@link CrmDirectory#NONE}.
     */
    public Builder crmDirectory(CrmDirectory crmDirectory) {
      this.crmDirectory = crmDirectory;
      return this;
    }

    /**
     * Optional. Without an analyzer messages are stored unclassified.
     */
    public Builder analyzer(EmailAnalyzer analyzer) {
      this.analyzer = analyzer;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public EmailProcessor build() {
      return new EmailProcessor(this);
    }
  }
}
