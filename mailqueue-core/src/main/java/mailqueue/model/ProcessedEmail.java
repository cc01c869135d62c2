package mailqueue.model;

import java.time.Instant;
import java.util.List;

/**
 * An inbound message persisted by the processor, unique per (connectionId, graphMessageId).
 */
public record ProcessedEmail(
    long id,
    long connectionId,
    long userId,
    String graphMessageId,
    String graphConversationId,
    String internetMessageId,
    String fromAddress,
    String fromName,
    List<String> toAddresses,
    List<String> ccAddresses,
    List<String> bccAddresses,
    String subject,
    String bodyPreview,
    String bodyText,
    String bodyHtml,
    boolean hasAttachments,
    List<AttachmentInfo> attachments,
    Instant receivedAt,
    Instant sentAt,
    String importance,
    List<String> categories,
    boolean read,
    boolean draft,
    String folderId,
    ProcessingStatus processingStatus,
    boolean aiProcessed,
    Instant aiProcessedAt,
    EmailAnalysis analysis,
    CrmLinks links) {

  public ProcessedEmail {
    toAddresses = toAddresses == null ? List.of() : List.copyOf(toAddresses);
    ccAddresses = ccAddresses == null ? List.of() : List.copyOf(ccAddresses);
    bccAddresses = bccAddresses == null ? List.of() : List.copyOf(bccAddresses);
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    categories = categories == null ? List.of() : List.copyOf(categories);
    links = links == null ? CrmLinks.NONE : links;
  }

  /**
   * Builds an unsaved record from a provider message. The body lands in {@code bodyHtml} or
   * {@code bodyText} depending on the message content type.
   */
  public static ProcessedEmail fromMessage(MailMessage message, long connectionId, long userId) {
    MailAddress from = message.from();
    return new ProcessedEmail(
        0L,
        connectionId,
        userId,
        message.id(),
        message.conversationId(),
        message.internetMessageId(),
        from == null ? null : from.address(),
        from == null ? null : from.name(),
        addresses(message.toRecipients()),
        addresses(message.ccRecipients()),
        addresses(message.bccRecipients()),
        message.subject(),
        message.bodyPreview(),
        message.isHtml() ? null : message.bodyContent(),
        message.isHtml() ? message.bodyContent() : null,
        message.hasAttachments(),
        message.attachments(),
        message.receivedAt(),
        message.sentAt(),
        message.importance(),
        message.categories(),
        message.read(),
        message.draft(),
        message.parentFolderId(),
        ProcessingStatus.PENDING,
        false,
        null,
        null,
        CrmLinks.NONE);
  }

  private static List<String> addresses(List<MailAddress> recipients) {
    return recipients.stream()
        .map(MailAddress::address)
        .filter(address -> address != null && !address.isEmpty())
        .toList();
  }
}
