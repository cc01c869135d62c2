package mailqueue.model;

import java.time.Instant;
import java.util.List;

/**
 * An outbound message and its delivery state.
 */
public record SentEmail(
    long id,
    long connectionId,
    long userId,
    List<String> toAddresses,
    List<String> ccAddresses,
    List<String> bccAddresses,
    List<String> replyTo,
    String subject,
    String bodyText,
    String bodyHtml,
    String importance,
    List<OutboundAttachment> attachments,
    SentEmailStatus status,
    Instant sentAt,
    Instant failedAt,
    String failureReason,
    String inReplyTo,
    Long linkedConversationId,
    Long linkedContactId,
    Long linkedPropertyId,
    String templateUsed,
    Instant createdAt) {

  public SentEmail {
    toAddresses = toAddresses == null ? List.of() : List.copyOf(toAddresses);
    ccAddresses = ccAddresses == null ? List.of() : List.copyOf(ccAddresses);
    bccAddresses = bccAddresses == null ? List.of() : List.copyOf(bccAddresses);
    replyTo = replyTo == null ? List.of() : List.copyOf(replyTo);
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    importance = importance == null ? "normal" : importance;
  }

  public boolean hasAttachments() {
    return !attachments.isEmpty();
  }

  public OutboundMessage toOutboundMessage() {
    return new OutboundMessage(toAddresses, ccAddresses, bccAddresses, subject, bodyText, bodyHtml,
        importance, replyTo, attachments, true);
  }
}
