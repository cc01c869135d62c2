package mailqueue.model;

import java.time.Instant;
import java.util.List;

/**
 * A message as returned by the mail provider.
 *
 * @param bodyContentType {@code "html"} or {@code "text"}
 */
public record MailMessage(
    String id,
    String conversationId,
    String internetMessageId,
    MailAddress from,
    List<MailAddress> toRecipients,
    List<MailAddress> ccRecipients,
    List<MailAddress> bccRecipients,
    String subject,
    String bodyPreview,
    String bodyContentType,
    String bodyContent,
    boolean hasAttachments,
    List<AttachmentInfo> attachments,
    Instant receivedAt,
    Instant sentAt,
    String importance,
    List<String> categories,
    boolean read,
    boolean draft,
    String parentFolderId) {

  public MailMessage {
    toRecipients = toRecipients == null ? List.of() : List.copyOf(toRecipients);
    ccRecipients = ccRecipients == null ? List.of() : List.copyOf(ccRecipients);
    bccRecipients = bccRecipients == null ? List.of() : List.copyOf(bccRecipients);
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    categories = categories == null ? List.of() : List.copyOf(categories);
  }

  public boolean isHtml() {
    return "html".equalsIgnoreCase(bodyContentType);
  }

  public String fromAddress() {
    return from == null ? null : from.address();
  }

  public MailMessage withAttachments(List<AttachmentInfo> attachments) {
    return new MailMessage(id, conversationId, internetMessageId, from, toRecipients, ccRecipients,
        bccRecipients, subject, bodyPreview, bodyContentType, bodyContent, hasAttachments,
        attachments, receivedAt, sentAt, importance, categories, read, draft, parentFolderId);
  }
}
