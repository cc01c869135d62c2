package mailqueue.model;

import java.util.List;

/**
 * Message handed to the provider's send call. When {@code bodyHtml} is present it wins over
 * {@code bodyText}.
 */
public record OutboundMessage(
    List<String> to,
    List<String> cc,
    List<String> bcc,
    String subject,
    String bodyText,
    String bodyHtml,
    String importance,
    List<String> replyTo,
    List<OutboundAttachment> attachments,
    boolean saveToSentItems) {

  public OutboundMessage {
    to = to == null ? List.of() : List.copyOf(to);
    cc = cc == null ? List.of() : List.copyOf(cc);
    bcc = bcc == null ? List.of() : List.copyOf(bcc);
    replyTo = replyTo == null ? List.of() : List.copyOf(replyTo);
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }
}
