package mailqueue.model;

/**
 * File attached to an outgoing message.
 *
 * @param contentBytes base64 encoded content
 */
public record OutboundAttachment(String name, String contentType, long size, String contentBytes) {

  public static OutboundAttachment ofBase64(String name, String contentType, String contentBytes) {
    long size = contentBytes == null ? 0 : (long) contentBytes.length() * 3 / 4;
    return new OutboundAttachment(name, contentType, size, contentBytes);
  }
}
