package mailqueue.model;

/** Attachment metadata; content bytes are never stored for inbound mail. */
public record AttachmentInfo(String id, String name, String contentType, long size, String contentId) {
}
