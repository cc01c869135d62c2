package mailqueue.model;

/** CRM records matched to a message sender; any component may be {@code null}. */
public record CrmLinks(Long conversationId, Long enquiryId, Long contactId) {
  public static final CrmLinks NONE = new CrmLinks(null, null, null);

  public boolean isEmpty() {
    return conversationId == null && enquiryId == null && contactId == null;
  }
}
