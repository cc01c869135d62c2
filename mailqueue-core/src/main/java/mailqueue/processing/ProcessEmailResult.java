package mailqueue.processing;

import mailqueue.model.EmailAnalysis;

/**
 * Outcome of {@link EmailProcessor#processEmail}.
 *
 * @param processedEmailId id of the stored record; also set when the message was already stored
 * @param linkedContactId  lead id when the sender is a lead, otherwise the enquiry id
 */
public record ProcessEmailResult(
    boolean success,
    Long processedEmailId,
    String error,
    Long linkedConversationId,
    Long linkedContactId,
    EmailAnalysis analysis) {

  public static ProcessEmailResult failure(String error) {
    return new ProcessEmailResult(false, null, error, null, null, null);
  }

  public static ProcessEmailResult alreadyProcessed(long processedEmailId) {
    return new ProcessEmailResult(true, processedEmailId, null, null, null, null);
  }
}
