package mailqueue.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fetch, store and link one inbound message.
 *
 * @param notificationId the webhook subscription id that produced the job, may be null
 */
public record ProcessEmailPayload(
    String graphMessageId, long connectionId, long userId, String notificationId)
    implements JobPayload {

  public ProcessEmailPayload {
    Objects.requireNonNull(graphMessageId, "graphMessageId");
  }

  @Override
  public JobType type() {
    return JobType.PROCESS_EMAIL;
  }

  @Override
  public Long ownerUserId() {
    return userId;
  }

  @Override
  public Map<String, String> toFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("graphMessageId", graphMessageId);
    fields.put("connectionId", Long.toString(connectionId));
    fields.put("userId", Long.toString(userId));
    if (notificationId != null) {
      fields.put("notificationId", notificationId);
    }
    return fields;
  }
}
