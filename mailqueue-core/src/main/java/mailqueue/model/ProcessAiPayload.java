package mailqueue.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record ProcessAiPayload(long processedEmailId, long connectionId, long userId)
    implements JobPayload {

  @Override
  public JobType type() {
    return JobType.PROCESS_AI;
  }

  @Override
  public Long ownerUserId() {
    return userId;
  }

  @Override
  public Map<String, String> toFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("processedEmailId", Long.toString(processedEmailId));
    fields.put("connectionId", Long.toString(connectionId));
    fields.put("userId", Long.toString(userId));
    return fields;
  }
}
