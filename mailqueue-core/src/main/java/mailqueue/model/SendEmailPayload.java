package mailqueue.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record SendEmailPayload(long connectionId, long userId, long sentEmailId)
    implements JobPayload {

  @Override
  public JobType type() {
    return JobType.SEND_EMAIL;
  }

  @Override
  public Long ownerUserId() {
    return userId;
  }

  @Override
  public Map<String, String> toFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("connectionId", Long.toString(connectionId));
    fields.put("userId", Long.toString(userId));
    fields.put("sentEmailId", Long.toString(sentEmailId));
    return fields;
  }
}
