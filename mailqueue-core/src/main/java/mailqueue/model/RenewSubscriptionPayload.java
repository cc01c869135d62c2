package mailqueue.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renew a webhook subscription.
 *
 * @param subscriptionId local id of the {@link WebhookSubscription} row
 */
public record RenewSubscriptionPayload(long subscriptionId, long connectionId)
    implements JobPayload {

  @Override
  public JobType type() {
    return JobType.RENEW_SUBSCRIPTION;
  }

  @Override
  public Long ownerUserId() {
    return null;
  }

  @Override
  public Map<String, String> toFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("subscriptionId", Long.toString(subscriptionId));
    fields.put("connectionId", Long.toString(connectionId));
    return fields;
  }
}
