package mailqueue.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One change notification as posted by the provider.
 *
 * @param resource      resource path, e.g. {@code Users/{id}/Messages/{messageId}}
 * @param resourceData  optional resource details; its {@code id} is the message id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Notification(
    String subscriptionId,
    String subscriptionExpirationDateTime,
    String changeType,
    String resource,
    ResourceData resourceData,
    String clientState,
    String tenantId) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ResourceData(String id) {
  }
}
