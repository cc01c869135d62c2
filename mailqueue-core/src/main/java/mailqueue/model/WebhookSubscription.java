package mailqueue.model;

import java.time.Instant;

/**
 * Local record of a provider change-notification subscription.
 *
 * @param id local row id
 * @param subscriptionId the provider's subscription id, unique
 * @param clientState shared secret echoed by the provider on every notification
 */
public record WebhookSubscription(
    long id,
    long connectionId,
    long userId,
    String subscriptionId,
    String resource,
    String changeType,
    String notificationUrl,
    Instant expiresAt,
    String clientState,
    SubscriptionStatus status,
    Instant lastNotificationAt,
    int renewalAttempts,
    String lastError) {

  public boolean isActive() {
    return status == SubscriptionStatus.ACTIVE;
  }
}
