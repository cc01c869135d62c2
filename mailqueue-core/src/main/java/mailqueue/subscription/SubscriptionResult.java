package mailqueue.subscription;

import java.time.Instant;

/**
 * @param subscriptionId local id of the subscription row
 */
public record SubscriptionResult(boolean success, Long subscriptionId, Instant expiresAt, String error) {

  public static SubscriptionResult success(long subscriptionId, Instant expiresAt) {
    return new SubscriptionResult(true, subscriptionId, expiresAt, null);
  }

  public static SubscriptionResult failure(String error) {
    return new SubscriptionResult(false, null, null, error);
  }
}
