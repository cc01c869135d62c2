package mailqueue.model;

import java.time.Instant;

public record SubscriptionRequest(
    String changeType,
    String notificationUrl,
    String resource,
    Instant expirationDateTime,
    String clientState) {
}
