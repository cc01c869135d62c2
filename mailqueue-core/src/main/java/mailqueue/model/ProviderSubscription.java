package mailqueue.model;

import java.time.Instant;

public record ProviderSubscription(
    String id,
    String resource,
    String changeType,
    String notificationUrl,
    Instant expirationDateTime,
    String clientState) {
}
