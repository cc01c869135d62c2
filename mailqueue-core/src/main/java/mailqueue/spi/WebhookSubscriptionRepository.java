package mailqueue.spi;

import mailqueue.model.SubscriptionStatus;
import mailqueue.model.WebhookSubscription;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WebhookSubscriptionRepository {

    Optional<WebhookSubscription> findById(long id);

    /**
     * Looks up a subscription by the provider-assigned id carried in notifications.
     */
    Optional<WebhookSubscription> findBySubscriptionId(String subscriptionId);

    List<WebhookSubscription> findByConnectionId(long connectionId);

    /**
     * Active subscriptions whose expiry is at or before {@code cutoff}.
     */
    List<WebhookSubscription> findActiveExpiringBefore(Instant cutoff);

    /**
     * Inserts a subscription; the {@code id} of the argument is ignored.
     *
     * @return the stored subscription with its generated id
     */
    WebhookSubscription insert(WebhookSubscription subscription);

    void touchLastNotification(long id, Instant at);

    /**
     * Records a successful renewal: new expiry, status active, renewalAttempts 0, lastError null.
     */
    void markRenewed(long id, Instant expiresAt);

    /**
     * Increments renewalAttempts and sets lastError.
     */
    void recordRenewalFailure(long id, String error);

    void updateStatus(long id, SubscriptionStatus status, String lastError);

    void delete(long id);
}
