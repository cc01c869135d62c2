package mailqueue.subscription;

import mailqueue.auth.AccessTokenManager;
import mailqueue.model.EmailConnection;
import mailqueue.model.EnqueueOptions;
import mailqueue.model.ProviderSubscription;
import mailqueue.model.RenewSubscriptionPayload;
import mailqueue.model.SubscriptionRequest;
import mailqueue.model.SubscriptionStatus;
import mailqueue.model.WebhookSubscription;
import mailqueue.queue.JobQueue;
import mailqueue.spi.EmailConnectionRepository;
import mailqueue.spi.MailProvider;
import mailqueue.spi.WebhookSubscriptionRepository;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a change-notification subscription alive for every connected inbox.
 *
 * <p>Subscriptions live {@link #SUBSCRIPTION_LIFETIME} and are renewed by a
 * {@code renew_subscription} job scheduled {@link #RENEWAL_LEAD} before expiry. A renewal that
 * fails after the subscription has already lapsed falls back to creating a new one.
 */
public final class SubscriptionManager {
    private static final Logger logger = Logger.getLogger(SubscriptionManager.class.getName());

    public static final Duration SUBSCRIPTION_LIFETIME = Duration.ofMinutes(4230);
    public static final Duration RENEWAL_LEAD = Duration.ofMinutes(60);
    public static final String WEBHOOK_PATH = "/api/email-integration/webhook";

    static final String CHANGE_TYPE = "created,updated";
    static final int RENEWAL_PRIORITY = 10;

    private final EmailConnectionRepository connections;
    private final WebhookSubscriptionRepository subscriptions;
    private final AccessTokenManager tokens;
    private final MailProvider mailProvider;
    private final JobQueue jobQueue;
    private final String notificationUrl;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    /**
     * @param baseUrl public base URL of the webhook endpoint host, e.g. {@code https://crm.example.com}
     */
    public SubscriptionManager(EmailConnectionRepository connections, WebhookSubscriptionRepository subscriptions,
                               AccessTokenManager tokens, MailProvider mailProvider, JobQueue jobQueue,
                               String baseUrl, Clock clock) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.mailProvider = Objects.requireNonNull(mailProvider, "mailProvider");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue");
        this.notificationUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl")) + WEBHOOK_PATH;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public SubscriptionResult createSubscription(long connectionId) {
        try {
            Optional<EmailConnection> found = connections.findById(connectionId);
            if (found.isEmpty() || !found.get().isActive()) {
                return SubscriptionResult.failure("Connection not found or inactive");
            }
            EmailConnection connection = found.get();
            String accessToken = tokens.getValidAccessToken(connection);

            String owner = connection.microsoftUserId() != null ? connection.microsoftUserId() : "me";
            String resource = "users/" + owner + "/mailFolders/inbox/messages";
            String clientState = newClientState();
            Instant expiration = clock.instant().plus(SUBSCRIPTION_LIFETIME);

            ProviderSubscription created = mailProvider.createSubscription(accessToken,
                    new SubscriptionRequest(CHANGE_TYPE, notificationUrl, resource, expiration, clientState));
            Instant expiresAt = created.expirationDateTime() != null ? created.expirationDateTime() : expiration;

            WebhookSubscription stored = subscriptions.insert(new WebhookSubscription(0L, connectionId,
                    connection.userId(), created.id(), resource, CHANGE_TYPE, notificationUrl, expiresAt,
                    clientState, SubscriptionStatus.ACTIVE, null, 0, null));
            scheduleRenewal(stored.id(), connectionId, expiresAt);

            logger.log(Level.INFO, "Created subscription {0} for connection {1}, expires {2}",
                    new Object[]{created.id(), connectionId, expiresAt});
            return SubscriptionResult.success(stored.id(), expiresAt);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to create subscription for connection " + connectionId, e);
            return SubscriptionResult.failure(errorMessage(e));
        }
    }

    /**
     * Extends a subscription's expiry.
     *
     * @param subscriptionId local id of the subscription row
     */
    public SubscriptionResult renewSubscription(long subscriptionId) {
        Optional<WebhookSubscription> found = subscriptions.findById(subscriptionId);
        if (found.isEmpty()) {
            return SubscriptionResult.failure("Subscription not found");
        }
        WebhookSubscription subscription = found.get();

        Optional<EmailConnection> connection = connections.findById(subscription.connectionId());
        if (connection.isEmpty() || !connection.get().isActive()) {
            String error = "Connection not found or inactive";
            subscriptions.updateStatus(subscriptionId, SubscriptionStatus.ERROR, error);
            return SubscriptionResult.failure(error);
        }

        try {
            String accessToken = tokens.getValidAccessToken(connection.get());
            Instant expiration = clock.instant().plus(SUBSCRIPTION_LIFETIME);
            ProviderSubscription renewed = mailProvider.renewSubscription(accessToken,
                    subscription.subscriptionId(), expiration);
            Instant expiresAt = renewed.expirationDateTime() != null ? renewed.expirationDateTime() : expiration;
            subscriptions.markRenewed(subscriptionId, expiresAt);
            scheduleRenewal(subscriptionId, subscription.connectionId(), expiresAt);
            logger.log(Level.INFO, "Renewed subscription {0}, expires {1}",
                    new Object[]{subscription.subscriptionId(), expiresAt});
            return SubscriptionResult.success(subscriptionId, expiresAt);
        } catch (RuntimeException e) {
            String error = errorMessage(e);
            logger.log(Level.WARNING, "Failed to renew subscription " + subscription.subscriptionId(), e);
            subscriptions.recordRenewalFailure(subscriptionId, error);

            if (!subscription.expiresAt().isAfter(clock.instant())) {
                subscriptions.updateStatus(subscriptionId, SubscriptionStatus.EXPIRED, error);
                logger.log(Level.INFO, "Subscription {0} expired, creating a new one",
                        subscription.subscriptionId());
                return createSubscription(subscription.connectionId());
            }
            return SubscriptionResult.failure(error);
        }
    }

    /**
     * Removes a subscription. The provider call is best effort; the local row is always deleted.
     */
    public boolean deleteSubscription(long subscriptionId) {
        Optional<WebhookSubscription> found = subscriptions.findById(subscriptionId);
        if (found.isEmpty()) {
            return false;
        }
        WebhookSubscription subscription = found.get();
        Optional<EmailConnection> connection = connections.findById(subscription.connectionId());
        if (connection.isPresent() && connection.get().isActive()) {
            try {
                String accessToken = tokens.getValidAccessToken(connection.get());
                mailProvider.deleteSubscription(accessToken, subscription.subscriptionId());
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Provider delete failed for subscription "
                        + subscription.subscriptionId() + "; removing local record anyway", e);
            }
        }
        subscriptions.delete(subscriptionId);
        logger.log(Level.INFO, "Deleted subscription {0}", subscription.subscriptionId());
        return true;
    }

    /**
     * Enqueues a renewal for every active subscription that expires within {@link #RENEWAL_LEAD}.
     *
     * @return the number of renewals enqueued
     */
    public int checkAndRenewSubscriptions() {
        Instant now = clock.instant();
        List<WebhookSubscription> expiring = subscriptions.findActiveExpiringBefore(now.plus(RENEWAL_LEAD));
        for (WebhookSubscription subscription : expiring) {
            jobQueue.enqueue(new RenewSubscriptionPayload(subscription.id(), subscription.connectionId()),
                    EnqueueOptions.defaults()
                            .withPriority(RENEWAL_PRIORITY)
                            .withIdempotencyKey("renew:" + subscription.id() + ":" + now.toEpochMilli()));
        }
        if (!expiring.isEmpty()) {
            logger.log(Level.INFO, "Queued renewal for {0} expiring subscriptions", expiring.size());
        }
        return expiring.size();
    }

    public List<WebhookSubscription> getSubscriptionsForConnection(long connectionId) {
        return subscriptions.findByConnectionId(connectionId);
    }

    private void scheduleRenewal(long subscriptionId, long connectionId, Instant expiresAt) {
        Instant renewAt = expiresAt.minus(RENEWAL_LEAD);
        RenewSubscriptionPayload payload = new RenewSubscriptionPayload(subscriptionId, connectionId);
        EnqueueOptions options = EnqueueOptions.defaults().withPriority(RENEWAL_PRIORITY);
        if (!renewAt.isAfter(clock.instant())) {
            jobQueue.enqueue(payload, options);
            return;
        }
        jobQueue.enqueue(payload, options
                .withScheduledFor(renewAt)
                .withIdempotencyKey("renew:" + subscriptionId + ":" + renewAt.toEpochMilli()));
    }

    private String newClientState() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
