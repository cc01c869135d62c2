package mailqueue.webhook;

import mailqueue.model.EmailConnection;
import mailqueue.model.EnqueueOptions;
import mailqueue.model.ProcessEmailPayload;
import mailqueue.model.WebhookSubscription;
import mailqueue.queue.JobQueue;
import mailqueue.spi.EmailConnectionRepository;
import mailqueue.spi.MetricsExporter;
import mailqueue.spi.WebhookSubscriptionRepository;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns provider change notifications into {@code process_email} jobs.
 *
 * <p>The receiver does no provider I/O: it validates each notification against its stored
 * subscription and enqueues a job, so the HTTP response returns well inside the provider's
 * timeout. Every notification is handled independently; a rejected one is logged, reported in
 * {@link WebhookResult#errors()} and never enqueued.
 *
 * <p>Jobs are keyed {@code email:{connectionId}:{messageId}:{changeType}}, so a redelivered
 * notification maps to the job that already exists.
 */
public final class WebhookReceiver {
    private static final Logger logger = Logger.getLogger(WebhookReceiver.class.getName());
    private static final Pattern MESSAGE_ID = Pattern.compile("messages/([^/]+)", Pattern.CASE_INSENSITIVE);

    static final String INVALID_PAYLOAD = "Invalid payload";

    private final WebhookSubscriptionRepository subscriptions;
    private final EmailConnectionRepository connections;
    private final JobQueue jobQueue;
    private final MetricsExporter metrics;
    private final Clock clock;

    public WebhookReceiver(WebhookSubscriptionRepository subscriptions, EmailConnectionRepository connections,
                           JobQueue jobQueue, MetricsExporter metrics, Clock clock) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.connections = Objects.requireNonNull(connections, "connections");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Handles one webhook request.
     *
     * @param validationToken the {@code validationToken} query parameter, or {@code null}
     * @param batch           the parsed body, or {@code null} when absent or unparseable
     */
    public WebhookResult handle(String validationToken, NotificationBatch batch) {
        if (validationToken != null) {
            logger.info("Webhook validation request received");
            return WebhookResult.validation(validationToken);
        }
        if (batch == null || batch.value() == null) {
            logger.warning("Webhook request without a notification list");
            return WebhookResult.processed(0, List.of(INVALID_PAYLOAD));
        }

        int processed = 0;
        List<String> errors = new ArrayList<>();
        for (Notification notification : batch.value()) {
            try {
                processNotification(notification);
                processed++;
                metrics.incrementWebhookAccepted();
            } catch (NotificationRejectedException e) {
                errors.add(e.getMessage());
                metrics.incrementWebhookRejected();
                logger.log(Level.WARNING, "Rejected notification: {0}", e.getMessage());
            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                errors.add(message);
                metrics.incrementWebhookRejected();
                logger.log(Level.WARNING, "Failed to handle notification", e);
            }
        }
        logger.log(Level.INFO, "Webhook processed {0} notifications with {1} errors",
                new Object[]{processed, errors.size()});
        return WebhookResult.processed(processed, errors);
    }

    /**
     * Constant-time comparison of a notification's client state with the stored secret.
     */
    public static boolean verifyClientState(Notification notification, String expectedClientState) {
        if (notification == null || notification.clientState() == null || expectedClientState == null) {
            return false;
        }
        return MessageDigest.isEqual(
                notification.clientState().getBytes(StandardCharsets.UTF_8),
                expectedClientState.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extracts the message id from {@code resourceData.id}, falling back to the
     * {@code messages/{id}} segment of the resource path.
     *
     * @return the message id, or {@code null} if none can be found
     */
    static String extractMessageId(Notification notification) {
        if (notification.resourceData() != null && notification.resourceData().id() != null
                && !notification.resourceData().id().isEmpty()) {
            return notification.resourceData().id();
        }
        if (notification.resource() != null) {
            Matcher matcher = MESSAGE_ID.matcher(notification.resource());
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    static int priorityFor(String changeType) {
        if ("created".equals(changeType)) {
            return 10;
        }
        if ("updated".equals(changeType)) {
            return 5;
        }
        return 0;
    }

    private void processNotification(Notification notification) {
        if (notification == null || notification.subscriptionId() == null) {
            throw new NotificationRejectedException("Notification without subscription id");
        }
        String subscriptionId = notification.subscriptionId();
        WebhookSubscription subscription = subscriptions.findBySubscriptionId(subscriptionId)
                .orElseThrow(() -> new NotificationRejectedException("Unknown subscription: " + subscriptionId));
        if (!verifyClientState(notification, subscription.clientState())) {
            throw new NotificationRejectedException("Invalid client state for subscription: " + subscriptionId);
        }
        if (!subscription.isActive()) {
            throw new NotificationRejectedException("Subscription not active: " + subscriptionId);
        }

        subscriptions.touchLastNotification(subscription.id(), clock.instant());

        EmailConnection connection = connections.findById(subscription.connectionId())
                .orElseThrow(() -> new NotificationRejectedException(
                        "Connection not found for subscription: " + subscriptionId));

        String messageId = extractMessageId(notification);
        if (messageId == null) {
            throw new NotificationRejectedException("No message id in notification for subscription: "
                    + subscriptionId);
        }

        String changeType = notification.changeType();
        EnqueueOptions options = EnqueueOptions.defaults()
                .withPriority(priorityFor(changeType))
                .withIdempotencyKey("email:" + connection.id() + ":" + messageId + ":" + changeType);
        jobQueue.enqueue(
                new ProcessEmailPayload(messageId, connection.id(), connection.userId(), subscriptionId),
                options);
        logger.log(Level.FINE, "Queued message {0} ({1}) for connection {2}",
                new Object[]{messageId, changeType, connection.id()});
    }
}
