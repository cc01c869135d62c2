package mailqueue.sending;

import mailqueue.auth.AccessTokenManager;
import mailqueue.model.EmailConnection;
import mailqueue.model.EnqueueOptions;
import mailqueue.model.SendEmailPayload;
import mailqueue.model.SentEmail;
import mailqueue.model.SentEmailStatus;
import mailqueue.queue.JobQueue;
import mailqueue.spi.EmailConnectionRepository;
import mailqueue.spi.MailProvider;
import mailqueue.spi.SentEmailRepository;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queues outbound mail and delivers it through the provider.
 *
 * <p>A message is first stored as queued together with a {@code send_email} job; the job calls
 * {@link #sendQueuedEmail(long)}, which is safe to repeat because a record that is already sent
 * short-circuits.
 */
public final class EmailSender {
    private static final Logger logger = Logger.getLogger(EmailSender.class.getName());

    static final int SEND_PRIORITY = 5;

    private final EmailConnectionRepository connections;
    private final SentEmailRepository sentEmails;
    private final AccessTokenManager tokens;
    private final MailProvider mailProvider;
    private final JobQueue jobQueue;
    private final Clock clock;

    public EmailSender(EmailConnectionRepository connections, SentEmailRepository sentEmails,
                       AccessTokenManager tokens, MailProvider mailProvider, JobQueue jobQueue, Clock clock) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.sentEmails = Objects.requireNonNull(sentEmails, "sentEmails");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.mailProvider = Objects.requireNonNull(mailProvider, "mailProvider");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue");
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Stores the message as queued and enqueues its delivery.
     */
    public SendEmailResult queueEmail(SendEmailRequest request) {
        try {
            Optional<EmailConnection> connection = connections.findById(request.connectionId());
            if (connection.isEmpty()) {
                return SendEmailResult.failure(null, "Connection not found");
            }
            if (!connection.get().isActive()) {
                return SendEmailResult.failure(null, "Connection is not active");
            }

            long sentEmailId = sentEmails.insert(toRecord(request));
            jobQueue.enqueue(new SendEmailPayload(request.connectionId(), request.userId(), sentEmailId),
                    EnqueueOptions.defaults().withPriority(SEND_PRIORITY));
            logger.log(Level.INFO, "Queued email {0} for connection {1}",
                    new Object[]{sentEmailId, request.connectionId()});
            return SendEmailResult.success(sentEmailId);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to queue email for connection " + request.connectionId(), e);
            return SendEmailResult.failure(null, errorMessage(e));
        }
    }

    /**
     * Delivers a queued message. Any failure marks the record failed and is returned as an
     * unsuccessful result.
     */
    public SendEmailResult sendQueuedEmail(long sentEmailId) {
        Optional<SentEmail> found = sentEmails.findById(sentEmailId);
        if (found.isEmpty()) {
            return SendEmailResult.failure(sentEmailId, "Email not found");
        }
        SentEmail email = found.get();
        if (email.status() == SentEmailStatus.SENT) {
            logger.log(Level.FINE, "Email {0} already sent", sentEmailId);
            return SendEmailResult.success(sentEmailId);
        }

        try {
            Optional<EmailConnection> connection = connections.findById(email.connectionId());
            if (connection.isEmpty() || !connection.get().isActive()) {
                String reason = "Connection not found or inactive";
                markFailed(sentEmailId, reason);
                return SendEmailResult.failure(sentEmailId, reason);
            }

            sentEmails.markSending(sentEmailId);
            String accessToken = tokens.getValidAccessToken(connection.get());
            mailProvider.sendMail(accessToken, email.toOutboundMessage());
            sentEmails.markSent(sentEmailId, clock.instant());
            logger.log(Level.INFO, "Sent email {0}", sentEmailId);
            return SendEmailResult.success(sentEmailId);
        } catch (RuntimeException e) {
            String reason = errorMessage(e);
            logger.log(Level.WARNING, "Failed to send email " + sentEmailId, e);
            markFailed(sentEmailId, reason);
            return SendEmailResult.failure(sentEmailId, reason);
        }
    }

    /**
     * Queues and delivers in one call.
     */
    public SendEmailResult sendImmediate(SendEmailRequest request) {
        SendEmailResult queued = queueEmail(request);
        if (!queued.success()) {
            return queued;
        }
        return sendQueuedEmail(queued.sentEmailId());
    }

    /**
     * Re-queues a failed message owned by {@code userId}.
     */
    public SendEmailResult retryFailedEmail(long sentEmailId, long userId) {
        Optional<SentEmail> found = sentEmails.findById(sentEmailId);
        if (found.isEmpty() || found.get().userId() != userId) {
            return SendEmailResult.failure(sentEmailId, "Email not found");
        }
        SentEmail email = found.get();
        if (email.status() != SentEmailStatus.FAILED) {
            return SendEmailResult.failure(sentEmailId, "Email is not in failed state");
        }
        try {
            sentEmails.resetToQueued(sentEmailId);
            jobQueue.enqueue(new SendEmailPayload(email.connectionId(), userId, sentEmailId),
                    EnqueueOptions.defaults().withPriority(SEND_PRIORITY));
            logger.log(Level.INFO, "Re-queued failed email {0}", sentEmailId);
            return SendEmailResult.success(sentEmailId);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to re-queue email " + sentEmailId, e);
            return SendEmailResult.failure(sentEmailId, errorMessage(e));
        }
    }

    /**
     * @param status optional filter, {@code null} for all
     */
    public List<SentEmail> getSentEmails(long userId, SentEmailStatus status, int limit, int offset) {
        return sentEmails.findByUserId(userId, status, limit, offset);
    }

    public Optional<SentEmail> getSentEmail(long sentEmailId, long userId) {
        return sentEmails.findById(sentEmailId).filter(email -> email.userId() == userId);
    }

    private SentEmail toRecord(SendEmailRequest request) {
        return new SentEmail(0L, request.connectionId(), request.userId(), request.to(), request.cc(),
                request.bcc(), request.replyTo(), request.subject(), request.bodyText(), request.bodyHtml(),
                request.importance(), request.attachments(), SentEmailStatus.QUEUED, null, null, null,
                request.inReplyTo(), request.linkedConversationId(), request.linkedContactId(),
                request.linkedPropertyId(), request.templateUsed(), clock.instant());
    }

    private void markFailed(long sentEmailId, String reason) {
        try {
            sentEmails.markFailed(sentEmailId, reason, clock.instant());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to mark email " + sentEmailId + " as failed", e);
        }
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
