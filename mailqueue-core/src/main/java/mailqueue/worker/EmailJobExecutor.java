package mailqueue.worker;

import mailqueue.model.Job;
import mailqueue.model.ProcessAiPayload;
import mailqueue.model.ProcessEmailPayload;
import mailqueue.model.RenewSubscriptionPayload;
import mailqueue.model.SendEmailPayload;
import mailqueue.model.SyncFolderPayload;
import mailqueue.processing.EmailProcessor;
import mailqueue.processing.ProcessEmailResult;
import mailqueue.sending.EmailSender;
import mailqueue.sending.SendEmailResult;
import mailqueue.subscription.SubscriptionManager;
import mailqueue.subscription.SubscriptionResult;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes each job type to its service and turns an unsuccessful service result into a
 * {@link JobExecutionException}.
 */
public final class EmailJobExecutor implements JobExecutor {
  private static final Logger logger = Logger.getLogger(EmailJobExecutor.class.getName());

  private final EmailProcessor processor;
  private final EmailSender sender;
  private final SubscriptionManager subscriptions;
  private final Clock clock;

  public EmailJobExecutor(EmailProcessor processor, EmailSender sender, SubscriptionManager subscriptions,
      Clock clock) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.sender = Objects.requireNonNull(sender, "sender");
    this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  @Override
  public Map<String, String> execute(Job job) throws JobExecutionException {
    logger.log(Level.FINE, "Executing job {0} ({1}), attempt {2}",
        new Object[]{job.id(), job.jobType().wireName(), job.attempts()});
    Map<String, String> result = new LinkedHashMap<>();
    // exhaustive over JobType
    Map<String, String> detail = switch (job.jobType()) {
      case PROCESS_EMAIL -> processEmail(job.payload(ProcessEmailPayload.class));
      case SEND_EMAIL -> sendEmail(job.payload(SendEmailPayload.class));
      case RENEW_SUBSCRIPTION -> renewSubscription(job.payload(RenewSubscriptionPayload.class));
      case SYNC_FOLDER -> syncFolder(job.payload(SyncFolderPayload.class));
      case PROCESS_AI -> processAi(job.payload(ProcessAiPayload.class));
    };
    result.putAll(detail);
    result.put("processedAt", clock.instant().toString());
    return result;
  }

  private Map<String, String> processEmail(ProcessEmailPayload payload) throws JobExecutionException {
    ProcessEmailResult outcome =
        processor.processEmail(payload.graphMessageId(), payload.connectionId(), payload.userId());
    if (!outcome.success()) {
      throw new JobExecutionException(outcome.error() != null ? outcome.error() : "Email processing failed");
    }
    return outcome.processedEmailId() != null
        ? Map.of("processedEmailId", outcome.processedEmailId().toString())
        : Map.of();
  }

  private Map<String, String> sendEmail(SendEmailPayload payload) throws JobExecutionException {
    SendEmailResult outcome = sender.sendQueuedEmail(payload.sentEmailId());
    if (!outcome.success()) {
      throw new JobExecutionException(outcome.error() != null ? outcome.error() : "Email sending failed");
    }
    return Map.of("sentEmailId", Long.toString(payload.sentEmailId()));
  }

  private Map<String, String> renewSubscription(RenewSubscriptionPayload payload)
      throws JobExecutionException {
    SubscriptionResult outcome = subscriptions.renewSubscription(payload.subscriptionId());
    if (!outcome.success()) {
      throw new JobExecutionException(
          outcome.error() != null ? outcome.error() : "Subscription renewal failed");
    }
    return outcome.expiresAt() != null ? Map.of("expiresAt", outcome.expiresAt().toString()) : Map.of();
  }

  // Folder sync runs in the host application's sync service.
  private Map<String, String> syncFolder(SyncFolderPayload payload) {
    logger.log(Level.INFO, "Folder sync for connection {0}, folder {1} is handled by the sync service",
        new Object[]{payload.connectionId(), payload.folderId()});
    return Map.of();
  }

  // Analysis already happens inline during processing.
  private Map<String, String> processAi(ProcessAiPayload payload) {
    logger.log(Level.INFO, "AI processing for email {0} is performed inline by the processor",
        payload.processedEmailId());
    return Map.of();
  }
}
