package mailqueue.model;

import java.util.Map;

/**
 * Typed body of a job. Each job type has exactly one payload record; payloads are persisted as a
 * flat JSON object of string fields so numeric ids survive any JSON codec unchanged.
 */
public sealed interface JobPayload
    permits ProcessEmailPayload, SendEmailPayload, SyncFolderPayload,
    RenewSubscriptionPayload, ProcessAiPayload {

  JobType type();

  /** Mailbox connection the job belongs to, denormalized onto the job row. */
  long connectionId();

  /** Owning user, or {@code null} when the payload does not carry one. */
  Long ownerUserId();

  Map<String, String> toFields();

  static JobPayload fromFields(JobType type, Map<String, String> fields) {
    switch (type) {
      case PROCESS_EMAIL:
        return new ProcessEmailPayload(
            required(fields, "graphMessageId"),
            requiredLong(fields, "connectionId"),
            requiredLong(fields, "userId"),
            fields.get("notificationId"));
      case SEND_EMAIL:
        return new SendEmailPayload(
            requiredLong(fields, "connectionId"),
            requiredLong(fields, "userId"),
            requiredLong(fields, "sentEmailId"));
      case SYNC_FOLDER:
        return new SyncFolderPayload(
            requiredLong(fields, "connectionId"),
            requiredLong(fields, "userId"),
            required(fields, "folderId"),
            fields.get("folderName"));
      case RENEW_SUBSCRIPTION:
        return new RenewSubscriptionPayload(
            requiredLong(fields, "subscriptionId"),
            requiredLong(fields, "connectionId"));
      case PROCESS_AI:
        return new ProcessAiPayload(
            requiredLong(fields, "processedEmailId"),
            requiredLong(fields, "connectionId"),
            requiredLong(fields, "userId"));
      default:
        throw new IllegalArgumentException("Unsupported job type: " + type);
    }
  }

  private static String required(Map<String, String> fields, String name) {
    String value = fields.get(name);
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing payload field: " + name);
    }
    return value;
  }

  private static long requiredLong(Map<String, String> fields, String name) {
    String value = required(fields, name);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Payload field " + name + " is not numeric: " + value, e);
    }
  }
}
