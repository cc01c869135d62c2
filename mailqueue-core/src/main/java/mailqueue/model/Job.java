package mailqueue.model;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted job row.
 *
 * <p>{@code attempts} counts claims, so a job that is currently {@link JobStatus#PROCESSING}
 * already includes the in-flight attempt.
 */
public record Job(
    long id,
    JobType jobType,
    JobPayload payload,
    JobStatus status,
    int priority,
    Instant scheduledFor,
    int attempts,
    int maxAttempts,
    String idempotencyKey,
    Long connectionId,
    Long userId,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String error,
    String errorStack,
    Map<String, String> result) {

  public <T extends JobPayload> T payload(Class<T> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException("Job " + id + " of type " + jobType.wireName()
          + " does not carry a " + type.getSimpleName());
    }
    return type.cast(payload);
  }
}
