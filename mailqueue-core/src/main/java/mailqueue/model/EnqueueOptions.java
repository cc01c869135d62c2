package mailqueue.model;

import java.time.Instant;

/**
 * Options for {@code JobQueue.enqueue}.
 *
 * @param priority higher runs first
 * @param scheduledFor earliest run time, {@code null} means now
 * @param maxAttempts total attempts before the job is dead-lettered
 * @param idempotencyKey deduplication key, {@code null} disables deduplication
 */
public record EnqueueOptions(int priority, Instant scheduledFor, int maxAttempts, String idempotencyKey) {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  public EnqueueOptions {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
  }

  public static EnqueueOptions defaults() {
    return new EnqueueOptions(0, null, DEFAULT_MAX_ATTEMPTS, null);
  }

  public EnqueueOptions withPriority(int priority) {
    return new EnqueueOptions(priority, scheduledFor, maxAttempts, idempotencyKey);
  }

  public EnqueueOptions withScheduledFor(Instant scheduledFor) {
    return new EnqueueOptions(priority, scheduledFor, maxAttempts, idempotencyKey);
  }

  public EnqueueOptions withMaxAttempts(int maxAttempts) {
    return new EnqueueOptions(priority, scheduledFor, maxAttempts, idempotencyKey);
  }

  public EnqueueOptions withIdempotencyKey(String idempotencyKey) {
    return new EnqueueOptions(priority, scheduledFor, maxAttempts, idempotencyKey);
  }
}
