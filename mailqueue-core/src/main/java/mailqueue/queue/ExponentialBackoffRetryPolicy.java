package mailqueue.queue;

/**
 * Deterministic exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * multiplier^attempts}, capped at {@code maxDelay}. The
 * {@linkplain #DEFAULT default} policy gives {@code min(4^attempts * 30s, 1h)}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final ExponentialBackoffRetryPolicy DEFAULT =
      new ExponentialBackoffRetryPolicy(30_000L, 4, 3_600_000L);

  private final long baseDelayMs;
  private final int multiplier;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay unit multiplied by {@code multiplier^attempts} (milliseconds)
   * @param multiplier  growth factor per attempt
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, int multiplier, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (multiplier < 1) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.multiplier = multiplier;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    long delay = baseDelayMs;
    for (int i = 0; i < attempts; i++) {
      // stop before overflow: anything past the cap is the cap
      if (delay > maxDelayMs / multiplier) {
        return maxDelayMs;
      }
      delay *= multiplier;
    }
    return Math.min(delay, maxDelayMs);
  }
}
