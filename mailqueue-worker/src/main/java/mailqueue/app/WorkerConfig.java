package mailqueue.app;

import java.util.Map;
import java.util.Objects;

/**
 * Settings of the standalone worker process, read from environment variables.
 *
 * @param pollIntervalMs   sleep between polls when the queue is empty
 * @param maxConcurrent    jobs executed in parallel
 * @param staleMinutes     age after which a processing job is reset to pending
 * @param retentionDays    age after which completed jobs are deleted
 * @param drainTimeoutMs   how long shutdown waits for in-flight jobs
 * @param databaseUrl      JDBC URL of the queue database
 * @param encryptionKey    passphrase for stored OAuth tokens
 * @param openAiApiKey     {@code null} disables email analysis
 * @param baseUrl          public URL the webhook endpoint is reachable under
 */
public record WorkerConfig(
    long pollIntervalMs,
    int maxConcurrent,
    int staleMinutes,
    int retentionDays,
    long drainTimeoutMs,
    String databaseUrl,
    String databaseUser,
    String databasePassword,
    String encryptionKey,
    String microsoftClientId,
    String microsoftClientSecret,
    String openAiApiKey,
    String baseUrl) {

  public static final String POLL_INTERVAL = "EMAIL_WORKER_POLL_INTERVAL";
  public static final String MAX_CONCURRENT = "EMAIL_WORKER_MAX_CONCURRENT";
  public static final String STALE_MINUTES = "EMAIL_WORKER_STALE_MINUTES";
  public static final String RETENTION_DAYS = "EMAIL_WORKER_RETENTION_DAYS";
  public static final String DRAIN_TIMEOUT_MS = "EMAIL_WORKER_DRAIN_TIMEOUT_MS";
  public static final String DATABASE_URL = "DATABASE_URL";
  public static final String DATABASE_USER = "DATABASE_USER";
  public static final String DATABASE_PASSWORD = "DATABASE_PASSWORD";
  public static final String ENCRYPTION_KEY = "EMAIL_TOKEN_ENCRYPTION_KEY";
  public static final String MICROSOFT_CLIENT_ID = "MICROSOFT_CLIENT_ID";
  public static final String MICROSOFT_CLIENT_SECRET = "MICROSOFT_CLIENT_SECRET";
  public static final String OPENAI_API_KEY = "OPENAI_API_KEY";
  public static final String BASE_URL = "BASE_URL";

  public WorkerConfig {
    Objects.requireNonNull(databaseUrl, "databaseUrl");
    Objects.requireNonNull(encryptionKey, "encryptionKey");
    Objects.requireNonNull(baseUrl, "baseUrl");
  }

  /**
   * Reads the configuration from {@code env}, typically {@link System#getenv()}. Blank values
   * count as unset.
   *
   * @throws IllegalArgumentException if a required variable is missing or a number is malformed
   */
  public static WorkerConfig fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    return new WorkerConfig(
        longValue(env, POLL_INTERVAL, 5000L),
        intValue(env, MAX_CONCURRENT, 5),
        intValue(env, STALE_MINUTES, 30),
        intValue(env, RETENTION_DAYS, 7),
        longValue(env, DRAIN_TIMEOUT_MS, 30_000L),
        required(env, DATABASE_URL),
        optional(env, DATABASE_USER),
        optional(env, DATABASE_PASSWORD),
        required(env, ENCRYPTION_KEY),
        optional(env, MICROSOFT_CLIENT_ID),
        optional(env, MICROSOFT_CLIENT_SECRET),
        optional(env, OPENAI_API_KEY),
        env.getOrDefault(BASE_URL, "").isBlank() ? "http://localhost:5000" : env.get(BASE_URL).trim());
  }

  public boolean analysisEnabled() {
    return openAiApiKey != null;
  }

  @Override
  public String toString() {
    return "WorkerConfig[pollIntervalMs=" + pollIntervalMs
        + ", maxConcurrent=" + maxConcurrent
        + ", staleMinutes=" + staleMinutes
        + ", retentionDays=" + retentionDays
        + ", drainTimeoutMs=" + drainTimeoutMs
        + ", databaseUrl=" + databaseUrl
        + ", analysisEnabled=" + analysisEnabled()
        + ", baseUrl=" + baseUrl + "]";
  }

  private static String optional(Map<String, String> env, String name) {
    String value = env.get(name);
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String required(Map<String, String> env, String name) {
    String value = optional(env, name);
    if (value == null) {
      throw new IllegalArgumentException(name + " must be set");
    }
    return value;
  }

  private static long longValue(Map<String, String> env, String name, long defaultValue) {
    String value = optional(env, name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be a number, got: " + value, e);
    }
  }

  private static int intValue(Map<String, String> env, String name, int defaultValue) {
    String value = optional(env, name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be a number, got: " + value, e);
    }
  }
}
