package mailqueue.spring.boot;

import mailqueue.model.JobType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the mail queue.
 *
 * @see MailQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "mailqueue")
public class MailQueueProperties {

  /**
   * Passphrase for the AES-GCM token cipher. The mail services are only wired when it is set.
   */
  private String encryptionKey;

  private final Worker worker = new Worker();
  private final Maintenance maintenance = new Maintenance();
  private final Graph graph = new Graph();
  private final OpenAi openai = new OpenAi();
  private final Webhook webhook = new Webhook();
  private final Metrics metrics = new Metrics();

  public String getEncryptionKey() {
    return encryptionKey;
  }

  public void setEncryptionKey(String encryptionKey) {
    this.encryptionKey = encryptionKey;
  }

  public Worker getWorker() {
    return worker;
  }

  public Maintenance getMaintenance() {
    return maintenance;
  }

  public Graph getGraph() {
    return graph;
  }

  public OpenAi getOpenai() {
    return openai;
  }

  public Webhook getWebhook() {
    return webhook;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Worker {
    /**
     * Runs the poll loop inside the application. Off by default; the standalone worker is
     * the usual deployment.
     */
    private boolean enabled = false;
    private long pollIntervalMs = 5000;
    private int maxConcurrent = 5;
    private long drainTimeoutMs = 30000;
    /**
     * Job types this worker claims. Empty means all.
     */
    private Set<JobType> jobTypes = new LinkedHashSet<>();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getPollIntervalMs() {
      return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
    }

    public int getMaxConcurrent() {
      return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
      this.maxConcurrent = maxConcurrent;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }

    public Set<JobType> getJobTypes() {
      return jobTypes;
    }

    public void setJobTypes(Set<JobType> jobTypes) {
      this.jobTypes = jobTypes;
    }
  }

  public static class Maintenance {
    private int staleMinutes = 30;
    private int retentionDays = 7;
    private long recoveryIntervalMs = 300_000;
    private long cleanupIntervalMs = 3_600_000;
    private long statsIntervalMs = 60_000;
    private long subscriptionCheckIntervalMs = 900_000;

    public int getStaleMinutes() {
      return staleMinutes;
    }

    public void setStaleMinutes(int staleMinutes) {
      this.staleMinutes = staleMinutes;
    }

    public int getRetentionDays() {
      return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
    }

    public long getRecoveryIntervalMs() {
      return recoveryIntervalMs;
    }

    public void setRecoveryIntervalMs(long recoveryIntervalMs) {
      this.recoveryIntervalMs = recoveryIntervalMs;
    }

    public long getCleanupIntervalMs() {
      return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
      this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public long getStatsIntervalMs() {
      return statsIntervalMs;
    }

    public void setStatsIntervalMs(long statsIntervalMs) {
      this.statsIntervalMs = statsIntervalMs;
    }

    public long getSubscriptionCheckIntervalMs() {
      return subscriptionCheckIntervalMs;
    }

    public void setSubscriptionCheckIntervalMs(long subscriptionCheckIntervalMs) {
      this.subscriptionCheckIntervalMs = subscriptionCheckIntervalMs;
    }
  }

  public static class Graph {
    private String clientId;
    private String clientSecret;
    private String baseUrl = "https://graph.microsoft.com/v1.0";
    private String authorityUrl = "https://login.microsoftonline.com";

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getClientSecret() {
      return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getAuthorityUrl() {
      return authorityUrl;
    }

    public void setAuthorityUrl(String authorityUrl) {
      this.authorityUrl = authorityUrl;
    }
  }

  public static class OpenAi {
    /**
     * AI classification is disabled when no key is set.
     */
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }
  }

  public static class Webhook {
    /**
     * Public base URL the provider posts notifications to.
     */
    private String baseUrl = "http://localhost:5000";

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "mailqueue";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
