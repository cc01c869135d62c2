package mailqueue.spring.boot;

import mailqueue.auth.AccessTokenManager;
import mailqueue.auth.AesGcmTokenCipher;
import mailqueue.dead.DeadJobManager;
import mailqueue.graph.GraphApiClient;
import mailqueue.graph.GraphTokenRefresher;
import mailqueue.jdbc.DataSourceConnectionProvider;
import mailqueue.jdbc.repository.JdbcCrmDirectory;
import mailqueue.jdbc.repository.JdbcEmailConnectionRepository;
import mailqueue.jdbc.repository.JdbcProcessedEmailRepository;
import mailqueue.jdbc.repository.JdbcSentEmailRepository;
import mailqueue.jdbc.repository.JdbcWebhookSubscriptionRepository;
import mailqueue.jdbc.store.AbstractJdbcJobStore;
import mailqueue.jdbc.store.JdbcJobStores;
import mailqueue.openai.OpenAiEmailAnalyzer;
import mailqueue.processing.EmailProcessor;
import mailqueue.queue.JobQueue;
import mailqueue.queue.RetryPolicy;
import mailqueue.sending.EmailSender;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.CrmDirectory;
import mailqueue.spi.EmailAnalyzer;
import mailqueue.spi.EmailConnectionRepository;
import mailqueue.spi.MailProvider;
import mailqueue.spi.MetricsExporter;
import mailqueue.spi.ProcessedEmailRepository;
import mailqueue.spi.SentEmailRepository;
import mailqueue.spi.TokenCipher;
import mailqueue.spi.TokenRefresher;
import mailqueue.spi.WebhookSubscriptionRepository;
import mailqueue.subscription.SubscriptionManager;
import mailqueue.webhook.WebhookReceiver;
import mailqueue.worker.EmailJobExecutor;
import mailqueue.worker.JobExecutor;
import mailqueue.worker.JobMaintenanceScheduler;
import mailqueue.worker.JobWorker;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.DispatcherServlet;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the mail queue.
 *
 * <p>Always wires the job store, {@link JobQueue}, repositories and {@link WebhookReceiver}
 * from the application's {@link DataSource}. The Graph-backed services (processor, sender,
 * subscription manager) need {@code mailqueue.encryption-key}; the in-app worker additionally
 * needs {@code mailqueue.worker.enabled=true}.
 *
 * @see MailQueueProperties
 * @see MailQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MailQueueProperties.class)
public class MailQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock mailQueueClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcJobStore jobStore(DataSource dataSource) {
    return JdbcJobStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public JobQueue jobQueue(ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore,
      ObjectProvider<RetryPolicy> retryPolicyProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      Clock clock) {
    var builder = JobQueue.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .clock(clock);
    retryPolicyProvider.ifAvailable(builder::retryPolicy);
    metricsProvider.ifAvailable(builder::metrics);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadJobManager deadJobManager(JobQueue jobQueue) {
    return new DeadJobManager(jobQueue);
  }

  @Bean
  @ConditionalOnMissingBean(EmailConnectionRepository.class)
  public JdbcEmailConnectionRepository emailConnectionRepository(ConnectionProvider connectionProvider) {
    return new JdbcEmailConnectionRepository(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(WebhookSubscriptionRepository.class)
  public JdbcWebhookSubscriptionRepository webhookSubscriptionRepository(ConnectionProvider connectionProvider) {
    return new JdbcWebhookSubscriptionRepository(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(ProcessedEmailRepository.class)
  public JdbcProcessedEmailRepository processedEmailRepository(ConnectionProvider connectionProvider) {
    return new JdbcProcessedEmailRepository(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(SentEmailRepository.class)
  public JdbcSentEmailRepository sentEmailRepository(ConnectionProvider connectionProvider) {
    return new JdbcSentEmailRepository(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(CrmDirectory.class)
  public JdbcCrmDirectory crmDirectory(ConnectionProvider connectionProvider) {
    return new JdbcCrmDirectory(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean
  public WebhookReceiver webhookReceiver(WebhookSubscriptionRepository subscriptions,
      EmailConnectionRepository connections,
      JobQueue jobQueue,
      ObjectProvider<MetricsExporter> metricsProvider,
      Clock clock) {
    return new WebhookReceiver(subscriptions, connections, jobQueue, metricsProvider.getIfAvailable(), clock);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
  @ConditionalOnClass(DispatcherServlet.class)
  static class WebhookEndpointConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WebhookController webhookController(WebhookReceiver webhookReceiver) {
      return new WebhookController(webhookReceiver);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "mailqueue.openai", name = "api-key")
  static class OpenAiConfiguration {

    @Bean
    @ConditionalOnMissingBean(EmailAnalyzer.class)
    public OpenAiEmailAnalyzer emailAnalyzer(MailQueueProperties props) {
      MailQueueProperties.OpenAi openai = props.getOpenai();
      return OpenAiEmailAnalyzer.builder()
          .apiKey(openai.getApiKey())
          .baseUrl(openai.getBaseUrl())
          .model(openai.getModel())
          .build();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "mailqueue", name = "encryption-key")
  static class MailServicesConfiguration {

    @Bean
    @ConditionalOnMissingBean(TokenCipher.class)
    public AesGcmTokenCipher tokenCipher(MailQueueProperties props) {
      return new AesGcmTokenCipher(props.getEncryptionKey());
    }

    @Bean
    @ConditionalOnMissingBean(MailProvider.class)
    public GraphApiClient mailProvider(MailQueueProperties props) {
      return GraphApiClient.builder()
          .baseUrl(props.getGraph().getBaseUrl())
          .build();
    }

    @Bean
    @ConditionalOnMissingBean(TokenRefresher.class)
    public GraphTokenRefresher tokenRefresher(MailQueueProperties props) {
      MailQueueProperties.Graph graph = props.getGraph();
      if (graph.getClientId() == null || graph.getClientSecret() == null) {
        throw new IllegalStateException(
            "mailqueue.graph.client-id and mailqueue.graph.client-secret must be set");
      }
      return GraphTokenRefresher.builder()
          .clientId(graph.getClientId())
          .clientSecret(graph.getClientSecret())
          .authorityUrl(graph.getAuthorityUrl())
          .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessTokenManager accessTokenManager(EmailConnectionRepository connections,
        TokenRefresher tokenRefresher, TokenCipher tokenCipher, Clock clock) {
      return new AccessTokenManager(connections, tokenRefresher, tokenCipher, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailProcessor emailProcessor(EmailConnectionRepository connections,
        ProcessedEmailRepository processedEmails,
        AccessTokenManager tokens,
        MailProvider mailProvider,
        CrmDirectory crmDirectory,
        ObjectProvider<EmailAnalyzer> analyzerProvider,
        Clock clock) {
      return EmailProcessor.builder()
          .connections(connections)
          .processedEmails(processedEmails)
          .tokens(tokens)
          .mailProvider(mailProvider)
          .crmDirectory(crmDirectory)
          .analyzer(analyzerProvider.getIfAvailable())
          .clock(clock)
          .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailSender emailSender(EmailConnectionRepository connections,
        SentEmailRepository sentEmails,
        AccessTokenManager tokens,
        MailProvider mailProvider,
        JobQueue jobQueue,
        Clock clock) {
      return new EmailSender(connections, sentEmails, tokens, mailProvider, jobQueue, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionManager subscriptionManager(EmailConnectionRepository connections,
        WebhookSubscriptionRepository subscriptions,
        AccessTokenManager tokens,
        MailProvider mailProvider,
        JobQueue jobQueue,
        MailQueueProperties props,
        Clock clock) {
      return new SubscriptionManager(connections, subscriptions, tokens, mailProvider, jobQueue,
          props.getWebhook().getBaseUrl(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(JobExecutor.class)
    public EmailJobExecutor jobExecutor(EmailProcessor processor, EmailSender sender,
        SubscriptionManager subscriptionManager, Clock clock) {
      return new EmailJobExecutor(processor, sender, subscriptionManager, clock);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "mailqueue.worker", name = "enabled", havingValue = "true")
    static class WorkerConfiguration {

      @Bean(initMethod = "start", destroyMethod = "close")
      @ConditionalOnMissingBean
      public JobWorker jobWorker(JobQueue jobQueue, JobExecutor jobExecutor, MailQueueProperties props,
          ObjectProvider<MetricsExporter> metricsProvider) {
        MailQueueProperties.Worker worker = props.getWorker();
        return JobWorker.builder()
            .jobQueue(jobQueue)
            .executor(jobExecutor)
            .jobTypes(worker.getJobTypes())
            .maxConcurrent(worker.getMaxConcurrent())
            .pollIntervalMs(worker.getPollIntervalMs())
            .drainTimeoutMs(worker.getDrainTimeoutMs())
            .metrics(metricsProvider.getIfAvailable())
            .build();
      }

      @Bean(initMethod = "start", destroyMethod = "close")
      @ConditionalOnMissingBean
      public JobMaintenanceScheduler jobMaintenanceScheduler(JobQueue jobQueue,
          SubscriptionManager subscriptionManager, MailQueueProperties props) {
        MailQueueProperties.Maintenance maintenance = props.getMaintenance();
        return JobMaintenanceScheduler.builder()
            .jobQueue(jobQueue)
            .staleMinutes(maintenance.getStaleMinutes())
            .retentionDays(maintenance.getRetentionDays())
            .recoveryIntervalMs(maintenance.getRecoveryIntervalMs())
            .cleanupIntervalMs(maintenance.getCleanupIntervalMs())
            .statsIntervalMs(maintenance.getStatsIntervalMs())
            .subscriptions(subscriptionManager)
            .subscriptionCheckIntervalMs(maintenance.getSubscriptionCheckIntervalMs())
            .build();
      }
    }
  }
}
