package mailqueue.app;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import mailqueue.auth.AccessTokenManager;
import mailqueue.auth.AesGcmTokenCipher;
import mailqueue.graph.GraphApiClient;
import mailqueue.graph.GraphTokenRefresher;
import mailqueue.jdbc.DataSourceConnectionProvider;
import mailqueue.jdbc.repository.JdbcCrmDirectory;
import mailqueue.jdbc.repository.JdbcEmailConnectionRepository;
import mailqueue.jdbc.repository.JdbcProcessedEmailRepository;
import mailqueue.jdbc.repository.JdbcSentEmailRepository;
import mailqueue.jdbc.repository.JdbcWebhookSubscriptionRepository;
import mailqueue.jdbc.store.JdbcJobStores;
import mailqueue.openai.OpenAiEmailAnalyzer;
import mailqueue.processing.EmailProcessor;
import mailqueue.queue.JobQueue;
import mailqueue.sending.EmailSender;
import mailqueue.spi.EmailAnalyzer;
import mailqueue.spi.EmailConnectionRepository;
import mailqueue.spi.MailProvider;
import mailqueue.spi.TokenRefresher;
import mailqueue.spi.WebhookSubscriptionRepository;
import mailqueue.subscription.SubscriptionManager;
import mailqueue.worker.EmailJobExecutor;
import mailqueue.worker.JobMaintenanceScheduler;
import mailqueue.worker.JobWorker;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Standalone worker process: polls the job queue, executes email jobs and runs the periodic
 * maintenance tasks until the JVM is asked to stop.
 *
 * <p>Configured entirely from environment variables, see {@link WorkerConfig}. On SIGTERM or
 * SIGINT the shutdown hook stops polling, waits up to the drain timeout for in-flight jobs and
 * closes the connection pool.
 */
public final class EmailWorkerApplication implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EmailWorkerApplication.class.getName());

  private final WorkerConfig config;
  private final JobQueue jobQueue;
  private final JobWorker worker;
  private final JobMaintenanceScheduler maintenance;

  EmailWorkerApplication(WorkerConfig config, DataSource dataSource, MailProvider mailProvider,
      TokenRefresher tokenRefresher, EmailAnalyzer analyzer, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    Objects.requireNonNull(dataSource, "dataSource");

    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
    this.jobQueue = JobQueue.builder()
        .connectionProvider(connectionProvider)
        .jobStore(JdbcJobStores.detect(dataSource))
        .clock(clock)
        .build();

    EmailConnectionRepository connections = new JdbcEmailConnectionRepository(connectionProvider);
    WebhookSubscriptionRepository subscriptions = new JdbcWebhookSubscriptionRepository(connectionProvider);
    AccessTokenManager tokens = new AccessTokenManager(
        connections, tokenRefresher, new AesGcmTokenCipher(config.encryptionKey()), clock);

    EmailProcessor processor = EmailProcessor.builder()
        .connections(connections)
        .processedEmails(new JdbcProcessedEmailRepository(connectionProvider))
        .tokens(tokens)
        .mailProvider(mailProvider)
        .crmDirectory(new JdbcCrmDirectory(connectionProvider))
        .analyzer(analyzer)
        .clock(clock)
        .build();
    EmailSender sender = new EmailSender(connections, new JdbcSentEmailRepository(connectionProvider),
        tokens, mailProvider, jobQueue, clock);
    SubscriptionManager subscriptionManager = new SubscriptionManager(connections, subscriptions, tokens,
        mailProvider, jobQueue, config.baseUrl(), clock);

    this.worker = JobWorker.builder()
        .jobQueue(jobQueue)
        .executor(new EmailJobExecutor(processor, sender, subscriptionManager, clock))
        .maxConcurrent(config.maxConcurrent())
        .pollIntervalMs(config.pollIntervalMs())
        .drainTimeoutMs(config.drainTimeoutMs())
        .build();
    this.maintenance = JobMaintenanceScheduler.builder()
        .jobQueue(jobQueue)
        .staleMinutes(config.staleMinutes())
        .retentionDays(config.retentionDays())
        .subscriptions(subscriptionManager)
        .build();
  }

  /**
   * Wires the worker against Microsoft Graph and, when an API key is configured, OpenAI.
   *
   * @throws IllegalStateException if the Microsoft client credentials are missing
   */
  public static EmailWorkerApplication create(WorkerConfig config, DataSource dataSource) {
    if (config.microsoftClientId() == null || config.microsoftClientSecret() == null) {
      throw new IllegalStateException(WorkerConfig.MICROSOFT_CLIENT_ID + " and "
          + WorkerConfig.MICROSOFT_CLIENT_SECRET + " must be set");
    }
    TokenRefresher tokenRefresher = GraphTokenRefresher.builder()
        .clientId(config.microsoftClientId())
        .clientSecret(config.microsoftClientSecret())
        .build();
    EmailAnalyzer analyzer = null;
    if (config.analysisEnabled()) {
      analyzer = OpenAiEmailAnalyzer.builder().apiKey(config.openAiApiKey()).build();
    } else {
      logger.warning("OPENAI_API_KEY not set, emails are stored without analysis");
    }
    return new EmailWorkerApplication(config, dataSource, GraphApiClient.builder().build(),
        tokenRefresher, analyzer, Clock.systemUTC());
  }

  public void start() {
    logger.log(Level.INFO, "Starting email worker with {0}", config);
    worker.start();
    maintenance.start();
  }

  JobQueue jobQueue() {
    return jobQueue;
  }

  @Override
  public void close() {
    logger.info("Stopping email worker");
    maintenance.close();
    worker.close();
    logger.info("Email worker stopped");
  }

  static HikariDataSource createDataSource(WorkerConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("mailqueue-worker");
    hikari.setJdbcUrl(config.databaseUrl());
    hikari.setUsername(config.databaseUser());
    hikari.setPassword(config.databasePassword());
    // one per job, one for the poll loop, one for maintenance
    hikari.setMaximumPoolSize(config.maxConcurrent() + 2);
    return new HikariDataSource(hikari);
  }

  private static void configureLogging() {
    if (System.getProperty("java.util.logging.config.file") != null) {
      return;
    }
    try (InputStream in = EmailWorkerApplication.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, "Could not read logging.properties", e);
    }
  }

  public static void main(String[] args) throws InterruptedException {
    configureLogging();
    WorkerConfig config = WorkerConfig.fromEnvironment(System.getenv());

    HikariDataSource dataSource = createDataSource(config);
    EmailWorkerApplication app;
    try {
      app = create(config, dataSource);
    } catch (RuntimeException e) {
      dataSource.close();
      throw e;
    }

    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      try {
        app.close();
      } finally {
        dataSource.close();
        stopped.countDown();
      }
    }, "mailqueue-shutdown"));

    app.start();
    // worker threads are daemons
    stopped.await();
  }
}
