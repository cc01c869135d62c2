package mailqueue.app;

import mailqueue.model.Job;
import mailqueue.model.JobStatus;
import mailqueue.model.SyncFolderPayload;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EmailWorkerApplicationTest {

  private JdbcDataSource dataSource;
  private EmailWorkerApplication app;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("RUNSCRIPT FROM 'classpath:db/schema-h2.sql'");
    }
  }

  @AfterEach
  void tearDown() {
    if (app != null) {
      app.close();
    }
  }

  private static WorkerConfig config(boolean withGraphCredentials) {
    Map<String, String> env = new HashMap<>();
    env.put("DATABASE_URL", "jdbc:h2:mem:unused");
    env.put("EMAIL_TOKEN_ENCRYPTION_KEY", "passphrase");
    env.put("EMAIL_WORKER_POLL_INTERVAL", "20");
    env.put("EMAIL_WORKER_DRAIN_TIMEOUT_MS", "1000");
    if (withGraphCredentials) {
      env.put("MICROSOFT_CLIENT_ID", "app-id");
      env.put("MICROSOFT_CLIENT_SECRET", "app-secret");
    }
    return WorkerConfig.fromEnvironment(env);
  }

  @Test
  void executesQueuedJobs() throws Exception {
    app = EmailWorkerApplication.create(config(true), dataSource);
    app.start();

    Job job = app.jobQueue().enqueue(new SyncFolderPayload(1L, 42L, "inbox", "Inbox"));

    long deadline = System.currentTimeMillis() + 5000;
    JobStatus status = JobStatus.PENDING;
    while (System.currentTimeMillis() < deadline) {
      status = app.jobQueue().getJob(job.id()).orElseThrow().status();
      if (status == JobStatus.COMPLETED) {
        break;
      }
      Thread.sleep(20);
    }
    assertEquals(JobStatus.COMPLETED, status);
  }

  @Test
  void requiresGraphCredentials() {
    assertThrows(IllegalStateException.class,
        () -> EmailWorkerApplication.create(config(false), dataSource));
  }

  @Test
  void closeWithoutStartIsSafe() {
    app = EmailWorkerApplication.create(config(true), dataSource);
    assertDoesNotThrow(app::close);
    app = null;
  }
}
