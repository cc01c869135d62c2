package mailqueue.jdbc.store;

import mailqueue.jdbc.DataSourceConnectionProvider;
import mailqueue.jdbc.H2Databases;
import mailqueue.model.EnqueueOptions;
import mailqueue.model.Job;
import mailqueue.model.JobStats;
import mailqueue.model.JobStatus;
import mailqueue.model.JobType;
import mailqueue.model.ProcessEmailPayload;
import mailqueue.model.RenewSubscriptionPayload;
import mailqueue.model.SendEmailPayload;
import mailqueue.queue.JobQueue;
import mailqueue.spi.JobStoreException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class H2JobStoreTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private JdbcDataSource dataSource;
  private H2JobStore store;
  private JobQueue queue;

  @BeforeEach
  void setUp() {
    dataSource = H2Databases.newDatabase();
    store = new H2JobStore();
    queue = JobQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .jobStore(store)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  private static ProcessEmailPayload email(String messageId) {
    return new ProcessEmailPayload(messageId, 7L, 42L, "sub-1");
  }

  @Test
  void insertPersistsTypedPayloadAsStringFields() throws SQLException {
    Job job = queue.enqueue(new SendEmailPayload(7L, 42L, 1234567890123L),
        EnqueueOptions.defaults().withPriority(5));

    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "SELECT job_type, payload, status, connection_id, user_id FROM email_job_queue WHERE id=?")) {
      ps.setLong(1, job.id());
      ResultSet rs = ps.executeQuery();
      assertTrue(rs.next());
      assertEquals("send_email", rs.getString("job_type"));
      assertTrue(rs.getString("payload").contains("\"sentEmailId\":\"1234567890123\""));
      assertEquals("pending", rs.getString("status"));
      assertEquals(7L, rs.getLong("connection_id"));
      assertEquals(42L, rs.getLong("user_id"));
    }

    Job loaded = queue.getJob(job.id()).orElseThrow();
    assertEquals(new SendEmailPayload(7L, 42L, 1234567890123L), loaded.payload());
    assertEquals(5, loaded.priority());
    assertEquals(NOW, loaded.scheduledFor());
    assertEquals(3, loaded.maxAttempts());
  }

  @Test
  void renewalJobHasNoUser() {
    Job job = queue.enqueue(new RenewSubscriptionPayload(9L, 7L));

    Job loaded = queue.getJob(job.id()).orElseThrow();
    assertEquals(7L, loaded.connectionId());
    assertNull(loaded.userId());
  }

  @Test
  void duplicateIdempotencyKeyReturnsExistingRow() {
    EnqueueOptions options = EnqueueOptions.defaults().withIdempotencyKey("email:7:AAMk:created");

    Job first = queue.enqueue(email("AAMk"), options);
    Job second = queue.enqueue(email("AAMk"), options.withPriority(10));

    assertEquals(first.id(), second.id());
    assertEquals(0, second.priority());
    assertEquals(1L, queue.getStats().pending());
  }

  @Test
  void rawDuplicateInsertIsConstraintViolation() throws SQLException {
    EnqueueOptions options = EnqueueOptions.defaults().withIdempotencyKey("k");
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, email("a"), options, NOW);
      JobStoreException e = assertThrows(JobStoreException.class,
          () -> store.insert(conn, email("b"), options, NOW));
      assertTrue(e.isConstraintViolation());
    }
  }

  @Test
  void claimFollowsPriorityThenScheduleThenId() {
    long low = queue.enqueue(email("low")).id();
    long highLate = queue.enqueue(email("high-late"), EnqueueOptions.defaults().withPriority(10)).id();
    long highEarly = queue.enqueue(email("high-early"),
        EnqueueOptions.defaults().withPriority(10).withScheduledFor(NOW.minusSeconds(60))).id();
    queue.enqueue(email("future"), EnqueueOptions.defaults().withPriority(99).withScheduledFor(NOW.plusSeconds(1)));

    assertEquals(highEarly, queue.fetchNextJob(null).orElseThrow().id());
    assertEquals(highLate, queue.fetchNextJob(null).orElseThrow().id());
    assertEquals(low, queue.fetchNextJob(null).orElseThrow().id());
    assertTrue(queue.fetchNextJob(null).isEmpty());
  }

  @Test
  void claimMarksProcessingAndCountsAttempt() {
    long id = queue.enqueue(email("m1")).id();

    Job claimed = queue.fetchNextJob(null).orElseThrow();

    assertEquals(id, claimed.id());
    assertEquals(JobStatus.PROCESSING, claimed.status());
    assertEquals(1, claimed.attempts());
    assertEquals(NOW, claimed.startedAt());
  }

  @Test
  void claimRespectsTypeFilter() {
    queue.enqueue(email("m1"), EnqueueOptions.defaults().withPriority(10));
    long send = queue.enqueue(new SendEmailPayload(7L, 42L, 1L)).id();

    Optional<Job> claimed = queue.fetchNextJob(Set.of(JobType.SEND_EMAIL, JobType.RENEW_SUBSCRIPTION));

    assertEquals(send, claimed.orElseThrow().id());
  }

  @Test
  void completeStoresResultOnlyForProcessingJobs() throws SQLException {
    long id = queue.enqueue(email("m1")).id();
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, store.markCompleted(conn, id, Map.of(), NOW));
    }
    queue.fetchNextJob(null);

    queue.completeJob(id, Map.of("processedEmailId", "12"));

    Job done = queue.getJob(id).orElseThrow();
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(NOW, done.completedAt());
    assertEquals(Map.of("processedEmailId", "12"), done.result());
  }

  @Test
  void failureRetriesThenDeadLetters() throws SQLException {
    long id = queue.enqueue(email("m1"), EnqueueOptions.defaults().withMaxAttempts(2)).id();

    queue.fetchNextJob(null);
    queue.failJob(id, new IllegalStateException("Graph API error (503)"), 2);
    Job retried = queue.getJob(id).orElseThrow();
    assertEquals(JobStatus.PENDING, retried.status());
    assertEquals(NOW.plusSeconds(120), retried.scheduledFor());
    assertEquals("Graph API error (503)", retried.error());
    assertNotNull(retried.errorStack());

    try (Connection conn = dataSource.getConnection()) {
      assertTrue(store.claimNext(conn, Set.of(), NOW.plusSeconds(120)).isPresent());
    }
    queue.failJob(id, new IllegalStateException("still failing"), 2);

    Job dead = queue.getJob(id).orElseThrow();
    assertEquals(JobStatus.DEAD, dead.status());
    assertEquals(2, dead.attempts());
    assertEquals(1, queue.getJobsByStatus(JobStatus.DEAD, 10).size());

    assertTrue(queue.retryDeadJob(id));
    Job revived = queue.getJob(id).orElseThrow();
    assertEquals(JobStatus.PENDING, revived.status());
    assertEquals(0, revived.attempts());
    assertNull(revived.error());
  }

  @Test
  void statsCountEveryStatus() {
    queue.enqueue(email("a"));
    queue.enqueue(email("b"));
    long c = queue.enqueue(email("c"), EnqueueOptions.defaults().withPriority(1)).id();
    queue.fetchNextJob(null);
    queue.completeJob(c, Map.of());
    queue.fetchNextJob(null);

    JobStats stats = queue.getStats();

    assertEquals(1L, stats.pending());
    assertEquals(1L, stats.processing());
    assertEquals(1L, stats.completed());
    assertEquals(0L, stats.dead());
  }

  @Test
  void cancelOnlyDeletesPendingJobs() {
    long pending = queue.enqueue(email("a")).id();
    long claimed = queue.enqueue(email("b"), EnqueueOptions.defaults().withPriority(1)).id();
    queue.fetchNextJob(null);

    assertFalse(queue.cancelJob(claimed));
    assertTrue(queue.cancelJob(pending));
    assertTrue(queue.getJob(pending).isEmpty());
  }

  @Test
  void staleResetAndCleanupUseCallerTime() throws SQLException {
    long stale = queue.enqueue(email("a")).id();
    queue.fetchNextJob(null);
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, store.resetStale(conn, NOW.minusSeconds(1), NOW));
      assertEquals(1, store.resetStale(conn, NOW, NOW));
    }
    assertEquals(JobStatus.PENDING, queue.getJob(stale).orElseThrow().status());

    queue.fetchNextJob(null);
    queue.completeJob(stale, Map.of());
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, store.deleteCompletedBefore(conn, NOW.minusSeconds(1)));
      assertEquals(1, store.deleteCompletedBefore(conn, NOW));
    }
  }

  @Test
  void threeJobsAmongFiveFetchersGiveExactlyThreeClaims() throws Exception {
    for (int round = 0; round < 10; round++) {
      dataSource = H2Databases.newDatabase();
      queue = JobQueue.builder()
          .connectionProvider(new DataSourceConnectionProvider(dataSource))
          .jobStore(store)
          .clock(Clock.fixed(NOW, ZoneOffset.UTC))
          .build();
      for (int i = 0; i < 3; i++) {
        queue.enqueue(email("r" + round + "-m" + i));
      }

      List<Optional<Job>> results = fetchConcurrently(5, 1);

      Set<Long> claimed = new HashSet<>();
      int claimCount = 0;
      for (Optional<Job> job : results) {
        if (job.isPresent()) {
          claimCount++;
          claimed.add(job.get().id());
        }
      }
      assertEquals(3, claimCount, "round " + round);
      assertEquals(3, claimed.size(), "round " + round);
      assertEquals(3L, queue.getStats().processing());
      assertEquals(0L, queue.getStats().pending());
    }
  }

  @Test
  void contendedFetchesNeverComeBackEmptyWhileJobsRemain() throws Exception {
    int threads = 12;
    int fetchesPerThread = 10;
    for (int i = 0; i < threads * fetchesPerThread; i++) {
      queue.enqueue(email("m" + i));
    }

    List<Optional<Job>> results = fetchConcurrently(threads, fetchesPerThread);

    Set<Long> claimed = new HashSet<>();
    for (Optional<Job> job : results) {
      assertTrue(job.isPresent());
      assertTrue(claimed.add(job.get().id()));
    }
    assertEquals(threads * fetchesPerThread, claimed.size());
    assertTrue(queue.fetchNextJob(null).isEmpty());
  }

  private List<Optional<Job>> fetchConcurrently(int threads, int fetchesPerThread) throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<Optional<Job>>>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      futures.add(pool.submit(() -> {
        start.await();
        List<Optional<Job>> fetched = new ArrayList<>();
        for (int n = 0; n < fetchesPerThread; n++) {
          fetched.add(queue.fetchNextJob(null));
        }
        return fetched;
      }));
    }
    start.countDown();

    List<Optional<Job>> results = new ArrayList<>();
    try {
      for (Future<List<Optional<Job>>> future : futures) {
        results.addAll(future.get(30, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
    return results;
  }
}
