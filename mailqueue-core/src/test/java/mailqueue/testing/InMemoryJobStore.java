package mailqueue.testing;

import mailqueue.model.EnqueueOptions;
import mailqueue.model.Job;
import mailqueue.model.JobPayload;
import mailqueue.model.JobStats;
import mailqueue.model.JobStatus;
import mailqueue.model.JobType;
import mailqueue.spi.JobStore;
import mailqueue.spi.JobStoreException;

import java.sql.Connection;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Synchronized in-memory {@link JobStore} with the same transition rules as the JDBC stores.
 */
public class InMemoryJobStore implements JobStore {
  private final Map<Long, Job> jobs = new LinkedHashMap<>();
  private final AtomicLong ids = new AtomicLong();

  @Override
  public synchronized long insert(Connection conn, JobPayload payload, EnqueueOptions options, Instant now) {
    if (options.idempotencyKey() != null && findByIdempotencyKey(conn, options.idempotencyKey()).isPresent()) {
      throw new JobStoreException("duplicate key",
          new SQLIntegrityConstraintViolationException("duplicate", "23505"));
    }
    long id = ids.incrementAndGet();
    Long userId = payload.ownerUserId();
    jobs.put(id, new Job(id, payload.type(), payload, JobStatus.PENDING, options.priority(),
        options.scheduledFor() != null ? options.scheduledFor() : now, 0, options.maxAttempts(),
        options.idempotencyKey(), payload.connectionId(), userId, now, null, null, null, null, Map.of()));
    return id;
  }

  @Override
  public synchronized Optional<Job> findById(Connection conn, long id) {
    return Optional.ofNullable(jobs.get(id));
  }

  @Override
  public synchronized Optional<Job> findByIdempotencyKey(Connection conn, String idempotencyKey) {
    return jobs.values().stream().filter(j -> idempotencyKey.equals(j.idempotencyKey())).findFirst();
  }

  @Override
  public synchronized Optional<Job> claimNext(Connection conn, Set<JobType> jobTypes, Instant now) {
    Optional<Job> next = jobs.values().stream()
        .filter(j -> j.status() == JobStatus.PENDING && !j.scheduledFor().isAfter(now))
        .filter(j -> jobTypes.isEmpty() || jobTypes.contains(j.jobType()))
        .min(Comparator.comparingInt(Job::priority).reversed()
            .thenComparing(Job::scheduledFor)
            .thenComparingLong(Job::id));
    next.ifPresent(j -> put(copy(j, JobStatus.PROCESSING, j.scheduledFor(), j.attempts() + 1, now,
        null, j.error(), j.errorStack(), j.result())));
    return next.map(j -> jobs.get(j.id()));
  }

  @Override
  public synchronized int markCompleted(Connection conn, long id, Map<String, String> result, Instant now) {
    Job job = jobs.get(id);
    if (job == null || job.status() != JobStatus.PROCESSING) {
      return 0;
    }
    put(copy(job, JobStatus.COMPLETED, job.scheduledFor(), job.attempts(), job.startedAt(), now,
        job.error(), job.errorStack(), result));
    return 1;
  }

  @Override
  public synchronized int markRetry(Connection conn, long id, Instant nextAt, String error, String errorStack,
      Instant now) {
    Job job = jobs.get(id);
    if (job == null || job.status() != JobStatus.PROCESSING) {
      return 0;
    }
    put(copy(job, JobStatus.PENDING, nextAt, job.attempts(), job.startedAt(), null, error, errorStack,
        job.result()));
    return 1;
  }

  @Override
  public synchronized int markDead(Connection conn, long id, String error, String errorStack, Instant now) {
    Job job = jobs.get(id);
    if (job == null || job.status() != JobStatus.PROCESSING) {
      return 0;
    }
    put(copy(job, JobStatus.DEAD, job.scheduledFor(), job.attempts(), job.startedAt(), null, error, errorStack,
        job.result()));
    return 1;
  }

  @Override
  public synchronized List<Job> findByStatus(Connection conn, JobStatus status, int limit) {
    List<Job> result = new ArrayList<>();
    for (Job job : jobs.values()) {
      if (job.status() == status) {
        result.add(0, job);
      }
    }
    return result.size() > limit ? result.subList(0, limit) : result;
  }

  @Override
  public synchronized JobStats countByStatus(Connection conn) {
    long[] counts = new long[JobStatus.values().length];
    jobs.values().forEach(j -> counts[j.status().ordinal()]++);
    return new JobStats(counts[0], counts[1], counts[2], counts[3], counts[4]);
  }

  @Override
  public synchronized int deleteCompletedBefore(Connection conn, Instant cutoff) {
    List<Long> doomed = new ArrayList<>();
    jobs.values().stream()
        .filter(j -> j.status() == JobStatus.COMPLETED && !j.completedAt().isAfter(cutoff))
        .forEach(j -> doomed.add(j.id()));
    doomed.forEach(jobs::remove);
    return doomed.size();
  }

  @Override
  public synchronized int resetStale(Connection conn, Instant startedBefore, Instant now) {
    int count = 0;
    for (Job job : new ArrayList<>(jobs.values())) {
      if (job.status() == JobStatus.PROCESSING && !job.startedAt().isAfter(startedBefore)) {
        put(copy(job, JobStatus.PENDING, job.scheduledFor(), job.attempts(), job.startedAt(), null,
            job.error(), job.errorStack(), job.result()));
        count++;
      }
    }
    return count;
  }

  @Override
  public synchronized int resetDead(Connection conn, long id, Instant now) {
    Job job = jobs.get(id);
    if (job == null || job.status() != JobStatus.DEAD) {
      return 0;
    }
    put(copy(job, JobStatus.PENDING, now, 0, job.startedAt(), null, null, null, job.result()));
    return 1;
  }

  @Override
  public synchronized int deletePending(Connection conn, long id) {
    Job job = jobs.get(id);
    if (job == null || job.status() != JobStatus.PENDING) {
      return 0;
    }
    jobs.remove(id);
    return 1;
  }

  public synchronized List<Job> all() {
    return new ArrayList<>(jobs.values());
  }

  private void put(Job job) {
    jobs.put(job.id(), job);
  }

  private static Job copy(Job j, JobStatus status, Instant scheduledFor, int attempts, Instant startedAt,
      Instant completedAt, String error, String errorStack, Map<String, String> result) {
    return new Job(j.id(), j.jobType(), j.payload(), status, j.priority(), scheduledFor, attempts,
        j.maxAttempts(), j.idempotencyKey(), j.connectionId(), j.userId(), j.createdAt(), startedAt,
        completedAt, error, errorStack, result);
  }
}
