package mailqueue.queue;

import mailqueue.model.EnqueueOptions;
import mailqueue.model.Job;
import mailqueue.model.JobPayload;
import mailqueue.model.JobStats;
import mailqueue.model.JobStatus;
import mailqueue.model.JobType;
import mailqueue.spi.ConnectionProvider;
import mailqueue.spi.JobStore;
import mailqueue.spi.JobStoreException;
import mailqueue.spi.MetricsExporter;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable job queue over a {@link JobStore}.
 *
 * <p>Owns connection handling: each operation borrows a connection from the
 * {@link ConnectionProvider}, and the claim and failure paths run in their own transaction.
 * Store and connection failures surface as {@link JobStoreException}.
 *
 * <p>Retry semantics: {@code maxAttempts} is the total number of attempts. A job whose stored
 * attempt count has reached it is dead-lettered on failure; otherwise it returns to pending
 * after the {@link RetryPolicy} delay.
 *
 * @see mailqueue.worker.JobWorker
 */
public final class JobQueue {
    private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

    static final int MAX_ERROR_LENGTH = 4000;

    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final RetryPolicy retryPolicy;
    private final MetricsExporter metrics;
    private final Clock clock;

    private JobQueue(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : ExponentialBackoffRetryPolicy.DEFAULT;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Adds a job. When the options carry an idempotency key that is already taken, the existing
     * job is returned unchanged and nothing is inserted.
     */
    public Job enqueue(JobPayload payload, EnqueueOptions options) {
        Objects.requireNonNull(payload, "payload");
        EnqueueOptions effective = options != null ? options : EnqueueOptions.defaults();
        String key = effective.idempotencyKey();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            if (key != null) {
                Optional<Job> existing = jobStore.findByIdempotencyKey(conn, key);
                if (existing.isPresent()) {
                    logger.log(Level.FINE, "Job with idempotency key {0} already exists: {1}",
                            new Object[]{key, existing.get().id()});
                    return existing.get();
                }
            }
            long id;
            try {
                id = jobStore.insert(conn, payload, effective, clock.instant());
            } catch (JobStoreException e) {
                // lost an insert race on the unique key
                if (key != null && e.isConstraintViolation()) {
                    return jobStore.findByIdempotencyKey(conn, key).orElseThrow(() -> e);
                }
                throw e;
            }
            metrics.incrementJobsEnqueued();
            logger.log(Level.INFO, "Enqueued job {0} ({1})", new Object[]{id, payload.type().wireName()});
            return jobStore.findById(conn, id)
                    .orElseThrow(() -> new JobStoreException("Inserted job not found: " + id));
        } catch (SQLException e) {
            throw new JobStoreException("Failed to enqueue " + payload.type().wireName() + " job", e);
        }
    }

    public Job enqueue(JobPayload payload) {
        return enqueue(payload, EnqueueOptions.defaults());
    }

    /**
     * Claims the next eligible job.
     *
     * @param jobTypes restricts the claim to these types; {@code null} or empty means any type
     * @return the claimed job, now processing, or empty when nothing is eligible
     */
    public Optional<Job> fetchNextJob(Set<JobType> jobTypes) {
        Set<JobType> types = jobTypes == null ? Set.of() : jobTypes;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Optional<Job> claimed = jobStore.claimNext(conn, types, clock.instant());
                conn.commit();
                claimed.ifPresent(job -> metrics.incrementJobsClaimed());
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to fetch next job", e);
        }
    }

    public void completeJob(long jobId, Map<String, String> result) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            int updated = jobStore.markCompleted(conn, jobId, result == null ? Map.of() : result, clock.instant());
            if (updated == 0) {
                logger.log(Level.WARNING, "Job {0} was not processing when completed", jobId);
                return;
            }
            metrics.incrementJobsCompleted();
            logger.log(Level.INFO, "Job {0} completed", jobId);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to complete job " + jobId, e);
        }
    }

    /**
     * Records a failed attempt. Uses the attempt count stored on the job, so a retry decision
     * never depends on what the caller believes.
     *
     * @param maxAttempts total attempts allowed, normally the job's own {@code maxAttempts}
     */
    public void failJob(long jobId, Throwable error, int maxAttempts) {
        String message = truncate(errorMessage(error));
        String stack = truncate(stackTrace(error));
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Optional<Job> found = jobStore.findById(conn, jobId);
                if (found.isEmpty()) {
                    conn.commit();
                    logger.log(Level.WARNING, "Cannot fail job {0}: not found", jobId);
                    return;
                }
                Job job = found.get();
                Instant now = clock.instant();
                if (job.attempts() >= maxAttempts) {
                    jobStore.markDead(conn, jobId, message, stack, now);
                    conn.commit();
                    metrics.incrementJobsDead();
                    logger.log(Level.SEVERE, "Job {0} ({1}) moved to dead letter queue after {2} attempts: {3}",
                            new Object[]{jobId, job.jobType().wireName(), job.attempts(), message});
                } else {
                    long delayMs = retryPolicy.computeDelayMs(job.attempts());
                    Instant nextAt = now.plusMillis(delayMs);
                    jobStore.markRetry(conn, jobId, nextAt, message, stack, now);
                    conn.commit();
                    metrics.incrementJobsRetried();
                    logger.log(Level.WARNING, "Job {0} ({1}) failed on attempt {2}, retrying at {3}: {4}",
                            new Object[]{jobId, job.jobType().wireName(), job.attempts(), nextAt, message});
                }
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to record failure of job " + jobId, e);
        }
    }

    /**
     * Lists jobs in a status, newest first.
     */
    public List<Job> getJobsByStatus(JobStatus status, int limit) {
        Objects.requireNonNull(status, "status");
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return jobStore.findByStatus(conn, status, limit);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list " + status.code() + " jobs", e);
        }
    }

    public Optional<Job> getJob(long jobId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return jobStore.findById(conn, jobId);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load job " + jobId, e);
        }
    }

    public JobStats getStats() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            JobStats stats = jobStore.countByStatus(conn);
            metrics.recordQueueDepths(stats);
            return stats;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
    }

    /**
     * Deletes completed jobs older than the retention window.
     *
     * @return the number of jobs deleted
     */
    public int cleanupOldJobs(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new IllegalArgumentException("olderThanDays must be >= 0");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            int deleted = jobStore.deleteCompletedBefore(conn, cutoff);
            metrics.addJobsCleaned(deleted);
            return deleted;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to clean up completed jobs", e);
        }
    }

    /**
     * Returns jobs stuck in processing for longer than {@code staleMinutes} to pending. Their
     * attempt count is kept.
     *
     * @return the number of jobs recovered
     */
    public int recoverStaleJobs(int staleMinutes) {
        if (staleMinutes < 0) {
            throw new IllegalArgumentException("staleMinutes must be >= 0");
        }
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            int recovered = jobStore.resetStale(conn, now.minus(Duration.ofMinutes(staleMinutes)), now);
            metrics.addJobsRecovered(recovered);
            return recovered;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to recover stale jobs", e);
        }
    }

    /**
     * Gives a dead job a fresh attempt budget.
     *
     * @return {@code true} if the job was dead and is now pending
     */
    public boolean retryDeadJob(long jobId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            boolean reset = jobStore.resetDead(conn, jobId, clock.instant()) > 0;
            if (reset) {
                logger.log(Level.INFO, "Dead job {0} reset to pending", jobId);
            }
            return reset;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to retry dead job " + jobId, e);
        }
    }

    /**
     * Deletes a job that has not been claimed yet.
     *
     * @return {@code true} if a pending job was deleted
     */
    public boolean cancelJob(long jobId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return jobStore.deletePending(conn, jobId) > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to cancel job " + jobId, e);
        }
    }

    private static String errorMessage(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }

    private static String stackTrace(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    /**
     * Builder for {@link JobQueue}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * Optional. Defaults to {@link ExponentialBackoffRetryPolicy#DEFAULT}.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JobQueue build() {
            return new JobQueue(this);
        }
    }
}
