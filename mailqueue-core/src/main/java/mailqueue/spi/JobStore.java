package mailqueue.spi;

import mailqueue.model.EnqueueOptions;
import mailqueue.model.Job;
import mailqueue.model.JobPayload;
import mailqueue.model.JobStats;
import mailqueue.model.JobStatus;
import mailqueue.model.JobType;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence contract for queued jobs, managing status transitions through the lifecycle:
 * pending → processing → completed, processing → pending (retry), or processing → dead.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Time is always passed in by the caller; stores never read the system clock.
 * Implementations live in the {@code mailqueue-jdbc} module.
 *
 * @see mailqueue.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

    /**
     * Inserts a new pending job.
     *
     * @param conn    the JDBC connection
     * @param payload typed job body; its type becomes the job type
     * @param options priority, schedule, attempt budget and idempotency key
     * @param now     creation time; also the schedule when {@code options.scheduledFor()} is null
     * @return the generated job id
     * @throws JobStoreException on SQL failure, including idempotency key conflicts
     */
    long insert(Connection conn, JobPayload payload, EnqueueOptions options, Instant now);

    Optional<Job> findById(Connection conn, long id);

    Optional<Job> findByIdempotencyKey(Connection conn, String idempotencyKey);

    /**
     * Claims the highest-priority eligible job: pending and scheduled at or before {@code now},
     * ordered by priority descending then schedule ascending.
     *
     * <p>The claim moves the job to processing, increments {@code attempts} and sets
     * {@code startedAt}. Two concurrent callers never receive the same job. Callers run this
     * inside a transaction.
     *
     * @param conn     the JDBC connection
     * @param jobTypes restricts eligible types; empty means any type
     * @param now      current time
     * @return the claimed job as stored after the claim, or empty
     */
    Optional<Job> claimNext(Connection conn, Set<JobType> jobTypes, Instant now);

    /**
     * Marks a processing job as completed.
     *
     * @return the number of rows updated (0 or 1)
     */
    int markCompleted(Connection conn, long id, Map<String, String> result, Instant now);

    /**
     * Returns a processing job to pending with a new schedule. The attempt count is left as is.
     *
     * @return the number of rows updated (0 or 1)
     */
    int markRetry(Connection conn, long id, Instant nextAt, String error, String errorStack, Instant now);

    /**
     * Moves a processing job to dead.
     *
     * @return the number of rows updated (0 or 1)
     */
    int markDead(Connection conn, long id, String error, String errorStack, Instant now);

    /**
     * Lists jobs in a status, newest first.
     */
    List<Job> findByStatus(Connection conn, JobStatus status, int limit);

    JobStats countByStatus(Connection conn);

    /**
     * Deletes completed jobs finished at or before {@code cutoff}.
     *
     * @return the number of rows deleted
     */
    int deleteCompletedBefore(Connection conn, Instant cutoff);

    /**
     * Returns processing jobs started at or before {@code startedBefore} to pending.
     *
     * @return the number of rows updated
     */
    int resetStale(Connection conn, Instant startedBefore, Instant now);

    /**
     * Resets a dead job to pending with zero attempts and no error. Returns 0 if the job does
     * not exist or is not dead.
     */
    int resetDead(Connection conn, long id, Instant now);

    /**
     * Deletes a job only if it is still pending.
     *
     * @return the number of rows deleted (0 or 1)
     */
    int deletePending(Connection conn, long id);
}
