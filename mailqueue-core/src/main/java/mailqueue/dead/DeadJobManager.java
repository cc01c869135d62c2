package mailqueue.dead;

import mailqueue.model.Job;
import mailqueue.model.JobStatus;
import mailqueue.queue.JobQueue;
import mailqueue.spi.JobStoreException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for listing, counting and retrying dead jobs.
 *
 * <p>Store failures are logged and reported as empty results, so an operator console never
 * fails on a transient database error.
 *
 * @see JobQueue#retryDeadJob
 */
public final class DeadJobManager {
  private static final Logger logger = Logger.getLogger(DeadJobManager.class.getName());

  private final JobQueue jobQueue;

  public DeadJobManager(JobQueue jobQueue) {
    this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue");
  }

  /**
   * @return dead jobs, newest first
   */
  public List<Job> list(int limit) {
    try {
      return jobQueue.getJobsByStatus(JobStatus.DEAD, limit);
    } catch (JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to list dead jobs", e);
      return List.of();
    }
  }

  /**
   * @return {@code true} if the job was dead and is now pending again
   */
  public boolean retry(long jobId) {
    try {
      return jobQueue.retryDeadJob(jobId);
    } catch (JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to retry dead job: " + jobId, e);
      return false;
    }
  }

  /**
   * Retries every dead job, fetching them in batches.
   *
   * @return total number of jobs reset to pending
   */
  public int retryAll(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int totalRetried = 0;
    List<Job> batch;
    do {
      int batchRetried = 0;
      batch = list(batchSize);
      for (Job job : batch) {
        if (retry(job.id())) {
          batchRetried++;
        }
      }
      totalRetried += batchRetried;
      if (batchRetried == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    if (totalRetried > 0) {
      logger.log(Level.INFO, "Retried {0} dead jobs", totalRetried);
    }
    return totalRetried;
  }

  public long count() {
    try {
      return jobQueue.getStats().dead();
    } catch (JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to count dead jobs", e);
      return 0L;
    }
  }
}
