package mailqueue.worker;

import mailqueue.model.JobStats;
import mailqueue.queue.JobQueue;
import mailqueue.subscription.SubscriptionManager;
import mailqueue.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background housekeeping for the job queue: stale-job recovery, cleanup of old completed jobs,
 * and periodic queue statistics. When a {@link SubscriptionManager} is supplied it also sweeps
 * for webhook subscriptions close to expiry.
 *
 * <p>Each task swallows and logs its own failures so one bad cycle never cancels the schedule.
 */
public final class JobMaintenanceScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobMaintenanceScheduler.class.getName());

  private final JobQueue jobQueue;
  private final int staleMinutes;
  private final int retentionDays;
  private final long recoveryIntervalMs;
  private final long cleanupIntervalMs;
  private final long statsIntervalMs;
  private final SubscriptionManager subscriptions;
  private final long subscriptionCheckIntervalMs;

  private ScheduledExecutorService scheduler;
  private volatile boolean closed;

  private JobMaintenanceScheduler(Builder builder) {
    this.jobQueue = Objects.requireNonNull(builder.jobQueue, "jobQueue");

    if (builder.staleMinutes <= 0) {
      throw new IllegalArgumentException("staleMinutes must be > 0");
    }
    if (builder.retentionDays < 0) {
      throw new IllegalArgumentException("retentionDays must be >= 0");
    }
    if (builder.recoveryIntervalMs <= 0L || builder.cleanupIntervalMs <= 0L || builder.statsIntervalMs <= 0L
        || builder.subscriptionCheckIntervalMs <= 0L) {
      throw new IllegalArgumentException("maintenance intervals must be > 0");
    }

    this.staleMinutes = builder.staleMinutes;
    this.retentionDays = builder.retentionDays;
    this.recoveryIntervalMs = builder.recoveryIntervalMs;
    this.cleanupIntervalMs = builder.cleanupIntervalMs;
    this.statsIntervalMs = builder.statsIntervalMs;
    this.subscriptions = builder.subscriptions;
    this.subscriptionCheckIntervalMs = builder.subscriptionCheckIntervalMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the schedules. Recovery and cleanup run once immediately. Subsequent calls are
   * no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobMaintenanceScheduler has been closed");
    }
    if (scheduler != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mailqueue-maintenance-"));
    scheduler.scheduleWithFixedDelay(this::runRecovery, 0, recoveryIntervalMs, TimeUnit.MILLISECONDS);
    scheduler.scheduleWithFixedDelay(this::runCleanup, 0, cleanupIntervalMs, TimeUnit.MILLISECONDS);
    scheduler.scheduleWithFixedDelay(this::logStats, statsIntervalMs, statsIntervalMs, TimeUnit.MILLISECONDS);
    if (subscriptions != null) {
      scheduler.scheduleWithFixedDelay(this::runSubscriptionCheck, 0, subscriptionCheckIntervalMs,
          TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Returns jobs stuck in processing to pending.
   *
   * @return the number of recovered jobs, 0 on failure
   */
  public int runRecovery() {
    if (closed) {
      return 0;
    }
    try {
      int recovered = jobQueue.recoverStaleJobs(staleMinutes);
      if (recovered > 0) {
        logger.log(Level.WARNING, "Recovered {0} stale jobs stuck in processing for over {1} minutes",
            new Object[]{recovered, staleMinutes});
      }
      return recovered;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Stale job recovery failed", t);
      return 0;
    }
  }

  /**
   * Deletes completed jobs past the retention window.
   *
   * @return the number of deleted jobs, 0 on failure
   */
  public int runCleanup() {
    if (closed) {
      return 0;
    }
    try {
      int deleted = jobQueue.cleanupOldJobs(retentionDays);
      if (deleted > 0) {
        logger.log(Level.INFO, "Cleaned up {0} completed jobs older than {1} days",
            new Object[]{deleted, retentionDays});
      }
      return deleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Job cleanup failed", t);
      return 0;
    }
  }

  /**
   * Queues renewals for subscriptions expiring within the renewal lead time.
   *
   * @return the number of renewals queued, 0 on failure or when no manager is configured
   */
  public int runSubscriptionCheck() {
    if (closed || subscriptions == null) {
      return 0;
    }
    try {
      return subscriptions.checkAndRenewSubscriptions();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Subscription renewal check failed", t);
      return 0;
    }
  }

  public void logStats() {
    if (closed) {
      return;
    }
    try {
      JobStats stats = jobQueue.getStats();
      logger.log(Level.INFO, "Queue stats: pending={0}, processing={1}, completed={2}, failed={3}, dead={4}",
          new Object[]{stats.pending(), stats.processing(), stats.completed(), stats.failed(), stats.dead()});
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Failed to read queue stats", t);
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link JobMaintenanceScheduler}. */
  public static final class Builder {
    private JobQueue jobQueue;
    private int staleMinutes = 30;
    private int retentionDays = 7;
    private long recoveryIntervalMs = TimeUnit.MINUTES.toMillis(5);
    private long cleanupIntervalMs = TimeUnit.HOURS.toMillis(1);
    private long statsIntervalMs = TimeUnit.SECONDS.toMillis(60);
    private SubscriptionManager subscriptions;
    private long subscriptionCheckIntervalMs = TimeUnit.MINUTES.toMillis(15);

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder jobQueue(JobQueue jobQueue) {
      this.jobQueue = jobQueue;
      return this;
    }

    /**
     * Age after which a processing job counts as stale. Defaults to {@code 30}.
     */
    public Builder staleMinutes(int staleMinutes) {
      this.staleMinutes = staleMinutes;
      return this;
    }

    /**
     * How long completed jobs are kept. Defaults to {@code 7}.
     */
    public Builder retentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    public Builder recoveryIntervalMs(long recoveryIntervalMs) {
      this.recoveryIntervalMs = recoveryIntervalMs;
      return this;
    }

    public Builder cleanupIntervalMs(long cleanupIntervalMs) {
      this.cleanupIntervalMs = cleanupIntervalMs;
      return this;
    }

    public Builder statsIntervalMs(long statsIntervalMs) {
      this.statsIntervalMs = statsIntervalMs;
      return this;
    }

    /**
     * Optional. Enables the periodic subscription expiry sweep.
     */
    public Builder subscriptions(SubscriptionManager subscriptions) {
      this.subscriptions = subscriptions;
      return this;
    }

    public Builder subscriptionCheckIntervalMs(long subscriptionCheckIntervalMs) {
      this.subscriptionCheckIntervalMs = subscriptionCheckIntervalMs;
      return this;
    }

    public JobMaintenanceScheduler build() {
      return new JobMaintenanceScheduler(this);
    }
  }
}
