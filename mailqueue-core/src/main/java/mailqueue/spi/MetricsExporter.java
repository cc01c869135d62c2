package mailqueue.spi;

import mailqueue.model.JobStats;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    void incrementJobsEnqueued();

    void incrementJobsClaimed();

    void incrementJobsCompleted();

    /**
     * Increments the count of failed attempts that were rescheduled.
     */
    void incrementJobsRetried();

    /**
     * Increments the count of jobs moved to dead (no more retries).
     */
    void incrementJobsDead();

    /**
     * Adds the number of stale processing jobs returned to pending by a recovery sweep.
     */
    default void addJobsRecovered(int count) {
    }

    /**
     * Adds the number of completed jobs removed by a cleanup sweep.
     */
    default void addJobsCleaned(int count) {
    }

    default void incrementWebhookAccepted() {
    }

    default void incrementWebhookRejected() {
    }

    /**
     * Records the number of jobs currently executing on this worker.
     */
    void recordActiveJobs(int activeJobs);

    /**
     * Records the latest per-status queue depth.
     */
    default void recordQueueDepths(JobStats stats) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementJobsEnqueued() {
        }

        @Override
        public void incrementJobsClaimed() {
        }

        @Override
        public void incrementJobsCompleted() {
        }

        @Override
        public void incrementJobsRetried() {
        }

        @Override
        public void incrementJobsDead() {
        }

        @Override
        public void recordActiveJobs(int activeJobs) {
        }
    }
}
