package mailqueue.worker;

import mailqueue.model.Job;
import mailqueue.model.JobType;
import mailqueue.queue.JobQueue;
import mailqueue.spi.MetricsExporter;
import mailqueue.util.DaemonThreadFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls the job queue and runs claimed jobs on a fixed pool.
 *
 * <p>A single poll thread claims one job at a time while fewer than {@code maxConcurrent} jobs
 * are in flight, and hands each one to the pool without waiting for it. When the gate is full
 * the poll thread waits {@value #GATE_WAIT_MS} ms; when the queue is empty it waits
 * {@code pollIntervalMs}.
 *
 * <p>A job that returns normally is completed with its result; any exception goes to
 * {@link JobQueue#failJob}, which decides between retry and dead-lettering.
 *
 * <p>{@link #close()} stops claiming and waits up to {@code drainTimeoutMs} for in-flight jobs.
 * Jobs cut off by a forced shutdown stay in processing and are picked up by the stale-job
 * recovery sweep.
 */
public final class JobWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobWorker.class.getName());

    static final long GATE_WAIT_MS = 100;

    private final JobQueue jobQueue;
    private final JobExecutor executor;
    private final Set<JobType> jobTypes;
    private final int maxConcurrent;
    private final long pollIntervalMs;
    private final long drainTimeoutMs;
    private final MetricsExporter metrics;

    private final AtomicInteger activeJobs = new AtomicInteger();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private ExecutorService pollThread;
    private ExecutorService workers;
    private volatile boolean closed;

    private JobWorker(Builder builder) {
        this.jobQueue = Objects.requireNonNull(builder.jobQueue, "jobQueue");
        this.executor = Objects.requireNonNull(builder.executor, "executor");

        if (builder.maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be > 0");
        }
        if (builder.pollIntervalMs <= 0L) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0L) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }

        this.jobTypes = builder.jobTypes == null || builder.jobTypes.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(builder.jobTypes));
        this.maxConcurrent = builder.maxConcurrent;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the poll loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobWorker has been closed");
        }
        if (pollThread != null) {
            return;
        }
        workers = Executors.newFixedThreadPool(maxConcurrent, new DaemonThreadFactory("mailqueue-worker-"));
        pollThread = Executors.newSingleThreadExecutor(new DaemonThreadFactory("mailqueue-poller-"));
        pollThread.execute(this::pollLoop);
        logger.log(Level.INFO, "Job worker started: maxConcurrent={0}, pollIntervalMs={1}, jobTypes={2}",
                new Object[]{maxConcurrent, pollIntervalMs, jobTypes.isEmpty() ? "all" : jobTypes});
    }

    /**
     * Claims and dispatches at most one job. Called by the poll loop; may also be invoked directly
     * after {@link #start()} for testing.
     *
     * @return {@code true} if a job was claimed
     */
    public boolean pollOnce() {
        if (closed || workers == null || activeJobs.get() >= maxConcurrent) {
            return false;
        }
        Optional<Job> claimed = jobQueue.fetchNextJob(jobTypes);
        if (claimed.isEmpty()) {
            return false;
        }
        dispatch(claimed.get());
        return true;
    }

    public int activeJobs() {
        return activeJobs.get();
    }

    private void pollLoop() {
        while (!closed) {
            try {
                if (activeJobs.get() >= maxConcurrent) {
                    pause(GATE_WAIT_MS);
                    continue;
                }
                if (!pollOnce()) {
                    pause(pollIntervalMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Poll cycle failed", t);
                try {
                    pause(pollIntervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void pause(long millis) throws InterruptedException {
        stopSignal.await(millis, TimeUnit.MILLISECONDS);
    }

    private void dispatch(Job job) {
        metrics.recordActiveJobs(activeJobs.incrementAndGet());
        try {
            workers.execute(() -> run(job));
        } catch (RejectedExecutionException e) {
            metrics.recordActiveJobs(activeJobs.decrementAndGet());
            logger.log(Level.WARNING, "Worker pool rejected job {0}; it will be recovered as stale", job.id());
        }
    }

    private void run(Job job) {
        try {
            jobQueue.completeJob(job.id(), executor.execute(job));
        } catch (Exception e) {
            logger.log(Level.WARNING, "Job {0} ({1}) failed: {2}",
                    new Object[]{job.id(), job.jobType().wireName(), e.getMessage()});
            try {
                jobQueue.failJob(job.id(), e, job.maxAttempts());
            } catch (RuntimeException storeFailure) {
                logger.log(Level.SEVERE, "Failed to record failure of job " + job.id(), storeFailure);
            }
        } finally {
            metrics.recordActiveJobs(activeJobs.decrementAndGet());
        }
    }

    /**
     * Stops claiming jobs and drains in-flight ones, forcing shutdown after the drain timeout.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        stopSignal.countDown();
        if (pollThread == null) {
            return;
        }
        pollThread.shutdown();
        workers.shutdown();
        try {
            pollThread.awaitTermination(5, TimeUnit.SECONDS);
            int inFlight = activeJobs.get();
            if (inFlight > 0) {
                logger.log(Level.INFO, "Waiting for {0} active jobs to complete", inFlight);
            }
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown with {0} active jobs",
                        activeJobs.get());
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Job worker stopped");
    }

    /**
     * Builder for {@link JobWorker}.
     */
    public static final class Builder {
        private JobQueue jobQueue;
        private JobExecutor executor;
        private Set<JobType> jobTypes;
        private int maxConcurrent = 5;
        private long pollIntervalMs = 5000;
        private long drainTimeoutMs = 30_000;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder jobQueue(JobQueue jobQueue) {
            this.jobQueue = jobQueue;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder executor(JobExecutor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Restricts the worker to these job types. Optional; defaults to all types.
         */
        public Builder jobTypes(Set<JobType> jobTypes) {
            this.jobTypes = jobTypes;
            return this;
        }

        /**
         * Optional. Defaults to {@code 5}. Must be &gt; 0.
         */
        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        /**
         * Sleep between polls when the queue is empty. Optional. Defaults to {@code 5000}.
         */
        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        /**
         * Optional. Defaults to {@code 30000}.
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public JobWorker build() {
            return new JobWorker(this);
        }
    }
}
