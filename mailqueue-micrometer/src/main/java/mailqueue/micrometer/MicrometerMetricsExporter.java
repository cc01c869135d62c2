package mailqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import mailqueue.model.JobStats;
import mailqueue.model.JobStatus;
import mailqueue.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mailqueue.jobs.enqueued}, {@code .claimed}, {@code .completed}</li>
 *   <li>{@code mailqueue.jobs.retried}: failed attempts that were rescheduled</li>
 *   <li>{@code mailqueue.jobs.dead}: jobs out of attempts</li>
 *   <li>{@code mailqueue.jobs.recovered}: stale processing jobs reset to pending</li>
 *   <li>{@code mailqueue.jobs.cleaned}: completed jobs deleted by retention cleanup</li>
 *   <li>{@code mailqueue.webhook.notifications} tagged {@code outcome=accepted|rejected}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code mailqueue.jobs.active}: jobs executing on this worker</li>
 *   <li>{@code mailqueue.queue.depth} tagged {@code status}: last sampled queue depth</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter claimed;
  private final Counter completed;
  private final Counter retried;
  private final Counter dead;
  private final Counter recovered;
  private final Counter cleaned;
  private final Counter webhookAccepted;
  private final Counter webhookRejected;
  private final List<Meter> meters = new ArrayList<>();

  private final AtomicInteger activeJobs = new AtomicInteger();
  private final Map<JobStatus, AtomicLong> depths = new EnumMap<>(JobStatus.class);
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "mailqueue"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mailqueue");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "crm.mailqueue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = counter(namePrefix + ".jobs.enqueued", "Jobs added to the queue");
    this.claimed = counter(namePrefix + ".jobs.claimed", "Jobs claimed by a worker");
    this.completed = counter(namePrefix + ".jobs.completed", "Jobs completed successfully");
    this.retried = counter(namePrefix + ".jobs.retried", "Failed attempts rescheduled with backoff");
    this.dead = counter(namePrefix + ".jobs.dead", "Jobs moved to dead");
    this.recovered = counter(namePrefix + ".jobs.recovered", "Stale processing jobs reset to pending");
    this.cleaned = counter(namePrefix + ".jobs.cleaned", "Completed jobs removed by cleanup");
    this.webhookAccepted = register(Counter.builder(namePrefix + ".webhook.notifications")
        .tag("outcome", "accepted")
        .description("Webhook notifications turned into jobs")
        .register(registry));
    this.webhookRejected = register(Counter.builder(namePrefix + ".webhook.notifications")
        .tag("outcome", "rejected")
        .description("Webhook notifications rejected")
        .register(registry));

    register(Gauge.builder(namePrefix + ".jobs.active", activeJobs, AtomicInteger::get)
        .description("Jobs executing on this worker")
        .register(registry));
    for (JobStatus status : JobStatus.values()) {
      AtomicLong depth = new AtomicLong();
      depths.put(status, depth);
      register(Gauge.builder(namePrefix + ".queue.depth", depth, AtomicLong::get)
          .tag("status", status.code())
          .register(registry));
    }
  }

  private Counter counter(String name, String description) {
    return register(Counter.builder(name).description(description).register(registry));
  }

  private <M extends Meter> M register(M meter) {
    meters.add(meter);
    return meter;
  }

  @Override
  public void incrementJobsEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementJobsClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementJobsCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementJobsRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementJobsDead() {
    if (closed) return;
    dead.increment();
  }

  @Override
  public void addJobsRecovered(int count) {
    if (closed || count <= 0) return;
    recovered.increment(count);
  }

  @Override
  public void addJobsCleaned(int count) {
    if (closed || count <= 0) return;
    cleaned.increment(count);
  }

  @Override
  public void incrementWebhookAccepted() {
    if (closed) return;
    webhookAccepted.increment();
  }

  @Override
  public void incrementWebhookRejected() {
    if (closed) return;
    webhookRejected.increment();
  }

  @Override
  public void recordActiveJobs(int activeJobs) {
    if (closed) return;
    this.activeJobs.set(activeJobs);
  }

  @Override
  public void recordQueueDepths(JobStats stats) {
    if (closed) return;
    depths.get(JobStatus.PENDING).set(stats.pending());
    depths.get(JobStatus.PROCESSING).set(stats.processing());
    depths.get(JobStatus.COMPLETED).set(stats.completed());
    depths.get(JobStatus.FAILED).set(stats.failed());
    depths.get(JobStatus.DEAD).set(stats.dead());
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
