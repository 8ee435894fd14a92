package mailsched.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import mailsched.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mailsched.messages.fetched}: messages returned by mailbox listings</li>
 *   <li>{@code mailsched.messages.duplicate}: messages skipped as already seen</li>
 *   <li>{@code mailsched.messages.extracted}: messages handed to the extractor</li>
 *   <li>{@code mailsched.extraction.failures}: messages degraded to no event</li>
 *   <li>{@code mailsched.fetch.failures}: failed fetch attempts</li>
 *   <li>{@code mailsched.drives.created}: company drives inserted</li>
 *   <li>{@code mailsched.assignments.created}: students assigned to rescheduled classes</li>
 *   <li>{@code mailsched.reschedule.noslot}: reschedules without an available slot</li>
 *   <li>{@code mailsched.persistence.conflicts}: units rolled back on a key collision</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code mailsched.queue.depth}: identities waiting in the priority queue</li>
 *   <li>{@code mailsched.workers.inflight}: identities currently being processed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code mailsched.reconcile.duration}: one reconciliation unit of work</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter fetched;
  private final Counter duplicatesSkipped;
  private final Counter extracted;
  private final Counter extractionFailures;
  private final Counter fetchFailures;
  private final Counter drivesCreated;
  private final Counter assignmentsCreated;
  private final Counter noSlot;
  private final Counter conflicts;
  private final Gauge queueDepthGauge;
  private final Gauge inFlightGauge;
  private final Timer reconcileDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "mailsched"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mailsched");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "campus.mailsched"})
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
    this.fetched = Counter.builder(namePrefix + ".messages.fetched")
        .description("Messages returned by mailbox listings")
        .register(registry);
    this.duplicatesSkipped = Counter.builder(namePrefix + ".messages.duplicate")
        .description("Messages skipped because their fingerprint was already seen")
        .register(registry);
    this.extracted = Counter.builder(namePrefix + ".messages.extracted")
        .description("Messages handed to the extractor")
        .register(registry);
    this.extractionFailures = Counter.builder(namePrefix + ".extraction.failures")
        .description("Messages whose extraction failed and degraded to no event")
        .register(registry);
    this.fetchFailures = Counter.builder(namePrefix + ".fetch.failures")
        .description("Failed fetch attempts")
        .register(registry);
    this.drivesCreated = Counter.builder(namePrefix + ".drives.created")
        .description("Company drives inserted")
        .register(registry);
    this.assignmentsCreated = Counter.builder(namePrefix + ".assignments.created")
        .description("Students assigned to rescheduled classes")
        .register(registry);
    this.noSlot = Counter.builder(namePrefix + ".reschedule.noslot")
        .description("Reschedule requests without an available slot")
        .register(registry);
    this.conflicts = Counter.builder(namePrefix + ".persistence.conflicts")
        .description("Units rolled back because an idempotence key already existed")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.inFlightGauge = Gauge.builder(namePrefix + ".workers.inflight", inFlight, AtomicInteger::get)
        .register(registry);
    this.reconcileDuration = Timer.builder(namePrefix + ".reconcile.duration")
        .description("Duration of one reconciliation unit of work")
        .register(registry);
  }

  @Override
  public void incrementFetched(int count) {
    if (closed) return;
    fetched.increment(count);
  }

  @Override
  public void incrementDuplicatesSkipped(int count) {
    if (closed) return;
    duplicatesSkipped.increment(count);
  }

  @Override
  public void incrementExtracted(int count) {
    if (closed) return;
    extracted.increment(count);
  }

  @Override
  public void incrementExtractionFailures(int count) {
    if (closed) return;
    extractionFailures.increment(count);
  }

  @Override
  public void incrementFetchFailures() {
    if (closed) return;
    fetchFailures.increment();
  }

  @Override
  public void incrementDrivesCreated() {
    if (closed) return;
    drivesCreated.increment();
  }

  @Override
  public void incrementAssignmentsCreated() {
    if (closed) return;
    assignmentsCreated.increment();
  }

  @Override
  public void incrementNoSlot() {
    if (closed) return;
    noSlot.increment();
  }

  @Override
  public void incrementConflicts() {
    if (closed) return;
    conflicts.increment();
  }

  @Override
  public void recordQueueState(int queued, int inFlight) {
    if (closed) return;
    this.queueDepth.set(queued);
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordReconcileDurationMs(long durationMs) {
    if (closed) return;
    reconcileDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link mailsched.MailSchedulePipeline#close()} to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(fetched, duplicatesSkipped, extracted, extractionFailures,
        fetchFailures, drivesCreated, assignmentsCreated, noSlot, conflicts,
        queueDepthGauge, inFlightGauge, reconcileDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
