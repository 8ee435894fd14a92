package mailsched.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see mailsched.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages returned by mailbox listings.
     */
    void incrementFetched(int count);

    /**
     * Increments the count of messages skipped because their fingerprint was already seen.
     */
    void incrementDuplicatesSkipped(int count);

    /**
     * Increments the count of messages handed to the extractor.
     */
    void incrementExtracted(int count);

    /**
     * Increments the count of messages whose extraction failed and degraded to no event.
     */
    void incrementExtractionFailures(int count);

    /**
     * Increments the count of failed fetch attempts (each retry counts).
     */
    void incrementFetchFailures();

    void incrementDrivesCreated();

    void incrementAssignmentsCreated();

    /**
     * Increments the count of reschedule requests that found no available slot.
     */
    void incrementNoSlot();

    /**
     * Increments the count of units rolled back because an idempotence key already existed.
     */
    void incrementConflicts();

    /**
     * Records the number of identities waiting in the priority queue and the
     * number currently being processed.
     */
    void recordQueueState(int queued, int inFlight);

    /**
     * Records the duration of one reconciliation unit of work.
     */
    default void recordReconcileDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementFetched(int count) {
        }

        @Override
        public void incrementDuplicatesSkipped(int count) {
        }

        @Override
        public void incrementExtracted(int count) {
        }

        @Override
        public void incrementExtractionFailures(int count) {
        }

        @Override
        public void incrementFetchFailures() {
        }

        @Override
        public void incrementDrivesCreated() {
        }

        @Override
        public void incrementAssignmentsCreated() {
        }

        @Override
        public void incrementNoSlot() {
        }

        @Override
        public void incrementConflicts() {
        }

        @Override
        public void recordQueueState(int queued, int inFlight) {
        }
    }
}
