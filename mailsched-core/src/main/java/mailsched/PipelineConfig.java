package mailsched;

import java.time.Duration;

/**
 * Tunables of a {@link MailSchedulePipeline}. Validation happens when the pipeline is built.
 */
public final class PipelineConfig {
  private int concurrency = 10;
  private int extractionConcurrency = 4;
  private int batchSize = 5;

  private Duration dedupRetention = Duration.ofDays(7);
  private int dedupMaxPerIdentity = 10_000;
  private long dedupEvictionIntervalMs = 3_600_000L;

  private Duration callTimeout = Duration.ofSeconds(30);
  private int maxFetchAttempts = 3;
  private int maxExtractionAttempts = 2;
  private long retryBaseDelayMs = 200L;
  private long retryMaxDelayMs = 60_000L;

  private int slotCapacity = 40;
  private int searchWeeks = 2;

  private boolean runSchedulerEnabled = true;
  private long runIntervalMs = 300_000L;
  private long drainTimeoutMs = 5000L;

  public int getConcurrency() {
    return concurrency;
  }

  public PipelineConfig setConcurrency(int concurrency) {
    this.concurrency = concurrency;
    return this;
  }

  public int getExtractionConcurrency() {
    return extractionConcurrency;
  }

  public PipelineConfig setExtractionConcurrency(int extractionConcurrency) {
    this.extractionConcurrency = extractionConcurrency;
    return this;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public PipelineConfig setBatchSize(int batchSize) {
    this.batchSize = batchSize;
    return this;
  }

  public Duration getDedupRetention() {
    return dedupRetention;
  }

  public PipelineConfig setDedupRetention(Duration dedupRetention) {
    this.dedupRetention = dedupRetention;
    return this;
  }

  public int getDedupMaxPerIdentity() {
    return dedupMaxPerIdentity;
  }

  public PipelineConfig setDedupMaxPerIdentity(int dedupMaxPerIdentity) {
    this.dedupMaxPerIdentity = dedupMaxPerIdentity;
    return this;
  }

  public long getDedupEvictionIntervalMs() {
    return dedupEvictionIntervalMs;
  }

  public PipelineConfig setDedupEvictionIntervalMs(long dedupEvictionIntervalMs) {
    this.dedupEvictionIntervalMs = dedupEvictionIntervalMs;
    return this;
  }

  public Duration getCallTimeout() {
    return callTimeout;
  }

  public PipelineConfig setCallTimeout(Duration callTimeout) {
    this.callTimeout = callTimeout;
    return this;
  }

  public int getMaxFetchAttempts() {
    return maxFetchAttempts;
  }

  public PipelineConfig setMaxFetchAttempts(int maxFetchAttempts) {
    this.maxFetchAttempts = maxFetchAttempts;
    return this;
  }

  public int getMaxExtractionAttempts() {
    return maxExtractionAttempts;
  }

  public PipelineConfig setMaxExtractionAttempts(int maxExtractionAttempts) {
    this.maxExtractionAttempts = maxExtractionAttempts;
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public PipelineConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public long getRetryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public PipelineConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
    this.retryMaxDelayMs = retryMaxDelayMs;
    return this;
  }

  public int getSlotCapacity() {
    return slotCapacity;
  }

  public PipelineConfig setSlotCapacity(int slotCapacity) {
    this.slotCapacity = slotCapacity;
    return this;
  }

  public int getSearchWeeks() {
    return searchWeeks;
  }

  public PipelineConfig setSearchWeeks(int searchWeeks) {
    this.searchWeeks = searchWeeks;
    return this;
  }

  public boolean isRunSchedulerEnabled() {
    return runSchedulerEnabled;
  }

  public PipelineConfig setRunSchedulerEnabled(boolean runSchedulerEnabled) {
    this.runSchedulerEnabled = runSchedulerEnabled;
    return this;
  }

  public long getRunIntervalMs() {
    return runIntervalMs;
  }

  public PipelineConfig setRunIntervalMs(long runIntervalMs) {
    this.runIntervalMs = runIntervalMs;
    return this;
  }

  public long getDrainTimeoutMs() {
    return drainTimeoutMs;
  }

  public PipelineConfig setDrainTimeoutMs(long drainTimeoutMs) {
    this.drainTimeoutMs = drainTimeoutMs;
    return this;
  }
}
