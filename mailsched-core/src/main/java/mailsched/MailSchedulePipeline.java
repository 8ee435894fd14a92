package mailsched;

import mailsched.dedup.DeduplicationCache;
import mailsched.dedup.InMemoryDeduplicationCache;
import mailsched.dedup.RetentionPolicy;
import mailsched.fetch.BoundedFetchScheduler;
import mailsched.fetch.ExponentialBackoffRetryPolicy;
import mailsched.fetch.RetryPolicy;
import mailsched.fetch.RunHandle;
import mailsched.fetch.RunReport;
import mailsched.poller.DedupEvictionScheduler;
import mailsched.poller.RunScheduler;
import mailsched.reconcile.ReconciliationEngine;
import mailsched.reconcile.SlotAllocator;
import mailsched.spi.ConnectionProvider;
import mailsched.spi.EventExtractor;
import mailsched.spi.IdentityDirectory;
import mailsched.spi.MessageSource;
import mailsched.spi.MetricsExporter;
import mailsched.spi.NotificationListener;
import mailsched.spi.PersistenceGateway;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the dedup cache, reconciliation engine, bounded fetch
 * scheduler and optional periodic schedulers into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MailSchedulePipeline pipeline = MailSchedulePipeline.builder()
 *     .connectionProvider(connProvider)
 *     .gateway(JdbcPersistenceGateways.detect(dataSource))
 *     .messageSource(imapSource)
 *     .extractor(new PromptedEventExtractor(completionClient))
 *     .directory(new JdbcStudentDirectory(connProvider))
 *     .build()) {
 *   pipeline.start();                       // periodic runs
 *   RunReport report = pipeline.runOnce(students);  // or on demand
 * }
 * }</pre>
 */
public final class MailSchedulePipeline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MailSchedulePipeline.class.getName());

  private final DeduplicationCache dedupCache;
  private final ReconciliationEngine engine;
  private final BoundedFetchScheduler fetchScheduler;
  private final RunScheduler runScheduler;
  private final DedupEvictionScheduler evictionScheduler;
  private final MetricsExporter metrics;

  private MailSchedulePipeline(DeduplicationCache dedupCache, ReconciliationEngine engine,
      BoundedFetchScheduler fetchScheduler, RunScheduler runScheduler,
      DedupEvictionScheduler evictionScheduler, MetricsExporter metrics) {
    this.dedupCache = dedupCache;
    this.engine = engine;
    this.fetchScheduler = fetchScheduler;
    this.runScheduler = runScheduler;
    this.evictionScheduler = evictionScheduler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic run schedule (when a directory was configured) and dedup eviction.
   */
  public void start() {
    if (runScheduler != null) {
      runScheduler.start();
    }
    evictionScheduler.start();
  }

  /** Starts a run over {@code identities} without waiting for it. */
  public RunHandle startRun(Collection<Identity> identities) {
    return fetchScheduler.start(identities);
  }

  /** Runs the pipeline over {@code identities} and waits for the report. */
  public RunReport runOnce(Collection<Identity> identities) throws InterruptedException {
    return fetchScheduler.runOnce(identities);
  }

  public DeduplicationCache dedupCache() {
    return dedupCache;
  }

  public ReconciliationEngine engine() {
    return engine;
  }

  /**
   * Shuts down components in order: run schedule, eviction, fetch scheduler, metrics.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (runScheduler != null) {
      try {
        runScheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      evictionScheduler.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      fetchScheduler.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link MailSchedulePipeline}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private PersistenceGateway gateway;
    private MessageSource messageSource;
    private EventExtractor extractor;
    private IdentityDirectory directory;
    private DeduplicationCache dedupCache;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private PipelineConfig config = new PipelineConfig();
    private Consumer<RunReport> reportListener;
    private final List<NotificationListener> listeners = new ArrayList<>();

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder gateway(PersistenceGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    /** <b>Required.</b> */
    public Builder messageSource(MessageSource messageSource) {
      this.messageSource = messageSource;
      return this;
    }

    /** <b>Required.</b> */
    public Builder extractor(EventExtractor extractor) {
      this.extractor = extractor;
      return this;
    }

    /** Optional. Without a directory there is no periodic run schedule. */
    public Builder directory(IdentityDirectory directory) {
      this.directory = directory;
      return this;
    }

    /** Optional. Defaults to an {@link InMemoryDeduplicationCache} using the configured retention. */
    public Builder dedupCache(DeduplicationCache dedupCache) {
      this.dedupCache = dedupCache;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}; closed with the pipeline if closeable. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to exponential backoff from the configured base and max delay. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder config(PipelineConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    public Builder listener(NotificationListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /** Receives the report of each scheduled run. */
    public Builder reportListener(Consumer<RunReport> reportListener) {
      this.reportListener = reportListener;
      return this;
    }

    public MailSchedulePipeline build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(gateway, "gateway");
      Objects.requireNonNull(messageSource, "messageSource");
      Objects.requireNonNull(extractor, "extractor");
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      DeduplicationCache cache = dedupCache != null
          ? dedupCache
          : new InMemoryDeduplicationCache(
              new RetentionPolicy(config.getDedupRetention(), config.getDedupMaxPerIdentity()), effectiveClock);
      RetryPolicy effectiveRetry = retryPolicy != null
          ? retryPolicy
          : new ExponentialBackoffRetryPolicy(Duration.ofMillis(config.getRetryBaseDelayMs()),
              Duration.ofMillis(config.getRetryMaxDelayMs()));

      ReconciliationEngine engine = ReconciliationEngine.builder()
          .connectionProvider(connectionProvider)
          .gateway(gateway)
          .allocator(new SlotAllocator(config.getSlotCapacity(), config.getSearchWeeks()))
          .metrics(effectiveMetrics)
          .clock(effectiveClock)
          .listeners(listeners)
          .build();

      BoundedFetchScheduler fetchScheduler = BoundedFetchScheduler.builder()
          .messageSource(messageSource)
          .dedupCache(cache)
          .extractor(extractor)
          .engine(engine)
          .retryPolicy(effectiveRetry)
          .metrics(effectiveMetrics)
          .concurrency(config.getConcurrency())
          .extractionConcurrency(config.getExtractionConcurrency())
          .batchSize(config.getBatchSize())
          .maxFetchAttempts(config.getMaxFetchAttempts())
          .maxExtractionAttempts(config.getMaxExtractionAttempts())
          .callTimeout(config.getCallTimeout())
          .drainTimeoutMs(config.getDrainTimeoutMs())
          .build();

      RunScheduler runScheduler = null;
      if (directory != null && config.isRunSchedulerEnabled()) {
        runScheduler = RunScheduler.builder()
            .directory(directory)
            .fetchScheduler(fetchScheduler)
            .intervalMs(config.getRunIntervalMs())
            .reportListener(reportListener)
            .build();
      } else if (directory != null) {
        logger.info("Run scheduler disabled; runs must be triggered explicitly");
      }

      DedupEvictionScheduler evictionScheduler = DedupEvictionScheduler.builder()
          .cache(cache)
          .intervalSeconds(Math.max(1L, config.getDedupEvictionIntervalMs() / 1000L))
          .build();

      return new MailSchedulePipeline(cache, engine, fetchScheduler, runScheduler,
          evictionScheduler, effectiveMetrics);
    }
  }
}
