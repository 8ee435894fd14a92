package mailsched.fetch;

import mailsched.Fingerprint;
import mailsched.Identity;
import mailsched.RawMessage;
import mailsched.dedup.DeduplicationCache;
import mailsched.model.ScheduleEvent;
import mailsched.queue.IdentityPriorityQueue;
import mailsched.reconcile.Outcome;
import mailsched.reconcile.ReconciliationEngine;
import mailsched.spi.EventExtractor;
import mailsched.spi.MailboxConnection;
import mailsched.spi.MessageSource;
import mailsched.spi.MetricsExporter;
import mailsched.spi.PersistenceUnavailableException;
import mailsched.spi.TransientFetchException;
import mailsched.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the fetch, deduplicate, extract and reconcile pipeline over a set of identities
 * with exactly {@code concurrency} workers, so at most that many mailbox connections are
 * open at once.
 *
 * <p>A run started from a plain collection first lists every mailbox once, spread over
 * the same workers, and queues each identity with its number of not yet seen messages;
 * empty mailboxes succeed without being queued. Each worker then pops the highest-priority identity, lists its unread messages on a
 * short-lived connection, claims unseen fingerprints oldest first, extracts them in
 * batches of {@code batchSize} through an {@link ExtractionGate}, reconciles every event
 * in fetch order and finally marks the processed messages read. A run ends when the
 * queue is empty and no worker is busy.
 *
 * <p>A failing mailbox never affects other identities: the identity is re-queued with
 * backoff and reported {@link IdentityOutcome#FAILED} once {@code maxFetchAttempts} is
 * reached. An unavailable store halts the run; identities not finished by then are
 * reported {@link IdentityOutcome#ABORTED}.
 *
 * <p>Create instances via {@link #builder()}. One run may be active at a time.
 *
 * @see BoundedFetchScheduler.Builder
 */
public final class BoundedFetchScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BoundedFetchScheduler.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final MessageSource messageSource;
  private final DeduplicationCache dedupCache;
  private final ReconciliationEngine engine;
  private final ExtractionGate extractionGate;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final int concurrency;
  private final int batchSize;
  private final int maxFetchAttempts;
  private final Duration callTimeout;
  private final long drainTimeoutMs;
  private final ExecutorService io;

  private Run active;
  private boolean closed;

  private BoundedFetchScheduler(Builder builder) {
    this.messageSource = Objects.requireNonNull(builder.messageSource, "messageSource");
    this.dedupCache = Objects.requireNonNull(builder.dedupCache, "dedupCache");
    this.engine = Objects.requireNonNull(builder.engine, "engine");
    Objects.requireNonNull(builder.extractor, "extractor");
    this.callTimeout = Objects.requireNonNull(builder.callTimeout, "callTimeout");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(Duration.ofMillis(200), Duration.ofSeconds(60));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (builder.maxFetchAttempts < 1) {
      throw new IllegalArgumentException("maxFetchAttempts must be >= 1");
    }
    this.concurrency = builder.concurrency;
    this.batchSize = builder.batchSize;
    this.maxFetchAttempts = builder.maxFetchAttempts;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.extractionGate = new ExtractionGate(builder.extractor, builder.extractionConcurrency,
        callTimeout, builder.maxExtractionAttempts, retryPolicy, metrics);
    this.io = Executors.newCachedThreadPool(new DaemonThreadFactory("mailsched-io-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a run over {@code identities}. Each mailbox is listed once up front and the
   * identity queued with its count of unseen messages, so fuller mailboxes go first; ties
   * keep the given order. An identity whose listing fails is queued with priority 1 and
   * retried by the normal fetch path.
   *
   * @throws IllegalStateException if a run is already active or the scheduler is closed
   */
  public synchronized RunHandle start(Collection<Identity> identities) {
    checkStartable();
    Run run = new Run(new LinkedHashSet<>(identities));
    active = run;
    run.launch();
    return run;
  }

  /**
   * Starts a run with known scores (number of pending messages); higher scores are
   * processed first. No mailbox is listed ahead of the run.
   *
   * @throws IllegalStateException if a run is already active or the scheduler is closed
   */
  public synchronized RunHandle start(Map<Identity, Long> pendingCounts) {
    checkStartable();
    Run run = new Run(Set.of());
    pendingCounts.forEach((identity, score) -> run.enqueue(identity, Math.max(1L, score)));
    active = run;
    run.launch();
    return run;
  }

  private void checkStartable() {
    if (closed) {
      throw new IllegalStateException("BoundedFetchScheduler has been closed");
    }
    if (active != null && !active.isDone()) {
      throw new IllegalStateException("A run is already active");
    }
  }

  /**
   * Runs to completion and returns the report.
   */
  public RunReport runOnce(Collection<Identity> identities) throws InterruptedException {
    return start(identities).await();
  }

  /**
   * Cancels any active run, waits up to the drain timeout for it to stop, then releases
   * the worker pools.
   */
  @Override
  public void close() {
    Run run;
    synchronized (this) {
      closed = true;
      run = active;
    }
    if (run != null && !run.isDone()) {
      run.cancel();
      try {
        run.await(drainTimeoutMs, TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown of active run");
        run.workers.shutdownNow();
      } catch (InterruptedException e) {
        run.workers.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    extractionGate.close();
    io.shutdownNow();
  }

  private <T> T awaitCall(Callable<T> call) throws ExecutionException, TimeoutException, InterruptedException {
    Future<T> future = io.submit(call);
    try {
      return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  /** What became of one reconciled message. */
  private enum Disposition {
    /** Applied or found already applied; may be marked read. */
    DONE,
    /** Not applied; left unread for a later run. */
    SKIPPED,
    /** Not applied and the run must stop. */
    HALT
  }

  /** One run: its own queue, workers and counters. */
  private final class Run implements RunHandle {
    private final IdentityPriorityQueue queue = new IdentityPriorityQueue();
    private final Set<Identity> members = ConcurrentHashMap.newKeySet();

    // Listing ahead of the run; workers wait on the latch before polling the queue.
    private final List<Identity> seedOrder;
    private final ConcurrentLinkedQueue<Identity> seeds;
    private final AtomicInteger seedsLeft;
    private final CountDownLatch seeded;
    private final Map<Identity, List<RawMessage>> prelisted = new ConcurrentHashMap<>();

    // An identity is processed by one worker at a time; guarded by busyLock.
    private final Object busyLock = new Object();
    private final Set<Identity> busy = new HashSet<>();
    private final Map<Identity, Long> deferred = new HashMap<>();
    private final Map<Identity, Duration> retryAfter = new HashMap<>();

    private final Map<Identity, IdentityOutcome> outcomes = new LinkedHashMap<>();
    private final Map<Identity, Integer> fetchFailures = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private final CompletableFuture<RunReport> result = new CompletableFuture<>();
    private final ExecutorService workers =
        Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("mailsched-fetch-"));

    private final AtomicInteger fetched = new AtomicInteger();
    private final AtomicInteger deduplicated = new AtomicInteger();
    private final AtomicInteger extracted = new AtomicInteger();
    private final AtomicInteger drives = new AtomicInteger();
    private final AtomicInteger assignments = new AtomicInteger();
    private final AtomicInteger noSlot = new AtomicInteger();
    private final AtomicInteger duplicates = new AtomicInteger();
    private final AtomicInteger failedMessages = new AtomicInteger();

    private volatile boolean cancelled;
    private volatile boolean halted;

    Run(Set<Identity> toSeed) {
      this.seedOrder = List.copyOf(toSeed);
      this.seeds = new ConcurrentLinkedQueue<>(seedOrder);
      this.seedsLeft = new AtomicInteger(seedOrder.size());
      this.seeded = new CountDownLatch(seedOrder.isEmpty() ? 0 : 1);
      members.addAll(seedOrder);
    }

    void enqueue(Identity identity, long score) {
      members.add(identity);
      queue.updateScore(identity, score);
    }

    void launch() {
      logger.log(Level.INFO, "Starting run over {0} identities with {1} workers",
          new Object[]{members.size(), concurrency});
      liveWorkers.set(concurrency);
      for (int i = 0; i < concurrency; i++) {
        workers.submit(this::workerLoop);
      }
      workers.shutdown();
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public void signal(Identity identity, int newMessages) {
      if (newMessages <= 0 || isDone() || cancelled || halted) {
        return;
      }
      synchronized (busyLock) {
        if (busy.contains(identity)) {
          members.add(identity);
          deferred.merge(identity, (long) newMessages, Long::sum);
          return;
        }
        enqueue(identity, newMessages);
      }
    }

    @Override
    public boolean isDone() {
      return result.isDone();
    }

    @Override
    public RunReport await() throws InterruptedException {
      try {
        return result.get();
      } catch (ExecutionException e) {
        throw new IllegalStateException("Run failed", e.getCause());
      }
    }

    @Override
    public RunReport await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
      try {
        return result.get(timeout, unit);
      } catch (ExecutionException e) {
        throw new IllegalStateException("Run failed", e.getCause());
      }
    }

    private boolean stopping() {
      return cancelled || halted || Thread.currentThread().isInterrupted();
    }

    private void workerLoop() {
      try {
        if (!seed()) {
          return;
        }
        while (!stopping()) {
          Identity identity;
          try {
            identity = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            break;
          }
          if (identity == null) {
            if (inFlight.get() == 0 && queue.isEmpty()) {
              break;
            }
            continue;
          }
          inFlight.incrementAndGet();
          if (!acquire(identity)) {
            inFlight.decrementAndGet();
            continue;
          }
          metrics.recordQueueState(queue.size(), inFlight.get());
          try {
            process(identity);
          } catch (Throwable t) {
            logger.log(Level.SEVERE, "Worker error while processing " + identity, t);
            finish(identity, IdentityOutcome.FAILED);
          } finally {
            release(identity);
            inFlight.decrementAndGet();
            metrics.recordQueueState(queue.size(), inFlight.get());
          }
        }
      } finally {
        if (liveWorkers.decrementAndGet() == 0) {
          complete();
        }
      }
    }

    /**
     * Lists pending seed mailboxes until none is left, then waits for the other workers to
     * finish theirs. Returns {@code false} if the run stopped meanwhile.
     */
    private boolean seed() {
      Identity identity;
      while (!stopping() && (identity = seeds.poll()) != null) {
        try {
          prelist(identity);
        } finally {
          if (seedsLeft.decrementAndGet() == 0) {
            queueSeeded();
          }
        }
      }
      try {
        while (!seeded.await(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
          if (stopping()) {
            return false;
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
      return true;
    }

    private void prelist(Identity identity) {
      try {
        List<RawMessage> listed = awaitCall(() -> {
          try (MailboxConnection connection = messageSource.connect(identity)) {
            return connection.listUnread();
          }
        });
        prelisted.put(identity, listed == null ? List.of() : listed);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (TimeoutException | ExecutionException e) {
        Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
        if (cause instanceof Error error) {
          throw error;
        }
        logger.log(Level.FINE, "Could not list {0} ahead of the run: {1}",
            new Object[]{identity, String.valueOf(cause)});
      }
    }

    private void queueSeeded() {
      int empty = 0;
      for (Identity identity : seedOrder) {
        List<RawMessage> listed = prelisted.get(identity);
        if (listed == null) {
          queue.updateScore(identity, 1L);
        } else if (listed.isEmpty()) {
          prelisted.remove(identity);
          finish(identity, IdentityOutcome.SUCCEEDED);
          empty++;
        } else {
          long unseen = 0;
          for (RawMessage message : listed) {
            if (!dedupCache.seen(identity, message.fingerprint())) {
              unseen++;
            }
          }
          queue.updateScore(identity, Math.max(1L, unseen));
        }
      }
      logger.log(Level.FINE, "Listed {0} mailboxes, {1} empty", new Object[]{seedOrder.size(), empty});
      seeded.countDown();
    }

    /** Claims the identity for this worker, or hands it to the worker already on it. */
    private boolean acquire(Identity identity) {
      synchronized (busyLock) {
        if (busy.add(identity)) {
          return true;
        }
        deferred.merge(identity, 1L, Long::sum);
        return false;
      }
    }

    /**
     * Requeues a pending fetch retry or signals deferred while the identity was busy.
     * Runs before the in-flight count drops, so idle workers do not see an empty run.
     */
    private void release(Identity identity) {
      synchronized (busyLock) {
        busy.remove(identity);
        Long more = deferred.remove(identity);
        Duration delay = retryAfter.remove(identity);
        if (delay != null) {
          queue.requeue(identity, 1L + (more == null ? 0L : more), delay);
        } else if (more != null && !stopping()) {
          queue.updateScore(identity, more);
        }
      }
    }

    private void process(Identity identity) {
      List<RawMessage> listed = prelisted.remove(identity);
      if (listed == null) {
        try {
          listed = awaitCall(() -> {
            try (MailboxConnection connection = messageSource.connect(identity)) {
              return connection.listUnread();
            }
          });
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        } catch (TimeoutException e) {
          onFetchFailure(identity, new TransientFetchException("Fetch exceeded " + callTimeout, e));
          return;
        } catch (ExecutionException e) {
          if (e.getCause() instanceof Error error) {
            throw error;
          }
          onFetchFailure(identity, e.getCause());
          return;
        }
      }
      fetchFailures.remove(identity);

      List<RawMessage> sorted = new ArrayList<>(listed == null ? List.of() : listed);
      sorted.sort(Comparator.comparing(RawMessage::receivedAt));
      List<RawMessage> claimed = new ArrayList<>();
      for (RawMessage message : sorted) {
        if (dedupCache.markIfAbsent(identity, message.fingerprint())) {
          claimed.add(message);
        }
      }
      int skipped = sorted.size() - claimed.size();
      fetched.addAndGet(sorted.size());
      deduplicated.addAndGet(skipped);
      metrics.incrementFetched(sorted.size());
      metrics.incrementDuplicatesSkipped(skipped);
      logger.log(Level.FINE, "{0}: {1} unread, {2} new", new Object[]{identity, sorted.size(), claimed.size()});

      Set<Fingerprint> processed = new LinkedHashSet<>();
      int next = 0;
      try {
        while (next < claimed.size()) {
          if (stopping()) {
            break;
          }
          List<RawMessage> batch = claimed.subList(next, Math.min(next + batchSize, claimed.size()));
          List<String> bodies = new ArrayList<>(batch.size());
          for (RawMessage message : batch) {
            bodies.add(message.body());
          }
          List<ScheduleEvent> events = extractionGate.extract(bodies);
          extracted.addAndGet(batch.size());
          metrics.incrementExtracted(batch.size());
          for (int i = 0; i < batch.size(); i++) {
            RawMessage message = batch.get(i);
            Disposition disposition = reconcile(identity, message, events.get(i));
            if (disposition == Disposition.HALT) {
              break;
            }
            if (disposition == Disposition.DONE) {
              processed.add(message.fingerprint());
            }
            next++;
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }

      for (int i = next; i < claimed.size(); i++) {
        dedupCache.forget(identity, claimed.get(i).fingerprint());
      }
      markRead(identity, processed);
      if (next < claimed.size()) {
        finish(identity, halted ? IdentityOutcome.ABORTED : IdentityOutcome.CANCELLED);
      } else {
        finish(identity, IdentityOutcome.SUCCEEDED);
      }
    }

    private Disposition reconcile(Identity identity, RawMessage message, ScheduleEvent event)
        throws InterruptedException {
      Outcome outcome;
      try {
        outcome = awaitCall(() -> engine.reconcile(identity, event));
      } catch (TimeoutException e) {
        // The unit may still commit; natural keys absorb a replay, so keep the claim.
        logger.log(Level.WARNING, "Reconciliation of " + message + " exceeded " + callTimeout);
        failedMessages.incrementAndGet();
        return Disposition.SKIPPED;
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof PersistenceUnavailableException) {
          if (!halted) {
            halted = true;
            logger.log(Level.SEVERE, "Store unavailable; halting run", cause);
          }
          dedupCache.forget(identity, message.fingerprint());
          return Disposition.HALT;
        }
        if (cause instanceof Error error) {
          throw error;
        }
        logger.log(Level.WARNING, "Reconciliation of " + message + " failed", cause);
        dedupCache.forget(identity, message.fingerprint());
        failedMessages.incrementAndGet();
        return Disposition.SKIPPED;
      }
      switch (outcome) {
        case CREATED_DRIVE -> drives.incrementAndGet();
        case ASSIGNED -> assignments.incrementAndGet();
        case NO_SLOT -> noSlot.incrementAndGet();
        case DUPLICATE -> duplicates.incrementAndGet();
        case FAILED -> {
          failedMessages.incrementAndGet();
          dedupCache.forget(identity, message.fingerprint());
          return Disposition.SKIPPED;
        }
        default -> {
        }
      }
      logger.log(Level.FINE, "{0} -> {1}", new Object[]{message, outcome});
      return Disposition.DONE;
    }

    private void markRead(Identity identity, Set<Fingerprint> processed) {
      if (processed.isEmpty()) {
        return;
      }
      try {
        awaitCall(() -> {
          try (MailboxConnection connection = messageSource.connect(identity)) {
            connection.markRead(processed);
          }
          return null;
        });
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (ExecutionException | TimeoutException e) {
        Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
        logger.log(Level.WARNING, "Failed to mark " + processed.size() + " messages read for " + identity, cause);
      }
    }

    private void onFetchFailure(Identity identity, Throwable failure) {
      metrics.incrementFetchFailures();
      int failures = fetchFailures.merge(identity, 1, Integer::sum);
      if (failures >= maxFetchAttempts) {
        logger.log(Level.WARNING, "Fetch failed " + failures + " times for " + identity + "; giving up", failure);
        finish(identity, IdentityOutcome.FAILED);
        return;
      }
      Duration delay = retryPolicy.delayAfter(failures);
      logger.log(Level.FINE, "Fetch attempt {0} failed for {1}, retrying in {2}: {3}",
          new Object[]{failures, identity, delay, String.valueOf(failure)});
      synchronized (busyLock) {
        retryAfter.put(identity, delay);
      }
    }

    private void finish(Identity identity, IdentityOutcome outcome) {
      synchronized (outcomes) {
        outcomes.remove(identity);
        outcomes.put(identity, outcome);
      }
    }

    private void complete() {
      IdentityOutcome unfinished = halted ? IdentityOutcome.ABORTED : IdentityOutcome.CANCELLED;
      queue.clear();
      Map<Identity, IdentityOutcome> snapshot;
      synchronized (outcomes) {
        for (Identity identity : members) {
          outcomes.putIfAbsent(identity, unfinished);
        }
        snapshot = new LinkedHashMap<>(outcomes);
      }
      RunReport report = new RunReport(snapshot, fetched.get(), deduplicated.get(), extracted.get(),
          drives.get(), assignments.get(), noSlot.get(), duplicates.get(), failedMessages.get());
      metrics.recordQueueState(0, 0);
      logger.log(Level.INFO, "Run finished: {0}", report);
      result.complete(report);
    }
  }

  /** Builder for {@link BoundedFetchScheduler}. */
  public static final class Builder {
    private MessageSource messageSource;
    private DeduplicationCache dedupCache;
    private EventExtractor extractor;
    private ReconciliationEngine engine;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private int concurrency = 10;
    private int extractionConcurrency = 4;
    private int batchSize = 5;
    private int maxFetchAttempts = 3;
    private int maxExtractionAttempts = 2;
    private Duration callTimeout = Duration.ofSeconds(30);
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /** <b>Required.</b> Opens mailbox sessions. */
    public Builder messageSource(MessageSource messageSource) {
      this.messageSource = messageSource;
      return this;
    }

    /** <b>Required.</b> Fingerprints already processed. */
    public Builder dedupCache(DeduplicationCache dedupCache) {
      this.dedupCache = dedupCache;
      return this;
    }

    /** <b>Required.</b> Converts message bodies into events. */
    public Builder extractor(EventExtractor extractor) {
      this.extractor = extractor;
      return this;
    }

    /** <b>Required.</b> Applies events to the store. */
    public Builder engine(ReconciliationEngine engine) {
      this.engine = engine;
      return this;
    }

    /**
     * Optional. Backoff for fetch and extraction retries. Defaults to
     * {@link ExponentialBackoffRetryPolicy} with 200 ms base and 60 s cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Number of workers, hence the maximum number of concurrently open mailbox connections.
     * Optional, defaults to {@code 10}.
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /** Maximum concurrent extraction calls. Optional, defaults to {@code 4}. */
    public Builder extractionConcurrency(int extractionConcurrency) {
      this.extractionConcurrency = extractionConcurrency;
      return this;
    }

    /** Messages per extraction call. Optional, defaults to {@code 5}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Fetch attempts per identity and run before it is reported failed. Defaults to {@code 3}. */
    public Builder maxFetchAttempts(int maxFetchAttempts) {
      this.maxFetchAttempts = maxFetchAttempts;
      return this;
    }

    /** Attempts per extraction batch before it degrades to no events. Defaults to {@code 2}. */
    public Builder maxExtractionAttempts(int maxExtractionAttempts) {
      this.maxExtractionAttempts = maxExtractionAttempts;
      return this;
    }

    /** Deadline for each mailbox, extraction and store call. Defaults to 30 seconds. */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /** Time {@link #close()} waits for an active run to stop. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public BoundedFetchScheduler build() {
      return new BoundedFetchScheduler(this);
    }
  }
}
