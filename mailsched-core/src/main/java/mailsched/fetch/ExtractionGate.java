package mailsched.fetch;

import mailsched.model.ScheduleEvent;
import mailsched.spi.EventExtractor;
import mailsched.spi.ExtractionException;
import mailsched.spi.MetricsExporter;
import mailsched.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Guards an {@link EventExtractor} with its own concurrency cap, a per-call deadline and
 * bounded retry.
 *
 * <p>The cap is independent of the number of fetch workers: at most
 * {@code maxConcurrency} extraction calls are outstanding at any time, including calls
 * that exceeded their deadline and are still winding down. When every attempt on a
 * batch fails, each of its messages is tried once on its own, and only the messages that
 * still fail degrade to {@link ScheduleEvent.NoEvent}.
 */
public final class ExtractionGate implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExtractionGate.class.getName());

  private final EventExtractor extractor;
  private final Semaphore permits;
  private final Duration callTimeout;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final ExecutorService executor;

  public ExtractionGate(EventExtractor extractor, int maxConcurrency, Duration callTimeout,
      int maxAttempts, RetryPolicy retryPolicy, MetricsExporter metrics) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("callTimeout must be > 0");
    }
    this.permits = new Semaphore(maxConcurrency, true);
    this.maxAttempts = maxAttempts;
    this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("mailsched-extract-"));
  }

  /**
   * Extracts one event per body, in order.
   *
   * @throws InterruptedException if the calling worker is interrupted while waiting
   */
  public List<ScheduleEvent> extract(List<String> bodies) throws InterruptedException {
    if (bodies.isEmpty()) {
      return List.of();
    }
    List<String> input = List.copyOf(bodies);
    RuntimeException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return callOnce(input);
      } catch (ExtractionException e) {
        last = e;
        logger.log(Level.FINE, "Extraction attempt {0}/{1} failed: {2}",
            new Object[]{attempt, maxAttempts, e.getMessage()});
        if (attempt < maxAttempts) {
          TimeUnit.MILLISECONDS.sleep(retryPolicy.delayAfter(attempt).toMillis());
        }
      }
    }
    if (input.size() == 1) {
      metrics.incrementExtractionFailures(1);
      logger.log(Level.WARNING, "Extraction failed after " + maxAttempts + " attempts; message degrades to no event",
          last);
      return List.of(degraded(last));
    }
    logger.log(Level.FINE, "Batch of {0} failed {1} times; extracting messages one by one",
        new Object[]{input.size(), maxAttempts});
    return extractEach(input);
  }

  private List<ScheduleEvent> extractEach(List<String> input) throws InterruptedException {
    List<ScheduleEvent> events = new ArrayList<>(input.size());
    int failed = 0;
    for (String body : input) {
      try {
        events.add(callOnce(List.of(body)).get(0));
      } catch (ExtractionException e) {
        failed++;
        logger.log(Level.WARNING, "Extraction of a single message failed; it degrades to no event", e);
        events.add(degraded(e));
      }
    }
    if (failed > 0) {
      metrics.incrementExtractionFailures(failed);
    }
    return events;
  }

  private static ScheduleEvent degraded(RuntimeException cause) {
    return ScheduleEvent.none("extraction failed: " + (cause == null ? "unknown" : cause.getMessage()));
  }

  private List<ScheduleEvent> callOnce(List<String> input) throws InterruptedException {
    permits.acquire();
    // Whoever flips this first owns the permit release: the task, or a cancel that won the race.
    AtomicBoolean claimed = new AtomicBoolean();
    Future<List<ScheduleEvent>> future;
    try {
      future = executor.submit(() -> {
        if (!claimed.compareAndSet(false, true)) {
          return List.of();
        }
        try {
          return extractor.extract(input);
        } finally {
          permits.release();
        }
      });
    } catch (RejectedExecutionException e) {
      permits.release();
      throw new ExtractionException("Extraction gate is closed", e);
    }
    List<ScheduleEvent> events;
    try {
      events = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      cancel(future, claimed);
      throw new ExtractionException("Extraction exceeded " + callTimeout, e);
    } catch (InterruptedException e) {
      cancel(future, claimed);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Error error) {
        throw error;
      }
      throw new ExtractionException("Extractor failed: " + cause.getMessage(), cause);
    }
    if (events == null || events.size() != input.size()) {
      throw new ExtractionException("Extractor returned " + (events == null ? "null" : events.size())
          + " events for " + input.size() + " messages");
    }
    List<ScheduleEvent> checked = new ArrayList<>(events.size());
    for (ScheduleEvent event : events) {
      checked.add(event == null ? ScheduleEvent.NONE : event);
    }
    return checked;
  }

  private void cancel(Future<?> future, AtomicBoolean claimed) {
    future.cancel(true);
    if (claimed.compareAndSet(false, true)) {
      permits.release();
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
