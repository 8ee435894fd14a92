package mailsched.poller;

import mailsched.dedup.DeduplicationCache;
import mailsched.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically evicts fingerprints outside the cache's retention policy so that a
 * long-running process holds bounded memory even for identities that stop receiving mail.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()}
 * are synchronized.
 */
public final class DedupEvictionScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DedupEvictionScheduler.class.getName());

  private final DeduplicationCache cache;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> evictTask;
  private volatile boolean closed;

  private DedupEvictionScheduler(Builder builder) {
    this.cache = Objects.requireNonNull(builder.cache, "cache");
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the eviction loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DedupEvictionScheduler has been closed");
    }
    if (evictTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mailsched-dedup-evict-"));
    evictTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs a single eviction pass. May be invoked directly.
   *
   * @return number of fingerprints evicted
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      int removed = cache.evictExpired();
      if (removed > 0) {
        logger.log(Level.FINE, "Evicted {0} expired fingerprints; {1} retained",
            new Object[]{removed, cache.size()});
      }
      return removed;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Dedup eviction pass failed", e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (evictTask != null) {
      evictTask.cancel(false);
      evictTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link DedupEvictionScheduler}. */
  public static final class Builder {
    private DeduplicationCache cache;
    private long intervalSeconds = 3600;

    private Builder() {}

    /**
     * Sets the cache to evict from. <b>Required.</b>
     */
    public Builder cache(DeduplicationCache cache) {
      this.cache = cache;
      return this;
    }

    /**
     * Sets the delay between eviction passes. Optional, defaults to one hour.
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public DedupEvictionScheduler build() {
      return new DedupEvictionScheduler(this);
    }
  }
}
