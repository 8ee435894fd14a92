package mailsched.poller;

import mailsched.Identity;
import mailsched.fetch.BoundedFetchScheduler;
import mailsched.fetch.RunHandle;
import mailsched.fetch.RunReport;
import mailsched.spi.IdentityDirectory;
import mailsched.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically runs the pipeline over every identity listed by an {@link IdentityDirectory}.
 *
 * <p>Runs never overlap: the next run is scheduled {@code intervalMs} after the previous one
 * finished. Create instances via {@link #builder()}. The {@link #start()} and
 * {@link #close()} methods are synchronized.
 *
 * @see RunScheduler.Builder
 */
public final class RunScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RunScheduler.class.getName());

    private final IdentityDirectory directory;
    private final BoundedFetchScheduler fetchScheduler;
    private final long intervalMs;
    private final long initialDelayMs;
    private final Consumer<RunReport> reportListener;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> runTask;
    private volatile RunHandle current;
    private volatile boolean closed;

    private RunScheduler(Builder builder) {
        this.directory = Objects.requireNonNull(builder.directory, "directory");
        this.fetchScheduler = Objects.requireNonNull(builder.fetchScheduler, "fetchScheduler");
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.initialDelayMs < 0L) {
            throw new IllegalArgumentException("initialDelayMs must be >= 0");
        }
        this.intervalMs = builder.intervalMs;
        this.initialDelayMs = builder.initialDelayMs;
        this.reportListener = builder.reportListener != null ? builder.reportListener : report -> { };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the schedule. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RunScheduler has been closed");
        }
        if (runTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mailsched-run-"));
        runTask = scheduler.scheduleWithFixedDelay(this::runOnce, initialDelayMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single run and blocks until it finishes. Called by the schedule, but may
     * also be invoked directly.
     *
     * @return the run's report, or {@code null} if no run took place
     */
    public RunReport runOnce() {
        if (closed) {
            return null;
        }
        try {
            List<Identity> identities = directory.listIdentities();
            if (identities.isEmpty()) {
                logger.fine("No identities to process");
                return null;
            }
            RunHandle handle = fetchScheduler.start(identities);
            current = handle;
            RunReport report = handle.await();
            reportListener.accept(report);
            return report;
        } catch (InterruptedException e) {
            RunHandle handle = current;
            if (handle != null) {
                handle.cancel();
            }
            Thread.currentThread().interrupt();
            return null;
        } catch (IllegalStateException e) {
            logger.log(Level.WARNING, "Skipping scheduled run: {0}", e.getMessage());
            return null;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Scheduled run failed", t);
            return null;
        } finally {
            current = null;
        }
    }

    /**
     * Cancels the schedule and any run in progress, then stops the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (runTask != null) {
            runTask.cancel(false);
            runTask = null;
        }
        RunHandle handle = current;
        if (handle != null) {
            handle.cancel();
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

    /**
     * Builder for {@link RunScheduler}.
     */
    public static final class Builder {
        private IdentityDirectory directory;
        private BoundedFetchScheduler fetchScheduler;
        private long intervalMs = 300_000;
        private long initialDelayMs;
        private Consumer<RunReport> reportListener;

        private Builder() {
        }

        /**
         * <p><b>Required.</b> Lists the identities each run processes.
         */
        public Builder directory(IdentityDirectory directory) {
            this.directory = directory;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder fetchScheduler(BoundedFetchScheduler fetchScheduler) {
            this.fetchScheduler = fetchScheduler;
            return this;
        }

        /**
         * Delay between the end of one run and the start of the next.
         *
         * <p>Optional. Defaults to five minutes. Must be &gt; 0.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Delay before the first run. Optional, defaults to {@code 0}.
         */
        public Builder initialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
            return this;
        }

        /**
         * Receives the report of every completed scheduled run. Optional.
         */
        public Builder reportListener(Consumer<RunReport> reportListener) {
            this.reportListener = reportListener;
            return this;
        }

        public RunScheduler build() {
            return new RunScheduler(this);
        }
    }
}
