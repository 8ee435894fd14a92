package mailsched.spring.boot;

import mailsched.PipelineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the reconciliation pipeline.
 *
 * @see MailScheduleAutoConfiguration
 */
@ConfigurationProperties(prefix = "mailsched")
public class MailScheduleProperties {

    /**
     * Prefix prepended to every schedule table name. Empty uses the plain names.
     */
    private String tablePrefix = "";

    /**
     * Mailboxes processed concurrently within one run.
     */
    private int concurrency = 10;

    /**
     * Messages listed and marked read per mailbox call.
     */
    private int batchSize = 5;

    /**
     * Timeout of a single mailbox or completion call.
     */
    private Duration callTimeout = Duration.ofSeconds(30);

    /**
     * Maximum attempts of a mailbox fetch before the identity is requeued.
     */
    private int maxFetchAttempts = 3;

    private final Dedup dedup = new Dedup();
    private final Extraction extraction = new Extraction();
    private final Retry retry = new Retry();
    private final Allocation allocation = new Allocation();
    private final Scheduler scheduler = new Scheduler();
    private final Metrics metrics = new Metrics();

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public int getMaxFetchAttempts() {
        return maxFetchAttempts;
    }

    public void setMaxFetchAttempts(int maxFetchAttempts) {
        this.maxFetchAttempts = maxFetchAttempts;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public Retry getRetry() {
        return retry;
    }

    public Allocation getAllocation() {
        return allocation;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Maps the bound properties onto a fresh {@link PipelineConfig}.
     */
    public PipelineConfig toPipelineConfig() {
        return new PipelineConfig()
            .setConcurrency(concurrency)
            .setBatchSize(batchSize)
            .setCallTimeout(callTimeout)
            .setMaxFetchAttempts(maxFetchAttempts)
            .setExtractionConcurrency(extraction.getConcurrency())
            .setMaxExtractionAttempts(extraction.getMaxAttempts())
            .setDedupRetention(dedup.getRetention())
            .setDedupMaxPerIdentity(dedup.getMaxPerIdentity())
            .setDedupEvictionIntervalMs(dedup.getEvictionInterval().toMillis())
            .setRetryBaseDelayMs(retry.getBaseDelayMs())
            .setRetryMaxDelayMs(retry.getMaxDelayMs())
            .setSlotCapacity(allocation.getSlotCapacity())
            .setSearchWeeks(allocation.getSearchWeeks())
            .setRunSchedulerEnabled(scheduler.isEnabled())
            .setRunIntervalMs(scheduler.getInterval().toMillis())
            .setDrainTimeoutMs(scheduler.getDrainTimeoutMs());
    }

    public static class Dedup {
        /**
         * How long a processed message fingerprint is remembered.
         */
        private Duration retention = Duration.ofDays(7);
        private int maxPerIdentity = 10_000;
        private Duration evictionInterval = Duration.ofHours(1);

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getMaxPerIdentity() {
            return maxPerIdentity;
        }

        public void setMaxPerIdentity(int maxPerIdentity) {
            this.maxPerIdentity = maxPerIdentity;
        }

        public Duration getEvictionInterval() {
            return evictionInterval;
        }

        public void setEvictionInterval(Duration evictionInterval) {
            this.evictionInterval = evictionInterval;
        }
    }

    public static class Extraction {
        /**
         * Completion calls allowed in flight across all mailboxes.
         */
        private int concurrency = 4;
        private int maxAttempts = 2;
        /**
         * Message bodies longer than this are truncated before prompting.
         */
        private int maxBodyChars = 8000;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getMaxBodyChars() {
            return maxBodyChars;
        }

        public void setMaxBodyChars(int maxBodyChars) {
            this.maxBodyChars = maxBodyChars;
        }
    }

    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 60_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Allocation {
        /**
         * Students per rescheduled class before another slot is used.
         */
        private int slotCapacity = 40;
        private int searchWeeks = 2;

        public int getSlotCapacity() {
            return slotCapacity;
        }

        public void setSlotCapacity(int slotCapacity) {
            this.slotCapacity = slotCapacity;
        }

        public int getSearchWeeks() {
            return searchWeeks;
        }

        public void setSearchWeeks(int searchWeeks) {
            this.searchWeeks = searchWeeks;
        }
    }

    public static class Scheduler {
        /**
         * Whether runs over the student directory are started periodically.
         */
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
        private long drainTimeoutMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "mailsched";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
