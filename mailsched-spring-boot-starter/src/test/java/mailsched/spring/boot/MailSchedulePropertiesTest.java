package mailsched.spring.boot;

import mailsched.PipelineConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailSchedulePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(MailScheduleProperties.class);
            assertEquals("", props.getTablePrefix());
            assertEquals(10, props.getConcurrency());
            assertEquals(5, props.getBatchSize());
            assertEquals(Duration.ofSeconds(30), props.getCallTimeout());
            assertEquals(3, props.getMaxFetchAttempts());
            assertEquals(Duration.ofDays(7), props.getDedup().getRetention());
            assertEquals(10_000, props.getDedup().getMaxPerIdentity());
            assertEquals(Duration.ofHours(1), props.getDedup().getEvictionInterval());
            assertEquals(4, props.getExtraction().getConcurrency());
            assertEquals(2, props.getExtraction().getMaxAttempts());
            assertEquals(8000, props.getExtraction().getMaxBodyChars());
            assertEquals(200, props.getRetry().getBaseDelayMs());
            assertEquals(60_000, props.getRetry().getMaxDelayMs());
            assertEquals(40, props.getAllocation().getSlotCapacity());
            assertEquals(2, props.getAllocation().getSearchWeeks());
            assertTrue(props.getScheduler().isEnabled());
            assertEquals(Duration.ofMinutes(5), props.getScheduler().getInterval());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("mailsched", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "mailsched.table-prefix=campus_",
                "mailsched.concurrency=3",
                "mailsched.batch-size=20",
                "mailsched.call-timeout=5s",
                "mailsched.dedup.retention=P1D",
                "mailsched.dedup.max-per-identity=50",
                "mailsched.extraction.concurrency=1",
                "mailsched.allocation.slot-capacity=25",
                "mailsched.allocation.search-weeks=4",
                "mailsched.scheduler.enabled=false",
                "mailsched.scheduler.interval=PT10M",
                "mailsched.metrics.name-prefix=campus.mailsched"
        ).run(ctx -> {
            var props = ctx.getBean(MailScheduleProperties.class);
            assertEquals("campus_", props.getTablePrefix());
            assertEquals(3, props.getConcurrency());
            assertEquals(20, props.getBatchSize());
            assertEquals(Duration.ofSeconds(5), props.getCallTimeout());
            assertEquals(Duration.ofDays(1), props.getDedup().getRetention());
            assertEquals(50, props.getDedup().getMaxPerIdentity());
            assertEquals(1, props.getExtraction().getConcurrency());
            assertEquals(25, props.getAllocation().getSlotCapacity());
            assertEquals(4, props.getAllocation().getSearchWeeks());
            assertFalse(props.getScheduler().isEnabled());
            assertEquals(Duration.ofMinutes(10), props.getScheduler().getInterval());
            assertEquals("campus.mailsched", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void mapsOntoPipelineConfig() {
        runner.withPropertyValues(
                "mailsched.concurrency=3",
                "mailsched.dedup.eviction-interval=PT30M",
                "mailsched.allocation.slot-capacity=25",
                "mailsched.scheduler.enabled=false",
                "mailsched.scheduler.interval=PT10M"
        ).run(ctx -> {
            PipelineConfig config = ctx.getBean(MailScheduleProperties.class).toPipelineConfig();
            assertEquals(3, config.getConcurrency());
            assertEquals(1_800_000L, config.getDedupEvictionIntervalMs());
            assertEquals(25, config.getSlotCapacity());
            assertFalse(config.isRunSchedulerEnabled());
            assertEquals(600_000L, config.getRunIntervalMs());
            assertEquals(Duration.ofDays(7), config.getDedupRetention());
        });
    }

    @Configuration
    @EnableConfigurationProperties(MailScheduleProperties.class)
    static class PropsConfig {
    }
}
