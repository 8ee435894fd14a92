package mailsched.poller;

import mailsched.Fingerprint;
import mailsched.Identity;
import mailsched.dedup.InMemoryDeduplicationCache;
import mailsched.dedup.RetentionPolicy;
import mailsched.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DedupEvictionSchedulerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
    private final InMemoryDeduplicationCache cache =
            new InMemoryDeduplicationCache(new RetentionPolicy(Duration.ofDays(7), 100), clock);

    @Test
    void runOnceEvictsExpiredFingerprints() {
        Identity student = Identity.of("s1");
        cache.mark(student, new Fingerprint("old"));
        clock.advance(Duration.ofDays(6));
        cache.mark(student, new Fingerprint("young"));
        clock.advance(Duration.ofDays(2));

        try (DedupEvictionScheduler scheduler = DedupEvictionScheduler.builder().cache(cache).build()) {
            assertEquals(1, scheduler.runOnce());
            assertEquals(0, scheduler.runOnce());
        }

        assertFalse(cache.seen(student, new Fingerprint("old")));
        assertTrue(cache.seen(student, new Fingerprint("young")));
        assertEquals(1, cache.size());
    }

    @Test
    void closedSchedulerDoesNothing() {
        cache.mark(Identity.of("s1"), new Fingerprint("old"));
        clock.advance(Duration.ofDays(8));

        DedupEvictionScheduler scheduler = DedupEvictionScheduler.builder().cache(cache).intervalSeconds(1).build();
        scheduler.start();
        scheduler.close();

        assertEquals(0, scheduler.runOnce());
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> DedupEvictionScheduler.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> DedupEvictionScheduler.builder().cache(cache).intervalSeconds(0).build());
    }
}
