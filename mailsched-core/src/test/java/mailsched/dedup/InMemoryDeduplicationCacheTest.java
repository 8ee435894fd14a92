package mailsched.dedup;

import mailsched.Fingerprint;
import mailsched.Identity;
import mailsched.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryDeduplicationCacheTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");
    private static final Identity ALICE = Identity.of("alice");
    private static final Identity BOB = Identity.of("bob");

    @Test
    void overlappingFetchesClaimEachMessageOnce() {
        var cache = new InMemoryDeduplicationCache();
        Fingerprint m1 = Fingerprint.of("m1", T0);
        Fingerprint m2 = Fingerprint.of("m2", T0.plusSeconds(60));

        // first fetch sees m1, overlapping second fetch sees m1 and m2
        assertTrue(cache.markIfAbsent(ALICE, m1));
        assertFalse(cache.markIfAbsent(ALICE, m1));
        assertTrue(cache.markIfAbsent(ALICE, m2));

        assertTrue(cache.seen(ALICE, m1));
        assertTrue(cache.seen(ALICE, m2));
        assertEquals(2, cache.size());
    }

    @Test
    void partitionsAreIndependentPerIdentity() {
        var cache = new InMemoryDeduplicationCache();
        Fingerprint fp = Fingerprint.of("same-id", T0);

        cache.mark(ALICE, fp);

        assertTrue(cache.seen(ALICE, fp));
        assertFalse(cache.seen(BOB, fp));
        assertTrue(cache.markIfAbsent(BOB, fp));
    }

    @Test
    void forgetReleasesClaim() {
        var cache = new InMemoryDeduplicationCache();
        Fingerprint fp = Fingerprint.of("m1", T0);
        cache.mark(ALICE, fp);

        cache.forget(ALICE, fp);

        assertFalse(cache.seen(ALICE, fp));
        assertTrue(cache.markIfAbsent(ALICE, fp));
    }

    @Test
    void entriesExpireAfterMaxAge() {
        var clock = new MutableClock(T0);
        var cache = new InMemoryDeduplicationCache(new RetentionPolicy(Duration.ofDays(7), 100), clock);
        Fingerprint old = Fingerprint.of("old", T0);
        cache.mark(ALICE, old);

        clock.advance(Duration.ofDays(6));
        Fingerprint young = Fingerprint.of("young", clock.instant());
        cache.mark(ALICE, young);
        assertTrue(cache.seen(ALICE, old));

        clock.advance(Duration.ofDays(1).plusSeconds(1));

        assertFalse(cache.seen(ALICE, old));
        assertEquals(1, cache.evictExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.seen(ALICE, young));
    }

    @Test
    void evictionDropsEmptyPartitionsAndLaterMarksStillWork() {
        var clock = new MutableClock(T0);
        var cache = new InMemoryDeduplicationCache(new RetentionPolicy(Duration.ofHours(1), 100), clock);
        cache.mark(ALICE, Fingerprint.of("m1", T0));
        clock.advance(Duration.ofHours(2));

        assertEquals(1, cache.evictExpired());
        assertEquals(0, cache.size());

        Fingerprint next = Fingerprint.of("m2", clock.instant());
        assertTrue(cache.markIfAbsent(ALICE, next));
        assertTrue(cache.seen(ALICE, next));
    }

    @Test
    void perIdentityCapEvictsOldestFirst() {
        var cache = new InMemoryDeduplicationCache(new RetentionPolicy(Duration.ofDays(7), 3));
        List<Fingerprint> fps = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Fingerprint fp = Fingerprint.of("m" + i, T0.plusSeconds(i));
            fps.add(fp);
            cache.mark(ALICE, fp);
        }

        assertEquals(3, cache.size());
        assertFalse(cache.seen(ALICE, fps.get(0)));
        assertFalse(cache.seen(ALICE, fps.get(1)));
        assertTrue(cache.seen(ALICE, fps.get(4)));
    }

    @Test
    void clearDropsEverything() {
        var cache = new InMemoryDeduplicationCache();
        cache.mark(ALICE, Fingerprint.of("m1", T0));
        cache.mark(BOB, Fingerprint.of("m1", T0));

        cache.clear();

        assertEquals(0, cache.size());
    }

    @Test
    void claimRacingClearLandsInLivePartition() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        var cache = new InMemoryDeduplicationCache(RetentionPolicy.DEFAULT, new GateClock(entered, release));
        Fingerprint fp = Fingerprint.of("m1", T0);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            // the claim resolves its partition, then parks on the clock before locking it
            Future<Boolean> claim = pool.submit(() -> cache.markIfAbsent(ALICE, fp));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            cache.clear();
            release.countDown();

            assertTrue(claim.get(5, TimeUnit.SECONDS));
            assertTrue(cache.seen(ALICE, fp));
            assertEquals(1, cache.size());
            assertFalse(cache.markIfAbsent(ALICE, fp));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        var cache = new InMemoryDeduplicationCache();
        Fingerprint fp = Fingerprint.of("contended", T0);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.markIfAbsent(ALICE, fp);
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }

    /** Blocks the first reader until released; later reads return immediately. */
    private static final class GateClock extends Clock {
        private final AtomicBoolean armed = new AtomicBoolean(true);
        private final CountDownLatch entered;
        private final CountDownLatch release;

        GateClock(CountDownLatch entered, CountDownLatch release) {
            this.entered = entered;
            this.release = release;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            if (armed.compareAndSet(true, false)) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return T0;
        }
    }
}
