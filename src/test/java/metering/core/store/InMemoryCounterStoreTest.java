package metering.core.store;

import metering.core.clock.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCounterStoreTest {

    private static final long START = 1_700_000_000_000L * 1_000_000L;

    private ManualClock clock;
    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(START);
        store = new InMemoryCounterStore(clock);
    }

    @Test
    void increment_startsFromZeroAndAccumulates() {
        assertEquals(0L, store.get("c"));
        assertEquals(3L, store.increment("c", 3, null));
        assertEquals(5L, store.increment("c", 2, null));
        assertEquals(5L, store.get("c"));
    }

    @Test
    void increment_refreshesTtl() {
        store.increment("c", 1, Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(8));
        store.increment("c", 1, Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(8));

        assertEquals(2L, store.get("c"));

        clock.advance(Duration.ofSeconds(2));
        assertEquals(0L, store.get("c"));
    }

    @Test
    void delete_resetsToZero() {
        store.increment("c", 7, null);
        store.delete("c");

        assertEquals(0L, store.get("c"));
        assertEquals(0, store.liveKeys());
    }

    @Test
    void setIfAbsent_onlyFirstCallWins_andKeepsFirstTtl() {
        assertTrue(store.setIfAbsent("e", "1", Duration.ofSeconds(10)));
        clock.advance(Duration.ofSeconds(6));
        assertFalse(store.setIfAbsent("e", "1", Duration.ofSeconds(10)));

        // The failed call did not extend the TTL
        clock.advance(Duration.ofSeconds(4));
        assertTrue(store.setIfAbsent("e", "1", Duration.ofSeconds(10)));
    }

    @Test
    void compareAndSet_treatsAbsentAsZero() {
        assertFalse(store.compareAndSet("c", 1, 2, null));
        assertTrue(store.compareAndSet("c", 0, 1, null));
        assertTrue(store.compareAndSet("c", 1, 2, null));
        assertFalse(store.compareAndSet("c", 1, 3, null));
        assertEquals(2L, store.get("c"));
    }

    @Test
    void expire_missingKeyReturnsFalse() {
        assertFalse(store.expire("nope", Duration.ofSeconds(1)));

        store.increment("c", 1, null);
        assertTrue(store.expire("c", Duration.ofSeconds(1)));
        clock.advance(Duration.ofSeconds(1));
        assertEquals(0L, store.get("c"));
    }

    @Test
    void slidingWindow_rejectsWithoutInsertingAndTrimsOldMarkers() {
        long now = clock.nowMillis();
        assertTrue(store.slidingWindowAdmit("w", now, 1000, 2, "a", null).admitted());
        assertTrue(store.slidingWindowAdmit("w", now, 1000, 2, "b", null).admitted());

        WindowAdmission rejected = store.slidingWindowAdmit("w", now, 1000, 2, "c", null);
        assertFalse(rejected.admitted());
        assertEquals(2L, rejected.count());

        // Markers at exactly windowStart are still inside the window
        assertFalse(store.slidingWindowAdmit("w", now + 1000, 1000, 2, "d", null).admitted());

        WindowAdmission later = store.slidingWindowAdmit("w", now + 1001, 1000, 2, "e", null);
        assertTrue(later.admitted());
        assertEquals(1L, later.count());
    }

    @Test
    void removeMarker_freesSlot() {
        long now = clock.nowMillis();
        store.slidingWindowAdmit("w", now, 1000, 1, "a", null);

        assertTrue(store.removeMarker("w", "a"));
        assertFalse(store.removeMarker("w", "a"));
        assertTrue(store.slidingWindowAdmit("w", now, 1000, 1, "b", null).admitted());
    }

    @Test
    void nonNumericValue_isRejectedByCounterOperations() {
        store.setIfAbsent("text", "abc", null);

        assertThrows(IllegalStateException.class, () -> store.increment("text", 1, null));
    }

    @Test
    void expiredKeys_areDroppedFromMemory() {
        for (int i = 0; i < 10_000; i++) {
            store.setIfAbsent("event:" + i, "1", Duration.ofSeconds(10));
        }
        assertEquals(10_000, store.slotCount());

        clock.advance(Duration.ofSeconds(10));

        assertEquals(0, store.liveKeys());
        assertEquals(10_000, store.purgeExpired());
        assertEquals(0, store.slotCount());
    }

    @Test
    void writes_sweepExpiredKeysWithoutExplicitPurge() {
        for (int i = 0; i < InMemoryCounterStore.SWEEP_INTERVAL; i++) {
            store.increment("usage:" + i, 1, Duration.ofSeconds(1));
        }
        clock.advance(Duration.ofSeconds(1));

        for (int i = 0; i < InMemoryCounterStore.SWEEP_INTERVAL; i++) {
            store.increment("fresh", 1, null);
        }

        assertEquals(1, store.slotCount());
        assertEquals(InMemoryCounterStore.SWEEP_INTERVAL, store.get("fresh"));
    }

    @Test
    void emptiedKeys_releaseTheirSlot() {
        long now = clock.nowMillis();
        store.increment("c", 1, null);
        store.delete("c");
        store.compareAndSet("missing", 5, 6, null);
        store.slidingWindowAdmit("w", now, 1000, 1, "a", null);
        store.removeMarker("w", "a");

        assertEquals(0, store.slotCount());
    }

    @Test
    void sweepRacingWrites_neverLosesAWrite() throws InterruptedException {
        int threads = 8;
        int perThread = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < perThread; i++) {
                        store.increment("c", 1, null);
                        store.compareAndSet("scratch", 0, 0, null);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        executor.submit(() -> {
            try {
                startLatch.await();
                while (doneLatch.getCount() > 0) {
                    store.delete("scratch");
                    store.purgeExpired();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdownNow();

        assertEquals((long) threads * perThread, store.get("c"));
    }
}
