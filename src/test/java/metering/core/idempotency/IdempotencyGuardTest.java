package metering.core.idempotency;

import metering.core.clock.ManualClock;
import metering.core.store.FailingCounterStore;
import metering.core.store.InMemoryCounterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyGuardTest {

    private ManualClock clock;
    private InMemoryCounterStore store;
    private IdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_700_000_000_000L * 1_000_000L);
        store = new InMemoryCounterStore(clock);
        guard = new IdempotencyGuard(store);
    }

    @Test
    void testFirstSeen_thenDuplicate() {
        assertTrue(guard.checkAndRecord("evt-123"));
        assertFalse(guard.checkAndRecord("evt-123"));
        assertFalse(guard.checkAndRecord("evt-123"));
        assertTrue(guard.checkAndRecord("evt-124"));
    }

    @Test
    void testRecordExpires_afterTtl() {
        assertTrue(guard.checkAndRecord("evt-1"));

        clock.advance(Duration.ofHours(23));
        assertFalse(guard.checkAndRecord("evt-1"));

        clock.advance(Duration.ofHours(1));
        assertTrue(guard.checkAndRecord("evt-1"));
    }

    @Test
    void testUsesEventKeyNamespace() {
        guard.checkAndRecord("evt-1");

        assertEquals(1L, store.get("event:evt-1"));
    }

    @Test
    void testConcurrentDuplicates_exactlyOneWins() throws InterruptedException {
        int threads = 32;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        AtomicInteger firsts = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (guard.checkAndRecord("evt-race")) {
                        firsts.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, firsts.get());
    }

    @Test
    void testStoreUnavailable_failsOpen() {
        IdempotencyGuard down = new IdempotencyGuard(new FailingCounterStore());

        assertTrue(down.checkAndRecord("evt-1"));
        assertTrue(down.checkAndRecord("evt-1"));
    }

    @Test
    void testRelease_makesIdNewAgain() {
        assertTrue(guard.checkAndRecord("evt-1"));
        guard.release("evt-1");

        assertEquals(0L, store.get("event:evt-1"));
        assertTrue(guard.checkAndRecord("evt-1"));
        assertFalse(guard.checkAndRecord("evt-1"));
    }

    @Test
    void testRelease_storeUnavailableIsLoggedNotThrown() {
        FailingCounterStore down = new FailingCounterStore();
        IdempotencyGuard guardOnDownStore = new IdempotencyGuard(down);

        assertDoesNotThrow(() -> guardOnDownStore.release("evt-1"));
        assertThrows(IllegalArgumentException.class, () -> guard.release(" "));
    }

    @Test
    void testBlankEventId_rejected() {
        assertThrows(IllegalArgumentException.class, () -> guard.checkAndRecord(""));
        assertThrows(IllegalArgumentException.class, () -> guard.checkAndRecord(null));
    }
}
