package metering.java.engine;

import metering.core.algorithms.sliding_window.SlidingWindowRateLimiter;
import metering.core.clock.ManualClock;
import metering.core.model.RateLimitResult;
import metering.core.model.RateLimiter;
import metering.core.model.StoreUnavailableException;
import metering.core.store.CounterStore;
import metering.core.store.FailingCounterStore;
import metering.core.store.InMemoryCounterStore;
import metering.core.usage.UsageAccountant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static metering.java.engine.PlanFixtures.features;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

/**
 * Gate evaluation against an in-memory store.
 *
 * Focus:
 * - every denial reason and the stage that produced it
 * - check ordering: rate before feature before usage
 * - overage billing admits past the limit and reports overage units
 * - a later denial gives back the rate-limit slot
 * - limit notifications
 */
class EntitlementGateTest {

    private ManualClock clock;
    private InMemoryCounterStore store;
    private UsageAccountant accountant;
    private RecordingNotifier notifier;
    private EntitlementGate gate;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(1_700_000_000_000L * 1_000_000L);
        store = new InMemoryCounterStore(clock);
        accountant = new UsageAccountant(store);
        notifier = new RecordingNotifier();
        gate = new EntitlementGate(new SlidingWindowRateLimiter(store, clock, Duration.ofSeconds(1)),
            accountant, notifier);
    }

    @Test
    void testAllow_countsUsageAndReportsRemaining() {
        PlanSnapshot pro = PlanFixtures.plan("pro", features("api_call", 1000));

        EntitlementDecision d = gate.evaluate("sub-1", "api_call", Optional.of(pro));

        assertTrue(d.allowed());
        assertEquals(DecisionReason.ALLOWED, d.reason());
        assertEquals(GateStage.USAGE_CHECK, d.decidedAt());
        assertEquals(1, d.usage());
        assertEquals(1000, d.limit());
        assertEquals(999, d.remaining());
        assertEquals("999", d.remainingLabel());
        assertEquals(1, accountant.getUsage("sub-1", "api_call"));
    }

    @Test
    void testDeny_noSubscription() {
        EntitlementDecision d = gate.evaluate("nobody", "api_call", Optional.empty());

        assertFalse(d.allowed());
        assertEquals(DecisionReason.NO_SUBSCRIPTION, d.reason());
        assertEquals("no_subscription", d.reason().code());
        assertEquals(GateStage.SUBSCRIPTION_CHECK, d.decidedAt());
        assertEquals(0, store.liveKeys());
    }

    @Test
    void testDeny_featureNotEntitled_withoutCounting() {
        PlanSnapshot free = PlanFixtures.plan("free", features("api_call", 100));

        EntitlementDecision d = gate.evaluate("sub-1", "export", Optional.of(free));

        assertFalse(d.allowed());
        assertEquals(DecisionReason.FEATURE_NOT_ENTITLED, d.reason());
        assertEquals(GateStage.FEATURE_CHECK, d.decidedAt());
        assertEquals(0, accountant.getUsage("sub-1", "export"));
    }

    @Test
    void testDeny_limitExceeded_reportsCurrentUsage() {
        PlanSnapshot free = PlanFixtures.plan("free", features("api_call", 3));
        for (int i = 0; i < 3; i++) {
            assertTrue(gate.evaluate("sub-1", "api_call", Optional.of(free)).allowed());
        }

        EntitlementDecision d = gate.evaluate("sub-1", "api_call", Optional.of(free));

        assertFalse(d.allowed());
        assertEquals(DecisionReason.LIMIT_EXCEEDED, d.reason());
        assertEquals(3, d.usage());
        assertEquals(3, d.limit());
        assertEquals(3, accountant.getUsage("sub-1", "api_call"));
    }

    @Test
    void testUnlimitedFeature_neverDenied() {
        PlanSnapshot pro = PlanFixtures.plan("pro", features("search", PlanSnapshot.UNLIMITED));

        EntitlementDecision d = null;
        for (int i = 0; i < 2000; i++) {
            d = gate.evaluate("sub-1", "search", Optional.of(pro));
            assertTrue(d.allowed());
        }

        assertTrue(d.unlimited());
        assertEquals("unlimited", d.remainingLabel());
        assertEquals("unlimited", d.limitLabel());
        assertEquals(2000, d.usage());
    }

    @Test
    void testOverage_admitsPastLimitAndReportsOverageUnits() {
        PlanSnapshot metered = PlanFixtures.overage("metered", "0.01", features("api_call", 1000));
        accountant.incrementUsage("sub-1", "api_call", 1049);

        EntitlementDecision d = gate.evaluate("sub-1", "api_call", Optional.of(metered));

        assertTrue(d.allowed());
        assertEquals(1050, d.usage());
        assertEquals(50, d.overageUnits());
        assertTrue(d.inOverage());
        assertEquals(0, d.remaining());
        assertEquals("overage: 50", d.remainingLabel());
    }

    @Test
    void testOverage_withUnlimitedFeature_isPlainCount() {
        PlanSnapshot metered = PlanFixtures.overage("metered", "1.00", features("search", PlanSnapshot.UNLIMITED));

        EntitlementDecision d = gate.evaluate("sub-1", "search", Optional.of(metered));

        assertTrue(d.allowed());
        assertEquals(0, d.overageUnits());
        assertEquals("unlimited", d.remainingLabel());
    }

    @Test
    void testRateLimited_beforeUsageIsCounted() {
        PlanSnapshot pro = PlanFixtures.rateLimited("pro", 5, 60, features("api_call", 1000));
        for (int i = 0; i < 5; i++) {
            assertTrue(gate.evaluate("sub-1", "api_call", Optional.of(pro)).allowed());
        }

        EntitlementDecision d = gate.evaluate("sub-1", "api_call", Optional.of(pro));

        assertFalse(d.allowed());
        assertEquals(DecisionReason.RATE_LIMITED, d.reason());
        assertEquals(GateStage.RATE_CHECK, d.decidedAt());
        assertEquals(60, d.retryAfterSeconds());
        assertEquals(5, accountant.getUsage("sub-1", "api_call"));
    }

    @Test
    void testRateCheck_precedesFeatureCheck() {
        RateLimiter rejectAll = new RateLimiter() {
            @Override
            public RateLimitResult tryAcquire(String key, int maxCalls, long windowSeconds) {
                return RateLimitResult.reject(maxCalls, windowSeconds);
            }

            @Override
            public void release(String key, RateLimitResult admitted) {
                fail("nothing to release");
            }
        };
        EntitlementGate g = new EntitlementGate(rejectAll, accountant, notifier);
        PlanSnapshot pro = PlanFixtures.rateLimited("pro", 1, 60, features("api_call", 1000));

        EntitlementDecision d = g.evaluate("sub-1", "export", Optional.of(pro));

        assertEquals(DecisionReason.RATE_LIMITED, d.reason());
        assertEquals(1, d.admittedInWindow());
    }

    @Test
    void testFeatureDenial_releasesRateLimitSlot() {
        PlanSnapshot pro = PlanFixtures.rateLimited("pro", 1, 60, features("api_call", 1000));

        for (int i = 0; i < 3; i++) {
            assertEquals(DecisionReason.FEATURE_NOT_ENTITLED,
                gate.evaluate("sub-1", "export", Optional.of(pro)).reason());
        }
    }

    @Test
    void testLimitDenial_releasesRateLimitSlot() {
        PlanSnapshot pro = PlanFixtures.rateLimited("pro", 2, 60, features("export", 1));
        assertTrue(gate.evaluate("sub-1", "export", Optional.of(pro)).allowed());
        assertEquals(DecisionReason.LIMIT_EXCEEDED, gate.evaluate("sub-1", "export", Optional.of(pro)).reason());
        assertEquals(DecisionReason.LIMIT_EXCEEDED, gate.evaluate("sub-1", "export", Optional.of(pro)).reason());

        // Renewal frees the quota; the one slot left in the window is still available
        accountant.resetUsage("sub-1", "export");
        assertTrue(gate.evaluate("sub-1", "export", Optional.of(pro)).allowed());
        assertEquals(DecisionReason.RATE_LIMITED, gate.evaluate("sub-1", "export", Optional.of(pro)).reason());
    }

    @Test
    void testLimitReached_notifiedOnceWhenCrossing() {
        PlanSnapshot free = PlanFixtures.plan("free", features("api_call", 3));
        for (int i = 0; i < 3; i++) {
            gate.evaluate("sub-1", "api_call", Optional.of(free));
        }

        assertEquals(1, notifier.alertsOf(AlertType.LIMIT_REACHED).size());
        UsageAlert alert = notifier.alertsOf(AlertType.LIMIT_REACHED).get(0);
        assertEquals("sub-1", alert.subscriberId());
        assertEquals("free", alert.planId());
        assertEquals("api_call", alert.featureCode());
        assertEquals(3, alert.limit());
        assertEquals(3, alert.currentUsage());
    }

    @Test
    void testLimitExceeded_notifiedOnEachDenial() {
        PlanSnapshot free = PlanFixtures.plan("free", features("api_call", 1));
        gate.evaluate("sub-1", "api_call", Optional.of(free));
        gate.evaluate("sub-1", "api_call", Optional.of(free));
        gate.evaluate("sub-1", "api_call", Optional.of(free));

        assertEquals(2, notifier.alertsOf(AlertType.LIMIT_EXCEEDED).size());
    }

    @Test
    void testOverage_notifiesLimitReachedWhenCrossing() {
        PlanSnapshot metered = PlanFixtures.overage("metered", "1.00", features("api_call", 10));
        accountant.incrementUsage("sub-1", "api_call", 8);

        gate.evaluate(new EntitlementRequest("sub-1", "api_call", 5), Optional.of(metered));
        gate.evaluate(new EntitlementRequest("sub-1", "api_call", 5), Optional.of(metered));

        assertEquals(1, notifier.alertsOf(AlertType.LIMIT_REACHED).size());
        assertEquals(13, notifier.alerts.get(0).currentUsage());
    }

    @Test
    void testNotifierFailure_doesNotChangeDecision() {
        UsageNotifier broken = new UsageNotifier() {
            @Override
            public void usageAlert(UsageAlert alert) {
                throw new IllegalStateException("webhook down");
            }

            @Override
            public void subscriptionRenewed(String subscriberId, String planId, int countersReset) {
            }
        };
        EntitlementGate g = new EntitlementGate(
            new SlidingWindowRateLimiter(store, clock, Duration.ofSeconds(1)), accountant, broken);
        PlanSnapshot free = PlanFixtures.plan("free", features("api_call", 1));

        assertTrue(g.evaluate("sub-1", "api_call", Optional.of(free)).allowed());
        assertEquals(DecisionReason.LIMIT_EXCEEDED, g.evaluate("sub-1", "api_call", Optional.of(free)).reason());
    }

    @Test
    void testStoreDown_usageUnavailableButRateLimiterFailsOpen() {
        FailingCounterStore down = new FailingCounterStore();
        EntitlementGate g = new EntitlementGate(
            new SlidingWindowRateLimiter(down, clock, Duration.ofSeconds(1)), new UsageAccountant(down), notifier);
        PlanSnapshot pro = PlanFixtures.rateLimited("pro", 5, 60, features("api_call", 1000));

        EntitlementDecision d = g.evaluate("sub-1", "api_call", Optional.of(pro));

        assertFalse(d.allowed());
        assertEquals(DecisionReason.USAGE_UNAVAILABLE, d.reason());
        assertEquals(GateStage.USAGE_CHECK, d.decidedAt());
        assertTrue(notifier.alerts.isEmpty());
    }

    @Test
    void testStoreDown_overagePathAlsoDenies() {
        FailingCounterStore down = new FailingCounterStore();
        EntitlementGate g = new EntitlementGate(
            new SlidingWindowRateLimiter(down, clock, Duration.ofSeconds(1)), new UsageAccountant(down), notifier);
        PlanSnapshot metered = PlanFixtures.overage("metered", "1.00", features("api_call", 10));

        assertEquals(DecisionReason.USAGE_UNAVAILABLE, g.evaluate("sub-1", "api_call", Optional.of(metered)).reason());
    }

    @Test
    void testFeatureDenial_releasesMarkerItRegistered() {
        CountingLimiter limiter = new CountingLimiter();
        EntitlementGate g = new EntitlementGate(limiter, accountant, notifier);
        PlanSnapshot pro = PlanFixtures.rateLimited("pro", 1, 60, features("api_call", 10));

        g.evaluate("sub-1", "export", Optional.of(pro));

        assertEquals(1, limiter.acquired);
        assertEquals(1, limiter.released);
        assertEquals("sub-1:export", limiter.lastKey);
    }

    @Test
    void testFailedRelease_keepsDenialAndSlotAgesOutWithWindow() {
        CounterStore flaky = spy(new InMemoryCounterStore(clock));
        doThrow(new StoreUnavailableException("marker removal timed out"))
            .when(flaky).removeMarker(anyString(), anyString());
        EntitlementGate g = new EntitlementGate(
            new SlidingWindowRateLimiter(flaky, clock, Duration.ofSeconds(1)), new UsageAccountant(flaky), notifier);
        PlanSnapshot pro = PlanFixtures.rateLimited("pro", 1, 60, features("api_call", 10));

        EntitlementDecision denied = g.evaluate("sub-1", "export", Optional.of(pro));
        assertEquals(DecisionReason.FEATURE_NOT_ENTITLED, denied.reason());

        // The marker could not be withdrawn, so it holds the only slot
        assertEquals(DecisionReason.RATE_LIMITED, g.evaluate("sub-1", "export", Optional.of(pro)).reason());

        clock.advance(Duration.ofSeconds(61));
        assertEquals(DecisionReason.FEATURE_NOT_ENTITLED, g.evaluate("sub-1", "export", Optional.of(pro)).reason());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> gate.evaluate(null, Optional.empty()));
        assertThrows(IllegalArgumentException.class, () -> gate.evaluate(EntitlementRequest.of("s", "f"), null));
        assertThrows(IllegalArgumentException.class, () -> new EntitlementRequest("s", "f", 0));
        assertThrows(IllegalArgumentException.class, () -> EntitlementRequest.of("a:b", "c"));
        assertThrows(IllegalArgumentException.class, () -> EntitlementRequest.of("a", "b:c"));
        assertThrows(IllegalArgumentException.class, () -> PlanFixtures.plan("pro", features("b:c", 10)));
    }

    private static final class CountingLimiter implements RateLimiter {
        int acquired;
        int released;
        String lastKey;

        @Override
        public RateLimitResult tryAcquire(String key, int maxCalls, long windowSeconds) {
            acquired++;
            lastKey = key;
            return RateLimitResult.allow(1, "marker-" + acquired);
        }

        @Override
        public void release(String key, RateLimitResult admitted) {
            if (admitted.hasMarker()) {
                released++;
            }
        }
    }
}
