package metering.java.engine;

import metering.core.clock.ManualClock;
import metering.core.store.InMemoryCounterStore;
import metering.core.usage.UsageAccountant;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CounterRebuilderTest {

    @Test
    void testRebuild_replacesDriftedCountersWithLoggedTotals() {
        UsageAccountant accountant = new UsageAccountant(new InMemoryCounterStore(new ManualClock(0)));
        InMemoryMeterEventLog log = new InMemoryMeterEventLog();
        log.append(event("e1", "sub-1", "api_call", 3));
        log.append(event("e2", "sub-1", "api_call", 2));
        log.append(event("e3", "sub-1", "export", 1));
        log.append(event("e4", "sub-2", "api_call", 7));

        accountant.incrementUsage("sub-1", "api_call", 99);
        accountant.incrementUsage("sub-3", "api_call", 4);

        CounterRebuilder.Result r = new CounterRebuilder(accountant).rebuild(log);

        assertEquals(3, r.countersReset());
        assertEquals(4, r.eventsReplayed());
        assertEquals(5, accountant.getUsage("sub-1", "api_call"));
        assertEquals(1, accountant.getUsage("sub-1", "export"));
        assertEquals(7, accountant.getUsage("sub-2", "api_call"));
        // Pairs absent from the log are left alone
        assertEquals(4, accountant.getUsage("sub-3", "api_call"));
    }

    @Test
    void testRebuild_isRepeatable() {
        UsageAccountant accountant = new UsageAccountant(new InMemoryCounterStore(new ManualClock(0)));
        InMemoryMeterEventLog log = new InMemoryMeterEventLog();
        log.append(event("e1", "sub-1", "api_call", 3));

        CounterRebuilder rebuilder = new CounterRebuilder(accountant);
        rebuilder.rebuild(log);
        rebuilder.rebuild(log);

        assertEquals(3, accountant.getUsage("sub-1", "api_call"));
    }

    private static MeterEvent event(String id, String subscriber, String feature, long units) {
        return new MeterEvent(id, subscriber, feature, units, Instant.parse("2026-10-01T00:00:00Z"), Map.of());
    }
}
