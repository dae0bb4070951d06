package metering.java.engine;

import metering.core.usage.UsageAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconstructs usage counters from the durable event log.
 *
 * <p>Every (subscriber, feature) pair seen in the log is reset first, then each event is
 * re-applied as an unconditional increment. Increments commute, so the result equals what
 * organic traffic produced regardless of replay order. Limits are not enforced during replay.
 *
 * <p>Run it while traffic for the affected subscribers is paused; concurrent increments
 * landing between reset and replay would be lost or double-counted.
 */
public final class CounterRebuilder {

    private static final Logger log = LoggerFactory.getLogger(CounterRebuilder.class);

    /**
     * @param countersReset distinct (subscriber, feature) pairs reset
     * @param eventsReplayed events re-applied
     */
    public record Result(int countersReset, int eventsReplayed) {
    }

    private final UsageAccountant accountant;

    public CounterRebuilder(UsageAccountant accountant) {
        if (accountant == null) throw new IllegalArgumentException("accountant cannot be null");
        this.accountant = accountant;
    }

    public Result rebuild(MeterEventLog eventLog) {
        if (eventLog == null) throw new IllegalArgumentException("eventLog cannot be null");
        List<MeterEvent> events = eventLog.readAll();
        log.info("Rebuilding usage counters from {} events", events.size());

        Set<Pair> pairs = new LinkedHashSet<>();
        for (MeterEvent event : events) {
            pairs.add(new Pair(event.subscriberId(), event.featureCode()));
        }
        for (Pair pair : pairs) {
            accountant.resetUsage(pair.subscriberId(), pair.featureCode());
        }

        int replayed = 0;
        for (MeterEvent event : events) {
            accountant.incrementUsage(event.subscriberId(), event.featureCode(), event.units());
            replayed++;
        }
        log.info("Rebuilt {} counters from {} events", pairs.size(), replayed);
        return new Result(pairs.size(), replayed);
    }

    private record Pair(String subscriberId, String featureCode) {
    }
}
