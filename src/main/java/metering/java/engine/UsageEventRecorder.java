package metering.java.engine;

import metering.core.clock.Clock;
import metering.core.idempotency.IdempotencyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records one logical usage event exactly once.
 *
 * <p>Flow: idempotency check first (a duplicate is reported and nothing is counted), then a
 * fresh plan snapshot and a gate evaluation, then a durable {@link MeterEvent} for admitted
 * events. A retried request therefore never increments twice.
 *
 * <p>An event id denied by a business rule (no subscription, rate limit, feature, limit) is
 * still consumed; retrying it reports a duplicate. An id whose event could not be accounted for
 * ({@code usage_unavailable}) or not written to the log is released, so the retry is processed.
 * When the log write fails the counter has already moved; {@link CounterRebuilder} restores
 * agreement with the log.
 */
public final class UsageEventRecorder {

    private static final Logger log = LoggerFactory.getLogger(UsageEventRecorder.class);

    public enum Status {
        RECORDED,
        DUPLICATE,
        DENIED
    }

    /**
     * @param status outcome
     * @param eventId id used for deduplication (generated when the caller sent none)
     * @param decision gate decision, null for duplicates
     */
    public record Result(Status status, String eventId, EntitlementDecision decision) {
    }

    private final SubscriptionLookup subscriptions;
    private final IdempotencyGuard idempotencyGuard;
    private final EntitlementGate gate;
    private final MeterEventLog eventLog;
    private final Clock clock;

    public UsageEventRecorder(SubscriptionLookup subscriptions, IdempotencyGuard idempotencyGuard,
                              EntitlementGate gate, MeterEventLog eventLog, Clock clock) {
        if (subscriptions == null) throw new IllegalArgumentException("subscriptions cannot be null");
        if (idempotencyGuard == null) throw new IllegalArgumentException("idempotencyGuard cannot be null");
        if (gate == null) throw new IllegalArgumentException("gate cannot be null");
        if (eventLog == null) throw new IllegalArgumentException("eventLog cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        this.subscriptions = subscriptions;
        this.idempotencyGuard = idempotencyGuard;
        this.gate = gate;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * @param request subscriber, feature and units
     * @param eventId caller-supplied idempotency key; null or blank to generate one
     * @param metadata free-form attributes stored with the event
     */
    public Result record(EntitlementRequest request, String eventId, Map<String, String> metadata) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        String id = eventId == null || eventId.isBlank() ? UUID.randomUUID().toString() : eventId;

        if (!idempotencyGuard.checkAndRecord(id)) {
            log.info("Duplicate usage event {} for {} / {}", id, request.subscriberId(), request.featureCode());
            return new Result(Status.DUPLICATE, id, null);
        }

        Optional<PlanSnapshot> snapshot = subscriptions.findActiveSubscription(request.subscriberId());
        EntitlementDecision decision = gate.evaluate(request, snapshot);
        if (!decision.allowed()) {
            if (decision.reason() == DecisionReason.USAGE_UNAVAILABLE) {
                // Nothing was counted; the retry must be evaluated again.
                idempotencyGuard.release(id);
            }
            return new Result(Status.DENIED, id, decision);
        }

        try {
            eventLog.append(new MeterEvent(id, request.subscriberId(), request.featureCode(), request.units(),
                Instant.ofEpochMilli(clock.nowMillis()), metadata));
        } catch (RuntimeException e) {
            log.error("Usage event {} was counted but not logged; releasing its id", id, e);
            idempotencyGuard.release(id);
            throw e;
        }
        return new Result(Status.RECORDED, id, decision);
    }
}
