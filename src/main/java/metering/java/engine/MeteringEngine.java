package metering.java.engine;

import metering.core.algorithms.sliding_window.SlidingWindowRateLimiter;
import metering.core.clock.Clock;
import metering.core.idempotency.IdempotencyGuard;
import metering.core.model.RateLimiter;
import metering.core.store.CounterStore;
import metering.core.usage.UsageAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires the metering components around one counter store.
 *
 * <p>Architecture:
 * <ul>
 *   <li>{@link CounterStore} holds every piece of mutable state; it is injected, never global</li>
 *   <li>{@link SubscriptionLookup} is queried once per request, so plan changes apply without restart</li>
 *   <li>The gate, recorder and services are stateless and safe to share between threads</li>
 * </ul>
 *
 * <p>Usage example:
 * <pre>
 * MeteringEngine engine = new MeteringEngine(store, subscriptions, eventLog,
 *     new LoggingUsageNotifier(), SystemClock.instance(), EngineSettings.defaults());
 *
 * EntitlementDecision decision = engine.check(EntitlementRequest.of("sub-42", "api_call"));
 * if (decision.allowed()) {
 *     // Serve the request
 * } else {
 *     // Reject with decision.reason().code()
 * }
 * </pre>
 */
public final class MeteringEngine {

    private static final Logger log = LoggerFactory.getLogger(MeteringEngine.class);

    private final CounterStore store;
    private final SubscriptionLookup subscriptions;
    private final MeterEventLog eventLog;
    private final EngineSettings settings;

    private final UsageAccountant accountant;
    private final IdempotencyGuard idempotencyGuard;
    private final RateLimiter rateLimiter;
    private final EntitlementGate gate;
    private final UsageEventRecorder recorder;
    private final UsageSummaryService summaries;
    private final SubscriptionRenewal renewals;
    private final CounterRebuilder rebuilder;

    /**
     * @param store shared counter store
     * @param subscriptions plan/subscription read contract
     * @param eventLog durable log written by {@link #recordEvent}
     * @param notifier outbound notifications
     * @param clock time source (injected for testability)
     * @param settings engine tunables
     * @throws IllegalArgumentException if any parameter is null
     */
    public MeteringEngine(CounterStore store, SubscriptionLookup subscriptions, MeterEventLog eventLog,
                          UsageNotifier notifier, Clock clock, EngineSettings settings) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (subscriptions == null) throw new IllegalArgumentException("subscriptions cannot be null");
        if (eventLog == null) throw new IllegalArgumentException("eventLog cannot be null");
        if (notifier == null) throw new IllegalArgumentException("notifier cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (settings == null) throw new IllegalArgumentException("settings cannot be null");

        this.store = store;
        this.subscriptions = subscriptions;
        this.eventLog = eventLog;
        this.settings = settings;

        this.accountant = new UsageAccountant(store, settings.usageTtl(), settings.maxCasRetries());
        this.idempotencyGuard = new IdempotencyGuard(store, settings.idempotencyTtl());
        this.rateLimiter = new SlidingWindowRateLimiter(store, clock, settings.rateLimitTtlBuffer());
        this.gate = new EntitlementGate(rateLimiter, accountant, notifier);
        this.recorder = new UsageEventRecorder(subscriptions, idempotencyGuard, gate, eventLog, clock);
        this.summaries = new UsageSummaryService(subscriptions, accountant);
        this.renewals = new SubscriptionRenewal(subscriptions, accountant, notifier);
        this.rebuilder = new CounterRebuilder(accountant);
    }

    /**
     * Loads a fresh plan snapshot and runs the gate for one attempt.
     */
    public EntitlementDecision check(EntitlementRequest request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        return gate.evaluate(request, subscriptions.findActiveSubscription(request.subscriberId()));
    }

    public UsageEventRecorder.Result recordEvent(EntitlementRequest request, String eventId,
                                                 Map<String, String> metadata) {
        return recorder.record(request, eventId, metadata);
    }

    public Optional<List<FeatureUsage>> summarize(String subscriberId) {
        return summaries.summarize(subscriberId);
    }

    public Optional<SubscriptionRenewal.Result> renew(String subscriberId) {
        return renewals.renew(subscriberId);
    }

    /**
     * Rebuilds usage counters from this engine's event log.
     */
    public CounterRebuilder.Result rebuildCounters() {
        return rebuilder.rebuild(eventLog);
    }

    public boolean storeHealthy() {
        try {
            return store.ping();
        } catch (RuntimeException e) {
            log.warn("Counter store health check failed: {}", e.getMessage());
            return false;
        }
    }

    public EntitlementGate gate() {
        return gate;
    }

    public UsageAccountant accountant() {
        return accountant;
    }

    public IdempotencyGuard idempotencyGuard() {
        return idempotencyGuard;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public EngineSettings settings() {
        return settings;
    }
}
