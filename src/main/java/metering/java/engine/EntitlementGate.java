package metering.java.engine;

import metering.core.model.RateLimitResult;
import metering.core.model.RateLimiter;
import metering.core.model.StoreUnavailableException;
import metering.core.model.UsageAdmission;
import metering.core.usage.UsageAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Stateless per-request orchestrator deciding allow / deny / overage for one attempt.
 *
 * <p>Checks run strictly in this order:
 * <ol>
 *   <li>SUBSCRIPTION_CHECK: no active plan denies with {@code no_subscription}</li>
 *   <li>RATE_CHECK: sliding window when the plan has a rate limit; registers a marker</li>
 *   <li>FEATURE_CHECK: feature missing from the plan denies with {@code feature_not_entitled}</li>
 *   <li>USAGE_CHECK: unconditional increment under overage billing, otherwise a limit-aware
 *       increment that denies with {@code limit_exceeded}</li>
 * </ol>
 *
 * <p>A marker registered in RATE_CHECK is withdrawn when a later check denies, so a request
 * rejected for another reason does not keep a rate-limit slot. Until the withdrawal lands the
 * marker counts: a concurrent request for the same key may be rejected with
 * {@code rate_limited} even though the slot is about to be freed. If the withdrawal fails
 * (store unavailable) the denial stands and the marker ages out with its window.
 *
 * <p>Thread-safety: holds no mutable state; all contention is resolved in the counter store.
 * The gate never writes the durable event log.
 */
public final class EntitlementGate {

    private static final Logger log = LoggerFactory.getLogger(EntitlementGate.class);

    private final RateLimiter rateLimiter;
    private final UsageAccountant accountant;
    private final UsageNotifier notifier;

    public EntitlementGate(RateLimiter rateLimiter, UsageAccountant accountant, UsageNotifier notifier) {
        if (rateLimiter == null) throw new IllegalArgumentException("rateLimiter cannot be null");
        if (accountant == null) throw new IllegalArgumentException("accountant cannot be null");
        if (notifier == null) throw new IllegalArgumentException("notifier cannot be null");
        this.rateLimiter = rateLimiter;
        this.accountant = accountant;
        this.notifier = notifier;
    }

    /**
     * Evaluates one attempt against the snapshot loaded for this request.
     *
     * @param request subscriber, feature and units
     * @param snapshot the subscriber's active plan, empty when there is none
     */
    public EntitlementDecision evaluate(EntitlementRequest request, Optional<PlanSnapshot> snapshot) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        if (snapshot == null) throw new IllegalArgumentException("snapshot cannot be null, use Optional.empty()");

        Progress progress = new Progress();

        progress.enter(GateStage.SUBSCRIPTION_CHECK);
        if (snapshot.isEmpty()) {
            return progress.deny(EntitlementDecision.noSubscription());
        }
        PlanSnapshot plan = snapshot.get();

        progress.enter(GateStage.RATE_CHECK);
        RateLimitResult rate = RateLimitResult.bypass();
        if (plan.rateLimited()) {
            rate = rateLimiter.tryAcquire(request.rateLimitKey(), plan.rateLimitMaxCalls(), plan.rateLimitWindowSeconds());
            if (!rate.allowed()) {
                return progress.deny(EntitlementDecision.rateLimited(rate.admittedInWindow(), rate.retryAfterSeconds()));
            }
        }

        progress.enter(GateStage.FEATURE_CHECK);
        if (!plan.entitles(request.featureCode())) {
            rateLimiter.release(request.rateLimitKey(), rate);
            return progress.deny(EntitlementDecision.featureNotEntitled());
        }

        progress.enter(GateStage.USAGE_CHECK);
        long limit = plan.limitFor(request.featureCode());
        EntitlementDecision decision = plan.overageEnabled() && limit != PlanSnapshot.UNLIMITED
            ? meterWithOverage(request, plan, limit, rate)
            : meterWithinLimit(request, plan, limit, rate);

        if (!decision.allowed()) {
            rateLimiter.release(request.rateLimitKey(), rate);
            return progress.deny(decision);
        }
        return progress.allow(decision);
    }

    public EntitlementDecision evaluate(String subscriberId, String featureCode, Optional<PlanSnapshot> snapshot) {
        return evaluate(EntitlementRequest.of(subscriberId, featureCode), snapshot);
    }

    private EntitlementDecision meterWithOverage(EntitlementRequest request, PlanSnapshot plan,
                                                 long limit, RateLimitResult rate) {
        long usage;
        try {
            usage = accountant.incrementUsage(request.subscriberId(), request.featureCode(), request.units());
        } catch (StoreUnavailableException e) {
            log.error("Usage store unavailable for {} / {}, denying", request.subscriberId(), request.featureCode(), e);
            return EntitlementDecision.usageUnavailable(limit);
        }
        if (crossedLimit(usage, request.units(), limit)) {
            alert(AlertType.LIMIT_REACHED, request, plan, limit, usage);
        }
        EntitlementDecision decision = EntitlementDecision.allowed(usage, limit, rate.admittedInWindow());
        if (decision.inOverage()) {
            log.debug("Overage for {} / {}: {} units past {}",
                request.subscriberId(), request.featureCode(), decision.overageUnits(), limit);
        }
        return decision;
    }

    private EntitlementDecision meterWithinLimit(EntitlementRequest request, PlanSnapshot plan,
                                                 long limit, RateLimitResult rate) {
        UsageAdmission admission = accountant.incrementIfBelowLimit(
            request.subscriberId(), request.featureCode(), limit, request.units());

        if (admission.failedClosed()) {
            return EntitlementDecision.usageUnavailable(limit);
        }
        if (!admission.admitted()) {
            alert(AlertType.LIMIT_EXCEEDED, request, plan, limit, admission.usage());
            return EntitlementDecision.limitExceeded(admission.usage(), limit);
        }
        if (limit != PlanSnapshot.UNLIMITED && crossedLimit(admission.usage(), request.units(), limit)) {
            alert(AlertType.LIMIT_REACHED, request, plan, limit, admission.usage());
        }
        return EntitlementDecision.allowed(admission.usage(), limit, rate.admittedInWindow());
    }

    private static boolean crossedLimit(long usageAfter, long units, long limit) {
        return usageAfter >= limit && usageAfter - units < limit;
    }

    private void alert(AlertType type, EntitlementRequest request, PlanSnapshot plan, long limit, long usage) {
        try {
            notifier.usageAlert(new UsageAlert(type, request.subscriberId(), plan.planId(),
                request.featureCode(), limit, usage));
        } catch (RuntimeException e) {
            log.error("Notifier failed for {} {} / {}", type.code(), request.subscriberId(), request.featureCode(), e);
        }
    }

    /**
     * Forward-only walk through {@link GateStage}. Each evaluation owns one instance.
     */
    private static final class Progress {
        private GateStage stage = GateStage.START;

        void enter(GateStage next) {
            if (stage.terminal() || next.ordinal() <= stage.ordinal()) {
                throw new IllegalStateException("illegal gate transition " + stage + " -> " + next);
            }
            stage = next;
        }

        EntitlementDecision deny(EntitlementDecision decision) {
            enter(GateStage.DENIED);
            return decision;
        }

        EntitlementDecision allow(EntitlementDecision decision) {
            enter(GateStage.ALLOWED);
            return decision;
        }
    }
}
