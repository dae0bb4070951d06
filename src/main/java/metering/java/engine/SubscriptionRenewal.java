package metering.java.engine;

import metering.core.usage.UsageAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Starts a new accounting period: every feature counter of the active plan is reset.
 */
public final class SubscriptionRenewal {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRenewal.class);

    /**
     * @param planId renewed plan
     * @param countersReset number of feature counters reset
     */
    public record Result(String planId, int countersReset) {
    }

    private final SubscriptionLookup subscriptions;
    private final UsageAccountant accountant;
    private final UsageNotifier notifier;

    public SubscriptionRenewal(SubscriptionLookup subscriptions, UsageAccountant accountant, UsageNotifier notifier) {
        if (subscriptions == null) throw new IllegalArgumentException("subscriptions cannot be null");
        if (accountant == null) throw new IllegalArgumentException("accountant cannot be null");
        if (notifier == null) throw new IllegalArgumentException("notifier cannot be null");
        this.subscriptions = subscriptions;
        this.accountant = accountant;
        this.notifier = notifier;
    }

    /**
     * @return the renewal result, or empty when there is no active subscription
     * @throws metering.core.model.StoreUnavailableException if a counter could not be reset
     */
    public Optional<Result> renew(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId must not be blank");
        }
        Optional<PlanSnapshot> snapshot = subscriptions.findActiveSubscription(subscriberId);
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        PlanSnapshot plan = snapshot.get();
        int reset = accountant.resetAll(subscriberId, plan.featureCodes());
        log.info("Renewed {} on plan {}, {} counters reset", subscriberId, plan.planId(), reset);

        try {
            notifier.subscriptionRenewed(subscriberId, plan.planId(), reset);
        } catch (RuntimeException e) {
            log.error("Notifier failed for renewal of {}", subscriberId, e);
        }
        return Optional.of(new Result(plan.planId(), reset));
    }
}
