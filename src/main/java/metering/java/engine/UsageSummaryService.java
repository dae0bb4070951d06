package metering.java.engine;

import metering.core.usage.UsageAccountant;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only usage report for a subscriber's active plan, in plan feature order.
 * Counter reads fail safe to 0.
 */
public final class UsageSummaryService {

    private final SubscriptionLookup subscriptions;
    private final UsageAccountant accountant;

    public UsageSummaryService(SubscriptionLookup subscriptions, UsageAccountant accountant) {
        if (subscriptions == null) throw new IllegalArgumentException("subscriptions cannot be null");
        if (accountant == null) throw new IllegalArgumentException("accountant cannot be null");
        this.subscriptions = subscriptions;
        this.accountant = accountant;
    }

    /**
     * @return one entry per plan feature, or empty when there is no active subscription
     */
    public Optional<List<FeatureUsage>> summarize(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId must not be blank");
        }
        return subscriptions.findActiveSubscription(subscriberId).map(plan -> {
            List<FeatureUsage> usage = new ArrayList<>(plan.features().size());
            for (Map.Entry<String, Long> feature : plan.features().entrySet()) {
                long used = accountant.getUsage(subscriberId, feature.getKey());
                usage.add(new FeatureUsage(feature.getKey(), feature.getValue(), used));
            }
            return List.copyOf(usage);
        });
    }
}
