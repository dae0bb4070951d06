package metering.java.engine;

import java.util.Optional;

/**
 * Read contract against the external subscription/plan store.
 * Called once per request; implementations must not cache across requests.
 */
public interface SubscriptionLookup {

    Optional<PlanSnapshot> findActiveSubscription(String subscriberId);
}
