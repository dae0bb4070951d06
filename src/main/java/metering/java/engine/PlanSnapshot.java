package metering.java.engine;

import metering.core.store.StoreKeys;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a subscriber's active plan, loaded once per request.
 *
 * <p>Instances are immutable: the feature map is copied defensively. A snapshot must not
 * outlive the request it was loaded for, so plan changes take effect on the next request.
 *
 * @param planId plan identifier
 * @param price recurring price (informational, billing is computed elsewhere)
 * @param billingPeriod accounting period
 * @param overageUnitPrice price per unit past the limit; 0 disables overage billing
 * @param rateLimitMaxCalls calls allowed per window; 0 disables rate limiting
 * @param rateLimitWindowSeconds window length in seconds
 * @param features feature code to limit; -1 means unlimited
 */
public record PlanSnapshot(
    String planId,
    BigDecimal price,
    BillingPeriod billingPeriod,
    BigDecimal overageUnitPrice,
    int rateLimitMaxCalls,
    long rateLimitWindowSeconds,
    Map<String, Long> features
) {
    public static final long UNLIMITED = -1L;

    public PlanSnapshot {
        if (planId == null || planId.isBlank()) throw new IllegalArgumentException("planId must not be blank");
        if (price == null) price = BigDecimal.ZERO;
        if (billingPeriod == null) billingPeriod = BillingPeriod.MONTHLY;
        if (overageUnitPrice == null) overageUnitPrice = BigDecimal.ZERO;
        if (overageUnitPrice.signum() < 0) throw new IllegalArgumentException("overageUnitPrice < 0");
        if (rateLimitMaxCalls < 0) throw new IllegalArgumentException("rateLimitMaxCalls < 0");
        if (rateLimitMaxCalls > 0 && rateLimitWindowSeconds <= 0) {
            throw new IllegalArgumentException("rateLimitWindowSeconds must be > 0 when rate limiting is enabled");
        }
        if (features == null) throw new IllegalArgumentException("features cannot be null");
        for (Map.Entry<String, Long> e : features.entrySet()) {
            StoreKeys.requireComponent("feature code", e.getKey());
            if (e.getValue() == null || e.getValue() < UNLIMITED) {
                throw new IllegalArgumentException("invalid limit for " + e.getKey() + ": " + e.getValue());
            }
        }
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public boolean overageEnabled() {
        return overageUnitPrice.signum() > 0;
    }

    public boolean rateLimited() {
        return rateLimitMaxCalls > 0;
    }

    public boolean entitles(String featureCode) {
        return features.containsKey(featureCode);
    }

    /**
     * @throws IllegalArgumentException if the plan does not include the feature
     */
    public long limitFor(String featureCode) {
        Long limit = features.get(featureCode);
        if (limit == null) {
            throw new IllegalArgumentException("feature not in plan " + planId + ": " + featureCode);
        }
        return limit;
    }

    public Set<String> featureCodes() {
        return features.keySet();
    }
}
