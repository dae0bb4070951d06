package metering.java.engine;

import metering.core.store.StoreKeys;

/**
 * One feature-consuming attempt.
 *
 * @param subscriberId tenant/user identity, without {@code ':'}
 * @param featureCode meterable capability being consumed, without {@code ':'}
 * @param units units consumed by this attempt, at least 1
 */
public record EntitlementRequest(String subscriberId, String featureCode, long units) {

    public EntitlementRequest {
        StoreKeys.requireComponent("subscriberId", subscriberId);
        StoreKeys.requireComponent("featureCode", featureCode);
        if (units <= 0) {
            throw new IllegalArgumentException("units must be > 0, got: " + units);
        }
    }

    public static EntitlementRequest of(String subscriberId, String featureCode) {
        return new EntitlementRequest(subscriberId, featureCode, 1L);
    }

    /** Key shared by the rate-limit window of this subscriber and feature. */
    public String rateLimitKey() {
        return subscriberId + StoreKeys.SEPARATOR + featureCode;
    }
}
