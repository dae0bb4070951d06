package metering.java.engine;

/**
 * Machine-readable outcome of a gate evaluation, specific enough to drive client behaviour
 * and free of store details.
 */
public enum DecisionReason {
    ALLOWED("allowed"),
    NO_SUBSCRIPTION("no_subscription"),
    RATE_LIMITED("rate_limited"),
    FEATURE_NOT_ENTITLED("feature_not_entitled"),
    LIMIT_EXCEEDED("limit_exceeded"),
    /** Usage could not be accounted for (store outage or unresolved contention). */
    USAGE_UNAVAILABLE("usage_unavailable");

    private final String code;

    DecisionReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
