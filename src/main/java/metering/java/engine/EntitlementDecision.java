package metering.java.engine;

/**
 * Result of one gate evaluation.
 *
 * @param allowed whether the caller may proceed
 * @param reason machine-readable reason ({@link DecisionReason#ALLOWED} on admission)
 * @param decidedAt the check that produced the decision
 * @param usage counter after the increment when allowed, the current value on a limit denial,
 *              0 otherwise
 * @param limit plan limit for the feature, {@link PlanSnapshot#UNLIMITED} for unlimited,
 *              0 when the decision was reached before the feature check
 * @param remaining units left before the limit (0 when unlimited or in overage, see
 *                  {@link #remainingLabel()})
 * @param overageUnits units past the limit, for downstream billing
 * @param admittedInWindow calls admitted in the current rate-limit window
 * @param retryAfterSeconds retry hint for {@link DecisionReason#RATE_LIMITED}, else 0
 */
public record EntitlementDecision(
    boolean allowed,
    DecisionReason reason,
    GateStage decidedAt,
    long usage,
    long limit,
    long remaining,
    long overageUnits,
    long admittedInWindow,
    long retryAfterSeconds
) {
    public static EntitlementDecision allowed(long usage, long limit, long admittedInWindow) {
        long overage = limit == PlanSnapshot.UNLIMITED ? 0L : Math.max(0L, usage - limit);
        long remaining = limit == PlanSnapshot.UNLIMITED ? 0L : Math.max(0L, limit - usage);
        return new EntitlementDecision(true, DecisionReason.ALLOWED, GateStage.USAGE_CHECK,
            usage, limit, remaining, overage, admittedInWindow, 0L);
    }

    public static EntitlementDecision noSubscription() {
        return denied(DecisionReason.NO_SUBSCRIPTION, GateStage.SUBSCRIPTION_CHECK, 0L, 0L);
    }

    public static EntitlementDecision rateLimited(long admittedInWindow, long retryAfterSeconds) {
        return new EntitlementDecision(false, DecisionReason.RATE_LIMITED, GateStage.RATE_CHECK,
            0L, 0L, 0L, 0L, admittedInWindow, retryAfterSeconds);
    }

    public static EntitlementDecision featureNotEntitled() {
        return denied(DecisionReason.FEATURE_NOT_ENTITLED, GateStage.FEATURE_CHECK, 0L, 0L);
    }

    public static EntitlementDecision limitExceeded(long currentUsage, long limit) {
        return denied(DecisionReason.LIMIT_EXCEEDED, GateStage.USAGE_CHECK, currentUsage, limit);
    }

    public static EntitlementDecision usageUnavailable(long limit) {
        return denied(DecisionReason.USAGE_UNAVAILABLE, GateStage.USAGE_CHECK, 0L, limit);
    }

    private static EntitlementDecision denied(DecisionReason reason, GateStage stage, long usage, long limit) {
        return new EntitlementDecision(false, reason, stage, usage, limit, 0L, 0L, 0L, 0L);
    }

    public boolean unlimited() {
        return limit == PlanSnapshot.UNLIMITED;
    }

    public boolean inOverage() {
        return overageUnits > 0;
    }

    /**
     * "unlimited", "overage: N" or the remaining count, as shown to API clients.
     */
    public String remainingLabel() {
        if (unlimited()) {
            return "unlimited";
        }
        if (inOverage()) {
            return "overage: " + overageUnits;
        }
        return Long.toString(remaining);
    }

    public String limitLabel() {
        return unlimited() ? "unlimited" : Long.toString(limit);
    }
}
