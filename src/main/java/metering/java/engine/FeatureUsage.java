package metering.java.engine;

/**
 * Usage of one feature of the active plan.
 */
public record FeatureUsage(String featureCode, long limit, long used) {

    public boolean unlimited() {
        return limit == PlanSnapshot.UNLIMITED;
    }

    public long remaining() {
        return unlimited() ? 0L : Math.max(0L, limit - used);
    }

    public long overageUnits() {
        return unlimited() ? 0L : Math.max(0L, used - limit);
    }

    public String remainingLabel() {
        if (unlimited()) {
            return "unlimited";
        }
        if (overageUnits() > 0) {
            return "overage: " + overageUnits();
        }
        return Long.toString(remaining());
    }
}
