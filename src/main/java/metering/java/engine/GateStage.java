package metering.java.engine;

/**
 * States of one gate evaluation, in the only order they may be visited.
 * ALLOWED and DENIED are terminal.
 */
public enum GateStage {
    START,
    SUBSCRIPTION_CHECK,
    RATE_CHECK,
    FEATURE_CHECK,
    USAGE_CHECK,
    ALLOWED,
    DENIED;

    public boolean terminal() {
        return this == ALLOWED || this == DENIED;
    }
}
