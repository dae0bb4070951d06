package metering.core.model;

/**
 * Compare-and-increment kept losing races on one key.
 */
public final class ConflictRetryExhaustedException extends MeteringException {

    private final String key;
    private final int attempts;

    public ConflictRetryExhaustedException(String key, int attempts) {
        super(ErrorCode.CONFLICT_RETRY_EXHAUSTED,
            "compare-and-set on " + key + " did not converge after " + attempts + " attempts", null);
        this.key = key;
        this.attempts = attempts;
    }

    public String key() {
        return key;
    }

    public int attempts() {
        return attempts;
    }
}
