package metering.core.model;

/**
 * Machine-readable error classes. Only the first two are ever carried by an exception;
 * invalid input surfaces as IllegalArgumentException and entitlement failures as denials.
 */
public enum ErrorCode {
    STORE_UNAVAILABLE("store_unavailable"),
    CONFLICT_RETRY_EXHAUSTED("conflict_retry_exhausted"),
    INVALID_INPUT("invalid_input"),
    NOT_ENTITLED("not_entitled");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
