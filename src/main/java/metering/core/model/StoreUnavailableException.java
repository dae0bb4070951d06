package metering.core.model;

/**
 * The counter store could not be reached or did not answer within its timeout.
 */
public final class StoreUnavailableException extends MeteringException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }

    public StoreUnavailableException(String message) {
        this(message, null);
    }
}
