package metering.core.model;

/**
 * Base for technical failures inside the engine.
 * Callers decide per operation whether to fail open or closed.
 */
public abstract class MeteringException extends RuntimeException {

    private final ErrorCode errorCode;

    protected MeteringException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
