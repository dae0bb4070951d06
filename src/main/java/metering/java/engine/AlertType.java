package metering.java.engine;

public enum AlertType {
    /** An admitted increment brought usage up to the limit. */
    LIMIT_REACHED("limit_reached"),
    /** An attempt was denied because the limit was already used up. */
    LIMIT_EXCEEDED("limit_exceeded");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
