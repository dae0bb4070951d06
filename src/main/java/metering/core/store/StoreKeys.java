package metering.core.store;

/**
 * Rules for the ids that are joined into composite store keys such as
 * {@code usage:{subscriber}:{feature}}.
 */
public final class StoreKeys {

    public static final char SEPARATOR = ':';

    private StoreKeys() {
    }

    /**
     * Validates one key component. A component holding the separator would let two different
     * (subscriber, feature) pairs share a key, so it is rejected.
     *
     * @param name field name used in the error message
     * @return {@code value}
     * @throws IllegalArgumentException if the value is blank or contains the separator
     */
    public static String requireComponent(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (value.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(name + " must not contain '" + SEPARATOR + "': " + value);
        }
        return value;
    }
}
