package metering.java.config;

import java.util.Locale;

public enum StoreType {
    MEMORY,
    REDIS;

    public static StoreType fromCode(String code) {
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("unknown store type: " + code, e);
        }
    }
}
