package metering.java.engine;

import java.util.Locale;

/**
 * Accounting period of a plan. Usage counters are reset when it rolls over.
 */
public enum BillingPeriod {
    MONTHLY,
    YEARLY,
    HOURLY,
    MINUTE;

    /**
     * Parses the lower-case code used in configuration ("monthly", "yearly", ...).
     */
    public static BillingPeriod fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("billing period must not be blank");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown billing period: " + code, e);
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
