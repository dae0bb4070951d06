package metering.core.model;

/**
 * Result of a limit-aware increment.
 *
 * @param admitted whether the units were counted
 * @param usage counter value after the increment, or the current value when not admitted
 * @param failedClosed true when the store could not be reached or the compare-and-set loop
 *                     gave up; usage is 0 in that case and carries no information
 */
public record UsageAdmission(boolean admitted, long usage, boolean failedClosed) {

    public static UsageAdmission admitted(long usage) {
        return new UsageAdmission(true, usage, false);
    }

    public static UsageAdmission rejected(long currentUsage) {
        return new UsageAdmission(false, currentUsage, false);
    }

    public static UsageAdmission unavailable() {
        return new UsageAdmission(false, 0L, true);
    }
}
