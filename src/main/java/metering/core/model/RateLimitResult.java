package metering.core.model;

/**
 * Outcome of one sliding-window check.
 *
 * @param decision ALLOW or REJECT
 * @param admittedInWindow calls admitted in the trailing window, including this one when allowed
 * @param retryAfterSeconds hint for rejected callers (the window length); 0 when allowed
 * @param marker id of the marker registered for this attempt, or null when none was registered
 */
public record RateLimitResult(
    Decision decision,
    long admittedInWindow,
    long retryAfterSeconds,
    String marker
) {
    public static RateLimitResult allow(long admittedInWindow, String marker) {
        return new RateLimitResult(Decision.ALLOW, admittedInWindow, 0L, marker);
    }

    /** Allowed without touching the store (limiter disabled, or store down). */
    public static RateLimitResult bypass() {
        return new RateLimitResult(Decision.ALLOW, 0L, 0L, null);
    }

    public static RateLimitResult reject(long admittedInWindow, long retryAfterSeconds) {
        return new RateLimitResult(Decision.REJECT, admittedInWindow, Math.max(0L, retryAfterSeconds), null);
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }

    public boolean hasMarker() {
        return marker != null;
    }
}
