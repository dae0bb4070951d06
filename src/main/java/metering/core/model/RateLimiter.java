package metering.core.model;

/**
 * "At most maxCalls per windowSeconds" per key.
 * A maxCalls of 0 disables the limiter for that call.
 */
public interface RateLimiter {
    RateLimitResult tryAcquire(String key, int maxCalls, long windowSeconds);

    /**
     * Withdraws the marker registered by an earlier allowed attempt, freeing its slot.
     * No-op for results that carry no marker.
     */
    void release(String key, RateLimitResult admitted);

    default boolean allow(String key, int maxCalls, long windowSeconds) {
        return tryAcquire(key, maxCalls, windowSeconds).allowed();
    }
}
