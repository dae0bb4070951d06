package metering.core.algorithms.sliding_window;

import metering.core.clock.Clock;
import metering.core.model.RateLimitResult;
import metering.core.model.RateLimiter;
import metering.core.model.StoreUnavailableException;
import metering.core.store.CounterStore;
import metering.core.store.WindowAdmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;

/**
 * Exact sliding window (log) kept in the counter store:
 * one timestamped marker per admitted call under {@code ratelimit:{key}}.
 *
 * <p>Trim, count and insert run as a single store script, so concurrent callers of the
 * same key cannot both observe "one slot left". A rejected attempt writes nothing.
 *
 * <p>Markers carry a random suffix so two calls in the same millisecond stay distinct.
 *
 * <p>Failure policy: fail open. A store outage is logged at WARN and the call is allowed.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    static final String KEY_PREFIX = "ratelimit:";

    private final CounterStore store;
    private final Clock clock;
    private final Duration ttlBuffer;

    /**
     * @param store shared counter store
     * @param clock wall-clock source for marker timestamps
     * @param ttlBuffer added to the window length to form the key TTL
     */
    public SlidingWindowRateLimiter(CounterStore store, Clock clock, Duration ttlBuffer) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (ttlBuffer == null || ttlBuffer.isNegative()) throw new IllegalArgumentException("ttlBuffer must be >= 0");
        this.store = store;
        this.clock = clock;
        this.ttlBuffer = ttlBuffer;
    }

    @Override
    public RateLimitResult tryAcquire(String key, int maxCalls, long windowSeconds) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key must not be blank");
        if (maxCalls < 0) throw new IllegalArgumentException("maxCalls < 0");
        if (maxCalls == 0) {
            return RateLimitResult.bypass();
        }
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds <= 0");

        long now = clock.nowMillis();
        long windowMillis = Duration.ofSeconds(windowSeconds).toMillis();
        String marker = now + "-" + UUID.randomUUID();
        Duration ttl = Duration.ofSeconds(windowSeconds).plus(ttlBuffer);

        try {
            WindowAdmission admission = store.slidingWindowAdmit(
                KEY_PREFIX + key, now, windowMillis, maxCalls, marker, ttl);
            if (admission.admitted()) {
                return RateLimitResult.allow(admission.count(), marker);
            }
            return RateLimitResult.reject(admission.count(), windowSeconds);
        } catch (StoreUnavailableException e) {
            log.warn("Rate limiter store unavailable for {}, allowing: {}", key, e.getMessage());
            return RateLimitResult.bypass();
        }
    }

    @Override
    public void release(String key, RateLimitResult admitted) {
        if (admitted == null || !admitted.hasMarker()) {
            return;
        }
        try {
            store.removeMarker(KEY_PREFIX + key, admitted.marker());
        } catch (StoreUnavailableException e) {
            // The marker ages out with the window.
            log.warn("Could not release rate limit marker for {}: {}", key, e.getMessage());
        }
    }
}
