package metering.core.store;

import java.time.Duration;

/**
 * Shared low-latency key-value store holding every piece of mutable metering state.
 *
 * <p>Contract:
 * <ul>
 *   <li>Every operation is linearizable per key and safe to call from many threads
 *       without external locking.</li>
 *   <li>Operations on different keys are not ordered relative to each other.</li>
 *   <li>Any operation may throw {@link metering.core.model.StoreUnavailableException};
 *       callers own the fallback policy.</li>
 *   <li>A {@code ttl} of null leaves the key without expiry.</li>
 * </ul>
 *
 * <p>The store knows nothing about subscribers, features or plans.
 */
public interface CounterStore {

    /**
     * Atomically adds {@code amount} (absent counts as 0) and refreshes the TTL.
     *
     * @return the value after the increment
     */
    long increment(String key, long amount, Duration ttl);

    /**
     * @return the counter value, or 0 when the key is absent or expired
     */
    long get(String key);

    void delete(String key);

    /**
     * Test-and-set: stores {@code value} only when the key is absent.
     * An existing key keeps both its value and its TTL.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * @return false if the key does not exist
     */
    boolean expire(String key, Duration ttl);

    /**
     * Sets the counter to {@code update} iff it currently equals {@code expected}
     * (absent compares equal to 0). The TTL is refreshed on success.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(String key, long expected, long update, Duration ttl);

    /**
     * Sliding-window admission as one atomic unit: drops markers older than
     * {@code nowMillis - windowMillis}, counts the rest, and either rejects without
     * writing or inserts {@code marker} at {@code nowMillis} and applies {@code ttl}.
     */
    WindowAdmission slidingWindowAdmit(String key, long nowMillis, long windowMillis,
                                       int maxCalls, String marker, Duration ttl);

    /**
     * @return true if the marker was present
     */
    boolean removeMarker(String key, String marker);

    /**
     * @return true when the store answers
     */
    boolean ping();
}
