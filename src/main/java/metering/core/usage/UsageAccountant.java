package metering.core.usage;

import metering.core.model.ConflictRetryExhaustedException;
import metering.core.model.StoreUnavailableException;
import metering.core.model.UsageAdmission;
import metering.core.store.CounterStore;
import metering.core.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;

/**
 * Owns the per-(subscriber, feature) usage counters of the current accounting period.
 *
 * <p>Counters live under {@code usage:{subscriber}:{feature}} with a long TTL refreshed on
 * every write, and are only ever reset explicitly (renewal, period rollover, rebuild).
 *
 * <p>Limit enforcement is a bounded compare-and-set loop: read, refuse if the increment would
 * pass the limit, otherwise CAS from the value read. A lost race re-reads and tries again, up to
 * {@code maxRetries} extra attempts. The counter can therefore never be pushed past the limit
 * by this class, whatever the interleaving.
 *
 * <p>Failure policy: reads fail safe to 0, limit-aware increments fail closed.
 */
public final class UsageAccountant {

    private static final Logger log = LoggerFactory.getLogger(UsageAccountant.class);

    public static final long UNLIMITED = -1L;
    public static final Duration DEFAULT_TTL = Duration.ofDays(90);
    public static final int DEFAULT_MAX_RETRIES = 5;

    static final String KEY_PREFIX = "usage:";

    private final CounterStore store;
    private final Duration ttl;
    private final int maxRetries;

    public UsageAccountant(CounterStore store) {
        this(store, DEFAULT_TTL, DEFAULT_MAX_RETRIES);
    }

    /**
     * @param store shared counter store
     * @param ttl counter TTL, refreshed on every increment
     * @param maxRetries compare-and-set retries after the first attempt
     */
    public UsageAccountant(CounterStore store, Duration ttl, int maxRetries) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("ttl must be > 0");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries < 0");
        this.store = store;
        this.ttl = ttl;
        this.maxRetries = maxRetries;
    }

    public static String usageKey(String subscriberId, String featureCode) {
        return KEY_PREFIX + subscriberId + StoreKeys.SEPARATOR + featureCode;
    }

    /**
     * @return units consumed this period; 0 when absent or when the store is unavailable
     */
    public long getUsage(String subscriberId, String featureCode) {
        String key = key(subscriberId, featureCode);
        try {
            return store.get(key);
        } catch (StoreUnavailableException e) {
            log.warn("Usage read failed for {}, reporting 0: {}", key, e.getMessage());
            return 0L;
        }
    }

    /**
     * Unconditional increment, used when overage billing lifts the ceiling.
     *
     * @return the counter after the increment
     * @throws StoreUnavailableException if the store cannot be reached
     */
    public long incrementUsage(String subscriberId, String featureCode, long amount) {
        requirePositive(amount);
        return store.increment(key(subscriberId, featureCode), amount, ttl);
    }

    public long incrementUsage(String subscriberId, String featureCode) {
        return incrementUsage(subscriberId, featureCode, 1L);
    }

    /**
     * Linearizable "increment iff the result stays within limit".
     * A limit of {@link #UNLIMITED} degenerates to {@link #incrementUsage}.
     */
    public UsageAdmission incrementIfBelowLimit(String subscriberId, String featureCode, long limit, long amount) {
        requirePositive(amount);
        if (limit < UNLIMITED) throw new IllegalArgumentException("limit must be >= -1");
        String key = key(subscriberId, featureCode);

        try {
            if (limit == UNLIMITED) {
                return UsageAdmission.admitted(store.increment(key, amount, ttl));
            }
            return compareAndIncrement(key, limit, amount);
        } catch (StoreUnavailableException e) {
            log.error("Usage store unavailable for {}, denying", key, e);
            return UsageAdmission.unavailable();
        } catch (ConflictRetryExhaustedException e) {
            log.error("Usage increment for {} gave up after {} attempts, denying", key, e.attempts());
            return UsageAdmission.unavailable();
        }
    }

    public UsageAdmission incrementIfBelowLimit(String subscriberId, String featureCode, long limit) {
        return incrementIfBelowLimit(subscriberId, featureCode, limit, 1L);
    }

    /**
     * Deletes the counter. Afterwards {@link #getUsage} reads 0.
     *
     * @throws StoreUnavailableException if the store cannot be reached
     */
    public void resetUsage(String subscriberId, String featureCode) {
        store.delete(key(subscriberId, featureCode));
    }

    /**
     * Resets every listed feature of one subscriber, as done on renewal.
     *
     * @return number of counters reset
     */
    public int resetAll(String subscriberId, Collection<String> featureCodes) {
        int reset = 0;
        for (String featureCode : featureCodes) {
            resetUsage(subscriberId, featureCode);
            reset++;
        }
        return reset;
    }

    private UsageAdmission compareAndIncrement(String key, long limit, long amount) {
        int attempts = 0;
        while (attempts <= maxRetries) {
            attempts++;
            long current = store.get(key);
            if (current + amount > limit) {
                return UsageAdmission.rejected(current);
            }
            long updated = current + amount;
            if (store.compareAndSet(key, current, updated, ttl)) {
                return UsageAdmission.admitted(updated);
            }
            log.debug("Lost compare-and-set race on {} (attempt {})", key, attempts);
        }
        throw new ConflictRetryExhaustedException(key, attempts);
    }

    private static String key(String subscriberId, String featureCode) {
        StoreKeys.requireComponent("subscriberId", subscriberId);
        StoreKeys.requireComponent("featureCode", featureCode);
        return usageKey(subscriberId, featureCode);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) throw new IllegalArgumentException("amount must be > 0");
    }
}
