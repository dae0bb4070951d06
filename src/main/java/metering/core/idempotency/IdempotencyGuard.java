package metering.core.idempotency;

import metering.core.model.StoreUnavailableException;
import metering.core.store.CounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Deduplication filter over the counter store.
 *
 * <p>An event id is accepted at most once per TTL: the first {@link #checkAndRecord} creates
 * {@code event:{id}} with a single test-and-set, every later call sees the key and reports a
 * duplicate without touching its TTL.
 *
 * <p>Failure policy: fail open. If the store cannot be reached the event is treated as new
 * and the failure is logged at ERROR.
 *
 * <p>An id recorded for an event that then could not be processed for a technical reason is
 * handed back with {@link #release}, so the caller's retry is not mistaken for a duplicate.
 */
public final class IdempotencyGuard {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyGuard.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    static final String KEY_PREFIX = "event:";

    private final CounterStore store;
    private final Duration ttl;

    public IdempotencyGuard(CounterStore store) {
        this(store, DEFAULT_TTL);
    }

    public IdempotencyGuard(CounterStore store, Duration ttl) {
        if (store == null) throw new IllegalArgumentException("store cannot be null");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("ttl must be > 0");
        this.store = store;
        this.ttl = ttl;
    }

    /**
     * @param eventId caller-supplied or engine-generated id
     * @return true the first time an id is seen, false for every repeat within the TTL
     */
    public boolean checkAndRecord(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId must not be blank");
        }
        try {
            return store.setIfAbsent(KEY_PREFIX + eventId, "1", ttl);
        } catch (StoreUnavailableException e) {
            log.error("Idempotency store unavailable, treating event {} as new", eventId, e);
            return true;
        }
    }

    /**
     * Forgets an id recorded by {@link #checkAndRecord}, making it acceptable again.
     * A store failure is logged; the record then expires with its TTL.
     */
    public void release(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId must not be blank");
        }
        try {
            store.delete(KEY_PREFIX + eventId);
        } catch (StoreUnavailableException e) {
            log.error("Could not release event {}, retries are rejected until it expires", eventId, e);
        }
    }
}
