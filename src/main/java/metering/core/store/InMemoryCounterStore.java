package metering.core.store;

import metering.core.clock.Clock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-process {@link CounterStore} honoring the same atomic contract as the Redis one.
 *
 * <p>Architecture:
 * <ul>
 *   <li>One {@link Slot} per key in a ConcurrentHashMap, each guarded by its own ReentrantLock,
 *       so contention only happens between callers of the same key</li>
 *   <li>Expiry is lazy: a slot whose deadline has passed reads as absent and is cleared
 *       by the next caller of its key</li>
 *   <li>A slot left empty is retired under its lock and removed from the map; a caller that
 *       raced with the removal sees the retired flag and retries on a fresh slot</li>
 *   <li>Expired keys nobody touches again are dropped by {@link #purgeExpired()}, which also
 *       runs every {@value #SWEEP_INTERVAL} writes</li>
 * </ul>
 *
 * <p>Clock injection makes TTL behaviour deterministic in tests.
 */
public final class InMemoryCounterStore implements CounterStore {

    private static final long NO_EXPIRY = Long.MAX_VALUE;
    static final int SWEEP_INTERVAL = 1024;

    private final Clock clock;
    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();

    public InMemoryCounterStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public long increment(String key, long amount, Duration ttl) {
        return write(key, slot -> {
            long now = clock.nowMillis();
            slot.clearIfExpired(now);
            long updated = slot.counter() + amount;
            slot.value = Long.toString(updated);
            slot.applyTtl(now, ttl);
            return updated;
        });
    }

    @Override
    public long get(String key) {
        return read(key, 0L, slot -> {
            slot.clearIfExpired(clock.nowMillis());
            return slot.counter();
        });
    }

    @Override
    public void delete(String key) {
        read(key, null, slot -> {
            slot.clear();
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return write(key, slot -> {
            long now = clock.nowMillis();
            slot.clearIfExpired(now);
            if (slot.exists()) {
                return false;
            }
            slot.value = value;
            slot.applyTtl(now, ttl);
            return true;
        });
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return read(key, false, slot -> {
            long now = clock.nowMillis();
            slot.clearIfExpired(now);
            if (!slot.exists()) {
                return false;
            }
            slot.applyTtl(now, ttl);
            return true;
        });
    }

    @Override
    public boolean compareAndSet(String key, long expected, long update, Duration ttl) {
        return write(key, slot -> {
            long now = clock.nowMillis();
            slot.clearIfExpired(now);
            if (slot.counter() != expected) {
                return false;
            }
            slot.value = Long.toString(update);
            slot.applyTtl(now, ttl);
            return true;
        });
    }

    @Override
    public WindowAdmission slidingWindowAdmit(String key, long nowMillis, long windowMillis,
                                              int maxCalls, String marker, Duration ttl) {
        return write(key, slot -> {
            slot.clearIfExpired(clock.nowMillis());
            long windowStart = nowMillis - windowMillis;
            slot.markers.removeIf(m -> m.timestampMillis() < windowStart);

            int count = slot.markers.size();
            if (count >= maxCalls) {
                return new WindowAdmission(false, count);
            }
            slot.markers.addLast(new Marker(marker, nowMillis));
            slot.applyTtl(clock.nowMillis(), ttl);
            return new WindowAdmission(true, count + 1L);
        });
    }

    @Override
    public boolean removeMarker(String key, String marker) {
        return read(key, false, slot -> {
            slot.clearIfExpired(clock.nowMillis());
            Iterator<Marker> it = slot.markers.iterator();
            while (it.hasNext()) {
                if (it.next().id().equals(marker)) {
                    it.remove();
                    return true;
                }
            }
            return false;
        });
    }

    @Override
    public boolean ping() {
        return true;
    }

    /**
     * Returns the number of keys that currently hold a live value.
     * Intended for tests.
     */
    public int liveKeys() {
        long now = clock.nowMillis();
        int live = 0;
        for (Slot slot : slots.values()) {
            slot.lock.lock();
            try {
                slot.clearIfExpired(now);
                if (slot.exists()) {
                    live++;
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return live;
    }

    /**
     * Returns the number of slots held in memory, live or not yet swept.
     */
    public int slotCount() {
        return slots.size();
    }

    /**
     * Drops every slot whose value has expired or that holds nothing.
     * Also runs on its own every {@value #SWEEP_INTERVAL} writes.
     *
     * @return number of slots removed
     */
    public int purgeExpired() {
        long now = clock.nowMillis();
        int removed = 0;
        for (Map.Entry<String, Slot> entry : slots.entrySet()) {
            Slot slot = entry.getValue();
            slot.lock.lock();
            try {
                slot.clearIfExpired(now);
                if (retireIfEmpty(entry.getKey(), slot)) {
                    removed++;
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return removed;
    }

    /**
     * Runs {@code op} on the locked slot of {@code key}, creating the slot when missing.
     */
    private <T> T write(String key, Function<Slot, T> op) {
        T result = writeLocked(key, op);
        if (writes.incrementAndGet() % SWEEP_INTERVAL == 0) {
            purgeExpired();
        }
        return result;
    }

    private <T> T writeLocked(String key, Function<Slot, T> op) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        while (true) {
            Slot slot = slots.computeIfAbsent(key, k -> new Slot());
            slot.lock.lock();
            try {
                if (slot.retired) {
                    continue;
                }
                T result = op.apply(slot);
                retireIfEmpty(key, slot);
                return result;
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Runs {@code op} on the locked slot of {@code key}, or returns {@code absent} when there is none.
     */
    private <T> T read(String key, T absent, Function<Slot, T> op) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        while (true) {
            Slot slot = slots.get(key);
            if (slot == null) {
                return absent;
            }
            slot.lock.lock();
            try {
                if (slot.retired) {
                    continue;
                }
                T result = op.apply(slot);
                retireIfEmpty(key, slot);
                return result;
            } finally {
                slot.lock.unlock();
            }
        }
    }

    // Caller holds slot.lock. A retired slot is never written again; callers that still hold
    // a reference to it see the flag and fetch the replacement from the map.
    private boolean retireIfEmpty(String key, Slot slot) {
        if (slot.retired || slot.exists()) {
            return false;
        }
        slot.retired = true;
        slots.remove(key, slot);
        return true;
    }

    private record Marker(String id, long timestampMillis) {
    }

    /**
     * Per-key state. All fields MUST only be touched while holding {@link #lock}.
     */
    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        final ArrayDeque<Marker> markers = new ArrayDeque<>();
        String value;
        long expiresAtMillis = NO_EXPIRY;
        boolean retired;

        boolean exists() {
            return value != null || !markers.isEmpty();
        }

        long counter() {
            if (value == null) {
                return 0L;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("value is not an integer: " + value, e);
            }
        }

        void applyTtl(long now, Duration ttl) {
            expiresAtMillis = ttl == null ? NO_EXPIRY : now + ttl.toMillis();
        }

        void clearIfExpired(long now) {
            if (expiresAtMillis != NO_EXPIRY && now >= expiresAtMillis) {
                clear();
            }
        }

        void clear() {
            value = null;
            markers.clear();
            expiresAtMillis = NO_EXPIRY;
        }
    }
}
