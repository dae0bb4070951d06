package metering.core.clock;

import java.time.Duration;

/**
 * Test clock. Both views of time are derived from one nanosecond counter that
 * starts at an arbitrary epoch offset and only moves when told to.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    @Override
    public long nowMillis() {
        return now / 1_000_000L;
    }

    public synchronized void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public synchronized void setNanos(long value) {
        now = value;
    }
}
