package metering.core.clock;

/**
 * Time source injected into everything that reads "now".
 *
 * nowNanos() is monotonic and only meaningful as a difference;
 * nowMillis() is wall-clock epoch time and is what gets written to the counter store,
 * where several processes must agree on it.
 */
public interface Clock {
    long nowNanos();

    long nowMillis();
}
