package metering.java.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Re-reads plans and subscriptions into a {@link ConfigSubscriptionLookup} on a fixed delay.
 *
 * <p>A configuration that fails to parse or validate is logged and skipped; the lookup keeps
 * serving the last good catalogue.
 */
public final class SubscriptionReloader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionReloader.class);

    private final ConfigSubscriptionLookup lookup;
    private final Supplier<Config> source;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    /**
     * @param lookup catalogue to refresh
     * @param source reads the current configuration, e.g. {@link MeteringConfig#loadRoot()}
     * @param interval delay between reloads, must be positive
     */
    public SubscriptionReloader(ConfigSubscriptionLookup lookup, Supplier<Config> source, Duration interval) {
        if (lookup == null) throw new IllegalArgumentException("lookup cannot be null");
        if (source == null) throw new IllegalArgumentException("source cannot be null");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.lookup = lookup;
        this.source = source;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "subscription-reloader");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::reloadNow, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Reloading subscriptions every {}", interval);
    }

    /**
     * @return true if the new catalogue was installed
     */
    public boolean reloadNow() {
        try {
            lookup.reload(source.get());
            return true;
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Subscription reload failed, keeping current catalogue", e);
            return false;
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
