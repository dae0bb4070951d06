package metering.java.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import metering.core.clock.Clock;
import metering.core.store.CounterStore;
import metering.core.store.InMemoryCounterStore;
import metering.core.store.RedisCounterStore;
import metering.java.engine.EngineSettings;
import metering.java.engine.InMemoryMeterEventLog;
import metering.java.engine.JsonLinesMeterEventLog;
import metering.java.engine.MeterEventLog;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings read from the {@code metering} block of Typesafe Config.
 *
 * <p>Resolution order: system environment, then {@code application.conf}, then the defaults in
 * {@code reference.conf}.
 *
 * @param storeType which counter store to build
 * @param redisAddress Redis URI, used when storeType is REDIS
 * @param storeTimeout per-command store timeout
 * @param storeConnectTimeout store connect timeout
 * @param engine engine tunables
 * @param serverPort gRPC port
 * @param eventLogPath JSON-lines event log file, or null for an in-memory log
 * @param subscriptionsReloadInterval how often the server re-reads plans and subscriptions; zero disables
 * @param root the full configuration, for {@link ConfigSubscriptionLookup}
 */
public record MeteringConfig(
    StoreType storeType,
    String redisAddress,
    Duration storeTimeout,
    Duration storeConnectTimeout,
    EngineSettings engine,
    int serverPort,
    Path eventLogPath,
    Duration subscriptionsReloadInterval,
    Config root
) {
    public static MeteringConfig load() {
        return from(loadRoot());
    }

    /**
     * Reads the configuration afresh, bypassing Typesafe Config's cache, so edits to
     * {@code application.conf} made since the last call are seen.
     */
    public static Config loadRoot() {
        ConfigFactory.invalidateCaches();
        return ConfigFactory.systemEnvironment().withFallback(ConfigFactory.load());
    }

    public static MeteringConfig from(Config config) {
        Config m = config.getConfig("metering");
        EngineSettings engine = new EngineSettings(
            m.getDuration("usage.ttl"),
            m.getInt("usage.max-retries"),
            m.getDuration("idempotency.ttl"),
            m.getDuration("rate-limit.ttl-buffer")
        );
        String logPath = m.getString("event-log.path");
        return new MeteringConfig(
            StoreType.fromCode(m.getString("store.type")),
            m.getString("store.redis.address"),
            m.getDuration("store.redis.timeout"),
            m.getDuration("store.redis.connect-timeout"),
            engine,
            m.getInt("server.port"),
            logPath.isBlank() ? null : Path.of(logPath),
            m.getDuration("subscriptions-reload.interval"),
            config
        );
    }

    public CounterStore createStore(Clock clock) {
        return switch (storeType) {
            case MEMORY -> new InMemoryCounterStore(clock);
            case REDIS -> RedisCounterStore.connect(redisAddress, storeTimeout, storeConnectTimeout);
        };
    }

    public MeterEventLog createEventLog() {
        return eventLogPath == null ? new InMemoryMeterEventLog() : new JsonLinesMeterEventLog(eventLogPath);
    }

    public ConfigSubscriptionLookup createSubscriptionLookup() {
        return ConfigSubscriptionLookup.from(root);
    }
}
