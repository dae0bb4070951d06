package metering.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import metering.core.clock.SystemClock;
import metering.core.store.CounterStore;
import metering.java.config.ConfigSubscriptionLookup;
import metering.java.config.MeteringConfig;
import metering.java.config.SubscriptionReloader;
import metering.java.engine.LoggingUsageNotifier;
import metering.java.engine.MeteringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the entitlement and metering engine.
 *
 * <p>Features:
 * <ul>
 *   <li>Port, counter store and event log taken from {@link MeteringConfig} (default port 9090)</li>
 *   <li>Plans and subscriptions from configuration, optionally re-read on a fixed delay</li>
 *   <li>Graceful shutdown with timeout; closes the counter store</li>
 *   <li>SystemClock for production</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * // Run with configuration defaults
 * java -jar entitlement-metering.jar
 *
 * // Run against Redis on a custom port
 * METERING_STORE_TYPE=redis METERING_PORT=8080 java -jar entitlement-metering.jar
 * </pre>
 */
public final class EntitlementServer {

    private static final Logger log = LoggerFactory.getLogger(EntitlementServer.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final AutoCloseable resources;

    /**
     * Creates a server with a custom engine (useful for testing).
     *
     * @param port Port to listen on
     * @param engine Metering engine
     */
    public EntitlementServer(int port, MeteringEngine engine) {
        this(port, engine, () -> { });
    }

    private EntitlementServer(int port, MeteringEngine engine, AutoCloseable resources) {
        this.server = ServerBuilder.forPort(port)
            .addService(new EntitlementServiceImpl(engine))
            .build();
        this.resources = resources;
    }

    /**
     * Builds the engine and server described by the configuration.
     */
    public static EntitlementServer fromConfig(MeteringConfig config) {
        SystemClock clock = SystemClock.instance();
        CounterStore store = config.createStore(clock);
        ConfigSubscriptionLookup subscriptions = config.createSubscriptionLookup();
        MeteringEngine engine = new MeteringEngine(
            store,
            subscriptions,
            config.createEventLog(),
            new LoggingUsageNotifier(),
            clock,
            config.engine());

        SubscriptionReloader reloader = null;
        if (!config.subscriptionsReloadInterval().isZero()) {
            reloader = new SubscriptionReloader(subscriptions, MeteringConfig::loadRoot,
                config.subscriptionsReloadInterval());
            reloader.start();
        }
        SubscriptionReloader scheduled = reloader;
        AutoCloseable resources = () -> {
            if (scheduled != null) {
                scheduled.close();
            }
            if (store instanceof AutoCloseable closeable) {
                closeable.close();
            }
        };
        return new EntitlementServer(config.serverPort(), engine, resources);
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        log.info("EntitlementServer started on port: {}", server.getPort());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                EntitlementServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully and releases the counter store.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (server != null) {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("EntitlementServer stopped.");
        }
        try {
            resources.close();
        } catch (Exception e) {
            log.warn("Failed to close counter store: {}", e.getMessage());
        }
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server != null ? server.getPort() : -1;
    }

    /**
     * Main entry point.
     *
     * @param args unused; configuration comes from application.conf and the environment
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        EntitlementServer server = fromConfig(MeteringConfig.load());
        server.start();
        server.blockUntilShutdown();
    }
}
