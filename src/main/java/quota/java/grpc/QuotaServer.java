package quota.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quota.core.clock.SystemClock;
import quota.java.engine.InMemoryKeyRegistry;
import quota.java.engine.QuotaEngine;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the quota service.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090), see {@link ServerConfig#load(String[])}</li>
 *   <li>API key authentication and request id logging on every call</li>
 *   <li>Graceful shutdown with timeout; the engine is closed afterwards</li>
 *   <li>SystemClock for production</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * // Run with defaults
 * java -cp ... quota.java.grpc.QuotaServer
 *
 * // Run with custom port
 * java -cp ... quota.java.grpc.QuotaServer 8080
 * </pre>
 */
public final class QuotaServer {

    private static final Logger LOG = LoggerFactory.getLogger(QuotaServer.class);

    private final Server server;
    private final QuotaEngine engine;
    private final ServerConfig config;

    public QuotaServer(ServerConfig config) {
        this(config, createDefaultEngine());
    }

    /**
     * Creates a server with a custom engine (useful for testing).
     *
     * @param config Port and shutdown settings
     * @param engine Quota engine
     */
    public QuotaServer(ServerConfig config, QuotaEngine engine) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.config = config;
        this.engine = engine;
        // Interceptors run last-to-first: request id wraps authentication
        this.server = ServerBuilder.forPort(config.port())
            .addService(ServerInterceptors.intercept(
                new QuotaServiceImpl(engine),
                new ApiKeyAuthInterceptor(engine.registry()),
                new RequestIdInterceptor()))
            .build();
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        LOG.info("QuotaServer started on port: {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.warn("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                QuotaServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully, then closes the engine.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        try {
            if (!server.shutdown().awaitTermination(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                LOG.warn("Server did not terminate within {}s, forcing shutdown", config.shutdownTimeoutSeconds());
                server.shutdownNow();
            }
        } finally {
            engine.close();
        }
        LOG.info("QuotaServer stopped.");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    private static QuotaEngine createDefaultEngine() {
        return new QuotaEngine(SystemClock.instance(), new InMemoryKeyRegistry());
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        ServerConfig config;
        try {
            config = ServerConfig.load(args);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        QuotaServer server = new QuotaServer(config);
        server.start();
        server.blockUntilShutdown();
    }
}
