package quota.java.grpc;

/**
 * Settings for {@link QuotaServer}.
 *
 * @param port Port to listen on (0 picks a free port)
 * @param shutdownTimeoutSeconds How long a graceful shutdown may take
 */
public record ServerConfig(int port, int shutdownTimeoutSeconds) {

    public static final int DEFAULT_PORT = 9090;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 5;

    static final String PORT_PROPERTY = "quota.server.port";
    static final String SHUTDOWN_TIMEOUT_PROPERTY = "quota.server.shutdownTimeoutSeconds";

    public ServerConfig {
        if (port < 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
        if (shutdownTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("shutdownTimeoutSeconds must be > 0, got: " + shutdownTimeoutSeconds);
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    /**
     * Resolves the configuration: port from the first argument, else the
     * {@code quota.server.port} system property, else 9090; shutdown timeout from
     * {@code quota.server.shutdownTimeoutSeconds}, else 5.
     *
     * @param args Command line arguments (may be empty)
     * @return resolved configuration
     * @throws IllegalArgumentException if a value is not a valid integer or out of range
     */
    public static ServerConfig load(String[] args) {
        String portValue = (args != null && args.length > 0)
            ? args[0]
            : System.getProperty(PORT_PROPERTY, String.valueOf(DEFAULT_PORT));
        String timeoutValue = System.getProperty(
            SHUTDOWN_TIMEOUT_PROPERTY, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));

        return new ServerConfig(parse("port", portValue), parse("shutdown timeout", timeoutValue));
    }

    private static int parse(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
