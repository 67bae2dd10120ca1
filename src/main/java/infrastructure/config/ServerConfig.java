package infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Listener and pool settings.
 * <p>
 * Resolution: first CLI argument (port), then the {@code server.port},
 * {@code server.workers} and {@code server.backlog} system properties, then defaults.
 * </p>
 */
public record ServerConfig(int port, int workers, int backlog) {

    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_PORT = 3003;
    public static final int DEFAULT_WORKERS = 8;
    public static final int DEFAULT_BACKLOG = 128;

    public static final String PORT_PROPERTY = "server.port";
    public static final String WORKERS_PROPERTY = "server.workers";
    public static final String BACKLOG_PROPERTY = "server.backlog";

    public ServerConfig {
        if (port < 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (backlog < 1) throw new IllegalArgumentException("backlog must be >= 1: " + backlog);
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, DEFAULT_WORKERS, DEFAULT_BACKLOG);
    }

    public static ServerConfig resolve(String[] args) {
        return resolve(args, System.getProperties());
    }

    static ServerConfig resolve(String[] args, Properties props) {
        String portText = args != null && args.length > 0 ? args[0] : props.getProperty(PORT_PROPERTY);
        int port = positive(PORT_PROPERTY, portText, DEFAULT_PORT, 65_535);
        int workers = positive(WORKERS_PROPERTY, props.getProperty(WORKERS_PROPERTY), DEFAULT_WORKERS, Integer.MAX_VALUE);
        int backlog = positive(BACKLOG_PROPERTY, props.getProperty(BACKLOG_PROPERTY), DEFAULT_BACKLOG, Integer.MAX_VALUE);
        return new ServerConfig(port, workers, backlog);
    }

    private static int positive(String key, String text, int fallback, int max) {
        if (text == null || text.isBlank()) return fallback;
        try {
            int v = Integer.parseInt(text.trim());
            if (v >= 1 && v <= max) return v;
        } catch (NumberFormatException ignored) {
            // reported below
        }
        log.warn("ignoring invalid {}='{}', using {}", key, text, fallback);
        return fallback;
    }
}
