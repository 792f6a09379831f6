package mobileqa.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Reads {@code mobileqa.properties} from the classpath and exposes typed
 * session, element and navigation settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code mobileqa.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class SessionConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    private static final String CONFIG_FILE       = "mobileqa.properties";
    private static final String CONFIG_LOCAL_FILE = "mobileqa.local.properties";

    // Property keys
    private static final String KEY_SERVER_URL         = "session.server.url";
    private static final String KEY_CAPABILITY_PREFIX  = "capability.";
    private static final String KEY_LOCATOR_STRATEGY   = "locator.strategy";
    private static final String KEY_RESOLUTION         = "element.resolution";
    private static final String KEY_TIMEOUT            = "element.timeout.ms";
    private static final String KEY_POLL               = "element.poll.ms";
    private static final String KEY_MAX_ATTEMPTS       = "element.max.attempts";
    private static final String KEY_BACKOFF            = "element.backoff.multiplier";
    private static final String KEY_MAX_POLL           = "element.max.poll.ms";
    private static final String KEY_HOP_TIMEOUT        = "navigation.hop.timeout.ms";

    // Defaults
    private static final String          DEFAULT_SERVER_URL       = "http://127.0.0.1:4723";
    private static final LocatorStrategy DEFAULT_LOCATOR_STRATEGY = LocatorStrategy.XPATH;
    private static final ResolutionMode  DEFAULT_RESOLUTION       = ResolutionMode.COMPOSED;
    private static final long            DEFAULT_TIMEOUT          = 10_000L;
    private static final long            DEFAULT_POLL             = 500L;
    private static final int             DEFAULT_MAX_ATTEMPTS     = 20;
    private static final double          DEFAULT_BACKOFF          = 1.5;
    private static final long            DEFAULT_MAX_POLL         = 2_000L;
    private static final long            DEFAULT_HOP_TIMEOUT      = 10_000L;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code mobileqa.local.properties} values override {@code mobileqa.properties}.
     *
     * @throws IllegalStateException if the base mobileqa.properties cannot be loaded
     */
    public SessionConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** Package-private constructor for tests. */
    SessionConfig(Properties props) {
        this.props = props;
    }

    /** Builds a config from explicit properties, e.g. the CLI's {@code -D} options. */
    public static SessionConfig of(Properties props) {
        return new SessionConfig(props);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Automation server URL (default: http://127.0.0.1:4723). */
    public String getServerUrl() {
        return props.getProperty(KEY_SERVER_URL, DEFAULT_SERVER_URL).trim();
    }

    /**
     * Driver capabilities: every {@code capability.X=value} key becomes
     * capability {@code X}, in key order. {@code "true"}/{@code "false"} and
     * integers are passed as booleans and numbers.
     */
    public Map<String, Object> getCapabilities() {
        Map<String, Object> caps = new LinkedHashMap<>();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            if (!key.startsWith(KEY_CAPABILITY_PREFIX)) continue;
            String raw = props.getProperty(key).trim();
            caps.put(key.substring(KEY_CAPABILITY_PREFIX.length()), typedCapability(raw));
        }
        return caps;
    }

    /** Strategy used to send locators to the driver (default: xpath). */
    public LocatorStrategy getLocatorStrategy() {
        return getEnum(KEY_LOCATOR_STRATEGY, LocatorStrategy.class, DEFAULT_LOCATOR_STRATEGY);
    }

    /** How relational elements are resolved (default: composed). */
    public ResolutionMode getResolutionMode() {
        return getEnum(KEY_RESOLUTION, ResolutionMode.class, DEFAULT_RESOLUTION);
    }

    /** Overall deadline for resolving one element (default: 10 s). */
    public Duration getElementTimeout() {
        return Duration.ofMillis(getLong(KEY_TIMEOUT, DEFAULT_TIMEOUT));
    }

    /** Delay before the second lookup attempt (default: 500 ms). */
    public Duration getPollInterval() {
        return Duration.ofMillis(getLong(KEY_POLL, DEFAULT_POLL));
    }

    /** Lookup attempts per operation (default: 20). */
    public int getMaxAttempts() {
        return getInt(KEY_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
    }

    /** Factor applied to the delay after each failed attempt (default: 1.5). */
    public double getBackoffMultiplier() {
        return getDouble(KEY_BACKOFF, DEFAULT_BACKOFF);
    }

    /** Upper bound for the delay between attempts (default: 2 s). */
    public Duration getMaxPollInterval() {
        return Duration.ofMillis(getLong(KEY_MAX_POLL, DEFAULT_MAX_POLL));
    }

    /** How long a navigation hop may take to land on its page (default: 10 s). */
    public Duration getHopTimeout() {
        return Duration.ofMillis(getLong(KEY_HOP_TIMEOUT, DEFAULT_HOP_TIMEOUT));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static Object typedCapability(String raw) {
        if (raw.equalsIgnoreCase("true"))  return Boolean.TRUE;
        if (raw.equalsIgnoreCase("false")) return Boolean.FALSE;
        if (raw.matches("-?\\d{1,9}"))     return Integer.parseInt(raw);
        return raw;
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
