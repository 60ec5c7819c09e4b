package qarunner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Loads {@code config.properties} from the classpath and applies the optional
 * {@code config.local.properties} overrides on top of it.
 *
 * <p>The typed helpers fall back to the supplied default, logging a warning,
 * when a value is present but cannot be parsed.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    private ConfigLoader() {}

    /**
     * Reads the base file and local overrides. A missing base file is tolerated
     * (all getters then return their defaults).
     *
     * @throws IllegalStateException if the base file exists but cannot be read
     */
    public static Properties load() {
        Properties props = new Properties();
        ClassLoader cl = ConfigLoader.class.getClassLoader();

        try (InputStream base = cl.getResourceAsStream(CONFIG_FILE)) {
            if (base != null) {
                props.load(base);
                log.debug("Loaded base config from {}", CONFIG_FILE);
            } else {
                log.warn("{} not found on classpath; using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = cl.getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}; using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
        return props;
    }

    // ── Typed accessors ────────────────────────────────────────────────────

    public static String getString(Properties props, String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? defaultValue : raw.trim();
    }

    public static int getInt(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public static long getLong(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public static double getDouble(Properties props, String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public static boolean getBool(Properties props, String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
