package qarunner.session;

import qarunner.config.ConfigLoader;
import qarunner.model.BrowserEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;

/**
 * Session pool settings ({@code pool.*} keys of {@code config.properties}).
 */
public class PoolConfig {

    private static final Logger log = LoggerFactory.getLogger(PoolConfig.class);

    private static final String KEY_MAX_SIZE          = "pool.max.size";
    private static final String KEY_IDLE_TIMEOUT      = "pool.idle.timeout.sec";
    private static final String KEY_SWEEP_INTERVAL    = "pool.sweep.interval.sec";
    private static final String KEY_PAGE_LOAD_TIMEOUT = "pool.page.load.timeout.sec";
    private static final String KEY_SCRIPT_TIMEOUT    = "pool.script.timeout.sec";
    private static final String KEY_DEFAULT_ENGINE    = "pool.default.engine";
    private static final String KEY_DEFAULT_HEADLESS  = "pool.default.headless";

    private final Properties props;

    public PoolConfig() {
        this(ConfigLoader.load());
    }

    /** Reads settings from already loaded properties instead of the classpath. */
    public PoolConfig(Properties props) {
        this.props = props;
    }

    /** Soft cap on pooled sessions; overflow sessions are still launched (default: 5). */
    public int getMaxSize() {
        return Math.max(1, ConfigLoader.getInt(props, KEY_MAX_SIZE, 5));
    }

    /** Idle sessions older than this are closed by the sweep (default: 5 minutes). */
    public Duration getIdleTimeout() {
        return Duration.ofSeconds(ConfigLoader.getLong(props, KEY_IDLE_TIMEOUT, 300L));
    }

    /** Interval of the background sweep (default: 1 minute). */
    public Duration getSweepInterval() {
        return Duration.ofSeconds(Math.max(1L, ConfigLoader.getLong(props, KEY_SWEEP_INTERVAL, 60L)));
    }

    public Duration getPageLoadTimeout() {
        return Duration.ofSeconds(ConfigLoader.getLong(props, KEY_PAGE_LOAD_TIMEOUT, 30L));
    }

    public Duration getScriptTimeout() {
        return Duration.ofSeconds(ConfigLoader.getLong(props, KEY_SCRIPT_TIMEOUT, 30L));
    }

    /** Engine used when a run does not override it (default: chromium). */
    public BrowserEngine getDefaultEngine() {
        String raw = ConfigLoader.getString(props, KEY_DEFAULT_ENGINE, "chromium");
        try {
            return BrowserEngine.fromId(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for '{}': '{}', using chromium", KEY_DEFAULT_ENGINE, raw);
            return BrowserEngine.CHROMIUM;
        }
    }

    public boolean isDefaultHeadless() {
        return ConfigLoader.getBool(props, KEY_DEFAULT_HEADLESS, true);
    }
}
