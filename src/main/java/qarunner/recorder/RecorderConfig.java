package qarunner.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.config.ConfigLoader;
import qarunner.model.BrowserEngine;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Recorder settings ({@code recorder.*} keys of {@code config.properties}).
 *
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>recorder.engine</td><td>chromium</td><td>Browser engine for recording windows</td></tr>
 *   <tr><td>recorder.poll.interval.ms</td><td>1000</td><td>How often buffered actions are collected</td></tr>
 *   <tr><td>recorder.redact.types</td><td>password</td><td>Comma-separated input types whose values are masked</td></tr>
 * </table>
 */
public class RecorderConfig {

    private static final Logger log = LoggerFactory.getLogger(RecorderConfig.class);

    private static final String KEY_ENGINE        = "recorder.engine";
    private static final String KEY_POLL_INTERVAL = "recorder.poll.interval.ms";
    private static final String KEY_REDACT_TYPES  = "recorder.redact.types";

    private final Properties props;

    public RecorderConfig() {
        this(ConfigLoader.load());
    }

    /** Reads settings from already loaded properties instead of the classpath. */
    public RecorderConfig(Properties props) {
        this.props = props;
    }

    public BrowserEngine getEngine() {
        String raw = ConfigLoader.getString(props, KEY_ENGINE, "chromium");
        try {
            return BrowserEngine.fromId(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for '{}': '{}', using chromium", KEY_ENGINE, raw);
            return BrowserEngine.CHROMIUM;
        }
    }

    public long getPollIntervalMs() {
        return Math.max(100L, ConfigLoader.getLong(props, KEY_POLL_INTERVAL, 1000L));
    }

    /** Lower-cased input types; empty when redaction is switched off. */
    public List<String> getRedactTypes() {
        String raw = ConfigLoader.getString(props, KEY_REDACT_TYPES, "password");
        return Arrays.stream(raw.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
