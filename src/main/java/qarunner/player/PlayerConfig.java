package qarunner.player;

import qarunner.config.ConfigLoader;

import java.util.Properties;

/**
 * Step execution settings ({@code player.*} keys of {@code config.properties}).
 */
public class PlayerConfig {

    private static final String KEY_EXPLICIT_WAIT     = "player.explicit.wait.sec";
    private static final String KEY_STEP_DELAY        = "player.step.delay.ms";
    private static final String KEY_EVIDENCE_DIR      = "player.evidence.dir";
    private static final String KEY_SCREENSHOT_FAIL   = "player.screenshot.on.failure";
    private static final String KEY_PAGE_SOURCE_FAIL  = "player.page.source.on.failure";
    private static final String KEY_HEALING_ENABLED   = "player.healing.enabled";

    private final Properties props;

    public PlayerConfig() {
        this(ConfigLoader.load());
    }

    /** Reads settings from already loaded properties instead of the classpath. */
    public PlayerConfig(Properties props) {
        this.props = props;
    }

    /** Explicit wait per element lookup in seconds (default: 15). */
    public int getExplicitWaitSec() {
        return ConfigLoader.getInt(props, KEY_EXPLICIT_WAIT, 15);
    }

    /** Pause between consecutive steps in milliseconds (default: 0). */
    public long getStepDelayMs() {
        return Math.max(0L, ConfigLoader.getLong(props, KEY_STEP_DELAY, 0L));
    }

    /** Directory where failure evidence is written (default: "evidence"). */
    public String getEvidenceDir() {
        return ConfigLoader.getString(props, KEY_EVIDENCE_DIR, "evidence");
    }

    public boolean isScreenshotOnFailure() {
        return ConfigLoader.getBool(props, KEY_SCREENSHOT_FAIL, true);
    }

    public boolean isPageSourceOnFailure() {
        return ConfigLoader.getBool(props, KEY_PAGE_SOURCE_FAIL, true);
    }

    /** Whether failed interactions are retried with a healed selector (default: true). */
    public boolean isHealingEnabled() {
        return ConfigLoader.getBool(props, KEY_HEALING_ENABLED, true);
    }
}
