package qarunner.player;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of step actions. Definitions name actions with free-form ids;
 * {@link #fromId} maps the accepted spellings and returns {@code null} for
 * anything else.
 */
public enum ActionKind {
    NAVIGATE,
    CLICK,
    HOVER,
    INPUT,
    SELECT,
    WAIT,
    SCROLL,
    ASSERT_TEXT_CONTAINS,
    ASSERT_ELEMENT_COUNT,
    ASSERT;

    private static final Map<String, ActionKind> IDS = Map.ofEntries(
            Map.entry("navigate", NAVIGATE),
            Map.entry("goto", NAVIGATE),
            Map.entry("click", CLICK),
            Map.entry("hover", HOVER),
            Map.entry("input", INPUT),
            Map.entry("fill", INPUT),
            Map.entry("type", INPUT),
            Map.entry("select", SELECT),
            Map.entry("wait", WAIT),
            Map.entry("scroll", SCROLL),
            Map.entry("asserttextcontains", ASSERT_TEXT_CONTAINS),
            Map.entry("assertelementcount", ASSERT_ELEMENT_COUNT),
            Map.entry("assert", ASSERT),
            Map.entry("assertexists", ASSERT));

    /** @return the matching kind, or {@code null} if the id is not supported */
    public static ActionKind fromId(String id) {
        if (id == null) return null;
        String key = id.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return IDS.get(key);
    }

    /** Element interactions that may be retried with a healed selector. */
    public boolean isHealable() {
        return this == CLICK || this == INPUT || this == SELECT;
    }

    public boolean requiresTarget() {
        return switch (this) {
            case CLICK, HOVER, INPUT, SELECT, ASSERT_TEXT_CONTAINS, ASSERT_ELEMENT_COUNT, ASSERT -> true;
            case NAVIGATE, WAIT, SCROLL -> false;
        };
    }

    public boolean requiresValue() {
        return switch (this) {
            case INPUT, SELECT, WAIT, ASSERT_TEXT_CONTAINS, ASSERT_ELEMENT_COUNT -> true;
            case NAVIGATE, CLICK, HOVER, SCROLL, ASSERT -> false;
        };
    }
}
