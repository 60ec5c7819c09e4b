package qarunner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Browser engines a session can be launched with. */
public enum BrowserEngine {
    CHROMIUM("chromium"),
    FIREFOX("firefox"),
    EDGE("edge");

    private final String id;

    BrowserEngine(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves an engine name as written in definitions and overrides.
     * {@code chrome} is accepted as an alias of {@code chromium},
     * {@code msedge} of {@code edge}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    @JsonCreator
    public static BrowserEngine fromId(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Browser engine must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "chromium", "chrome" -> CHROMIUM;
            case "firefox" -> FIREFOX;
            case "edge", "msedge" -> EDGE;
            default -> throw new IllegalArgumentException("Unknown browser engine: " + name);
        };
    }
}
