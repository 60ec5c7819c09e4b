package qarunner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kind of test a plan member refers to. */
public enum TestType {
    UI,
    API;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TestType fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
