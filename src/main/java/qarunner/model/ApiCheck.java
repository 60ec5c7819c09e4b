package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One assertion of an API test.
 *
 * <ul>
 *   <li>{@code STATUS_CODE}: {@code expected} is the exact status</li>
 *   <li>{@code STATUS_RANGE}: {@code expected} is {@code lo-hi}, inclusive</li>
 *   <li>{@code BODY_CONTAINS}: case-insensitive substring</li>
 *   <li>{@code JSON_PATH_EQUALS}: {@code path} is a dot path, compared as text</li>
 *   <li>{@code HEADER_EQUALS}: {@code path} is the header name</li>
 *   <li>{@code DURATION_BELOW}: {@code expected} is a millisecond bound</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiCheck {

    public enum Type { STATUS_CODE, STATUS_RANGE, BODY_CONTAINS, JSON_PATH_EQUALS, HEADER_EQUALS, DURATION_BELOW }

    @JsonProperty("type")
    private Type type;

    @JsonProperty("path")
    private String path;

    @JsonProperty("expected")
    private String expected;

    public ApiCheck() {}

    public ApiCheck(Type type, String path, String expected) {
        this.type     = type;
        this.path     = path;
        this.expected = expected;
    }

    public static ApiCheck status(int code) {
        return new ApiCheck(Type.STATUS_CODE, null, String.valueOf(code));
    }

    public Type getType()        { return type; }
    public String getPath()      { return path; }
    public String getExpected()  { return expected; }

    public void setType(Type type)            { this.type = type; }
    public void setPath(String path)          { this.path = path; }
    public void setExpected(String expected)  { this.expected = expected; }

    @Override
    public String toString() {
        return type + (path != null ? "(" + path + ")" : "") + "=" + expected;
    }
}
