package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One user interaction captured by a recording session. The final action of
 * every stopped recording has type {@link #TYPE_STOP}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordedAction {

    public static final String TYPE_NAVIGATE = "navigate";
    public static final String TYPE_STOP     = "stop";

    @JsonProperty("type")
    private String type;

    @JsonProperty("selector")
    private String selector;

    @JsonProperty("value")
    private String value;

    @JsonProperty("url")
    private String url;

    @JsonProperty("timestamp")
    private Instant timestamp;

    public RecordedAction() {}

    public RecordedAction(String type, String selector, String value, String url, Instant timestamp) {
        this.type      = type;
        this.selector  = selector;
        this.value     = value;
        this.url       = url;
        this.timestamp = timestamp;
    }

    public static RecordedAction navigate(String url, Instant at) {
        return new RecordedAction(TYPE_NAVIGATE, null, null, url, at);
    }

    public static RecordedAction stop(Instant at) {
        return new RecordedAction(TYPE_STOP, null, null, null, at);
    }

    public String getType()       { return type; }
    public String getSelector()   { return selector; }
    public String getValue()      { return value; }
    public String getUrl()        { return url; }
    public Instant getTimestamp() { return timestamp; }

    public void setType(String type)            { this.type = type; }
    public void setSelector(String selector)    { this.selector = selector; }
    public void setValue(String value)          { this.value = value; }
    public void setUrl(String url)              { this.url = url; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    @Override
    public String toString() {
        return String.format("RecordedAction{%s %s}", type, selector != null ? selector : url);
    }
}
