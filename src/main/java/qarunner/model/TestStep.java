package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One declared step of a UI test: an action identifier plus its target
 * locator and value. {@code elementId} links the step to an entry of the
 * test's element repository.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestStep {

    @JsonProperty("action")
    private String action;

    @JsonProperty("target")
    private String target;

    @JsonProperty("elementId")
    private String elementId;

    @JsonProperty("value")
    private String value;

    @JsonProperty("name")
    private String name;

    public TestStep() {}

    public TestStep(String action, String target, String value) {
        this.action = action;
        this.target = target;
        this.value  = value;
    }

    public static TestStep navigate(String url) {
        return new TestStep("navigate", null, url);
    }

    public TestStep copy() {
        TestStep c = new TestStep(action, target, value);
        c.elementId = elementId;
        c.name      = name;
        return c;
    }

    public String getAction()    { return action; }
    public String getTarget()    { return target; }
    public String getElementId() { return elementId; }
    public String getValue()     { return value; }
    public String getName()      { return name; }

    public void setAction(String action)       { this.action = action; }
    public void setTarget(String target)       { this.target = target; }
    public void setElementId(String elementId) { this.elementId = elementId; }
    public void setValue(String value)         { this.value = value; }
    public void setName(String name)           { this.name = name; }

    @Override
    public String toString() {
        return String.format("TestStep{%s '%s'%s}", action, target, value != null ? " = '" + value + "'" : "");
    }
}
