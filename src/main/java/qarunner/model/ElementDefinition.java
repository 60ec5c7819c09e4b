package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named element in a test's element repository. {@code originalSelector}
 * keeps the selector the element was first captured with once healing has
 * replaced {@code selector}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementDefinition {

    @JsonProperty("id")
    private String id;

    @JsonProperty("selector")
    private String selector;

    @JsonProperty("originalSelector")
    private String originalSelector;

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("text")
    private String text;

    public ElementDefinition() {}

    public ElementDefinition(String id, String selector) {
        this.id       = id;
        this.selector = selector;
    }

    public ElementDefinition copy() {
        ElementDefinition c = new ElementDefinition(id, selector);
        c.originalSelector = originalSelector;
        c.tag              = tag;
        c.text             = text;
        return c;
    }

    public String getId()               { return id; }
    public String getSelector()         { return selector; }
    public String getOriginalSelector() { return originalSelector; }
    public String getTag()              { return tag; }
    public String getText()             { return text; }

    public void setId(String id)                             { this.id = id; }
    public void setSelector(String selector)                 { this.selector = selector; }
    public void setOriginalSelector(String originalSelector) { this.originalSelector = originalSelector; }
    public void setTag(String tag)                           { this.tag = tag; }
    public void setText(String text)                         { this.text = text; }
}
