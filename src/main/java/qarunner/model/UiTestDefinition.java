package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** A browser test: optional start URL, ordered steps and its element repository. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UiTestDefinition {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("url")
    private String url;

    @JsonProperty("steps")
    private List<TestStep> steps = new ArrayList<>();

    @JsonProperty("elements")
    private List<ElementDefinition> elements = new ArrayList<>();

    public UiTestDefinition() {}

    public UiTestDefinition(String id, String name, String url, List<TestStep> steps) {
        this.id    = id;
        this.name  = name;
        this.url   = url;
        this.steps = new ArrayList<>(steps);
    }

    public Optional<ElementDefinition> findElement(String elementId) {
        if (elementId == null || elements == null) return Optional.empty();
        return elements.stream().filter(e -> elementId.equals(e.getId())).findFirst();
    }

    public UiTestDefinition copy() {
        UiTestDefinition c = new UiTestDefinition();
        c.id       = id;
        c.name     = name;
        c.url      = url;
        c.steps    = new ArrayList<>();
        c.elements = new ArrayList<>();
        if (steps != null) steps.forEach(s -> c.steps.add(s.copy()));
        if (elements != null) elements.forEach(e -> c.elements.add(e.copy()));
        return c;
    }

    public String getId()                         { return id; }
    public String getName()                       { return name; }
    public String getUrl()                        { return url; }
    public List<TestStep> getSteps()              { return steps; }
    public List<ElementDefinition> getElements()  { return elements; }

    public void setId(String id)                               { this.id = id; }
    public void setName(String name)                           { this.name = name; }
    public void setUrl(String url)                             { this.url = url; }
    public void setSteps(List<TestStep> steps)                 { this.steps = steps; }
    public void setElements(List<ElementDefinition> elements)  { this.elements = elements; }
}
