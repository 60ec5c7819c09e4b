package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Ordered collection of UI and API tests executed together. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestPlan {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("members")
    private List<PlanMember> members = new ArrayList<>();

    public TestPlan() {}

    public TestPlan(String id, String name, List<PlanMember> members) {
        this.id      = id;
        this.name    = name;
        this.members = new ArrayList<>(members);
    }

    public TestPlan copy() {
        return new TestPlan(id, name, members == null ? List.of() : members);
    }

    public String getId()                { return id; }
    public String getName()              { return name; }
    public List<PlanMember> getMembers() { return members; }

    public void setId(String id)                       { this.id = id; }
    public void setName(String name)                   { this.name = name; }
    public void setMembers(List<PlanMember> members)   { this.members = members; }
}
