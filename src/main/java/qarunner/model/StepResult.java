package qarunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one executed step. A healing retry is recorded as a sub-step of
 * the step it repaired.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepResult {

    @JsonProperty("index")
    private int index;

    @JsonProperty("action")
    private String action;

    @JsonProperty("target")
    private String target;

    @JsonProperty("value")
    private String value;

    @JsonProperty("status")
    private StepStatus status;

    @JsonProperty("error")
    private String error;

    @JsonProperty("details")
    private String details;

    @JsonProperty("screenshotPath")
    private String screenshotPath;

    @JsonProperty("healed")
    private boolean healed;

    @JsonProperty("healedLocator")
    private String healedLocator;

    @JsonProperty("rootCause")
    private String rootCause;

    @JsonProperty("durationMs")
    private long durationMs;

    @JsonProperty("subSteps")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<StepResult> subSteps = new ArrayList<>();

    public StepResult() {}

    public StepResult(int index, String action, String target, String value) {
        this.index  = index;
        this.action = action;
        this.target = target;
        this.value  = value;
    }

    // ── Outcome ────────────────────────────────────────────────────────────

    public StepResult passed(String details) {
        this.status  = StepStatus.PASSED;
        this.details = details;
        this.error   = null;
        return this;
    }

    public StepResult failed(String error) {
        this.status = StepStatus.FAILED;
        this.error  = error;
        return this;
    }

    /** Marks the step as repaired by {@code locator}; the step itself counts as passed. */
    public StepResult healedWith(String locator, String details) {
        this.healed        = true;
        this.healedLocator = locator;
        return passed(details);
    }

    public void addSubStep(StepResult subStep) {
        subSteps.add(subStep);
    }

    @JsonIgnore
    public boolean isPassed() {
        return status == StepStatus.PASSED;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public int getIndex()                 { return index; }
    public String getAction()             { return action; }
    public String getTarget()             { return target; }
    public String getValue()              { return value; }
    public StepStatus getStatus()         { return status; }
    public String getError()              { return error; }
    public String getDetails()            { return details; }
    public String getScreenshotPath()     { return screenshotPath; }
    public boolean isHealed()             { return healed; }
    public String getHealedLocator()      { return healedLocator; }
    public String getRootCause()          { return rootCause; }
    public long getDurationMs()           { return durationMs; }
    public List<StepResult> getSubSteps() { return subSteps; }

    public void setScreenshotPath(String screenshotPath) { this.screenshotPath = screenshotPath; }
    public void setRootCause(String rootCause)           { this.rootCause = rootCause; }
    public void setDurationMs(long durationMs)           { this.durationMs = durationMs; }

    @Override
    public String toString() {
        return String.format("StepResult{#%d %s '%s' %s%s}", index, action, target, status,
                healed ? " [HEALED -> " + healedLocator + "]" : "");
    }
}
