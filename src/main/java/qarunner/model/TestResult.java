package qarunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one test (UI or API) inside an execution.
 * Steps are only populated for UI tests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestResult {

    @JsonProperty("testId")
    private String testId;

    @JsonProperty("testType")
    private TestType testType;

    @JsonProperty("name")
    private String name;

    @JsonProperty("status")
    private TestStatus status;

    @JsonProperty("steps")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<StepResult> steps = new ArrayList<>();

    @JsonProperty("error")
    private String error;

    @JsonProperty("durationMs")
    private long durationMs;

    @JsonProperty("screenshotPath")
    private String screenshotPath;

    public TestResult() {}

    public TestResult(String testId, TestType testType, String name) {
        this.testId   = testId;
        this.testType = testType;
        this.name     = name;
    }

    /** Result for a test that could not run to a verdict at all. */
    public static TestResult error(String testId, TestType testType, String name, String message) {
        TestResult r = new TestResult(testId, testType, name);
        r.status = TestStatus.ERROR;
        r.error  = message;
        return r;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == TestStatus.PASSED;
    }

    public TestResult copy() {
        TestResult c = new TestResult(testId, testType, name);
        c.status         = status;
        c.steps          = new ArrayList<>(steps);
        c.error          = error;
        c.durationMs     = durationMs;
        c.screenshotPath = screenshotPath;
        return c;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public String getTestId()           { return testId; }
    public TestType getTestType()       { return testType; }
    public String getName()             { return name; }
    public TestStatus getStatus()       { return status; }
    public List<StepResult> getSteps()  { return steps; }
    public String getError()            { return error; }
    public long getDurationMs()         { return durationMs; }
    public String getScreenshotPath()   { return screenshotPath; }

    public void setStatus(TestStatus status)             { this.status = status; }
    public void setSteps(List<StepResult> steps)         { this.steps = steps; }
    public void setError(String error)                   { this.error = error; }
    public void setDurationMs(long durationMs)           { this.durationMs = durationMs; }
    public void setScreenshotPath(String screenshotPath) { this.screenshotPath = screenshotPath; }

    @Override
    public String toString() {
        return String.format("TestResult{%s '%s' %s, %d step(s), %dms}",
                testType, testId, status, steps.size(), durationMs);
    }
}
