package qarunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One run of a test plan. Status only moves forward
 * ({@code PENDING -> RUNNING -> PASSED|FAILED|PARTIAL|ERROR}); once terminal,
 * every mutator throws {@link IllegalStateException}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionRecord {

    @JsonProperty("id")
    private String id;

    @JsonProperty("planId")
    private String planId;

    @JsonProperty("scheduleId")
    private String scheduleId;

    @JsonProperty("status")
    private ExecutionStatus status;

    @JsonProperty("startedAt")
    private Instant startedAt;

    @JsonProperty("completedAt")
    private Instant completedAt;

    @JsonProperty("results")
    private List<TestResult> results = new ArrayList<>();

    @JsonProperty("triggerSource")
    private TriggerSource triggerSource;

    @JsonProperty("triggeredBy")
    private String triggeredBy;

    @JsonProperty("environment")
    private String environment;

    @JsonProperty("errorMessage")
    private String errorMessage;

    @JsonProperty("totalTests")
    private int totalTests;

    @JsonProperty("passedTests")
    private int passedTests;

    @JsonProperty("failedTests")
    private int failedTests;

    @JsonProperty("erroredTests")
    private int erroredTests;

    @JsonProperty("executionDurationMs")
    private Long executionDurationMs;

    protected ExecutionRecord() {}

    /** New record in {@code PENDING} state. */
    public static ExecutionRecord pending(String id, String planId, RunOrigin origin,
                                          String environment, Instant now) {
        ExecutionRecord r = new ExecutionRecord();
        r.id            = id;
        r.planId        = planId;
        r.scheduleId    = origin.scheduleId();
        r.triggerSource = origin.source();
        r.triggeredBy   = origin.requestedBy();
        r.environment   = environment;
        r.status        = ExecutionStatus.PENDING;
        r.startedAt     = now;
        return r;
    }

    // ── Transitions ────────────────────────────────────────────────────────

    public void markRunning() {
        if (status != ExecutionStatus.PENDING) {
            throw new IllegalStateException(
                    "Execution " + id + " cannot move to RUNNING from " + status);
        }
        status = ExecutionStatus.RUNNING;
    }

    public void appendResult(TestResult result) {
        if (status != ExecutionStatus.RUNNING) {
            throw new IllegalStateException(
                    "Execution " + id + " is " + status + "; results can only be appended while RUNNING");
        }
        results.add(result);
    }

    /**
     * Moves the record to a terminal status and fills the summary counters.
     *
     * @throws IllegalStateException if already terminal or {@code terminal} is not a terminal status
     */
    public void complete(ExecutionStatus terminal, Instant at, String error) {
        if (!terminal.isTerminal()) {
            throw new IllegalStateException(terminal + " is not a terminal status");
        }
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Execution " + id + " already completed with " + status);
        }
        status       = terminal;
        completedAt  = at;
        errorMessage = error;
        totalTests   = results.size();
        passedTests  = (int) results.stream().filter(t -> t.getStatus() == TestStatus.PASSED).count();
        failedTests  = (int) results.stream().filter(t -> t.getStatus() == TestStatus.FAILED).count();
        erroredTests = (int) results.stream().filter(t -> t.getStatus() == TestStatus.ERROR).count();
        if (startedAt != null && at != null) {
            executionDurationMs = Duration.between(startedAt, at).toMillis();
        }
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public ExecutionRecord copy() {
        ExecutionRecord c = new ExecutionRecord();
        c.id                  = id;
        c.planId              = planId;
        c.scheduleId          = scheduleId;
        c.status              = status;
        c.startedAt           = startedAt;
        c.completedAt         = completedAt;
        c.results             = new ArrayList<>(results);
        c.triggerSource       = triggerSource;
        c.triggeredBy         = triggeredBy;
        c.environment         = environment;
        c.errorMessage        = errorMessage;
        c.totalTests          = totalTests;
        c.passedTests         = passedTests;
        c.failedTests         = failedTests;
        c.erroredTests        = erroredTests;
        c.executionDurationMs = executionDurationMs;
        return c;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public String getId()                 { return id; }
    public String getPlanId()             { return planId; }
    public String getScheduleId()         { return scheduleId; }
    public ExecutionStatus getStatus()    { return status; }
    public Instant getStartedAt()         { return startedAt; }
    public Instant getCompletedAt()       { return completedAt; }
    public List<TestResult> getResults()  { return Collections.unmodifiableList(results); }
    public TriggerSource getTriggerSource() { return triggerSource; }
    public String getTriggeredBy()        { return triggeredBy; }
    public String getEnvironment()        { return environment; }
    public String getErrorMessage()       { return errorMessage; }
    public int getTotalTests()            { return totalTests; }
    public int getPassedTests()           { return passedTests; }
    public int getFailedTests()           { return failedTests; }
    public int getErroredTests()          { return erroredTests; }
    public Long getExecutionDurationMs()  { return executionDurationMs; }

    @Override
    public String toString() {
        return String.format("ExecutionRecord{id='%s', plan='%s', status=%s, results=%d}",
                id, planId, status, results.size());
    }
}
