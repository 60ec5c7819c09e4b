package qarunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A recurring (or one-shot) trigger for a test plan.
 *
 * <p>{@code frequency} is one of {@code daily}, {@code weekly}, {@code monthly},
 * {@code once}, {@code cron:<expr>} or {@code every_N_minutes|hours|days}.
 * The time-of-day, weekday and day-of-month of fixed recurrences are taken
 * from {@code nextRunAt}, interpreted in UTC.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Schedule {

    public static final String FREQUENCY_ONCE = "once";

    @JsonProperty("id")
    private String id;

    @JsonProperty("planId")
    private String planId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("frequency")
    private String frequency;

    @JsonProperty("nextRunAt")
    private Instant nextRunAt;

    @JsonProperty("lastRunAt")
    private Instant lastRunAt;

    @JsonProperty("active")
    private boolean active = true;

    @JsonProperty("retryPolicy")
    private RetryPolicy retryPolicy = RetryPolicy.NONE;

    /** Re-runs allowed by {@link RetryPolicy#RETRY_N}. */
    @JsonProperty("retryCount")
    private int retryCount;

    @JsonProperty("environment")
    private String environment;

    @JsonProperty("browsers")
    private List<String> browsers = new ArrayList<>();

    @JsonProperty("headless")
    private Boolean headless;

    public Schedule() {}

    public Schedule(String id, String planId, String frequency, Instant nextRunAt) {
        this.id        = id;
        this.planId    = planId;
        this.name      = id;
        this.frequency = frequency;
        this.nextRunAt = nextRunAt;
    }

    /** Detached copy, so stores never share mutable state with callers. */
    public Schedule copy() {
        Schedule c = new Schedule(id, planId, frequency, nextRunAt);
        c.name        = name;
        c.lastRunAt   = lastRunAt;
        c.active      = active;
        c.retryPolicy = retryPolicy;
        c.retryCount  = retryCount;
        c.environment = environment;
        c.browsers    = browsers == null ? new ArrayList<>() : new ArrayList<>(browsers);
        c.headless    = headless;
        return c;
    }

    @JsonIgnore
    public boolean isOnce() {
        return FREQUENCY_ONCE.equalsIgnoreCase(frequency == null ? "" : frequency.trim());
    }

    /**
     * Engine the runs of this schedule use: the first listed browser, or
     * {@code null} when none is listed. Every listed name must be known.
     *
     * @throws IllegalArgumentException if any listed browser is unknown
     */
    @JsonIgnore
    public BrowserEngine primaryBrowser() {
        if (browsers == null || browsers.isEmpty()) return null;
        BrowserEngine first = null;
        for (String name : browsers) {
            BrowserEngine engine = BrowserEngine.fromId(name);
            if (first == null) first = engine;
        }
        return first;
    }

    /**
     * Overrides applied to every run of this schedule.
     *
     * @throws IllegalArgumentException if any listed browser is unknown
     */
    @JsonIgnore
    public ExecutionOverrides toOverrides() {
        return new ExecutionOverrides(environment, primaryBrowser(), headless);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public String getId()                 { return id; }
    public String getPlanId()             { return planId; }
    public String getName()               { return name; }
    public String getFrequency()          { return frequency; }
    public Instant getNextRunAt()         { return nextRunAt; }
    public Instant getLastRunAt()         { return lastRunAt; }
    public boolean isActive()             { return active; }
    public RetryPolicy getRetryPolicy()   { return retryPolicy == null ? RetryPolicy.NONE : retryPolicy; }
    public int getRetryCount()            { return retryCount; }
    public String getEnvironment()        { return environment; }
    public List<String> getBrowsers()     { return browsers; }
    public Boolean getHeadless()          { return headless; }

    public void setId(String id)                       { this.id = id; }
    public void setPlanId(String planId)               { this.planId = planId; }
    public void setName(String name)                   { this.name = name; }
    public void setFrequency(String frequency)         { this.frequency = frequency; }
    public void setNextRunAt(Instant nextRunAt)        { this.nextRunAt = nextRunAt; }
    public void setLastRunAt(Instant lastRunAt)        { this.lastRunAt = lastRunAt; }
    public void setActive(boolean active)              { this.active = active; }
    public void setRetryPolicy(RetryPolicy retryPolicy){ this.retryPolicy = retryPolicy; }
    public void setRetryCount(int retryCount)          { this.retryCount = retryCount; }
    public void setEnvironment(String environment)     { this.environment = environment; }
    public void setBrowsers(List<String> browsers)     { this.browsers = browsers; }
    public void setHeadless(Boolean headless)          { this.headless = headless; }

    @Override
    public String toString() {
        return String.format("Schedule{id='%s', plan='%s', frequency='%s', next=%s, active=%s}",
                id, planId, frequency, nextRunAt, active);
    }
}
