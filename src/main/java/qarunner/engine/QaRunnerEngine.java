package qarunner.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.ai.AIConfig;
import qarunner.ai.FailureAnalyzer;
import qarunner.ai.SelectorHealer;
import qarunner.api.ApiClient;
import qarunner.api.ApiTestRunner;
import qarunner.config.ConfigLoader;
import qarunner.execution.AdhocRunner;
import qarunner.execution.ExecutionListener;
import qarunner.execution.JsonExecutionReportWriter;
import qarunner.execution.PlanOrchestrator;
import qarunner.model.ElementDefinition;
import qarunner.model.ExecutionOverrides;
import qarunner.model.ExecutionRecord;
import qarunner.model.RecordedAction;
import qarunner.model.RunOrigin;
import qarunner.model.Schedule;
import qarunner.model.TestResult;
import qarunner.model.TestStep;
import qarunner.player.HealingListener;
import qarunner.player.PlayerConfig;
import qarunner.player.StepExecutor;
import qarunner.player.TestRunner;
import qarunner.recorder.RecorderConfig;
import qarunner.recorder.RecordingController;
import qarunner.scheduler.RecurrenceTranslator;
import qarunner.scheduler.ScheduleRegistry;
import qarunner.scheduler.SchedulerConfig;
import qarunner.session.PoolConfig;
import qarunner.session.SeleniumSessionLauncher;
import qarunner.session.SessionLauncher;
import qarunner.session.SessionPool;
import qarunner.store.DefinitionStore;
import qarunner.store.ExecutionRecordStore;
import qarunner.store.InMemoryExecutionRecordStore;
import qarunner.store.ScheduleStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Entry point of the runner: schedules, manual plan runs, ad-hoc sequences
 * and interactive recordings, all sharing one browser session pool.
 *
 * <h3>Typical usage</h3>
 * <pre>{@code
 * try (QaRunnerEngine engine = QaRunnerEngine.builder()
 *         .definitions(definitionStore)
 *         .schedules(scheduleStore)
 *         .build()) {
 *     engine.loadAllSchedules();
 *     ExecutionRecord record = engine.runPlan("smoke", "alice", ExecutionOverrides.none());
 * }
 * }</pre>
 */
public class QaRunnerEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QaRunnerEngine.class);

    private final ScheduleStore schedules;
    private final ExecutionRecordStore records;
    private final SessionPool pool;
    private final PlanOrchestrator orchestrator;
    private final ScheduleRegistry registry;
    private final RecordingController recorder;
    private final AdhocRunner adhocRunner;

    QaRunnerEngine(ScheduleStore schedules, ExecutionRecordStore records, SessionPool pool,
                   PlanOrchestrator orchestrator, ScheduleRegistry registry,
                   RecordingController recorder, AdhocRunner adhocRunner) {
        this.schedules    = schedules;
        this.records      = records;
        this.pool         = pool;
        this.orchestrator = orchestrator;
        this.registry     = registry;
        this.recorder     = recorder;
        this.adhocRunner  = adhocRunner;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Schedules ─────────────────────────────────────────────────────────

    /**
     * @throws qarunner.scheduler.InvalidRecurrenceException if the frequency cannot be parsed
     * @throws IllegalArgumentException if a listed browser is unknown
     * @return whether a timer was armed
     */
    public boolean armSchedule(Schedule schedule) {
        RecurrenceTranslator.validate(schedule.getFrequency());
        schedule.primaryBrowser();
        return registry.arm(schedule);
    }

    public boolean disarmSchedule(String scheduleId) {
        return registry.disarm(scheduleId);
    }

    /**
     * @throws qarunner.scheduler.InvalidRecurrenceException if the frequency cannot be parsed
     * @throws IllegalArgumentException if a listed browser is unknown
     */
    public boolean rearmSchedule(Schedule schedule) {
        RecurrenceTranslator.validate(schedule.getFrequency());
        schedule.primaryBrowser();
        return registry.rearm(schedule);
    }

    public int loadAllSchedules() {
        return registry.loadAll();
    }

    public Set<String> armedScheduleIds() {
        return registry.armedIds();
    }

    public Optional<Schedule> findSchedule(String scheduleId) {
        return schedules.find(scheduleId);
    }

    // ── Executions ────────────────────────────────────────────────────────

    /**
     * Manual run of a plan on the calling thread.
     *
     * @throws qarunner.execution.PlanNotFoundException if the plan does not exist
     */
    public ExecutionRecord runPlan(String planId, String requestedBy, ExecutionOverrides overrides) {
        return orchestrator.run(planId, RunOrigin.manual(requestedBy), overrides);
    }

    public ExecutionRecord runPlan(String planId, ExecutionOverrides overrides) {
        return runPlan(planId, "manual", overrides);
    }

    public Optional<ExecutionRecord> findExecution(String executionId) {
        return records.find(executionId);
    }

    public TestResult runAdhocSequence(String url, List<TestStep> steps, List<ElementDefinition> elements,
                                       ExecutionOverrides overrides) {
        return adhocRunner.run(url, steps, elements, overrides);
    }

    // ── Recordings ────────────────────────────────────────────────────────

    /**
     * @throws qarunner.recorder.RecordingException if the recording cannot be started
     */
    public String startRecording(String url, String userId) {
        return recorder.start(url, userId);
    }

    public Optional<List<RecordedAction>> pollRecording(String sessionId, String userId) {
        return recorder.poll(sessionId, userId);
    }

    public Optional<List<RecordedAction>> stopRecording(String sessionId, String userId) {
        return recorder.stop(sessionId, userId);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /** Pool size, for status reporting. */
    public int openSessions() {
        return pool.size();
    }

    @Override
    public void close() {
        log.info("Shutting down engine");
        registry.shutdown();
        recorder.close();
        pool.close();
    }

    // ── Builder ───────────────────────────────────────────────────────────

    /**
     * Wires the engine. Definition and schedule stores are required; every
     * other collaborator defaults to the configured implementation.
     */
    public static class Builder {

        private DefinitionStore definitions;
        private ScheduleStore schedules;
        private ExecutionRecordStore records;
        private Properties properties;
        private SessionLauncher launcher;
        private SelectorHealer healer;
        private boolean healerSet;
        private FailureAnalyzer analyzer;
        private boolean analyzerSet;
        private HealingListener healingListener;
        private ApiClient apiClient;
        private boolean executionReports = true;
        private final List<ExecutionListener> listeners = new ArrayList<>();

        Builder() {}

        public Builder definitions(DefinitionStore definitions) {
            this.definitions = definitions;
            return this;
        }

        public Builder schedules(ScheduleStore schedules) {
            this.schedules = schedules;
            return this;
        }

        public Builder executionRecords(ExecutionRecordStore records) {
            this.records = records;
            return this;
        }

        /** Configuration to use instead of {@code config.properties}. */
        public Builder properties(Properties properties) {
            this.properties = properties;
            return this;
        }

        public Builder sessionLauncher(SessionLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        /** Replaces the LLM healer; {@code null} disables healing. */
        public Builder selectorHealer(SelectorHealer healer) {
            this.healer    = healer;
            this.healerSet = true;
            return this;
        }

        public Builder failureAnalyzer(FailureAnalyzer analyzer) {
            this.analyzer    = analyzer;
            this.analyzerSet = true;
            return this;
        }

        /** Replaces the default write-back of healed selectors into the definition store. */
        public Builder healingListener(HealingListener healingListener) {
            this.healingListener = healingListener;
            return this;
        }

        public Builder apiClient(ApiClient apiClient) {
            this.apiClient = apiClient;
            return this;
        }

        public Builder executionListener(ExecutionListener listener) {
            listeners.add(listener);
            return this;
        }

        /** Whether terminal records are also written as JSON to {@code execution.report.dir} (default: on). */
        public Builder executionReports(boolean enabled) {
            this.executionReports = enabled;
            return this;
        }

        public QaRunnerEngine build() {
            Objects.requireNonNull(definitions, "definitions store is required");
            Objects.requireNonNull(schedules, "schedule store is required");

            Properties props = properties != null ? properties : ConfigLoader.load();
            PlayerConfig playerConfig = new PlayerConfig(props);
            PoolConfig poolConfig = new PoolConfig(props);
            AIConfig aiConfig = new AIConfig(props);

            ExecutionRecordStore recordStore = records != null ? records : new InMemoryExecutionRecordStore();
            SessionPool pool = new SessionPool(
                    launcher != null ? launcher : new SeleniumSessionLauncher(poolConfig), poolConfig);

            DefinitionStore defs = definitions;
            HealingListener onHealed = healingListener != null
                    ? healingListener
                    : (testId, stepIndex, original, healed) -> defs.updateStepLocator(testId, stepIndex, healed);
            StepExecutor stepExecutor = new StepExecutor(playerConfig,
                    healerSet ? healer : aiConfig.createSelectorHealer(),
                    analyzerSet ? analyzer : aiConfig.createFailureAnalyzer(),
                    onHealed);
            TestRunner testRunner = new TestRunner(stepExecutor, playerConfig);
            ApiTestRunner apiRunner = new ApiTestRunner(apiClient != null ? apiClient : ApiClient.create());

            PlanOrchestrator orchestrator = new PlanOrchestrator(
                    definitions, recordStore, pool, testRunner, apiRunner, poolConfig);
            listeners.forEach(orchestrator::addListener);
            if (executionReports) {
                orchestrator.addListener(new JsonExecutionReportWriter(
                        ConfigLoader.getString(props, "execution.report.dir", "reports")));
            }

            ScheduleRegistry registry = new ScheduleRegistry(
                    schedules, definitions, recordStore, orchestrator, new SchedulerConfig(props));
            RecordingController recorder = new RecordingController(pool, new RecorderConfig(props));
            AdhocRunner adhoc = new AdhocRunner(pool, testRunner, poolConfig);

            pool.start();
            log.info("Engine ready (pool max {}, default engine {})",
                    poolConfig.getMaxSize(), poolConfig.getDefaultEngine());
            return new QaRunnerEngine(schedules, recordStore, pool, orchestrator, registry, recorder, adhoc);
        }
    }
}
