package qarunner.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.api.ApiTestRunner;
import qarunner.model.ApiTestDefinition;
import qarunner.model.BrowserEngine;
import qarunner.model.ExecutionOverrides;
import qarunner.model.ExecutionRecord;
import qarunner.model.ExecutionStatus;
import qarunner.model.PlanMember;
import qarunner.model.RunOrigin;
import qarunner.model.TestPlan;
import qarunner.model.TestResult;
import qarunner.model.TestStatus;
import qarunner.model.TestType;
import qarunner.model.UiTestDefinition;
import qarunner.player.TestRunner;
import qarunner.session.PoolConfig;
import qarunner.session.SessionHandle;
import qarunner.session.SessionPool;
import qarunner.store.DefinitionStore;
import qarunner.store.ExecutionRecordStore;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every member of a test plan in declared order and produces one
 * {@link ExecutionRecord}.
 *
 * <p>The record is persisted as {@code PENDING}, then {@code RUNNING} before
 * the first test starts, then after every test result, and finally in its
 * terminal state. A failure to persist is logged and does not stop the run.
 *
 * <p>Final status:
 * <ul>
 *   <li>{@code PASSED}: every result passed (or the plan is empty)</li>
 *   <li>{@code FAILED}: every result failed or errored</li>
 *   <li>{@code PARTIAL}: anything in between</li>
 *   <li>{@code ERROR}: the run itself broke down outside a single test</li>
 * </ul>
 */
public class PlanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PlanOrchestrator.class);

    private final DefinitionStore definitions;
    private final ExecutionRecordStore records;
    private final SessionPool pool;
    private final TestRunner testRunner;
    private final ApiTestRunner apiRunner;
    private final BrowserEngine defaultEngine;
    private final boolean defaultHeadless;
    private final Clock clock;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public PlanOrchestrator(DefinitionStore definitions, ExecutionRecordStore records, SessionPool pool,
                            TestRunner testRunner, ApiTestRunner apiRunner, PoolConfig poolConfig) {
        this(definitions, records, pool, testRunner, apiRunner,
                poolConfig.getDefaultEngine(), poolConfig.isDefaultHeadless(), Clock.systemUTC());
    }

    PlanOrchestrator(DefinitionStore definitions, ExecutionRecordStore records, SessionPool pool,
                     TestRunner testRunner, ApiTestRunner apiRunner,
                     BrowserEngine defaultEngine, boolean defaultHeadless, Clock clock) {
        this.definitions     = definitions;
        this.records         = records;
        this.pool            = pool;
        this.testRunner      = testRunner;
        this.apiRunner       = apiRunner;
        this.defaultEngine   = defaultEngine;
        this.defaultHeadless = defaultHeadless;
        this.clock           = clock;
    }

    public void addListener(ExecutionListener listener) {
        listeners.add(listener);
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Runs a plan to completion.
     *
     * @param overrides environment, engine and headless overrides; {@code null} means none
     * @return the terminal record
     * @throws PlanNotFoundException if the plan does not exist (no record is created)
     */
    public ExecutionRecord run(String planId, RunOrigin origin, ExecutionOverrides overrides) {
        TestPlan plan = definitions.findPlan(planId)
                .orElseThrow(() -> new PlanNotFoundException(planId));
        ExecutionOverrides o = overrides != null ? overrides : ExecutionOverrides.none();

        ExecutionRecord record = ExecutionRecord.pending(
                UUID.randomUUID().toString(), planId, origin, o.environment(), clock.instant());
        createQuietly(record);
        record.markRunning();
        persist(record);

        List<PlanMember> members = plan.getMembers() == null ? List.of() : plan.getMembers();
        log.info("Execution {} started: plan '{}' ({} member(s)), {} by {}",
                record.getId(), planId, members.size(), origin.source(), origin.requestedBy());

        try {
            for (PlanMember member : members) {
                TestResult result = runMember(member, record.getId(), o);
                record.appendResult(result);
                persist(record);
            }
            if (members.isEmpty()) {
                log.warn("Plan '{}' has no members; execution {} passes vacuously", planId, record.getId());
            }
            record.complete(aggregate(record.getResults()), clock.instant(), null);
        } catch (RuntimeException e) {
            log.error("Execution {} of plan '{}' aborted", record.getId(), planId, e);
            record.complete(ExecutionStatus.ERROR, clock.instant(), "Execution aborted: " + e.getMessage());
        }

        persist(record);
        log.info("Execution {} finished {} ({}/{} passed) in {}ms", record.getId(), record.getStatus(),
                record.getPassedTests(), record.getTotalTests(), record.getExecutionDurationMs());
        notifyListeners(record);
        return record;
    }

    /**
     * Folds test results into a plan status. An empty list is {@code PASSED}.
     */
    static ExecutionStatus aggregate(List<TestResult> results) {
        long passed = results.stream().filter(r -> r.getStatus() == TestStatus.PASSED).count();
        if (passed == results.size()) return ExecutionStatus.PASSED;
        if (passed == 0) return ExecutionStatus.FAILED;
        return ExecutionStatus.PARTIAL;
    }

    // ── Member execution ──────────────────────────────────────────────────

    private TestResult runMember(PlanMember member, String executionId, ExecutionOverrides o) {
        if (member.getTestType() == null) {
            return TestResult.error(member.getTestId(), null, null, "Plan member has no test type");
        }
        return switch (member.getTestType()) {
            case UI -> definitions.findUiTest(member.getTestId())
                    .map(test -> runUi(test, executionId, o))
                    .orElseGet(() -> missing(member));
            case API -> definitions.findApiTest(member.getTestId())
                    .map(this::runApi)
                    .orElseGet(() -> missing(member));
        };
    }

    private TestResult runUi(UiTestDefinition test, String executionId, ExecutionOverrides o) {
        BrowserEngine engine = o.engineOr(defaultEngine);
        boolean headless = o.headlessOr(defaultHeadless);

        SessionHandle handle;
        try {
            handle = pool.acquire(engine, headless);
        } catch (RuntimeException e) {
            log.error("No {} session for UI test '{}': {}", engine, test.getId(), e.getMessage());
            return TestResult.error(test.getId(), TestType.UI, test.getName(),
                    "Browser session unavailable: " + e.getMessage());
        }

        try {
            return testRunner.run(test, handle, executionId + "-" + test.getId());
        } catch (RuntimeException e) {
            log.error("UI test '{}' failed unexpectedly", test.getId(), e);
            return TestResult.error(test.getId(), TestType.UI, test.getName(), "Unexpected error: " + e.getMessage());
        } finally {
            pool.release(handle);
        }
    }

    private TestResult runApi(ApiTestDefinition test) {
        try {
            return apiRunner.run(test);
        } catch (RuntimeException e) {
            log.error("API test '{}' failed unexpectedly", test.getId(), e);
            return TestResult.error(test.getId(), TestType.API, test.getName(), "Unexpected error: " + e.getMessage());
        }
    }

    private static TestResult missing(PlanMember member) {
        log.error("Plan member {} refers to a test that does not exist", member);
        return TestResult.error(member.getTestId(), member.getTestType(), null,
                member.getTestType().name() + " test not found: " + member.getTestId());
    }

    // ── Persistence & notification ────────────────────────────────────────

    private void createQuietly(ExecutionRecord record) {
        try {
            records.create(record.copy());
        } catch (RuntimeException e) {
            log.error("Could not create execution record {}: {}", record.getId(), e.getMessage());
        }
    }

    private void persist(ExecutionRecord record) {
        try {
            records.update(record.copy());
        } catch (RuntimeException e) {
            log.error("Could not persist execution record {} ({}): {}",
                    record.getId(), record.getStatus(), e.getMessage());
        }
    }

    private void notifyListeners(ExecutionRecord record) {
        for (ExecutionListener listener : listeners) {
            try {
                listener.onExecutionCompleted(record.copy());
            } catch (RuntimeException e) {
                log.warn("Execution listener {} failed for {}: {}",
                        listener.getClass().getSimpleName(), record.getId(), e.getMessage());
            }
        }
    }
}
