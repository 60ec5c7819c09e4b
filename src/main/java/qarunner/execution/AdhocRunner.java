package qarunner.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.BrowserEngine;
import qarunner.model.ElementDefinition;
import qarunner.model.ExecutionOverrides;
import qarunner.model.TestResult;
import qarunner.model.TestStep;
import qarunner.model.UiTestDefinition;
import qarunner.player.TestRunner;
import qarunner.session.PoolConfig;
import qarunner.session.SessionHandle;
import qarunner.session.SessionPool;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs a step sequence that is not stored anywhere, e.g. to try out a
 * freshly recorded flow. Healed selectors are not written back.
 */
public class AdhocRunner {

    private static final Logger log = LoggerFactory.getLogger(AdhocRunner.class);

    private final SessionPool pool;
    private final TestRunner testRunner;
    private final BrowserEngine defaultEngine;
    private final boolean defaultHeadless;

    public AdhocRunner(SessionPool pool, TestRunner testRunner, PoolConfig poolConfig) {
        this(pool, testRunner, poolConfig.getDefaultEngine(), poolConfig.isDefaultHeadless());
    }

    AdhocRunner(SessionPool pool, TestRunner testRunner, BrowserEngine defaultEngine, boolean defaultHeadless) {
        this.pool            = pool;
        this.testRunner      = testRunner;
        this.defaultEngine   = defaultEngine;
        this.defaultHeadless = defaultHeadless;
    }

    /**
     * @param url      start page; may be {@code null} when the first step navigates
     * @param elements element repository for steps that use {@code elementId}; may be {@code null}
     * @throws qarunner.session.SessionLaunchException if no browser can be started
     */
    public TestResult run(String url, List<TestStep> steps, List<ElementDefinition> elements,
                          ExecutionOverrides overrides) {
        ExecutionOverrides o = overrides != null ? overrides : ExecutionOverrides.none();
        String id = "adhoc-" + UUID.randomUUID();
        UiTestDefinition test = new UiTestDefinition(id, "Ad-hoc sequence", url,
                steps == null ? List.of() : steps);
        test.setElements(elements == null ? new ArrayList<>() : new ArrayList<>(elements));

        SessionHandle handle = pool.acquire(o.engineOr(defaultEngine), o.headlessOr(defaultHeadless));
        log.info("Running ad-hoc sequence {} ({} step(s)) on session {}", id, test.getSteps().size(), handle.getId());
        try {
            return testRunner.runTransient(test, handle, id);
        } finally {
            pool.release(handle);
        }
    }
}
