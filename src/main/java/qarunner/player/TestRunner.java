package qarunner.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.ElementDefinition;
import qarunner.model.StepResult;
import qarunner.model.TestResult;
import qarunner.model.TestStatus;
import qarunner.model.TestStep;
import qarunner.model.TestType;
import qarunner.model.UiTestDefinition;
import qarunner.session.SessionHandle;

import java.util.List;

/**
 * Runs one UI test on an already acquired session.
 *
 * <ol>
 *   <li>If the test declares a URL, navigates there first; if that fails the
 *       test stops before any declared step.</li>
 *   <li>Runs the declared steps in order and stops at the first failure;
 *       later steps are not executed and not reported.</li>
 * </ol>
 *
 * Steps that reference an element id take their selector from the test's
 * element repository. Unexpected runtime errors produce an {@code ERROR} result.
 */
public class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private final StepExecutor executor;
    private final long stepDelayMs;

    public TestRunner(StepExecutor executor, PlayerConfig config) {
        this(executor, config.getStepDelayMs());
    }

    public TestRunner(StepExecutor executor, long stepDelayMs) {
        this.executor    = executor;
        this.stepDelayMs = stepDelayMs;
    }

    /** Runs a stored test; healed selectors are reported for persistence. */
    public TestResult run(UiTestDefinition test, SessionHandle handle, String runKey) {
        return run(test, handle, runKey, true);
    }

    /** Runs a transient test (ad-hoc sequence); healed selectors are not persisted. */
    public TestResult runTransient(UiTestDefinition test, SessionHandle handle, String runKey) {
        return run(test, handle, runKey, false);
    }

    private TestResult run(UiTestDefinition test, SessionHandle handle, String runKey, boolean persistHealing) {
        TestResult result = new TestResult(test.getId(), TestType.UI, test.getName());
        StepContext ctx = new StepContext(runKey, persistHealing ? test.getId() : null, -1, test.getElements());
        long start = System.currentTimeMillis();
        log.info("Running UI test '{}' on session {}", test.getId(), handle.getId());

        try {
            boolean ok = true;
            boolean hasUrl = test.getUrl() != null && !test.getUrl().isBlank();
            if (hasUrl) {
                StepResult nav = executor.execute(handle, TestStep.navigate(test.getUrl()), ctx);
                result.getSteps().add(nav);
                ok = nav.isPassed();
                if (!ok) {
                    log.warn("Initial navigation of test '{}' to {} failed: {}", test.getId(), test.getUrl(), nav.getError());
                }
            }

            List<TestStep> steps = test.getSteps() == null ? List.of() : test.getSteps();
            for (int i = 0; ok && i < steps.size(); i++) {
                if (hasUrl || i > 0) pace();
                StepResult step = executor.execute(handle, resolve(test, steps.get(i)), ctx.atIndex(i));
                result.getSteps().add(step);
                ok = step.isPassed();
            }

            result.setStatus(ok ? TestStatus.PASSED : TestStatus.FAILED);
            if (!ok) {
                result.setError(result.getSteps().get(result.getSteps().size() - 1).getError());
            }
        } catch (RuntimeException e) {
            log.error("UI test '{}' aborted by unexpected error", test.getId(), e);
            result.setStatus(TestStatus.ERROR);
            result.setError("Unexpected error: " + StepExecutor.describe(e));
        }

        result.setDurationMs(System.currentTimeMillis() - start);
        result.getSteps().stream()
                .map(StepResult::getScreenshotPath)
                .filter(p -> p != null)
                .reduce((first, second) -> second)
                .ifPresent(result::setScreenshotPath);
        log.info("UI test '{}' finished {} in {}ms", test.getId(), result.getStatus(), result.getDurationMs());
        return result;
    }

    /** Applies the element repository's current selector to a step that references it. */
    private static TestStep resolve(UiTestDefinition test, TestStep step) {
        if (step.getElementId() == null) return step;
        String selector = test.findElement(step.getElementId())
                .map(ElementDefinition::getSelector)
                .filter(s -> !s.isBlank())
                .orElse(null);
        if (selector == null || selector.equals(step.getTarget())) return step;
        TestStep resolved = step.copy();
        resolved.setTarget(selector);
        return resolved;
    }

    private void pace() {
        if (stepDelayMs <= 0) return;
        try {
            Thread.sleep(stepDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QaRunnerException("Interrupted between steps", e);
        }
    }
}
