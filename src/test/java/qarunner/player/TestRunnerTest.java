package qarunner.player;

import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.WebDriver;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import qarunner.model.BrowserEngine;
import qarunner.model.ElementDefinition;
import qarunner.model.StepResult;
import qarunner.model.TestResult;
import qarunner.model.TestStatus;
import qarunner.model.TestStep;
import qarunner.model.UiTestDefinition;
import qarunner.session.SessionHandle;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class TestRunnerTest {

    @Mock StepExecutor executor;
    @Mock WebDriver driver;

    private AutoCloseable mocks;
    private SessionHandle handle;
    private TestRunner runner;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        handle = new SessionHandle("s1", BrowserEngine.CHROMIUM, true, driver, Instant.now());
        runner = new TestRunner(executor, 0L);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static StepResult pass(TestStep s) {
        return new StepResult(0, s.getAction(), s.getTarget(), s.getValue()).passed("ok");
    }

    private static StepResult fail(TestStep s, String error) {
        return new StepResult(0, s.getAction(), s.getTarget(), s.getValue()).failed(error);
    }

    @Test(description = "all steps pass: test passes and every step is reported")
    public void run_allStepsPass() {
        UiTestDefinition test = new UiTestDefinition("t1", "Login", "https://app.test",
                List.of(new TestStep("click", "#a", null), new TestStep("click", "#b", null)));
        when(executor.execute(eq(handle), any(), any())).thenAnswer(inv -> pass(inv.getArgument(1)));

        TestResult result = runner.run(test, handle, "run-1");

        assertThat(result.getStatus()).isEqualTo(TestStatus.PASSED);
        assertThat(result.getSteps()).hasSize(3);
        assertThat(result.getSteps().get(0).getAction()).isEqualTo("navigate");
    }

    @Test(description = "failed initial navigation stops before the first declared step")
    public void run_navigationFailure_skipsSteps() {
        UiTestDefinition test = new UiTestDefinition("t1", "Login", "https://down.test",
                List.of(new TestStep("click", "#a", null)));
        when(executor.execute(eq(handle), any(), any())).thenAnswer(inv -> fail(inv.getArgument(1), "net::ERR"));

        TestResult result = runner.run(test, handle, "run-1");

        assertThat(result.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(result.getSteps()).hasSize(1);
        assertThat(result.getError()).isEqualTo("net::ERR");
        verify(executor, times(1)).execute(any(), any(), any());
    }

    @Test(description = "execution stops at the first failing step")
    public void run_stopsAtFirstFailure() {
        TestStep first = new TestStep("click", "#a", null);
        TestStep second = new TestStep("click", "#broken", null);
        TestStep third = new TestStep("click", "#c", null);
        UiTestDefinition test = new UiTestDefinition("t1", "Flow", null, List.of(first, second, third));
        when(executor.execute(eq(handle), any(), any())).thenAnswer(inv -> {
            TestStep s = inv.getArgument(1);
            return "#broken".equals(s.getTarget()) ? fail(s, "not found") : pass(s);
        });

        TestResult result = runner.run(test, handle, "run-1");

        assertThat(result.getStatus()).isEqualTo(TestStatus.FAILED);
        assertThat(result.getSteps()).extracting(StepResult::getTarget).containsExactly("#a", "#broken");
        assertThat(result.getError()).isEqualTo("not found");
    }

    @Test(description = "element id takes the selector from the element repository")
    public void run_resolvesElementId() {
        TestStep step = new TestStep("click", "#stale", null);
        step.setElementId("submit");
        UiTestDefinition test = new UiTestDefinition("t1", "Flow", null, List.of(step));
        test.setElements(List.of(new ElementDefinition("submit", "#fresh")));
        when(executor.execute(eq(handle), any(), any())).thenAnswer(inv -> pass(inv.getArgument(1)));

        runner.run(test, handle, "run-1");

        ArgumentCaptor<TestStep> captor = ArgumentCaptor.forClass(TestStep.class);
        ArgumentCaptor<StepContext> ctx = ArgumentCaptor.forClass(StepContext.class);
        verify(executor).execute(eq(handle), captor.capture(), ctx.capture());
        assertThat(captor.getValue().getTarget()).isEqualTo("#fresh");
        assertThat(step.getTarget()).as("definition untouched").isEqualTo("#stale");
        assertThat(ctx.getValue().testId()).isEqualTo("t1");
        assertThat(ctx.getValue().stepIndex()).isZero();
    }

    @Test(description = "transient runs pass no test id so healing is not persisted")
    public void runTransient_hasNoTestId() {
        UiTestDefinition test = new UiTestDefinition("adhoc-1", "Ad-hoc sequence", null,
                List.of(new TestStep("click", "#a", null)));
        when(executor.execute(eq(handle), any(), any())).thenAnswer(inv -> pass(inv.getArgument(1)));

        runner.runTransient(test, handle, "adhoc-1");

        ArgumentCaptor<StepContext> ctx = ArgumentCaptor.forClass(StepContext.class);
        verify(executor).execute(eq(handle), any(), ctx.capture());
        assertThat(ctx.getValue().testId()).isNull();
    }

    @Test(description = "unexpected runtime error yields an ERROR result")
    public void run_unexpectedError() {
        UiTestDefinition test = new UiTestDefinition("t1", "Flow", null, List.of(new TestStep("click", "#a", null)));
        when(executor.execute(any(), any(), any())).thenThrow(new IllegalStateException("driver crashed"));

        TestResult result = runner.run(test, handle, "run-1");

        assertThat(result.getStatus()).isEqualTo(TestStatus.ERROR);
        assertThat(result.getError()).isEqualTo("Unexpected error: driver crashed");
    }

    @Test(description = "test screenshot is the last step screenshot")
    public void run_carriesLastScreenshot() {
        UiTestDefinition test = new UiTestDefinition("t1", "Flow", null, List.of(new TestStep("click", "#a", null)));
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> {
            StepResult r = fail(inv.getArgument(1), "boom");
            r.setScreenshotPath("evidence/t1/step-0.png");
            return r;
        });

        TestResult result = runner.run(test, handle, "run-1");

        assertThat(result.getScreenshotPath()).isEqualTo("evidence/t1/step-0.png");
    }
}
