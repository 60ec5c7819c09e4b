package qarunner.execution;

import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.WebDriver;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import qarunner.model.BrowserEngine;
import qarunner.model.ElementDefinition;
import qarunner.model.ExecutionOverrides;
import qarunner.model.TestResult;
import qarunner.model.TestStep;
import qarunner.model.TestType;
import qarunner.model.UiTestDefinition;
import qarunner.player.TestRunner;
import qarunner.session.SessionHandle;
import qarunner.session.SessionLaunchException;
import qarunner.session.SessionPool;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class AdhocRunnerTest {

    @Mock SessionPool pool;
    @Mock TestRunner testRunner;
    @Mock WebDriver driver;

    private AutoCloseable mocks;
    private SessionHandle handle;
    private AdhocRunner runner;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        handle = new SessionHandle("s1", BrowserEngine.CHROMIUM, true, driver, Instant.now());
        when(pool.acquire(any(), anyBoolean())).thenReturn(handle);
        runner = new AdhocRunner(pool, testRunner, BrowserEngine.CHROMIUM, true);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test(description = "sequence runs as a transient test and the session is returned")
    public void run_transientTest() {
        TestResult expected = new TestResult("x", TestType.UI, "Ad-hoc sequence");
        when(testRunner.runTransient(any(), eq(handle), any())).thenReturn(expected);
        List<TestStep> steps = List.of(new TestStep("click", "#go", null));
        List<ElementDefinition> elements = List.of(new ElementDefinition("go", "#go"));

        TestResult result = runner.run("https://app.test", steps, elements, null);

        ArgumentCaptor<UiTestDefinition> test = ArgumentCaptor.forClass(UiTestDefinition.class);
        verify(testRunner).runTransient(test.capture(), eq(handle), any());
        assertThat(result).isSameAs(expected);
        assertThat(test.getValue().getId()).startsWith("adhoc-");
        assertThat(test.getValue().getUrl()).isEqualTo("https://app.test");
        assertThat(test.getValue().findElement("go")).isPresent();
        verify(pool).release(handle);
        verify(testRunner, never()).run(any(), any(), any());
    }

    @Test(description = "overrides pick the browser")
    public void run_usesOverrides() {
        runner.run(null, List.of(TestStep.navigate("https://app.test")), null,
                new ExecutionOverrides(null, BrowserEngine.EDGE, false));

        verify(pool).acquire(BrowserEngine.EDGE, false);
    }

    @Test(description = "session is released even when the run throws")
    public void run_releasesOnFailure() {
        when(testRunner.runTransient(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> runner.run("https://app.test", List.of(), null, null))
                .isInstanceOf(IllegalStateException.class);
        verify(pool).release(handle);
    }

    @Test(description = "launch failure propagates")
    public void run_launchFailure() {
        when(pool.acquire(any(), anyBoolean())).thenThrow(new SessionLaunchException("no browser", null));

        assertThatThrownBy(() -> runner.run("https://app.test", List.of(), null, null))
                .isInstanceOf(SessionLaunchException.class);
        verifyNoInteractions(testRunner);
    }
}
