package qarunner.player;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import qarunner.ai.FailureAnalyzer;
import qarunner.ai.HealingResult;
import qarunner.ai.SelectorHealer;
import qarunner.model.BrowserEngine;
import qarunner.model.ElementDefinition;
import qarunner.model.StepResult;
import qarunner.model.StepStatus;
import qarunner.model.TestStep;
import qarunner.session.SessionHandle;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link StepExecutor}. Selenium, waits, evidence and the
 * healer are all mocked.
 */
public class StepExecutorTest {

    private interface FullDriver extends WebDriver, JavascriptExecutor {}

    @Mock FullDriver driver;
    @Mock WaitStrategy wait;
    @Mock EvidenceCollector evidence;
    @Mock SelectorHealer healer;
    @Mock FailureAnalyzer analyzer;
    @Mock HealingListener listener;
    @Mock WebElement element;

    private AutoCloseable mocks;
    private SessionHandle handle;
    private StepContext ctx;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(driver.getWindowHandles()).thenReturn(Set.of("main"));
        when(driver.getPageSource()).thenReturn("<html><button id='new'>Go</button></html>");
        when(evidence.collect(any(), anyString(), anyInt(), any(), anyString())).thenReturn("evidence/shot.png");
        handle = new SessionHandle("s1", BrowserEngine.CHROMIUM, true, driver, Instant.now());
        ctx = new StepContext("run-1", "login", 0, List.of());
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private StepExecutor executor(SelectorHealer withHealer) {
        return new StepExecutor(d -> wait, withHealer, analyzer, listener, evidence);
    }

    // ── Plain actions ─────────────────────────────────────────────────────

    @Test(description = "click waits for the element and clicks it")
    public void click_clicksElement() {
        when(wait.waitForClickable(By.cssSelector("#go"))).thenReturn(element);

        StepResult r = executor(null).execute(handle, new TestStep("click", "#go", null), ctx);

        assertThat(r.getStatus()).isEqualTo(StepStatus.PASSED);
        verify(element).click();
    }

    @Test(description = "navigate uses the value as URL and waits for the page")
    public void navigate_drivesToUrl() {
        StepResult r = executor(null).execute(handle, TestStep.navigate("https://app.test/login"), ctx);

        assertThat(r.isPassed()).isTrue();
        verify(driver).get("https://app.test/login");
        verify(wait).waitForPageLoad();
    }

    @Test(description = "input clears the field before typing")
    public void input_clearsThenTypes() {
        when(wait.waitForVisible(By.id("user"))).thenReturn(element);

        StepResult r = executor(null).execute(handle, new TestStep("fill", "id=user", "alice"), ctx);

        assertThat(r.isPassed()).isTrue();
        verify(element).clear();
        verify(element).sendKeys("alice");
    }

    @Test(description = "text assertion passes when the element text contains the value")
    public void assertTextContains_passes() {
        when(wait.waitForVisible(By.cssSelector("h1"))).thenReturn(element);
        when(element.getText()).thenReturn("Welcome back, alice");

        StepResult r = executor(null).execute(handle, new TestStep("assertTextContains", "h1", "Welcome"), ctx);

        assertThat(r.isPassed()).isTrue();
    }

    @Test(description = "text assertion fails with expected and actual text")
    public void assertTextContains_failsWithActualText() {
        when(wait.waitForVisible(By.cssSelector("h1"))).thenReturn(element);
        when(element.getText()).thenReturn("Sign in");

        StepResult r = executor(null).execute(handle, new TestStep("assertTextContains", "h1", "Welcome"), ctx);

        assertThat(r.isPassed()).isFalse();
        assertThat(r.getError()).contains("'Welcome'").contains("'Sign in'");
        assertThat(r.getScreenshotPath()).isEqualTo("evidence/shot.png");
    }

    @Test(description = "element count failure reports operator and actual count")
    public void assertElementCount_reportsActualCount() {
        when(driver.findElements(By.cssSelector(".row"))).thenReturn(List.of(element));

        StepResult r = executor(null).execute(handle, new TestStep("assertElementCount", ".row", ">=2"), ctx);

        assertThat(r.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(r.getError()).isEqualTo("Expected element count >=2 for '.row' but found 1");
    }

    @Test(description = "scroll without target scrolls the window")
    public void scroll_withoutTarget_scrollsWindow() {
        StepResult r = executor(null).execute(handle, new TestStep("scroll", null, null), ctx);

        assertThat(r.isPassed()).isTrue();
        verify(driver).executeScript(contains("scrollBy"), eq(500));
    }

    // ── Validation ────────────────────────────────────────────────────────

    @Test(description = "unknown action fails without touching the browser")
    public void unsupportedAction_fails() {
        StepResult r = executor(null).execute(handle, new TestStep("teleport", "#x", null), ctx);

        assertThat(r.isPassed()).isFalse();
        assertThat(r.getError()).isEqualTo("Unsupported action: teleport");
        verifyNoInteractions(wait);
    }

    @Test(description = "element action without target names the missing field")
    public void missingTarget_fails() {
        StepResult r = executor(null).execute(handle, new TestStep("click", " ", null), ctx);

        assertThat(r.getError()).isEqualTo("Missing required field 'target' for action click");
    }

    @Test(description = "negative wait is rejected")
    public void wait_negativeValue_fails() {
        StepResult r = executor(null).execute(handle, new TestStep("wait", null, "-5"), ctx);

        assertThat(r.isPassed()).isFalse();
        assertThat(r.getError()).contains("non-negative");
    }

    @Test(description = "evidence failure does not change the step outcome")
    public void evidenceFailure_isIgnored() {
        when(evidence.collect(any(), anyString(), anyInt(), any(), anyString()))
                .thenThrow(new IllegalStateException("disk full"));
        when(wait.waitForClickable(any())).thenThrow(new NoSuchElementException("gone"));

        StepResult r = executor(null).execute(handle, new TestStep("click", "#go", null), ctx);

        assertThat(r.isPassed()).isFalse();
        assertThat(r.getScreenshotPath()).isNull();
    }

    // ── Healing ───────────────────────────────────────────────────────────

    @Test(description = "failed click is retried once with the healed selector")
    public void click_healsAndRetries() {
        when(wait.waitForClickable(By.cssSelector("#old"))).thenThrow(new NoSuchElementException("no #old"));
        when(wait.waitForClickable(By.cssSelector("#new"))).thenReturn(element);
        when(healer.propose(eq("#old"), any(), any(), any())).thenReturn(HealingResult.success("#new"));

        StepResult r = executor(healer).execute(handle, new TestStep("click", "#old", null), ctx);

        assertThat(r.isPassed()).isTrue();
        assertThat(r.isHealed()).isTrue();
        assertThat(r.getHealedLocator()).isEqualTo("#new");
        assertThat(r.getSubSteps()).hasSize(1);
        assertThat(r.getSubSteps().get(0).getTarget()).isEqualTo("#new");
        assertThat(r.getSubSteps().get(0).isPassed()).isTrue();
        verify(listener).onLocatorHealed("login", 0, "#old", "#new");
    }

    @Test(description = "healer receives the element definition the step refers to")
    public void heal_passesElementDefinition() {
        ElementDefinition def = new ElementDefinition("submit", "#old");
        StepContext withElements = new StepContext("run-1", "login", 2, List.of(def));
        TestStep step = new TestStep("click", "#old", null);
        step.setElementId("submit");
        when(wait.waitForClickable(any())).thenThrow(new NoSuchElementException("no"));
        when(healer.propose(any(), any(), any(), any())).thenReturn(HealingResult.failed("nothing similar"));

        executor(healer).execute(handle, step, withElements);

        verify(healer).propose(eq("#old"), anyString(), anyString(), eq(def));
    }

    @Test(description = "healed selector that also fails leaves the step failed with both errors")
    public void heal_retryFails() {
        when(wait.waitForClickable(any())).thenThrow(new NoSuchElementException("not found"));
        when(healer.propose(any(), any(), any(), any())).thenReturn(HealingResult.success("#new"));

        StepResult r = executor(healer).execute(handle, new TestStep("click", "#old", null), ctx);

        assertThat(r.isPassed()).isFalse();
        assertThat(r.isHealed()).isFalse();
        assertThat(r.getSubSteps()).singleElement().satisfies(s -> assertThat(s.isPassed()).isFalse());
        assertThat(r.getError()).contains("healed selector '#new' also failed");
        verifyNoInteractions(listener);
    }

    @Test(description = "no heal proposal: failure reason becomes the root cause")
    public void heal_noProposal_setsRootCause() {
        when(wait.waitForClickable(any())).thenThrow(new NoSuchElementException("not found"));
        when(healer.propose(any(), any(), any(), any())).thenReturn(HealingResult.failed("No similar element"));
        when(analyzer.analyze(any(), any(), any(), any())).thenReturn(null);

        StepResult r = executor(healer).execute(handle, new TestStep("click", "#old", null), ctx);

        assertThat(r.isPassed()).isFalse();
        assertThat(r.getSubSteps()).isEmpty();
        assertThat(r.getRootCause()).isEqualTo("No similar element");
    }

    @Test(description = "healer echoing the failing selector: no retry, root cause says so")
    public void heal_sameSelector_noRetry() {
        when(wait.waitForClickable(any())).thenThrow(new NoSuchElementException("not found"));
        when(healer.propose(any(), any(), any(), any())).thenReturn(HealingResult.success("#old"));
        when(analyzer.analyze(any(), any(), any(), any())).thenReturn(null);

        StepResult r = executor(healer).execute(handle, new TestStep("click", "#old", null), ctx);

        assertThat(r.isPassed()).isFalse();
        assertThat(r.isHealed()).isFalse();
        assertThat(r.getSubSteps()).isEmpty();
        assertThat(r.getRootCause())
                .contains("healer returned the original selector")
                .doesNotContain("healed selector did not resolve");
        verify(wait, times(1)).waitForClickable(any());
        verifyNoInteractions(listener);
    }

    @Test(description = "a throwing listener does not fail a healed step")
    public void heal_listenerFailure_isSwallowed() {
        when(wait.waitForClickable(By.cssSelector("#old"))).thenThrow(new NoSuchElementException("no"));
        when(wait.waitForClickable(By.cssSelector("#new"))).thenReturn(element);
        when(healer.propose(any(), any(), any(), any())).thenReturn(HealingResult.success("#new"));
        doThrow(new IllegalArgumentException("store down"))
                .when(listener).onLocatorHealed(anyString(), anyInt(), anyString(), anyString());

        StepResult r = executor(healer).execute(handle, new TestStep("click", "#old", null), ctx);

        assertThat(r.isPassed()).isTrue();
        assertThat(r.isHealed()).isTrue();
    }

    @Test(description = "transient runs (no test id) never notify the listener")
    public void heal_transientRun_skipsListener() {
        when(wait.waitForClickable(By.cssSelector("#old"))).thenThrow(new NoSuchElementException("no"));
        when(wait.waitForClickable(By.cssSelector("#new"))).thenReturn(element);
        when(healer.propose(any(), any(), any(), any())).thenReturn(HealingResult.success("#new"));

        StepResult r = executor(healer).execute(handle, new TestStep("click", "#old", null),
                new StepContext("adhoc", null, 0, List.of()));

        assertThat(r.isHealed()).isTrue();
        verifyNoInteractions(listener);
    }

    @Test(description = "assertions are never healed")
    public void assertion_isNotHealed() {
        when(wait.waitForPresent(any())).thenThrow(new NoSuchElementException("missing"));

        StepResult r = executor(healer).execute(handle, new TestStep("assert", "#banner", null), ctx);

        assertThat(r.isPassed()).isFalse();
        verifyNoInteractions(healer);
    }

    @Test(description = "multi-line WebDriver messages are cut to the first line")
    public void describe_keepsFirstLine() {
        assertThat(StepExecutor.describe(new NoSuchElementException("no such element\nBuild info: x")))
                .isEqualTo("no such element");
        assertThat(StepExecutor.describe(new IllegalStateException())).isEqualTo("IllegalStateException");
    }
}
