package qarunner.player;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.support.ui.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.ai.FailureAnalyzer;
import qarunner.ai.HealingResult;
import qarunner.ai.SelectorHealer;
import qarunner.model.ElementDefinition;
import qarunner.model.StepResult;
import qarunner.model.TestStep;
import qarunner.session.SessionHandle;

import java.util.function.Function;

/**
 * Executes one {@link TestStep} against a session and reports a
 * {@link StepResult}. Automation errors never escape: they become failed
 * steps with a best-effort screenshot.
 *
 * <p>When a click, input or select fails and a {@link SelectorHealer} is
 * configured, the healer is asked for a replacement selector and the action
 * is retried exactly once with it. The retry is recorded as a sub-step; on
 * success the step is marked healed and the {@link HealingListener} is told
 * so the definition can be updated.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    /** Routed to logs/healing.log by logback.xml. */
    private static final Logger healLog = LoggerFactory.getLogger(StepExecutor.class.getName() + ".healing");

    private static final int DEFAULT_SCROLL_PX = 500;

    private final Function<WebDriver, WaitStrategy> waits;
    private final SelectorHealer healer;
    private final FailureAnalyzer analyzer;
    private final HealingListener healingListener;
    private final EvidenceCollector evidence;

    /**
     * @param healer          may be {@code null} (no healing)
     * @param analyzer        may be {@code null} (no LLM root-cause analysis)
     * @param healingListener may be {@code null}
     */
    public StepExecutor(PlayerConfig config, SelectorHealer healer, FailureAnalyzer analyzer,
                        HealingListener healingListener) {
        this(driver -> new WaitStrategy(driver, config.getExplicitWaitSec()),
                config.isHealingEnabled() ? healer : null,
                analyzer,
                healingListener,
                new EvidenceCollector(config));
    }

    /** Package-private constructor for tests: all collaborators injectable. */
    StepExecutor(Function<WebDriver, WaitStrategy> waits, SelectorHealer healer, FailureAnalyzer analyzer,
                 HealingListener healingListener, EvidenceCollector evidence) {
        this.waits           = waits;
        this.healer          = healer;
        this.analyzer        = analyzer;
        this.healingListener = healingListener;
        this.evidence        = evidence;
    }

    // ── Public API ─────────────────────────────────────────────────────────

    public StepResult execute(SessionHandle handle, TestStep step, StepContext ctx) {
        WebDriver driver = handle.getDriver();
        long start = System.currentTimeMillis();
        StepResult result = new StepResult(ctx.stepIndex(), step.getAction(), step.getTarget(), step.getValue());

        ActionKind kind = ActionKind.fromId(step.getAction());
        if (kind == null) {
            fail(result, "Unsupported action: " + step.getAction(), driver, step, ctx);
        } else {
            String missing = missingField(kind, step);
            if (missing != null) {
                fail(result, "Missing required field '" + missing + "' for action " + step.getAction(),
                        driver, step, ctx);
            } else {
                run(kind, driver, step, ctx, result);
            }
        }

        result.setDurationMs(System.currentTimeMillis() - start);
        log.debug("Step {} finished: {}", ctx.stepIndex(), result);
        return result;
    }

    // ── Execution ──────────────────────────────────────────────────────────

    private void run(ActionKind kind, WebDriver driver, TestStep step, StepContext ctx, StepResult result) {
        try {
            result.passed(perform(kind, driver, step.getTarget(), step.getValue()));
        } catch (RuntimeException e) {
            String error = describe(e);
            log.info("Step {} ({} '{}') failed: {}", ctx.stepIndex(), step.getAction(), step.getTarget(), error);
            if (healer != null && kind.isHealable()) {
                heal(kind, driver, step, ctx, result, error);
            } else {
                fail(result, error, driver, step, ctx);
            }
        }
    }

    private void heal(ActionKind kind, WebDriver driver, TestStep step, StepContext ctx,
                      StepResult result, String error) {
        String original = step.getTarget();
        String pageSource = safePageSource(driver);
        ElementDefinition element = ctx.elements().stream()
                .filter(e -> e.getId() != null && e.getId().equals(step.getElementId()))
                .findFirst()
                .orElse(null);

        HealingResult proposal;
        try {
            proposal = healer.propose(original, pageSource, error, element);
        } catch (RuntimeException e) {
            log.warn("Selector healer threw for '{}': {}", original, e.getMessage());
            proposal = HealingResult.failed("Healer error: " + e.getMessage());
        }

        String failure = error;
        boolean unchanged = proposal.healed() && proposal.locator().equals(original);
        if (proposal.healed() && !unchanged) {
            healLog.info("HEAL ATTEMPT test={} step={} action={} '{}' -> '{}'",
                    ctx.testId(), ctx.stepIndex(), step.getAction(), original, proposal.locator());
            StepResult retry = new StepResult(ctx.stepIndex(), step.getAction(), proposal.locator(), step.getValue());
            long retryStart = System.currentTimeMillis();
            try {
                String details = perform(kind, driver, proposal.locator(), step.getValue());
                retry.passed(details);
                retry.setDurationMs(System.currentTimeMillis() - retryStart);
                result.addSubStep(retry);
                result.healedWith(proposal.locator(), details);
                result.setRootCause("Selector '" + original + "' no longer matched; healed to '"
                        + proposal.locator() + "'");
                healLog.info("HEALED test={} step={} '{}' -> '{}'",
                        ctx.testId(), ctx.stepIndex(), original, proposal.locator());
                notifyHealed(ctx, original, proposal.locator());
                return;
            } catch (RuntimeException retryError) {
                retry.failed(describe(retryError));
                retry.setDurationMs(System.currentTimeMillis() - retryStart);
                result.addSubStep(retry);
                healLog.info("HEAL FAILED test={} step={} '{}': {}",
                        ctx.testId(), ctx.stepIndex(), proposal.locator(), retry.getError());
                failure = error + " (healed selector '" + proposal.locator() + "' also failed: "
                        + retry.getError() + ")";
            }
        } else if (unchanged) {
            healLog.info("NO HEAL test={} step={} '{}': healer returned the original selector",
                    ctx.testId(), ctx.stepIndex(), original);
        } else {
            healLog.info("NO HEAL test={} step={} '{}': {}", ctx.testId(), ctx.stepIndex(), original,
                    proposal.failureReason());
        }

        String rootCause = analyzer != null
                ? analyzer.analyze(step.getAction(), original, failure, pageSource)
                : null;
        if (rootCause == null) {
            if (unchanged) {
                rootCause = "Selector '" + original + "' no longer matched; healer returned the original selector";
            } else if (proposal.healed()) {
                rootCause = "Selector '" + original + "' no longer matched and the healed selector did not resolve either";
            } else {
                rootCause = proposal.failureReason();
            }
        }
        result.setRootCause(rootCause);
        fail(result, failure, driver, step, ctx);
    }

    /**
     * Performs the action and returns a short description of what happened.
     *
     * @throws RuntimeException on any automation or assertion failure
     */
    private String perform(ActionKind kind, WebDriver driver, String locator, String value) {
        WaitStrategy wait = waits.apply(driver);
        return switch (kind) {
            case NAVIGATE -> {
                String url = value != null && !value.isBlank() ? value : locator;
                driver.get(url);
                wait.waitForPageLoad();
                yield "Navigated to " + url;
            }
            case CLICK -> {
                wait.waitForClickable(Locators.toBy(locator)).click();
                yield "Clicked " + locator;
            }
            case HOVER -> {
                WebElement el = wait.waitForVisible(Locators.toBy(locator));
                new Actions(driver).moveToElement(el).perform();
                yield "Hovered over " + locator;
            }
            case INPUT -> {
                WebElement el = wait.waitForVisible(Locators.toBy(locator));
                el.clear();
                el.sendKeys(value);
                yield "Entered text into " + locator;
            }
            case SELECT -> {
                Select select = new Select(wait.waitForVisible(Locators.toBy(locator)));
                try {
                    select.selectByValue(value);
                } catch (NoSuchElementException byValueMissing) {
                    select.selectByVisibleText(value);
                }
                yield "Selected '" + value + "' in " + locator;
            }
            case WAIT -> {
                long ms = parseWaitMillis(value);
                sleep(ms);
                yield "Waited " + ms + "ms";
            }
            case SCROLL -> {
                JavascriptExecutor js = (JavascriptExecutor) driver;
                if (locator == null || locator.isBlank()) {
                    js.executeScript("window.scrollBy(0, arguments[0]);", DEFAULT_SCROLL_PX);
                    yield "Scrolled page by " + DEFAULT_SCROLL_PX + "px";
                }
                WebElement el = wait.waitForPresent(Locators.toBy(locator));
                js.executeScript("arguments[0].scrollIntoView({block: 'center'});", el);
                yield "Scrolled " + locator + " into view";
            }
            case ASSERT_TEXT_CONTAINS -> {
                String actual = wait.waitForVisible(Locators.toBy(locator)).getText();
                if (actual == null || !actual.contains(value)) {
                    throw new QaRunnerException("Expected text of '" + locator + "' to contain '"
                            + value + "' but was '" + actual + "'");
                }
                yield "Text of " + locator + " contains '" + value + "'";
            }
            case ASSERT_ELEMENT_COUNT -> {
                CountExpectation expected = CountExpectation.parse(value);
                By by = Locators.toBy(locator);
                int actual = driver.findElements(by).size();
                if (!expected.matches(actual)) {
                    throw new QaRunnerException("Expected element count " + expected + " for '"
                            + locator + "' but found " + actual);
                }
                yield "Found " + actual + " element(s) for " + locator + " (expected " + expected + ")";
            }
            case ASSERT -> {
                wait.waitForPresent(Locators.toBy(locator));
                yield "Element " + locator + " is present";
            }
        };
    }

    // ── Helpers ────────────────────────────────────────────────────────────

    private static String missingField(ActionKind kind, TestStep step) {
        if (kind == ActionKind.NAVIGATE) {
            return isBlank(step.getValue()) && isBlank(step.getTarget()) ? "value" : null;
        }
        if (kind.requiresTarget() && isBlank(step.getTarget())) return "target";
        if (kind.requiresValue() && step.getValue() == null) return "value";
        return null;
    }

    private static long parseWaitMillis(String value) {
        try {
            long ms = Long.parseLong(value.trim());
            if (ms < 0) throw new NumberFormatException("negative");
            return ms;
        } catch (NumberFormatException e) {
            throw new QaRunnerException("Wait duration must be a non-negative number of milliseconds, got '"
                    + value + "'");
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QaRunnerException("Interrupted while waiting", e);
        }
    }

    private void fail(StepResult result, String error, WebDriver driver, TestStep step, StepContext ctx) {
        result.failed(error);
        try {
            result.setScreenshotPath(evidence.collect(driver, ctx.runKey(), ctx.stepIndex(), step, error));
        } catch (RuntimeException e) {
            log.warn("Evidence capture failed for step {}: {}", ctx.stepIndex(), e.getMessage());
        }
    }

    private void notifyHealed(StepContext ctx, String original, String healed) {
        if (healingListener == null || ctx.testId() == null || ctx.stepIndex() < 0) return;
        try {
            healingListener.onLocatorHealed(ctx.testId(), ctx.stepIndex(), original, healed);
        } catch (RuntimeException e) {
            log.warn("Could not persist healed selector for test {} step {}: {}",
                    ctx.testId(), ctx.stepIndex(), e.getMessage());
        }
    }

    private static String safePageSource(WebDriver driver) {
        try {
            return driver.getPageSource();
        } catch (RuntimeException e) {
            log.debug("Page source unavailable: {}", e.getMessage());
            return null;
        }
    }

    /** First line of the exception message; WebDriver messages carry multi-line build info. */
    static String describe(Throwable t) {
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) return t.getClass().getSimpleName();
        int nl = msg.indexOf('\n');
        return nl > 0 ? msg.substring(0, nl).trim() : msg.trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
