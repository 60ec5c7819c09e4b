package qarunner.player;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Explicit waits for one driver. Implicit waits are never set, so every
 * element lookup is bounded by {@code timeoutSec} and fails with a
 * {@link QaRunnerException} naming the locator.
 */
public class WaitStrategy {

    private static final Logger log = LoggerFactory.getLogger(WaitStrategy.class);

    private final WebDriverWait wait;
    private final int timeoutSec;

    /**
     * @param driver     session the waits poll
     * @param timeoutSec upper bound for every wait, in seconds
     */
    public WaitStrategy(WebDriver driver, int timeoutSec) {
        this.timeoutSec = timeoutSec;
        this.wait = new WebDriverWait(driver, Duration.ofSeconds(timeoutSec));
    }

    // ── Element conditions ──────────────────────────────────────────────

    /**
     * Waits until the element is attached to the DOM, visible or not.
     *
     * @param locator element to look for
     * @return the element found
     * @throws QaRunnerException if nothing matches within the timeout
     */
    public WebElement waitForPresent(By locator) {
        log.debug("Waiting up to {}s for element PRESENT: {}", timeoutSec, locator);
        try {
            return wait.until(ExpectedConditions.presenceOfElementLocated(locator));
        } catch (RuntimeException e) {
            throw new QaRunnerException(
                    "Timed out after " + timeoutSec + "s waiting for element to be present: " + locator, e);
        }
    }

    /**
     * Waits until the element is in the DOM and displayed.
     *
     * @param locator element to look for
     * @return the visible element
     * @throws QaRunnerException if the element is not visible within the timeout
     */
    public WebElement waitForVisible(By locator) {
        log.debug("Waiting up to {}s for element VISIBLE: {}", timeoutSec, locator);
        try {
            return wait.until(ExpectedConditions.visibilityOfElementLocated(locator));
        } catch (RuntimeException e) {
            throw new QaRunnerException(
                    "Timed out after " + timeoutSec + "s waiting for element to be visible: " + locator, e);
        }
    }

    /**
     * Waits until the element is displayed and enabled.
     *
     * @param locator element to look for
     * @return the element, ready for a click or typing
     * @throws QaRunnerException if the element is not clickable within the timeout
     */
    public WebElement waitForClickable(By locator) {
        log.debug("Waiting up to {}s for element CLICKABLE: {}", timeoutSec, locator);
        try {
            return wait.until(ExpectedConditions.elementToBeClickable(locator));
        } catch (RuntimeException e) {
            throw new QaRunnerException(
                    "Timed out after " + timeoutSec + "s waiting for element to be clickable: " + locator, e);
        }
    }

    // ── Page conditions ─────────────────────────────────────────────────

    /**
     * Waits until the browser reports {@code document.readyState == 'complete'}.
     *
     * @throws QaRunnerException if loading does not finish within the timeout
     */
    public void waitForPageLoad() {
        log.debug("Waiting up to {}s for page load", timeoutSec);
        try {
            wait.until(d -> "complete".equals(
                    ((JavascriptExecutor) d).executeScript("return document.readyState")));
        } catch (RuntimeException e) {
            throw new QaRunnerException(
                    "Timed out after " + timeoutSec + "s waiting for page to finish loading", e);
        }
    }
}
