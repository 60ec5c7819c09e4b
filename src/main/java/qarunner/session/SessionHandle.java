package qarunner.session;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.BrowserEngine;

import java.time.Instant;

/**
 * One live browser owned by the {@link SessionPool}. A handle is used by at
 * most one caller at a time; busy state and last-use time are only changed
 * by the pool under its lock.
 */
public class SessionHandle {

    private static final Logger log = LoggerFactory.getLogger(SessionHandle.class);

    private final String id;
    private final BrowserEngine engine;
    private final boolean headless;
    private final WebDriver driver;

    private boolean busy;
    private Instant lastUsedAt;

    public SessionHandle(String id, BrowserEngine engine, boolean headless, WebDriver driver, Instant createdAt) {
        this.id         = id;
        this.engine     = engine;
        this.headless   = headless;
        this.driver     = driver;
        this.lastUsedAt = createdAt;
    }

    /**
     * Probes the browser. Any WebDriver failure (closed window, dead session,
     * lost connection) counts as disconnected.
     */
    public boolean isConnected() {
        try {
            return !driver.getWindowHandles().isEmpty();
        } catch (WebDriverException e) {
            log.debug("Session {} probe failed: {}", id, e.getMessage());
            return false;
        }
    }

    /** Quits the browser. Never throws. */
    public void close() {
        try {
            driver.quit();
            log.debug("Session {} closed", id);
        } catch (RuntimeException e) {
            log.warn("Session {} did not close cleanly: {}", id, e.getMessage());
        }
    }

    // ── Pool bookkeeping ───────────────────────────────────────────────────

    void markBusy(Instant now) {
        busy       = true;
        lastUsedAt = now;
    }

    void markIdle(Instant now) {
        busy       = false;
        lastUsedAt = now;
    }

    boolean matches(BrowserEngine wantedEngine, boolean wantedHeadless) {
        return engine == wantedEngine && headless == wantedHeadless;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public String getId()            { return id; }
    public BrowserEngine getEngine() { return engine; }
    public boolean isHeadless()      { return headless; }
    public WebDriver getDriver()     { return driver; }
    public boolean isBusy()          { return busy; }
    public Instant getLastUsedAt()   { return lastUsedAt; }

    @Override
    public String toString() {
        return String.format("SessionHandle{%s %s%s%s}", id, engine.id(),
                headless ? " headless" : "", busy ? " busy" : "");
    }
}
