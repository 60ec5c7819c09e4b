package qarunner.recorder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.NoSuchWindowException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.Json;
import qarunner.model.RecordedAction;
import qarunner.session.SessionHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * State of one live recording: the browser it watches and the actions
 * collected so far. All methods are synchronized; the watcher thread and
 * request threads may call them concurrently.
 */
public class RecordingSession {

    private static final Logger log = LoggerFactory.getLogger(RecordingSession.class);
    private static final TypeReference<List<RecordedAction>> ACTION_LIST = new TypeReference<>() {};

    private final String id;
    private final String userId;
    private final SessionHandle handle;
    private final List<String> redactTypes;
    private final Instant startedAt;
    private final List<RecordedAction> actions = new ArrayList<>();

    private String lastUrl;
    private boolean closedExternally;
    private boolean stopped;

    RecordingSession(String id, String userId, SessionHandle handle, List<String> redactTypes, Instant startedAt) {
        this.id          = id;
        this.userId      = userId;
        this.handle      = handle;
        this.redactTypes = List.copyOf(redactTypes);
        this.startedAt   = startedAt;
    }

    /** Opens the start page and installs the capture hook. Failures propagate. */
    synchronized void begin(String url) {
        WebDriver driver = handle.getDriver();
        driver.get(url);
        lastUrl = driver.getCurrentUrl();
        actions.add(RecordedAction.navigate(lastUrl, startedAt));
        install(driver);
        log.info("Recording {} started for user {} at {}", id, userId, lastUrl);
    }

    /**
     * Collects buffered actions from the page. Records a {@code navigate}
     * action when the URL changed, and re-installs the hook on a new document.
     * Marks the session closed when the browser is gone.
     */
    synchronized void harvest(Instant now) {
        if (stopped || closedExternally) return;
        WebDriver driver = handle.getDriver();
        try {
            String url = driver.getCurrentUrl();
            List<RecordedAction> batch = new ArrayList<>(drain(driver));
            if (url != null && !url.equals(lastUrl)) {
                batch.add(RecordedAction.navigate(url, now));
                lastUrl = url;
            }
            batch.sort(Comparator.comparing(a -> a.getTimestamp() != null ? a.getTimestamp() : now));
            actions.addAll(batch);
            if (install(driver)) {
                log.debug("Recording {}: capture hook re-installed on {}", id, url);
            }
        } catch (NoSuchSessionException | NoSuchWindowException e) {
            markClosed(e);
        } catch (WebDriverException e) {
            if (!handle.isConnected()) {
                markClosed(e);
            } else {
                log.debug("Recording {}: harvest failed, will retry: {}", id, e.getMessage());
            }
        }
    }

    /**
     * Final harvest (when still open), then appends the terminal {@code stop}
     * action. Returns the complete list; later calls return {@code null}.
     */
    synchronized List<RecordedAction> finish(Instant now) {
        if (stopped) return null;
        harvest(now);
        stopped = true;
        actions.add(RecordedAction.stop(now));
        log.info("Recording {} stopped with {} action(s){}", id, actions.size(),
                closedExternally ? " (browser was closed externally)" : "");
        return new ArrayList<>(actions);
    }

    synchronized List<RecordedAction> snapshot() {
        return new ArrayList<>(actions);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private boolean install(WebDriver driver) {
        Object installed = ((JavascriptExecutor) driver).executeScript(CaptureScripts.INSTALL, redactTypes);
        return Boolean.TRUE.equals(installed);
    }

    private List<RecordedAction> drain(WebDriver driver) {
        Object raw = ((JavascriptExecutor) driver).executeScript(CaptureScripts.DRAIN);
        if (!(raw instanceof String json) || json.isBlank()) return List.of();
        try {
            return Json.mapper().readValue(json, ACTION_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Recording {}: discarding unreadable action buffer: {}", id, e.getOriginalMessage());
            return List.of();
        }
    }

    private void markClosed(WebDriverException cause) {
        closedExternally = true;
        log.info("Recording {}: browser closed externally ({})", id, firstLine(cause.getMessage()));
    }

    private static String firstLine(String s) {
        if (s == null) return "no detail";
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public String getId()           { return id; }
    public String getUserId()       { return userId; }
    public Instant getStartedAt()   { return startedAt; }
    SessionHandle getHandle()       { return handle; }

    public synchronized boolean isClosedExternally() {
        return closedExternally;
    }

    public synchronized boolean isStopped() {
        return stopped;
    }
}
