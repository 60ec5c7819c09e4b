package qarunner.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.BrowserEngine;
import qarunner.model.RecordedAction;
import qarunner.session.SessionHandle;
import qarunner.session.SessionPool;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Starts, observes and stops interactive recording sessions.
 *
 * <h3>Typical usage</h3>
 * <pre>{@code
 * String id = controller.start("https://app.example.com", "alice");
 * // user interacts with the visible browser ...
 * List<RecordedAction> actions = controller.stop(id, "alice").orElseThrow();
 * }</pre>
 *
 * <p>A background watcher collects buffered actions from every open session
 * at {@code recorder.poll.interval.ms}. When the user closes the browser
 * window the session stays registered, so a later {@link #stop} still returns
 * everything captured before the close.
 *
 * <p>Lookups by an unknown id, a second stop, or a user id that does not own
 * the session return {@link Optional#empty()} rather than throwing.
 */
public class RecordingController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecordingController.class);

    private final SessionPool pool;
    private final BrowserEngine engine;
    private final long pollIntervalMs;
    private final List<String> redactTypes;
    private final Clock clock;
    private final Map<String, RecordingSession> sessions = new ConcurrentHashMap<>();

    private ScheduledExecutorService watcher;

    public RecordingController(SessionPool pool, RecorderConfig config) {
        this(pool, config.getEngine(), config.getPollIntervalMs(), config.getRedactTypes(), Clock.systemUTC());
    }

    RecordingController(SessionPool pool, BrowserEngine engine, long pollIntervalMs,
                        List<String> redactTypes, Clock clock) {
        this.pool           = pool;
        this.engine         = engine;
        this.pollIntervalMs = pollIntervalMs;
        this.redactTypes    = redactTypes;
        this.clock          = clock;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Opens a visible browser on {@code url} and starts capturing.
     *
     * @return the new recording's id
     * @throws RecordingException if the browser cannot be started or the page cannot be prepared
     */
    public String start(String url, String userId) {
        SessionHandle handle;
        try {
            handle = pool.acquire(engine, false);
        } catch (RuntimeException e) {
            throw new RecordingException("Could not open a browser for recording: " + e.getMessage(), e);
        }

        String id = UUID.randomUUID().toString();
        RecordingSession session = new RecordingSession(id, userId, handle, redactTypes, clock.instant());
        try {
            session.begin(url);
        } catch (RuntimeException e) {
            pool.release(handle);
            throw new RecordingException("Could not start recording on " + url + ": " + e.getMessage(), e);
        }
        sessions.put(id, session);
        ensureWatcher();
        return id;
    }

    /**
     * Actions captured so far, without ending the recording.
     */
    public Optional<List<RecordedAction>> poll(String sessionId, String userId) {
        return owned(sessionId, userId).map(session -> {
            session.harvest(clock.instant());
            return session.snapshot();
        });
    }

    /**
     * Ends a recording: collects what is still buffered, appends a terminal
     * {@code stop} action and closes the browser.
     */
    public Optional<List<RecordedAction>> stop(String sessionId, String userId) {
        Optional<RecordingSession> found = owned(sessionId, userId);
        if (found.isEmpty()) return Optional.empty();
        RecordingSession session = found.get();
        if (!sessions.remove(sessionId, session)) {
            log.debug("Recording {} already stopped", sessionId);
            return Optional.empty();
        }

        List<RecordedAction> actions = session.finish(clock.instant());
        try {
            pool.discard(session.getHandle());
        } catch (RuntimeException e) {
            log.warn("Recording {}: closing the browser failed: {}", sessionId, e.getMessage());
        }
        return Optional.ofNullable(actions);
    }

    public List<String> activeSessionIds() {
        return new ArrayList<>(sessions.keySet());
    }

    /** Stops the watcher and every open recording. */
    @Override
    public void close() {
        synchronized (this) {
            if (watcher != null) {
                watcher.shutdownNow();
                watcher = null;
            }
        }
        for (RecordingSession session : new ArrayList<>(sessions.values())) {
            stop(session.getId(), null);
        }
        log.info("Recording controller closed");
    }

    // ── Watcher ───────────────────────────────────────────────────────────

    /** Collects from every open session once. */
    void harvestAll() {
        for (RecordingSession session : sessions.values()) {
            try {
                session.harvest(clock.instant());
            } catch (RuntimeException e) {
                log.warn("Recording {}: harvest failed: {}", session.getId(), e.getMessage());
            }
        }
    }

    private synchronized void ensureWatcher() {
        if (watcher != null) return;
        watcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recording-watcher");
            t.setDaemon(true);
            return t;
        });
        watcher.scheduleWithFixedDelay(this::harvestAll, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        log.debug("Recording watcher started (every {}ms)", pollIntervalMs);
    }

    private Optional<RecordingSession> owned(String sessionId, String userId) {
        RecordingSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) return Optional.empty();
        if (userId != null && !Objects.equals(userId, session.getUserId())) {
            log.warn("User {} is not the owner of recording {}", userId, sessionId);
            return Optional.empty();
        }
        return Optional.of(session);
    }
}
