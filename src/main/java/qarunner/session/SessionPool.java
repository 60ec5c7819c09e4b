package qarunner.session;

import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.BrowserEngine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multiplexes browser sessions between concurrent runs.
 *
 * <ul>
 *   <li>Idle sessions are reused only for an exact engine + headless match.</li>
 *   <li>A busy session is never handed out twice.</li>
 *   <li>Above {@code maxSize} an overflow session is launched anyway, with a warning.</li>
 *   <li>Disconnected sessions are evicted on acquire and on release.</li>
 *   <li>A periodic sweep closes sessions idle for longer than {@code idleTimeout}.</li>
 * </ul>
 *
 * <p>Registry changes happen under a single lock; launching, probing and
 * closing browsers happen outside it. Eviction always drops the registry
 * entry, even if the browser refuses to close.
 */
public class SessionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private final SessionLauncher launcher;
    private final int maxSize;
    private final Duration idleTimeout;
    private final Duration sweepInterval;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SessionHandle> handles = new LinkedHashMap<>();

    private ScheduledExecutorService sweeper;

    public SessionPool(SessionLauncher launcher, PoolConfig config) {
        this(launcher, config.getMaxSize(), config.getIdleTimeout(), config.getSweepInterval(), Clock.systemUTC());
    }

    /** Package-private constructor for tests (fixed sizes and a controllable clock). */
    SessionPool(SessionLauncher launcher, int maxSize, Duration idleTimeout, Duration sweepInterval, Clock clock) {
        this.launcher      = launcher;
        this.maxSize       = maxSize;
        this.idleTimeout   = idleTimeout;
        this.sweepInterval = sweepInterval;
        this.clock         = clock;
    }

    // ── Lifecycle ──────────────────────────────────────────────────────────

    /** Starts the background idle sweep. Idempotent. */
    public void start() {
        lock.lock();
        try {
            if (sweeper != null) return;
            sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "session-pool-sweeper");
                t.setDaemon(true);
                return t;
            });
            long periodMs = sweepInterval.toMillis();
            sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
            log.info("Session pool started (max={}, idleTimeout={}s, sweep every {}s)",
                    maxSize, idleTimeout.toSeconds(), sweepInterval.toSeconds());
        } finally {
            lock.unlock();
        }
    }

    /** Stops the sweep and closes every session, busy or not. */
    @Override
    public void close() {
        List<SessionHandle> all;
        lock.lock();
        try {
            if (sweeper != null) {
                sweeper.shutdownNow();
                sweeper = null;
            }
            all = new ArrayList<>(handles.values());
            handles.clear();
        } finally {
            lock.unlock();
        }
        all.forEach(SessionHandle::close);
        log.info("Session pool closed ({} session(s) shut down)", all.size());
    }

    // ── Public API ─────────────────────────────────────────────────────────

    /**
     * Returns an exclusive session for the given engine and mode, reusing an
     * idle connected one when possible.
     *
     * @throws SessionLaunchException if a new browser has to be started and cannot be
     */
    public SessionHandle acquire(BrowserEngine engine, boolean headless) {
        while (true) {
            SessionHandle candidate = null;
            lock.lock();
            try {
                for (SessionHandle h : handles.values()) {
                    if (!h.isBusy() && h.matches(engine, headless)) {
                        candidate = h;
                        candidate.markBusy(clock.instant());
                        break;
                    }
                }
            } finally {
                lock.unlock();
            }
            if (candidate == null) break;
            if (candidate.isConnected()) {
                log.debug("Reusing session {}", candidate.getId());
                return candidate;
            }
            log.info("Evicting disconnected idle session {}", candidate.getId());
            evict(candidate);
        }

        boolean overflow;
        lock.lock();
        try {
            overflow = handles.size() >= maxSize;
        } finally {
            lock.unlock();
        }
        if (overflow) {
            log.warn("Session pool at capacity ({}); launching overflow {} session", maxSize, engine.id());
        }

        WebDriver driver = launcher.launch(engine, headless);
        Instant now = clock.instant();
        SessionHandle handle = new SessionHandle(UUID.randomUUID().toString(), engine, headless, driver, now);
        lock.lock();
        try {
            handle.markBusy(now);
            handles.put(handle.getId(), handle);
        } finally {
            lock.unlock();
        }
        log.info("Launched session {} ({} in pool)", handle.getId(), size());
        return handle;
    }

    /**
     * Returns a session to the pool. Disconnected sessions are evicted; a
     * handle the pool does not know is simply closed.
     */
    public void release(SessionHandle handle) {
        if (handle == null) return;
        if (!isTracked(handle)) {
            log.warn("Released session {} is not tracked by the pool; closing it", handle.getId());
            handle.close();
            return;
        }
        if (!handle.isConnected()) {
            log.info("Released session {} is disconnected; evicting", handle.getId());
            evict(handle);
            return;
        }
        lock.lock();
        try {
            handle.markIdle(clock.instant());
        } finally {
            lock.unlock();
        }
        log.debug("Session {} returned to pool", handle.getId());
    }

    /** Removes and closes a session regardless of its state. */
    public void discard(SessionHandle handle) {
        if (handle == null) return;
        evict(handle);
    }

    /**
     * Closes idle sessions unused for longer than the idle timeout.
     *
     * @return number of sessions evicted
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        List<SessionHandle> expired = new ArrayList<>();
        lock.lock();
        try {
            handles.values().removeIf(h -> {
                boolean stale = !h.isBusy() && !h.getLastUsedAt().isAfter(cutoff);
                if (stale) expired.add(h);
                return stale;
            });
        } finally {
            lock.unlock();
        }
        if (!expired.isEmpty()) {
            log.info("Sweep evicting {} idle session(s)", expired.size());
            expired.forEach(SessionHandle::close);
        }
        return expired.size();
    }

    public int size() {
        lock.lock();
        try {
            return handles.size();
        } finally {
            lock.unlock();
        }
    }

    public int idleCount() {
        lock.lock();
        try {
            return (int) handles.values().stream().filter(h -> !h.isBusy()).count();
        } finally {
            lock.unlock();
        }
    }

    // ── Internals ──────────────────────────────────────────────────────────

    private boolean isTracked(SessionHandle handle) {
        lock.lock();
        try {
            return handles.get(handle.getId()) == handle;
        } finally {
            lock.unlock();
        }
    }

    private void evict(SessionHandle handle) {
        lock.lock();
        try {
            handles.remove(handle.getId(), handle);
        } finally {
            lock.unlock();
        }
        handle.close();
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Session sweep failed", e);
        }
    }
}
