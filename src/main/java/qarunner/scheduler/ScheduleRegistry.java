package qarunner.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.execution.PlanOrchestrator;
import qarunner.model.BrowserEngine;
import qarunner.model.ExecutionRecord;
import qarunner.model.ExecutionStatus;
import qarunner.model.RunOrigin;
import qarunner.model.Schedule;
import qarunner.store.DefinitionStore;
import qarunner.store.ExecutionRecordStore;
import qarunner.store.ScheduleStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one armed timer per active schedule and runs the schedule's plan
 * whenever its trigger fires.
 *
 * <p>A fire only hands the run to the worker pool, so the timer threads are
 * never blocked and different schedules run concurrently. A {@code once}
 * schedule runs at most one time: the fire must win both the removal from
 * the armed set and the active-to-inactive flip in the store before the plan
 * is executed, so a concurrent {@link #disarm} or a duplicate fire does nothing.
 *
 * <p>Nothing that goes wrong during a scheduled run escapes the worker: an
 * orchestration failure is stored as an {@code ERROR} execution record.
 *
 * <p>The armed set lives in this process only. Running several registries
 * against the same schedule store fires every schedule once per process.
 */
public class ScheduleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRegistry.class);

    private final ScheduleStore schedules;
    private final DefinitionStore definitions;
    private final ExecutionRecordStore records;
    private final PlanOrchestrator orchestrator;
    private final TimerDriver timer;
    private final ExecutorService workers;
    private final long retryDelayMs;
    private final String triggeredBy;
    private final Clock clock;

    private final Map<String, ArmedSchedule> armed = new ConcurrentHashMap<>();

    public ScheduleRegistry(ScheduleStore schedules, DefinitionStore definitions, ExecutionRecordStore records,
                            PlanOrchestrator orchestrator, SchedulerConfig config) {
        this(schedules, definitions, records, orchestrator,
                new ExecutorTimerDriver(config.getTimerThreads()),
                Executors.newFixedThreadPool(config.getWorkerThreads(),
                        ExecutorTimerDriver.daemonThreads("schedule-worker-")),
                config.getRetryDelayMs(), config.getTriggeredBy(), Clock.systemUTC());
    }

    ScheduleRegistry(ScheduleStore schedules, DefinitionStore definitions, ExecutionRecordStore records,
                     PlanOrchestrator orchestrator, TimerDriver timer, ExecutorService workers,
                     long retryDelayMs, String triggeredBy, Clock clock) {
        this.schedules    = schedules;
        this.definitions  = definitions;
        this.records      = records;
        this.orchestrator = orchestrator;
        this.timer        = timer;
        this.workers      = workers;
        this.retryDelayMs = retryDelayMs;
        this.triggeredBy  = triggeredBy;
        this.clock        = clock;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Arms a schedule, replacing any timer already armed for its id.
     *
     * <p>Nothing is armed (and {@code false} is returned) when the schedule is
     * inactive, its frequency is invalid, its plan does not exist, or it is a
     * {@code once} schedule whose time has passed; the last case also
     * deactivates it in the store.
     */
    public boolean arm(Schedule schedule) {
        String id = schedule.getId();
        if (!schedule.isActive()) {
            log.info("Schedule {} is inactive; not arming", id);
            return false;
        }

        Trigger trigger;
        try {
            trigger = RecurrenceTranslator.translate(schedule);
        } catch (InvalidRecurrenceException e) {
            log.error("Schedule {} not armed: {}", id, e.getMessage());
            return false;
        }

        BrowserEngine browser;
        try {
            browser = schedule.primaryBrowser();
        } catch (IllegalArgumentException e) {
            log.error("Schedule {} not armed: {}", id, e.getMessage());
            return false;
        }
        List<String> browsers = schedule.getBrowsers();
        if (browsers != null && browsers.size() > 1) {
            log.warn("Schedule {} lists {} browsers; only {} is used", id, browsers.size(), browser.id());
        }

        if (definitions.findPlan(schedule.getPlanId()).isEmpty()) {
            log.error("Schedule {} not armed: test plan {} not found", id, schedule.getPlanId());
            return false;
        }

        if (schedule.isOnce() && !schedule.getNextRunAt().isAfter(clock.instant())) {
            boolean deactivated = schedules.deactivateIfActive(id);
            log.info("Once-schedule {} was due at {}; not arming{}", id, schedule.getNextRunAt(),
                    deactivated ? " (deactivated)" : "");
            return false;
        }

        if (disarm(id)) {
            log.warn("Schedule {} was already armed; previous timer replaced", id);
        }

        ArmedSchedule entry = new ArmedSchedule(schedule.copy(), trigger);
        armed.put(id, entry);
        entry.timer = timer.schedule(trigger, () -> onFire(entry));
        if (armed.get(id) != entry) {
            if (entry.fired) {
                log.info("Armed schedule {} (plan {}) with {}; already fired", id, schedule.getPlanId(), trigger);
                return true;
            }
            // disarmed while the timer was being created
            entry.cancel();
            return false;
        }
        log.info("Armed schedule {} (plan {}) with {}", id, schedule.getPlanId(), trigger);
        return true;
    }

    /** Stops a schedule's timer. Idempotent; returns whether anything was armed. */
    public boolean disarm(String scheduleId) {
        ArmedSchedule entry = armed.remove(scheduleId);
        if (entry == null) {
            log.debug("Schedule {} not armed; nothing to disarm", scheduleId);
            return false;
        }
        entry.cancel();
        log.info("Disarmed schedule {}", scheduleId);
        return true;
    }

    /** Applies a changed schedule: disarms it, then arms it again if still active. */
    public boolean rearm(Schedule schedule) {
        disarm(schedule.getId());
        if (!schedule.isActive()) {
            log.info("Schedule {} is now inactive; left disarmed", schedule.getId());
            return false;
        }
        return arm(schedule);
    }

    /**
     * Startup: disarms everything, then arms every active schedule in the store.
     *
     * @return number of schedules armed
     */
    public int loadAll() {
        armed.keySet().forEach(this::disarm);
        List<Schedule> active = schedules.findActive();
        log.info("Loading {} active schedule(s)", active.size());
        int count = 0;
        for (Schedule schedule : active) {
            if (arm(schedule)) count++;
        }
        log.info("{} of {} schedule(s) armed", count, active.size());
        return count;
    }

    public Set<String> armedIds() {
        return new TreeSet<>(armed.keySet());
    }

    /** Disarms everything and waits briefly for runs in progress. */
    public void shutdown() {
        armed.keySet().forEach(this::disarm);
        timer.close();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Scheduled runs still in progress after 30s; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Schedule registry shut down");
    }

    // ── Firing ────────────────────────────────────────────────────────────

    /** Runs on a timer thread. */
    void onFire(ArmedSchedule entry) {
        String id = entry.schedule.getId();
        Instant firedAt = clock.instant();

        if (entry.schedule.isOnce()) {
            if (!armed.remove(id, entry)) {
                log.debug("Once-schedule {} fired after being disarmed; ignoring", id);
                return;
            }
            entry.fired = true;
            if (!schedules.deactivateIfActive(id)) {
                log.info("Once-schedule {} already inactive; not running", id);
                return;
            }
        } else if (armed.get(id) != entry) {
            entry.cancel();
            return;
        }

        try {
            workers.execute(() -> runScheduled(entry, firedAt));
        } catch (RejectedExecutionException e) {
            log.warn("Schedule {} fired during shutdown; run dropped", id);
        }
    }

    /** Runs on a worker thread. */
    private void runScheduled(ArmedSchedule entry, Instant firedAt) {
        Schedule schedule = entry.schedule;
        if (entry.trigger.isRecurring()) {
            Optional<Schedule> latest = schedules.find(schedule.getId());
            if (latest.isEmpty() || !latest.get().isActive()) {
                log.info("Schedule {} was {} in the store; disarming", schedule.getId(),
                        latest.isEmpty() ? "deleted" : "deactivated");
                armed.remove(schedule.getId(), entry);
                entry.cancel();
                return;
            }
            schedule = latest.get();
        }
        recordRunTimes(schedule, entry.trigger, firedAt);

        log.info("Schedule {} fired: running plan {}", schedule.getId(), schedule.getPlanId());
        ExecutionRecord outcome = runPlan(schedule);

        int retries = schedule.getRetryPolicy().additionalAttempts(schedule.getRetryCount());
        for (int attempt = 1; attempt <= retries && needsRetry(outcome); attempt++) {
            log.warn("Scheduled run of {} ended {}; retry {}/{} in {}ms",
                    schedule.getId(), outcome.getStatus(), attempt, retries, retryDelayMs);
            if (!pause()) {
                log.warn("Retries of schedule {} interrupted", schedule.getId());
                return;
            }
            outcome = runPlan(schedule);
        }
    }

    private ExecutionRecord runPlan(Schedule schedule) {
        try {
            return orchestrator.run(schedule.getPlanId(),
                    RunOrigin.scheduled(schedule.getId(), triggeredBy), schedule.toOverrides());
        } catch (RuntimeException e) {
            log.error("Scheduled run of {} (plan {}) failed", schedule.getId(), schedule.getPlanId(), e);
            return errorRecord(schedule, e);
        }
    }

    private ExecutionRecord errorRecord(Schedule schedule, RuntimeException cause) {
        Instant now = clock.instant();
        ExecutionRecord record = ExecutionRecord.pending(UUID.randomUUID().toString(), schedule.getPlanId(),
                RunOrigin.scheduled(schedule.getId(), triggeredBy), schedule.getEnvironment(), now);
        record.markRunning();
        record.complete(ExecutionStatus.ERROR, now, cause.getMessage());
        try {
            records.create(record.copy());
        } catch (RuntimeException e) {
            log.error("Could not store error record for schedule {}: {}", schedule.getId(), e.getMessage());
        }
        return record;
    }

    private void recordRunTimes(Schedule schedule, Trigger trigger, Instant firedAt) {
        try {
            Instant next = trigger.isRecurring() ? trigger.nextFireAfter(firedAt) : null;
            schedules.updateRunTimes(schedule.getId(), firedAt, next);
            log.debug("Schedule {} ran at {}, next run {}", schedule.getId(), firedAt, next);
        } catch (RuntimeException e) {
            log.error("Could not update run times of schedule {}: {}", schedule.getId(), e.getMessage());
        }
    }

    private static boolean needsRetry(ExecutionRecord record) {
        return record.getStatus() == ExecutionStatus.FAILED || record.getStatus() == ExecutionStatus.ERROR;
    }

    private boolean pause() {
        if (retryDelayMs <= 0) return true;
        try {
            Thread.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ── Nested types ──────────────────────────────────────────────────────

    static final class ArmedSchedule {

        final Schedule schedule;
        final Trigger trigger;
        volatile TimerDriver.ArmedTimer timer;
        volatile boolean fired;

        ArmedSchedule(Schedule schedule, Trigger trigger) {
            this.schedule = schedule;
            this.trigger  = trigger;
        }

        void cancel() {
            TimerDriver.ArmedTimer t = timer;
            if (t != null) t.cancel();
        }
    }
}
