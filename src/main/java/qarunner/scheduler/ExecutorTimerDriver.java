package qarunner.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TimerDriver} on a {@link ScheduledExecutorService}.
 *
 * <ul>
 *   <li>one-shot: a single delayed task</li>
 *   <li>interval: fixed-rate task starting at the next anchor-aligned instant</li>
 *   <li>cron: a delayed task that re-arms itself for the next cron time after each fire</li>
 * </ul>
 */
public class ExecutorTimerDriver implements TimerDriver {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTimerDriver.class);

    private final ScheduledExecutorService executor;
    private final Clock clock;

    public ExecutorTimerDriver(int threads) {
        this(Executors.newScheduledThreadPool(Math.max(1, threads), daemonThreads("schedule-timer-")),
                Clock.systemUTC());
    }

    ExecutorTimerDriver(ScheduledExecutorService executor, Clock clock) {
        this.executor = executor;
        this.clock    = clock;
    }

    @Override
    public ArmedTimer schedule(Trigger trigger, Runnable task) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Timer task for {} failed", trigger, e);
            }
        };
        Instant now = clock.instant();
        return switch (trigger.kind()) {
            case ONCE -> {
                ScheduledFuture<?> f = executor.schedule(guarded, delayMillis(now, trigger.anchor()), TimeUnit.MILLISECONDS);
                yield () -> f.cancel(false);
            }
            case INTERVAL -> {
                Instant first = trigger.nextFireAfter(now.minusMillis(1));
                ScheduledFuture<?> f = executor.scheduleAtFixedRate(guarded, delayMillis(now, first),
                        trigger.interval().toMillis(), TimeUnit.MILLISECONDS);
                yield () -> f.cancel(false);
            }
            case CRON -> {
                CronTimer timer = new CronTimer(trigger, guarded);
                timer.armNext(now);
                yield timer;
            }
        };
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private long delayMillis(Instant now, Instant at) {
        return Math.max(0L, Duration.between(now, at).toMillis());
    }

    /** Re-arms itself after each fire. */
    private final class CronTimer implements ArmedTimer {

        private final Trigger trigger;
        private final Runnable task;
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> pending;

        CronTimer(Trigger trigger, Runnable task) {
            this.trigger = trigger;
            this.task    = task;
        }

        void armNext(Instant after) {
            if (cancelled) return;
            Instant next = trigger.nextFireAfter(after);
            if (next == null) {
                log.info("Cron trigger {} has no further fire times", trigger);
                return;
            }
            try {
                pending = executor.schedule(() -> fire(next), delayMillis(clock.instant(), next), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Timer shut down; {} not re-armed", trigger);
            }
        }

        private void fire(Instant scheduledFor) {
            if (cancelled) return;
            try {
                task.run();
            } finally {
                Instant now = clock.instant();
                armNext(now.isAfter(scheduledFor) ? now : scheduledFor);
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = pending;
            if (f != null) f.cancel(false);
        }
    }
}
