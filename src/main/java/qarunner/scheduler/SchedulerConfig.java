package qarunner.scheduler;

import qarunner.config.ConfigLoader;

import java.util.Properties;

/**
 * Scheduler settings ({@code scheduler.*} keys of {@code config.properties}).
 */
public class SchedulerConfig {

    private final Properties props;

    public SchedulerConfig() {
        this(ConfigLoader.load());
    }

    /** Reads settings from already loaded properties instead of the classpath. */
    public SchedulerConfig(Properties props) {
        this.props = props;
    }

    /** Threads that run fired schedules (default: 4). */
    public int getWorkerThreads() {
        return Math.max(1, ConfigLoader.getInt(props, "scheduler.worker.threads", 4));
    }

    public int getTimerThreads() {
        return Math.max(1, ConfigLoader.getInt(props, "scheduler.timer.threads", 2));
    }

    /** Pause before a retry of a failed scheduled run (default: 30 s). */
    public long getRetryDelayMs() {
        return Math.max(0L, ConfigLoader.getLong(props, "scheduler.retry.delay.ms", 30_000L));
    }

    /** Identity recorded as {@code triggeredBy} on scheduled executions. */
    public String getTriggeredBy() {
        return ConfigLoader.getString(props, "scheduler.triggered.by", "scheduler");
    }
}
