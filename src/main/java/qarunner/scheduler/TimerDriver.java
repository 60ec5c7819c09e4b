package qarunner.scheduler;

/**
 * Time-based trigger primitive behind the {@link ScheduleRegistry}.
 * Tasks must return quickly; long work belongs on another executor.
 */
public interface TimerDriver extends AutoCloseable {

    /** Arms {@code task} to run at every fire time of {@code trigger}. */
    ArmedTimer schedule(Trigger trigger, Runnable task);

    /** Cancels everything still armed and releases the timer threads. */
    @Override
    void close();

    /** Handle to an armed trigger. */
    interface ArmedTimer {

        /** Stops future fires. Idempotent; a fire already running is not interrupted. */
        void cancel();
    }
}
