package qarunner.store;

import qarunner.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleStore {

    List<Schedule> findActive();

    Optional<Schedule> find(String scheduleId);

    /**
     * Atomically flips the schedule from active to inactive.
     *
     * @return {@code true} only for the caller that performed the change
     */
    boolean deactivateIfActive(String scheduleId);

    /** Records the last fire time and the next planned one. */
    void updateRunTimes(String scheduleId, Instant lastRunAt, Instant nextRunAt);
}
