package qarunner.store;

import qarunner.model.Schedule;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/** Map-backed {@link ScheduleStore}; callers always receive copies. */
public class InMemoryScheduleStore implements ScheduleStore {

    private final Map<String, Schedule> schedules = new ConcurrentHashMap<>();

    public void save(Schedule schedule) {
        schedules.put(schedule.getId(), schedule.copy());
    }

    @Override
    public List<Schedule> findActive() {
        return schedules.values().stream()
                .filter(Schedule::isActive)
                .sorted(Comparator.comparing(Schedule::getId))
                .map(Schedule::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Schedule> find(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId)).map(Schedule::copy);
    }

    @Override
    public boolean deactivateIfActive(String scheduleId) {
        AtomicBoolean changed = new AtomicBoolean(false);
        schedules.computeIfPresent(scheduleId, (id, current) -> {
            if (!current.isActive()) return current;
            Schedule copy = current.copy();
            copy.setActive(false);
            changed.set(true);
            return copy;
        });
        return changed.get();
    }

    @Override
    public void updateRunTimes(String scheduleId, Instant lastRunAt, Instant nextRunAt) {
        schedules.computeIfPresent(scheduleId, (id, current) -> {
            Schedule copy = current.copy();
            copy.setLastRunAt(lastRunAt);
            if (nextRunAt != null) copy.setNextRunAt(nextRunAt);
            return copy;
        });
    }
}
