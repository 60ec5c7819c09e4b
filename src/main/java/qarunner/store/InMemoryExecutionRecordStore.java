package qarunner.store;

import qarunner.model.ExecutionRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Map-backed {@link ExecutionRecordStore}. Stores snapshots, and refuses to
 * overwrite a record that is already terminal.
 */
public class InMemoryExecutionRecordStore implements ExecutionRecordStore {

    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();

    @Override
    public void create(ExecutionRecord record) {
        ExecutionRecord previous = records.putIfAbsent(record.getId(), record.copy());
        if (previous != null) {
            throw new IllegalStateException("Execution " + record.getId() + " already exists");
        }
    }

    @Override
    public void update(ExecutionRecord record) {
        records.compute(record.getId(), (id, stored) -> {
            if (stored != null && stored.isTerminal()) {
                throw new IllegalStateException("Execution " + id + " is already " + stored.getStatus());
            }
            return record.copy();
        });
    }

    @Override
    public Optional<ExecutionRecord> find(String executionId) {
        return Optional.ofNullable(records.get(executionId)).map(ExecutionRecord::copy);
    }

    @Override
    public List<ExecutionRecord> findByPlan(String planId) {
        return select(r -> planId.equals(r.getPlanId()));
    }

    @Override
    public List<ExecutionRecord> findBySchedule(String scheduleId) {
        return select(r -> scheduleId.equals(r.getScheduleId()));
    }

    private List<ExecutionRecord> select(Predicate<ExecutionRecord> filter) {
        return records.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(ExecutionRecord::getStartedAt))
                .map(ExecutionRecord::copy)
                .collect(Collectors.toList());
    }
}
