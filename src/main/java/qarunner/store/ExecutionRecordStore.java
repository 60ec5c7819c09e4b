package qarunner.store;

import qarunner.model.ExecutionRecord;

import java.util.List;
import java.util.Optional;

public interface ExecutionRecordStore {

    void create(ExecutionRecord record);

    /**
     * Persists the current state of a record.
     *
     * @throws IllegalStateException if the stored record is already terminal
     */
    void update(ExecutionRecord record);

    Optional<ExecutionRecord> find(String executionId);

    List<ExecutionRecord> findByPlan(String planId);

    List<ExecutionRecord> findBySchedule(String scheduleId);
}
