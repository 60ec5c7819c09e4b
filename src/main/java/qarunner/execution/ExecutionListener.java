package qarunner.execution;

import qarunner.model.ExecutionRecord;

/**
 * Receives every execution record once it is terminal. Implementations must
 * not block for long; exceptions they throw are logged and ignored.
 */
@FunctionalInterface
public interface ExecutionListener {

    void onExecutionCompleted(ExecutionRecord record);
}
