package qarunner.model;

/**
 * Lifecycle of an {@link ExecutionRecord}. Transitions only move forward:
 * {@code PENDING -> RUNNING -> terminal}.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    PASSED,
    FAILED,
    PARTIAL,
    ERROR;

    public boolean isTerminal() {
        return this == PASSED || this == FAILED || this == PARTIAL || this == ERROR;
    }
}
