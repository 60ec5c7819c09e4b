package qarunner.model;

/** Outcome of one test inside an execution. */
public enum TestStatus {
    PASSED,
    FAILED,
    ERROR
}
