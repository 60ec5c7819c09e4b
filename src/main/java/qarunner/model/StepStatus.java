package qarunner.model;

public enum StepStatus {
    PASSED,
    FAILED
}
