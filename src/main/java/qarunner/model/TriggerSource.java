package qarunner.model;

/** Who started an execution. */
public enum TriggerSource {
    SCHEDULED,
    MANUAL
}
