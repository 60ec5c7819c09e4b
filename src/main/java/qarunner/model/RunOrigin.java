package qarunner.model;

/**
 * Provenance of a plan run.
 *
 * @param source      scheduled or manual
 * @param requestedBy user or service that asked for the run
 * @param scheduleId  owning schedule, {@code null} for manual runs
 */
public record RunOrigin(TriggerSource source, String requestedBy, String scheduleId) {

    public static RunOrigin manual(String requestedBy) {
        return new RunOrigin(TriggerSource.MANUAL, requestedBy, null);
    }

    public static RunOrigin scheduled(String scheduleId, String requestedBy) {
        return new RunOrigin(TriggerSource.SCHEDULED, requestedBy, scheduleId);
    }
}
