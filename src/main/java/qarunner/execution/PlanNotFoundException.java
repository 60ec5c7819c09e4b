package qarunner.execution;

import qarunner.player.QaRunnerException;

/** The requested plan id does not resolve to a stored plan. */
public class PlanNotFoundException extends QaRunnerException {

    private final String planId;

    public PlanNotFoundException(String planId) {
        super("Test plan not found: " + planId);
        this.planId = planId;
    }

    public String getPlanId() {
        return planId;
    }
}
