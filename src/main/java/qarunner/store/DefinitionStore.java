package qarunner.store;

import qarunner.model.ApiTestDefinition;
import qarunner.model.TestPlan;
import qarunner.model.UiTestDefinition;

import java.util.Optional;

/** Read access to plan and test definitions, plus the healed-selector write-back. */
public interface DefinitionStore {

    Optional<TestPlan> findPlan(String planId);

    Optional<UiTestDefinition> findUiTest(String testId);

    Optional<ApiTestDefinition> findApiTest(String testId);

    /**
     * Replaces the selector of one step, and of the element-repository entry it
     * uses (matched by element id, else by the old selector). The entry keeps
     * its first selector as {@code originalSelector}.
     *
     * @throws IllegalArgumentException if the test or step does not exist
     */
    void updateStepLocator(String testId, int stepIndex, String newSelector);
}
