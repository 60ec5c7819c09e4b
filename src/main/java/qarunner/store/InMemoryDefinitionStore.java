package qarunner.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.ApiTestDefinition;
import qarunner.model.ElementDefinition;
import qarunner.model.TestPlan;
import qarunner.model.TestStep;
import qarunner.model.UiTestDefinition;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed {@link DefinitionStore}; callers always receive copies. */
public class InMemoryDefinitionStore implements DefinitionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDefinitionStore.class);

    private final Map<String, TestPlan> plans = new ConcurrentHashMap<>();
    private final Map<String, UiTestDefinition> uiTests = new ConcurrentHashMap<>();
    private final Map<String, ApiTestDefinition> apiTests = new ConcurrentHashMap<>();

    public void savePlan(TestPlan plan) {
        plans.put(plan.getId(), plan.copy());
    }

    public void saveUiTest(UiTestDefinition test) {
        uiTests.put(test.getId(), test.copy());
    }

    public void saveApiTest(ApiTestDefinition test) {
        apiTests.put(test.getId(), test.copy());
    }

    @Override
    public Optional<TestPlan> findPlan(String planId) {
        return Optional.ofNullable(plans.get(planId)).map(TestPlan::copy);
    }

    @Override
    public Optional<UiTestDefinition> findUiTest(String testId) {
        return Optional.ofNullable(uiTests.get(testId)).map(UiTestDefinition::copy);
    }

    @Override
    public Optional<ApiTestDefinition> findApiTest(String testId) {
        return Optional.ofNullable(apiTests.get(testId)).map(ApiTestDefinition::copy);
    }

    @Override
    public void updateStepLocator(String testId, int stepIndex, String newSelector) {
        UiTestDefinition updated = uiTests.computeIfPresent(testId, (id, current) -> {
            if (stepIndex < 0 || stepIndex >= current.getSteps().size()) {
                throw new IllegalArgumentException("Test " + testId + " has no step " + stepIndex);
            }
            UiTestDefinition copy = current.copy();
            TestStep step = copy.getSteps().get(stepIndex);
            String oldSelector = step.getTarget();
            step.setTarget(newSelector);

            Optional<ElementDefinition> element = step.getElementId() != null
                    ? copy.findElement(step.getElementId())
                    : copy.getElements().stream()
                            .filter(e -> oldSelector != null && oldSelector.equals(e.getSelector()))
                            .findFirst();
            element.ifPresent(e -> {
                if (e.getOriginalSelector() == null) e.setOriginalSelector(e.getSelector());
                e.setSelector(newSelector);
            });
            return copy;
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown UI test: " + testId);
        }
        log.info("Updated selector of test {} step {} to '{}'", testId, stepIndex, newSelector);
    }
}
