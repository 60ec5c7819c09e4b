package qarunner.player;

import qarunner.model.ElementDefinition;

import java.util.List;

/**
 * Where a step sits: the run it belongs to, the owning test (if persisted)
 * and its declared index.
 *
 * @param runKey    evidence sub-directory
 * @param testId    owning test id, {@code null} for ad-hoc sequences (no healing persistence)
 * @param stepIndex declared index, {@code -1} for the implicit navigation
 * @param elements  the test's element repository
 */
public record StepContext(String runKey, String testId, int stepIndex, List<ElementDefinition> elements) {

    public StepContext {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public StepContext atIndex(int index) {
        return new StepContext(runKey, testId, index, elements);
    }
}
