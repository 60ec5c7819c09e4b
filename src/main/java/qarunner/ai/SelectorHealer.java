package qarunner.ai;

import qarunner.model.ElementDefinition;

/**
 * Proposes a replacement selector for one that no longer resolves.
 * Implementations must not throw; failure is reported through
 * {@link HealingResult#failed(String)}.
 */
public interface SelectorHealer {

    /**
     * @param originalLocator the selector that failed
     * @param pageSource      current page HTML (may be large or {@code null})
     * @param errorText       the automation error that triggered healing
     * @param element         repository entry for the element, if the step references one
     */
    HealingResult propose(String originalLocator, String pageSource, String errorText, ElementDefinition element);
}
