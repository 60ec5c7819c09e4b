package qarunner.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a failed step into a short root-cause explanation using the LLM.
 * Returns {@code null} whenever the model is unavailable or answers in an
 * unexpected format; callers treat the analysis as optional.
 */
public class FailureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FailureAnalyzer.class);

    private static final int MAX_DOM_CHARS   = 8_000;
    private static final int MAX_ERROR_CHARS = 1_000;

    private static final String SYSTEM_PROMPT = """
            You are a test automation engineer analysing a failed browser step.
            Respond in exactly this format (no other text):
            ROOT_CAUSE: <1-2 sentences explaining why the step failed>
            CATEGORY: <one of: LOCATOR_CHANGED, ELEMENT_NOT_VISIBLE, TIMING, NAVIGATION, DATA_MISMATCH, OTHER>
            """;

    private final LLMClient llmClient;

    public FailureAnalyzer(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    /**
     * @param action     action identifier of the failed step
     * @param locator    selector the step used
     * @param error      automation error text
     * @param pageSource page HTML at the time of failure (may be {@code null})
     * @return root-cause text prefixed with its category, or {@code null}
     */
    public String analyze(String action, String locator, String error, String pageSource) {
        String prompt = """
                Failed step: %s on '%s'

                Error:
                %s

                DOM snapshot (first %d chars):
                %s
                """.formatted(action, locator,
                        truncate(error, MAX_ERROR_CHARS),
                        MAX_DOM_CHARS,
                        truncate(pageSource, MAX_DOM_CHARS));
        try {
            String response = llmClient.complete(List.of(
                    LLMClient.ChatMessage.system(SYSTEM_PROMPT),
                    LLMClient.ChatMessage.user(prompt)));
            String rootCause = extractField(response, "ROOT_CAUSE:");
            if (rootCause == null) {
                log.debug("Failure analysis reply not in expected format: {}", response);
                return null;
            }
            String category = extractField(response, "CATEGORY:");
            return category != null ? "[" + category + "] " + rootCause : rootCause;
        } catch (Exception e) {
            log.warn("LLM failure analysis request failed: {}", e.getMessage());
            return null;
        }
    }

    private static String extractField(String response, String prefix) {
        if (response == null) return null;
        return response.lines()
                .map(String::trim)
                .filter(l -> l.startsWith(prefix))
                .map(l -> l.substring(prefix.length()).trim())
                .findFirst()
                .orElse(null);
    }

    private static String truncate(String s, int max) {
        if (s == null) return "(unavailable)";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
