package qarunner.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.ElementDefinition;
import qarunner.player.Locators;

import java.io.IOException;
import java.util.List;

/**
 * Asks the LLM for a replacement selector, given the failed selector, the
 * error and a truncated snapshot of the live page.
 *
 * <p>The model must answer with a bare CSS selector or XPath, or the sentinel
 * {@code CANNOT_HEAL}. When it cannot help (or is unreachable) and the
 * element repository knows the element's visible text, a text-matching
 * XPath is proposed instead.
 */
public class LlmSelectorHealer implements SelectorHealer {

    private static final Logger log = LoggerFactory.getLogger(LlmSelectorHealer.class);

    static final String CANNOT_HEAL_SENTINEL = "CANNOT_HEAL";

    private static final int TEXT_MATCH_MAX_CHARS = 30;

    private static final String SYSTEM_PROMPT = """
            You repair broken Selenium selectors. Given the selector that no longer
            matches, the automation error and the current page HTML, reply with ONE
            CSS selector or XPath that uniquely identifies the intended element.

            Rules:
            - Reply with the selector only: no prose, no quotes, no code fences
            - Prefer stable attributes (id, name, data-testid, aria-label)
            - If you cannot find the element, reply exactly: CANNOT_HEAL
            """;

    private final LLMClient llm;
    private final int domSnippetChars;

    /**
     * @param llm             configured client
     * @param domSnippetChars maximum characters of page HTML sent to the model
     */
    public LlmSelectorHealer(LLMClient llm, int domSnippetChars) {
        this.llm             = llm;
        this.domSnippetChars = domSnippetChars;
    }

    @Override
    public HealingResult propose(String originalLocator, String pageSource, String errorText,
                                 ElementDefinition element) {
        String userPrompt = """
                Broken selector: %s
                Error: %s
                %s
                Page HTML (truncated):
                %s
                """.formatted(
                        originalLocator,
                        errorText,
                        describe(element),
                        truncate(pageSource));

        HealingResult fromModel;
        try {
            String reply = clean(llm.complete(List.of(
                    LLMClient.ChatMessage.system(SYSTEM_PROMPT),
                    LLMClient.ChatMessage.user(userPrompt))));
            log.debug("Healer reply for '{}': {}", originalLocator, reply);

            if (reply.isEmpty() || CANNOT_HEAL_SENTINEL.equalsIgnoreCase(reply)) {
                fromModel = HealingResult.failed("Model could not suggest a selector for '" + originalLocator + "'");
            } else if (reply.equals(originalLocator)) {
                fromModel = HealingResult.failed("Model suggested the original selector again");
            } else {
                return HealingResult.success(reply);
            }
        } catch (IOException e) {
            log.warn("LLM healing request failed: {}", e.getMessage());
            fromModel = HealingResult.failed("LLM error: " + e.getMessage());
        }

        HealingResult fallback = healByText(element);
        return fallback.healed() ? fallback : fromModel;
    }

    /**
     * Text-based fallback that needs no model: an XPath matching the element's
     * tag and a prefix of its recorded visible text.
     */
    public HealingResult healByText(ElementDefinition element) {
        if (element == null || element.getText() == null || element.getText().isBlank()) {
            return HealingResult.failed("No element text available for text-based healing");
        }
        String text = element.getText().trim();
        String prefix = text.substring(0, Math.min(TEXT_MATCH_MAX_CHARS, text.length()));
        String tag = element.getTag() != null && !element.getTag().isBlank() ? element.getTag() : "*";
        return HealingResult.success(
                "//" + tag + "[contains(normalize-space(.), " + Locators.xpathLiteral(prefix) + ")]");
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private String truncate(String pageSource) {
        if (pageSource == null) return "(unavailable)";
        return pageSource.length() > domSnippetChars
                ? pageSource.substring(0, domSnippetChars) + "\n... [TRUNCATED]"
                : pageSource;
    }

    private static String describe(ElementDefinition element) {
        if (element == null) return "";
        return String.format("Element: id=%s tag=%s text=%s originalSelector=%s%n",
                element.getId(), element.getTag(), element.getText(), element.getOriginalSelector());
    }

    /** Strips code fences, surrounding quotes and anything after the first line. */
    static String clean(String reply) {
        if (reply == null) return "";
        String s = reply.trim();
        if (s.startsWith("```")) {
            s = s.replaceFirst("^```[a-zA-Z]*\\s*", "").replaceFirst("\\s*```\\s*$", "");
        }
        int nl = s.indexOf('\n');
        if (nl >= 0) s = s.substring(0, nl);
        s = s.trim();
        if (s.length() >= 2 && (s.startsWith("\"") && s.endsWith("\"") || s.startsWith("`") && s.endsWith("`"))) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }
}
