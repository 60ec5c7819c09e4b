package qarunner.ai;

import qarunner.config.ConfigLoader;

import java.util.Properties;

/**
 * AI settings ({@code ai.*} keys of {@code config.properties}) and factories
 * for the LLM-backed components.
 */
public class AIConfig {

    private final Properties props;

    public AIConfig() {
        this(ConfigLoader.load());
    }

    /** Reads settings from already loaded properties instead of the classpath. */
    public AIConfig(Properties props) {
        this.props = props;
    }

    // ── Property accessors ────────────────────────────────────────────────

    /** Whether selector healing uses the LLM at all (default: true). */
    public boolean isAiEnabled() {
        return ConfigLoader.getBool(props, "ai.enabled", true);
    }

    /** Whether failed healed-eligible steps get an LLM root-cause analysis (default: false). */
    public boolean isAnalyzerEnabled() {
        return ConfigLoader.getBool(props, "ai.analyzer.enabled", false);
    }

    /** Base URL of the OpenAI-compatible endpoint; defaults to Ollama's local address. */
    public String getLlmBaseUrl() {
        return ConfigLoader.getString(props, "ai.llm.base.url", "http://localhost:11434/v1");
    }

    public String getLlmModel() {
        return ConfigLoader.getString(props, "ai.llm.model", "qwen2.5-coder:32b");
    }

    public double getTemperature() {
        return ConfigLoader.getDouble(props, "ai.llm.temperature", 0.1);
    }

    public int getMaxTokens() {
        return ConfigLoader.getInt(props, "ai.llm.max.tokens", 1024);
    }

    public int getTimeoutSec() {
        return ConfigLoader.getInt(props, "ai.llm.timeout.sec", 120);
    }

    public int getRetryCount() {
        return ConfigLoader.getInt(props, "ai.llm.retry.count", 2);
    }

    public long getRetryDelayMs() {
        return ConfigLoader.getLong(props, "ai.llm.retry.delay.ms", 2000L);
    }

    /** Maximum page HTML characters sent to the healer (default: 30000). */
    public int getDomSnippetChars() {
        return ConfigLoader.getInt(props, "ai.healer.dom.snippet.chars", 30_000);
    }

    // ── Factory methods ───────────────────────────────────────────────────

    public LLMClient createLLMClient() {
        return new LLMClient(
                getLlmBaseUrl(),
                getLlmModel(),
                getTemperature(),
                getMaxTokens(),
                getTimeoutSec(),
                getRetryCount(),
                getRetryDelayMs());
    }

    /** @return the LLM healer, or {@code null} when AI is disabled */
    public SelectorHealer createSelectorHealer() {
        return isAiEnabled() ? new LlmSelectorHealer(createLLMClient(), getDomSnippetChars()) : null;
    }

    /** @return the analyzer, or {@code null} when disabled */
    public FailureAnalyzer createFailureAnalyzer() {
        return isAiEnabled() && isAnalyzerEnabled() ? new FailureAnalyzer(createLLMClient()) : null;
    }
}
