package qarunner.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint
 * (Ollama, vLLM, OpenAI). Server errors (5xx) and transport failures are
 * retried; client errors and malformed responses are not.
 */
public class LLMClient {

    private static final Logger log = LoggerFactory.getLogger(LLMClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final int retryCount;
    private final long retryDelayMs;
    private final OkHttpClient httpClient;

    /**
     * @param baseUrl      endpoint root, e.g. {@code http://localhost:11434/v1}; a trailing slash is dropped
     * @param model        model name sent with every request
     * @param temperature  sampling temperature
     * @param maxTokens    completion length limit
     * @param timeoutSec   read timeout per attempt
     * @param retryCount   extra attempts after a retriable failure; negative means none
     * @param retryDelayMs pause between attempts
     */
    public LLMClient(String baseUrl, String model, double temperature, int maxTokens,
                     int timeoutSec, int retryCount, long retryDelayMs) {
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model        = model;
        this.temperature  = temperature;
        this.maxTokens    = maxTokens;
        this.retryCount   = Math.max(0, retryCount);
        this.retryDelayMs = retryDelayMs;
        this.httpClient   = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Sends the conversation and returns the assistant's reply.
     *
     * @param messages chat turns in conversation order
     * @return {@code choices[0].message.content}, trimmed
     * @throws IOException when all attempts fail or the response is unusable
     */
    public String complete(List<ChatMessage> messages) throws IOException {
        Request request = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .post(RequestBody.create(buildRequestJson(messages), JSON))
                .build();

        IOException last = null;
        for (int attempt = 1; attempt <= retryCount + 1; attempt++) {
            if (attempt > 1) {
                log.warn("Retrying LLM request (attempt {}/{}) after {}ms", attempt, retryCount + 1, retryDelayMs);
                pause();
            }
            try {
                return executeOnce(request);
            } catch (NonRetriableException e) {
                throw e;
            } catch (IOException e) {
                log.warn("LLM request attempt {} failed: {}", attempt, e.getMessage());
                last = e;
            }
        }
        throw new IOException("LLM request failed after " + (retryCount + 1) + " attempt(s): "
                + (last != null ? last.getMessage() : "unknown"), last);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private String executeOnce(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (response.code() >= 500) {
                throw new IOException("LLM server error " + response.code() + ": " + text);
            }
            if (!response.isSuccessful()) {
                throw new NonRetriableException("LLM request rejected with HTTP " + response.code() + ": " + text);
            }
            return parseContent(text);
        }
    }

    private void pause() throws IOException {
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during retry delay", ie);
        }
    }

    private String buildRequestJson(List<ChatMessage> messages) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", model);
        root.put("temperature", temperature);
        root.put("max_tokens", maxTokens);
        root.put("stream", false);
        ArrayNode msgs = root.putArray("messages");
        for (ChatMessage msg : messages) {
            msgs.addObject().put("role", msg.role()).put("content", msg.content());
        }
        return MAPPER.writeValueAsString(root);
    }

    private static String parseContent(String responseBody) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new NonRetriableException("LLM response is not JSON: " + e.getOriginalMessage());
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new NonRetriableException("LLM response missing choices[0].message.content");
        }
        return content.asText().trim();
    }

    // ── Nested types ──────────────────────────────────────────────────────

    /** One chat turn. */
    public record ChatMessage(String role, String content) {

        /** @param content instructions for the model */
        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        /** @param content the question or page excerpt */
        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }

    /** Failure that a retry cannot fix (4xx, malformed body). */
    static final class NonRetriableException extends IOException {
        NonRetriableException(String msg) {
            super(msg);
        }
    }
}
