package qarunner.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/** HTTP response returned by {@link ApiClient#send}. */
public final class ApiResponse {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int statusCode;
    private final String body;
    private final Map<String, String> headers;
    private final long durationMs;
    private final ApiRequest request;

    public ApiResponse(int statusCode, String body, Map<String, String> headers, long durationMs,
                       ApiRequest request) {
        this.statusCode = statusCode;
        this.body       = body == null ? "" : body;
        this.headers    = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
        this.durationMs = durationMs;
        this.request    = request;
    }

    public int getStatusCode()              { return statusCode; }
    public String getBody()                 { return body; }
    /** Header names are lower-cased. */
    public Map<String, String> getHeaders() { return headers; }
    public long getDurationMs()             { return durationMs; }
    public ApiRequest getRequest()          { return request; }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode <= 299;
    }

    /** Case-insensitive substring match on the body. */
    public boolean bodyContains(String text) {
        if (text == null) return false;
        return body.toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
    }

    public String header(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Follows a dot path ({@code data.items.0.id}) through the JSON body.
     * Numeric segments index into arrays.
     *
     * @return the value's text (containers as JSON), or {@code null} if absent or the body is not JSON
     */
    public String getJsonValue(String jsonPath) {
        if (jsonPath == null || jsonPath.isEmpty()) return null;
        JsonNode node;
        try {
            node = MAPPER.readTree(body);
        } catch (Exception e) {
            return null;
        }
        for (String segment : jsonPath.split("\\.")) {
            if (node == null) return null;
            if (node.isArray() && segment.chars().allMatch(Character::isDigit)) {
                node = node.get(Integer.parseInt(segment));
            } else if (node.isObject()) {
                node = node.get(segment);
            } else {
                return null;
            }
        }
        if (node == null || node.isMissingNode()) return null;
        return node.isValueNode() ? node.asText() : node.toString();
    }

    @Override
    public String toString() {
        return "ApiResponse{status=" + statusCode + ", durationMs=" + durationMs
                + ", bodyLength=" + body.length() + '}';
    }
}
