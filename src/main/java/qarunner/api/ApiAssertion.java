package qarunner.api;

import java.util.Objects;

/**
 * Fluent checks over an {@link ApiResponse}. Each method throws
 * {@link AssertionError} with a message naming expected and actual values.
 *
 * <pre>{@code
 * client.assertThat(response).statusCode(200).bodyContains("userId").durationBelow(2_000);
 * }</pre>
 */
public final class ApiAssertion {

    private final ApiResponse response;

    public ApiAssertion(ApiResponse response) {
        this.response = Objects.requireNonNull(response, "response must not be null");
    }

    public ApiAssertion statusCode(int expected) {
        int actual = response.getStatusCode();
        if (actual != expected) {
            throw new AssertionError("Expected status " + expected + " but was " + actual
                    + " (body: " + truncate(response.getBody(), 200) + ")");
        }
        return this;
    }

    public ApiAssertion statusCodeBetween(int lo, int hi) {
        int actual = response.getStatusCode();
        if (actual < lo || actual > hi) {
            throw new AssertionError("Expected status between " + lo + " and " + hi + " but was " + actual);
        }
        return this;
    }

    /** Case-insensitive. */
    public ApiAssertion bodyContains(String text) {
        if (!response.bodyContains(text)) {
            throw new AssertionError("Expected body to contain '" + text + "' but was: "
                    + truncate(response.getBody(), 300));
        }
        return this;
    }

    public ApiAssertion jsonPath(String path, String expected) {
        String actual = response.getJsonValue(path);
        if (!Objects.equals(actual, expected)) {
            throw new AssertionError("Expected JSON path '" + path + "' to be '" + expected
                    + "' but was " + (actual == null ? "absent" : "'" + actual + "'"));
        }
        return this;
    }

    public ApiAssertion header(String name, String expected) {
        String actual = response.header(name);
        if (actual == null) {
            throw new AssertionError("Expected header '" + name + "' but it was missing");
        }
        if (!actual.equals(expected)) {
            throw new AssertionError("Expected header '" + name + "' to be '" + expected
                    + "' but was '" + actual + "'");
        }
        return this;
    }

    public ApiAssertion durationBelow(long ms) {
        long actual = response.getDurationMs();
        if (actual >= ms) {
            throw new AssertionError("Expected response in under " + ms + "ms but took " + actual + "ms");
        }
        return this;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "<null>";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
