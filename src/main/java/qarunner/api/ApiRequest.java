package qarunner.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable HTTP request sent through {@link ApiClient}.
 *
 * <pre>{@code
 * ApiRequest req = ApiRequest.of("POST", "https://api.example.com/users")
 *         .body("{\"name\":\"Alice\"}")
 *         .contentType("application/json")
 *         .header("X-Request-Id", "abc123")
 *         .timeout(5_000)
 *         .build();
 * }</pre>
 */
public final class ApiRequest {

    /** Supported HTTP methods. */
    public enum Method {
        GET, POST, PUT, DELETE, PATCH, HEAD;

        /**
         * @param name method name in any case; blank means {@code GET}
         * @throws IllegalArgumentException for an unsupported method name
         */
        public static Method parse(String name) {
            if (name == null || name.isBlank()) return GET;
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported HTTP method: " + name, e);
            }
        }
    }

    private final Method method;
    private final String url;
    private final Map<String, String> headers;
    private final Map<String, String> queryParams;
    private final String body;
    private final String contentType;
    private final int timeoutMs;

    private ApiRequest(Builder b) {
        this.method      = Objects.requireNonNull(b.method, "method must not be null");
        this.url         = Objects.requireNonNull(b.url, "url must not be null");
        this.headers     = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(b.queryParams));
        this.body        = b.body;
        this.contentType = b.contentType;
        this.timeoutMs   = b.timeoutMs;
    }

    /**
     * Starts a builder for a method given by name, as written in API test definitions.
     *
     * @param method HTTP method name; blank means {@code GET}
     * @param url    absolute request URL
     * @throws IllegalArgumentException for an unsupported method name
     */
    public static Builder of(String method, String url) {
        return new Builder(Method.parse(method), url);
    }

    /** Creates a GET request builder for {@code url}. */
    public static Builder get(String url) {
        return new Builder(Method.GET, url);
    }

    /** Creates a POST request builder with a request body. */
    public static Builder post(String url, String body) {
        return new Builder(Method.POST, url).body(body);
    }

    public Method getMethod()                   { return method; }
    public String getUrl()                      { return url; }
    public Map<String, String> getHeaders()     { return headers; }
    public Map<String, String> getQueryParams() { return queryParams; }
    public String getBody()                     { return body; }
    public String getContentType()              { return contentType; }
    public int getTimeoutMs()                   { return timeoutMs; }

    /** Fluent builder; obtain one through {@link #of}, {@link #get} or {@link #post}. */
    public static final class Builder {

        private final Method method;
        private final String url;
        private final Map<String, String> headers     = new LinkedHashMap<>();
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private String body;
        private String contentType;
        private int timeoutMs = 30_000;

        private Builder(Method method, String url) {
            this.method = method;
            this.url    = url;
        }

        /** Adds (or replaces) a request header. */
        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        /** Adds every header in {@code values}; {@code null} is ignored. */
        public Builder headers(Map<String, String> values) {
            if (values != null) headers.putAll(values);
            return this;
        }

        /** Adds a URL query parameter. */
        public Builder param(String name, String value) {
            queryParams.put(name, value);
            return this;
        }

        /** Adds every query parameter in {@code values}; {@code null} is ignored. */
        public Builder params(Map<String, String> values) {
            if (values != null) queryParams.putAll(values);
            return this;
        }

        /** Sets the raw request body. */
        public Builder body(String body) {
            this.body = body;
            return this;
        }

        /** Sets the {@code Content-Type} header value. */
        public Builder contentType(String ct) {
            this.contentType = ct;
            return this;
        }

        /** Request timeout in milliseconds (default 30 000); non-positive values keep the default. */
        public Builder timeout(int ms) {
            if (ms > 0) this.timeoutMs = ms;
            return this;
        }

        /**
         * @return the immutable request
         * @throws NullPointerException if the URL is missing
         */
        public ApiRequest build() {
            return new ApiRequest(this);
        }
    }
}
