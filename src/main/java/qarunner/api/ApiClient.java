package qarunner.api;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Synchronous HTTP client on OkHttp 4. One instance owns one connection pool,
 * shared by all API tests of a runner.
 */
public final class ApiClient {

    private static final Logger log = LoggerFactory.getLogger(ApiClient.class);

    private static final RequestBody EMPTY_BODY = RequestBody.create(new byte[0], null);

    private final OkHttpClient http;

    private ApiClient(OkHttpClient http) {
        this.http = Objects.requireNonNull(http, "OkHttpClient must not be null");
    }

    public static ApiClient create() {
        return new ApiClient(new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build());
    }

    /** Wraps a pre-configured client (interceptors, proxies, test doubles). */
    public static ApiClient wrap(OkHttpClient http) {
        return new ApiClient(http);
    }

    /**
     * Executes the request. The request's timeout is applied through
     * {@link OkHttpClient#newBuilder()}, which shares the pool and dispatcher.
     *
     * @throws ApiTransportException if no HTTP response was received
     */
    public ApiResponse send(ApiRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        int timeoutMs = request.getTimeoutMs();
        OkHttpClient callClient = http.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();

        Request okRequest = buildOkRequest(request);
        log.debug(">> {} {}", request.getMethod(), okRequest.url());

        long start = System.currentTimeMillis();
        try (Response okResponse = callClient.newCall(okRequest).execute()) {
            ResponseBody responseBody = okResponse.body();
            String body = responseBody != null ? responseBody.string() : "";
            long durationMs = System.currentTimeMillis() - start;

            Map<String, String> headers = new LinkedHashMap<>();
            for (String name : okResponse.headers().names()) {
                headers.put(name.toLowerCase(Locale.ROOT), okResponse.header(name));
            }
            log.debug("<< {} {} ({}ms)", okResponse.code(), okRequest.url(), durationMs);
            return new ApiResponse(okResponse.code(), body, headers, durationMs, request);
        } catch (IOException e) {
            throw new ApiTransportException(
                    request.getMethod() + " " + request.getUrl() + " failed: " + e.getMessage(), e);
        }
    }

    public ApiAssertion assertThat(ApiResponse response) {
        return new ApiAssertion(response);
    }

    private static Request buildOkRequest(ApiRequest request) {
        HttpUrl parsed = HttpUrl.parse(request.getUrl());
        if (parsed == null) {
            throw new IllegalArgumentException("Malformed URL: " + request.getUrl());
        }
        HttpUrl.Builder urlBuilder = parsed.newBuilder();
        request.getQueryParams().forEach(urlBuilder::addQueryParameter);

        Request.Builder builder = new Request.Builder().url(urlBuilder.build());
        request.getHeaders().forEach(builder::addHeader);

        String raw = request.getBody();
        MediaType mediaType = request.getContentType() != null ? MediaType.parse(request.getContentType()) : null;
        RequestBody body = raw == null || raw.isEmpty() ? EMPTY_BODY : RequestBody.create(raw, mediaType);

        switch (request.getMethod()) {
            case GET -> builder.get();
            case HEAD -> builder.head();
            case DELETE -> {
                if (raw != null && !raw.isEmpty()) builder.delete(body);
                else builder.delete();
            }
            case POST -> builder.post(body);
            case PUT -> builder.put(body);
            case PATCH -> builder.patch(body);
        }
        return builder.build();
    }
}
