package qarunner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** An HTTP request plus the checks its response must satisfy. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiTestDefinition {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("method")
    private String method = "GET";

    @JsonProperty("url")
    private String url;

    @JsonProperty("headers")
    private Map<String, String> headers = new LinkedHashMap<>();

    @JsonProperty("queryParams")
    private Map<String, String> queryParams = new LinkedHashMap<>();

    @JsonProperty("body")
    private String body;

    @JsonProperty("contentType")
    private String contentType;

    @JsonProperty("timeoutMs")
    private int timeoutMs = 30_000;

    @JsonProperty("assertions")
    private List<ApiCheck> assertions = new ArrayList<>();

    public ApiTestDefinition() {}

    public ApiTestDefinition(String id, String name, String method, String url) {
        this.id     = id;
        this.name   = name;
        this.method = method;
        this.url    = url;
    }

    public ApiTestDefinition copy() {
        ApiTestDefinition c = new ApiTestDefinition(id, name, method, url);
        c.headers     = headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
        c.queryParams = queryParams == null ? new LinkedHashMap<>() : new LinkedHashMap<>(queryParams);
        c.body        = body;
        c.contentType = contentType;
        c.timeoutMs   = timeoutMs;
        c.assertions  = assertions == null ? new ArrayList<>() : new ArrayList<>(assertions);
        return c;
    }

    public String getId()                       { return id; }
    public String getName()                     { return name; }
    public String getMethod()                   { return method; }
    public String getUrl()                      { return url; }
    public Map<String, String> getHeaders()     { return headers; }
    public Map<String, String> getQueryParams() { return queryParams; }
    public String getBody()                     { return body; }
    public String getContentType()              { return contentType; }
    public int getTimeoutMs()                   { return timeoutMs; }
    public List<ApiCheck> getAssertions()       { return assertions; }

    public void setId(String id)                                { this.id = id; }
    public void setName(String name)                            { this.name = name; }
    public void setMethod(String method)                        { this.method = method; }
    public void setUrl(String url)                              { this.url = url; }
    public void setHeaders(Map<String, String> headers)         { this.headers = headers; }
    public void setQueryParams(Map<String, String> queryParams) { this.queryParams = queryParams; }
    public void setBody(String body)                            { this.body = body; }
    public void setContentType(String contentType)              { this.contentType = contentType; }
    public void setTimeoutMs(int timeoutMs)                     { this.timeoutMs = timeoutMs; }
    public void setAssertions(List<ApiCheck> assertions)        { this.assertions = assertions; }
}
