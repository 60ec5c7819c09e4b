package qarunner.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.ApiCheck;
import qarunner.model.ApiTestDefinition;
import qarunner.model.TestResult;
import qarunner.model.TestStatus;
import qarunner.model.TestType;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one API test: sends the request and evaluates every check.
 *
 * <ul>
 *   <li>All checks are evaluated; any failure makes the test {@code FAILED}
 *       with every message joined.</li>
 *   <li>A test without checks requires a 2xx status.</li>
 *   <li>No response at all (transport error) or an unusable definition
 *       makes the test {@code ERROR}.</li>
 * </ul>
 */
public class ApiTestRunner {

    private static final Logger log = LoggerFactory.getLogger(ApiTestRunner.class);

    private final ApiClient client;

    public ApiTestRunner(ApiClient client) {
        this.client = client;
    }

    public TestResult run(ApiTestDefinition test) {
        TestResult result = new TestResult(test.getId(), TestType.API, test.getName());
        long start = System.currentTimeMillis();
        log.info("Running API test '{}': {} {}", test.getId(), test.getMethod(), test.getUrl());

        try {
            ApiRequest request = ApiRequest.of(test.getMethod(), test.getUrl())
                    .headers(test.getHeaders())
                    .params(test.getQueryParams())
                    .body(test.getBody())
                    .contentType(test.getContentType())
                    .timeout(test.getTimeoutMs())
                    .build();
            ApiResponse response = client.send(request);
            ApiAssertion assertion = client.assertThat(response);

            List<String> failures = new ArrayList<>();
            List<ApiCheck> checks = test.getAssertions() == null ? List.of() : test.getAssertions();
            if (checks.isEmpty()) {
                evaluate(failures, "2xx status", () -> assertion.statusCodeBetween(200, 299));
            } else {
                for (ApiCheck check : checks) {
                    evaluate(failures, check.toString(), () -> apply(assertion, check));
                }
            }

            if (failures.isEmpty()) {
                result.setStatus(TestStatus.PASSED);
            } else {
                result.setStatus(TestStatus.FAILED);
                result.setError(String.join("; ", failures));
            }
        } catch (ApiTransportException e) {
            log.warn("API test '{}' got no response: {}", test.getId(), e.getMessage());
            result.setStatus(TestStatus.ERROR);
            result.setError(e.getMessage());
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("API test '{}' has an unusable definition: {}", test.getId(), e.getMessage());
            result.setStatus(TestStatus.ERROR);
            result.setError("Invalid API test definition: " + e.getMessage());
        }

        result.setDurationMs(System.currentTimeMillis() - start);
        log.info("API test '{}' finished {} in {}ms", test.getId(), result.getStatus(), result.getDurationMs());
        return result;
    }

    private static void apply(ApiAssertion assertion, ApiCheck check) {
        String expected = check.getExpected();
        switch (check.getType()) {
            case STATUS_CODE -> assertion.statusCode(Integer.parseInt(expected.trim()));
            case STATUS_RANGE -> {
                String[] bounds = expected.split("-");
                if (bounds.length != 2) {
                    throw new IllegalArgumentException("status range must be 'lo-hi', got '" + expected + "'");
                }
                assertion.statusCodeBetween(Integer.parseInt(bounds[0].trim()), Integer.parseInt(bounds[1].trim()));
            }
            case BODY_CONTAINS -> assertion.bodyContains(expected);
            case JSON_PATH_EQUALS -> assertion.jsonPath(check.getPath(), expected);
            case HEADER_EQUALS -> assertion.header(check.getPath(), expected);
            case DURATION_BELOW -> assertion.durationBelow(Long.parseLong(expected.trim()));
        }
    }

    private static void evaluate(List<String> failures, String label, Runnable check) {
        try {
            check.run();
        } catch (AssertionError e) {
            failures.add(e.getMessage());
        } catch (IllegalArgumentException | NullPointerException e) {
            failures.add("Invalid check " + label + ": " + e.getMessage());
        }
    }
}
