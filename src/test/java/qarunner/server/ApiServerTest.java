package qarunner.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import qarunner.engine.QaRunnerEngine;
import qarunner.execution.PlanNotFoundException;
import qarunner.model.BrowserEngine;
import qarunner.model.ExecutionOverrides;
import qarunner.model.ExecutionRecord;
import qarunner.model.RecordedAction;
import qarunner.model.RunOrigin;
import qarunner.model.Schedule;
import qarunner.model.TestResult;
import qarunner.model.TestStatus;
import qarunner.model.TestStep;
import qarunner.model.TestType;
import qarunner.recorder.RecordingException;
import qarunner.scheduler.InvalidRecurrenceException;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Integration tests for {@link ApiServer}: a real server on a free port in
 * front of a mocked {@link QaRunnerEngine}, exercised with
 * {@code java.net.http.HttpClient}.
 */
public class ApiServerTest {

    private static final Instant NOW = Instant.parse("2024-05-15T12:00:00Z");

    @Mock QaRunnerEngine engine;

    private AutoCloseable mocks;
    private ApiServer server;
    private HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private String baseUrl;

    @BeforeClass
    public void startServer() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        int port = findFreePort();
        server = new ApiServer(engine, port);
        server.start();
        http    = HttpClient.newHttpClient();
        baseUrl = "http://localhost:" + port;
    }

    @AfterClass
    public void stopServer() throws Exception {
        if (server != null) {
            server.stop();
        }
        mocks.close();
    }

    @BeforeMethod
    public void resetEngine() {
        reset(engine);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static int findFreePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private HttpResponse<String> send(String method, String path, String jsonBody) throws Exception {
        HttpRequest.BodyPublisher body = jsonBody != null
                ? HttpRequest.BodyPublishers.ofString(jsonBody)
                : HttpRequest.BodyPublishers.noBody();
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .method(method, body)
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send("GET", path, null);
    }

    private HttpResponse<String> post(String path, String jsonBody) throws Exception {
        return send("POST", path, jsonBody);
    }

    private JsonNode json(HttpResponse<String> resp) throws IOException {
        return mapper.readTree(resp.body());
    }

    // ── /api/status ───────────────────────────────────────────────────────

    @Test
    public void status_reportsArmedSchedulesAndSessions() throws Exception {
        when(engine.armedScheduleIds()).thenReturn(Set.of("nightly"));
        when(engine.openSessions()).thenReturn(2);

        HttpResponse<String> resp = get("/api/status");

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.headers().firstValue("Content-Type")).hasValue("application/json");
        JsonNode body = json(resp);
        assertThat(body.get("state").asText()).isEqualTo("running");
        assertThat(body.get("armedSchedules").get(0).asText()).isEqualTo("nightly");
        assertThat(body.get("openSessions").asInt()).isEqualTo(2);
    }

    @Test
    public void status_wrongMethod() throws Exception {
        assertThat(post("/api/status", "{}").statusCode()).isEqualTo(405);
    }

    // ── /api/plans ────────────────────────────────────────────────────────

    @Test(description = "run request passes requester and overrides to the engine")
    public void runPlan_ok() throws Exception {
        ExecutionRecord record = ExecutionRecord.pending("exec-1", "checkout", RunOrigin.manual("carol"), "staging", NOW);
        when(engine.runPlan(eq("checkout"), eq("carol"), any())).thenReturn(record);

        HttpResponse<String> resp = post("/api/plans/checkout/run",
                "{\"requestedBy\":\"carol\",\"environment\":\"staging\",\"engine\":\"firefox\",\"headless\":false}");

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(json(resp).get("id").asText()).isEqualTo("exec-1");
        ArgumentCaptor<ExecutionOverrides> overrides = ArgumentCaptor.forClass(ExecutionOverrides.class);
        verify(engine).runPlan(eq("checkout"), eq("carol"), overrides.capture());
        assertThat(overrides.getValue()).isEqualTo(new ExecutionOverrides("staging", BrowserEngine.FIREFOX, false));
    }

    @Test(description = "empty body runs with defaults as 'api'")
    public void runPlan_emptyBody() throws Exception {
        when(engine.runPlan(anyString(), anyString(), any()))
                .thenReturn(ExecutionRecord.pending("exec-2", "checkout", RunOrigin.manual("api"), null, NOW));

        assertThat(post("/api/plans/checkout/run", "").statusCode()).isEqualTo(200);
        verify(engine).runPlan("checkout", "api", ExecutionOverrides.none());
    }

    @Test
    public void runPlan_unknownPlan() throws Exception {
        when(engine.runPlan(eq("ghost"), anyString(), any())).thenThrow(new PlanNotFoundException("ghost"));

        HttpResponse<String> resp = post("/api/plans/ghost/run", "{}");

        assertThat(resp.statusCode()).isEqualTo(404);
        assertThat(json(resp).get("error").asText()).contains("ghost");
    }

    @Test(description = "unknown engine name is a client error")
    public void runPlan_badEngine() throws Exception {
        HttpResponse<String> resp = post("/api/plans/checkout/run", "{\"engine\":\"netscape\"}");

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(json(resp).get("error").asText()).isEqualTo("Unknown browser engine: netscape");
        verify(engine, never()).runPlan(anyString(), anyString(), any());
    }

    @Test
    public void runPlan_badJson() throws Exception {
        assertThat(post("/api/plans/checkout/run", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/api/plans/checkout/run", "[1,2]").statusCode()).isEqualTo(400);
    }

    @Test
    public void plans_unknownPath() throws Exception {
        assertThat(post("/api/plans/checkout/stop", "{}").statusCode()).isEqualTo(404);
        assertThat(get("/api/plans/checkout/run").statusCode()).isEqualTo(405);
    }

    // ── /api/schedules ────────────────────────────────────────────────────

    @Test
    public void schedules_arm() throws Exception {
        Schedule nightly = new Schedule("nightly", "checkout", "daily", NOW);
        when(engine.findSchedule("nightly")).thenReturn(Optional.of(nightly));
        when(engine.armSchedule(nightly)).thenReturn(true);

        HttpResponse<String> resp = post("/api/schedules/nightly/arm", null);

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(json(resp).get("armed").asBoolean()).isTrue();
        assertThat(json(resp).get("scheduleId").asText()).isEqualTo("nightly");
    }

    @Test
    public void schedules_rearmInvalidFrequency() throws Exception {
        Schedule broken = new Schedule("broken", "checkout", "every blue moon", NOW);
        when(engine.findSchedule("broken")).thenReturn(Optional.of(broken));
        when(engine.rearmSchedule(broken)).thenThrow(new InvalidRecurrenceException("Unrecognized frequency: 'every blue moon'"));

        HttpResponse<String> resp = post("/api/schedules/broken/rearm", null);

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(json(resp).get("error").asText()).contains("every blue moon");
    }

    @Test
    public void schedules_armUnknownBrowser() throws Exception {
        Schedule webkit = new Schedule("webkit", "checkout", "daily", NOW);
        when(engine.findSchedule("webkit")).thenReturn(Optional.of(webkit));
        when(engine.armSchedule(webkit)).thenThrow(new IllegalArgumentException("Unknown browser engine: webkit"));

        HttpResponse<String> resp = post("/api/schedules/webkit/arm", null);

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(json(resp).get("error").asText()).contains("Unknown browser engine");
    }

    @Test
    public void schedules_disarm() throws Exception {
        HttpResponse<String> resp = post("/api/schedules/nightly/disarm", null);

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(json(resp).get("armed").asBoolean()).isFalse();
        verify(engine).disarmSchedule("nightly");
    }

    @Test
    public void schedules_notFound() throws Exception {
        when(engine.findSchedule("ghost")).thenReturn(Optional.empty());

        assertThat(post("/api/schedules/ghost/arm", null).statusCode()).isEqualTo(404);
        assertThat(post("/api/schedules/nightly/pause", null).statusCode()).isEqualTo(404);
        assertThat(post("/api/schedules/nightly", null).statusCode()).isEqualTo(404);
    }

    // ── /api/recordings ───────────────────────────────────────────────────

    @Test
    public void recordings_start() throws Exception {
        when(engine.startRecording("https://app.test/", "alice")).thenReturn("rec-1");

        HttpResponse<String> resp = post("/api/recordings", "{\"url\":\"https://app.test/\",\"userId\":\"alice\"}");

        assertThat(resp.statusCode()).isEqualTo(201);
        assertThat(json(resp).get("sessionId").asText()).isEqualTo("rec-1");
    }

    @Test
    public void recordings_startWithoutUrl() throws Exception {
        assertThat(post("/api/recordings", "{\"userId\":\"alice\"}").statusCode()).isEqualTo(400);
        verifyNoInteractions(engine);
    }

    @Test
    public void recordings_startFails() throws Exception {
        when(engine.startRecording(anyString(), any()))
                .thenThrow(new RecordingException("Could not open a browser for recording: no display", null));

        HttpResponse<String> resp = post("/api/recordings", "{\"url\":\"https://app.test/\"}");

        assertThat(resp.statusCode()).isEqualTo(500);
        assertThat(json(resp).get("error").asText()).contains("no display");
    }

    @Test
    public void recordings_pollAndStop() throws Exception {
        List<RecordedAction> actions = List.of(
                RecordedAction.navigate("https://app.test/", NOW),
                RecordedAction.stop(NOW.plusSeconds(30)));
        when(engine.pollRecording("rec-1", "alice")).thenReturn(Optional.of(actions.subList(0, 1)));
        when(engine.stopRecording("rec-1", "alice")).thenReturn(Optional.of(actions));

        HttpResponse<String> polled = get("/api/recordings/rec-1?userId=alice");
        HttpResponse<String> stopped = send("DELETE", "/api/recordings/rec-1?userId=alice", null);

        assertThat(polled.statusCode()).isEqualTo(200);
        assertThat(json(polled)).hasSize(1);
        assertThat(stopped.statusCode()).isEqualTo(200);
        assertThat(json(stopped).get(1).get("type").asText()).isEqualTo("stop");
    }

    @Test
    public void recordings_unknownOrNotOwned() throws Exception {
        when(engine.stopRecording(anyString(), any())).thenReturn(Optional.empty());

        assertThat(send("DELETE", "/api/recordings/rec-1?userId=bob", null).statusCode()).isEqualTo(404);
    }

    @Test
    public void recordings_wrongMethod() throws Exception {
        assertThat(send("PUT", "/api/recordings/rec-1", "{}").statusCode()).isEqualTo(405);
        assertThat(get("/api/recordings").statusCode()).isEqualTo(405);
    }

    // ── /api/adhoc ────────────────────────────────────────────────────────

    @Test
    public void adhoc_runsSequence() throws Exception {
        TestResult result = new TestResult("adhoc-1", TestType.UI, "Ad-hoc sequence");
        result.setStatus(TestStatus.PASSED);
        when(engine.runAdhocSequence(any(), anyList(), anyList(), any())).thenReturn(result);

        HttpResponse<String> resp = post("/api/adhoc",
                "{\"url\":\"https://app.test/\",\"steps\":[{\"action\":\"click\",\"target\":\"#go\"}]}");

        assertThat(resp.statusCode()).isEqualTo(200);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<TestStep>> steps = ArgumentCaptor.forClass(List.class);
        verify(engine).runAdhocSequence(eq("https://app.test/"), steps.capture(), eq(List.of()), any());
        assertThat(steps.getValue()).singleElement()
                .satisfies(s -> assertThat(s.getTarget()).isEqualTo("#go"));
    }

    @Test
    public void adhoc_nothingToRun() throws Exception {
        HttpResponse<String> resp = post("/api/adhoc", "{}");

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(json(resp).get("error").asText()).isEqualTo("Provide a url, steps, or both");
    }

    @Test
    public void adhoc_badSteps() throws Exception {
        assertThat(post("/api/adhoc", "{\"steps\":\"click\"}").statusCode()).isEqualTo(400);
    }
}
