package qarunner.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.engine.QaRunnerEngine;
import qarunner.execution.PlanNotFoundException;
import qarunner.model.BrowserEngine;
import qarunner.model.ElementDefinition;
import qarunner.model.ExecutionOverrides;
import qarunner.model.ExecutionRecord;
import qarunner.model.Json;
import qarunner.model.RecordedAction;
import qarunner.model.Schedule;
import qarunner.model.TestResult;
import qarunner.model.TestStep;
import qarunner.recorder.RecordingException;
import qarunner.scheduler.InvalidRecurrenceException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Embedded HTTP adapter over {@link QaRunnerEngine}.
 *
 * <p>Listens on localhost:{port} (default 8765). Uses the JDK's built-in
 * {@code com.sun.net.httpserver.HttpServer}.
 *
 * <ul>
 *   <li>{@code GET    /api/status}</li>
 *   <li>{@code POST   /api/plans/{id}/run} body: {@code {"requestedBy","environment","engine","headless"}} (all optional)</li>
 *   <li>{@code POST   /api/schedules/{id}/arm|disarm|rearm}</li>
 *   <li>{@code POST   /api/recordings} body: {@code {"url","userId"}}</li>
 *   <li>{@code GET    /api/recordings/{id}?userId=}</li>
 *   <li>{@code DELETE /api/recordings/{id}?userId=}</li>
 *   <li>{@code POST   /api/adhoc} body: {@code {"url","steps","elements","engine","headless"}}</li>
 * </ul>
 *
 * Errors are returned as {@code {"error":"<message>"}}.
 */
@SuppressWarnings("restriction")
public class ApiServer {

    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private static final TypeReference<List<TestStep>> STEP_LIST = new TypeReference<>() {};
    private static final TypeReference<List<ElementDefinition>> ELEMENT_LIST = new TypeReference<>() {};

    private final QaRunnerEngine engine;
    private final int port;
    private final ObjectMapper mapper = Json.mapper();
    private HttpServer httpServer;
    private ExecutorService executor;

    public ApiServer(QaRunnerEngine engine, int port) {
        this.engine = engine;
        this.port   = port;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public void start() {
        try {
            httpServer = HttpServer.create(new InetSocketAddress("localhost", port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start API server on port " + port, e);
        }
        executor = Executors.newFixedThreadPool(4);
        httpServer.setExecutor(executor);

        httpServer.createContext("/api/status",      guarded(this::handleStatus));
        httpServer.createContext("/api/plans/",      guarded(this::handlePlans));
        httpServer.createContext("/api/schedules/",  guarded(this::handleSchedules));
        httpServer.createContext("/api/recordings",  guarded(this::handleRecordings));
        httpServer.createContext("/api/adhoc",       guarded(this::handleAdhoc));
        httpServer.start();
        log.info("API server listening on http://localhost:{}", port);
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(1);
            httpServer = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
        log.info("API server stopped");
    }

    // ── Handlers ─────────────────────────────────────────────────────────────

    /** GET /api/status */
    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!assertMethod(exchange, "GET")) return;
        ObjectNode body = mapper.createObjectNode();
        body.put("state", "running");
        body.putPOJO("armedSchedules", engine.armedScheduleIds());
        body.put("openSessions", engine.openSessions());
        sendJson(exchange, 200, body);
    }

    /** POST /api/plans/{id}/run */
    private void handlePlans(HttpExchange exchange) throws IOException {
        String[] parts = pathAfter(exchange, "/api/plans/");
        if (parts.length != 2 || !"run".equals(parts[1])) {
            sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath());
            return;
        }
        if (!assertMethod(exchange, "POST")) return;
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;

        String requestedBy = text(body, "requestedBy");
        try {
            ExecutionRecord record = engine.runPlan(parts[0],
                    requestedBy != null ? requestedBy : "api", overrides(body));
            sendJson(exchange, 200, record);
        } catch (PlanNotFoundException e) {
            sendError(exchange, 404, e.getMessage());
        }
    }

    /** POST /api/schedules/{id}/arm|disarm|rearm */
    private void handleSchedules(HttpExchange exchange) throws IOException {
        String[] parts = pathAfter(exchange, "/api/schedules/");
        if (parts.length != 2) {
            sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath());
            return;
        }
        if (!assertMethod(exchange, "POST")) return;
        String scheduleId = parts[0];
        String op = parts[1];

        boolean armed;
        if ("disarm".equals(op)) {
            engine.disarmSchedule(scheduleId);
            armed = false;
        } else if ("arm".equals(op) || "rearm".equals(op)) {
            Optional<Schedule> schedule = engine.findSchedule(scheduleId);
            if (schedule.isEmpty()) {
                sendError(exchange, 404, "Schedule not found: " + scheduleId);
                return;
            }
            try {
                armed = "arm".equals(op)
                        ? engine.armSchedule(schedule.get())
                        : engine.rearmSchedule(schedule.get());
            } catch (InvalidRecurrenceException | IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }
        } else {
            sendError(exchange, 404, "Unknown schedule operation: " + op);
            return;
        }

        ObjectNode resp = mapper.createObjectNode();
        resp.put("scheduleId", scheduleId);
        resp.put("armed", armed);
        sendJson(exchange, 200, resp);
    }

    /** POST /api/recordings, GET|DELETE /api/recordings/{id} */
    private void handleRecordings(HttpExchange exchange) throws IOException {
        String[] parts = pathAfter(exchange, "/api/recordings");
        if (parts.length == 0) {
            if (!assertMethod(exchange, "POST")) return;
            JsonNode body = readJsonBody(exchange);
            if (body == null) return;
            String url = text(body, "url");
            if (url == null || url.isBlank()) {
                sendError(exchange, 400, "Missing required field: url");
                return;
            }
            try {
                String sessionId = engine.startRecording(url, text(body, "userId"));
                ObjectNode resp = mapper.createObjectNode();
                resp.put("sessionId", sessionId);
                sendJson(exchange, 201, resp);
            } catch (RecordingException e) {
                sendError(exchange, 500, e.getMessage());
            }
            return;
        }
        if (parts.length != 1) {
            sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath());
            return;
        }

        String sessionId = parts[0];
        String userId = queryParams(exchange).get("userId");
        Optional<List<RecordedAction>> actions;
        switch (exchange.getRequestMethod().toUpperCase()) {
            case "GET" -> actions = engine.pollRecording(sessionId, userId);
            case "DELETE" -> actions = engine.stopRecording(sessionId, userId);
            default -> {
                sendError(exchange, 405, "Method Not Allowed: expected GET or DELETE");
                return;
            }
        }
        if (actions.isEmpty()) {
            sendError(exchange, 404, "Recording not found: " + sessionId);
            return;
        }
        sendJson(exchange, 200, actions.get());
    }

    /** POST /api/adhoc */
    private void handleAdhoc(HttpExchange exchange) throws IOException {
        if (!assertMethod(exchange, "POST")) return;
        JsonNode body = readJsonBody(exchange);
        if (body == null) return;

        List<TestStep> steps;
        List<ElementDefinition> elements;
        try {
            steps = body.has("steps") ? mapper.convertValue(body.get("steps"), STEP_LIST) : List.of();
            elements = body.has("elements") ? mapper.convertValue(body.get("elements"), ELEMENT_LIST) : List.of();
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, "Invalid steps or elements: " + e.getMessage());
            return;
        }
        String url = text(body, "url");
        if ((url == null || url.isBlank()) && steps.isEmpty()) {
            sendError(exchange, 400, "Provide a url, steps, or both");
            return;
        }

        TestResult result = engine.runAdhocSequence(url, steps, elements, overrides(body));
        sendJson(exchange, 200, result);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** Maps argument errors to 400 and anything else unexpected to 500. */
    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                sendError(exchange, 500, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } finally {
                exchange.close();
            }
        };
    }

    private ExecutionOverrides overrides(JsonNode body) {
        String engineId = text(body, "engine");
        JsonNode headless = body.get("headless");
        return new ExecutionOverrides(
                text(body, "environment"),
                engineId != null ? BrowserEngine.fromId(engineId) : null,
                headless != null && headless.isBoolean() ? headless.asBoolean() : null);
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /** Path segments after {@code prefix}, empty segments dropped. */
    private static String[] pathAfter(HttpExchange exchange, String prefix) {
        String rest = exchange.getRequestURI().getPath().substring(prefix.length());
        return Arrays.stream(rest.split("/")).filter(s -> !s.isEmpty()).toArray(String[]::new);
    }

    private static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null) return params;
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) continue;
            params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return params;
    }

    /**
     * Checks that the request uses the expected HTTP method.
     * Returns true if ok; sends 405 and returns false otherwise.
     */
    private boolean assertMethod(HttpExchange exchange, String expected) throws IOException {
        if (!expected.equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method Not Allowed: expected " + expected);
            return false;
        }
        return true;
    }

    /**
     * Reads the request body as a JSON object. An empty body is an empty object.
     * Returns null and sends 400 if the body is not a JSON object.
     */
    private JsonNode readJsonBody(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length == 0) return mapper.createObjectNode();
        try {
            JsonNode node = mapper.readTree(raw);
            if (node != null && node.isObject()) return node;
            sendError(exchange, 400, "Request body must be a JSON object");
        } catch (IOException e) {
            sendError(exchange, 400, "Invalid JSON body: " + e.getMessage());
        }
        return null;
    }

    private void sendJson(HttpExchange exchange, int status, Object obj) throws IOException {
        byte[] body = mapper.writeValueAsBytes(obj);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    /** Sends a JSON error response: {"error":"<message>"}. */
    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode err = mapper.createObjectNode();
        err.put("error", message);
        sendJson(exchange, status, err);
    }
}
