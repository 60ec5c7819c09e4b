package qarunner.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.ApiTestDefinition;
import qarunner.model.Json;
import qarunner.model.Schedule;
import qarunner.model.TestPlan;
import qarunner.model.UiTestDefinition;
import qarunner.player.QaRunnerException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Loads plans, tests and schedules from one JSON document.
 *
 * <p>The document is validated against {@code definitions-schema.json} before
 * it is deserialized; a document that does not conform is rejected as a whole.
 */
public final class DefinitionsFile {

    private static final Logger log = LoggerFactory.getLogger(DefinitionsFile.class);
    private static final String SCHEMA_RESOURCE = "/definitions-schema.json";

    private static volatile JsonSchema schema;

    private DefinitionsFile() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads and validates a definitions file.
     *
     * @throws IOException               if the file cannot be read or is not JSON
     * @throws InvalidDefinitionsException if the document violates the schema
     */
    public static Contents read(Path path) throws IOException {
        log.debug("Reading definitions from {}", path);
        return parse(Files.readString(path), path.toString());
    }

    /** Parses and validates a definitions document held in memory. */
    public static Contents parse(String json, String source) throws IOException {
        JsonNode tree = Json.mapper().readTree(json);
        validate(tree, source);
        Contents contents = Json.mapper().treeToValue(tree, Contents.class);
        log.info("Loaded {} plan(s), {} UI test(s), {} API test(s), {} schedule(s) from {}",
                contents.plans.size(), contents.uiTests.size(), contents.apiTests.size(),
                contents.schedules.size(), source);
        return contents;
    }

    /** Copies everything in {@code contents} into the given stores. */
    public static void loadInto(Contents contents, InMemoryDefinitionStore definitions,
                                InMemoryScheduleStore schedules) {
        contents.plans.forEach(definitions::savePlan);
        contents.uiTests.forEach(definitions::saveUiTest);
        contents.apiTests.forEach(definitions::saveApiTest);
        contents.schedules.forEach(schedules::save);
    }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validate(JsonNode tree, String source) {
        Set<ValidationMessage> errors = schema().validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Definitions in ").append(source).append(" are invalid:");
            errors.forEach(e -> sb.append("\n  ").append(e.getMessage()));
            throw new InvalidDefinitionsException(sb.toString());
        }
    }

    private static JsonSchema schema() {
        if (schema == null) {
            synchronized (DefinitionsFile.class) {
                if (schema == null) {
                    try (InputStream is = DefinitionsFile.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
                        }
                        schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(is);
                    } catch (IOException e) {
                        throw new IllegalStateException("Failed to load " + SCHEMA_RESOURCE, e);
                    }
                }
            }
        }
        return schema;
    }

    // ── Nested types ──────────────────────────────────────────────────────

    /** Deserialized document. Missing sections are empty lists. */
    public static class Contents {

        @JsonProperty("plans")
        public List<TestPlan> plans = new ArrayList<>();

        @JsonProperty("uiTests")
        public List<UiTestDefinition> uiTests = new ArrayList<>();

        @JsonProperty("apiTests")
        public List<ApiTestDefinition> apiTests = new ArrayList<>();

        @JsonProperty("schedules")
        public List<Schedule> schedules = new ArrayList<>();
    }

    public static class InvalidDefinitionsException extends QaRunnerException {
        public InvalidDefinitionsException(String msg) {
            super(msg);
        }
    }
}
