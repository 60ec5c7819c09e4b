package qarunner.execution;

import com.fasterxml.jackson.databind.JsonNode;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import qarunner.model.ExecutionRecord;
import qarunner.model.ExecutionStatus;
import qarunner.model.Json;
import qarunner.model.RunOrigin;
import qarunner.model.TestResult;
import qarunner.model.TestStatus;
import qarunner.model.TestType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

public class JsonExecutionReportWriterTest {

    private static final Instant NOW = Instant.parse("2024-05-15T12:00:00Z");

    private Path tempDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("qarunner-reports");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    private static ExecutionRecord finished() {
        ExecutionRecord r = ExecutionRecord.pending("exec-7", "checkout", RunOrigin.scheduled("nightly", "scheduler"),
                "staging", NOW);
        r.markRunning();
        TestResult health = new TestResult("health", TestType.API, "Health");
        health.setStatus(TestStatus.PASSED);
        r.appendResult(health);
        r.complete(ExecutionStatus.PASSED, NOW.plusSeconds(3), null);
        return r;
    }

    @Test(description = "terminal record is written as JSON named after its id")
    public void writesReport() throws IOException {
        Path dir = tempDir.resolve("nested/reports");
        JsonExecutionReportWriter writer = new JsonExecutionReportWriter(dir.toString());

        writer.onExecutionCompleted(finished());

        Path file = dir.resolve("execution-exec-7.json");
        assertThat(file).exists();
        JsonNode json = Json.mapper().readTree(file.toFile());
        assertThat(json.get("planId").asText()).isEqualTo("checkout");
        assertThat(json.get("scheduleId").asText()).isEqualTo("nightly");
        assertThat(json.get("startedAt").asText()).isEqualTo("2024-05-15T12:00:00Z");
        assertThat(json.get("results")).hasSize(1);
        assertThat(json.has("terminal")).isFalse();
    }

    @Test(description = "unwritable directory is logged, not thrown")
    public void unwritableTarget() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("not-a-dir"));
        JsonExecutionReportWriter writer = new JsonExecutionReportWriter(blocker.toString());

        writer.onExecutionCompleted(finished());

        assertThat(Files.isRegularFile(blocker)).isTrue();
    }
}
