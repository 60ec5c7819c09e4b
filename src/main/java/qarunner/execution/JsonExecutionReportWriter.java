package qarunner.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qarunner.model.ExecutionRecord;
import qarunner.model.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes each finished execution to {@code {reportDir}/execution-{id}.json}
 * for downstream report generation.
 */
public class JsonExecutionReportWriter implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(JsonExecutionReportWriter.class);

    private final Path reportDir;

    public JsonExecutionReportWriter(String reportDir) {
        this.reportDir = Paths.get(reportDir);
    }

    @Override
    public void onExecutionCompleted(ExecutionRecord record) {
        Path target = reportDir.resolve("execution-" + record.getId() + ".json");
        try {
            Files.createDirectories(reportDir);
            Json.mapper().writeValue(target.toFile(), record);
            log.info("Execution report written to {}", target);
        } catch (IOException e) {
            log.warn("Could not write execution report {}: {}", target, e.getMessage());
        }
    }

    public Path getReportDir() {
        return reportDir;
    }
}
