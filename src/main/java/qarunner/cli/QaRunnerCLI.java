package qarunner.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import qarunner.config.ConfigLoader;
import qarunner.engine.QaRunnerEngine;
import qarunner.execution.PlanNotFoundException;
import qarunner.model.BrowserEngine;
import qarunner.model.ExecutionOverrides;
import qarunner.model.ExecutionRecord;
import qarunner.model.ExecutionStatus;
import qarunner.model.Json;
import qarunner.server.ApiServer;
import qarunner.store.DefinitionsFile;
import qarunner.store.InMemoryDefinitionStore;
import qarunner.store.InMemoryScheduleStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code qarunner serve}    load definitions, arm schedules, serve the HTTP API</li>
 *   <li>{@code qarunner run-plan} run one plan now and print the execution record</li>
 *   <li>{@code qarunner version}  print build version</li>
 * </ul>
 */
@Command(
        name        = "qarunner",
        description = "Scheduled and on-demand UI/API test plan runner with self-healing selectors",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                QaRunnerCLI.ServeCommand.class,
                QaRunnerCLI.RunPlanCommand.class,
                QaRunnerCLI.VersionCommand.class
        }
)
public class QaRunnerCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new QaRunnerCLI()).execute(args);
        System.exit(exit);
    }

    /** Builds an engine over in-memory stores filled from a definitions file. */
    static QaRunnerEngine loadEngine(Path definitionsFile, Properties props) throws IOException {
        InMemoryDefinitionStore definitions = new InMemoryDefinitionStore();
        InMemoryScheduleStore schedules = new InMemoryScheduleStore();
        DefinitionsFile.loadInto(DefinitionsFile.read(definitionsFile), definitions, schedules);
        return QaRunnerEngine.builder()
                .definitions(definitions)
                .schedules(schedules)
                .properties(props)
                .build();
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Long-running mode: arms every active schedule and serves the HTTP API
     * until the process is terminated.
     */
    @Command(
            name        = "serve",
            description = "Arm all active schedules and start the HTTP API",
            mixinStandardHelpOptions = true
    )
    static class ServeCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

        @Option(names = {"-d", "--definitions"}, required = true,
                description = "Definitions JSON file (plans, tests, schedules)")
        Path definitions;

        @Option(names = {"-p", "--port"},
                description = "HTTP port (default: server.port from config.properties, else 8765)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            Properties props = ConfigLoader.load();
            int httpPort = port != null ? port : ConfigLoader.getInt(props, "server.port", 8765);

            QaRunnerEngine engine = loadEngine(definitions, props);
            int armed = engine.loadAllSchedules();
            ApiServer server = new ApiServer(engine, httpPort);
            server.start();
            log.info("Serving with {} armed schedule(s); press Ctrl+C to stop", armed);

            CountDownLatch shutdown = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                engine.close();
                shutdown.countDown();
            }, "qarunner-shutdown"));
            shutdown.await();
            return 0;
        }
    }

    /**
     * Runs a single plan on the calling thread. Exit code 0 only when the
     * execution passed.
     */
    @Command(
            name        = "run-plan",
            description = "Run a test plan once and print the execution record as JSON",
            mixinStandardHelpOptions = true
    )
    static class RunPlanCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(RunPlanCommand.class);

        @Parameters(index = "0", description = "Plan id")
        String planId;

        @Option(names = {"-d", "--definitions"}, required = true,
                description = "Definitions JSON file (plans, tests, schedules)")
        Path definitions;

        @Option(names = {"-e", "--environment"}, description = "Environment label recorded on the execution")
        String environment;

        @Option(names = {"-b", "--browser"}, description = "Browser engine: chromium, firefox, edge")
        String browser;

        @Option(names = "--headed", description = "Show the browser window")
        boolean headed;

        @Option(names = {"-u", "--user"}, description = "Requester recorded on the execution",
                defaultValue = "cli")
        String user;

        @Override
        public Integer call() throws Exception {
            ExecutionOverrides overrides = new ExecutionOverrides(environment,
                    browser != null ? BrowserEngine.fromId(browser) : null,
                    headed ? Boolean.FALSE : null);

            try (QaRunnerEngine engine = loadEngine(definitions, ConfigLoader.load())) {
                ExecutionRecord record = engine.runPlan(planId, user, overrides);
                System.out.println(Json.write(record));
                return record.getStatus() == ExecutionStatus.PASSED ? 0 : 1;
            } catch (PlanNotFoundException e) {
                log.error(e.getMessage());
                System.err.println("Error: " + e.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "version", description = "Print version information")
    static class VersionCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("QA Runner 1.0.0-SNAPSHOT");
            System.out.println("Selenium WebDriver 4.21.0 | Spring scheduling support 6.1.8");
            System.out.println("Modules: scheduler, execution, session, player, ai, api, recorder, store, server, cli");
            return 0;
        }
    }
}
