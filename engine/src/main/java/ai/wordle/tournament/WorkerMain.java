package ai.wordle.tournament;

import ai.wordle.strategy.Strategy;
import ai.wordle.strategy.StrategyRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a forked worker JVM.
 * <p>
 * Protocol with {@link ForkedWorkerLauncher}:
 * <ul>
 *   <li>stdin: one {@link WorkerJob} JSON document;</li>
 *   <li>stdout: a {@code GAME_RESULT <json>} line per finished game, a {@code WORKER_ERROR <message>}
 *       line on failure; any other line is ordinary log output;</li>
 *   <li>exit code {@value #EXIT_OK} when all secrets were played, {@value #EXIT_RESTART} when a
 *       stuck game thread forced an early exit, {@value #EXIT_FAILED} when the strategy failed.</li>
 * </ul>
 */
public final class WorkerMain {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String RESULT_PREFIX = "GAME_RESULT ";
    public static final String ERROR_PREFIX = "WORKER_ERROR ";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_RESTART = 75;

    private WorkerMain() {
    }

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        int code;
        try {
            WorkerJob job = OBJECT_MAPPER.readValue(System.in, WorkerJob.class);
            code = run(job, out);
        } catch (Exception e) {
            log.error("Worker could not start", e);
            out.println(ERROR_PREFIX + oneLine(e.toString()));
            code = EXIT_FAILED;
        }
        out.flush();
        // Abandoned game threads are daemons, but halt() also skips shutdown hooks they could block.
        Runtime.getRuntime().halt(code);
    }

    static int run(WorkerJob job, PrintStream out) throws InterruptedException {
        StrategyRegistry registry = StrategyRegistry.withBuiltIns(
                job.getTreeDirectory() == null ? null : Path.of(job.getTreeDirectory()));
        registry.loadPlugins();
        Supplier<Strategy> factory;
        try {
            factory = registry.factory(job.getStrategy());
        } catch (IllegalArgumentException e) {
            out.println(ERROR_PREFIX + oneLine(e.getMessage()));
            return EXIT_FAILED;
        }

        StrategyWorker worker = new StrategyWorker(job.getStrategy(), factory, job.toGameConfig(),
                job.gameTimeoutMillis(), job.getRoundId());
        worker.setHaltOnStuckThread(true);
        try {
            worker.play(job.getSecrets(), outcome -> emit(out, outcome));
        } catch (WorkerFailedException e) {
            log.error("Strategy {} failed", job.getStrategy(), e.getCause());
            out.println(ERROR_PREFIX + oneLine(e.getMessage()));
            return EXIT_FAILED;
        }
        return worker.isHalted() ? EXIT_RESTART : EXIT_OK;
    }

    private static void emit(PrintStream out, GameOutcome outcome) {
        try {
            out.println(RESULT_PREFIX + OBJECT_MAPPER.writeValueAsString(outcome));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize outcome " + outcome, e);
        }
    }

    private static String oneLine(String message) {
        return message == null ? "unknown error" : message.replace('\n', ' ').replace('\r', ' ');
    }
}
