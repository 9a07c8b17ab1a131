package ai.wordle.tournament;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@link TournamentReport}s as pretty-printed JSON.
 * <p>
 * Layout under the output directory:
 * <pre>
 * runs/&lt;tournamentId&gt;/tournament_results.json
 * latest.json                       (copy of the most recent run)
 * </pre>
 */
public class TournamentReportWriter {

    private static final Logger log = LoggerFactory.getLogger(TournamentReportWriter.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String RESULTS_FILE = "tournament_results.json";
    public static final String LATEST_FILE = "latest.json";

    private final Path outputDir;

    public TournamentReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Writes the report and refreshes {@code latest.json}.
     *
     * @return path of the run's results file
     */
    public Path write(TournamentReport report) throws IOException {
        Path runDir = outputDir.resolve("runs").resolve(report.tournamentId());
        Files.createDirectories(runDir);
        Path results = runDir.resolve(RESULTS_FILE);
        OBJECT_MAPPER.writeValue(results.toFile(), report);
        Files.copy(results, outputDir.resolve(LATEST_FILE), StandardCopyOption.REPLACE_EXISTING);
        log.info("Tournament results written to {}", results);
        return results;
    }

    /**
     * Reads a report back, for tools and tests.
     */
    public static TournamentReport read(Path file) throws IOException {
        return OBJECT_MAPPER.readValue(file.toFile(), TournamentReport.class);
    }
}
