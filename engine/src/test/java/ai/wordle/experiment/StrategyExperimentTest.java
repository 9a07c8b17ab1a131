package ai.wordle.experiment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wordle.WordleTestHelper;
import ai.wordle.experiment.ExperimentReport.GameTrace;
import ai.wordle.experiment.ExperimentReport.StepTrace;
import ai.wordle.strategy.MaxProbabilityStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StrategyExperimentTest {

    @Test
    void tracesEveryStepOfEveryGame() {
        StrategyExperiment experiment = new StrategyExperiment(
                WordleTestHelper.uniformLexicon(WordleTestHelper.FOUR_WORDS), 6, true);

        ExperimentReport report = experiment.run(new MaxProbabilityStrategy(), 10, 42L);

        assertEquals("MaxProb", report.strategy());
        assertEquals(4, report.summary().games());
        assertEquals(4, report.summary().solved());
        assertEquals(1.0, report.summary().solveRate(), 1e-12);
        for (GameTrace game : report.games()) {
            assertTrue(game.solved());
            assertEquals(game.numGuesses(), game.steps().size());
            StepTrace last = game.steps().get(game.steps().size() - 1);
            assertEquals(game.secret(), last.guess());
            assertEquals("2222", last.feedback());
            assertEquals(1, last.remaining());
            assertEquals(0.0, last.entropyBits());
        }
    }

    @Test
    void sameSeed_sameSecrets() {
        StrategyExperiment experiment = new StrategyExperiment(
                WordleTestHelper.uniformLexicon(WordleTestHelper.allWords("abc", 3)), 6, true);
        ExperimentReport a = experiment.run(new MaxProbabilityStrategy(), 5, 9L);
        ExperimentReport b = experiment.run(new MaxProbabilityStrategy(), 5, 9L);
        assertEquals(a.games(), b.games());
        assertEquals(5, a.games().size());
    }

    @Test
    void bits_isLog2OfTheRemainingCount() {
        assertEquals(0.0, StrategyExperiment.bits(0));
        assertEquals(0.0, StrategyExperiment.bits(1));
        assertEquals(2.0, StrategyExperiment.bits(4), 1e-12);
    }

    @Test
    void report_isWrittenAsJson(@TempDir Path dir) throws IOException {
        ExperimentReport report = new StrategyExperiment(
                WordleTestHelper.uniformLexicon(WordleTestHelper.FOUR_WORDS), 6, true)
                .run(new MaxProbabilityStrategy(), 2, 1L);
        Path file = dir.resolve("nested").resolve("experiment.json");

        StrategyExperiment.write(report, file);

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals("MaxProb", json.get("strategy").asText());
        assertEquals(2, json.get("summary").get("games").asInt());
        assertTrue(json.get("games").get(0).get("steps").get(0).has("entropy_bits"));
        assertEquals(4, json.get("config").get("word_length").asInt());
    }
}
