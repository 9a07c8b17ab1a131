package ai.wordle.experiment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.wordle.WordleTestHelper;
import ai.wordle.config.ExperimentProperties;
import ai.wordle.game.LexiconLoader;
import ai.wordle.strategy.StrategyRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExperimentRunnerTest {

    private static ExperimentProperties properties(Path dir, String strategy) {
        ExperimentProperties properties = new ExperimentProperties();
        properties.setStrategy(strategy);
        properties.setWordLength(4);
        properties.setMode("uniform");
        properties.setNumGames(3);
        properties.setOutput(dir.resolve("out").resolve("experiment.json").toString());
        return properties;
    }

    @Test
    void writesTheTraceOfTheConfiguredStrategy(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("mini_spanish_4.txt"), WordleTestHelper.FOUR_WORDS, StandardCharsets.UTF_8);
        ExperimentProperties properties = properties(dir, "entropy");

        new ExperimentRunner(properties, StrategyRegistry.withBuiltIns(null), new LexiconLoader(dir)).run();

        JsonNode json = new ObjectMapper().readTree(Path.of(properties.getOutput()).toFile());
        assertEquals("Entropy", json.get("strategy").asText());
        assertEquals(3, json.get("games").size());
    }

    @Test
    void unknownStrategy_isRejected(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("mini_spanish_4.txt"), WordleTestHelper.FOUR_WORDS, StandardCharsets.UTF_8);
        ExperimentRunner runner = new ExperimentRunner(properties(dir, "Oracle"), StrategyRegistry.withBuiltIns(null),
                new LexiconLoader(dir));
        assertThrows(IllegalArgumentException.class, () -> runner.run());
    }
}
