package ai.wordle.strategy.entropy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wordle.WordleTestHelper;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.GameConfig;
import ai.wordle.game.GameSession;
import ai.wordle.game.ProbabilityMode;
import ai.wordle.game.Turn;
import ai.wordle.game.WordleRules;
import ai.wordle.strategy.tree.DecisionTree;
import ai.wordle.strategy.tree.FeedbackPath;
import ai.wordle.strategy.tree.TreeCheckpointStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntropyStrategyTest {

    private static List<String> play(EntropyStrategy strategy, GameConfig config, String secret) {
        GameSession session = new GameSession(config, new Random(0L));
        session.reset(secret);
        strategy.beginGame(config);
        List<String> guesses = new ArrayList<>();
        while (!session.isOver()) {
            String guess = strategy.guess(session.history());
            guesses.add(guess);
            session.guess(guess);
        }
        assertTrue(session.isSolved(), "did not solve " + secret + ": " + guesses);
        return guesses;
    }

    @Test
    void solvesEverySecretOfASmallVocabulary() {
        List<String> words = WordleTestHelper.allWords("abcd", 3);
        GameConfig config = WordleTestHelper.uniformConfig(words, 8);
        EntropyStrategy strategy = new EntropyStrategy();
        for (String secret : words) {
            play(strategy, config, secret);
        }
    }

    @Test
    void sameSecret_sameGuesses() {
        List<String> words = WordleTestHelper.allWords("abcde", 3);
        GameConfig config = WordleTestHelper.uniformConfig(words, 8);
        EntropyStrategy reused = new EntropyStrategy();
        List<String> first = play(reused, config, "ecb");
        assertEquals(first, play(reused, config, "ecb"));
        assertEquals(first, play(new EntropyStrategy(), config, "ecb"));
    }

    @Test
    void openingGuess_isTheHighestEntropyCandidate() {
        GameConfig config = WordleTestHelper.uniformConfig(WordleTestHelper.FOUR_WORDS, 6);
        EntropyStrategy strategy = new EntropyStrategy();
        strategy.beginGame(config);
        // Every word separates all four secrets; the tie goes to the first in order.
        assertEquals("aabb", strategy.guess(List.of()));
    }

    @Test
    void largeVocabulary_samplesAConsistentGuessReproducibly() {
        List<String> words = WordleTestHelper.allWords("abcdefg", 4);
        assertTrue(words.size() > EntropyStrategy.EVALUATION_LIMIT);
        GameConfig config = WordleTestHelper.uniformConfig(words, 6);
        EntropyStrategy strategy = new EntropyStrategy();

        strategy.beginGame(config);
        String opening = strategy.guess(List.of());
        assertTrue(words.contains(opening), opening);

        List<Turn> history = List.of(new Turn(opening, WordleRules.feedback("gfed", opening)));
        String second = strategy.guess(history);
        assertTrue(WordleRules.filterByHistory(words, history).contains(second), second);

        // beginGame reseeds the sampler, so the same position gives the same guess.
        strategy.beginGame(config);
        assertEquals(opening, strategy.guess(List.of()));
        assertEquals(second, strategy.guess(history));

        EntropyStrategy fresh = new EntropyStrategy();
        fresh.beginGame(config);
        assertEquals(opening, fresh.guess(List.of()));
    }

    @Test
    void precomputedTree_overridesLiveSearch() {
        DecisionTree tree = new DecisionTree(4, ProbabilityMode.UNIFORM, Map.of(FeedbackPath.ROOT, "dcba"));
        EntropyStrategy strategy = new EntropyStrategy(List.of(tree));
        strategy.beginGame(WordleTestHelper.uniformConfig(WordleTestHelper.FOUR_WORDS, 6));
        assertEquals("dcba", strategy.guess(List.of()));

        // A path the tree does not cover falls back to live search.
        List<Turn> history = List.of(new Turn("aabb", FeedbackPattern.parse("2010")));
        assertEquals("abcd", strategy.guess(history));
    }

    @Test
    void treeForAnotherMode_isIgnored() {
        DecisionTree tree = new DecisionTree(4, ProbabilityMode.FREQUENCY, Map.of(FeedbackPath.ROOT, "dcba"));
        EntropyStrategy strategy = new EntropyStrategy(List.of(tree));
        strategy.beginGame(WordleTestHelper.uniformConfig(WordleTestHelper.FOUR_WORDS, 6));
        assertEquals("aabb", strategy.guess(List.of()));
    }

    @Test
    void twoCandidatesLeft_guessesTheFirst() {
        EntropyStrategy strategy = new EntropyStrategy();
        strategy.beginGame(WordleTestHelper.uniformConfig(List.of("mesa", "rosa"), 6));
        assertEquals("mesa", strategy.guess(List.of()));
    }

    @Test
    void inconsistentHistory_fallsBackToTheFirstWord() {
        EntropyStrategy strategy = new EntropyStrategy();
        strategy.beginGame(WordleTestHelper.uniformConfig(WordleTestHelper.FOUR_WORDS, 6));
        List<Turn> history = List.of(new Turn("aabb", FeedbackPattern.parse("0000")));
        assertEquals("aabb", strategy.guess(history));
    }

    @Test
    void treeDirectory_loadsValidTreesAndSkipsBrokenOnes(@TempDir Path dir) throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        store.saveTree(new DecisionTree(4, ProbabilityMode.UNIFORM, Map.of(FeedbackPath.ROOT, "dcba")));
        Files.writeString(dir.resolve("tree_5_uniform.json"), "{not json", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("tree_notes.json"), "{}", StandardCharsets.UTF_8);

        EntropyStrategy strategy = new EntropyStrategy(dir);

        assertEquals(Set.of("4_uniform"), strategy.trees().keySet());
        strategy.beginGame(WordleTestHelper.uniformConfig(WordleTestHelper.FOUR_WORDS, 6));
        assertEquals("dcba", strategy.guess(List.of()));
    }

    @Test
    void weights_followTheDistribution() {
        GameConfig config = WordleTestHelper.uniformConfig(WordleTestHelper.FOUR_WORDS, 6);
        double[] weights = EntropyStrategy.weights(List.of("abab", "dcba"), config.probabilities());
        assertEquals(0.25, weights[0], 1e-12);
        assertEquals(0.25, weights[1], 1e-12);
    }
}
