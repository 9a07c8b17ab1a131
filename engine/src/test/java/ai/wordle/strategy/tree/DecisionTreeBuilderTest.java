package ai.wordle.strategy.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wordle.WordleTestHelper;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Lexicon;
import ai.wordle.game.ProbabilityMode;
import ai.wordle.game.WordleRules;
import ai.wordle.strategy.entropy.EntropyScorer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DecisionTreeBuilderTest {

    private static final Lexicon LEXICON = WordleTestHelper.uniformLexicon(WordleTestHelper.allWords("abcde", 3));

    private static DecisionTreeBuilder builder(Path dir) {
        return new DecisionTreeBuilder(new TreeCheckpointStore(dir), 2, 2, 2, 1);
    }

    @Test
    void rootGuess_matchesASequentialScan(@TempDir Path dir) throws IOException {
        DecisionTree tree = new DecisionTreeBuilder(new TreeCheckpointStore(dir), 0, 2, 3, 10).build(LEXICON);

        List<String> words = LEXICON.vocabulary().words();
        double[] weights = new double[words.size()];
        Arrays.fill(weights, 1.0 / words.size());
        String expected = new EntropyScorer(3).best(words, words, weights, new HashSet<>(words)).guess();

        assertEquals(1, tree.size());
        assertEquals(expected, tree.guessAt(FeedbackPath.ROOT).orElseThrow());
    }

    @Test
    void everyExpandedChildHasMoreThanMinCandidates(@TempDir Path dir) throws IOException {
        DecisionTree tree = builder(dir).build(LEXICON);
        List<String> words = LEXICON.vocabulary().words();

        for (FeedbackPath path : tree.asMap().keySet()) {
            assertTrue(path.depth() <= 2, "too deep: " + path);
            List<String> candidates = words;
            FeedbackPath prefix = FeedbackPath.ROOT;
            for (FeedbackPattern pattern : path.patterns()) {
                String guess = tree.guessAt(prefix).orElseThrow(() -> new AssertionError("orphan node " + path));
                candidates = WordleRules.filterCandidates(candidates, guess, pattern);
                prefix = prefix.append(pattern);
            }
            assertTrue(path.isRoot() || candidates.size() > 2, path + " has " + candidates.size() + " candidates");
            assertTrue(candidates.contains(tree.guessAt(path).orElseThrow()), "guess is not a candidate at " + path);
        }
        assertTrue(tree.size() > 1);
    }

    @Test
    void interruptedBuild_resumesToTheSameTree(@TempDir Path reference, @TempDir Path interrupted) throws IOException {
        DecisionTree expected = builder(reference).build(LEXICON);

        TreeCheckpointStore store = new TreeCheckpointStore(interrupted);
        DecisionTreeBuilder failing = builder(interrupted).withListener(new DecisionTreeBuilder.BuildListener() {
            @Override
            public void onNodeComputed(FeedbackPath path, String guess, int candidates) {
                throw new IllegalStateException("stop");
            }
        });
        assertThrows(IllegalStateException.class, () -> failing.build(LEXICON));
        Map<FeedbackPath, String> checkpoint = store.loadCheckpoint(3, ProbabilityMode.UNIFORM);
        assertEquals(2, checkpoint.size());
        assertFalse(Files.exists(store.treePath(3, ProbabilityMode.UNIFORM)));

        AtomicInteger computed = new AtomicInteger();
        DecisionTree resumed = builder(interrupted).withListener(new DecisionTreeBuilder.BuildListener() {
            @Override
            public void onNodeComputed(FeedbackPath path, String guess, int candidates) {
                assertFalse(checkpoint.containsKey(path), "recomputed " + path);
                computed.incrementAndGet();
            }
        }).build(LEXICON);

        assertEquals(expected.asMap(), resumed.asMap());
        assertEquals(expected.size() - 2, computed.get());
        assertFalse(Files.exists(store.checkpointPath(3, ProbabilityMode.UNIFORM)));
        assertTrue(Files.exists(store.treePath(3, ProbabilityMode.UNIFORM)));
    }

    @Test
    void finishedTree_isNotRebuilt(@TempDir Path dir) throws IOException {
        DecisionTree first = builder(dir).build(LEXICON);
        AtomicInteger calls = new AtomicInteger();
        DecisionTree second = builder(dir).withListener(new DecisionTreeBuilder.BuildListener() {
            @Override
            public void onDepthComplete(int depth, int nodes) {
                calls.incrementAndGet();
            }
        }).build(LEXICON);
        assertEquals(first.asMap(), second.asMap());
        assertEquals(0, calls.get());
    }

    @Test
    void partition_groupsCandidatesByFeedback() {
        Map<FeedbackPattern, List<String>> children =
                DecisionTreeBuilder.partition(WordleTestHelper.FOUR_WORDS, "aabb");
        assertEquals(4, children.size());
        assertEquals(List.of("abcd"), children.get(FeedbackPattern.parse("2010")));
    }

    @Test
    void invalidSettings_areRejected(@TempDir Path dir) {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        assertThrows(IllegalArgumentException.class, () -> new DecisionTreeBuilder(store, -1, 15, 1, 10));
        assertThrows(IllegalArgumentException.class, () -> new DecisionTreeBuilder(store, 4, 15, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new DecisionTreeBuilder(store, 4, 15, 1, 0));
    }
}
