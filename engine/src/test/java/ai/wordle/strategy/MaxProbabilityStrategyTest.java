package ai.wordle.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wordle.WordleTestHelper;
import ai.wordle.game.GameConfig;
import ai.wordle.game.GameSession;
import ai.wordle.game.ProbabilityDistribution;
import ai.wordle.game.ProbabilityMode;
import ai.wordle.game.Vocabulary;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class MaxProbabilityStrategyTest {

    @Test
    void uniformGame_guessesAlphabeticallyAndSolvesInTwo() {
        GameConfig config = WordleTestHelper.uniformConfig(WordleTestHelper.FOUR_WORDS, 6);
        GameSession session = new GameSession(config, new Random(0L));
        session.reset("abcd");

        MaxProbabilityStrategy strategy = new MaxProbabilityStrategy();
        strategy.beginGame(config);

        String first = strategy.guess(session.history());
        assertEquals("aabb", first);
        assertEquals("2010", session.guess(first).toString());

        String second = strategy.guess(session.history());
        assertEquals("abcd", second);
        assertTrue(session.guess(second).isAllGreen());
        assertEquals(2, session.guessCount());
    }

    @Test
    void frequencyGame_startsWithTheMostProbableWord() {
        Vocabulary vocabulary = Vocabulary.of(4, WordleTestHelper.FOUR_WORDS);
        ProbabilityDistribution frequency = ProbabilityDistribution.frequency(vocabulary,
                Map.of("aabb", 1L, "abab", 2L, "abcd", 3L, "dcba", 5000L));
        GameConfig config = new GameConfig(4, vocabulary, ProbabilityMode.FREQUENCY, frequency, 6, true);

        MaxProbabilityStrategy strategy = new MaxProbabilityStrategy();
        strategy.beginGame(config);
        assertEquals("dcba", strategy.guess(List.of()));
    }
}
