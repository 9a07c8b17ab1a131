package ai.wordle.tournament;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StrategyRoundStatsTest {

    @Test
    void aggregatesSolvedFailedAndTimedOutGames() {
        List<GameOutcome> outcomes = List.of(
                new GameOutcome("Entropy", "casa", 3, true, false),
                new GameOutcome("Entropy", "mesa", 4, true, false),
                new GameOutcome("Entropy", "rosa", 3, true, false),
                GameOutcome.timeout("Entropy", "cosa", 6));

        StrategyRoundStats stats = StrategyRoundStats.of("Entropy", outcomes);

        assertEquals(4, stats.gamesPlayed());
        assertEquals(3, stats.gamesSolved());
        assertEquals(0.75, stats.solveRate(), 1e-12);
        assertEquals(17.0 / 4, stats.meanGuesses(), 1e-12);
        assertEquals(3.5, stats.medianGuesses(), 1e-12);
        assertEquals(7, stats.maxGuesses());
        assertEquals(1, stats.timedOut());
        assertEquals(List.of("3", "4", "failed"), List.copyOf(stats.guessDistribution().keySet()));
        assertEquals(Map.of("3", 2, "4", 1, "failed", 1), stats.guessDistribution());
    }

    @Test
    void median_ofOddCount_isTheMiddleValue() {
        assertEquals(4.0, StrategyRoundStats.median(List.of(2, 4, 7)));
    }

    @Test
    void noGames_isAnError() {
        assertThrows(IllegalArgumentException.class, () -> StrategyRoundStats.of("Entropy", List.of()));
    }
}
