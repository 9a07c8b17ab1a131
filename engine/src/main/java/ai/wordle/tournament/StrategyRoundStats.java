package ai.wordle.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate of one strategy's games in one round.
 * <p>
 * {@code guessDistribution} counts solved games under their guess count ({@code "1"} ..
 * {@code "<maxGuesses>"}) and every unsolved or timed-out game under {@code "failed"}.
 * Keys appear in that order; buckets with no games are left out.
 */
public record StrategyRoundStats(
        @JsonProperty("name") String name,
        @JsonProperty("games_played") int gamesPlayed,
        @JsonProperty("games_solved") int gamesSolved,
        @JsonProperty("solve_rate") double solveRate,
        @JsonProperty("mean_guesses") double meanGuesses,
        @JsonProperty("median_guesses") double medianGuesses,
        @JsonProperty("max_guesses") int maxGuesses,
        @JsonProperty("timed_out") int timedOut,
        @JsonProperty("guess_distribution") Map<String, Integer> guessDistribution) {

    public static final String FAILED_BUCKET = "failed";

    /**
     * Aggregates the outcomes of one strategy.
     *
     * @throws IllegalArgumentException if there are no outcomes
     */
    public static StrategyRoundStats of(String name, List<GameOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            throw new IllegalArgumentException("No games to aggregate for " + name);
        }
        int n = outcomes.size();
        int solved = 0;
        int timeouts = 0;
        long sum = 0;
        List<Integer> guesses = new ArrayList<>(n);
        Map<Integer, Integer> solvedAt = new TreeMap<>();
        int failed = 0;
        for (GameOutcome outcome : outcomes) {
            guesses.add(outcome.numGuesses());
            sum += outcome.numGuesses();
            if (outcome.timedOut()) {
                timeouts++;
            }
            if (outcome.solved()) {
                solved++;
                solvedAt.merge(outcome.numGuesses(), 1, Integer::sum);
            } else {
                failed++;
            }
        }
        Collections.sort(guesses);

        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (Map.Entry<Integer, Integer> bucket : solvedAt.entrySet()) {
            distribution.put(String.valueOf(bucket.getKey()), bucket.getValue());
        }
        if (failed > 0) {
            distribution.put(FAILED_BUCKET, failed);
        }

        return new StrategyRoundStats(name, n, solved, (double) solved / n, (double) sum / n,
                median(guesses), guesses.get(n - 1), timeouts, distribution);
    }

    static double median(List<Integer> sorted) {
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
