package ai.wordle.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * One strategy's line in the final standings.
 *
 * @param roundPoints points earned per round id
 */
public record LeaderboardEntry(
        @JsonProperty("rank") int rank,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("total_points") double totalPoints,
        @JsonProperty("round_points") Map<String, Double> roundPoints,
        @JsonProperty("overall_solve_rate") double overallSolveRate,
        @JsonProperty("overall_mean_guesses") double overallMeanGuesses) {
}
