package ai.wordle.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Everything one round produced.
 *
 * @param seed       seed the round's secrets and shock were drawn with
 * @param strategies stats of every strategy that finished the round
 * @param failed     strategies whose worker crashed this round, with the reason
 */
public record RoundResult(
        @JsonProperty("round_id") String roundId,
        @JsonProperty("word_length") int wordLength,
        @JsonProperty("mode") String mode,
        @JsonProperty("repetition") int repetition,
        @JsonProperty("seed") long seed,
        @JsonProperty("num_games") int numGames,
        @JsonProperty("secrets") List<String> secrets,
        @JsonProperty("strategies") List<StrategyRoundStats> strategies,
        @JsonProperty("failed") Map<String, String> failed) {
}
