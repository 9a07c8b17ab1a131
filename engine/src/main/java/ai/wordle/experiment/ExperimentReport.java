package ai.wordle.experiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Per-game trace of a single-strategy experiment, as written to JSON.
 */
public record ExperimentReport(
        @JsonProperty("strategy") String strategy,
        @JsonProperty("config") Map<String, Object> config,
        @JsonProperty("summary") Summary summary,
        @JsonProperty("games") List<GameTrace> games) {

    public record Summary(
            @JsonProperty("games") int games,
            @JsonProperty("solved") int solved,
            @JsonProperty("solve_rate") double solveRate,
            @JsonProperty("mean_guesses") double meanGuesses) {
    }

    public record GameTrace(
            @JsonProperty("game") int game,
            @JsonProperty("secret") String secret,
            @JsonProperty("solved") boolean solved,
            @JsonProperty("num_guesses") int numGuesses,
            @JsonProperty("steps") List<StepTrace> steps) {
    }

    /**
     * @param remaining   candidates still consistent after this guess
     * @param entropyBits {@code log2(remaining)}, 0 when one or none remain
     */
    public record StepTrace(
            @JsonProperty("guess") String guess,
            @JsonProperty("feedback") String feedback,
            @JsonProperty("remaining") int remaining,
            @JsonProperty("entropy_bits") double entropyBits) {
    }
}
