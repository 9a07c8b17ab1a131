package ai.wordle.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one strategy playing one secret.
 *
 * @param numGuesses guesses made; {@code maxGuesses + 1} for a game that timed out
 * @param timedOut   true when the game was cut off by the per-game deadline
 */
public record GameOutcome(
        @JsonProperty("strategy") String strategy,
        @JsonProperty("secret") String secret,
        @JsonProperty("num_guesses") int numGuesses,
        @JsonProperty("solved") boolean solved,
        @JsonProperty("timed_out") boolean timedOut) {

    /**
     * Outcome recorded when a game runs out of time: unsolved, one guess worse than the
     * maximum.
     */
    public static GameOutcome timeout(String strategy, String secret, int maxGuesses) {
        return new GameOutcome(strategy, secret, maxGuesses + 1, false, true);
    }
}
