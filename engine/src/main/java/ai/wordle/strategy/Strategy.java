package ai.wordle.strategy;

import ai.wordle.game.GameConfig;
import ai.wordle.game.Turn;
import java.util.List;

/**
 * A guessing algorithm that can be entered into experiments and tournaments.
 * <p>
 * Per game the caller invokes {@link #beginGame(GameConfig)} exactly once, then
 * {@link #guess(List)} until the game ends, then {@link #endGame(String, boolean, int)} exactly
 * once. {@code endGame} is skipped for games that hit the time limit.
 */
public interface Strategy {

    /**
     * Human-readable name used in reports and for registry lookup.
     */
    String name();

    /**
     * Called before the first guess of each game; a place for per-game precomputation.
     */
    default void beginGame(GameConfig config) {
    }

    /**
     * Provide the next guess.
     *
     * @param history the (guess, feedback) pairs observed so far, oldest first
     * @return the word to guess next
     */
    String guess(List<Turn> history);

    /**
     * Called after the game reached a terminal state; a place for learning or logging.
     */
    default void endGame(String secret, boolean solved, int numGuesses) {
    }
}
