package ai.wordle.game;

/**
 * An operation was attempted in the wrong {@link GameSession.State}, e.g. guessing before
 * {@code reset()} or after the game ended, or reading the secret mid-game.
 */
public class GameStateException extends IllegalStateException {

    public GameStateException(String message) {
        super(message);
    }
}
