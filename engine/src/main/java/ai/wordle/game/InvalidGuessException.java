package ai.wordle.game;

/**
 * A guess or secret violated the rules of the configured game: wrong length,
 * a non-vocabulary guess while guesses are restricted, or a secret outside the vocabulary.
 * <p>
 * Always fatal to the single call; nothing is silently corrected.
 */
public class InvalidGuessException extends IllegalArgumentException {

    public InvalidGuessException(String message) {
        super(message);
    }
}
