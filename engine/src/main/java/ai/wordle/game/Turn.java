package ai.wordle.game;

import java.util.Objects;

/**
 * One entry of a game's history: the submitted guess and the feedback it received.
 */
public record Turn(String guess, FeedbackPattern pattern) {

    public Turn {
        Objects.requireNonNull(guess, "guess");
        Objects.requireNonNull(pattern, "pattern");
    }
}
