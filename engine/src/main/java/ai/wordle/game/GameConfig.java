package ai.wordle.game;

import java.util.Objects;

/**
 * Everything a strategy learns about a game when it starts: word length, vocabulary,
 * probability mode and distribution, guess budget, and whether non-vocabulary guesses are allowed.
 * <p>
 * Immutable; handed to {@code Strategy.beginGame} once per game.
 */
public record GameConfig(
        int wordLength,
        Vocabulary vocabulary,
        ProbabilityMode mode,
        ProbabilityDistribution probabilities,
        int maxGuesses,
        boolean allowNonWords) {

    public GameConfig {
        Objects.requireNonNull(vocabulary, "vocabulary");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(probabilities, "probabilities");
        if (vocabulary.wordLength() != wordLength) {
            throw new IllegalArgumentException("Vocabulary word length " + vocabulary.wordLength()
                    + " != configured word length " + wordLength);
        }
        if (maxGuesses < 1) {
            throw new IllegalArgumentException("maxGuesses must be >= 1: " + maxGuesses);
        }
        if (Math.abs(probabilities.sum() - 1.0) > ProbabilityDistribution.SUM_TOLERANCE) {
            throw new IllegalArgumentException("Probabilities sum to " + probabilities.sum());
        }
    }

    /**
     * Config for a lexicon with the given budget.
     */
    public static GameConfig of(Lexicon lexicon, int maxGuesses, boolean allowNonWords) {
        return new GameConfig(
                lexicon.wordLength(),
                lexicon.vocabulary(),
                lexicon.mode(),
                lexicon.distribution(),
                maxGuesses,
                allowNonWords);
    }
}
