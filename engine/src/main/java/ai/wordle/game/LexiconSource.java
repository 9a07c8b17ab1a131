package ai.wordle.game;

import java.io.IOException;

/**
 * Supplies the lexicon for one (word length, mode) configuration.
 */
@FunctionalInterface
public interface LexiconSource {

    Lexicon load(int wordLength, ProbabilityMode mode) throws IOException;
}
