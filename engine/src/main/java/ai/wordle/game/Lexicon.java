package ai.wordle.game;

import java.util.Objects;

/**
 * A vocabulary together with its secret-word distribution and the mode that produced it.
 */
public record Lexicon(Vocabulary vocabulary, ProbabilityDistribution distribution, ProbabilityMode mode) {

    public Lexicon {
        Objects.requireNonNull(vocabulary, "vocabulary");
        Objects.requireNonNull(distribution, "distribution");
        Objects.requireNonNull(mode, "mode");
        if (distribution.vocabulary() != vocabulary) {
            throw new IllegalArgumentException("Distribution was built for a different vocabulary");
        }
    }

    public static Lexicon uniform(Vocabulary vocabulary) {
        return new Lexicon(vocabulary, ProbabilityDistribution.uniform(vocabulary), ProbabilityMode.UNIFORM);
    }

    public int wordLength() {
        return vocabulary.wordLength();
    }

    /**
     * Same lexicon with a perturbed distribution.
     */
    public Lexicon withDistribution(ProbabilityDistribution perturbed) {
        return new Lexicon(vocabulary, perturbed, mode);
    }
}
