package ai.wordle.strategy.entropy;

/**
 * A guess with the entropy of the feedback partition it induces.
 *
 * @param guess     the word
 * @param entropy   Shannon entropy in bits
 * @param candidate whether the word is itself still a possible secret
 */
public record ScoredGuess(String guess, double entropy, boolean candidate) {

    /**
     * Selection rule shared by live search and tree precomputation: strictly higher entropy
     * wins; on an exact tie a candidate beats a non-candidate; otherwise the incumbent stays.
     *
     * @param incumbent current best, or null
     */
    public boolean beats(ScoredGuess incumbent) {
        if (incumbent == null) {
            return true;
        }
        if (entropy > incumbent.entropy) {
            return true;
        }
        return entropy == incumbent.entropy && candidate && !incumbent.candidate;
    }

    /**
     * The better of two scored guesses, keeping {@code a} unless {@code b} beats it.
     */
    public static ScoredGuess better(ScoredGuess a, ScoredGuess b) {
        if (b == null) {
            return a;
        }
        return b.beats(a) ? b : a;
    }
}
