package ai.wordle.strategy.entropy;

import ai.wordle.game.WordleRules;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores guesses by the Shannon entropy of the probability-weighted feedback partition they
 * induce over a set of possible secrets.
 * <p>
 * For a guess {@code g} and secrets {@code c_1..c_n} with weights {@code w_i}, each secret falls
 * into the bucket of {@code feedback(c_i, g)}; bucket mass is the summed weight normalized by the
 * total, and the score is {@code H = -Σ p_k log2 p_k}.
 * <p>
 * Instances keep a reusable bucket buffer and are therefore <b>not thread-safe</b>: every worker
 * task builds its own.
 */
public class EntropyScorer {

    /** Up to this word length buckets are a dense array indexed by pattern code (3^10 entries). */
    private static final int DENSE_MAX_LENGTH = 10;

    private static final double LN2 = Math.log(2.0);

    private final double[] dense;
    private final int[] stamp;
    private final int[] touched;
    private final Map<Integer, Double> sparse;
    private int generation;

    public EntropyScorer(int wordLength) {
        if (wordLength <= DENSE_MAX_LENGTH) {
            int size = 1;
            for (int i = 0; i < wordLength; i++) {
                size *= 3;
            }
            this.dense = new double[size];
            this.stamp = new int[size];
            this.touched = new int[size];
            this.sparse = null;
        } else {
            this.dense = null;
            this.stamp = null;
            this.touched = null;
            this.sparse = new HashMap<>();
        }
    }

    /**
     * Entropy in bits of the partition of {@code secrets} induced by {@code guess}.
     *
     * @param secrets possible secrets
     * @param weights weight of each secret, aligned with {@code secrets}; need not be normalized
     */
    public double entropy(String guess, List<String> secrets, double[] weights) {
        double total = 0.0;
        for (double w : weights) {
            total += w;
        }
        if (total <= 0.0) {
            return 0.0;
        }
        double h = 0.0;
        if (dense != null) {
            // A bucket holds stale mass unless its stamp matches the current generation.
            generation++;
            int used = 0;
            for (int i = 0; i < secrets.size(); i++) {
                int code = WordleRules.feedbackCode(secrets.get(i), guess);
                if (stamp[code] != generation) {
                    stamp[code] = generation;
                    dense[code] = 0.0;
                    touched[used++] = code;
                }
                dense[code] += weights[i];
            }
            for (int k = 0; k < used; k++) {
                h -= term(dense[touched[k]] / total);
            }
        } else {
            sparse.clear();
            for (int i = 0; i < secrets.size(); i++) {
                sparse.merge(WordleRules.feedbackCode(secrets.get(i), guess), weights[i], Double::sum);
            }
            for (double mass : sparse.values()) {
                h -= term(mass / total);
            }
        }
        return h;
    }

    /**
     * Best guess of {@code pool} against {@code secrets}, scanning the pool in order and applying
     * {@link ScoredGuess#beats(ScoredGuess)}.
     *
     * @param candidates words that are still possible secrets, for the tie-break
     * @return the winner, or null for an empty pool
     */
    public ScoredGuess best(Collection<String> pool, List<String> secrets, double[] weights, Set<String> candidates) {
        ScoredGuess best = null;
        for (String guess : pool) {
            ScoredGuess scored = new ScoredGuess(guess, entropy(guess, secrets, weights), candidates.contains(guess));
            if (scored.beats(best)) {
                best = scored;
            }
        }
        return best;
    }

    private static double term(double p) {
        return p > 0.0 ? p * Math.log(p) / LN2 : 0.0;
    }
}
