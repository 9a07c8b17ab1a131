package ai.wordle.game;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Probability of each vocabulary word being the secret; values sum to 1.
 * <p>
 * Two construction modes mirror {@link ProbabilityMode}: {@link #uniform(Vocabulary)} and
 * {@link #frequency(Vocabulary, Map)}. Either can be {@linkplain #perturb(double, long) shocked}
 * with multiplicative white noise to keep strategies from overfitting exact corpus values.
 */
public final class ProbabilityDistribution {

    /** Accepted deviation of the probability sum from 1 for externally supplied maps. */
    public static final double SUM_TOLERANCE = 1e-6;

    /** Steepness of the sigmoid applied to centred log-counts in frequency mode. */
    public static final double DEFAULT_STEEPNESS = 1.5;

    private static final double PERTURBED_FLOOR = 1e-12;

    private final Vocabulary vocabulary;
    private final double[] probabilities;

    private ProbabilityDistribution(Vocabulary vocabulary, double[] probabilities) {
        this.vocabulary = vocabulary;
        this.probabilities = probabilities;
    }

    /**
     * Equal probability {@code 1/N} for every word.
     */
    public static ProbabilityDistribution uniform(Vocabulary vocabulary) {
        double[] p = new double[vocabulary.size()];
        Arrays.fill(p, 1.0 / vocabulary.size());
        return new ProbabilityDistribution(vocabulary, p);
    }

    /**
     * Sigmoid-smoothed frequency weights with the default steepness.
     *
     * @param counts raw corpus count per word; missing words count as 0
     */
    public static ProbabilityDistribution frequency(Vocabulary vocabulary, Map<String, Long> counts) {
        return frequency(vocabulary, counts, DEFAULT_STEEPNESS);
    }

    /**
     * Maps each raw count to {@code sigmoid(steepness * (log(count + 1) - mean))}, where mean is
     * the average log-count over the vocabulary, then normalizes.
     */
    public static ProbabilityDistribution frequency(Vocabulary vocabulary, Map<String, Long> counts, double steepness) {
        List<String> words = vocabulary.words();
        double[] logCounts = new double[words.size()];
        double mean = 0.0;
        for (int i = 0; i < words.size(); i++) {
            long count = counts.getOrDefault(words.get(i), 0L);
            logCounts[i] = Math.log(count + 1.0);
            mean += logCounts[i];
        }
        mean /= words.size();
        double[] weights = new double[words.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = sigmoid(steepness * (logCounts[i] - mean));
        }
        return new ProbabilityDistribution(vocabulary, normalize(weights));
    }

    /**
     * Wraps an externally supplied word to probability map after validating it.
     *
     * @throws IllegalArgumentException if a word is missing, a value is negative, or the sum
     *                                  deviates from 1 by more than {@link #SUM_TOLERANCE}
     */
    public static ProbabilityDistribution fromMap(Vocabulary vocabulary, Map<String, Double> probabilities) {
        double[] p = new double[vocabulary.size()];
        double total = 0.0;
        for (int i = 0; i < p.length; i++) {
            String word = vocabulary.get(i);
            Double value = probabilities.get(word);
            if (value == null) {
                throw new IllegalArgumentException("No probability for word " + word);
            }
            if (value < 0.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Invalid probability for " + word + ": " + value);
            }
            p[i] = value;
            total += value;
        }
        if (probabilities.size() != vocabulary.size()) {
            throw new IllegalArgumentException("Probability map has " + probabilities.size()
                    + " entries for a vocabulary of " + vocabulary.size());
        }
        if (Math.abs(total - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Probabilities sum to " + total + ", expected 1");
        }
        return new ProbabilityDistribution(vocabulary, p);
    }

    /**
     * Returns a copy where each probability is multiplied by {@code 1 + U(-noiseScale, noiseScale)},
     * floored at a tiny positive value and renormalized. Deterministic for a given seed.
     *
     * @param noiseScale perturbation magnitude, e.g. 0.05 for 5% noise
     * @param seed       random seed
     */
    public ProbabilityDistribution perturb(double noiseScale, long seed) {
        if (noiseScale < 0.0) {
            throw new IllegalArgumentException("Noise scale must be >= 0: " + noiseScale);
        }
        Random rng = new Random(seed);
        double[] perturbed = new double[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            double factor = 1.0 + (rng.nextDouble() * 2.0 - 1.0) * noiseScale;
            perturbed[i] = Math.max(probabilities[i] * factor, PERTURBED_FLOOR);
        }
        return new ProbabilityDistribution(vocabulary, normalize(perturbed));
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    /**
     * Probability of a word, or 0 for words outside the vocabulary.
     */
    public double probability(String word) {
        int index = vocabulary.indexOf(word);
        return index < 0 ? 0.0 : probabilities[index];
    }

    /**
     * Probability by vocabulary index; the fast path for scoring loops.
     */
    public double probabilityAt(int index) {
        return probabilities[index];
    }

    /**
     * Word to probability in vocabulary order (unmodifiable).
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < probabilities.length; i++) {
            map.put(vocabulary.get(i), probabilities[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    public double sum() {
        double total = 0.0;
        for (double p : probabilities) {
            total += p;
        }
        return total;
    }

    private static double[] normalize(double[] weights) {
        double total = 0.0;
        for (double w : weights) {
            total += w;
        }
        double[] result = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            result[i] = weights[i] / total;
        }
        return result;
    }

    // Split form avoids overflow of exp() for large |x|.
    private static double sigmoid(double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
        double ex = Math.exp(x);
        return ex / (1.0 + ex);
    }
}
