package ai.wordle.game;

import java.util.Locale;

/**
 * How secret-word probabilities are assigned over a vocabulary.
 */
public enum ProbabilityMode {
    /** Every word equally likely. */
    UNIFORM("uniform"),
    /** Sigmoid-smoothed corpus frequency. */
    FREQUENCY("frequency");

    private final String key;

    ProbabilityMode(String key) {
        this.key = key;
    }

    /**
     * Lowercase name used in file names, round ids and reports.
     */
    public String key() {
        return key;
    }

    public static ProbabilityMode fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (ProbabilityMode mode : values()) {
                if (mode.key.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("mode must be 'uniform' or 'frequency', got " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
