package ai.wordle.strategy.tree;

import ai.wordle.game.ProbabilityMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Precomputed feedback-path to guess map for one (word length, mode) configuration.
 */
public final class DecisionTree {

    private final int wordLength;
    private final ProbabilityMode mode;
    private final Map<FeedbackPath, String> nodes;

    public DecisionTree(int wordLength, ProbabilityMode mode, Map<FeedbackPath, String> nodes) {
        this.wordLength = wordLength;
        this.mode = mode;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public int wordLength() {
        return wordLength;
    }

    public ProbabilityMode mode() {
        return mode;
    }

    /**
     * Guess stored for the exact path, if the tree covers it.
     */
    public Optional<String> guessAt(FeedbackPath path) {
        return Optional.ofNullable(nodes.get(path));
    }

    public int size() {
        return nodes.size();
    }

    public Map<FeedbackPath, String> asMap() {
        return nodes;
    }

    @Override
    public String toString() {
        return "DecisionTree(" + wordLength + "_" + mode.key() + ", nodes=" + nodes.size() + ")";
    }
}
