package ai.wordle.strategy.tree;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk JSON shape of checkpoints and finished trees.
 * <p>
 * {@code nodes} maps path keys (see {@link FeedbackPath#key()}) to guesses.
 */
public class TreeDocument {

    @JsonProperty("word_length")
    private int wordLength;

    @JsonProperty("mode")
    private String mode;

    @JsonProperty("nodes")
    private Map<String, String> nodes = new LinkedHashMap<>();

    public TreeDocument() {
    }

    public TreeDocument(int wordLength, String mode, Map<String, String> nodes) {
        this.wordLength = wordLength;
        this.mode = mode;
        this.nodes = nodes;
    }

    public int getWordLength() {
        return wordLength;
    }

    public String getMode() {
        return mode;
    }

    public Map<String, String> getNodes() {
        return nodes;
    }
}
