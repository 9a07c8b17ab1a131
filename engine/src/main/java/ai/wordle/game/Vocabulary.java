package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, duplicate-free, immutable list of words that all share one length.
 */
public final class Vocabulary {

    private final int wordLength;
    private final List<String> words;
    private final Map<String, Integer> index;

    private Vocabulary(int wordLength, List<String> words, Map<String, Integer> index) {
        this.wordLength = wordLength;
        this.words = words;
        this.index = index;
    }

    /**
     * Builds a vocabulary, keeping the given order.
     *
     * @param wordLength expected length of every word
     * @param words      the words; must be non-empty, unique and of {@code wordLength}
     * @throws IllegalArgumentException if a word has the wrong length or appears twice
     */
    public static Vocabulary of(int wordLength, Collection<String> words) {
        if (wordLength < 1 || wordLength > FeedbackPattern.MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "Word length must be between 1 and " + FeedbackPattern.MAX_LENGTH + ": " + wordLength);
        }
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("Vocabulary must not be empty");
        }
        List<String> ordered = new ArrayList<>(words.size());
        Map<String, Integer> seen = new HashMap<>();
        List<String> bad = new ArrayList<>();
        for (String word : words) {
            if (word == null || word.length() != wordLength) {
                if (bad.size() < 5) {
                    bad.add(word);
                }
                continue;
            }
            if (seen.putIfAbsent(word, ordered.size()) != null) {
                throw new IllegalArgumentException("Duplicate word in vocabulary: " + word);
            }
            ordered.add(word);
        }
        if (!bad.isEmpty()) {
            throw new IllegalArgumentException("Words with wrong length (expected " + wordLength + "): " + bad);
        }
        return new Vocabulary(wordLength, Collections.unmodifiableList(ordered), Collections.unmodifiableMap(seen));
    }

    public static Vocabulary of(int wordLength, String... words) {
        return of(wordLength, List.of(words));
    }

    public int wordLength() {
        return wordLength;
    }

    /**
     * Words in vocabulary order (unmodifiable).
     */
    public List<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean contains(String word) {
        return index.containsKey(word);
    }

    /**
     * Position of a word in vocabulary order, or -1 if absent.
     */
    public int indexOf(String word) {
        Integer position = index.get(word);
        return position == null ? -1 : position;
    }

    public String get(int index) {
        return words.get(index);
    }

    @Override
    public String toString() {
        return "Vocabulary(length=" + wordLength + ", size=" + words.size() + ")";
    }
}
