package ai.wordle;

import ai.wordle.game.GameConfig;
import ai.wordle.game.Lexicon;
import ai.wordle.game.Vocabulary;
import java.util.ArrayList;
import java.util.List;

/**
 * Small vocabularies and configs shared by unit tests.
 */
public final class WordleTestHelper {

    /** Four words whose feedback against each other is fully worked out in the tests. */
    public static final List<String> FOUR_WORDS = List.of("aabb", "abab", "abcd", "dcba");

    private WordleTestHelper() {
    }

    public static Lexicon uniformLexicon(List<String> words) {
        return Lexicon.uniform(Vocabulary.of(words.get(0).length(), words));
    }

    public static GameConfig uniformConfig(List<String> words, int maxGuesses) {
        return GameConfig.of(uniformLexicon(words), maxGuesses, true);
    }

    /**
     * Every word of {@code length} letters over the alphabet, in lexicographic order.
     */
    public static List<String> allWords(String alphabet, int length) {
        List<String> words = new ArrayList<>();
        words.add("");
        for (int i = 0; i < length; i++) {
            List<String> longer = new ArrayList<>();
            for (String prefix : words) {
                for (char c : alphabet.toCharArray()) {
                    longer.add(prefix + c);
                }
            }
            words = longer;
        }
        return words;
    }
}
