package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Pure game rules: feedback for a guess against a secret, and candidate filtering.
 * <p>
 * Duplicate letters are the subtle part. Greens are claimed first; a non-green position is
 * yellow only while the secret still holds an uncredited occurrence of that letter, so a
 * letter is never credited more often than it occurs. For secret {@code aabb} and guess
 * {@code abab} the verdict is green, yellow, yellow, green.
 * <p>
 * Filtering is always recomputed from the full word list; callers never keep incremental
 * candidate state between turns.
 */
public final class WordleRules {

    private WordleRules() {
    }

    /**
     * Computes the feedback pattern for {@code guess} against {@code secret}.
     *
     * @throws InvalidGuessException if the lengths differ
     */
    public static FeedbackPattern feedback(String secret, String guess) {
        return FeedbackPattern.fromCode(feedbackCode(secret, guess), secret.length());
    }

    /**
     * Same verdict as {@link #feedback(String, String)}, returned as the base-3 pattern code.
     * <p>
     * This is the hot path of entropy scoring and allocates only two small arrays.
     *
     * @throws InvalidGuessException if the lengths differ
     */
    public static int feedbackCode(String secret, String guess) {
        int n = secret.length();
        if (guess.length() != n) {
            throw new InvalidGuessException(
                    "Guess length (" + guess.length() + ") != secret length (" + n + ")");
        }
        int[] marks = new int[n];
        // consumed[j]: secret letter j already credited to some guess position
        boolean[] consumed = new boolean[n];

        // Pass 1: greens.
        for (int i = 0; i < n; i++) {
            if (guess.charAt(i) == secret.charAt(i)) {
                marks[i] = 2;
                consumed[i] = true;
            }
        }

        // Pass 2: yellows against the remaining (unconsumed) secret letters.
        for (int i = 0; i < n; i++) {
            if (marks[i] == 2) {
                continue;
            }
            char g = guess.charAt(i);
            for (int j = 0; j < n; j++) {
                if (!consumed[j] && secret.charAt(j) == g) {
                    marks[i] = 1;
                    consumed[j] = true;
                    break;
                }
            }
        }

        int code = 0;
        int weight = 1;
        for (int i = 0; i < n; i++) {
            code += marks[i] * weight;
            weight *= 3;
        }
        return code;
    }

    /**
     * Keeps exactly the words {@code w} for which {@code feedback(w, guess)} equals {@code pattern},
     * preserving input order.
     */
    public static List<String> filterCandidates(Collection<String> candidates, String guess, FeedbackPattern pattern) {
        List<String> kept = new ArrayList<>();
        if (guess.length() != pattern.length()) {
            return kept;
        }
        int code = pattern.code();
        for (String word : candidates) {
            if (word.length() == guess.length() && feedbackCode(word, guess) == code) {
                kept.add(word);
            }
        }
        return kept;
    }

    /**
     * Re-filters the full word list through every turn of a game, in order.
     */
    public static List<String> filterByHistory(List<String> words, List<Turn> history) {
        List<String> candidates = words;
        for (Turn turn : history) {
            candidates = filterCandidates(candidates, turn.guess(), turn.pattern());
        }
        return candidates == words ? new ArrayList<>(words) : candidates;
    }
}
