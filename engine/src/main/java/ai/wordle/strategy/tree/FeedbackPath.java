package ai.wordle.strategy.tree;

import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Turn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Identity of a decision-tree node: the feedback patterns observed so far, oldest first.
 * <p>
 * The root is the empty path. The textual key joins pattern digit strings with {@code '/'}
 * (root key is {@code ""}), e.g. {@code "20100/00122"}.
 */
public final class FeedbackPath implements Comparable<FeedbackPath> {

    public static final FeedbackPath ROOT = new FeedbackPath(List.of());

    private static final char SEPARATOR = '/';

    private final List<FeedbackPattern> patterns;
    private final String key;

    private FeedbackPath(List<FeedbackPattern> patterns) {
        this.patterns = patterns;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < patterns.size(); i++) {
            if (i > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(patterns.get(i));
        }
        this.key = sb.toString();
    }

    public static FeedbackPath of(List<FeedbackPattern> patterns) {
        return patterns.isEmpty() ? ROOT : new FeedbackPath(Collections.unmodifiableList(new ArrayList<>(patterns)));
    }

    /**
     * Path of a game's history.
     */
    public static FeedbackPath ofHistory(List<Turn> history) {
        List<FeedbackPattern> patterns = new ArrayList<>(history.size());
        for (Turn turn : history) {
            patterns.add(turn.pattern());
        }
        return of(patterns);
    }

    /**
     * Parses a textual key.
     *
     * @param wordLength expected length of every pattern
     * @throws IllegalArgumentException if the key is malformed
     */
    public static FeedbackPath parse(String key, int wordLength) {
        if (key == null) {
            throw new IllegalArgumentException("Path key cannot be null");
        }
        if (key.isEmpty()) {
            return ROOT;
        }
        List<FeedbackPattern> patterns = new ArrayList<>();
        for (String part : key.split(String.valueOf(SEPARATOR), -1)) {
            if (part.length() != wordLength) {
                throw new IllegalArgumentException("Pattern '" + part + "' in path '" + key
                        + "' does not have length " + wordLength);
            }
            patterns.add(FeedbackPattern.parse(part));
        }
        return of(patterns);
    }

    public FeedbackPath append(FeedbackPattern pattern) {
        List<FeedbackPattern> extended = new ArrayList<>(patterns.size() + 1);
        extended.addAll(patterns);
        extended.add(pattern);
        return new FeedbackPath(Collections.unmodifiableList(extended));
    }

    public int depth() {
        return patterns.size();
    }

    public boolean isRoot() {
        return patterns.isEmpty();
    }

    public List<FeedbackPattern> patterns() {
        return patterns;
    }

    public String key() {
        return key;
    }

    /**
     * Shallower paths first, then by key; the breadth-first work order of the tree builder.
     */
    @Override
    public int compareTo(FeedbackPath other) {
        int byDepth = Integer.compare(depth(), other.depth());
        return byDepth != 0 ? byDepth : key.compareTo(other.key);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FeedbackPath && key.equals(((FeedbackPath) o).key));
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : key;
    }
}
