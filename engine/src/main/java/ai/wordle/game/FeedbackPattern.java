package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable sequence of {@link Mark}s produced by comparing a guess with a secret.
 * <p>
 * A pattern is identified by its length and its base-3 code {@code Σ mark[i] * 3^i}, so
 * equality and hashing are cheap enough to use patterns as map keys when partitioning
 * candidates. The textual form lists the mark digits in position order, e.g. {@code "20100"}.
 */
public final class FeedbackPattern {

    /** Longest supported word; 3^19 is the largest power of three that fits an int code. */
    public static final int MAX_LENGTH = 19;

    private final int length;
    private final int code;

    private FeedbackPattern(int length, int code) {
        this.length = length;
        this.code = code;
    }

    /**
     * Creates a pattern from its base-3 code.
     *
     * @param code   base-3 code as returned by {@link WordleRules#feedbackCode(String, String)}
     * @param length number of positions
     * @return the pattern
     */
    public static FeedbackPattern fromCode(int code, int length) {
        checkLength(length);
        if (code < 0 || code >= pow3(length)) {
            throw new IllegalArgumentException("Code " + code + " out of range for length " + length);
        }
        return new FeedbackPattern(length, code);
    }

    /**
     * Creates a pattern from marks in position order.
     */
    public static FeedbackPattern of(Mark... marks) {
        checkLength(marks.length);
        int code = 0;
        int weight = 1;
        for (Mark mark : marks) {
            code += mark.getValue() * weight;
            weight *= 3;
        }
        return new FeedbackPattern(marks.length, code);
    }

    /**
     * Parses the compact digit form, e.g. {@code "20100"}.
     *
     * @throws IllegalArgumentException if the text contains anything but 0, 1 and 2
     */
    public static FeedbackPattern parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Pattern text cannot be null");
        }
        Mark[] marks = new Mark[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '2') {
                throw new IllegalArgumentException("Invalid pattern text: " + text);
            }
            marks[i] = Mark.fromValue(c - '0');
        }
        return of(marks);
    }

    /**
     * Pattern of a correct guess.
     */
    public static FeedbackPattern allGreen(int length) {
        checkLength(length);
        return new FeedbackPattern(length, pow3(length) - 1);
    }

    public int length() {
        return length;
    }

    public int code() {
        return code;
    }

    public Mark markAt(int position) {
        if (position < 0 || position >= length) {
            throw new IndexOutOfBoundsException("Position " + position + " outside pattern of length " + length);
        }
        return Mark.fromValue((code / pow3(position)) % 3);
    }

    public List<Mark> marks() {
        List<Mark> marks = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            marks.add(markAt(i));
        }
        return Collections.unmodifiableList(marks);
    }

    public boolean isAllGreen() {
        return code == pow3(length) - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeedbackPattern)) {
            return false;
        }
        FeedbackPattern other = (FeedbackPattern) o;
        return length == other.length && code == other.code;
    }

    @Override
    public int hashCode() {
        return 31 * length + code;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(length);
        int remaining = code;
        for (int i = 0; i < length; i++) {
            sb.append((char) ('0' + remaining % 3));
            remaining /= 3;
        }
        return sb.toString();
    }

    static int pow3(int exponent) {
        int result = 1;
        for (int i = 0; i < exponent; i++) {
            result *= 3;
        }
        return result;
    }

    private static void checkLength(int length) {
        if (length < 1 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("Pattern length must be between 1 and " + MAX_LENGTH + ": " + length);
        }
    }
}
