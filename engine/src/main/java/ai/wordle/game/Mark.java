package ai.wordle.game;

/**
 * Per-position verdict of a guess against the secret.
 * <p>
 * The numeric value is the digit used in the compact textual form of a
 * {@link FeedbackPattern} (e.g. {@code "20100"}) and in its base-3 integer code.
 */
public enum Mark {
    /** Letter absent, or all of its occurrences already credited. */
    GRAY(0),
    /** Letter present elsewhere in the secret. */
    YELLOW(1),
    /** Correct letter in the correct position. */
    GREEN(2);

    private final int value;

    Mark(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Resolves a mark from its digit value.
     *
     * @param value 0, 1 or 2
     * @return the matching mark
     * @throws IllegalArgumentException if the value is out of range
     */
    public static Mark fromValue(int value) {
        return switch (value) {
            case 0 -> GRAY;
            case 1 -> YELLOW;
            case 2 -> GREEN;
            default -> throw new IllegalArgumentException("Invalid mark value: " + value);
        };
    }
}
