package ai.wordle.tournament;

import ai.wordle.game.ProbabilityMode;
import java.util.ArrayList;
import java.util.List;

/**
 * One (word length, probability mode) cell of the round matrix.
 */
public record RoundSpec(int wordLength, ProbabilityMode mode) {

    /** {4, 5, 6} letters x {uniform, frequency}. */
    public static final List<RoundSpec> CANONICAL = matrix(List.of(4, 5, 6),
            List.of(ProbabilityMode.UNIFORM, ProbabilityMode.FREQUENCY));

    /**
     * Every combination, word length major.
     */
    public static List<RoundSpec> matrix(List<Integer> wordLengths, List<ProbabilityMode> modes) {
        List<RoundSpec> rounds = new ArrayList<>();
        for (int wordLength : wordLengths) {
            for (ProbabilityMode mode : modes) {
                rounds.add(new RoundSpec(wordLength, mode));
            }
        }
        return List.copyOf(rounds);
    }

    /**
     * {@code <L>_<mode>}, suffixed with {@code _r<rep>} when the tournament repeats rounds.
     */
    public String roundId(int repetition, int repetitions) {
        String id = wordLength + "_" + mode.key();
        return repetitions > 1 ? id + "_r" + repetition : id;
    }
}
