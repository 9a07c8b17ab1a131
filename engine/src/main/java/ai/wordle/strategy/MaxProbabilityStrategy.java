package ai.wordle.strategy;

import ai.wordle.game.GameConfig;
import ai.wordle.game.ProbabilityDistribution;
import ai.wordle.game.Turn;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Always guesses the most probable remaining candidate, alphabetical on ties.
 * <p>
 * Under uniform probabilities this reduces to "alphabetically first consistent word".
 */
public class MaxProbabilityStrategy extends CandidateStrategy {

    public static final String NAME = "MaxProb";

    /** Vocabulary ordered by descending probability, then alphabetically. */
    private List<String> ranked = List.of();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void beginGame(GameConfig config) {
        super.beginGame(config);
        ProbabilityDistribution probabilities = config.probabilities();
        List<String> words = new ArrayList<>(config.vocabulary().words());
        words.sort(Comparator.comparingDouble((String w) -> -probabilities.probability(w))
                .thenComparing(Comparator.naturalOrder()));
        ranked = words;
    }

    @Override
    public String guess(List<Turn> history) {
        // Filtering preserves order, so the head of the survivors is the best-ranked word.
        List<String> remaining = candidates(ranked, history);
        return remaining.isEmpty() ? ranked.get(0) : remaining.get(0);
    }
}
