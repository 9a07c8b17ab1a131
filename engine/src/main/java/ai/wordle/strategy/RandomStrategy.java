package ai.wordle.strategy;

import ai.wordle.game.Turn;
import java.util.List;
import java.util.Random;

/**
 * Baseline: a uniformly random word among the remaining candidates.
 */
public class RandomStrategy extends CandidateStrategy {

    public static final String NAME = "Random";

    private final Random random;

    public RandomStrategy() {
        this(new Random());
    }

    public RandomStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String guess(List<Turn> history) {
        List<String> remaining = candidates(history);
        if (remaining.isEmpty()) {
            return config.vocabulary().get(0);
        }
        return remaining.get(random.nextInt(remaining.size()));
    }
}
