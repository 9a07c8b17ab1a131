package ai.wordle.strategy;

import ai.wordle.game.GameConfig;
import ai.wordle.game.Turn;
import ai.wordle.game.WordleRules;
import java.util.List;

/**
 * Base class for strategies that pick among the words still consistent with the history.
 */
public abstract class CandidateStrategy implements Strategy {

    /** Config of the game in progress; set by {@link #beginGame(GameConfig)}. */
    protected GameConfig config;

    @Override
    public void beginGame(GameConfig config) {
        this.config = config;
    }

    /**
     * Words consistent with every turn so far, filtered from the full ordered word list.
     */
    protected List<String> candidates(List<String> orderedWords, List<Turn> history) {
        return WordleRules.filterByHistory(orderedWords, history);
    }

    protected List<String> candidates(List<Turn> history) {
        if (config == null) {
            throw new IllegalStateException("beginGame() must be called before guess()");
        }
        return candidates(config.vocabulary().words(), history);
    }
}
