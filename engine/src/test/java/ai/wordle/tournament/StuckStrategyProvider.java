package ai.wordle.tournament;

import ai.wordle.game.Turn;
import ai.wordle.strategy.Strategy;
import ai.wordle.strategy.StrategyProvider;
import java.util.List;

/**
 * Registers {@code Stuck}: a strategy that never answers and ignores interrupts, so only
 * stopping its JVM ends the game.
 */
public class StuckStrategyProvider implements StrategyProvider {

    public static final String NAME = "Stuck";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Strategy create() {
        return new Strategy() {
            private volatile long spins;

            @Override
            public String name() {
                return NAME;
            }

            @Override
            public String guess(List<Turn> history) {
                while (spins >= 0) {
                    spins++;
                }
                return "";
            }
        };
    }
}
