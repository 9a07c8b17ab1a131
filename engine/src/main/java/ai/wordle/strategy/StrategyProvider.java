package ai.wordle.strategy;

/**
 * Plugin hook for strategies shipped outside this module.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} from
 * {@code META-INF/services/ai.wordle.strategy.StrategyProvider} and must have a public
 * no-argument constructor. Each {@link #create()} call must return a fresh instance because
 * workers discard a strategy after it overruns its time limit.
 */
public interface StrategyProvider {

    /**
     * Registry name of the strategy; must match {@link Strategy#name()} of created instances.
     */
    String name();

    Strategy create();
}
