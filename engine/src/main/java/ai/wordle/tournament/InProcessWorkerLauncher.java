package ai.wordle.tournament;

import ai.wordle.strategy.Strategy;
import ai.wordle.strategy.StrategyRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs workers as threads of the current JVM.
 * <p>
 * Meant for tests and development. There is no memory or CPU isolation, and a timed-out game
 * whose thread ignores interrupts keeps running in the background until the JVM exits; use
 * {@link ForkedWorkerLauncher} for tournaments with untrusted strategies.
 */
public class InProcessWorkerLauncher implements WorkerLauncher {

    private final StrategyRegistry registry;

    public InProcessWorkerLauncher(StrategyRegistry registry) {
        this.registry = registry;
    }

    @Override
    public List<GameOutcome> run(WorkerJob job) throws WorkerFailedException, InterruptedException {
        Supplier<Strategy> factory;
        try {
            factory = registry.factory(job.getStrategy());
        } catch (IllegalArgumentException e) {
            throw new WorkerFailedException(job.getStrategy(), e.getMessage(), e);
        }
        StrategyWorker worker = new StrategyWorker(job.getStrategy(), factory, job.toGameConfig(),
                job.gameTimeoutMillis(), job.getRoundId());
        List<GameOutcome> outcomes = new ArrayList<>(job.getSecrets().size());
        worker.play(job.getSecrets(), outcomes::add);
        return outcomes;
    }
}
