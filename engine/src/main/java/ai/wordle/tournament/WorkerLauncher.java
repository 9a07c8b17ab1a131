package ai.wordle.tournament;

import java.util.List;

/**
 * Runs one {@link WorkerJob} somewhere and returns the outcome of every secret in it.
 */
public interface WorkerLauncher {

    /**
     * @return one outcome per secret of the job, in play order
     * @throws WorkerFailedException if the strategy crashed; the round continues without it
     * @throws InterruptedException  if the coordinator is interrupted while waiting
     */
    List<GameOutcome> run(WorkerJob job) throws WorkerFailedException, InterruptedException;
}
