package ai.wordle.tournament;

/**
 * A strategy's worker could not finish its round: the strategy threw, returned an invalid
 * guess, ran out of memory, or its process died. Only that strategy's round is affected.
 */
public class WorkerFailedException extends Exception {

    private final String strategy;

    public WorkerFailedException(String strategy, String message) {
        super(message);
        this.strategy = strategy;
    }

    public WorkerFailedException(String strategy, String message, Throwable cause) {
        super(message, cause);
        this.strategy = strategy;
    }

    public String getStrategy() {
        return strategy;
    }
}
