package ai.wordle.strategy.tree;

/**
 * A checkpoint or tree file exists but cannot be trusted. Fatal to a precomputation run.
 */
public class CheckpointCorruptedException extends IllegalStateException {

    public CheckpointCorruptedException(String message) {
        super(message);
    }

    public CheckpointCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
