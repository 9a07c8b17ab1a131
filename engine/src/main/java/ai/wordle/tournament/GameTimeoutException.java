package ai.wordle.tournament;

import java.util.concurrent.TimeoutException;

/**
 * A game exceeded its time budget.
 * <p>
 * The game thread was interrupted and abandoned. {@link #isAbandonedThreadAlive()} tells whether
 * it was still running when the exception was raised; such a thread keeps consuming CPU and
 * can only be reclaimed by ending its process.
 */
public class GameTimeoutException extends TimeoutException {

    private final boolean abandonedThreadAlive;

    public GameTimeoutException(String message, boolean abandonedThreadAlive) {
        super(message);
        this.abandonedThreadAlive = abandonedThreadAlive;
    }

    public boolean isAbandonedThreadAlive() {
        return abandonedThreadAlive;
    }
}
