package ai.wordle.tournament;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a task on a dedicated daemon thread and gives up on it at a deadline.
 * <p>
 * At the deadline the thread is interrupted and given a short grace period to finish. Code that
 * ignores interrupts cannot be stopped from inside the JVM; such a thread is abandoned and
 * reported through {@link GameTimeoutException#isAbandonedThreadAlive()} so the caller can decide
 * to end the process.
 */
public final class TimeLimitedCall {

    /** How long an interrupted task gets to wind down before it is considered stuck. */
    static final long JOIN_GRACE_MILLIS = 200L;

    private TimeLimitedCall() {
    }

    /**
     * @param timeoutMillis deadline for the task
     * @param threadName    name of the thread the task runs on
     * @return the task's result
     * @throws GameTimeoutException if the task did not finish in time
     * @throws ExecutionException   if the task threw
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    public static <T> T call(Callable<T> task, long timeoutMillis, String threadName)
            throws GameTimeoutException, ExecutionException, InterruptedException {
        FutureTask<T> future = new FutureTask<>(task);
        Thread thread = new Thread(future, threadName);
        thread.setDaemon(true);
        thread.start();
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            thread.join(JOIN_GRACE_MILLIS);
            throw new GameTimeoutException("Exceeded " + timeoutMillis + " ms", thread.isAlive());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
