package ai.wordle.tournament;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class TimeLimitedCallTest {

    @Test
    void fastTask_returnsItsValue() throws Exception {
        assertEquals("done", TimeLimitedCall.call(() -> "done", 1_000L, "fast"));
    }

    @Test
    void slowTask_isInterruptedAndReported() {
        GameTimeoutException e = assertThrows(GameTimeoutException.class, () -> TimeLimitedCall.call(() -> {
            Thread.sleep(10_000L);
            return null;
        }, 100L, "sleeper"));
        assertFalse(e.isAbandonedThreadAlive());
    }

    @Test
    void taskIgnoringInterrupts_isAbandoned() {
        AtomicBoolean release = new AtomicBoolean();
        try {
            GameTimeoutException e = assertThrows(GameTimeoutException.class, () -> TimeLimitedCall.call(() -> {
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                return null;
            }, 100L, "spinner"));
            assertTrue(e.isAbandonedThreadAlive());
        } finally {
            release.set(true);
        }
    }

    @Test
    void failingTask_surfacesItsException() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> TimeLimitedCall.call(() -> {
            throw new IllegalStateException("boom");
        }, 1_000L, "failing"));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }
}
