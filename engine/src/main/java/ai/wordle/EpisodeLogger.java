package ai.wordle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs for per-game analysis.
 *
 * <p>Each line is prefixed with {@code EPISODE_STEP} or {@code EPISODE_SUMMARY} so downstream
 * tools can filter it out of mixed logs easily. Disabled unless the JVM runs with
 * {@code -Dlog.episodes=true}.</p>
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Emit one line describing a guess: which word was played, the feedback it got, and how
     * many candidates were consistent before and after.
     */
    public static void logStep(
            String solverId,
            String roundId,
            int stepIndex,
            String guess,
            String feedback,
            int candidatesBefore,
            int candidatesAfter) {

        try {
            ObjectNode node = OBJECT_MAPPER.createObjectNode();
            node.put("type", "step");
            node.put("solver", solverId);
            if (roundId != null) {
                node.put("round_id", roundId);
            }
            node.put("step_index", stepIndex);
            node.put("guess", guess);
            node.put("feedback", feedback);
            node.put("candidates_before", candidatesBefore);
            node.put("candidates_after", candidatesAfter);

            if (log.isInfoEnabled()) {
                log.info("EPISODE_STEP {}", OBJECT_MAPPER.writeValueAsString(node));
            }
        } catch (Exception e) {
            // Logging must never interfere with gameplay.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode step", e);
            }
        }
    }

    /**
     * Emit a single structured JSON line summarising the whole game.
     */
    public static void logSummary(
            String solverId,
            String roundId,
            String secret,
            int numGuesses,
            boolean solved,
            boolean timedOut,
            long durationNanos) {

        try {
            ObjectNode node = OBJECT_MAPPER.createObjectNode();
            node.put("type", "summary");
            node.put("solver", solverId);
            if (roundId != null) {
                node.put("round_id", roundId);
            }
            node.put("secret", secret);
            node.put("num_guesses", numGuesses);
            node.put("solved", solved);
            node.put("timed_out", timedOut);
            node.put("duration_nanos", durationNanos);

            if (log.isInfoEnabled()) {
                log.info("EPISODE_SUMMARY {}", OBJECT_MAPPER.writeValueAsString(node));
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode summary", e);
            }
        }
    }
}
