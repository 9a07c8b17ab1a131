package ai.wordle.tournament;

/**
 * Progress of the tournament owned by a {@link TournamentOrchestrator}.
 * <p>
 * Transitions: {@code IDLE -> RUNNING -> FINISHED | FAILED}. All accessors are synchronized and
 * {@link #snapshot()} returns an immutable copy, so a monitoring thread can poll it while the
 * tournament runs.
 */
public class RunStatus {

    public enum State {
        IDLE,
        RUNNING,
        FINISHED,
        FAILED
    }

    /**
     * Point-in-time copy of the status.
     *
     * @param currentRound id of the round being played, or null
     * @param error        failure message when {@code state == FAILED}
     */
    public record Snapshot(State state, String tournamentId, String currentRound, int roundsCompleted,
                           int roundsTotal, String error) {
    }

    private State state = State.IDLE;
    private String tournamentId;
    private String currentRound;
    private int roundsCompleted;
    private int roundsTotal;
    private String error;

    synchronized void start(String tournamentId, int roundsTotal) {
        if (state == State.RUNNING) {
            throw new IllegalStateException("Tournament " + this.tournamentId + " is already running");
        }
        this.state = State.RUNNING;
        this.tournamentId = tournamentId;
        this.roundsTotal = roundsTotal;
        this.roundsCompleted = 0;
        this.currentRound = null;
        this.error = null;
    }

    synchronized void roundStarted(String roundId) {
        this.currentRound = roundId;
    }

    synchronized void roundCompleted() {
        this.roundsCompleted++;
        this.currentRound = null;
    }

    synchronized void finish() {
        this.state = State.FINISHED;
        this.currentRound = null;
    }

    synchronized void fail(String message) {
        this.state = State.FAILED;
        this.error = message;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(state, tournamentId, currentRound, roundsCompleted, roundsTotal, error);
    }
}
