package ai.wordle.tournament;

import ai.wordle.EpisodeLogger;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.GameConfig;
import ai.wordle.game.GameSession;
import ai.wordle.game.Turn;
import ai.wordle.game.WordleRules;
import ai.wordle.strategy.Strategy;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays one strategy through a list of secrets, strictly one game at a time.
 * <p>
 * Each game runs under {@link TimeLimitedCall}. A game that misses its deadline is scored as
 * {@link GameOutcome#timeout(String, String, int)}, its {@code endGame} is skipped, and the
 * strategy instance is replaced by a fresh one from the factory because the abandoned thread may
 * still be using the old one. Any exception out of the strategy, including an invalid guess,
 * ends the worker with a {@link WorkerFailedException}.
 * <p>
 * With {@link #setHaltOnStuckThread(boolean)} the worker stops right after a timeout whose game
 * thread ignored the interrupt; a forked worker then exits so the coordinator can relaunch it
 * with a clean JVM for the remaining secrets.
 */
public class StrategyWorker {

    private static final Logger log = LoggerFactory.getLogger(StrategyWorker.class);

    private final String strategyName;
    private final Supplier<Strategy> factory;
    private final GameConfig config;
    private final long gameTimeoutMillis;
    private final String roundId;

    private boolean haltOnStuckThread;
    private boolean halted;

    public StrategyWorker(String strategyName, Supplier<Strategy> factory, GameConfig config,
                          long gameTimeoutMillis, String roundId) {
        this.strategyName = strategyName;
        this.factory = factory;
        this.config = config;
        this.gameTimeoutMillis = gameTimeoutMillis;
        this.roundId = roundId;
    }

    public void setHaltOnStuckThread(boolean haltOnStuckThread) {
        this.haltOnStuckThread = haltOnStuckThread;
    }

    /**
     * True when the last {@link #play(List, Consumer)} stopped early because a timed-out game
     * thread could not be stopped.
     */
    public boolean isHalted() {
        return halted;
    }

    /**
     * Plays the secrets in order, handing each outcome to {@code sink} as soon as it is known.
     *
     * @return number of games played
     * @throws WorkerFailedException if the strategy cannot be created or fails during a game
     * @throws InterruptedException  if the calling thread is interrupted
     */
    public int play(List<String> secrets, Consumer<GameOutcome> sink) throws WorkerFailedException, InterruptedException {
        halted = false;
        Strategy strategy = newStrategy();
        int played = 0;
        for (String secret : secrets) {
            GameSession session = new GameSession(config, new Random(0L));
            session.reset(secret);
            Strategy current = strategy;
            long startNanos = System.nanoTime();
            GameOutcome outcome;
            try {
                TimeLimitedCall.call(() -> {
                    playGame(current, session);
                    return null;
                }, gameTimeoutMillis, "game-" + strategyName);
                current.endGame(secret, session.isSolved(), session.guessCount());
                outcome = new GameOutcome(strategyName, secret, session.guessCount(), session.isSolved(), false);
            } catch (GameTimeoutException e) {
                outcome = GameOutcome.timeout(strategyName, secret, config.maxGuesses());
                log.warn("{} timed out on '{}' after {} ms{}", strategyName, secret, gameTimeoutMillis,
                        e.isAbandonedThreadAlive() ? " (game thread still running)" : "");
                if (e.isAbandonedThreadAlive() && haltOnStuckThread) {
                    halted = true;
                }
                strategy = halted ? strategy : newStrategy();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new WorkerFailedException(strategyName, strategyName + " failed on secret '" + secret + "': "
                        + cause, cause);
            } catch (RuntimeException e) {
                throw new WorkerFailedException(strategyName, strategyName + " failed in endGame for '" + secret
                        + "': " + e, e);
            }

            played++;
            if (EpisodeLogger.isEnabled()) {
                EpisodeLogger.logSummary(strategyName, roundId, secret, outcome.numGuesses(), outcome.solved(),
                        outcome.timedOut(), System.nanoTime() - startNanos);
            }
            sink.accept(outcome);
            if (halted) {
                break;
            }
        }
        return played;
    }

    private void playGame(Strategy strategy, GameSession session) throws InterruptedException {
        strategy.beginGame(config);
        while (!session.isOver()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Game abandoned");
            }
            List<Turn> history = session.history();
            String word = strategy.guess(history);
            FeedbackPattern pattern = session.guess(word);
            if (EpisodeLogger.isEnabled()) {
                logStep(history, session.history(), word, pattern);
            }
        }
    }

    private void logStep(List<Turn> before, List<Turn> after, String word, FeedbackPattern pattern) {
        List<String> words = config.vocabulary().words();
        EpisodeLogger.logStep(strategyName, roundId, before.size(), word, pattern.toString(),
                WordleRules.filterByHistory(words, before).size(),
                WordleRules.filterByHistory(words, after).size());
    }

    private Strategy newStrategy() throws WorkerFailedException {
        try {
            return factory.get();
        } catch (RuntimeException e) {
            throw new WorkerFailedException(strategyName, "Cannot create strategy " + strategyName + ": " + e, e);
        }
    }
}
