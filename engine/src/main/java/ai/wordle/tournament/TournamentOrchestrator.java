package ai.wordle.tournament;

import ai.wordle.config.TournamentProperties;
import ai.wordle.game.Lexicon;
import ai.wordle.game.LexiconSource;
import ai.wordle.game.ProbabilityMode;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every entered strategy through every round and produces the {@link TournamentReport}.
 * <p>
 * For each repetition and each {@link RoundSpec}:
 * <ol>
 *   <li>a round seed is drawn from the master RNG;</li>
 *   <li>the lexicon is loaded; in frequency mode with a non-zero shock its distribution is
 *       perturbed with the round seed;</li>
 *   <li>the secrets are the whole vocabulary, or a sample of {@code numGames} drawn with the
 *       round seed;</li>
 *   <li>every strategy plays the same secrets through the {@link WorkerLauncher}, several
 *       strategies at a time; results are taken as workers finish.</li>
 * </ol>
 * A strategy whose worker fails is listed in the round's {@code failed} map and simply earns no
 * points for that round. After the last round the {@link Leaderboard} is computed and the
 * report written.
 */
public class TournamentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TournamentOrchestrator.class);
    private static final DateTimeFormatter RUN_ID = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final LexiconSource lexicons;
    private final WorkerLauncher launcher;
    private final List<String> strategies;
    private final TournamentProperties properties;
    private final List<RoundSpec> rounds;
    private final String treeDirectory;
    private final TournamentReportWriter writer;
    private final RunStatus status = new RunStatus();

    /**
     * @param strategies    registry names of the entered strategies
     * @param treeDirectory passed on to workers for precomputed trees; may be null
     * @param writer        where the report goes; null to skip writing
     */
    public TournamentOrchestrator(LexiconSource lexicons, WorkerLauncher launcher, List<String> strategies,
                                  TournamentProperties properties, String treeDirectory, TournamentReportWriter writer) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("No strategies entered");
        }
        this.lexicons = lexicons;
        this.launcher = launcher;
        this.strategies = List.copyOf(strategies);
        this.properties = properties;
        this.treeDirectory = treeDirectory;
        this.writer = writer;
        List<ProbabilityMode> modes = new ArrayList<>();
        for (String mode : properties.getModes()) {
            modes.add(ProbabilityMode.fromKey(mode));
        }
        this.rounds = RoundSpec.matrix(properties.getWordLengths(), modes);
    }

    public RunStatus status() {
        return status;
    }

    public List<RoundSpec> rounds() {
        return rounds;
    }

    /**
     * Plays the whole tournament.
     *
     * @throws IOException if a word list cannot be read or the report cannot be written
     */
    public TournamentReport run() throws IOException {
        long masterSeed = properties.getSeed() != null ? properties.getSeed() : new Random().nextInt(Integer.MAX_VALUE);
        Random master = new Random(masterSeed);
        String tournamentId = LocalDateTime.now().format(RUN_ID);
        int repetitions = Math.max(1, properties.getRepetitions());
        int workers = workers();

        status.start(tournamentId, rounds.size() * repetitions);
        log.info("Tournament {}: {} strategies, {} round(s) x {} repetition(s), {} workers, timeout {}s/game, shock {}",
                tournamentId, strategies.size(), rounds.size(), repetitions, workers,
                properties.getGameTimeoutSeconds(), properties.getShock());

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<RoundResult> results = new ArrayList<>();
            for (int rep = 1; rep <= repetitions; rep++) {
                for (RoundSpec spec : rounds) {
                    long roundSeed = master.nextInt(Integer.MAX_VALUE);
                    String roundId = spec.roundId(rep, repetitions);
                    status.roundStarted(roundId);
                    results.add(playRound(executor, spec, roundId, rep, roundSeed));
                    status.roundCompleted();
                }
            }

            List<LeaderboardEntry> leaderboard = Leaderboard.compute(results);
            TournamentReport report = new TournamentReport(tournamentId, LocalDateTime.now().toString(),
                    config(tournamentId, masterSeed, repetitions), results, leaderboard);
            if (writer != null) {
                writer.write(report);
            }
            status.finish();
            return report;
        } catch (IOException | RuntimeException e) {
            status.fail(e.getMessage());
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }

    RoundResult playRound(ExecutorService executor, RoundSpec spec, String roundId, int repetition, long roundSeed)
            throws IOException {
        Lexicon lexicon = lexicons.load(spec.wordLength(), spec.mode());
        if (properties.getShock() > 0.0 && spec.mode() == ProbabilityMode.FREQUENCY) {
            lexicon = lexicon.withDistribution(lexicon.distribution().perturb(properties.getShock(), roundSeed));
        }
        List<String> secrets = secrets(lexicon.vocabulary().words(), properties.getNumGames(), roundSeed);
        log.info("Round {}: {} words, {} secrets, seed {}", roundId, lexicon.vocabulary().size(), secrets.size(), roundSeed);

        CompletionService<StrategyRun> completion = new ExecutorCompletionService<>(executor);
        for (String strategy : strategies) {
            WorkerJob job = WorkerJob.of(strategy, roundId, lexicon, secrets, properties.getMaxGuesses(),
                    properties.isAllowNonWords(), properties.getGameTimeoutSeconds(), treeDirectory);
            completion.submit(() -> runWorker(job));
        }

        Map<String, StrategyRun> runs = new LinkedHashMap<>();
        for (int i = 0; i < strategies.size(); i++) {
            StrategyRun run = take(completion);
            runs.put(run.strategy(), run);
            if (run.error() != null) {
                log.warn("  {} FAILED: {}", run.strategy(), run.error());
            } else {
                StrategyRoundStats stats = run.stats();
                log.info("  {} done: {}/{} solved, mean {}{}", run.strategy(), stats.gamesSolved(), stats.gamesPlayed(),
                        String.format("%.2f", stats.meanGuesses()),
                        stats.timedOut() > 0 ? ", timeouts: " + stats.timedOut() : "");
            }
        }

        List<StrategyRoundStats> stats = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String strategy : strategies) {
            StrategyRun run = runs.get(strategy);
            if (run.error() != null) {
                failed.put(strategy, run.error());
            } else if (run.stats() != null) {
                stats.add(run.stats());
            }
        }
        return new RoundResult(roundId, spec.wordLength(), spec.mode().key(), repetition, roundSeed, secrets.size(),
                secrets, stats, failed);
    }

    private StrategyRun runWorker(WorkerJob job) throws InterruptedException {
        try {
            List<GameOutcome> outcomes = launcher.run(job);
            if (outcomes.size() != job.getSecrets().size()) {
                return new StrategyRun(job.getStrategy(), null, "Worker returned " + outcomes.size()
                        + " results for " + job.getSecrets().size() + " secrets");
            }
            StrategyRoundStats stats = outcomes.isEmpty() ? null : StrategyRoundStats.of(job.getStrategy(), outcomes);
            return new StrategyRun(job.getStrategy(), stats, null);
        } catch (WorkerFailedException e) {
            return new StrategyRun(job.getStrategy(), null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Worker for {} crashed", job.getStrategy(), e);
            return new StrategyRun(job.getStrategy(), null, e.toString());
        }
    }

    /**
     * The whole vocabulary, or a seeded sample of {@code numGames} secrets when that is smaller.
     */
    static List<String> secrets(List<String> vocabulary, Integer numGames, long seed) {
        List<String> secrets = new ArrayList<>(vocabulary);
        if (numGames != null && numGames < secrets.size()) {
            Collections.shuffle(secrets, new Random(seed));
            secrets = new ArrayList<>(secrets.subList(0, Math.max(0, numGames)));
        }
        return secrets;
    }

    private int workers() {
        if (properties.getWorkers() > 0) {
            return properties.getWorkers();
        }
        return Math.max(1, Math.min(strategies.size(), Math.min(Runtime.getRuntime().availableProcessors(), 4)));
    }

    private Map<String, Object> config(String tournamentId, long masterSeed, int repetitions) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("tournament_id", tournamentId);
        config.put("name", properties.getName());
        config.put("master_seed", masterSeed);
        config.put("num_games", properties.getNumGames());
        config.put("repetitions", repetitions);
        config.put("shock_scale", properties.getShock());
        config.put("game_timeout", properties.getGameTimeoutSeconds());
        config.put("max_guesses", properties.getMaxGuesses());
        config.put("allow_non_words", properties.isAllowNonWords());
        config.put("isolation", properties.getIsolation());
        config.put("strategies", strategies);
        List<Map<String, Object>> roundConfig = new ArrayList<>();
        for (RoundSpec spec : rounds) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("word_length", spec.wordLength());
            entry.put("mode", spec.mode().key());
            roundConfig.add(entry);
        }
        config.put("rounds", roundConfig);
        return config;
    }

    private static StrategyRun take(CompletionService<StrategyRun> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Worker task failed", e.getCause());
        }
    }

    /** One strategy's round: stats on success, the reason otherwise. */
    private record StrategyRun(String strategy, StrategyRoundStats stats, String error) {
    }
}
