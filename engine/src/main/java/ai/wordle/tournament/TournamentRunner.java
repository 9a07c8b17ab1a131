package ai.wordle.tournament;

import ai.wordle.config.StrategyProperties;
import ai.wordle.config.TournamentProperties;
import ai.wordle.game.LexiconLoader;
import ai.wordle.strategy.StrategyRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs a tournament when the {@code tournament} profile is active and logs the leaderboard.
 */
@Component
@Profile("tournament")
public class TournamentRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(TournamentRunner.class);

    private final TournamentProperties properties;
    private final StrategyProperties strategyProperties;
    private final StrategyRegistry registry;
    private final LexiconLoader lexiconLoader;

    public TournamentRunner(TournamentProperties properties, StrategyProperties strategyProperties,
                            StrategyRegistry registry, LexiconLoader lexiconLoader) {
        this.properties = properties;
        this.strategyProperties = strategyProperties;
        this.registry = registry;
        this.lexiconLoader = lexiconLoader;
    }

    @Override
    public void run(String... args) throws Exception {
        TournamentOrchestrator orchestrator = new TournamentOrchestrator(lexiconLoader, launcher(), entrants(),
                properties, strategyProperties.getTreeDirectory(),
                new TournamentReportWriter(Path.of(properties.getOutputDir())));
        TournamentReport report = orchestrator.run();
        printLeaderboard(report.leaderboard());
    }

    WorkerLauncher launcher() {
        String isolation = properties.getIsolation() == null ? "process" : properties.getIsolation().toLowerCase(Locale.ROOT);
        switch (isolation) {
            case "process":
                return new ForkedWorkerLauncher(properties.getMemoryLimitMb());
            case "thread":
                log.warn("Thread isolation: no memory limit, and stuck strategies cannot be killed");
                return new InProcessWorkerLauncher(registry);
            default:
                throw new IllegalArgumentException("tournament.isolation must be 'process' or 'thread', got " + isolation);
        }
    }

    /**
     * Requested strategies in the order given, or every registered one.
     */
    List<String> entrants() {
        if (properties.getStrategies() == null || properties.getStrategies().isEmpty()) {
            return registry.names();
        }
        List<String> entrants = new ArrayList<>();
        for (String requested : properties.getStrategies()) {
            String name = canonical(requested);
            if (name == null) {
                log.warn("Unknown strategy '{}' ignored. Available: {}", requested, registry.names());
            } else if (!entrants.contains(name)) {
                entrants.add(name);
            }
        }
        return entrants;
    }

    private String canonical(String requested) {
        for (String name : registry.names()) {
            if (name.equalsIgnoreCase(requested.trim())) {
                return name;
            }
        }
        return null;
    }

    private static void printLeaderboard(List<LeaderboardEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%n  LEADERBOARD%n  %-6s%-25s%8s%8s%8s%n", "Rank", "Strategy", "Points", "Solve%", "MeanG"));
        for (LeaderboardEntry e : entries) {
            sb.append(String.format("  %-6d%-25s%8.1f%7.1f%%%8.2f%n", e.rank(), e.strategy(), e.totalPoints(),
                    e.overallSolveRate() * 100.0, e.overallMeanGuesses()));
        }
        log.info(sb.toString());
    }
}
