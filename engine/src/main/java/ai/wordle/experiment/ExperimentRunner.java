package ai.wordle.experiment;

import ai.wordle.config.ExperimentProperties;
import ai.wordle.game.Lexicon;
import ai.wordle.game.LexiconLoader;
import ai.wordle.game.ProbabilityMode;
import ai.wordle.strategy.Strategy;
import ai.wordle.strategy.StrategyRegistry;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs a single-strategy experiment when the {@code experiment} profile is active.
 */
@Component
@Profile("experiment")
public class ExperimentRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ExperimentRunner.class);

    private final ExperimentProperties properties;
    private final StrategyRegistry registry;
    private final LexiconLoader lexiconLoader;

    public ExperimentRunner(ExperimentProperties properties, StrategyRegistry registry, LexiconLoader lexiconLoader) {
        this.properties = properties;
        this.registry = registry;
        this.lexiconLoader = lexiconLoader;
    }

    @Override
    public void run(String... args) throws Exception {
        Lexicon lexicon = lexiconLoader.load(properties.getWordLength(), ProbabilityMode.fromKey(properties.getMode()));
        Strategy strategy = registry.create(properties.getStrategy());
        log.info("Experiment: {} on {} {}-letter words ({}), {} games", strategy.name(), lexicon.vocabulary().size(),
                lexicon.wordLength(), lexicon.mode(), properties.getNumGames());

        ExperimentReport report = new StrategyExperiment(lexicon, properties.getMaxGuesses(), properties.isAllowNonWords())
                .run(strategy, properties.getNumGames(), properties.getSeed());
        ExperimentReport.Summary summary = report.summary();
        log.info("{}: solved {}/{} ({}%), mean guesses {}", strategy.name(), summary.solved(), summary.games(),
                String.format("%.1f", summary.solveRate() * 100.0), String.format("%.2f", summary.meanGuesses()));

        Path output = Path.of(properties.getOutput());
        StrategyExperiment.write(report, output);
        log.info("Trace written to {}", output);
    }
}
