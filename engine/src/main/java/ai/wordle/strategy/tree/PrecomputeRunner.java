package ai.wordle.strategy.tree;

import ai.wordle.config.PrecomputeProperties;
import ai.wordle.config.StrategyProperties;
import ai.wordle.game.Lexicon;
import ai.wordle.game.LexiconLoader;
import ai.wordle.game.ProbabilityMode;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Builds every configured decision tree when the {@code precompute} profile is active.
 * <p>
 * Safe to stop at any point: the next run resumes from the checkpoints and skips trees that
 * are already complete.
 */
@Component
@Profile("precompute")
public class PrecomputeRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PrecomputeRunner.class);

    private final PrecomputeProperties properties;
    private final StrategyProperties strategyProperties;
    private final LexiconLoader lexiconLoader;

    public PrecomputeRunner(PrecomputeProperties properties, StrategyProperties strategyProperties,
                            LexiconLoader lexiconLoader) {
        this.properties = properties;
        this.strategyProperties = strategyProperties;
        this.lexiconLoader = lexiconLoader;
    }

    @Override
    public void run(String... args) throws Exception {
        TreeCheckpointStore store = new TreeCheckpointStore(Path.of(strategyProperties.getTreeDirectory()));
        DecisionTreeBuilder builder = new DecisionTreeBuilder(store, properties.getMaxDepth(),
                properties.getMinCandidates(), properties.effectiveWorkers(), properties.getCheckpointEvery())
                .withListener(new DecisionTreeBuilder.BuildListener() {
                    @Override
                    public void onDepthComplete(int depth, int nodes) {
                        log.info("  depth {} done: {} node(s)", depth, nodes);
                    }
                });

        log.info("Precomputing {} x {} tree(s) into {}", properties.getWordLengths(), properties.getModes(),
                store.directory());
        for (int wordLength : properties.getWordLengths()) {
            for (String modeKey : properties.getModes()) {
                ProbabilityMode mode = ProbabilityMode.fromKey(modeKey);
                Lexicon lexicon = lexiconLoader.load(wordLength, mode);
                DecisionTree tree = builder.build(lexicon);
                log.info("{} ready at {}", tree, store.treePath(wordLength, mode));
            }
        }
    }
}
