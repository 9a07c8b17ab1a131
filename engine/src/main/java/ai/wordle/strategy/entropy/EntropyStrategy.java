package ai.wordle.strategy.entropy;

import ai.wordle.game.GameConfig;
import ai.wordle.game.ProbabilityDistribution;
import ai.wordle.game.ProbabilityMode;
import ai.wordle.game.Turn;
import ai.wordle.strategy.CandidateStrategy;
import ai.wordle.strategy.tree.DecisionTree;
import ai.wordle.strategy.tree.FeedbackPath;
import ai.wordle.strategy.tree.TreeCheckpointStore;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the guess that maximizes the expected information of the feedback.
 * <p>
 * Each turn the candidates are recomputed from the full vocabulary. If a precomputed
 * {@link DecisionTree} covers the (word length, mode) of the game and has an entry for the exact
 * feedback path, that guess is returned straight away. Otherwise a live search runs:
 * <ul>
 *   <li>no candidates left (inconsistent history): the first vocabulary word;</li>
 *   <li>one or two candidates: the first of them;</li>
 *   <li>otherwise every word of the guess pool is scored against the evaluation set with
 *       {@link EntropyScorer}, weighted by the candidates' probability mass.</li>
 * </ul>
 * The pool is the candidates themselves, sampled down to {@link #POOL_LIMIT} words; the
 * evaluation set is sampled down to {@link #EVALUATION_LIMIT}. Sampling uses a per-game RNG
 * reseeded in {@link #beginGame(GameConfig)}, so a game is reproducible for a given secret.
 */
public class EntropyStrategy extends CandidateStrategy {

    private static final Logger log = LoggerFactory.getLogger(EntropyStrategy.class);

    public static final String NAME = "Entropy";

    /** Maximum number of guesses scored per turn. */
    public static final int POOL_LIMIT = 200;

    /** Maximum number of secrets each guess is scored against. */
    public static final int EVALUATION_LIMIT = 500;

    static final long GAME_SEED = 42L;

    private static final Pattern TREE_FILE = Pattern.compile("^tree_(\\d+)_([a-z]+)\\.json$");

    private final Map<String, DecisionTree> trees = new HashMap<>();

    private Random rng = new Random(GAME_SEED);
    private EntropyScorer scorer;
    private int scorerLength;
    private DecisionTree activeTree;

    /**
     * Live search only.
     */
    public EntropyStrategy() {
    }

    /**
     * Loads every {@code tree_<L>_<mode>.json} found in the directory. Trees that cannot be read
     * are skipped with a warning and the affected configurations fall back to live search.
     *
     * @param treeDirectory directory of precomputed trees; null or missing means none
     */
    public EntropyStrategy(Path treeDirectory) {
        if (treeDirectory != null && Files.isDirectory(treeDirectory)) {
            loadTrees(treeDirectory);
        }
    }

    /**
     * Uses the given trees directly.
     */
    public EntropyStrategy(Collection<DecisionTree> trees) {
        for (DecisionTree tree : trees) {
            this.trees.put(treeKey(tree.wordLength(), tree.mode()), tree);
        }
    }

    private void loadTrees(Path treeDirectory) {
        TreeCheckpointStore store = new TreeCheckpointStore(treeDirectory);
        try (DirectoryStream<Path> files = Files.newDirectoryStream(treeDirectory, "tree_*.json")) {
            for (Path file : files) {
                Matcher m = TREE_FILE.matcher(file.getFileName().toString());
                if (!m.matches()) {
                    continue;
                }
                try {
                    int wordLength = Integer.parseInt(m.group(1));
                    ProbabilityMode mode = ProbabilityMode.fromKey(m.group(2));
                    Optional<DecisionTree> tree = store.loadTree(wordLength, mode);
                    tree.ifPresent(t -> trees.put(treeKey(wordLength, mode), t));
                    if (log.isDebugEnabled() && tree.isPresent()) {
                        log.debug("Loaded decision tree {} ({} nodes)", file.getFileName(), tree.get().size());
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Skipping unreadable decision tree {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list decision trees in {}: {}", treeDirectory, e.getMessage());
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void beginGame(GameConfig config) {
        super.beginGame(config);
        this.rng = new Random(GAME_SEED);
        if (scorer == null || scorerLength != config.wordLength()) {
            this.scorer = new EntropyScorer(config.wordLength());
            this.scorerLength = config.wordLength();
        }
        this.activeTree = trees.get(treeKey(config.wordLength(), config.mode()));
    }

    @Override
    public String guess(List<Turn> history) {
        List<String> candidates = candidates(history);

        if (activeTree != null) {
            Optional<String> precomputed = activeTree.guessAt(FeedbackPath.ofHistory(history));
            if (precomputed.isPresent()) {
                return precomputed.get();
            }
        }

        if (candidates.isEmpty()) {
            return config.vocabulary().get(0);
        }
        if (candidates.size() <= 2) {
            return candidates.get(0);
        }

        List<String> pool = sample(candidates, POOL_LIMIT);
        List<String> secrets = sample(candidates, EVALUATION_LIMIT);
        double[] weights = weights(secrets, config.probabilities());

        ScoredGuess best = scorer.best(pool, secrets, weights, new HashSet<>(candidates));
        if (log.isTraceEnabled()) {
            log.trace("Turn {}: {} candidates, best {} ({} bits)", history.size() + 1, candidates.size(),
                    best.guess(), best.entropy());
        }
        return best.guess();
    }

    /**
     * Trees currently available, keyed by {@code <L>_<mode>}.
     */
    public Map<String, DecisionTree> trees() {
        return trees;
    }

    /**
     * The list itself when it is small enough, otherwise a uniform sample without replacement.
     */
    private List<String> sample(List<String> words, int limit) {
        if (words.size() <= limit) {
            return words;
        }
        List<String> shuffled = new ArrayList<>(words);
        // Partial Fisher-Yates: the first `limit` slots end up a uniform sample.
        for (int i = 0; i < limit; i++) {
            int j = i + rng.nextInt(shuffled.size() - i);
            String tmp = shuffled.get(i);
            shuffled.set(i, shuffled.get(j));
            shuffled.set(j, tmp);
        }
        return new ArrayList<>(shuffled.subList(0, limit));
    }

    static double[] weights(List<String> words, ProbabilityDistribution probabilities) {
        double[] weights = new double[words.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = probabilities.probability(words.get(i));
        }
        return weights;
    }

    private static String treeKey(int wordLength, ProbabilityMode mode) {
        return wordLength + "_" + mode.key();
    }
}
