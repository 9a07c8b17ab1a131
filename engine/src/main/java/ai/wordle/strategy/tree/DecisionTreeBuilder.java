package ai.wordle.strategy.tree;

import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Lexicon;
import ai.wordle.game.ProbabilityMode;
import ai.wordle.game.Vocabulary;
import ai.wordle.game.WordleRules;
import ai.wordle.strategy.entropy.EntropyScorer;
import ai.wordle.strategy.entropy.ScoredGuess;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the feedback-path to best-guess map for one (word length, mode), in parallel and
 * resumably.
 * <p>
 * Work proceeds breadth-first by depth:
 * <ul>
 *   <li><b>Root</b>: the whole vocabulary is both guess pool and candidate set. The pool is cut
 *       into contiguous chunks, each chunk's best guess is computed on a worker, and the chunk
 *       winners are reduced in chunk order with {@link ScoredGuess#beats(ScoredGuess)}, so the
 *       result does not depend on which worker finished first.</li>
 *   <li><b>Deeper levels</b>: a computed node's candidates are partitioned by the feedback of its
 *       guess; every child with more than {@code minCandidates} words is pending at the next
 *       depth. All pending nodes of a depth run in parallel, each scoring its own candidates as
 *       the guess pool.</li>
 * </ul>
 * Nodes at {@code maxDepth} are computed but not expanded.
 * <p>
 * Only the calling thread touches the checkpoint. It is written after the root, every
 * {@code checkpointEvery} completed nodes, and at the end of every depth. On restart the pending
 * set is rebuilt by walking the checkpoint from the root, so checkpointed nodes are never
 * recomputed. When nothing is pending the tree is saved as {@code tree_<L>_<mode>.json} and the
 * checkpoint is removed. If that file already exists the build is skipped.
 */
public class DecisionTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeBuilder.class);

    static final int MIN_ROOT_CHUNK = 50;

    /**
     * Progress callbacks, invoked on the building thread. An exception thrown from a callback
     * aborts the build; whatever was checkpointed so far is kept.
     */
    public interface BuildListener {

        default void onRootComplete(ScoredGuess root) {
        }

        default void onNodeComputed(FeedbackPath path, String guess, int candidates) {
        }

        default void onDepthComplete(int depth, int nodes) {
        }
    }

    private final TreeCheckpointStore store;
    private final int maxDepth;
    private final int minCandidates;
    private final int workers;
    private final int checkpointEvery;
    private BuildListener listener = new BuildListener() {
    };

    public DecisionTreeBuilder(TreeCheckpointStore store, int maxDepth, int minCandidates, int workers, int checkpointEvery) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        if (checkpointEvery < 1) {
            throw new IllegalArgumentException("checkpointEvery must be >= 1: " + checkpointEvery);
        }
        this.store = store;
        this.maxDepth = maxDepth;
        this.minCandidates = minCandidates;
        this.workers = workers;
        this.checkpointEvery = checkpointEvery;
    }

    public DecisionTreeBuilder withListener(BuildListener listener) {
        this.listener = listener;
        return this;
    }

    /**
     * Builds (or resumes, or returns the already finished) tree for the lexicon's configuration.
     *
     * @throws CheckpointCorruptedException if an existing checkpoint cannot be trusted
     * @throws IOException                  if checkpoint or tree files cannot be written
     */
    public DecisionTree build(Lexicon lexicon) throws IOException {
        int wordLength = lexicon.wordLength();
        ProbabilityMode mode = lexicon.mode();

        Optional<DecisionTree> finished = store.loadTree(wordLength, mode);
        if (finished.isPresent()) {
            log.info("Tree {}_{} already complete ({} nodes), skipping", wordLength, mode.key(), finished.get().size());
            return finished.get();
        }

        Map<FeedbackPath, String> nodes = new TreeMap<>(store.loadCheckpoint(wordLength, mode));
        Map<String, Double> weights = weights(lexicon);
        log.info("Building tree {}_{}: {} words, {} nodes checkpointed, maxDepth={}, minCandidates={}, workers={}",
                wordLength, mode.key(), lexicon.vocabulary().size(), nodes.size(), maxDepth, minCandidates, workers);

        long start = System.currentTimeMillis();
        ExecutorService executor = Executors.newFixedThreadPool(workers, new BuilderThreadFactory());
        try {
            while (true) {
                List<PendingNode> pending = pending(nodes, lexicon.vocabulary());
                if (pending.isEmpty()) {
                    break;
                }
                int depth = pending.get(0).path().depth();
                List<PendingNode> level = new ArrayList<>();
                for (PendingNode node : pending) {
                    if (node.path().depth() == depth) {
                        level.add(node);
                    }
                }
                if (depth == 0) {
                    computeRoot(level.get(0), weights, executor, nodes, lexicon);
                } else {
                    computeLevel(depth, level, weights, executor, nodes, lexicon);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        DecisionTree tree = new DecisionTree(wordLength, mode, nodes);
        store.saveTree(tree);
        store.deleteCheckpoint(wordLength, mode);
        log.info("Tree {}_{} complete: {} nodes in {} ms", wordLength, mode.key(), tree.size(),
                System.currentTimeMillis() - start);
        return tree;
    }

    /**
     * Walks the known part of the tree from the root and returns every node that still needs a
     * guess, shallowest first.
     */
    List<PendingNode> pending(Map<FeedbackPath, String> nodes, Vocabulary vocabulary) {
        List<PendingNode> pending = new ArrayList<>();
        visit(FeedbackPath.ROOT, vocabulary.words(), nodes, pending);
        pending.sort((a, b) -> a.path().compareTo(b.path()));
        return pending;
    }

    private void visit(FeedbackPath path, List<String> candidates, Map<FeedbackPath, String> nodes, List<PendingNode> pending) {
        if (candidates.size() <= 1) {
            return;
        }
        String guess = nodes.get(path);
        if (guess == null) {
            // Children are unknown until this node has a guess.
            pending.add(new PendingNode(path, List.copyOf(candidates)));
            return;
        }
        if (path.depth() >= maxDepth) {
            return;
        }
        for (Map.Entry<FeedbackPattern, List<String>> child : partition(candidates, guess).entrySet()) {
            if (child.getValue().size() > minCandidates) {
                visit(path.append(child.getKey()), child.getValue(), nodes, pending);
            }
        }
    }

    static Map<FeedbackPattern, List<String>> partition(List<String> candidates, String guess) {
        Map<FeedbackPattern, List<String>> children = new LinkedHashMap<>();
        for (String candidate : candidates) {
            children.computeIfAbsent(WordleRules.feedback(candidate, guess), p -> new ArrayList<>()).add(candidate);
        }
        return children;
    }

    private void computeRoot(PendingNode root, Map<String, Double> weights, ExecutorService executor,
                             Map<FeedbackPath, String> nodes, Lexicon lexicon) throws IOException {
        List<String> pool = root.candidates();
        int chunkSize = Math.max(MIN_ROOT_CHUNK, pool.size() / (workers * 4));
        List<Future<ScoredGuess>> chunks = new ArrayList<>();
        for (int from = 0; from < pool.size(); from += chunkSize) {
            List<String> chunk = List.copyOf(pool.subList(from, Math.min(pool.size(), from + chunkSize)));
            chunks.add(executor.submit(new NodeTask(chunk, root.candidates(), weights)));
        }
        log.info("Depth 0: evaluating {} guesses x {} candidates in {} chunks",
                pool.size(), root.candidates().size(), chunks.size());

        ScoredGuess best = null;
        int done = 0;
        for (Future<ScoredGuess> chunk : chunks) {
            best = ScoredGuess.better(best, await(chunk));
            done++;
            if (log.isDebugEnabled()) {
                log.debug("Root chunk {}/{}: best so far {} (H={})", done, chunks.size(), best.guess(), best.entropy());
            }
        }

        nodes.put(FeedbackPath.ROOT, best.guess());
        store.saveCheckpoint(lexicon.wordLength(), lexicon.mode(), nodes);
        log.info("Root guess {} (H={})", best.guess(), String.format("%.4f", best.entropy()));
        listener.onRootComplete(best);
        listener.onDepthComplete(0, 1);
    }

    private void computeLevel(int depth, List<PendingNode> level, Map<String, Double> weights, ExecutorService executor,
                              Map<FeedbackPath, String> nodes, Lexicon lexicon) throws IOException {
        log.info("Depth {}: {} node(s)", depth, level.size());
        CompletionService<ScoredGuess> completion = new ExecutorCompletionService<>(executor);
        Map<Future<ScoredGuess>, PendingNode> submitted = new LinkedHashMap<>();
        for (PendingNode node : level) {
            submitted.put(completion.submit(new NodeTask(node.candidates(), node.candidates(), weights)), node);
        }

        int done = 0;
        int sinceCheckpoint = 0;
        while (done < level.size()) {
            Future<ScoredGuess> future = takeNext(completion);
            PendingNode node = submitted.get(future);
            ScoredGuess best = await(future);
            nodes.put(node.path(), best.guess());
            done++;
            sinceCheckpoint++;
            if (sinceCheckpoint >= checkpointEvery) {
                store.saveCheckpoint(lexicon.wordLength(), lexicon.mode(), nodes);
                sinceCheckpoint = 0;
            }
            if (log.isDebugEnabled()) {
                log.debug("[{}/{}] {} cands={} -> {} H={}", done, level.size(), node.path(),
                        node.candidates().size(), best.guess(), best.entropy());
            }
            listener.onNodeComputed(node.path(), best.guess(), node.candidates().size());
        }

        store.saveCheckpoint(lexicon.wordLength(), lexicon.mode(), nodes);
        listener.onDepthComplete(depth, level.size());
    }

    private static Map<String, Double> weights(Lexicon lexicon) {
        Map<String, Double> weights = new LinkedHashMap<>();
        Vocabulary vocabulary = lexicon.vocabulary();
        for (int i = 0; i < vocabulary.size(); i++) {
            weights.put(vocabulary.get(i), lexicon.distribution().probabilityAt(i));
        }
        return weights;
    }

    private static Future<ScoredGuess> takeNext(CompletionService<ScoredGuess> completion) {
        try {
            return completion.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building tree", e);
        }
    }

    private static ScoredGuess await(Future<ScoredGuess> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building tree", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Tree node computation failed", cause);
        }
    }

    /** A node that still needs its guess, with the words that reach it. */
    record PendingNode(FeedbackPath path, List<String> candidates) {
    }

    /**
     * Scores a guess pool against a node's candidates. Inputs are immutable; each task has its
     * own scorer.
     */
    private static final class NodeTask implements Callable<ScoredGuess> {

        private final List<String> pool;
        private final List<String> candidates;
        private final double[] weights;

        NodeTask(List<String> pool, List<String> candidates, Map<String, Double> weightByWord) {
            this.pool = pool;
            this.candidates = candidates;
            this.weights = new double[candidates.size()];
            for (int i = 0; i < candidates.size(); i++) {
                this.weights[i] = weightByWord.get(candidates.get(i));
            }
        }

        @Override
        public ScoredGuess call() {
            Set<String> candidateSet = new HashSet<>(candidates);
            EntropyScorer scorer = new EntropyScorer(candidates.get(0).length());
            return scorer.best(pool, candidates, weights, candidateSet);
        }
    }

    private static final class BuilderThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "tree-builder-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
