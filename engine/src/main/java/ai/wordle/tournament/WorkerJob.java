package ai.wordle.tournament;

import ai.wordle.game.GameConfig;
import ai.wordle.game.Lexicon;
import ai.wordle.game.ProbabilityDistribution;
import ai.wordle.game.ProbabilityMode;
import ai.wordle.game.Vocabulary;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a worker needs to play one strategy through one round.
 * <p>
 * This is the document a forked worker JVM reads from its standard input, so it carries the
 * round's vocabulary and (possibly perturbed) probabilities by value rather than re-reading the
 * word lists.
 */
public class WorkerJob {

    @JsonProperty("strategy")
    private String strategy;

    @JsonProperty("round_id")
    private String roundId;

    @JsonProperty("word_length")
    private int wordLength;

    @JsonProperty("mode")
    private String mode;

    /** Vocabulary in order. */
    @JsonProperty("words")
    private List<String> words = new ArrayList<>();

    /** Probability of each word, aligned with {@link #words}. */
    @JsonProperty("probabilities")
    private List<Double> probabilities = new ArrayList<>();

    @JsonProperty("max_guesses")
    private int maxGuesses;

    @JsonProperty("allow_non_words")
    private boolean allowNonWords;

    @JsonProperty("game_timeout_seconds")
    private double gameTimeoutSeconds;

    /** Secrets still to play, in order. */
    @JsonProperty("secrets")
    private List<String> secrets = new ArrayList<>();

    /** Where the strategy may look for precomputed trees; null for none. */
    @JsonProperty("tree_directory")
    private String treeDirectory;

    /**
     * Default constructor for JSON binding.
     */
    public WorkerJob() {
    }

    /**
     * Job for one strategy in one round.
     */
    public static WorkerJob of(String strategy, String roundId, Lexicon lexicon, List<String> secrets,
                               int maxGuesses, boolean allowNonWords, double gameTimeoutSeconds, String treeDirectory) {
        WorkerJob job = new WorkerJob();
        job.strategy = strategy;
        job.roundId = roundId;
        job.wordLength = lexicon.wordLength();
        job.mode = lexicon.mode().key();
        Vocabulary vocabulary = lexicon.vocabulary();
        for (int i = 0; i < vocabulary.size(); i++) {
            job.words.add(vocabulary.get(i));
            job.probabilities.add(lexicon.distribution().probabilityAt(i));
        }
        job.maxGuesses = maxGuesses;
        job.allowNonWords = allowNonWords;
        job.gameTimeoutSeconds = gameTimeoutSeconds;
        job.secrets = new ArrayList<>(secrets);
        job.treeDirectory = treeDirectory;
        return job;
    }

    /**
     * Same job restricted to the given secrets; used to relaunch a worker for the games it has
     * not played yet.
     */
    public WorkerJob withSecrets(List<String> remaining) {
        WorkerJob copy = new WorkerJob();
        copy.strategy = strategy;
        copy.roundId = roundId;
        copy.wordLength = wordLength;
        copy.mode = mode;
        copy.words = words;
        copy.probabilities = probabilities;
        copy.maxGuesses = maxGuesses;
        copy.allowNonWords = allowNonWords;
        copy.gameTimeoutSeconds = gameTimeoutSeconds;
        copy.secrets = new ArrayList<>(remaining);
        copy.treeDirectory = treeDirectory;
        return copy;
    }

    /**
     * Rebuilds the game configuration the strategy is handed.
     *
     * @throws IllegalArgumentException if the words and probabilities are inconsistent
     */
    public GameConfig toGameConfig() {
        if (words.size() != probabilities.size()) {
            throw new IllegalArgumentException("Job has " + words.size() + " words but "
                    + probabilities.size() + " probabilities");
        }
        Vocabulary vocabulary = Vocabulary.of(wordLength, words);
        Map<String, Double> byWord = new LinkedHashMap<>();
        for (int i = 0; i < words.size(); i++) {
            byWord.put(words.get(i), probabilities.get(i));
        }
        return new GameConfig(wordLength, vocabulary, ProbabilityMode.fromKey(mode),
                ProbabilityDistribution.fromMap(vocabulary, byWord), maxGuesses, allowNonWords);
    }

    public long gameTimeoutMillis() {
        return Math.max(1L, Math.round(gameTimeoutSeconds * 1000.0));
    }

    public String getStrategy() {
        return strategy;
    }

    public String getRoundId() {
        return roundId;
    }

    public int getWordLength() {
        return wordLength;
    }

    public String getMode() {
        return mode;
    }

    public List<String> getWords() {
        return words;
    }

    public List<Double> getProbabilities() {
        return probabilities;
    }

    public int getMaxGuesses() {
        return maxGuesses;
    }

    public boolean isAllowNonWords() {
        return allowNonWords;
    }

    public double getGameTimeoutSeconds() {
        return gameTimeoutSeconds;
    }

    public List<String> getSecrets() {
        return secrets;
    }

    public String getTreeDirectory() {
        return treeDirectory;
    }
}
