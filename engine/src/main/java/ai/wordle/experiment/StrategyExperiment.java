package ai.wordle.experiment;

import ai.wordle.experiment.ExperimentReport.GameTrace;
import ai.wordle.experiment.ExperimentReport.StepTrace;
import ai.wordle.experiment.ExperimentReport.Summary;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.GameConfig;
import ai.wordle.game.GameSession;
import ai.wordle.game.Lexicon;
import ai.wordle.game.WordleRules;
import ai.wordle.strategy.Strategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays one strategy on a seeded sample of secrets and records every step: the guess, its
 * feedback, how many candidates remain and how many bits of uncertainty that leaves.
 * <p>
 * Unlike a tournament this runs in the calling thread with no time limit, which makes it the
 * tool for looking at what a strategy actually does.
 */
public class StrategyExperiment {

    private static final Logger log = LoggerFactory.getLogger(StrategyExperiment.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Lexicon lexicon;
    private final int maxGuesses;
    private final boolean allowNonWords;

    public StrategyExperiment(Lexicon lexicon, int maxGuesses, boolean allowNonWords) {
        this.lexicon = lexicon;
        this.maxGuesses = maxGuesses;
        this.allowNonWords = allowNonWords;
    }

    /**
     * Plays {@code numGames} secrets sampled without replacement with {@code seed}.
     */
    public ExperimentReport run(Strategy strategy, int numGames, long seed) {
        List<String> words = lexicon.vocabulary().words();
        List<String> secrets = new ArrayList<>(words);
        Collections.shuffle(secrets, new Random(seed));
        secrets = secrets.subList(0, Math.min(numGames, secrets.size()));

        GameConfig config = GameConfig.of(lexicon, maxGuesses, allowNonWords);
        GameSession session = new GameSession(config, new Random(seed));
        List<GameTrace> games = new ArrayList<>();
        int solved = 0;
        long guesses = 0;

        for (int i = 0; i < secrets.size(); i++) {
            String secret = secrets.get(i);
            session.reset(secret);
            strategy.beginGame(config);
            List<String> candidates = words;
            List<StepTrace> steps = new ArrayList<>();
            while (!session.isOver()) {
                String word = strategy.guess(session.history());
                FeedbackPattern pattern = session.guess(word);
                candidates = WordleRules.filterCandidates(candidates, word, pattern);
                steps.add(new StepTrace(word, pattern.toString(), candidates.size(), bits(candidates.size())));
            }
            strategy.endGame(secret, session.isSolved(), session.guessCount());

            games.add(new GameTrace(i + 1, secret, session.isSolved(), session.guessCount(), steps));
            guesses += session.guessCount();
            if (session.isSolved()) {
                solved++;
            }
            if (log.isDebugEnabled()) {
                log.debug("Game {}/{} '{}': {} in {} guesses", i + 1, secrets.size(), secret,
                        session.isSolved() ? "SOLVED" : "FAILED", session.guessCount());
            }
        }

        int n = games.size();
        Summary summary = new Summary(n, solved, n == 0 ? 0.0 : (double) solved / n, n == 0 ? 0.0 : (double) guesses / n);
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("word_length", lexicon.wordLength());
        settings.put("mode", lexicon.mode().key());
        settings.put("max_guesses", maxGuesses);
        settings.put("num_games", numGames);
        settings.put("seed", seed);
        return new ExperimentReport(strategy.name(), settings, summary, games);
    }

    public static void write(ExperimentReport report, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        OBJECT_MAPPER.writeValue(file.toFile(), report);
    }

    static double bits(int remaining) {
        return remaining > 1 ? Math.log(remaining) / Math.log(2.0) : 0.0;
    }
}
