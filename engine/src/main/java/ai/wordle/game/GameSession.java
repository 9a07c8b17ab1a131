package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * One game's mutable state: the secret, the ordered guess history and the lifecycle state.
 * <p>
 * Lifecycle: {@link State#NOT_STARTED} → {@link State#ACTIVE} → {@link State#SOLVED} or
 * {@link State#EXHAUSTED}; both end states are terminal until the next {@link #reset()}.
 * <p>
 * A session is owned by the caller that created it and is not thread-safe. The secret is
 * only readable once the game is over so a strategy handed the session cannot peek.
 */
public class GameSession {

    /** Lifecycle of a single game. */
    public enum State {
        NOT_STARTED,
        ACTIVE,
        SOLVED,
        EXHAUSTED;

        public boolean isTerminal() {
            return this == SOLVED || this == EXHAUSTED;
        }
    }

    private final Vocabulary vocabulary;
    private final int maxGuesses;
    private final boolean allowNonWords;
    private final Random random;

    private final List<Turn> history = new ArrayList<>();
    private String secret;
    private State state = State.NOT_STARTED;

    public GameSession(Vocabulary vocabulary, int maxGuesses, boolean allowNonWords, Random random) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        if (maxGuesses < 1) {
            throw new IllegalArgumentException("maxGuesses must be >= 1: " + maxGuesses);
        }
        this.maxGuesses = maxGuesses;
        this.allowNonWords = allowNonWords;
        this.random = Objects.requireNonNull(random, "random");
    }

    public GameSession(GameConfig config, Random random) {
        this(config.vocabulary(), config.maxGuesses(), config.allowNonWords(), random);
    }

    /**
     * Starts a new game with a secret drawn uniformly at random from the vocabulary.
     */
    public void reset() {
        start(vocabulary.get(random.nextInt(vocabulary.size())));
    }

    /**
     * Starts a new game with the given secret.
     *
     * @throws InvalidGuessException if the secret is not in the vocabulary
     */
    public void reset(String secret) {
        if (secret == null) {
            reset();
            return;
        }
        if (!vocabulary.contains(secret)) {
            throw new InvalidGuessException("Secret '" + secret + "' is not in the vocabulary");
        }
        start(secret);
    }

    private void start(String chosen) {
        this.secret = chosen;
        this.history.clear();
        this.state = State.ACTIVE;
    }

    /**
     * Submits a guess and returns its feedback.
     *
     * @throws GameStateException    if the game is not active
     * @throws InvalidGuessException if the word has the wrong length, or is outside the
     *                               vocabulary while non-words are not allowed
     */
    public FeedbackPattern guess(String word) {
        if (state == State.NOT_STARTED) {
            throw new GameStateException("Call reset() before guessing");
        }
        if (state.isTerminal()) {
            throw new GameStateException("Game is already over (" + state + ")");
        }
        if (word == null) {
            throw new InvalidGuessException("Guess cannot be null");
        }
        String normalized = word.toLowerCase(Locale.ROOT);
        if (normalized.length() != vocabulary.wordLength()) {
            throw new InvalidGuessException("Guess length (" + normalized.length()
                    + ") != word length (" + vocabulary.wordLength() + ")");
        }
        if (!allowNonWords && !vocabulary.contains(normalized)) {
            throw new InvalidGuessException("'" + normalized + "' is not in the vocabulary");
        }

        FeedbackPattern pattern = WordleRules.feedback(secret, normalized);
        history.add(new Turn(normalized, pattern));
        if (normalized.equals(secret)) {
            state = State.SOLVED;
        } else if (history.size() >= maxGuesses) {
            state = State.EXHAUSTED;
        }
        return pattern;
    }

    /**
     * Reveals the secret.
     *
     * @throws GameStateException while the game is not over
     */
    public String secret() {
        if (!state.isTerminal()) {
            throw new GameStateException("Secret is only available once the game is over (state " + state + ")");
        }
        return secret;
    }

    /**
     * Immutable snapshot of the guesses so far.
     */
    public List<Turn> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public State state() {
        return state;
    }

    public boolean isSolved() {
        return state == State.SOLVED;
    }

    public boolean isOver() {
        return state.isTerminal();
    }

    public int guessCount() {
        return history.size();
    }

    public int remainingGuesses() {
        return maxGuesses - history.size();
    }

    public int maxGuesses() {
        return maxGuesses;
    }

    public int wordLength() {
        return vocabulary.wordLength();
    }
}
