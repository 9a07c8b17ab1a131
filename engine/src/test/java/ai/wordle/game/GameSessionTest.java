package ai.wordle.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import org.junit.jupiter.api.Test;

class GameSessionTest {

    private static final Vocabulary WORDS = Vocabulary.of(4, "casa", "cosa", "mesa", "rosa");

    private static GameSession session(int maxGuesses, boolean allowNonWords) {
        return new GameSession(WORDS, maxGuesses, allowNonWords, new Random(1L));
    }

    @Test
    void guessBeforeReset_isAStateError() {
        assertThrows(GameStateException.class, () -> session(6, true).guess("casa"));
    }

    @Test
    void correctGuess_solvesTheGame() {
        GameSession session = session(6, true);
        session.reset("mesa");
        assertFalse(session.guess("casa").isAllGreen());
        assertTrue(session.guess("MESA").isAllGreen());
        assertEquals(GameSession.State.SOLVED, session.state());
        assertEquals(2, session.guessCount());
        assertEquals("mesa", session.secret());
        assertEquals("mesa", session.history().get(1).guess());
    }

    @Test
    void runningOutOfGuesses_exhaustsTheGame() {
        GameSession session = session(2, true);
        session.reset("rosa");
        session.guess("casa");
        session.guess("cosa");
        assertEquals(GameSession.State.EXHAUSTED, session.state());
        assertThrows(GameStateException.class, () -> session.guess("rosa"));
    }

    @Test
    void secret_isHiddenWhileTheGameIsActive() {
        GameSession session = session(6, true);
        session.reset("casa");
        assertThrows(GameStateException.class, session::secret);
    }

    @Test
    void nonWords_dependOnTheConfiguration() {
        GameSession strict = session(6, false);
        strict.reset("casa");
        assertThrows(InvalidGuessException.class, () -> strict.guess("zzzz"));
        assertEquals(0, strict.guessCount());

        GameSession lenient = session(6, true);
        lenient.reset("casa");
        assertEquals("0002", lenient.guess("zzza").toString());
    }

    @Test
    void wrongLengthGuess_isRejected() {
        GameSession session = session(6, true);
        session.reset("casa");
        assertThrows(InvalidGuessException.class, () -> session.guess("casas"));
    }

    @Test
    void secretOutsideVocabulary_isRejected() {
        assertThrows(InvalidGuessException.class, () -> session(6, true).reset("pato"));
    }

    @Test
    void reset_startsAFreshGame() {
        GameSession session = session(6, true);
        session.reset("casa");
        session.guess("casa");
        session.reset();
        assertEquals(GameSession.State.ACTIVE, session.state());
        assertEquals(0, session.guessCount());
        assertEquals(6, session.remainingGuesses());
    }
}
