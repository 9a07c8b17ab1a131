package ai.wordle.strategy.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Turn;
import java.util.List;
import org.junit.jupiter.api.Test;

class FeedbackPathTest {

    @Test
    void key_joinsPatternsWithSlashes() {
        FeedbackPath path = FeedbackPath.ROOT.append(FeedbackPattern.parse("20100")).append(FeedbackPattern.parse("00122"));
        assertEquals("20100/00122", path.key());
        assertEquals(2, path.depth());
        assertEquals(path, FeedbackPath.parse("20100/00122", 5));
    }

    @Test
    void emptyKey_isTheRoot() {
        assertSame(FeedbackPath.ROOT, FeedbackPath.parse("", 5));
        assertSame(FeedbackPath.ROOT, FeedbackPath.ofHistory(List.of()));
        assertEquals("", FeedbackPath.ROOT.key());
    }

    @Test
    void history_mapsToThePathOfItsPatterns() {
        List<Turn> history = List.of(new Turn("casa", FeedbackPattern.parse("0120")));
        assertEquals(FeedbackPath.parse("0120", 4), FeedbackPath.ofHistory(history));
    }

    @Test
    void malformedKeys_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> FeedbackPath.parse("2010/20", 4));
        assertThrows(IllegalArgumentException.class, () -> FeedbackPath.parse("2010/", 4));
        assertThrows(IllegalArgumentException.class, () -> FeedbackPath.parse("20x0", 4));
    }

    @Test
    void ordering_isBreadthFirst() {
        FeedbackPath shallow = FeedbackPath.parse("2222", 4);
        FeedbackPath deep = FeedbackPath.parse("0000/0000", 4);
        assertTrue(FeedbackPath.ROOT.compareTo(shallow) < 0);
        assertTrue(shallow.compareTo(deep) < 0);
        assertTrue(FeedbackPath.parse("0001", 4).compareTo(FeedbackPath.parse("0010", 4)) < 0);
    }
}
