package ai.wordle.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProbabilityDistributionTest {

    private static final Vocabulary WORDS = Vocabulary.of(5, "arbol", "perro", "queso", "tigre");

    @Test
    void uniform_givesEveryWordTheSameMass() {
        ProbabilityDistribution uniform = ProbabilityDistribution.uniform(WORDS);
        assertEquals(1.0, uniform.sum(), 1e-9);
        assertEquals(0.25, uniform.probability("queso"), 1e-12);
        assertEquals(0.0, uniform.probability("zzzzz"));
    }

    @Test
    void frequency_favoursCommonWords() {
        Map<String, Long> counts = Map.of("arbol", 5000L, "perro", 120L, "queso", 3L, "tigre", 1L);
        ProbabilityDistribution frequency = ProbabilityDistribution.frequency(WORDS, counts);
        assertEquals(1.0, frequency.sum(), 1e-9);
        assertTrue(frequency.probability("arbol") > frequency.probability("perro"));
        assertTrue(frequency.probability("perro") > frequency.probability("queso"));
        assertTrue(frequency.probability("tigre") > 0.0);
    }

    @Test
    void perturb_isSeededAndStaysNormalized() {
        ProbabilityDistribution base = ProbabilityDistribution.uniform(WORDS);
        ProbabilityDistribution a = base.perturb(0.05, 17L);
        ProbabilityDistribution b = base.perturb(0.05, 17L);
        ProbabilityDistribution c = base.perturb(0.05, 18L);

        assertEquals(1.0, a.sum(), 1e-9);
        assertEquals(a.asMap(), b.asMap());
        assertNotEquals(a.asMap(), c.asMap());
        for (double p : a.asMap().values()) {
            assertTrue(p > 0.25 * 0.8 && p < 0.25 * 1.2, "perturbed value out of range: " + p);
        }
    }

    @Test
    void perturbWithZeroScale_changesNothing() {
        ProbabilityDistribution base = ProbabilityDistribution.uniform(WORDS);
        assertEquals(base.asMap(), base.perturb(0.0, 3L).asMap());
    }

    @Test
    void fromMap_validatesTheSum() {
        Map<String, Double> ok = new LinkedHashMap<>();
        ok.put("arbol", 0.4);
        ok.put("perro", 0.3);
        ok.put("queso", 0.2);
        ok.put("tigre", 0.1);
        assertEquals(0.3, ProbabilityDistribution.fromMap(WORDS, ok).probability("perro"), 1e-12);

        Map<String, Double> bad = new LinkedHashMap<>(ok);
        bad.put("tigre", 0.2);
        assertThrows(IllegalArgumentException.class, () -> ProbabilityDistribution.fromMap(WORDS, bad));

        Map<String, Double> missing = new LinkedHashMap<>(ok);
        missing.remove("tigre");
        assertThrows(IllegalArgumentException.class, () -> ProbabilityDistribution.fromMap(WORDS, missing));
    }
}
