package org.tesis.parque;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ParetoRankingTest {

    private static final List<Evaluation> POP = new ArrayList<>();

    @BeforeAll
    static void evaluate() {
        LayoutEvaluator ev = new LayoutEvaluator(Sites.decoder(), new ComplianceValidator(RuleSet.defaults()),
                new TimelineEstimator());
        Random rng = new Random(7);
        POP.add(ev.evaluate(LayoutGenome.seeded(Sites.industrialPark())));
        for (int i = 0; i < 9; i++) POP.add(ev.evaluate(LayoutGenome.random(rng)));
        POP.add(Evaluation.failed(LayoutGenome.random(rng), "synthetic failure", Sites.industrialPark()));
    }

    @Test
    @DisplayName("Domination is irreflexive and antisymmetric")
    void dominationProperties() {
        for (Evaluation a : POP) {
            assertFalse(ParetoRanking.dominates(a, a));
            for (Evaluation b : POP) {
                assertFalse(ParetoRanking.dominates(a, b) && ParetoRanking.dominates(b, a));
            }
        }
    }

    @Test
    @DisplayName("Fewer hard violations always dominates")
    void constrained() {
        for (Evaluation a : POP) {
            for (Evaluation b : POP) {
                if (a.hardRank() < b.hardRank()) assertTrue(ParetoRanking.dominates(a, b));
            }
        }
    }

    @Test
    @DisplayName("Nobody in the first front is dominated; failed decodes rank last")
    void fronts() {
        ParetoRanking r = ParetoRanking.of(POP);
        List<Integer> first = r.fronts().get(0);
        for (int i : first) {
            for (Evaluation other : POP) assertFalse(ParetoRanking.dominates(other, POP.get(i)));
        }
        int failed = POP.size() - 1;
        for (int i = 0; i < failed; i++) {
            if (!POP.get(i).isFailed()) assertTrue(r.rank(i) < r.rank(failed));
        }
        int total = 0;
        for (List<Integer> f : r.fronts()) total += f.size();
        assertEquals(POP.size(), total);
    }

    @Test
    @DisplayName("Survivor selection keeps the requested size and prefers better ranks")
    void survivors() {
        List<Evaluation> kept = GeneticOptimizer.survivors(POP, 5);
        assertEquals(5, kept.size());
        assertFalse(kept.contains(POP.get(POP.size() - 1)));
        Evaluation best = GeneticOptimizer.pick(POP);
        for (Evaluation e : POP) assertFalse(e.betterThan(best));
    }
}
