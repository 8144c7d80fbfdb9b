package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GeneticOptimizerTest {

    private static LayoutEvaluator evaluator() {
        return new LayoutEvaluator(Sites.decoder(), new ComplianceValidator(RuleSet.defaults()), new TimelineEstimator());
    }

    private static OptimizerConfig small(int threads) {
        return OptimizerConfig.builder().populationSize(8).maxGenerations(3).threads(threads).seed(11).build();
    }

    @Test
    @DisplayName("Same seed gives the same best layout regardless of thread count")
    @Timeout(value = 5, unit = TimeUnit.MINUTES)
    void deterministicAcrossThreads() {
        OptimizationResult one = new GeneticOptimizer(evaluator(), small(1)).optimize();
        OptimizationResult four = new GeneticOptimizer(evaluator(), small(4)).optimize();
        assertEquals(one.getBest().getGenome(), four.getBest().getGenome());
        assertEquals(one.getBest().getScore().getAggregate(), four.getBest().getScore().getAggregate());
        assertEquals(one.getGenerations(), four.getGenerations());
    }

    @Test
    @DisplayName("The result is never worse than the seeded genome")
    @Timeout(value = 5, unit = TimeUnit.MINUTES)
    void notWorseThanSeed() {
        LayoutEvaluator ev = evaluator();
        Evaluation seed = ev.evaluate(LayoutGenome.seeded(ev.getParams()));
        OptimizationResult r = new GeneticOptimizer(ev, small(2)).optimize();
        assertFalse(seed.betterThan(r.getBest()));
        assertFalse(r.getFront().isEmpty());
        assertTrue(r.getEvaluations() >= 8);
    }

    @Test
    @DisplayName("A cancelled run stops at once and returns the best initial layout")
    void cancelled() {
        OptimizerProgress progress = new OptimizerProgress();
        progress.cancel();
        OptimizationResult r = new GeneticOptimizer(evaluator(), small(2)).optimize(progress);
        assertTrue(r.isCancelled());
        assertEquals(0, r.getGenerations());
        assertNotNull(r.getBest().getLayout());
        assertEquals(8, progress.getEvaluations());
        assertEquals(r.getBest().getScore().getAggregate(), progress.getBestAggregate());
    }

    @Test
    @DisplayName("A spent wall-clock budget ends the run on the deadline")
    void deadline() {
        OptimizerConfig c = OptimizerConfig.builder().populationSize(4).maxGenerations(50).threads(1)
                .budgetMillis(1).build();
        OptimizationResult r = new GeneticOptimizer(evaluator(), c).optimize();
        assertEquals(OptimizationResult.StopReason.DEADLINE, r.getStopReason());
    }

    @Test
    @DisplayName("A site no genome can decode is infeasible for the whole run")
    void allFail() {
        LayoutEvaluator broken = new LayoutEvaluator(Sites.decoder(), new ComplianceValidator(RuleSet.defaults()),
                new TimelineEstimator()) {
            @Override
            public Evaluation evaluate(LayoutGenome genome) {
                return Evaluation.failed(genome, "no room", getParams());
            }
        };
        OptimizerConfig c = OptimizerConfig.builder().populationSize(4).maxGenerations(2).threads(1).build();
        assertThrows(InfeasibleGeometryException.class, () -> new GeneticOptimizer(broken, c).optimize());
    }
}
