package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.util.AssertionFailedException;

import static org.junit.jupiter.api.Assertions.*;

class LayoutEvaluatorTest {

    private static LayoutEvaluator evaluatorFailingWith(RuntimeException failure) {
        LayoutDecoder decoder = new LayoutDecoder(Sites.twentyHectares(), Sites.highway(), Sites.industrialPark()) {
            @Override
            public CandidateLayout decode(LayoutGenome genome) {
                throw failure;
            }
        };
        return new LayoutEvaluator(decoder, new ComplianceValidator(RuleSet.defaults()), new TimelineEstimator());
    }

    @Test
    @DisplayName("The seeded genome evaluates to a scored layout")
    void seeded() {
        Evaluation e = new LayoutEvaluator(Sites.decoder(), new ComplianceValidator(RuleSet.defaults()),
                new TimelineEstimator()).evaluate(LayoutGenome.seeded(Sites.industrialPark()));
        assertFalse(e.isFailed(), e::getFailure);
        assertNotNull(e.getLayout());
        assertNotNull(e.getMetrics());
    }

    @Test
    @DisplayName("A JTS assertion failure inside decoding fails the genome instead of the run")
    void assertionFailureBecomesFailedEvaluation() {
        Evaluation e = evaluatorFailingWith(new AssertionFailedException("degenerate ring"))
                .evaluate(LayoutGenome.seeded(Sites.industrialPark()));
        assertTrue(e.isFailed());
        assertTrue(e.getFailure().startsWith("AssertionFailedException"), e.getFailure());
    }

    @Test
    @DisplayName("Topology and infeasibility errors fail the genome as well")
    void geometryErrorsBecomeFailedEvaluation() {
        assertTrue(evaluatorFailingWith(new TopologyException("side location conflict"))
                .evaluate(LayoutGenome.seeded(Sites.industrialPark())).isFailed());
        assertTrue(evaluatorFailingWith(new InfeasibleGeometryException("no room"))
                .evaluate(LayoutGenome.seeded(Sites.industrialPark())).isFailed());
    }

    @Test
    @DisplayName("Other runtime errors are defects and propagate")
    void defectsPropagate() {
        LayoutEvaluator e = evaluatorFailingWith(new IllegalStateException("bug"));
        assertThrows(IllegalStateException.class, () -> e.evaluate(LayoutGenome.seeded(Sites.industrialPark())));
    }
}
