package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringMatrixTest {

    private static ScoreVector uniform(double v) {
        Map<ScoreDimension, Double> m = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) m.put(d, v);
        return new ScoreVector(m, Map.of());
    }

    @Test
    @DisplayName("Letter grades follow the aggregate score")
    void grades() {
        assertEquals("A+", ScoreVector.grade(0.97));
        assertEquals("A", ScoreVector.grade(0.90));
        assertEquals("B", ScoreVector.grade(0.82));
        assertEquals("D", ScoreVector.grade(0.60));
        assertEquals("F", ScoreVector.grade(0.2));
        assertEquals("B+", uniform(0.86).grade());
    }

    @Test
    @DisplayName("Weights shift the aggregate and values are clipped to [0,1]")
    void weightedAggregate() {
        Map<ScoreDimension, Double> v = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) v.put(d, 0.0);
        v.put(ScoreDimension.FINANCIAL, 2.0);
        Map<ScoreDimension, Double> w = new EnumMap<>(ScoreDimension.class);
        w.put(ScoreDimension.FINANCIAL, 6.0);
        ScoreVector s = new ScoreVector(v, w);
        assertEquals(1.0, s.get(ScoreDimension.FINANCIAL));
        assertEquals(0.5, s.getAggregate(), 1e-12);
    }

    @Test
    @DisplayName("Comparison picks the best overall and the best per dimension")
    void compare() {
        Map<ScoreDimension, Double> v = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) v.put(d, 0.1);
        v.put(ScoreDimension.ENVIRONMENTAL, 0.99);
        ScoreVector green = new ScoreVector(v, Map.of());
        ScoringMatrix.Comparison c = ScoringMatrix.compare(List.of(uniform(0.5), green, uniform(0.7)));
        assertEquals(2, c.getBestOverall());
        assertEquals(1, c.getBestByDimension().get(ScoreDimension.ENVIRONMENTAL));
        assertEquals(2, c.getBestByDimension().get(ScoreDimension.COMPLIANCE));
        assertThrows(IllegalArgumentException.class, () -> ScoringMatrix.compare(List.of()));
    }

    @Test
    @DisplayName("Scores of the seeded layout are all in range and compliance reflects the report")
    void seededScore() {
        ParameterSet params = Sites.industrialPark();
        CandidateLayout layout = Sites.decoder().decode(LayoutGenome.seeded(params));
        LayoutMetrics m = LayoutMetrics.of(layout, params);
        ViolationReport r = new ComplianceValidator(RuleSet.defaults()).validate(m);
        TimelineResult t = new TimelineEstimator().estimate(layout);
        ScoreVector s = new ScoringMatrix(params).score(m, r, t);

        for (ScoreDimension d : ScoreDimension.values()) {
            assertTrue(s.get(d) >= 0 && s.get(d) <= 1, d + "=" + s.get(d));
        }
        assertEquals(1.0 / (1.0 + r.getHardCount() + r.getSoftPenalty()), s.get(ScoreDimension.COMPLIANCE), 1e-12);
        assertEquals(Math.min(1.0, m.getSalableFraction() / params.getSalableAreaCeiling()),
                s.get(ScoreDimension.EFFICIENCY), 1e-12);
        assertTrue(s.getAggregate() > 0);
    }
}
