package org.tesis.parque;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceValidatorTest {

    private static CandidateLayout layout;
    private static LayoutMetrics metrics;

    @BeforeAll
    static void decode() {
        layout = Sites.decoder().decode(LayoutGenome.seeded(Sites.industrialPark()));
        metrics = LayoutMetrics.of(layout, Sites.industrialPark());
    }

    @Test
    @DisplayName("The bundled rule table loads from the classpath")
    void defaultRules() {
        RuleSet rules = RuleSet.defaults();
        assertEquals(21, rules.size());
        long hard = rules.getRules().stream().filter(r -> r.getSeverity() == Severity.HARD).count();
        assertEquals(12, hard);
    }

    @Test
    @DisplayName("Validation is deterministic for the same layout")
    void deterministic() {
        ComplianceValidator v = new ComplianceValidator(RuleSet.defaults());
        ViolationReport a = v.validate(layout, Sites.industrialPark());
        ViolationReport b = v.validate(layout, Sites.industrialPark());
        assertEquals(a, b);
        assertEquals(a.getMeasurements(), b.getMeasurements());
    }

    @Test
    @DisplayName("The seeded 20 ha layout meets every hard rule")
    void seededLayoutCompliant() {
        ViolationReport r = new ComplianceValidator(RuleSet.defaults()).validate(metrics);
        assertTrue(r.isCompliant(), () -> "hard violations: " + r.bySeverity(Severity.HARD));
        assertTrue(metrics.getSalableFraction() <= 0.85);
    }

    @Test
    @DisplayName("A violated rule is reported with its magnitude and weighted into the soft penalty")
    void softPenalty() throws IOException {
        String json = "{\"rules\": ["
                + "{\"id\": \"too-many-lots\", \"quantity\": \"lot_count_ratio\", \"operator\": \"le\", \"threshold\": 0.5,"
                + " \"severity\": \"soft\", \"weight\": 3.0},"
                + "{\"id\": \"roads-exist\", \"quantity\": \"ROAD_FRACTION\", \"operator\": \"GT\", \"threshold\": 0,"
                + " \"severity\": \"HARD\"}]}";
        ViolationReport r = new ComplianceValidator(RuleSet.fromJson(json)).validate(metrics);
        assertEquals(0, r.getHardCount());
        assertEquals(1, r.getSoftCount());
        Violation v = r.getViolations().get("too-many-lots");
        double ratio = metrics.getLotCount() / 50.0;
        assertEquals(ratio - 0.5, v.getMagnitude(), 1e-9);
        assertEquals(3.0 * (ratio - 0.5), r.getSoftPenalty(), 1e-9);
        assertEquals(List.of(v), r.bySeverity(Severity.SOFT));
    }

    @Test
    @DisplayName("Malformed rule tables are rejected")
    void malformedRules() {
        assertThrows(IllegalArgumentException.class,
                () -> RuleSet.fromJson("{\"rules\": [{\"id\": \"x\", \"quantity\": \"ROAD_FRACTION\", \"operator\": \"LE\", \"severity\": \"HARD\"}]}"));
        assertThrows(IllegalArgumentException.class,
                () -> RuleSet.fromJson("{\"rules\": [{\"id\": \"x\", \"quantity\": \"NOPE\", \"operator\": \"LE\", \"threshold\": 1, \"severity\": \"HARD\"}]}"));
        assertThrows(IllegalArgumentException.class, () -> RuleSet.fromJson("{}"));
    }

    @Test
    @DisplayName("An unbuildable layout counts as one hard violation with the maximal penalty")
    void unbuildable() {
        ViolationReport r = ViolationReport.unbuildable("boom");
        assertFalse(r.isCompliant());
        assertEquals(Double.MAX_VALUE, r.getSoftPenalty());
    }
}
