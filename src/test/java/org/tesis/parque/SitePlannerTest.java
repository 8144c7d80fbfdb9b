package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SitePlannerTest {

    private static OptimizerConfig scenarioConfig() {
        return OptimizerConfig.builder().populationSize(16).maxGenerations(10).threads(4).seed(42).build();
    }

    @Test
    @DisplayName("20 ha rectangle on a highway: a compliant park with at least 50 lots")
    @Timeout(value = 10, unit = TimeUnit.MINUTES)
    void twentyHectareScenario() throws IOException {
        SiteInput site;
        try (InputStream in = getClass().getResourceAsStream("/sites/twenty-hectare.csv")) {
            site = BoundaryCsvReader.read(in, "twenty-hectare.csv");
        }
        SitePlanner planner = new SitePlanner(Sites.industrialPark(), RuleSet.defaults(), scenarioConfig(),
                DurationTable.defaults());
        SitePlanReport report = planner.plan(site);

        assertTrue(report.isCompliant(), () -> "hard: " + report.getViolations().bySeverity(Severity.HARD));
        LayoutMetrics m = report.getMetrics();
        assertTrue(m.getLotCount() >= 50, "lots " + m.getLotCount());
        assertTrue(m.getSalableFraction() >= 0.70 && m.getSalableFraction() <= 0.85, "salable " + m.getSalableFraction());
        assertTrue(m.measure(Quantity.LARGEST_RESIDUAL_RATIO) < 1.0, "largest residual " + m.getLargestResidualArea());
        assertTrue(m.getRoadFraction() > 0.05 && m.getRoadFraction() < 0.25, "roads " + m.getRoadFraction());
        assertTrue(m.partitionError() <= 1e-3);
        assertTrue(report.getGenerations() <= 10);
        assertFalse(report.isCancelled());
        assertTrue(report.getTimeline().getTotalDays() > 0);
        assertFalse(report.getTimeline().getCriticalPath().isEmpty());
        assertFalse(report.features().isEmpty());
        assertTrue(report.getScore().getAggregate() > 0);
        assertFalse(report.getFront().isEmpty());
    }

    @Test
    @DisplayName("20 ha L-shaped site: both arms are served and no leftover piece could hold a lot")
    @Timeout(value = 10, unit = TimeUnit.MINUTES)
    void lShapedScenario() {
        SitePlanner planner = new SitePlanner(Sites.industrialPark(), RuleSet.defaults(), scenarioConfig(),
                DurationTable.defaults());
        SitePlanReport report = planner.plan(Sites.lShape(), Sites.highway());

        assertTrue(report.isCompliant(), () -> "hard: " + report.getViolations().bySeverity(Severity.HARD));
        LayoutMetrics m = report.getMetrics();
        assertTrue(m.getLotCount() >= 50, "lots " + m.getLotCount());
        assertTrue(m.getLargestResidualArea() < Sites.industrialPark().getLotSizeMin(),
                "largest residual " + m.getLargestResidualArea());
        assertTrue(m.partitionError() <= 1e-3);
        assertTrue(report.getLayout().getRoads().isConnected());
    }

    @Test
    @DisplayName("A buffer wider than the site aborts before any search")
    void infeasibleBuffer() {
        ParameterSet p = ParameterSet.builder().perimeterBuffer(300).build();
        SitePlanner planner = new SitePlanner(p);
        assertThrows(InfeasibleGeometryException.class, () -> planner.plan(Sites.twentyHectares(), Sites.highway()));
    }

    @Test
    @DisplayName("No edge long enough for an entrance aborts with no valid frontage")
    void noFrontage() {
        ParameterSet p = ParameterSet.builder().entrances(1, 800, 50).build();
        SitePlanner planner = new SitePlanner(p);
        assertThrows(NoValidFrontageException.class, () -> planner.plan(Sites.twentyHectares(), Sites.highway()));
    }

    @Test
    @DisplayName("Cancelling before the first generation still returns a plan")
    void cancelledPlan() {
        OptimizerProgress progress = new OptimizerProgress();
        progress.cancel();
        SitePlanner planner = new SitePlanner(Sites.industrialPark(), RuleSet.defaults(),
                OptimizerConfig.builder().populationSize(4).threads(2).build(), DurationTable.defaults());
        SitePlanReport report = planner.plan(Sites.twentyHectares(), null, progress);
        assertTrue(report.isCancelled());
        assertNotNull(report.getLayout());
        assertTrue(progress.getElapsedMillis() >= 0);
    }
}
