package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimelineEstimatorTest {

    private static WorkPackage wp(String id, int days, String... preds) {
        return new WorkPackage(id, WorkType.EARTHWORKS, 1, days, List.of(preds));
    }

    @Test
    @DisplayName("Critical path follows the longest chain; slack shows on the short branch")
    void diamond() {
        TimelineGraph g = new TimelineGraph()
                .add(wp("a", 3))
                .add(wp("b", 5, "a"))
                .add(wp("c", 2, "a"))
                .add(wp("d", 4, "b", "c"));
        TimelineResult r = new TimelineEstimator().estimate(g);

        assertEquals(12, r.getTotalDays());
        assertEquals(List.of("a", "b", "d"), r.getCriticalPath());
        assertEquals(3, r.get("c").getEarliestStart());
        assertEquals(3, r.get("c").getSlack());
        assertFalse(r.get("c").isCritical());
        assertTrue(r.get("b").isCritical());
        assertEquals(2, r.getPeakParallel());
    }

    @Test
    @DisplayName("A cycle is reported with the packages that could not be ordered")
    void cycle() {
        TimelineGraph g = new TimelineGraph()
                .add(wp("a", 1))
                .add(wp("b", 1, "a", "c"))
                .add(wp("c", 1, "b"));
        CyclicDependencyException e = assertThrows(CyclicDependencyException.class,
                () -> new TimelineEstimator().estimate(g));
        assertEquals(List.of("b", "c"), e.getUnresolved());
    }

    @Test
    @DisplayName("Duration lookup rounds up and never drops below one day")
    void durations() {
        DurationTable t = DurationTable.defaults();
        assertEquals(25, t.days(WorkType.PRIMARY_ROAD, 1.5));
        assertEquals(5, t.days(WorkType.FINAL_INSPECTION, 0));
        assertEquals(1, DurationTable.builder().rate(WorkType.EARTHWORKS, 0, 0)
                .rate(WorkType.SITE_PREPARATION, 0, 0).rate(WorkType.UTILITY_NETWORK, 0, 0)
                .rate(WorkType.DETENTION_POND, 0, 0).rate(WorkType.FACILITY, 0, 0)
                .rate(WorkType.PRIMARY_ROAD, 0, 0).rate(WorkType.SECONDARY_ROAD, 0, 0)
                .rate(WorkType.ACCESS_ROAD, 0, 0).rate(WorkType.LOT_GRADING, 0, 0)
                .rate(WorkType.LANDSCAPING, 0, 0).rate(WorkType.FINAL_INSPECTION, 0, 0)
                .build().days(WorkType.EARTHWORKS, 0));
        assertThrows(IllegalArgumentException.class, () -> DurationTable.builder().build());
    }

    @Test
    @DisplayName("Layout schedule is bounded by the longest package and the sum of all packages")
    void layoutBounds() {
        CandidateLayout layout = Sites.decoder().decode(LayoutGenome.seeded(Sites.industrialPark()));
        TimelineGraph g = TimelineGraph.of(layout, DurationTable.defaults());
        TimelineResult r = new TimelineEstimator().estimate(g);

        int longest = 0, sum = 0;
        for (WorkPackage p : g.packages()) {
            longest = Math.max(longest, p.getDurationDays());
            sum += p.getDurationDays();
        }
        assertTrue(r.getTotalDays() >= longest);
        assertTrue(r.getTotalDays() <= sum);
        assertEquals("site-preparation", r.getCriticalPath().get(0));
        assertEquals("final-inspection", r.getCriticalPath().get(r.getCriticalPath().size() - 1));
        assertEquals(List.of("final-inspection"), g.sinks());
        assertNotNull(g.get("lot-grading-1"));
        assertEquals(r.getTotalDays(), (int) r.getMilestones().get(WorkType.Phase.HANDOVER));
    }

    @Test
    @DisplayName("Same layout, same graph")
    void deterministicGraph() {
        CandidateLayout layout = Sites.decoder().decode(LayoutGenome.seeded(Sites.industrialPark()));
        TimelineResult a = new TimelineEstimator().estimate(layout);
        TimelineResult b = new TimelineEstimator().estimate(layout);
        assertEquals(a.getCriticalPath(), b.getCriticalPath());
        assertEquals(a.durations(), b.durations());
    }
}
