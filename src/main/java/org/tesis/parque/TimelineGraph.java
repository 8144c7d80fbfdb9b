package org.tesis.parque;

import java.util.*;

/**
 * Work packages and their predecessor edges, in insertion order. Built
 * deterministically from a layout by {@link #of(CandidateLayout, DurationTable)};
 * the same layout always yields the same graph.
 */
public final class TimelineGraph {

    /** lots graded together in one package */
    static final int LOTS_PER_GRADING_PHASE = 30;

    private final Map<String, WorkPackage> packages = new LinkedHashMap<>();

    public TimelineGraph add(WorkPackage p) {
        if (packages.putIfAbsent(p.getId(), p) != null) {
            throw new IllegalArgumentException("duplicate work package " + p.getId());
        }
        return this;
    }

    public Collection<WorkPackage> packages() {
        return Collections.unmodifiableCollection(packages.values());
    }

    public WorkPackage get(String id) {
        return packages.get(id);
    }

    public int size() {
        return packages.size();
    }

    /** Packages no other package waits for. */
    public List<String> sinks() {
        Set<String> waitedOn = new HashSet<>();
        for (WorkPackage p : packages.values()) waitedOn.addAll(p.getPredecessors());
        List<String> out = new ArrayList<>();
        for (String id : packages.keySet()) if (!waitedOn.contains(id)) out.add(id);
        return out;
    }

    public static TimelineGraph of(CandidateLayout layout, DurationTable table) {
        Builder b = new Builder(table);
        double siteHa = layout.getBoundary().getArea() / 10_000.0;
        RoadNetwork roads = layout.getRoads();

        b.add("site-preparation", WorkType.SITE_PREPARATION, siteHa);
        b.add("earthworks", WorkType.EARTHWORKS, layout.getBuildable().getArea() / 10_000.0, "site-preparation");
        b.add("utility-networks", WorkType.UTILITY_NETWORK, roads.totalLength() / 1000.0, "earthworks");

        for (InfrastructureElement e : layout.getInfrastructure()) {
            if (e.getKind().isGreen()) {
                b.add(e.getId(), WorkType.DETENTION_POND, e.getArea() / 1000.0, "earthworks");
            } else {
                b.add(e.getId(), WorkType.FACILITY, e.getArea() / 1000.0, "utility-networks");
            }
        }

        List<String> roadPackages = new ArrayList<>();
        double primary = roads.length(RoadClass.PRIMARY);
        double secondary = roads.length(RoadClass.SECONDARY);
        double access = roads.length(RoadClass.ACCESS);
        if (primary > 0) {
            b.add("roads-primary", WorkType.PRIMARY_ROAD, primary / 1000.0, "utility-networks");
            roadPackages.add("roads-primary");
        }
        if (secondary > 0) {
            b.add("roads-secondary", WorkType.SECONDARY_ROAD, secondary / 1000.0, "utility-networks");
            roadPackages.add("roads-secondary");
        }
        if (access > 0) {
            b.add("roads-access", WorkType.ACCESS_ROAD, access / 1000.0,
                    primary > 0 ? "roads-primary" : "utility-networks");
            roadPackages.add("roads-access");
        }

        String lotGate = secondary > 0 ? "roads-secondary" : primary > 0 ? "roads-primary" : "utility-networks";
        int lots = layout.getLots().size();
        for (int i = 0, phase = 1; i < lots; i += LOTS_PER_GRADING_PHASE, phase++) {
            int n = Math.min(LOTS_PER_GRADING_PHASE, lots - i);
            b.add("lot-grading-" + phase, WorkType.LOT_GRADING, n, lotGate);
        }

        double greenHa = (layout.openSpaceArea() + layout.getPerimeterBuffer().getArea()) / 10_000.0;
        b.add("landscaping", WorkType.LANDSCAPING, greenHa,
                roadPackages.isEmpty() ? List.of("utility-networks") : roadPackages);

        b.add("final-inspection", WorkType.FINAL_INSPECTION, 0, b.graph.sinks());
        return b.graph;
    }

    private static final class Builder {
        final DurationTable table;
        final TimelineGraph graph = new TimelineGraph();

        Builder(DurationTable table) {
            this.table = table;
        }

        void add(String id, WorkType type, double quantity, String... predecessors) {
            add(id, type, quantity, Arrays.asList(predecessors));
        }

        void add(String id, WorkType type, double quantity, List<String> predecessors) {
            graph.add(new WorkPackage(id, type, quantity, table.days(type, quantity), predecessors));
        }
    }
}
