package org.tesis.parque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Critical path method over a work-package graph: forward pass for earliest
 * times in topological order, backward pass for latest times, then the
 * zero-slack chain ending at the latest finish.
 */
public class TimelineEstimator {

    private static final Logger log = LoggerFactory.getLogger(TimelineEstimator.class);

    private final DurationTable table;

    public TimelineEstimator() {
        this(DurationTable.defaults());
    }

    public TimelineEstimator(DurationTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public TimelineResult estimate(CandidateLayout layout) {
        return estimate(TimelineGraph.of(layout, table));
    }

    /**
     * @throws CyclicDependencyException if the graph has a cycle or an edge to an unknown package
     */
    public TimelineResult estimate(TimelineGraph graph) {
        List<WorkPackage> order = topologicalOrder(graph);
        Map<String, List<String>> successors = new HashMap<>();
        for (WorkPackage p : order) {
            for (String pred : p.getPredecessors()) successors.computeIfAbsent(pred, k -> new ArrayList<>()).add(p.getId());
        }

        Map<String, Integer> es = new HashMap<>(), ef = new HashMap<>();
        int total = 0;
        for (WorkPackage p : order) {
            int start = 0;
            for (String pred : p.getPredecessors()) start = Math.max(start, ef.get(pred));
            es.put(p.getId(), start);
            ef.put(p.getId(), start + p.getDurationDays());
            total = Math.max(total, start + p.getDurationDays());
        }

        Map<String, Integer> ls = new HashMap<>(), lf = new HashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            WorkPackage p = order.get(i);
            int finish = total;
            for (String s : successors.getOrDefault(p.getId(), List.of())) finish = Math.min(finish, ls.get(s));
            lf.put(p.getId(), finish);
            ls.put(p.getId(), finish - p.getDurationDays());
        }

        Map<String, TimelineResult.Schedule> schedule = new LinkedHashMap<>();
        Map<WorkType.Phase, Integer> milestones = new EnumMap<>(WorkType.Phase.class);
        for (WorkPackage p : order) {
            String id = p.getId();
            schedule.put(id, new TimelineResult.Schedule(p, es.get(id), ef.get(id), ls.get(id), lf.get(id)));
            milestones.merge(p.getType().getPhase(), ef.get(id), Math::max);
        }

        List<String> critical = criticalPath(order, graph, es, ef, total);
        TimelineResult result = new TimelineResult(total, critical, schedule, milestones, peakParallel(order, es, ef));
        log.debug("timeline | packages={} | days={} | critical={}", order.size(), total, critical);
        return result;
    }

    // Kahn's algorithm, ready packages taken in insertion order
    static List<WorkPackage> topologicalOrder(TimelineGraph graph) {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (WorkPackage p : graph.packages()) {
            indegree.put(p.getId(), p.getPredecessors().size());
            for (String pred : p.getPredecessors()) {
                if (graph.get(pred) == null) throw new CyclicDependencyException(List.of(p.getId()));
                successors.computeIfAbsent(pred, k -> new ArrayList<>()).add(p.getId());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        for (Map.Entry<String, Integer> e : indegree.entrySet()) if (e.getValue() == 0) ready.add(e.getKey());
        List<WorkPackage> order = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(graph.get(id));
            for (String s : successors.getOrDefault(id, List.of())) {
                if (indegree.merge(s, -1, Integer::sum) == 0) ready.add(s);
            }
        }
        if (order.size() < graph.size()) {
            List<String> unresolved = new ArrayList<>();
            for (Map.Entry<String, Integer> e : indegree.entrySet()) if (e.getValue() > 0) unresolved.add(e.getKey());
            throw new CyclicDependencyException(unresolved);
        }
        return order;
    }

    private static List<String> criticalPath(List<WorkPackage> order, TimelineGraph graph,
                                             Map<String, Integer> es, Map<String, Integer> ef, int total) {
        LinkedList<String> path = new LinkedList<>();
        if (order.isEmpty()) return path;
        WorkPackage current = null;
        for (WorkPackage p : order) if (ef.get(p.getId()) == total) current = p;
        while (current != null) {
            path.addFirst(current.getId());
            WorkPackage next = null;
            int start = es.get(current.getId());
            for (String pred : current.getPredecessors()) {
                if (ef.get(pred) == start) {
                    next = graph.get(pred);
                    break;
                }
            }
            current = next;
        }
        return path;
    }

    private static int peakParallel(List<WorkPackage> order, Map<String, Integer> es, Map<String, Integer> ef) {
        TreeMap<Integer, Integer> delta = new TreeMap<>();
        for (WorkPackage p : order) {
            if (p.getDurationDays() == 0) continue;
            delta.merge(es.get(p.getId()), 1, Integer::sum);
            delta.merge(ef.get(p.getId()), -1, Integer::sum);
        }
        int running = 0, peak = 0;
        for (int d : delta.values()) {
            running += d;
            peak = Math.max(peak, running);
        }
        return peak;
    }
}
