package org.tesis.parque;

import java.util.*;

/**
 * Critical-path schedule of a work-package graph. Days count from zero at
 * project start.
 */
public final class TimelineResult {

    /** Earliest/latest start and finish of one package. */
    public static final class Schedule {
        private final WorkPackage workPackage;
        private final int earliestStart, earliestFinish, latestStart, latestFinish;

        Schedule(WorkPackage workPackage, int es, int ef, int ls, int lf) {
            this.workPackage = workPackage;
            this.earliestStart = es;
            this.earliestFinish = ef;
            this.latestStart = ls;
            this.latestFinish = lf;
        }

        public WorkPackage getWorkPackage() {
            return workPackage;
        }

        public int getEarliestStart() {
            return earliestStart;
        }

        public int getEarliestFinish() {
            return earliestFinish;
        }

        public int getLatestStart() {
            return latestStart;
        }

        public int getLatestFinish() {
            return latestFinish;
        }

        public int getSlack() {
            return latestStart - earliestStart;
        }

        public boolean isCritical() {
            return getSlack() == 0;
        }
    }

    private final int totalDays;
    private final List<String> criticalPath;
    private final Map<String, Schedule> schedule;
    private final Map<WorkType.Phase, Integer> milestones;
    private final int peakParallel;

    TimelineResult(int totalDays, List<String> criticalPath, Map<String, Schedule> schedule,
                   Map<WorkType.Phase, Integer> milestones, int peakParallel) {
        this.totalDays = totalDays;
        this.criticalPath = List.copyOf(criticalPath);
        this.schedule = Collections.unmodifiableMap(new LinkedHashMap<>(schedule));
        this.milestones = Collections.unmodifiableMap(new EnumMap<>(milestones));
        this.peakParallel = peakParallel;
    }

    public int getTotalDays() {
        return totalDays;
    }

    /** Package ids from project start to finish along the longest path. */
    public List<String> getCriticalPath() {
        return criticalPath;
    }

    /** Per-package schedule in topological order. */
    public Map<String, Schedule> getSchedule() {
        return schedule;
    }

    public Schedule get(String id) {
        return schedule.get(id);
    }

    /** Day on which each phase present in the graph completes. */
    public Map<WorkType.Phase, Integer> getMilestones() {
        return milestones;
    }

    /** Largest number of packages running on the same day. */
    public int getPeakParallel() {
        return peakParallel;
    }

    public Map<String, Integer> durations() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Schedule s : schedule.values()) out.put(s.getWorkPackage().getId(), s.getWorkPackage().getDurationDays());
        return out;
    }

    @Override
    public String toString() {
        return "TimelineResult{days=" + totalDays + ", critical=" + criticalPath + "}";
    }
}
