package org.tesis.parque;

import java.util.EnumMap;
import java.util.Map;

/**
 * Duration lookup keyed by work type: {@code ceil(base + rate * quantity)}
 * days, never less than one.
 */
public final class DurationTable {

    private final Map<WorkType, double[]> entries;

    private DurationTable(Map<WorkType, double[]> entries) {
        this.entries = entries;
    }

    /** Production rates for a flat greenfield site. */
    public static DurationTable defaults() {
        return builder()
                .rate(WorkType.SITE_PREPARATION, 5, 0.5)
                .rate(WorkType.EARTHWORKS, 15, 1.0)
                .rate(WorkType.UTILITY_NETWORK, 10, 8)
                .rate(WorkType.DETENTION_POND, 15, 2)
                .rate(WorkType.FACILITY, 30, 1)
                .rate(WorkType.PRIMARY_ROAD, 10, 10)
                .rate(WorkType.SECONDARY_ROAD, 10, 8)
                .rate(WorkType.ACCESS_ROAD, 5, 10)
                .rate(WorkType.LOT_GRADING, 5, 0.5)
                .rate(WorkType.LANDSCAPING, 10, 1)
                .rate(WorkType.FINAL_INSPECTION, 5, 0)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int days(WorkType type, double quantity) {
        double[] e = entries.get(type);
        if (e == null) throw new IllegalArgumentException("no duration for " + type);
        if (!(quantity >= 0)) throw new IllegalArgumentException("quantity must be >= 0: " + quantity);
        return Math.max(1, (int) Math.ceil(e[0] + e[1] * quantity - 1e-9));
    }

    public static final class Builder {
        private final Map<WorkType, double[]> entries = new EnumMap<>(WorkType.class);

        public Builder rate(WorkType type, double baseDays, double daysPerUnit) {
            if (baseDays < 0 || daysPerUnit < 0) throw new IllegalArgumentException("negative duration for " + type);
            entries.put(type, new double[]{baseDays, daysPerUnit});
            return this;
        }

        public DurationTable build() {
            for (WorkType t : WorkType.values()) {
                if (!entries.containsKey(t)) throw new IllegalArgumentException("no duration for " + t);
            }
            return new DurationTable(new EnumMap<>(entries));
        }
    }
}
