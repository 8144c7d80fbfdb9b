package org.tesis.parque;

import java.util.List;
import java.util.Objects;

/** One node of the timeline graph. */
public final class WorkPackage {

    private final String id;
    private final WorkType type;
    private final double quantity;
    private final int durationDays;
    private final List<String> predecessors;

    public WorkPackage(String id, WorkType type, double quantity, int durationDays, List<String> predecessors) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        if (durationDays < 0) throw new IllegalArgumentException("negative duration for " + id);
        this.quantity = quantity;
        this.durationDays = durationDays;
        this.predecessors = List.copyOf(predecessors);
    }

    public String getId() {
        return id;
    }

    public WorkType getType() {
        return type;
    }

    /** In the unit of {@link WorkType#getUnit()}. */
    public double getQuantity() {
        return quantity;
    }

    public int getDurationDays() {
        return durationDays;
    }

    public List<String> getPredecessors() {
        return predecessors;
    }

    @Override
    public String toString() {
        return id + "(" + durationDays + "d)";
    }
}
