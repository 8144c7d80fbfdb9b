package org.tesis.parque;

import java.util.List;

/** Outcome of one optimizer run. */
public final class OptimizationResult {

    public enum StopReason {
        GENERATION_CAP, STAGNATION, DEADLINE, CANCELLED
    }

    private final Evaluation best;
    private final List<Evaluation> front;
    private final int generations;
    private final int evaluations;
    private final long elapsedMillis;
    private final StopReason stopReason;

    OptimizationResult(Evaluation best, List<Evaluation> front, int generations, int evaluations,
                       long elapsedMillis, StopReason stopReason) {
        this.best = best;
        this.front = List.copyOf(front);
        this.generations = generations;
        this.evaluations = evaluations;
        this.elapsedMillis = elapsedMillis;
        this.stopReason = stopReason;
    }

    /** Fewest hard violations, then highest aggregate score. */
    public Evaluation getBest() {
        return best;
    }

    /** First non-dominated front of the final population. */
    public List<Evaluation> getFront() {
        return front;
    }

    /** True when the best layout has no hard violation. */
    public boolean isCompliant() {
        return best.getReport().isCompliant();
    }

    public int getGenerations() {
        return generations;
    }

    /** Distinct genomes decoded. */
    public int getEvaluations() {
        return evaluations;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public boolean isCancelled() {
        return stopReason == StopReason.CANCELLED;
    }
}
