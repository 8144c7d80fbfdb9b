package org.tesis.parque;

import java.util.List;

/**
 * Everything a finished planning run hands to rendering and export: the
 * chosen layout with its features, violations, score and timeline, plus the
 * run's counters.
 */
public final class SitePlanReport {

    private final CandidateLayout layout;
    private final LayoutMetrics metrics;
    private final ViolationReport violations;
    private final ScoreVector score;
    private final TimelineResult timeline;
    private final OptimizationResult run;

    SitePlanReport(Evaluation best, OptimizationResult run) {
        this.layout = best.getLayout();
        this.metrics = best.getMetrics();
        this.violations = best.getReport();
        this.score = best.getScore();
        this.timeline = best.getTimeline();
        this.run = run;
    }

    public CandidateLayout getLayout() {
        return layout;
    }

    public List<LayoutFeature> features() {
        return layout.features();
    }

    public LayoutMetrics getMetrics() {
        return metrics;
    }

    public ViolationReport getViolations() {
        return violations;
    }

    public ScoreVector getScore() {
        return score;
    }

    public TimelineResult getTimeline() {
        return timeline;
    }

    /** False when no layout of the run met every hard rule; the best one is still returned. */
    public boolean isCompliant() {
        return violations.isCompliant();
    }

    public List<PlacementInfeasible> getPlacementFailures() {
        return layout.getPlacementFailures();
    }

    public int getGenerations() {
        return run.getGenerations();
    }

    public long getElapsedMillis() {
        return run.getElapsedMillis();
    }

    public boolean isCancelled() {
        return run.isCancelled();
    }

    public OptimizationResult.StopReason getStopReason() {
        return run.getStopReason();
    }

    /** Alternatives on the final non-dominated front. */
    public List<Evaluation> getFront() {
        return run.getFront();
    }

    @Override
    public String toString() {
        return "SitePlanReport{lots=" + metrics.getLotCount() + ", compliant=" + isCompliant()
                + ", score=" + GeneticOptimizer.DF.format(score.getAggregate()) + " " + score.grade()
                + ", days=" + timeline.getTotalDays() + "}";
    }
}
