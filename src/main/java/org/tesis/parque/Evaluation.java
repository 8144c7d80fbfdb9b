package org.tesis.parque;

/**
 * A decoded and judged genome: the layout with its metrics, violations,
 * score and timeline, or the reason it could not be built. Immutable, so one
 * instance can be shared by every generation that meets the same genome.
 */
public final class Evaluation {

    /** number of minimized objectives */
    static final int OBJECTIVES = 4;
    /** stand-in for an unbounded soft penalty in objective space */
    static final double PENALTY_CAP = 1e6;

    private final LayoutGenome genome;
    private final CandidateLayout layout;
    private final LayoutMetrics metrics;
    private final ViolationReport report;
    private final ScoreVector score;
    private final TimelineResult timeline;
    private final String failure;
    private final double[] objectives;

    Evaluation(LayoutGenome genome, CandidateLayout layout, LayoutMetrics metrics, ViolationReport report,
               ScoreVector score, TimelineResult timeline) {
        this.genome = genome;
        this.layout = layout;
        this.metrics = metrics;
        this.report = report;
        this.score = score;
        this.timeline = timeline;
        this.failure = null;
        this.objectives = new double[]{
                Math.min(PENALTY_CAP, report.getSoftPenalty()),
                -score.getAggregate(),
                -metrics.roadEfficiency(),
                -metrics.getLotQuality()
        };
    }

    private Evaluation(LayoutGenome genome, String failure, ScoreVector zero) {
        this.genome = genome;
        this.layout = null;
        this.metrics = null;
        this.report = ViolationReport.unbuildable(failure);
        this.score = zero;
        this.timeline = null;
        this.failure = failure;
        this.objectives = new double[]{PENALTY_CAP, 0, 0, 0};
    }

    static Evaluation failed(LayoutGenome genome, String reason, ParameterSet params) {
        return new Evaluation(genome, reason, ScoreVector.zero(params.getScoreWeights()));
    }

    public LayoutGenome getGenome() {
        return genome;
    }

    /** Null when the genome could not be decoded. */
    public CandidateLayout getLayout() {
        return layout;
    }

    public LayoutMetrics getMetrics() {
        return metrics;
    }

    public ViolationReport getReport() {
        return report;
    }

    public ScoreVector getScore() {
        return score;
    }

    public TimelineResult getTimeline() {
        return timeline;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public String getFailure() {
        return failure;
    }

    /** Hard violations for constrained domination; a failed decode ranks below every layout. */
    int hardRank() {
        return failure != null ? Integer.MAX_VALUE : report.getHardCount();
    }

    double objective(int i) {
        return objectives[i];
    }

    double aggregate() {
        return score.getAggregate();
    }

    /** Final pick order: fewer hard violations, then higher aggregate, then genome key. */
    boolean betterThan(Evaluation o) {
        if (hardRank() != o.hardRank()) return hardRank() < o.hardRank();
        if (aggregate() != o.aggregate()) return aggregate() > o.aggregate();
        return genome.key().compareTo(o.genome.key()) < 0;
    }

    @Override
    public String toString() {
        if (failure != null) return "Evaluation{failed: " + failure + "}";
        return "Evaluation{hard=" + report.getHardCount() + ", soft=" + report.getSoftCount()
                + ", aggregate=" + score.getAggregate() + ", lots=" + metrics.getLotCount() + "}";
    }
}
