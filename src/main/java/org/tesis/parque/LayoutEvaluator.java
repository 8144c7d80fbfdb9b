package org.tesis.parque;

import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.util.AssertionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decode, validate, schedule and score one genome. Geometry failures of the
 * genome at hand become a failed {@link Evaluation} instead of an exception.
 * Stateless apart from its collaborators, so safe to call from many threads.
 */
public class LayoutEvaluator {

    private static final Logger log = LoggerFactory.getLogger(LayoutEvaluator.class);

    private final LayoutDecoder decoder;
    private final ComplianceValidator validator;
    private final ScoringMatrix scoring;
    private final TimelineEstimator timeline;

    public LayoutEvaluator(LayoutDecoder decoder, ComplianceValidator validator, TimelineEstimator timeline) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.timeline = Objects.requireNonNull(timeline, "timeline");
        this.scoring = new ScoringMatrix(decoder.getParams());
    }

    public LayoutDecoder getDecoder() {
        return decoder;
    }

    public ParameterSet getParams() {
        return decoder.getParams();
    }

    public Evaluation evaluate(LayoutGenome genome) {
        CandidateLayout layout;
        LayoutMetrics metrics;
        try {
            layout = decoder.decode(genome);
            metrics = LayoutMetrics.of(layout, getParams());
        } catch (SitePlanException | TopologyException | AssertionFailedException | IllegalArgumentException e) {
            log.debug("decode failed | {} | {}", genome, e.toString());
            return Evaluation.failed(genome, e.getClass().getSimpleName() + ": " + e.getMessage(), getParams());
        }
        ViolationReport report = validator.validate(metrics);
        // a cycle here is a generator defect and propagates
        TimelineResult schedule = timeline.estimate(layout);
        ScoreVector score = scoring.score(metrics, report, schedule);
        return new Evaluation(genome, layout, metrics, report, score, schedule);
    }
}
