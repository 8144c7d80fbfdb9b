package org.tesis.parque;

import org.locationtech.jts.geom.LineString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point: boundary and parameters in, planned site out. Checks up front
 * that the boundary can carry any layout at all, then runs the optimizer.
 */
public class SitePlanner {

    private static final Logger log = LoggerFactory.getLogger(SitePlanner.class);

    private final ParameterSet params;
    private final RuleSet rules;
    private final OptimizerConfig config;
    private final DurationTable durations;

    public SitePlanner(ParameterSet params) {
        this(params, RuleSet.defaults(), OptimizerConfig.defaults(), DurationTable.defaults());
    }

    public SitePlanner(ParameterSet params, RuleSet rules, OptimizerConfig config, DurationTable durations) {
        this.params = Objects.requireNonNull(params, "params");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.config = Objects.requireNonNull(config, "config");
        this.durations = Objects.requireNonNull(durations, "durations");
    }

    public SitePlanReport plan(SiteInput site) {
        return plan(site.getBoundary(), site.getReference().orElse(null), new OptimizerProgress());
    }

    public SitePlanReport plan(Boundary boundary, LineString reference) {
        return plan(boundary, reference, new OptimizerProgress());
    }

    /**
     * @param reference external road to front on, or null to use the longest edge
     * @param progress  live counters; cancelling it ends the run with the best layout so far
     * @throws InfeasibleGeometryException if the buffer leaves nothing buildable or no layout decodes
     * @throws NoValidFrontageException    if no boundary edge can take an entrance
     */
    public SitePlanReport plan(Boundary boundary, LineString reference, OptimizerProgress progress) {
        Objects.requireNonNull(boundary, "boundary");
        log.info("plan | site={} m2 | buffer={} m | reference={}", GeneticOptimizer.DF.format(boundary.area()),
                GeneticOptimizer.DF.format(params.getPerimeterBuffer()), reference != null);
        RoadNetworkGenerator.buildableArea(boundary, params.getPerimeterBuffer());
        EntrancePlacer.frontageEdges(boundary.shell(), reference, params.getEntranceClearance());

        LayoutDecoder decoder = new LayoutDecoder(boundary, reference, params);
        LayoutEvaluator evaluator = new LayoutEvaluator(decoder, new ComplianceValidator(rules),
                new TimelineEstimator(durations));
        OptimizationResult run = new GeneticOptimizer(evaluator, config).optimize(progress);
        SitePlanReport report = new SitePlanReport(run.getBest(), run);
        if (!report.isCompliant()) {
            log.warn("plan | no layout meets every hard rule; best has {} hard violation(s): {}",
                    report.getViolations().getHardCount(), report.getViolations().bySeverity(Severity.HARD));
        }
        log.info("plan | {}", report);
        return report;
    }
}
