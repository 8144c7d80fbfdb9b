package org.tesis.parque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.DecimalFormat;
import java.util.*;
import java.util.concurrent.*;

/**
 * NSGA-II search over layout genomes. Each generation breeds a full set of
 * offspring by tournament, uniform crossover and Gaussian mutation, decodes
 * them in parallel, and keeps the best half of parents plus offspring by
 * constrained Pareto rank and crowding distance. All random draws happen on
 * the calling thread, so a seed gives the same result for any thread count.
 */
public class GeneticOptimizer {

    private static final Logger log = LoggerFactory.getLogger(GeneticOptimizer.class);
    static final DecimalFormat DF = new DecimalFormat("#,##0.###");

    private final LayoutEvaluator evaluator;
    private final OptimizerConfig config;

    public GeneticOptimizer(LayoutEvaluator evaluator, OptimizerConfig config) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.config = Objects.requireNonNull(config, "config");
    }

    public OptimizationResult optimize() {
        return optimize(new OptimizerProgress());
    }

    /**
     * Runs until the generation cap, stagnation, the wall-clock budget or
     * cancellation through {@code progress}, whichever comes first.
     *
     * @throws InfeasibleGeometryException if no genome of the run could be decoded
     */
    public OptimizationResult optimize(OptimizerProgress progress) {
        progress.start();
        long t0 = System.currentTimeMillis();
        long deadline = config.getBudgetMillis() > 0 ? t0 + config.getBudgetMillis() : Long.MAX_VALUE;
        Random rng = new Random(config.getSeed());
        DecodeCache cache = new DecodeCache();
        int n = config.getPopulationSize();
        log.info("optimizer | population={} | generations={} | genes={} | threads={} | seed={}",
                n, config.getMaxGenerations(), LayoutGenome.LENGTH, config.getThreads(), config.getSeed());

        ExecutorService pool = Executors.newFixedThreadPool(config.getThreads(), daemonThreads());
        try {
            List<LayoutGenome> genomes = new ArrayList<>(n);
            genomes.add(LayoutGenome.seeded(evaluator.getParams()));
            while (genomes.size() < n) genomes.add(LayoutGenome.random(rng));
            List<Evaluation> pop = evaluateAll(genomes, cache, pool, progress);
            if (pop == null) throw new SitePlanException("optimization interrupted before the first generation");
            ParetoRanking ranking = ParetoRanking.of(pop);
            Evaluation best = pick(pop);
            progress.best(best.aggregate());
            log.info("initial | {}", describe(best));

            OptimizationResult.StopReason stop = OptimizationResult.StopReason.GENERATION_CAP;
            int gen = 0, lastImprove = 0;
            while (gen < config.getMaxGenerations()) {
                if (progress.isCancelled() || Thread.currentThread().isInterrupted()) {
                    stop = OptimizationResult.StopReason.CANCELLED;
                    break;
                }
                if (System.currentTimeMillis() >= deadline) {
                    stop = OptimizationResult.StopReason.DEADLINE;
                    break;
                }
                gen++;
                List<LayoutGenome> children = new ArrayList<>(n);
                while (children.size() < n) {
                    LayoutGenome a = tournament(pop, ranking, rng);
                    LayoutGenome b = tournament(pop, ranking, rng);
                    LayoutGenome[] pair = rng.nextDouble() < config.getCrossoverRate()
                            ? crossover(a, b, rng) : new LayoutGenome[]{a, b};
                    children.add(mutate(pair[0], rng));
                    if (children.size() < n) children.add(mutate(pair[1], rng));
                }
                List<Evaluation> offspring = evaluateAll(children, cache, pool, progress);
                if (offspring == null) {
                    stop = OptimizationResult.StopReason.CANCELLED;
                    gen--;
                    break;
                }
                List<Evaluation> merged = new ArrayList<>(pop);
                merged.addAll(offspring);
                pop = survivors(merged, n);
                ranking = ParetoRanking.of(pop);
                progress.generationDone();

                Evaluation genBest = pick(merged);
                if (improves(genBest, best)) {
                    best = genBest;
                    lastImprove = gen;
                    progress.best(best.aggregate());
                    log.info("improvement | gen {} | {}", gen, describe(best));
                }
                log.debug("Gen {} | front={} | best={} | cache={}", gen, ranking.fronts().get(0).size(),
                        DF.format(best.aggregate()), cache.size());
                if (gen - lastImprove >= config.getStagnationWindow()) {
                    stop = OptimizationResult.StopReason.STAGNATION;
                    break;
                }
            }

            if (best.isFailed()) {
                throw new InfeasibleGeometryException("no layout could be built for this boundary: " + best.getFailure());
            }
            List<Evaluation> front = new ArrayList<>();
            for (int i : ranking.fronts().get(0)) if (!pop.get(i).isFailed()) front.add(pop.get(i));
            long elapsed = System.currentTimeMillis() - t0;
            summary(best, gen, cache.size(), elapsed, stop);
            return new OptimizationResult(best, front, gen, cache.size(), elapsed, stop);
        } finally {
            progress.finish();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads() {
        return r -> {
            Thread t = new Thread(r, "layout-eval");
            t.setDaemon(true);
            return t;
        };
    }

    /** Evaluations in genome order, or null when the run was interrupted. */
    private List<Evaluation> evaluateAll(List<LayoutGenome> genomes, DecodeCache cache, ExecutorService pool,
                                         OptimizerProgress progress) {
        List<Callable<Evaluation>> tasks = new ArrayList<>(genomes.size());
        for (LayoutGenome g : genomes) {
            tasks.add(() -> cache.get(g, x -> {
                progress.evaluated();
                return evaluator.evaluate(x);
            }));
        }
        List<Evaluation> out = new ArrayList<>(genomes.size());
        try {
            for (Future<Evaluation> f : pool.invokeAll(tasks)) out.add(f.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new SitePlanException("layout evaluation failed", cause);
        }
        return out;
    }

    private LayoutGenome tournament(List<Evaluation> pop, ParetoRanking ranking, Random rng) {
        Comparator<Integer> order = ranking.order(pop);
        int best = rng.nextInt(pop.size());
        for (int k = 1; k < config.getTournamentSize(); k++) {
            int c = rng.nextInt(pop.size());
            if (order.compare(c, best) < 0) best = c;
        }
        return pop.get(best).getGenome();
    }

    // uniform crossover, one coin per gene
    private static LayoutGenome[] crossover(LayoutGenome a, LayoutGenome b, Random rng) {
        double[] x = a.genes(), y = b.genes();
        for (int i = 0; i < LayoutGenome.LENGTH; i++) {
            if (rng.nextBoolean()) {
                double t = x[i];
                x[i] = y[i];
                y[i] = t;
            }
        }
        return new LayoutGenome[]{new LayoutGenome(x), new LayoutGenome(y)};
    }

    private LayoutGenome mutate(LayoutGenome g, Random rng) {
        double[] x = g.genes();
        boolean changed = false;
        for (int i = 0; i < LayoutGenome.LENGTH; i++) {
            if (rng.nextDouble() < config.getMutationRate()) {
                x[i] = GeomUtils.clip01(x[i] + rng.nextGaussian() * config.getMutationSigma());
                changed = true;
            }
        }
        return changed ? new LayoutGenome(x) : g;
    }

    // NSGA-II environmental selection over parents + offspring
    static List<Evaluation> survivors(List<Evaluation> merged, int n) {
        ParetoRanking r = ParetoRanking.of(merged);
        List<Integer> idx = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) idx.add(i);
        idx.sort(r.order(merged));
        List<Evaluation> out = new ArrayList<>(n);
        for (int k = 0; k < n; k++) out.add(merged.get(idx.get(k)));
        return out;
    }

    static Evaluation pick(List<Evaluation> pop) {
        Evaluation best = pop.get(0);
        for (Evaluation e : pop) if (e.betterThan(best)) best = e;
        return best;
    }

    private boolean improves(Evaluation candidate, Evaluation best) {
        if (candidate.hardRank() != best.hardRank()) return candidate.hardRank() < best.hardRank();
        return candidate.aggregate() > best.aggregate() + config.getStagnationEpsilon();
    }

    private static String describe(Evaluation e) {
        if (e.isFailed()) return "unbuildable: " + e.getFailure();
        LayoutMetrics m = e.getMetrics();
        return "lots=" + m.getLotCount()
                + " | salable=" + DF.format(100.0 * m.getSalableFraction()) + " %"
                + " | hard=" + e.getReport().getHardCount()
                + " | soft=" + e.getReport().getSoftCount()
                + " | score=" + DF.format(e.aggregate());
    }

    private static void summary(Evaluation best, int gens, int evaluations, long ms, OptimizationResult.StopReason stop) {
        LayoutMetrics m = best.getMetrics();
        log.info("------------------------------");
        log.info("OPTIMIZATION SUMMARY");
        log.info("Lots               : {}", m.getLotCount());
        log.info("Salable area       : {} %", DF.format(100.0 * m.getSalableFraction()));
        log.info("Road area          : {} %", DF.format(100.0 * m.getRoadFraction()));
        log.info("Green area         : {} %", DF.format(100.0 * m.getGreenFraction()));
        log.info("Hard / soft        : {} / {}", best.getReport().getHardCount(), best.getReport().getSoftCount());
        log.info("Aggregate score    : {} ({})", DF.format(best.aggregate()), best.getScore().grade());
        log.info("Generations        : {} ({})", gens, stop);
        log.info("Evaluations        : {}", evaluations);
        log.info("Elapsed            : {} ms ({} s)", ms, DF.format(ms / 1000.0));
        log.info("------------------------------");
    }
}
