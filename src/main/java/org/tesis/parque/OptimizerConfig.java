package org.tesis.parque;

import java.util.Properties;

/**
 * Search settings of the genetic optimizer. Immutable; built with
 * {@link #builder()} or read from {@code optimizer.*} properties.
 */
public final class OptimizerConfig {

    static final int DEFAULT_POPULATION = 24;
    static final int DEFAULT_GENERATIONS = 40;
    static final double DEFAULT_CROSSOVER = 0.9;
    static final double DEFAULT_MUTATION = 0.2;
    static final int DEFAULT_TOURNAMENT = 2;
    static final int DEFAULT_STAGNATION = 8;
    static final double DEFAULT_STAGNATION_EPS = 1e-4;
    static final long DEFAULT_SEED = 42L;

    private final int populationSize;
    private final int maxGenerations;
    private final double crossoverRate;
    private final double mutationRate;
    private final double mutationSigma;
    private final int tournamentSize;
    private final int stagnationWindow;
    private final double stagnationEpsilon;
    private final int threads;
    private final long seed;
    private final long budgetMillis;

    private OptimizerConfig(Builder b) {
        this.populationSize = b.populationSize;
        this.maxGenerations = b.maxGenerations;
        this.crossoverRate = b.crossoverRate;
        this.mutationRate = b.mutationRate;
        this.mutationSigma = b.mutationSigma;
        this.tournamentSize = b.tournamentSize;
        this.stagnationWindow = b.stagnationWindow;
        this.stagnationEpsilon = b.stagnationEpsilon;
        this.threads = b.threads;
        this.seed = b.seed;
        this.budgetMillis = b.budgetMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OptimizerConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code optimizer.population}, {@code optimizer.generations},
     * {@code optimizer.crossoverRate}, {@code optimizer.mutationRate},
     * {@code optimizer.mutationSigma}, {@code optimizer.tournamentSize},
     * {@code optimizer.stagnationWindow}, {@code optimizer.stagnationEpsilon},
     * {@code optimizer.threads}, {@code optimizer.seed} and
     * {@code optimizer.budgetMillis}; missing keys keep their defaults.
     */
    public static OptimizerConfig fromProperties(Properties p) {
        Builder b = builder();
        String v;
        if ((v = get(p, "population")) != null) b.populationSize(Integer.parseInt(v));
        if ((v = get(p, "generations")) != null) b.maxGenerations(Integer.parseInt(v));
        if ((v = get(p, "crossoverRate")) != null) b.crossoverRate(Double.parseDouble(v));
        if ((v = get(p, "mutationRate")) != null) b.mutationRate(Double.parseDouble(v));
        if ((v = get(p, "mutationSigma")) != null) b.mutationSigma(Double.parseDouble(v));
        if ((v = get(p, "tournamentSize")) != null) b.tournamentSize(Integer.parseInt(v));
        if ((v = get(p, "stagnationWindow")) != null) b.stagnationWindow(Integer.parseInt(v));
        if ((v = get(p, "stagnationEpsilon")) != null) b.stagnationEpsilon(Double.parseDouble(v));
        if ((v = get(p, "threads")) != null) b.threads(Integer.parseInt(v));
        if ((v = get(p, "seed")) != null) b.seed(Long.parseLong(v));
        if ((v = get(p, "budgetMillis")) != null) b.budgetMillis(Long.parseLong(v));
        return b.build();
    }

    private static String get(Properties p, String key) {
        String v = p.getProperty("optimizer." + key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public int getMaxGenerations() {
        return maxGenerations;
    }

    public double getCrossoverRate() {
        return crossoverRate;
    }

    /** Per-gene probability of a Gaussian step. */
    public double getMutationRate() {
        return mutationRate;
    }

    public double getMutationSigma() {
        return mutationSigma;
    }

    public int getTournamentSize() {
        return tournamentSize;
    }

    public int getStagnationWindow() {
        return stagnationWindow;
    }

    public double getStagnationEpsilon() {
        return stagnationEpsilon;
    }

    public int getThreads() {
        return threads;
    }

    public long getSeed() {
        return seed;
    }

    /** Wall-clock budget in ms, 0 for none. */
    public long getBudgetMillis() {
        return budgetMillis;
    }

    @Override
    public String toString() {
        return "OptimizerConfig{pop=" + populationSize + ", gens=" + maxGenerations + ", pc=" + crossoverRate
                + ", pm=" + mutationRate + ", threads=" + threads + ", seed=" + seed + "}";
    }

    public static final class Builder {
        private int populationSize = DEFAULT_POPULATION;
        private int maxGenerations = DEFAULT_GENERATIONS;
        private double crossoverRate = DEFAULT_CROSSOVER;
        private double mutationRate = DEFAULT_MUTATION;
        private double mutationSigma = 0.1;
        private int tournamentSize = DEFAULT_TOURNAMENT;
        private int stagnationWindow = DEFAULT_STAGNATION;
        private double stagnationEpsilon = DEFAULT_STAGNATION_EPS;
        private int threads = Runtime.getRuntime().availableProcessors();
        private long seed = DEFAULT_SEED;
        private long budgetMillis = 0;

        public Builder populationSize(int v) {
            this.populationSize = v;
            return this;
        }

        public Builder maxGenerations(int v) {
            this.maxGenerations = v;
            return this;
        }

        public Builder crossoverRate(double v) {
            this.crossoverRate = v;
            return this;
        }

        public Builder mutationRate(double v) {
            this.mutationRate = v;
            return this;
        }

        public Builder mutationSigma(double v) {
            this.mutationSigma = v;
            return this;
        }

        public Builder tournamentSize(int v) {
            this.tournamentSize = v;
            return this;
        }

        public Builder stagnationWindow(int v) {
            this.stagnationWindow = v;
            return this;
        }

        public Builder stagnationEpsilon(double v) {
            this.stagnationEpsilon = v;
            return this;
        }

        public Builder threads(int v) {
            this.threads = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder budgetMillis(long v) {
            this.budgetMillis = v;
            return this;
        }

        public OptimizerConfig build() {
            if (populationSize < 2) throw new IllegalArgumentException("population must be >= 2: " + populationSize);
            if (maxGenerations < 0) throw new IllegalArgumentException("generations must be >= 0: " + maxGenerations);
            if (crossoverRate < 0 || crossoverRate > 1) throw new IllegalArgumentException("crossover rate outside [0,1]: " + crossoverRate);
            if (mutationRate < 0 || mutationRate > 1) throw new IllegalArgumentException("mutation rate outside [0,1]: " + mutationRate);
            if (!(mutationSigma > 0)) throw new IllegalArgumentException("mutation sigma must be > 0: " + mutationSigma);
            if (tournamentSize < 1 || tournamentSize > populationSize)
                throw new IllegalArgumentException("tournament size outside [1,population]: " + tournamentSize);
            if (stagnationWindow < 1) throw new IllegalArgumentException("stagnation window must be >= 1: " + stagnationWindow);
            if (stagnationEpsilon < 0) throw new IllegalArgumentException("stagnation epsilon must be >= 0: " + stagnationEpsilon);
            if (threads < 1) throw new IllegalArgumentException("threads must be >= 1: " + threads);
            if (budgetMillis < 0) throw new IllegalArgumentException("budget must be >= 0: " + budgetMillis);
            return new OptimizerConfig(this);
        }
    }
}
