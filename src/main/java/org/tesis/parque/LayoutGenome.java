package org.tesis.parque;

import java.util.Arrays;
import java.util.Random;

/**
 * Parameterization of one candidate layout: a fixed vector of genes, each
 * normalized to [0, 1] and mapped to a concrete generator input by the
 * decoder. Immutable; equality is gene-wise.
 */
public final class LayoutGenome {

    public static final int LOT_DEPTH = 0;
    public static final int LOT_SIZE = 1;
    public static final int SPINE_OFFSET = 2;
    public static final int AXIS_FLIP = 3;
    public static final int SECONDARY_DELTA = 4;
    public static final int ENTRANCE_CHOICE = 5;
    public static final int CUT_SEED = 6;
    public static final int LENGTH = 7;

    /** entrance choices addressable by the choice gene */
    static final int ENTRANCE_CHOICES = 4;

    private final double[] genes;

    public LayoutGenome(double[] genes) {
        if (genes.length != LENGTH)
            throw new IllegalArgumentException("genome needs " + LENGTH + " genes, got " + genes.length);
        this.genes = new double[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            if (Double.isNaN(genes[i])) throw new IllegalArgumentException("gene " + i + " is NaN");
            this.genes[i] = GeomUtils.clip01(genes[i]);
        }
    }

    /** Genome reproducing the parameter-set targets: middle spine, base secondary count, first entrance. */
    public static LayoutGenome seeded(ParameterSet p) {
        double[] g = new double[LENGTH];
        g[LOT_DEPTH] = 0.5;
        double span = p.getLotSizeMax() - p.getLotSizeMin();
        g[LOT_SIZE] = span > 0 ? (p.getLotSizeTarget() - p.getLotSizeMin()) / span : 0.5;
        g[SPINE_OFFSET] = 0.5;
        g[AXIS_FLIP] = 0.0;
        g[SECONDARY_DELTA] = 0.5;
        g[ENTRANCE_CHOICE] = 0.0;
        g[CUT_SEED] = 0.5;
        return new LayoutGenome(g);
    }

    public static LayoutGenome random(Random rng) {
        double[] g = new double[LENGTH];
        for (int i = 0; i < LENGTH; i++) g[i] = rng.nextDouble();
        return new LayoutGenome(g);
    }

    public double gene(int i) {
        return genes[i];
    }

    public double[] genes() {
        return genes.clone();
    }

    LayoutGenome with(int i, double value) {
        double[] g = genes.clone();
        g[i] = value;
        return new LayoutGenome(g);
    }

    /** Target lot depth in [sqrt(target), 2 sqrt(target)]. */
    double lotDepth(double lotSizeTarget) {
        double base = Math.sqrt(lotSizeTarget);
        return base + genes[LOT_DEPTH] * base;
    }

    double lotSize(double min, double max) {
        return min + genes[LOT_SIZE] * (max - min);
    }

    double spineOffset() {
        return 0.3 + 0.4 * genes[SPINE_OFFSET];
    }

    boolean crossAxis() {
        return genes[AXIS_FLIP] >= 0.5;
    }

    int secondaryDelta() {
        double g = genes[SECONDARY_DELTA];
        return g < 1.0 / 3 ? -1 : (g < 2.0 / 3 ? 0 : 1);
    }

    int entranceChoice() {
        return Math.min(ENTRANCE_CHOICES - 1, (int) (genes[ENTRANCE_CHOICE] * ENTRANCE_CHOICES));
    }

    long cutSeed() {
        return (long) (genes[CUT_SEED] * Integer.MAX_VALUE);
    }

    /** Stable text key, used to break ties deterministically. */
    String key() {
        StringBuilder sb = new StringBuilder();
        for (double g : genes) sb.append(Long.toHexString(Double.doubleToLongBits(g))).append(':');
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LayoutGenome that)) return false;
        return Arrays.equals(genes, that.genes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(genes);
    }

    @Override
    public String toString() {
        return "LayoutGenome" + Arrays.toString(genes);
    }
}
