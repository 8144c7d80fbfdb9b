package org.tesis.parque;

/**
 * Comparison between a measured quantity and a rule threshold.
 */
public enum Operator {
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("==");

    /** tolerance of {@link #EQ} */
    static final double EQ_TOL = 1e-9;

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public boolean holds(double measured, double threshold) {
        switch (this) {
            case LT: return measured < threshold;
            case LE: return measured <= threshold;
            case GT: return measured > threshold;
            case GE: return measured >= threshold;
            case EQ: return Math.abs(measured - threshold) <= EQ_TOL * Math.max(1.0, Math.abs(threshold));
            default: throw new IllegalStateException("unknown operator " + this);
        }
    }

    public String symbol() {
        return symbol;
    }
}
