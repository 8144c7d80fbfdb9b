package org.tesis.parque;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters of a running optimization, safe to read from another thread.
 * {@link #cancel()} asks the run to stop after the current generation; it
 * then returns the best layout found so far.
 */
public final class OptimizerProgress {

    private final AtomicInteger generations = new AtomicInteger();
    private final AtomicInteger evaluations = new AtomicInteger();
    private final AtomicLong startMillis = new AtomicLong();
    private final AtomicLong endMillis = new AtomicLong();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile double bestAggregate = Double.NaN;

    void start() {
        startMillis.set(System.currentTimeMillis());
        endMillis.set(0);
    }

    void finish() {
        endMillis.set(System.currentTimeMillis());
    }

    void generationDone() {
        generations.incrementAndGet();
    }

    void evaluated() {
        evaluations.incrementAndGet();
    }

    void best(double aggregate) {
        bestAggregate = aggregate;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int getGenerations() {
        return generations.get();
    }

    public int getEvaluations() {
        return evaluations.get();
    }

    public long getElapsedMillis() {
        long s = startMillis.get();
        if (s == 0) return 0;
        long e = endMillis.get();
        return (e == 0 ? System.currentTimeMillis() : e) - s;
    }

    /** Aggregate score of the best layout so far, NaN before the first generation. */
    public double getBestAggregate() {
        return bestAggregate;
    }
}
