package org.tesis.parque;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Evaluations of one optimization run keyed by genome. Owned by the run, so
 * nothing leaks between runs with different boundaries or parameters.
 */
final class DecodeCache {

    private final ConcurrentMap<LayoutGenome, Evaluation> entries = new ConcurrentHashMap<>();

    /** Cached evaluation, or {@code compute}'s result stored for next time. */
    Evaluation get(LayoutGenome genome, Function<LayoutGenome, Evaluation> compute) {
        Evaluation e = entries.get(genome);
        if (e != null) return e;
        // decoding runs outside the map lock; a concurrent twin computes the same value
        e = compute.apply(genome);
        Evaluation prev = entries.putIfAbsent(genome, e);
        return prev != null ? prev : e;
    }

    int size() {
        return entries.size();
    }
}
