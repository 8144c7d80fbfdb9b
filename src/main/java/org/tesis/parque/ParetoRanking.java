package org.tesis.parque;

import java.util.*;

/**
 * Non-dominated sorting with crowding distance over a list of evaluations.
 * Domination is constrained: fewer hard violations always dominates, and
 * only evaluations with equal hard counts are compared on the objectives.
 */
final class ParetoRanking {

    private final int[] rank;
    private final double[] crowding;
    private final List<List<Integer>> fronts;

    private ParetoRanking(int[] rank, double[] crowding, List<List<Integer>> fronts) {
        this.rank = rank;
        this.crowding = crowding;
        this.fronts = fronts;
    }

    static boolean dominates(Evaluation a, Evaluation b) {
        if (a.hardRank() != b.hardRank()) return a.hardRank() < b.hardRank();
        boolean strictly = false;
        for (int i = 0; i < Evaluation.OBJECTIVES; i++) {
            double x = a.objective(i), y = b.objective(i);
            if (x > y) return false;
            if (x < y) strictly = true;
        }
        return strictly;
    }

    static ParetoRanking of(List<Evaluation> pop) {
        int n = pop.size();
        int[] rank = new int[n];
        int[] dominatedBy = new int[n];
        List<List<Integer>> dominates = new ArrayList<>(n);
        for (int i = 0; i < n; i++) dominates.add(new ArrayList<>());
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (dominates(pop.get(i), pop.get(j))) {
                    dominates.get(i).add(j);
                    dominatedBy[j]++;
                } else if (dominates(pop.get(j), pop.get(i))) {
                    dominates.get(j).add(i);
                    dominatedBy[i]++;
                }
            }
        }
        List<List<Integer>> fronts = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        for (int i = 0; i < n; i++) if (dominatedBy[i] == 0) current.add(i);
        int r = 0;
        while (!current.isEmpty()) {
            fronts.add(current);
            List<Integer> next = new ArrayList<>();
            for (int i : current) {
                rank[i] = r;
                for (int j : dominates.get(i)) if (--dominatedBy[j] == 0) next.add(j);
            }
            Collections.sort(next);
            current = next;
            r++;
        }
        double[] crowding = new double[n];
        for (List<Integer> f : fronts) crowd(pop, f, crowding);
        return new ParetoRanking(rank, crowding, fronts);
    }

    private static void crowd(List<Evaluation> pop, List<Integer> front, double[] crowding) {
        if (front.size() <= 2) {
            for (int i : front) crowding[i] = Double.POSITIVE_INFINITY;
            return;
        }
        List<Integer> sorted = new ArrayList<>(front);
        for (int m = 0; m < Evaluation.OBJECTIVES; m++) {
            final int obj = m;
            sorted.sort(Comparator.comparingDouble((Integer i) -> pop.get(i).objective(obj))
                    .thenComparing(i -> pop.get(i).getGenome().key()));
            double lo = pop.get(sorted.get(0)).objective(m);
            double hi = pop.get(sorted.get(sorted.size() - 1)).objective(m);
            crowding[sorted.get(0)] = Double.POSITIVE_INFINITY;
            crowding[sorted.get(sorted.size() - 1)] = Double.POSITIVE_INFINITY;
            if (hi - lo <= 0) continue;
            for (int k = 1; k < sorted.size() - 1; k++) {
                double gap = pop.get(sorted.get(k + 1)).objective(m) - pop.get(sorted.get(k - 1)).objective(m);
                crowding[sorted.get(k)] += gap / (hi - lo);
            }
        }
    }

    int rank(int i) {
        return rank[i];
    }

    double crowding(int i) {
        return crowding[i];
    }

    /** Indices per front, best front first. */
    List<List<Integer>> fronts() {
        return fronts;
    }

    /** Selection order: lower rank, then larger crowding distance, then genome key. */
    Comparator<Integer> order(List<Evaluation> pop) {
        return Comparator.comparingInt((Integer i) -> rank[i])
                .thenComparing(i -> -crowding[i])
                .thenComparing(i -> pop.get(i).getGenome().key());
    }
}
