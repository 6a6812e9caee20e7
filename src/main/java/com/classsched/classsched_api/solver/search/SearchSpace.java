package com.classsched.classsched_api.solver.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.conflict.SchedulingGroup;
import com.classsched.classsched_api.solver.domain.SlotDomain;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Root state of one search: the candidate open-slot combinations of every
 * group after root-level pruning, ordered best local score first, then by
 * ascending mask. Immutable once built and shared by all workers.
 *
 * <p>Groups with nothing left to place are pre-assigned; they are not search
 * variables but their fixed meetings have already pruned their neighbours.
 * Groups with more than {@link #MAX_CANDIDATES_PER_GROUP} combinations are
 * not expanded; a search over such a space cannot be completed.
 */
final class SearchSpace {

    static final int MAX_CANDIDATES_PER_GROUP = 2_000_000;

    final ResolvedProblem problem;
    final SearchObjective objective;
    final int groupCount;
    final long[][] candidates;
    final BendableLongScore[][] localScores;
    final boolean[] preassigned;
    final int[][] initialDomains;
    final int[][] teacherNeighbours;
    final int[][] pairNeighbours;
    // Local and pair terms of the pre-assigned groups
    final BendableLongScore baseScore;
    final List<int[]> fixedClashes;
    final boolean[] oversized;

    private SearchSpace(ResolvedProblem problem, SearchObjective objective) {
        this.problem = problem;
        this.objective = objective;
        this.groupCount = problem.groupCount();
        this.candidates = new long[groupCount][];
        this.localScores = new BendableLongScore[groupCount][];
        this.preassigned = new boolean[groupCount];
        this.initialDomains = new int[groupCount][];
        this.teacherNeighbours = new int[groupCount][];
        this.pairNeighbours = new int[groupCount][];
        this.fixedClashes = new ArrayList<>();
        this.oversized = new boolean[groupCount];

        for (int g = 0; g < groupCount; g++) {
            teacherNeighbours[g] = problem.teacherNeighbours(g);
            pairNeighbours[g] = objective.pairNeighbours(g);
        }
        for (int g = 0; g < groupCount; g++) {
            SchedulingGroup group = problem.group(g);
            preassigned[g] = group.getOpenCount() == 0;
            long legal = prunedLegalMask(g);
            oversized[g] = !preassigned[g] && candidateCount(group, legal) > MAX_CANDIDATES_PER_GROUP;
            long[] raw;
            if (preassigned[g]) {
                raw = new long[] {0L};
            } else if (oversized[g]) {
                raw = new long[0];
            } else {
                raw = combinations(group, legal, problem.getSlotDomain());
            }
            order(g, raw);
            int[] domain = new int[candidates[g].length];
            for (int i = 0; i < domain.length; i++) {
                domain[i] = i;
            }
            initialDomains[g] = domain;
        }

        BendableLongScore base = objective.zero();
        for (int g = 0; g < groupCount; g++) {
            if (!preassigned[g]) {
                continue;
            }
            base = base.add(localScores[g][0]);
            for (int h : pairNeighbours[g]) {
                if (h < g && preassigned[h]) {
                    base = base.add(objective.pair(g, 0L, h, 0L));
                }
            }
        }
        this.baseScore = base;
    }

    static SearchSpace build(ResolvedProblem problem, SearchObjective objective) {
        return new SearchSpace(problem, objective);
    }

    /** Whether some group has no candidate left or two fixed meetings clash, before any search. */
    boolean infeasibleAtRoot() {
        if (!fixedClashes.isEmpty()) {
            return true;
        }
        for (int g = 0; g < groupCount; g++) {
            if (candidates[g].length == 0 && !oversized[g]) {
                return true;
            }
        }
        return false;
    }

    boolean hasOversizedGroups() {
        for (boolean tooLarge : oversized) {
            if (tooLarge) {
                return true;
            }
        }
        return false;
    }

    List<String> oversizedGroups() {
        List<String> messages = new ArrayList<>();
        for (int g = 0; g < groupCount; g++) {
            if (oversized[g]) {
                messages.add(problem.group(g) + " has " + candidateCount(problem.group(g), prunedLegal(g))
                        + " candidate slot combinations, more than the " + MAX_CANDIDATES_PER_GROUP
                        + " the search can hold; fix some of its meetings or narrow its parts of day");
            }
        }
        return messages;
    }

    /** Most constrained search variable at the root, or -1 when every group is pre-assigned. */
    int rootGroup() {
        int root = -1;
        for (int g = 0; g < groupCount; g++) {
            if (!preassigned[g] && (root < 0 || initialDomains[g].length < initialDomains[root].length)) {
                root = g;
            }
        }
        return root;
    }

    private long prunedLegalMask(int g) {
        SchedulingGroup group = problem.group(g);
        for (int h : teacherNeighbours[g]) {
            if (h > g && (group.getFixedMask() & problem.group(h).getFixedMask()) != 0L) {
                fixedClashes.add(new int[] {g, h});
            }
        }
        return prunedLegal(g);
    }

    private long prunedLegal(int g) {
        long legal = problem.group(g).legalMask();
        for (int h : teacherNeighbours[g]) {
            legal &= ~problem.group(h).getFixedMask();
        }
        return legal;
    }

    private void order(int g, long[] raw) {
        BendableLongScore[] scores = new BendableLongScore[raw.length];
        Integer[] indexes = new Integer[raw.length];
        for (int i = 0; i < raw.length; i++) {
            scores[i] = objective.local(g, raw[i]);
            indexes[i] = i;
        }
        Arrays.sort(indexes, Comparator.<Integer, BendableLongScore>comparing(i -> scores[i]).reversed()
                .thenComparingLong(i -> raw[i]));
        candidates[g] = new long[raw.length];
        localScores[g] = new BendableLongScore[raw.length];
        for (int i = 0; i < raw.length; i++) {
            candidates[g][i] = raw[indexes[i]];
            localScores[g][i] = scores[indexes[i]];
        }
    }

    /**
     * Every open-slot mask of the right size inside {@code legal}. Double
     * groups place their open meetings in at most two adjacent periods of one
     * weekday.
     */
    static long[] combinations(SchedulingGroup group, long legal, SlotDomain slots) {
        int open = group.getOpenCount();
        if (open == 0) {
            return new long[] {0L};
        }
        if (group.isDoubleClass()) {
            return doubleCombinations(open, legal, slots);
        }
        int[] bits = bitsOf(legal);
        long[] out = new long[(int) binomial(bits.length, open)];
        fill(bits, open, 0, 0L, out, new int[] {0});
        return out;
    }

    /** Number of masks {@link #combinations} would produce, without building them. */
    static long candidateCount(SchedulingGroup group, long legal) {
        int open = group.getOpenCount();
        if (open == 0) {
            return 1L;
        }
        if (group.isDoubleClass()) {
            return open > 2 ? 0L : Long.bitCount(legal);
        }
        return binomial(Long.bitCount(legal), open);
    }

    private static long[] doubleCombinations(int open, long legal, SlotDomain slots) {
        if (open == 1) {
            int[] bits = bitsOf(legal);
            long[] out = new long[bits.length];
            for (int i = 0; i < bits.length; i++) {
                out[i] = 1L << bits[i];
            }
            return out;
        }
        if (open > 2) {
            return new long[0];
        }
        List<Long> pairs = new ArrayList<>();
        for (int id : bitsOf(legal)) {
            boolean lastPeriod = slots.get(id).getPeriod() == SlotDomain.PERIODS_PER_DAY - 1;
            long pair = (1L << id) | (1L << (id + 1));
            if (!lastPeriod && (legal & pair) == pair) {
                pairs.add(pair);
            }
        }
        return pairs.stream().mapToLong(Long::longValue).toArray();
    }

    private static void fill(int[] bits, int remaining, int from, long acc, long[] out, int[] cursor) {
        if (remaining == 0) {
            out[cursor[0]++] = acc;
            return;
        }
        for (int i = from; i <= bits.length - remaining; i++) {
            fill(bits, remaining - 1, i + 1, acc | (1L << bits[i]), out, cursor);
        }
    }

    private static int[] bitsOf(long mask) {
        int[] bits = new int[Long.bitCount(mask)];
        int n = 0;
        for (long rest = mask; rest != 0L; rest &= rest - 1) {
            bits[n++] = Long.numberOfTrailingZeros(rest);
        }
        return bits;
    }

    static long binomial(int n, int k) {
        if (k < 0 || k > n) {
            return 0L;
        }
        long result = 1L;
        for (int i = 1; i <= Math.min(k, n - k); i++) {
            result = result * (n - i + 1) / i;
        }
        return result;
    }
}
