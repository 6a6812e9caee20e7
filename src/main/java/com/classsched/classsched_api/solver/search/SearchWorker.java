package com.classsched.classsched_api.solver.search;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Depth-first search over one root branch (or the whole tree). Not thread
 * safe; every worker owns its domains and assignment.
 */
final class SearchWorker {

    private final SearchSpace space;
    private final SearchBudget budget;
    private final SolutionListener listener;
    private final int branch;

    // Current domains: indexes into space.candidates, kept in candidate order
    private final int[][] domains;
    private final long[] masks;
    private final boolean[] assigned;
    private int unassigned;
    private boolean stopped;
    private long solutionsFound;

    SearchWorker(SearchSpace space, SearchBudget budget, SolutionListener listener, int branch) {
        this.space = space;
        this.budget = budget;
        this.listener = listener;
        this.branch = branch;
        this.domains = space.initialDomains.clone();
        this.masks = new long[space.groupCount];
        this.assigned = space.preassigned.clone();
        for (boolean done : assigned) {
            if (!done) {
                unassigned++;
            }
        }
    }

    /**
     * Explores the subtree below the given root value.
     *
     * @return true when the subtree was fully explored or pruned
     */
    boolean runBranch(int rootGroup, int rootValue) {
        if (budget.tick()) {
            tryValue(rootGroup, rootValue, space.baseScore);
        } else {
            stopped = true;
        }
        return !stopped;
    }

    /** @return true when the whole tree was explored */
    boolean runAll() {
        if (!listener.prunes(optimistic(space.baseScore), branch)) {
            descend(space.baseScore);
        }
        return !stopped;
    }

    private void descend(BendableLongScore score) {
        if (unassigned == 0) {
            if (!listener.onSolution(new SearchSolution(masks.clone(), score, branch, solutionsFound++))) {
                stopped = true;
            }
            return;
        }
        int group = selectGroup();
        for (int value : domains[group]) {
            if (!budget.tick()) {
                stopped = true;
                return;
            }
            tryValue(group, value, score);
            if (stopped) {
                return;
            }
        }
    }

    private void tryValue(int group, int value, BendableLongScore score) {
        long mask = space.candidates[group][value];
        int[] neighbours = space.teacherNeighbours[group];
        int[][] saved = null;
        boolean wipeout = false;
        for (int k = 0; k < neighbours.length && !wipeout; k++) {
            int other = neighbours[k];
            if (assigned[other]) {
                continue;
            }
            int[] filtered = filter(other, mask);
            if (filtered != domains[other]) {
                if (saved == null) {
                    saved = new int[neighbours.length][];
                }
                saved[k] = domains[other];
                domains[other] = filtered;
            }
            wipeout = filtered.length == 0;
        }

        if (!wipeout) {
            assigned[group] = true;
            masks[group] = mask;
            unassigned--;
            BendableLongScore next = score.add(space.localScores[group][value]);
            for (int other : space.pairNeighbours[group]) {
                if (assigned[other] && other != group) {
                    next = next.add(space.objective.pair(group, mask, other, masks[other]));
                }
            }
            if (!listener.prunes(optimistic(next), branch)) {
                descend(next);
            }
            unassigned++;
            masks[group] = 0L;
            assigned[group] = false;
        }

        if (saved != null) {
            for (int k = 0; k < neighbours.length; k++) {
                if (saved[k] != null) {
                    domains[neighbours[k]] = saved[k];
                }
            }
        }
    }

    /** Returns the same array when nothing is removed. */
    private int[] filter(int group, long taken) {
        int[] domain = domains[group];
        long[] values = space.candidates[group];
        int kept = 0;
        for (int value : domain) {
            if ((values[value] & taken) == 0L) {
                kept++;
            }
        }
        if (kept == domain.length) {
            return domain;
        }
        int[] filtered = new int[kept];
        int n = 0;
        for (int value : domain) {
            if ((values[value] & taken) == 0L) {
                filtered[n++] = value;
            }
        }
        return filtered;
    }

    // Fewest remaining values first, lowest index on ties
    private int selectGroup() {
        int best = -1;
        for (int g = 0; g < domains.length; g++) {
            if (!assigned[g] && (best < 0 || domains[g].length < domains[best].length)) {
                best = g;
            }
        }
        return best;
    }

    private BendableLongScore optimistic(BendableLongScore score) {
        BendableLongScore bound = score;
        for (int g = 0; g < domains.length; g++) {
            if (!assigned[g] && domains[g].length > 0) {
                bound = bound.add(space.localScores[g][domains[g][0]]);
            }
        }
        return bound;
    }
}
