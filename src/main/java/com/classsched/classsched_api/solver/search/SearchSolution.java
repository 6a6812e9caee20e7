package com.classsched.classsched_api.solver.search;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;
import lombok.Value;

/**
 * A complete assignment: one open-slot mask per scheduling group, with its
 * score, the root branch it was found in and its position among the
 * solutions of that branch in depth-first order.
 */
@Value
public class SearchSolution {
    long[] openMasks;
    BendableLongScore score;
    int branch;
    long sequence;

    /** Higher score wins; equal scores go to the lower root branch, then the earlier solution. */
    public boolean isBetterThan(SearchSolution other) {
        int comparison = score.compareTo(other.score);
        if (comparison != 0) {
            return comparison > 0;
        }
        return branch != other.branch ? branch < other.branch : sequence < other.sequence;
    }
}
