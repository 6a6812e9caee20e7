package com.classsched.classsched_api.solver.search;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Scores partial assignments for the search. Scores never increase as groups
 * get assigned: local and pair terms are penalties (zero or negative), which
 * makes the best remaining local score of each unassigned group a valid
 * optimistic bound.
 *
 * <p>Masks passed in hold only the open (non-fixed) slots of a group.
 */
public interface SearchObjective {

    BendableLongScore zero();

    BendableLongScore local(int group, long openMask);

    BendableLongScore pair(int group, long openMask, int other, long otherOpenMask);

    /** Groups whose assignment can change the pair term of the given group. */
    int[] pairNeighbours(int group);

    /** Every timetable scores zero; the search then returns them in canonical order. */
    static SearchObjective none() {
        return NoObjective.INSTANCE;
    }
}
