package com.classsched.classsched_api.solver.search;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

interface SolutionListener {

    /** Whether a node whose best reachable score is {@code optimistic} can be skipped. */
    boolean prunes(BendableLongScore optimistic, int branch);

    /** @return false to stop the search */
    boolean onSolution(SearchSolution solution);
}
