package com.classsched.classsched_api.solver.search;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

final class NoObjective implements SearchObjective {

    static final NoObjective INSTANCE = new NoObjective();

    private static final BendableLongScore ZERO = BendableLongScore.of(new long[1], new long[1]);
    private static final int[] NO_NEIGHBOURS = new int[0];

    private NoObjective() {
    }

    @Override
    public BendableLongScore zero() {
        return ZERO;
    }

    @Override
    public BendableLongScore local(int group, long openMask) {
        return ZERO;
    }

    @Override
    public BendableLongScore pair(int group, long openMask, int other, long otherOpenMask) {
        return ZERO;
    }

    @Override
    public int[] pairNeighbours(int group) {
        return NO_NEIGHBOURS;
    }
}
