package com.classsched.classsched_api.solver.optimizer;

public enum OptimizationStrategy {
    /** Prune with the incumbent; proves optimality when it finishes. */
    BRANCH_AND_BOUND,
    /** Enumerate a bounded number of valid timetables and keep the cheapest. */
    CANDIDATE_POOL
}
