package com.classsched.classsched_api.solver.optimizer;

import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Budget and strategy of one optimization run.
 */
@Value
@AllArgsConstructor
public class SearchSettings {

    public static final Duration DEFAULT_MAX_TIME = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_CANDIDATES = 100;

    OptimizationStrategy strategy;
    // Null for no time limit
    Duration maxTime;
    int maxCandidates;
    // Zero for no node limit
    long maxNodes;
    int threads;
    // Best distinct timetables to return
    int numSchedules;

    public SearchSettings(OptimizationStrategy strategy, Duration maxTime, int maxCandidates, long maxNodes,
                          int threads) {
        this(strategy, maxTime, maxCandidates, maxNodes, threads, 1);
    }

    public static SearchSettings defaults() {
        return new SearchSettings(OptimizationStrategy.BRANCH_AND_BOUND, DEFAULT_MAX_TIME, DEFAULT_MAX_CANDIDATES,
                0L, Runtime.getRuntime().availableProcessors());
    }
}
