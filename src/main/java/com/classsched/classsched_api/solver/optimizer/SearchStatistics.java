package com.classsched.classsched_api.solver.optimizer;

import lombok.Value;

@Value
public class SearchStatistics {
    OptimizationStrategy strategy;
    long nodes;
    int candidatesScored;
    long elapsedMillis;
    int threads;
}
