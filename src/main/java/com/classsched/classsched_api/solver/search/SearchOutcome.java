package com.classsched.classsched_api.solver.search;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

/**
 * What a search produced. {@code exhaustive} means the part of the tree the
 * search was asked about was fully explored (or pruned) within budget.
 */
@Getter
public final class SearchOutcome {

    private final List<SearchSolution> solutions;
    private final boolean exhaustive;
    private final long nodes;
    private final Duration elapsed;
    private final List<String> diagnostics;

    SearchOutcome(List<SearchSolution> solutions, boolean exhaustive, long nodes, Duration elapsed,
                  List<String> diagnostics) {
        this.solutions = List.copyOf(solutions);
        this.exhaustive = exhaustive;
        this.nodes = nodes;
        this.elapsed = elapsed;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Optional<SearchSolution> best() {
        return solutions.isEmpty() ? Optional.empty() : Optional.of(solutions.get(0));
    }

    public boolean isInfeasible() {
        return exhaustive && solutions.isEmpty();
    }
}
