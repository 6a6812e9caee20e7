package com.classsched.classsched_api.solver.search;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Incumbents shared by the branch-and-bound workers: the best {@code capacity}
 * solutions found so far, best first. The only mutable state the workers share
 * besides the node counter.
 */
final class SharedBound implements SolutionListener {

    private static final Logger logger = LoggerFactory.getLogger(SharedBound.class);

    private final int capacity;
    // Immutable, sorted best first, at most capacity entries
    private final AtomicReference<List<SearchSolution>> ranked = new AtomicReference<>(List.of());
    private final AtomicInteger improvements = new AtomicInteger();

    SharedBound(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public boolean prunes(BendableLongScore optimistic, int branch) {
        List<SearchSolution> current = ranked.get();
        if (current.size() < capacity) {
            return false;
        }
        SearchSolution worst = current.get(current.size() - 1);
        int comparison = optimistic.compareTo(worst.getScore());
        return comparison < 0 || (comparison == 0 && worst.getBranch() <= branch);
    }

    @Override
    public boolean onSolution(SearchSolution solution) {
        while (true) {
            List<SearchSolution> current = ranked.get();
            if (current.size() == capacity && !solution.isBetterThan(current.get(current.size() - 1))) {
                return true;
            }
            List<SearchSolution> next = new ArrayList<>(current.size() + 1);
            int position = 0;
            while (position < current.size() && current.get(position).isBetterThan(solution)) {
                position++;
            }
            next.addAll(current.subList(0, position));
            next.add(solution);
            next.addAll(current.subList(position, Math.min(current.size(), capacity - 1)));
            if (ranked.compareAndSet(current, List.copyOf(next))) {
                improvements.incrementAndGet();
                logger.debug("New incumbent {} from branch {} at rank {}", solution.getScore(), solution.getBranch(),
                        position + 1);
                return true;
            }
        }
    }

    List<SearchSolution> ranked() {
        return ranked.get();
    }

    int improvements() {
        return improvements.get();
    }
}
