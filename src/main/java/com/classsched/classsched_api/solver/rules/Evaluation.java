package com.classsched.classsched_api.solver.rules;

import java.util.List;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;
import lombok.Value;

/**
 * Soft-constraint report of one timetable.
 */
@Value
public class Evaluation {
    List<Violation> violations;
    // Indexed by layer, highest priority first
    long[] layerCosts;
    BendableLongScore score;

    public long totalCost() {
        long total = 0L;
        for (long cost : layerCosts) {
            total += cost;
        }
        return total;
    }

    public long costOf(SoftRule rule) {
        return violations.stream().filter(v -> v.getRule() == rule).mapToLong(Violation::getWeight).sum();
    }
}
