package com.classsched.classsched_api.solver.rules;

import java.util.Set;

import lombok.Value;

/**
 * A validated, enabled soft rule with its weight, priority and options.
 */
@Value
public class RuleSetting {

    public static final int DEFAULT_SPACING_THRESHOLD = 3;
    public static final Set<String> DEFAULT_SCIENCE_CURRICULA = Set.of("sciences", "statistics");

    SoftRule rule;
    long weight;
    int priority;
    // Only read by MAXIMUM_SPACING
    int threshold;
    // Only read by SCIENCE_STATISTICS_CONFLICT
    Set<String> curricula;

    public static RuleSetting of(SoftRule rule, long weight, int priority) {
        return new RuleSetting(rule, weight, priority, DEFAULT_SPACING_THRESHOLD, DEFAULT_SCIENCE_CURRICULA);
    }
}
