package com.classsched.classsched_api.solver.optimizer;

import com.classsched.classsched_api.solver.rules.LayeredRules;

import lombok.Value;

/**
 * A validated preset: which soft rules apply, in which layers, and how long to search.
 */
@Value
public class SolverPreset {
    String name;
    LayeredRules rules;
    SearchSettings search;
}
