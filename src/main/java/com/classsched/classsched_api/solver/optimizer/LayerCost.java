package com.classsched.classsched_api.solver.optimizer;

import java.util.List;

import com.classsched.classsched_api.solver.rules.SoftRule;

import lombok.Value;

@Value
public class LayerCost {
    int layer;
    int priority;
    List<SoftRule> rules;
    long cost;
}
