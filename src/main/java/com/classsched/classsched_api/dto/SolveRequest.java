package com.classsched.classsched_api.dto;

import java.util.Map;

import com.classsched.classsched_api.config.SchedulerProperties.RuleProperties;
import com.classsched.classsched_api.model.TimetableInput;
import com.classsched.classsched_api.solver.optimizer.OptimizationStrategy;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Facts to schedule plus optional preset name and overrides. Null fields
 * fall back to the preset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SolveRequest {
    private TimetableInput input;
    private String preset;
    private Map<String, RuleProperties> rules;
    private Long maxTimeSeconds;
    private Integer maxCandidates;
    private Long maxNodes;
    private Integer threads;
    private OptimizationStrategy strategy;
    private Integer numSchedules;

    public SolveRequest(TimetableInput input) {
        this.input = input;
    }
}
