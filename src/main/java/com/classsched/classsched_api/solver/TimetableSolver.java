package com.classsched.classsched_api.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classsched.classsched_api.model.TimetableInput;
import com.classsched.classsched_api.solver.conflict.ConflictResolver;
import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.facts.FactStore;
import com.classsched.classsched_api.solver.facts.FactStoreBuilder;
import com.classsched.classsched_api.solver.optimizer.LayeredOptimizer;
import com.classsched.classsched_api.solver.optimizer.ScheduleResult;
import com.classsched.classsched_api.solver.optimizer.SolverPreset;
import com.classsched.classsched_api.solver.rules.SoftConstraintEvaluator;

/**
 * Runs the whole pipeline for one input: facts, joint resolution, search and
 * soft-rule optimization. Input and configuration errors surface as
 * {@link com.classsched.classsched_api.exception.SchedulerException}s before
 * any search starts.
 */
public class TimetableSolver {

    private static final Logger logger = LoggerFactory.getLogger(TimetableSolver.class);

    private final SlotDomain slotDomain;
    private final ConflictResolver conflictResolver = new ConflictResolver();

    public TimetableSolver(SlotDomain slotDomain) {
        this.slotDomain = slotDomain;
    }

    public ScheduleResult solve(TimetableInput input, SolverPreset preset) {
        return solve(prepare(input), preset);
    }

    /** Validates the input and resolves joints, without searching. */
    public ResolvedProblem prepare(TimetableInput input) {
        FactStore facts = new FactStoreBuilder(slotDomain).build(input);
        return conflictResolver.resolve(facts);
    }

    public ScheduleResult solve(ResolvedProblem problem, SolverPreset preset) {
        FactStore facts = problem.getFacts();
        SoftConstraintEvaluator evaluator = new SoftConstraintEvaluator(facts, preset.getRules());
        logger.info("Solving {} units in {} groups with preset '{}'",
                facts.getUnits().size(), problem.groupCount(), preset.getName());
        ScheduleResult result = new LayeredOptimizer(problem, evaluator).optimize(preset.getSearch());
        return result.withPresetName(preset.getName());
    }
}
