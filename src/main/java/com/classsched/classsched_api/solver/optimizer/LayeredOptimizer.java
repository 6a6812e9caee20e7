package com.classsched.classsched_api.solver.optimizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.rules.Evaluation;
import com.classsched.classsched_api.solver.rules.LayeredRules;
import com.classsched.classsched_api.solver.rules.SoftConstraintEvaluator;
import com.classsched.classsched_api.solver.search.AssignmentEngine;
import com.classsched.classsched_api.solver.search.HardConstraintChecker;
import com.classsched.classsched_api.solver.search.SearchBudget;
import com.classsched.classsched_api.solver.search.SearchObjective;
import com.classsched.classsched_api.solver.search.SearchOutcome;
import com.classsched.classsched_api.solver.search.SearchSolution;

/**
 * Picks the best valid timetables under the layered soft rules: lower cost in
 * a higher-priority layer always wins, lower layers only break ties. Exact
 * ties are broken deterministically, so reruns within budget agree.
 */
public class LayeredOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(LayeredOptimizer.class);

    private final ResolvedProblem problem;
    private final SoftConstraintEvaluator evaluator;
    private final AssignmentEngine engine;
    private final HardConstraintChecker checker;

    public LayeredOptimizer(ResolvedProblem problem, SoftConstraintEvaluator evaluator) {
        this.problem = problem;
        this.evaluator = evaluator;
        this.engine = new AssignmentEngine(problem);
        this.checker = new HardConstraintChecker(problem);
    }

    public ScheduleResult optimize(SearchSettings settings) {
        SearchBudget budget = SearchBudget.of(settings.getMaxTime(), settings.getMaxNodes());
        LayeredRules rules = evaluator.getRules();
        SearchObjective objective = rules.isEmpty()
                ? SearchObjective.none()
                : new RuleObjective(problem, evaluator);
        logger.info("Optimizing {} groups with {} over {} layers (rules: {})",
                problem.groupCount(), settings.getStrategy(), rules.layerCount(), rules.getSettings());

        int wanted = settings.getNumSchedules();
        SearchOutcome outcome;
        List<Candidate> chosen = new ArrayList<>();
        int scored = 0;
        if (settings.getStrategy() == OptimizationStrategy.CANDIDATE_POOL) {
            outcome = engine.enumerate(objective, settings.getMaxCandidates(), budget);
            List<Candidate> pool = new ArrayList<>();
            for (SearchSolution solution : outcome.getSolutions()) {
                pool.add(candidate(solution));
                scored++;
            }
            pool.sort(Comparator.comparing((Candidate c) -> c.evaluation.getScore()).reversed()
                    .thenComparing(c -> c.timetable.serialize()));
            chosen.addAll(pool.subList(0, Math.min(wanted, pool.size())));
        } else {
            outcome = engine.optimize(objective, budget, settings.getThreads(), wanted);
            for (SearchSolution solution : outcome.getSolutions()) {
                chosen.add(candidate(solution));
                scored++;
            }
        }

        List<RankedTimetable> ranked = new ArrayList<>();
        for (Candidate candidate : chosen) {
            List<String> broken = checker.check(candidate.timetable);
            if (!broken.isEmpty()) {
                throw new IllegalStateException("Search produced an invalid timetable: " + broken);
            }
            ranked.add(new RankedTimetable(ranked.size() + 1, candidate.timetable, candidate.evaluation));
        }

        SolveStatus status = statusOf(outcome);
        SearchStatistics statistics = new SearchStatistics(settings.getStrategy(), outcome.getNodes(), scored,
                outcome.getElapsed().toMillis(), settings.getThreads());
        Candidate best = chosen.isEmpty() ? null : chosen.get(0);
        logger.info("Optimization finished with status {}, {} timetables, best score {} after {} nodes",
                status, ranked.size(), best == null ? "-" : best.evaluation.getScore(), outcome.getNodes());
        return new ScheduleResult(null, status, ranked,
                best == null ? List.of() : layerCosts(rules, best.evaluation),
                best == null ? List.of() : problem.conflicts(best.timetable),
                outcome.getDiagnostics(), statistics);
    }

    private Candidate candidate(SearchSolution solution) {
        Timetable timetable = problem.toTimetable(solution.getOpenMasks());
        return new Candidate(timetable, evaluator.evaluate(timetable, problem::isJoint));
    }

    private static SolveStatus statusOf(SearchOutcome outcome) {
        if (outcome.getSolutions().isEmpty()) {
            return outcome.isExhaustive() ? SolveStatus.INFEASIBLE : SolveStatus.UNKNOWN;
        }
        return outcome.isExhaustive() ? SolveStatus.OPTIMAL : SolveStatus.FEASIBLE;
    }

    private static List<LayerCost> layerCosts(LayeredRules rules, Evaluation evaluation) {
        List<LayerCost> layers = new ArrayList<>();
        for (int layer = 0; layer < rules.layerCount(); layer++) {
            layers.add(new LayerCost(layer, rules.getPriorities().get(layer), rules.rulesInLayer(layer),
                    evaluation.getLayerCosts()[layer]));
        }
        return layers;
    }

    private static final class Candidate {
        private final Timetable timetable;
        private final Evaluation evaluation;

        private Candidate(Timetable timetable, Evaluation evaluation) {
            this.timetable = timetable;
            this.evaluation = evaluation;
        }
    }
}
