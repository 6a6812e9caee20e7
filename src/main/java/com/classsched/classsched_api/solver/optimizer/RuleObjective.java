package com.classsched.classsched_api.solver.optimizer;

import java.util.ArrayList;
import java.util.List;

import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.conflict.SchedulingGroup;
import com.classsched.classsched_api.solver.facts.Unit;
import com.classsched.classsched_api.solver.rules.SoftConstraintEvaluator;
import com.classsched.classsched_api.solver.rules.Violation;
import com.classsched.classsched_api.solver.search.SearchObjective;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Search objective backed by the soft rules. The local term of a group sums
 * the unit-local violations of its members; the pair term of two groups sums
 * the pairwise violations between their members.
 */
class RuleObjective implements SearchObjective {

    private final ResolvedProblem problem;
    private final SoftConstraintEvaluator evaluator;
    private final int[][] pairNeighbours;

    RuleObjective(ResolvedProblem problem, SoftConstraintEvaluator evaluator) {
        this.problem = problem;
        this.evaluator = evaluator;
        this.pairNeighbours = computePairNeighbours();
    }

    @Override
    public BendableLongScore zero() {
        return evaluator.getRules().zeroScore();
    }

    @Override
    public BendableLongScore local(int group, long openMask) {
        SchedulingGroup g = problem.group(group);
        long fixed = g.getFixedMask();
        List<Violation> violations = new ArrayList<>();
        for (Unit unit : g.getMembers()) {
            violations.addAll(evaluator.unitViolations(unit, openMask | fixed, unit.getFixedMask()));
        }
        return evaluator.score(violations);
    }

    @Override
    public BendableLongScore pair(int group, long openMask, int other, long otherOpenMask) {
        SchedulingGroup g = problem.group(group);
        SchedulingGroup h = problem.group(other);
        long maskG = openMask | g.getFixedMask();
        long maskH = otherOpenMask | h.getFixedMask();
        if ((maskG & maskH) == 0L) {
            return zero();
        }
        List<Violation> violations = new ArrayList<>();
        for (Unit a : g.getMembers()) {
            for (Unit b : h.getMembers()) {
                violations.addAll(evaluator.pairViolations(a, maskG, b, maskH));
            }
        }
        return evaluator.score(violations);
    }

    @Override
    public int[] pairNeighbours(int group) {
        return pairNeighbours[group];
    }

    private int[][] computePairNeighbours() {
        int n = problem.groupCount();
        List<List<Integer>> adjacency = new ArrayList<>();
        for (int g = 0; g < n; g++) {
            adjacency.add(new ArrayList<>());
        }
        if (evaluator.hasPairwiseRules()) {
            for (int g = 0; g < n; g++) {
                for (int h = g + 1; h < n; h++) {
                    if (related(problem.group(g), problem.group(h))) {
                        adjacency.get(g).add(h);
                        adjacency.get(h).add(g);
                    }
                }
            }
        }
        int[][] result = new int[n][];
        for (int g = 0; g < n; g++) {
            result[g] = adjacency.get(g).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    private boolean related(SchedulingGroup g, SchedulingGroup h) {
        for (Unit a : g.getMembers()) {
            for (Unit b : h.getMembers()) {
                if (evaluator.pairRelevant(a, b)) {
                    return true;
                }
            }
        }
        return false;
    }
}
