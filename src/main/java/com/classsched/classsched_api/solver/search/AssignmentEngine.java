package com.classsched.classsched_api.solver.search;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classsched.classsched_api.solver.conflict.ResolvedProblem;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Backtracking search for timetables that satisfy every hard constraint.
 *
 * <p>Variables are scheduling groups, values are open-slot masks. The next
 * group is the one with the fewest remaining values; assigning a group removes
 * overlapping values from the groups that share a teacher with it. The engine
 * keeps no state between calls.
 */
public class AssignmentEngine {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentEngine.class);

    private final ResolvedProblem problem;

    public AssignmentEngine(ResolvedProblem problem) {
        this.problem = problem;
    }

    public ResolvedProblem getProblem() {
        return problem;
    }

    /** First valid timetable in canonical depth-first order. */
    public SearchOutcome findFirst(SearchBudget budget) {
        return optimize(SearchObjective.none(), budget, 1, 1);
    }

    /**
     * Up to {@code limit} distinct valid timetables in depth-first order, the
     * values of each group tried best local score first. The outcome is
     * exhaustive when the tree holds no more than {@code limit} timetables.
     */
    public SearchOutcome enumerate(SearchObjective objective, int limit, SearchBudget budget) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        SearchSpace space = SearchSpace.build(problem, objective);
        if (space.infeasibleAtRoot()) {
            return infeasible(space, budget);
        }
        if (space.hasOversizedGroups()) {
            return tooLarge(space, budget);
        }
        List<SearchSolution> found = new ArrayList<>();
        SolutionListener collector = new SolutionListener() {
            @Override
            public boolean prunes(BendableLongScore optimistic, int branch) {
                return false;
            }

            @Override
            public boolean onSolution(SearchSolution solution) {
                // One timetable past the limit proves the tree is larger
                if (found.size() == limit) {
                    return false;
                }
                found.add(solution);
                return true;
            }
        };
        boolean complete = new SearchWorker(space, budget, collector, 0).runAll();
        logger.info("Enumerated {} timetables in {} nodes (complete: {})", found.size(), budget.getNodes(), complete);
        List<String> diagnostics = complete && found.isEmpty()
                ? new InfeasibilityDiagnoser(problem, space).diagnose()
                : List.of();
        return new SearchOutcome(found, complete, budget.getNodes(), budget.elapsed(), diagnostics);
    }

    /** Branch and bound for the single best timetable under {@code objective}. */
    public SearchOutcome optimize(SearchObjective objective, SearchBudget budget, int threads) {
        return optimize(objective, budget, threads, 1);
    }

    /**
     * Branch and bound: the {@code count} best distinct timetables under
     * {@code objective}, best first. Root values are split among
     * {@code threads} workers; on equal scores the lowest root branch wins,
     * then the earlier timetable of that branch in depth-first order.
     */
    public SearchOutcome optimize(SearchObjective objective, SearchBudget budget, int threads, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got " + count);
        }
        SearchSpace space = SearchSpace.build(problem, objective);
        if (space.infeasibleAtRoot()) {
            return infeasible(space, budget);
        }
        if (space.hasOversizedGroups()) {
            return tooLarge(space, budget);
        }
        SharedBound bound = new SharedBound(count);
        int root = space.rootGroup();
        boolean complete;
        if (root < 0) {
            complete = new SearchWorker(space, budget, bound, 0).runAll();
        } else {
            complete = runBranches(space, budget, bound, root, threads);
        }
        logger.info("Search finished after {} nodes in {} ms: {} improvements, complete: {}",
                budget.getNodes(), budget.elapsed().toMillis(), bound.improvements(), complete);

        List<SearchSolution> solutions = bound.ranked();
        List<String> diagnostics = complete && solutions.isEmpty()
                ? new InfeasibilityDiagnoser(problem, space).diagnose()
                : List.of();
        return new SearchOutcome(solutions, complete, budget.getNodes(), budget.elapsed(), diagnostics);
    }

    private boolean runBranches(SearchSpace space, SearchBudget budget, SharedBound bound, int root, int threads) {
        int branches = space.initialDomains[root].length;
        List<Callable<Boolean>> tasks = new ArrayList<>(branches);
        for (int b = 0; b < branches; b++) {
            final int branch = b;
            final int value = space.initialDomains[root][b];
            tasks.add(() -> new SearchWorker(space, budget, bound, branch).runBranch(root, value));
        }
        int workers = Math.max(1, Math.min(threads, branches));
        logger.debug("Splitting {} root values of group {} among {} workers", branches, problem.group(root), workers);

        if (workers == 1) {
            boolean complete = true;
            for (Callable<Boolean> task : tasks) {
                complete &= call(task);
            }
            return complete;
        }

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "search-worker-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            boolean complete = true;
            for (Future<Boolean> future : pool.invokeAll(tasks)) {
                complete &= future.get();
            }
            return complete;
        } catch (InterruptedException e) {
            budget.exhaust();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Search interrupted", e);
        } catch (ExecutionException e) {
            budget.exhaust();
            throw new IllegalStateException("Search worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private static boolean call(Callable<Boolean> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Search worker failed", e);
        }
    }

    private SearchOutcome tooLarge(SearchSpace space, SearchBudget budget) {
        List<String> diagnostics = space.oversizedGroups();
        logger.warn("Search space too large to expand: {}", diagnostics);
        return new SearchOutcome(List.of(), false, budget.getNodes(), budget.elapsed(), diagnostics);
    }

    private SearchOutcome infeasible(SearchSpace space, SearchBudget budget) {
        List<String> diagnostics = new InfeasibilityDiagnoser(problem, space).diagnose();
        logger.info("Infeasible before search: {}", diagnostics);
        return new SearchOutcome(List.of(), true, budget.getNodes(), budget.elapsed(), diagnostics);
    }
}
