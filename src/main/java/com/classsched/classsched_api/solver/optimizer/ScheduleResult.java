package com.classsched.classsched_api.solver.optimizer;

import java.util.List;
import java.util.Optional;

import com.classsched.classsched_api.solver.conflict.Conflict;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.rules.Evaluation;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;
import lombok.Getter;

/**
 * Outcome of one solve. Timetables are present only when the status is
 * {@link SolveStatus#OPTIMAL} or {@link SolveStatus#FEASIBLE}; the first of
 * {@link #getRanked()} is the best, and layer costs and conflicts describe it.
 */
@Getter
public final class ScheduleResult {

    private final String presetName;
    private final SolveStatus status;
    private final List<RankedTimetable> ranked;
    private final List<LayerCost> layerCosts;
    private final List<Conflict> conflicts;
    private final List<String> diagnostics;
    private final SearchStatistics statistics;

    ScheduleResult(String presetName, SolveStatus status, List<RankedTimetable> ranked,
                   List<LayerCost> layerCosts, List<Conflict> conflicts, List<String> diagnostics,
                   SearchStatistics statistics) {
        this.presetName = presetName;
        this.status = status;
        this.ranked = List.copyOf(ranked);
        this.layerCosts = List.copyOf(layerCosts);
        this.conflicts = List.copyOf(conflicts);
        this.diagnostics = List.copyOf(diagnostics);
        this.statistics = statistics;
    }

    public boolean hasTimetable() {
        return !ranked.isEmpty();
    }

    /** The best timetable, or null. */
    public Timetable getTimetable() {
        return ranked.isEmpty() ? null : ranked.get(0).getTimetable();
    }

    /** Evaluation of the best timetable, or null. */
    public Evaluation getEvaluation() {
        return ranked.isEmpty() ? null : ranked.get(0).getEvaluation();
    }

    public Optional<BendableLongScore> getScore() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0).getEvaluation().getScore());
    }

    public ScheduleResult withPresetName(String name) {
        return new ScheduleResult(name, status, ranked, layerCosts, conflicts, diagnostics, statistics);
    }
}
