package com.classsched.classsched_api.solver.optimizer;

import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.rules.Evaluation;

import lombok.Value;

/** One of the returned timetables; rank 1 is the best. */
@Value
public class RankedTimetable {
    int rank;
    Timetable timetable;
    Evaluation evaluation;
}
