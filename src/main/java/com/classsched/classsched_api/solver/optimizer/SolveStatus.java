package com.classsched.classsched_api.solver.optimizer;

public enum SolveStatus {
    /** Best timetable of the explored space; the space was explored completely. */
    OPTIMAL,
    /** Valid timetable, not proven best. */
    FEASIBLE,
    /** No valid timetable exists. */
    INFEASIBLE,
    /** The budget ran out before any valid timetable was found. */
    UNKNOWN
}
