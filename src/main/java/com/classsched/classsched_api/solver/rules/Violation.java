package com.classsched.classsched_api.solver.rules;

import java.util.List;

import com.classsched.classsched_api.solver.domain.Timeslot;
import com.classsched.classsched_api.solver.facts.UnitKey;

import lombok.Value;

/**
 * One witness of a soft rule being broken. Teacher and slot are null when the
 * rule does not refer to one.
 */
@Value
public class Violation {
    SoftRule rule;
    List<UnitKey> units;
    String teacherId;
    Timeslot slot;
    long weight;
    String detail;
}
