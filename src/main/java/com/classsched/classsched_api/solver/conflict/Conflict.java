package com.classsched.classsched_api.solver.conflict;

import com.classsched.classsched_api.solver.domain.Timeslot;
import com.classsched.classsched_api.solver.facts.UnitPair;

import lombok.Value;

/**
 * Two non-joint units meeting in the same slot, reported once per pair.
 */
@Value
public class Conflict implements Comparable<Conflict> {
    UnitPair pair;
    Timeslot slot;

    @Override
    public int compareTo(Conflict other) {
        int cmp = pair.compareTo(other.pair);
        return cmp != 0 ? cmp : slot.compareTo(other.slot);
    }
}
