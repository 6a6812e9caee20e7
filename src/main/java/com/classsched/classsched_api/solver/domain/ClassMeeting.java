package com.classsched.classsched_api.solver.domain;

import java.util.Comparator;

import com.classsched.classsched_api.solver.facts.UnitKey;

import lombok.Value;

/**
 * One weekly meeting of a unit. Fixed meetings were pinned by the user.
 */
@Value
public class ClassMeeting implements Comparable<ClassMeeting> {

    private static final Comparator<ClassMeeting> ORDER = Comparator
            .comparing(ClassMeeting::getUnit)
            .thenComparing(ClassMeeting::getSlot);

    UnitKey unit;
    Timeslot slot;
    boolean fixed;

    @Override
    public int compareTo(ClassMeeting other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return unit + "@" + slot.getWeekday() + "." + slot.getPeriod() + (fixed ? "!" : "");
    }
}
