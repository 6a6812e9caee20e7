package com.classsched.classsched_api.solver.facts;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

import com.classsched.classsched_api.solver.domain.PartOfDay;

import lombok.Getter;

/**
 * A course offering group with everything the search needs to know about it.
 */
@Getter
public final class Unit {

    private static final Comparator<Teacher> PRIMARY_ORDER = Comparator
            .comparingInt(Teacher::availability)
            .thenComparing(Teacher::getId);

    private final UnitKey key;
    private final Course course;
    private final List<Teacher> lecturers;
    private final Teacher primaryLecturer;
    private final Set<PartOfDay> allowedParts;
    private final long fixedMask;
    private final String name;

    Unit(UnitKey key, Course course, List<Teacher> lecturers, Set<PartOfDay> allowedParts,
         long fixedMask, String name) {
        this.key = key;
        this.course = course;
        this.lecturers = List.copyOf(lecturers);
        this.primaryLecturer = lecturers.stream().min(PRIMARY_ORDER)
                .orElseThrow(() -> new IllegalArgumentException("Unit " + key + " has no lecturer"));
        this.allowedParts = Set.copyOf(allowedParts);
        this.fixedMask = fixedMask;
        this.name = name;
    }

    public int getNumClasses() {
        return course.getNumClasses();
    }

    public int getFixedCount() {
        return Long.bitCount(fixedMask);
    }

    public boolean isTaughtBy(Teacher teacher) {
        return lecturers.contains(teacher);
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
