package com.classsched.classsched_api.solver.facts;

import java.util.Comparator;

import lombok.Value;

/**
 * Identifies a schedulable unit: one offering group of one course.
 */
@Value
public class UnitKey implements Comparable<UnitKey> {

    private static final Comparator<UnitKey> ORDER = Comparator
            .comparing(UnitKey::getCourseId)
            .thenComparing(UnitKey::getGroupId);

    String courseId;
    String groupId;

    public static UnitKey of(String courseId, String groupId) {
        return new UnitKey(courseId, groupId);
    }

    @Override
    public int compareTo(UnitKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return courseId + "/" + groupId;
    }
}
