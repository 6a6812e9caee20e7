package com.classsched.classsched_api.solver.facts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.classsched.classsched_api.solver.domain.SlotDomain;

/**
 * Normalized, validated facts of one scheduling problem. Read-only once
 * built; shared by every search worker without locking.
 */
public final class FactStore {

    private final SlotDomain slotDomain;
    private final Map<String, Course> courses;
    private final Map<String, Teacher> teachers;
    private final SortedMap<UnitKey, Unit> units;
    private final List<CurriculumMembership> curricula;
    private final SortedSet<UnitPair> joints;
    private final Map<String, Set<String>> curriculaByCourse;
    private final Set<String> requiredCourses;

    FactStore(SlotDomain slotDomain, Map<String, Course> courses, Map<String, Teacher> teachers,
              Map<UnitKey, Unit> units, List<CurriculumMembership> curricula, Set<UnitPair> joints) {
        this.slotDomain = slotDomain;
        this.courses = Collections.unmodifiableMap(new TreeMap<>(courses));
        this.teachers = Collections.unmodifiableMap(new TreeMap<>(teachers));
        this.units = Collections.unmodifiableSortedMap(new TreeMap<>(units));
        this.curricula = List.copyOf(curricula);
        this.joints = Collections.unmodifiableSortedSet(new TreeSet<>(joints));

        Map<String, Set<String>> byCourse = new TreeMap<>();
        Set<String> required = new TreeSet<>();
        for (CurriculumMembership membership : curricula) {
            byCourse.computeIfAbsent(membership.getCourseId(), c -> new TreeSet<>())
                    .add(membership.getCurriculumId());
            if (membership.isRequired()) {
                required.add(membership.getCourseId());
            }
        }
        byCourse.replaceAll((course, ids) -> Collections.unmodifiableSet(ids));
        this.curriculaByCourse = Collections.unmodifiableMap(byCourse);
        this.requiredCourses = Collections.unmodifiableSet(required);
    }

    public SlotDomain getSlotDomain() { return slotDomain; }
    public Map<String, Course> getCourses() { return courses; }
    public Map<String, Teacher> getTeachers() { return teachers; }
    public List<CurriculumMembership> getCurricula() { return curricula; }
    public SortedSet<UnitPair> getJoints() { return joints; }

    /** Units in canonical key order. */
    public List<Unit> getUnits() {
        return new ArrayList<>(units.values());
    }

    public Unit unit(UnitKey key) {
        Unit unit = units.get(key);
        if (unit == null) {
            throw new NoSuchElementException("Unknown unit " + key);
        }
        return unit;
    }

    public Set<String> curriculaOf(String courseId) {
        return curriculaByCourse.getOrDefault(courseId, Set.of());
    }

    /** Whether the course is required by at least one curriculum. */
    public boolean isRequired(String courseId) {
        return requiredCourses.contains(courseId);
    }

    public boolean shareCurriculum(String courseA, String courseB) {
        Set<String> a = curriculaOf(courseA);
        if (a.isEmpty()) {
            return false;
        }
        for (String curriculum : curriculaOf(courseB)) {
            if (a.contains(curriculum)) {
                return true;
            }
        }
        return false;
    }

}
