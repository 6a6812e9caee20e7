package com.classsched.classsched_api.solver.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.classsched.classsched_api.solver.facts.UnitKey;

/**
 * A complete set of class meetings, kept in canonical order so two
 * timetables with the same meetings serialize identically.
 */
public final class Timetable {

    private final List<ClassMeeting> meetings;
    private final SortedMap<UnitKey, Long> masks;
    private final SortedMap<UnitKey, Long> fixedMasks;

    public Timetable(List<ClassMeeting> meetings) {
        List<ClassMeeting> sorted = new ArrayList<>(meetings);
        Collections.sort(sorted);
        this.meetings = Collections.unmodifiableList(sorted);

        SortedMap<UnitKey, Long> all = new TreeMap<>();
        SortedMap<UnitKey, Long> fixed = new TreeMap<>();
        for (ClassMeeting meeting : sorted) {
            all.merge(meeting.getUnit(), meeting.getSlot().bit(), (a, b) -> a | b);
            fixed.merge(meeting.getUnit(), meeting.isFixed() ? meeting.getSlot().bit() : 0L, (a, b) -> a | b);
        }
        this.masks = Collections.unmodifiableSortedMap(all);
        this.fixedMasks = Collections.unmodifiableSortedMap(fixed);
    }

    public List<ClassMeeting> getMeetings() { return meetings; }

    public int size() {
        return meetings.size();
    }

    public List<UnitKey> units() {
        return new ArrayList<>(masks.keySet());
    }

    /** Slots used by the unit, as a mask; 0 when the unit has no meeting. */
    public long maskOf(UnitKey unit) {
        return masks.getOrDefault(unit, 0L);
    }

    public long fixedMaskOf(UnitKey unit) {
        return fixedMasks.getOrDefault(unit, 0L);
    }

    /**
     * Canonical text form, used to break exact cost ties between candidates.
     */
    public String serialize() {
        return meetings.stream().map(ClassMeeting::toString).collect(Collectors.joining(";"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return meetings.equals(((Timetable) o).meetings);
    }

    @Override
    public int hashCode() {
        return meetings.hashCode();
    }

    @Override
    public String toString() {
        return serialize();
    }
}
