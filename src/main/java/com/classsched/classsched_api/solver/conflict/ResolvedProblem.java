package com.classsched.classsched_api.solver.conflict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.classsched.classsched_api.solver.domain.ClassMeeting;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.domain.Timeslot;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.facts.FactStore;
import com.classsched.classsched_api.solver.facts.Unit;
import com.classsched.classsched_api.solver.facts.UnitKey;
import com.classsched.classsched_api.solver.facts.UnitPair;

/**
 * Relations derived from the fact store: the joint closure (as scheduling
 * groups), teacher sharing between groups and the symmetric conflict
 * relation. Immutable.
 */
public final class ResolvedProblem {

    private final FactStore facts;
    private final List<SchedulingGroup> groups;
    private final Map<UnitKey, Integer> groupOf;
    private final int[][] teacherNeighbours;

    ResolvedProblem(FactStore facts, List<SchedulingGroup> groups, Map<UnitKey, Integer> groupOf,
                    int[][] teacherNeighbours) {
        this.facts = facts;
        this.groups = Collections.unmodifiableList(groups);
        this.groupOf = Collections.unmodifiableMap(groupOf);
        this.teacherNeighbours = teacherNeighbours;
    }

    public FactStore getFacts() { return facts; }
    public SlotDomain getSlotDomain() { return facts.getSlotDomain(); }
    public List<SchedulingGroup> getGroups() { return groups; }

    public int groupCount() {
        return groups.size();
    }

    public SchedulingGroup group(int index) {
        return groups.get(index);
    }

    public SchedulingGroup groupOf(UnitKey unit) {
        Integer index = groupOf.get(unit);
        if (index == null) {
            throw new NoSuchElementException("Unknown unit " + unit);
        }
        return groups.get(index);
    }

    /** Indexes of the other groups that share at least one teacher with the given one. */
    public int[] teacherNeighbours(int group) {
        return teacherNeighbours[group];
    }

    /** Joint closure: distinct units merged into the same group. */
    public boolean isJoint(UnitKey a, UnitKey b) {
        return !a.equals(b) && groupOf(a) == groupOf(b);
    }

    /**
     * Symmetric conflict relation: same slot, different units, not joint.
     */
    public boolean conflicts(ClassMeeting a, ClassMeeting b) {
        return a.getSlot().equals(b.getSlot())
                && !a.getUnit().equals(b.getUnit())
                && !isJoint(a.getUnit(), b.getUnit());
    }

    /**
     * Every conflict of the timetable, each unit pair and slot listed once in
     * canonical order.
     */
    public List<Conflict> conflicts(Timetable timetable) {
        List<Conflict> conflicts = new ArrayList<>();
        List<UnitKey> units = timetable.units();
        for (int i = 0; i < units.size(); i++) {
            for (int j = i + 1; j < units.size(); j++) {
                UnitKey a = units.get(i);
                UnitKey b = units.get(j);
                if (isJoint(a, b)) {
                    continue;
                }
                long shared = timetable.maskOf(a) & timetable.maskOf(b);
                for (Timeslot slot : getSlotDomain().slotsOf(shared)) {
                    conflicts.add(new Conflict(UnitPair.of(a, b), slot));
                }
            }
        }
        Collections.sort(conflicts);
        return conflicts;
    }

    /**
     * Builds the timetable for one open-slot mask per group. Joint members
     * receive identical slots; a meeting is marked fixed only for the member
     * whose own facts fix it.
     */
    public Timetable toTimetable(long[] openMasks) {
        if (openMasks.length != groups.size()) {
            throw new IllegalArgumentException("Expected " + groups.size() + " group masks, got " + openMasks.length);
        }
        List<ClassMeeting> meetings = new ArrayList<>();
        for (SchedulingGroup group : groups) {
            long open = openMasks[group.getIndex()];
            long fixed = group.getFixedMask();
            for (Unit unit : group.getMembers()) {
                for (Timeslot slot : getSlotDomain().slotsOf(open | fixed)) {
                    meetings.add(new ClassMeeting(unit.getKey(), slot, (unit.getFixedMask() & slot.bit()) != 0L));
                }
            }
        }
        return new Timetable(meetings);
    }
}
