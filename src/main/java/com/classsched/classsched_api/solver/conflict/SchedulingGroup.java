package com.classsched.classsched_api.solver.conflict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.classsched.classsched_api.solver.domain.PartOfDay;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.facts.Teacher;
import com.classsched.classsched_api.solver.facts.Unit;
import com.classsched.classsched_api.solver.facts.UnitKey;

/**
 * Jointly taught units merged into the single entity the search assigns.
 * Carries the union of its members' hard constraints.
 */
public final class SchedulingGroup {

    private final int index;
    private final List<Unit> members;
    private final int numClasses;
    private final long fixedMask;
    private final boolean doubleClass;
    private final Set<PartOfDay> allowedParts;
    private final long partMask;
    private final long availableMask;
    private final List<Teacher> teachers;

    SchedulingGroup(int index, List<Unit> members, SlotDomain slotDomain) {
        this.index = index;
        this.members = List.copyOf(members);
        this.numClasses = members.get(0).getNumClasses();

        long fixed = 0L;
        long available = slotDomain.fullMask();
        boolean anyDouble = false;
        Set<PartOfDay> parts = EnumSet.allOf(PartOfDay.class);
        Set<Teacher> allTeachers = new TreeSet<>(Comparator.comparing(Teacher::getId));
        for (Unit unit : members) {
            fixed |= unit.getFixedMask();
            available &= unit.getPrimaryLecturer().getAvailableMask();
            anyDouble |= unit.getCourse().isDoubleClass();
            parts.retainAll(unit.getAllowedParts());
            allTeachers.addAll(unit.getLecturers());
        }
        this.fixedMask = fixed;
        this.availableMask = available;
        this.doubleClass = anyDouble;
        this.allowedParts = parts;
        this.partMask = slotDomain.partOfDayMask(parts);
        this.teachers = new ArrayList<>(allTeachers);
    }

    public int getIndex() { return index; }
    public List<Unit> getMembers() { return members; }
    public int getNumClasses() { return numClasses; }
    public long getFixedMask() { return fixedMask; }
    public boolean isDoubleClass() { return doubleClass; }
    public Set<PartOfDay> getAllowedParts() { return allowedParts; }
    public long getPartMask() { return partMask; }
    /** Slots where every member's primary lecturer is available. */
    public long getAvailableMask() { return availableMask; }
    public List<Teacher> getTeachers() { return teachers; }

    public UnitKey getKey() {
        return members.get(0).getKey();
    }

    public int getFixedCount() {
        return Long.bitCount(fixedMask);
    }

    /** Number of meetings the search still has to place. */
    public int getOpenCount() {
        return numClasses - getFixedCount();
    }

    /** Slots a non-fixed meeting may use, before any conflict pruning. */
    public long legalMask() {
        return availableMask & partMask & ~fixedMask;
    }

    public boolean sharesTeacherWith(SchedulingGroup other) {
        for (Teacher teacher : teachers) {
            if (other.teachers.contains(teacher)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (members.size() == 1) {
            return getKey().toString();
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) sb.append(" + ");
            sb.append(members.get(i).getKey());
        }
        return sb.append(']').toString();
    }
}
