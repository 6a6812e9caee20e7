package com.classsched.classsched_api.solver.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.conflict.SchedulingGroup;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.facts.Teacher;

/**
 * Best-effort explanation of why no timetable exists. Looks for groups left
 * without candidates, clashing fixed meetings and overloaded teachers; the
 * search can still fail when none of these apply.
 */
final class InfeasibilityDiagnoser {

    private final ResolvedProblem problem;
    private final SearchSpace space;
    private final SlotDomain slots;

    InfeasibilityDiagnoser(ResolvedProblem problem, SearchSpace space) {
        this.problem = problem;
        this.space = space;
        this.slots = problem.getSlotDomain();
    }

    List<String> diagnose() {
        List<String> findings = new ArrayList<>();
        for (int[] clash : space.fixedClashes) {
            SchedulingGroup a = problem.group(clash[0]);
            SchedulingGroup b = problem.group(clash[1]);
            findings.add("Fixed meetings of " + a + " and " + b + " share a teacher and clash at "
                    + slots.slotsOf(a.getFixedMask() & b.getFixedMask()));
        }
        for (int g = 0; g < space.groupCount; g++) {
            if (space.candidates[g].length == 0 && !space.oversized[g]) {
                findings.add(emptyDomain(problem.group(g)));
            }
        }
        findings.addAll(overloadedTeachers());
        if (findings.isEmpty()) {
            findings.add("Every group has candidate slots, but no combination avoids all teacher clashes");
        }
        return findings;
    }

    // Applies the hard rules one at a time and names the first that leaves too few slots
    private String emptyDomain(SchedulingGroup group) {
        int open = group.getOpenCount();
        long remaining = slots.fullMask() & ~group.getFixedMask();
        remaining &= group.getAvailableMask();
        if (Long.bitCount(remaining) < open) {
            return group + " needs " + open + " slots but its primary lecturer is available in only "
                    + Long.bitCount(remaining);
        }
        remaining &= group.getPartMask();
        if (Long.bitCount(remaining) < open) {
            return group + " needs " + open + " slots but only " + Long.bitCount(remaining)
                    + " available slots fall in " + group.getAllowedParts();
        }
        for (int h : space.teacherNeighbours[group.getIndex()]) {
            remaining &= ~problem.group(h).getFixedMask();
        }
        if (Long.bitCount(remaining) < open) {
            return group + " needs " + open + " slots but fixed meetings of its teachers leave only "
                    + Long.bitCount(remaining);
        }
        if (group.isDoubleClass()) {
            return group + " is a double class but no two consecutive periods of one weekday are free for "
                    + open + " meetings";
        }
        return group + " has no candidate slots";
    }

    private List<String> overloadedTeachers() {
        Map<String, List<SchedulingGroup>> byTeacher = new TreeMap<>();
        for (SchedulingGroup group : problem.getGroups()) {
            for (Teacher teacher : group.getTeachers()) {
                byTeacher.computeIfAbsent(teacher.getId(), t -> new ArrayList<>()).add(group);
            }
        }
        List<String> findings = new ArrayList<>();
        byTeacher.forEach((teacher, groups) -> {
            int needed = 0;
            long usable = 0L;
            long fixed = 0L;
            for (SchedulingGroup group : groups) {
                needed += group.getOpenCount();
                usable |= group.legalMask();
                fixed |= group.getFixedMask();
            }
            int free = Long.bitCount(usable & ~fixed);
            if (groups.size() > 1 && needed > free) {
                findings.add("Teacher " + teacher + " has " + needed + " meetings to place across "
                        + groups.size() + " groups but only " + free + " usable slots");
            }
        });
        return findings;
    }
}
