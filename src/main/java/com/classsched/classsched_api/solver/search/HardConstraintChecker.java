package com.classsched.classsched_api.solver.search;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.conflict.SchedulingGroup;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.domain.Timeslot;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.facts.Teacher;
import com.classsched.classsched_api.solver.facts.Unit;
import com.classsched.classsched_api.solver.facts.UnitKey;

/**
 * Independent check of a finished timetable against every hard constraint.
 * Returns one message per violation; an empty list means valid.
 */
public class HardConstraintChecker {

    private static final Logger logger = LoggerFactory.getLogger(HardConstraintChecker.class);

    private final ResolvedProblem problem;
    private final SlotDomain slots;

    public HardConstraintChecker(ResolvedProblem problem) {
        this.problem = problem;
        this.slots = problem.getSlotDomain();
    }

    public List<String> check(Timetable timetable) {
        List<String> violations = new ArrayList<>();
        List<Unit> units = problem.getFacts().getUnits();
        for (Unit unit : units) {
            checkUnit(unit, timetable, violations);
        }
        for (int i = 0; i < units.size(); i++) {
            for (int j = i + 1; j < units.size(); j++) {
                checkPair(units.get(i), units.get(j), timetable, violations);
            }
        }
        if (!violations.isEmpty()) {
            logger.error("Timetable breaks {} hard constraints: {}", violations.size(), violations);
        }
        return violations;
    }

    private void checkUnit(Unit unit, Timetable timetable, List<String> violations) {
        UnitKey key = unit.getKey();
        long mask = timetable.maskOf(key);
        long fixed = timetable.fixedMaskOf(key);
        SchedulingGroup group = problem.groupOf(key);
        // Slots fixed for a joint partner are not this unit's choice either
        long open = mask & ~group.getFixedMask();

        if (Long.bitCount(mask) != unit.getNumClasses()) {
            violations.add(key + " has " + Long.bitCount(mask) + " meetings instead of " + unit.getNumClasses());
        }
        if (fixed != unit.getFixedMask()) {
            violations.add(key + " does not keep its fixed meetings " + slots.slotsOf(unit.getFixedMask()));
        }
        long outside = open & ~unit.getPrimaryLecturer().getAvailableMask();
        if (outside != 0L) {
            violations.add(key + " meets outside the availability of " + unit.getPrimaryLecturer()
                    + " at " + slots.slotsOf(outside));
        }
        long wrongPart = open & ~slots.partOfDayMask(unit.getAllowedParts());
        if (wrongPart != 0L) {
            violations.add(key + " meets outside " + unit.getAllowedParts() + " at " + slots.slotsOf(wrongPart));
        }
        if (group.isDoubleClass() && !isDoubleShape(open)) {
            violations.add(key + " is a double class but meets at " + slots.slotsOf(open));
        }
    }

    private void checkPair(Unit a, Unit b, Timetable timetable, List<String> violations) {
        long shared = timetable.maskOf(a.getKey()) & timetable.maskOf(b.getKey());
        if (problem.isJoint(a.getKey(), b.getKey())) {
            if (timetable.maskOf(a.getKey()) != timetable.maskOf(b.getKey())) {
                violations.add(a.getKey() + " and " + b.getKey() + " are joint but meet at different slots");
            }
            return;
        }
        if (shared == 0L) {
            return;
        }
        for (Teacher teacher : a.getLecturers()) {
            if (b.isTaughtBy(teacher)) {
                violations.add("Teacher " + teacher + " teaches " + a.getKey() + " and " + b.getKey()
                        + " at " + slots.slotsOf(shared));
            }
        }
    }

    // Non-fixed meetings of a double class: at most two, adjacent periods of one weekday
    private boolean isDoubleShape(long open) {
        List<Timeslot> meetings = slots.slotsOf(open);
        if (meetings.size() <= 1) {
            return true;
        }
        if (meetings.size() > 2) {
            return false;
        }
        Timeslot first = meetings.get(0);
        Timeslot second = meetings.get(1);
        return first.getWeekday() == second.getWeekday() && second.getPeriod() - first.getPeriod() == 1;
    }
}
