package com.classsched.classsched_api.solver.rules;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classsched.classsched_api.solver.domain.PartOfDay;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.domain.Timeslot;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.facts.FactStore;
import com.classsched.classsched_api.solver.facts.Teacher;
import com.classsched.classsched_api.solver.facts.Unit;
import com.classsched.classsched_api.solver.facts.UnitKey;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Computes soft-constraint violations of full or partial timetables.
 *
 * <p>Unit-local rules only look at the slots of one unit; pairwise rules look
 * at two units that are not taught jointly. The cost of a complete timetable is
 * the sum of the local costs of every unit and the pairwise costs of every
 * unordered pair of non-joint units, so the search can add them up
 * incrementally and {@link #evaluate(Timetable, JointPredicate)} returns the
 * same totals.
 */
public class SoftConstraintEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(SoftConstraintEvaluator.class);

    /** Tells the evaluator which distinct units are taught jointly. */
    @FunctionalInterface
    public interface JointPredicate {
        boolean isJoint(UnitKey a, UnitKey b);
    }

    private final FactStore facts;
    private final LayeredRules rules;
    private final SlotDomain slots;
    private final long morningMask;
    private final long fridayAfterMorningMask;
    private final List<RuleSetting> localSettings = new ArrayList<>();
    private final List<RuleSetting> pairSettings = new ArrayList<>();

    public SoftConstraintEvaluator(FactStore facts, LayeredRules rules) {
        this.facts = facts;
        this.rules = rules;
        this.slots = facts.getSlotDomain();
        this.morningMask = slots.partOfDayMask(EnumSet.of(PartOfDay.MORNING));
        this.fridayAfterMorningMask = slots.weekdayMask(DayOfWeek.FRIDAY.getValue() - 1) & ~morningMask;
        for (RuleSetting setting : rules.getSettings()) {
            if (setting.getRule().isPairwise()) {
                pairSettings.add(setting);
            } else {
                localSettings.add(setting);
            }
        }
    }

    public LayeredRules getRules() {
        return rules;
    }

    public FactStore getFacts() {
        return facts;
    }

    public boolean hasPairwiseRules() {
        return !pairSettings.isEmpty();
    }

    /**
     * Violations of the unit-local rules.
     *
     * @param mask all slots of the unit, fixed ones included
     * @param fixedMask the fixed subset of {@code mask}
     */
    public List<Violation> unitViolations(Unit unit, long mask, long fixedMask) {
        List<Violation> violations = new ArrayList<>();
        for (RuleSetting setting : localSettings) {
            switch (setting.getRule()) {
                case NON_MORNING_CLASS:
                    nonMorning(setting, unit, mask, violations);
                    break;
                case DIFFERENT_PARTS_OF_DAY:
                    differentParts(setting, unit, mask, violations);
                    break;
                case UNDERGRAD_FRIDAY_AFTERNOON:
                    fridayAfternoon(setting, unit, mask & ~fixedMask, violations);
                    break;
                case TEACHER_PREFERENCE:
                    teacherPreference(setting, unit, mask, violations);
                    break;
                case MAXIMUM_SPACING:
                    maximumSpacing(setting, unit, mask, violations);
                    break;
                default:
                    throw new IllegalStateException("Rule " + setting.getRule() + " is not unit-local");
            }
        }
        return violations;
    }

    /**
     * Violations of the pairwise rules between two distinct, non-joint units.
     */
    public List<Violation> pairViolations(Unit a, long maskA, Unit b, long maskB) {
        List<Violation> violations = new ArrayList<>();
        long shared = maskA & maskB;
        if (shared == 0L) {
            return violations;
        }
        for (RuleSetting setting : pairSettings) {
            switch (setting.getRule()) {
                case CURRICULUM_CONFLICT:
                    if (curriculumRelated(a, b)) {
                        sharedSlots(setting, a, b, shared, "common curriculum", violations);
                    }
                    break;
                case SCIENCE_STATISTICS_CONFLICT:
                    if (scienceStatisticsRelated(setting, a, b)) {
                        sharedSlots(setting, a, b, shared, "science/statistics against required course", violations);
                    }
                    break;
                default:
                    throw new IllegalStateException("Rule " + setting.getRule() + " is not pairwise");
            }
        }
        return violations;
    }

    /** Whether some enabled pairwise rule can fire between the two units. */
    public boolean pairRelevant(Unit a, Unit b) {
        for (RuleSetting setting : pairSettings) {
            switch (setting.getRule()) {
                case CURRICULUM_CONFLICT:
                    if (curriculumRelated(a, b)) return true;
                    break;
                case SCIENCE_STATISTICS_CONFLICT:
                    if (scienceStatisticsRelated(setting, a, b)) return true;
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    /** Per-layer cost of a list of violations. */
    public long[] layerCosts(List<Violation> violations) {
        long[] costs = new long[rules.layerCount()];
        for (Violation violation : violations) {
            costs[rules.layerOf(violation.getRule())] += violation.getWeight();
        }
        return costs;
    }

    public BendableLongScore score(List<Violation> violations) {
        return rules.toScore(layerCosts(violations));
    }

    /**
     * Full evaluation of a timetable. Units whose key the predicate reports as
     * joint are not compared by the pairwise rules.
     */
    public Evaluation evaluate(Timetable timetable, JointPredicate joint) {
        List<Violation> violations = new ArrayList<>();
        List<UnitKey> keys = timetable.units();
        for (UnitKey key : keys) {
            violations.addAll(unitViolations(facts.unit(key), timetable.maskOf(key), timetable.fixedMaskOf(key)));
        }
        if (!pairSettings.isEmpty()) {
            for (int i = 0; i < keys.size(); i++) {
                for (int j = i + 1; j < keys.size(); j++) {
                    UnitKey a = keys.get(i);
                    UnitKey b = keys.get(j);
                    if (joint.isJoint(a, b)) {
                        continue;
                    }
                    violations.addAll(pairViolations(facts.unit(a), timetable.maskOf(a),
                            facts.unit(b), timetable.maskOf(b)));
                }
            }
        }
        long[] costs = layerCosts(violations);
        logger.debug("Evaluated timetable of {} meetings: {} violations, layer costs {}",
                timetable.size(), violations.size(), costs);
        return new Evaluation(List.copyOf(violations), costs, rules.toScore(costs));
    }

    private void nonMorning(RuleSetting setting, Unit unit, long mask, List<Violation> out) {
        for (Timeslot slot : slots.slotsOf(mask & ~morningMask)) {
            out.add(violation(setting, List.of(unit.getKey()), null, slot, "meets in the " + slot.getPartOfDay()));
        }
    }

    private void differentParts(RuleSetting setting, Unit unit, long mask, List<Violation> out) {
        Set<PartOfDay> parts = EnumSet.noneOf(PartOfDay.class);
        for (Timeslot slot : slots.slotsOf(mask)) {
            parts.add(slot.getPartOfDay());
        }
        if (parts.size() > 1) {
            out.add(violation(setting, List.of(unit.getKey()), null, null, "meets in " + parts));
        }
    }

    private void fridayAfternoon(RuleSetting setting, Unit unit, long openMask, List<Violation> out) {
        if (!unit.getCourse().isUndergrad()) {
            return;
        }
        for (Timeslot slot : slots.slotsOf(openMask & fridayAfterMorningMask)) {
            out.add(violation(setting, List.of(unit.getKey()), null, slot, "undergraduate class on Friday " + slot.getPartOfDay()));
        }
    }

    private void teacherPreference(RuleSetting setting, Unit unit, long mask, List<Violation> out) {
        for (Teacher teacher : unit.getLecturers()) {
            if (!teacher.hasPreferences()) {
                continue;
            }
            for (Timeslot slot : slots.slotsOf(mask & ~teacher.getPreferredMask())) {
                out.add(violation(setting, List.of(unit.getKey()), teacher.getId(), slot, "outside preferred slots"));
            }
        }
    }

    private void maximumSpacing(RuleSetting setting, Unit unit, long mask, List<Violation> out) {
        List<Timeslot> meetings = slots.slotsOf(mask);
        for (int i = 0; i < meetings.size(); i++) {
            for (int j = i + 1; j < meetings.size(); j++) {
                Timeslot first = meetings.get(i);
                Timeslot second = meetings.get(j);
                int distance = Math.abs(second.getWeekday() - first.getWeekday());
                if (distance > setting.getThreshold()) {
                    out.add(violation(setting, List.of(unit.getKey()), null, second,
                            distance + " weekdays after " + first));
                }
            }
        }
    }

    private boolean curriculumRelated(Unit a, Unit b) {
        return facts.shareCurriculum(a.getCourse().getId(), b.getCourse().getId());
    }

    private boolean scienceStatisticsRelated(RuleSetting setting, Unit a, Unit b) {
        return scienceAgainstRequired(setting, a, b) || scienceAgainstRequired(setting, b, a);
    }

    private boolean scienceAgainstRequired(RuleSetting setting, Unit science, Unit other) {
        boolean inScience = facts.curriculaOf(science.getCourse().getId()).stream()
                .anyMatch(setting.getCurricula()::contains);
        return inScience
                && facts.isRequired(other.getCourse().getId())
                && other.getCourse().getIdealSemester() >= 2;
    }

    private void sharedSlots(RuleSetting setting, Unit a, Unit b, long shared, String reason, List<Violation> out) {
        List<UnitKey> witnesses = a.getKey().compareTo(b.getKey()) <= 0
                ? List.of(a.getKey(), b.getKey())
                : List.of(b.getKey(), a.getKey());
        for (Timeslot slot : slots.slotsOf(shared)) {
            out.add(violation(setting, witnesses, null, slot, reason));
        }
    }

    private static Violation violation(RuleSetting setting, List<UnitKey> units, String teacherId,
                                       Timeslot slot, String detail) {
        return new Violation(setting.getRule(), units, teacherId, slot, setting.getWeight(), detail);
    }
}
