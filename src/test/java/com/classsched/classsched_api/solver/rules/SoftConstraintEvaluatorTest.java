package com.classsched.classsched_api.solver.rules;

import static com.classsched.classsched_api.solver.InputBuilder.input;
import static com.classsched.classsched_api.solver.InputBuilder.slot;
import static com.classsched.classsched_api.solver.InputBuilder.slots;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.classsched.classsched_api.solver.conflict.ConflictResolver;
import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.domain.ClassMeeting;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.facts.FactStore;
import com.classsched.classsched_api.solver.facts.FactStoreBuilder;
import com.classsched.classsched_api.solver.facts.UnitKey;

class SoftConstraintEvaluatorTest {

    private final SlotDomain domain = SlotDomain.standard();
    private FactStore facts;
    private ResolvedProblem problem;

    @BeforeEach
    void setUp() {
        facts = new FactStoreBuilder(domain).build(input()
                .course("calc", 2, true, false, 1)
                .course("algo", 2, true, false, 3)
                .course("prob", 2, false, false, 0)
                .course("grad", 2, false, false, 0)
                .teacher("ana", slots(slot(0, 0), slot(0, 1), slot(1, 0), slot(4, 2)), slots(slot(0, 0)))
                .teacher("bia")
                .teacher("caio")
                .workload("calc", "x", "ana")
                .workload("calc", "y", "bia")
                .workload("algo", "x", "bia")
                .workload("prob", "x", "caio")
                .workload("grad", "x", "caio")
                .curriculum("bcc", "calc", true)
                .curriculum("bcc", "algo", true)
                .curriculum("statistics", "prob", false)
                .curriculum("statistics", "grad", false)
                .joint("prob", "x", "grad", "x")
                .build());
        problem = new ConflictResolver().resolve(facts);
    }

    private SoftConstraintEvaluator evaluator(RuleSetting... settings) {
        return new SoftConstraintEvaluator(facts, new LayeredRules(List.of(settings)));
    }

    private static UnitKey key(String course, String group) {
        return UnitKey.of(course, group);
    }

    private ClassMeeting meeting(String course, String group, int weekday, int period) {
        return new ClassMeeting(key(course, group), domain.of(weekday, period), false);
    }

    private Evaluation evaluate(SoftConstraintEvaluator evaluator, ClassMeeting... meetings) {
        return evaluator.evaluate(new Timetable(List.of(meetings)), problem::isJoint);
    }

    @Test
    void nonMorningCountsEveryLaterMeeting() {
        Evaluation evaluation = evaluate(evaluator(RuleSetting.of(SoftRule.NON_MORNING_CLASS, 4, 1)),
                meeting("calc", "y", 0, 0), meeting("calc", "y", 0, 2), meeting("calc", "y", 2, 5));

        assertThat(evaluation.getViolations()).hasSize(2);
        assertThat(evaluation.getLayerCosts()).containsExactly(8);
    }

    @Test
    void differentPartsOfDayCountsOncePerUnit() {
        SoftConstraintEvaluator evaluator = evaluator(RuleSetting.of(SoftRule.DIFFERENT_PARTS_OF_DAY, 1, 1));

        assertThat(evaluate(evaluator, meeting("calc", "y", 0, 0), meeting("calc", "y", 1, 2), meeting("calc", "y", 2, 4))
                .getViolations()).hasSize(1);
        assertThat(evaluate(evaluator, meeting("calc", "y", 0, 0), meeting("calc", "y", 3, 1))
                .getViolations()).isEmpty();
    }

    @Test
    void fridayAfternoonOnlyForNonFixedUndergradMeetings() {
        SoftConstraintEvaluator evaluator = evaluator(RuleSetting.of(SoftRule.UNDERGRAD_FRIDAY_AFTERNOON, 1, 1));

        assertThat(evaluate(evaluator, meeting("calc", "y", 4, 2), meeting("calc", "y", 4, 0))
                .getViolations()).hasSize(1);
        assertThat(evaluate(evaluator, meeting("prob", "x", 4, 2)).getViolations()).isEmpty();
        ClassMeeting fixed = new ClassMeeting(key("calc", "y"), domain.of(4, 3), true);
        assertThat(evaluate(evaluator, fixed).getViolations()).isEmpty();
    }

    @Test
    void teacherPreferenceNamesTheTeacher() {
        SoftConstraintEvaluator evaluator = evaluator(RuleSetting.of(SoftRule.TEACHER_PREFERENCE, 3, 1));

        Evaluation evaluation = evaluate(evaluator, meeting("calc", "x", 0, 0), meeting("calc", "x", 1, 0));
        assertThat(evaluation.getViolations()).singleElement().satisfies(v -> {
            assertThat(v.getTeacherId()).isEqualTo("ana");
            assertThat(v.getSlot()).isEqualTo(domain.of(1, 0));
            assertThat(v.getWeight()).isEqualTo(3);
        });
        // bia has no preferences at all
        assertThat(evaluate(evaluator, meeting("calc", "y", 3, 5)).getViolations()).isEmpty();
    }

    @Test
    void maximumSpacingUsesTheThreshold() {
        ClassMeeting monday = meeting("calc", "y", 0, 0);
        ClassMeeting friday = meeting("calc", "y", 4, 0);
        ClassMeeting thursday = meeting("calc", "y", 3, 0);

        assertThat(evaluate(evaluator(RuleSetting.of(SoftRule.MAXIMUM_SPACING, 1, 1)), monday, friday)
                .getViolations()).hasSize(1);
        assertThat(evaluate(evaluator(RuleSetting.of(SoftRule.MAXIMUM_SPACING, 1, 1)), monday, thursday)
                .getViolations()).isEmpty();
        RuleSetting lenient = new RuleSetting(SoftRule.MAXIMUM_SPACING, 1, 1, 4, RuleSetting.DEFAULT_SCIENCE_CURRICULA);
        assertThat(evaluate(evaluator(lenient), monday, friday).getViolations()).isEmpty();
    }

    @Test
    void curriculumConflictCountsSharedSlotsOfRelatedUnits() {
        SoftConstraintEvaluator evaluator = evaluator(RuleSetting.of(SoftRule.CURRICULUM_CONFLICT, 2, 1));

        Evaluation evaluation = evaluate(evaluator,
                meeting("calc", "x", 0, 0), meeting("calc", "x", 1, 0),
                meeting("calc", "y", 0, 0),
                meeting("algo", "x", 0, 0), meeting("algo", "x", 1, 0),
                meeting("prob", "x", 1, 0));

        // calc/x-calc/y at Mon 0, calc/x-algo/x at Mon 0 and Tue 0, calc/y-algo/x at Mon 0
        assertThat(evaluation.getViolations()).hasSize(4);
        assertThat(evaluation.costOf(SoftRule.CURRICULUM_CONFLICT)).isEqualTo(8);
        assertThat(evaluation.getViolations()).allSatisfy(v ->
                assertThat(v.getUnits().get(0)).isLessThan(v.getUnits().get(1)));
    }

    @Test
    void jointUnitsNeverConflict() {
        SoftConstraintEvaluator evaluator = evaluator(RuleSetting.of(SoftRule.CURRICULUM_CONFLICT, 1, 1));

        assertThat(evaluate(evaluator, meeting("prob", "x", 0, 0), meeting("grad", "x", 0, 0))
                .getViolations()).isEmpty();
    }

    @Test
    void scienceStatisticsConflictNeedsRequiredLaterSemesterCourse() {
        SoftConstraintEvaluator evaluator = evaluator(RuleSetting.of(SoftRule.SCIENCE_STATISTICS_CONFLICT, 5, 1));

        // algo is required with ideal semester 3, calc only semester 1
        assertThat(evaluate(evaluator, meeting("prob", "x", 2, 2), meeting("algo", "x", 2, 2))
                .getViolations()).hasSize(1);
        assertThat(evaluate(evaluator, meeting("prob", "x", 2, 2), meeting("calc", "y", 2, 2))
                .getViolations()).isEmpty();
    }

    @Test
    void layersFollowPriorities() {
        SoftConstraintEvaluator evaluator = evaluator(
                RuleSetting.of(SoftRule.NON_MORNING_CLASS, 1, 0),
                RuleSetting.of(SoftRule.DIFFERENT_PARTS_OF_DAY, 7, 9));

        Evaluation evaluation = evaluate(evaluator, meeting("calc", "y", 0, 0), meeting("calc", "y", 0, 4));
        assertThat(evaluation.getLayerCosts()).containsExactly(7, 1);
        assertThat(evaluation.getScore().softScore(0)).isEqualTo(-7);
        assertThat(evaluation.totalCost()).isEqualTo(8);
    }

    @Test
    void fullEvaluationEqualsSumOfUnitAndPairTerms() {
        SoftConstraintEvaluator evaluator = evaluator(
                RuleSetting.of(SoftRule.NON_MORNING_CLASS, 1, 0),
                RuleSetting.of(SoftRule.CURRICULUM_CONFLICT, 2, 1),
                RuleSetting.of(SoftRule.MAXIMUM_SPACING, 3, 1));
        Timetable timetable = new Timetable(List.of(
                meeting("calc", "x", 0, 0), meeting("calc", "x", 4, 3),
                meeting("algo", "x", 0, 0), meeting("algo", "x", 2, 2)));

        List<Violation> decomposed = new ArrayList<>();
        decomposed.addAll(evaluator.unitViolations(facts.unit(key("calc", "x")), timetable.maskOf(key("calc", "x")), 0L));
        decomposed.addAll(evaluator.unitViolations(facts.unit(key("algo", "x")), timetable.maskOf(key("algo", "x")), 0L));
        decomposed.addAll(evaluator.pairViolations(facts.unit(key("algo", "x")), timetable.maskOf(key("algo", "x")),
                facts.unit(key("calc", "x")), timetable.maskOf(key("calc", "x"))));

        Evaluation full = evaluator.evaluate(timetable, problem::isJoint);
        assertThat(full.getLayerCosts()).containsExactly(evaluator.layerCosts(decomposed));
        assertThat(full.getViolations()).hasSameSizeAs(decomposed);
    }
}
