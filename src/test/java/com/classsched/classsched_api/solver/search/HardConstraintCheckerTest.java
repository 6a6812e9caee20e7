package com.classsched.classsched_api.solver.search;

import static com.classsched.classsched_api.solver.InputBuilder.input;
import static com.classsched.classsched_api.solver.InputBuilder.slot;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.classsched.classsched_api.solver.conflict.ConflictResolver;
import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.domain.ClassMeeting;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.facts.FactStoreBuilder;
import com.classsched.classsched_api.solver.facts.UnitKey;

class HardConstraintCheckerTest {

    private final SlotDomain domain = SlotDomain.standard();
    private HardConstraintChecker checker;

    @BeforeEach
    void setUp() {
        ResolvedProblem problem = new ConflictResolver().resolve(new FactStoreBuilder(domain).build(input()
                .course("a", 1).course("b", 1).course("lab", 2, false, true, 0)
                .teacher("t", slot(0, 0), slot(0, 1), slot(1, 0), slot(1, 1))
                .workload("a", "x", "t").workload("b", "x", "t").workload("lab", "x", "t")
                .build()));
        checker = new HardConstraintChecker(problem);
    }

    private ClassMeeting meeting(String course, int weekday, int period) {
        return new ClassMeeting(UnitKey.of(course, "x"), domain.of(weekday, period), false);
    }

    @Test
    void acceptsValidTimetable() {
        Timetable timetable = new Timetable(List.of(
                meeting("a", 0, 0), meeting("b", 0, 1), meeting("lab", 1, 0), meeting("lab", 1, 1)));

        assertThat(checker.check(timetable)).isEmpty();
    }

    @Test
    void reportsTeacherClash() {
        Timetable timetable = new Timetable(List.of(
                meeting("a", 0, 0), meeting("b", 0, 0), meeting("lab", 1, 0), meeting("lab", 1, 1)));

        assertThat(checker.check(timetable)).singleElement().satisfies(m -> assertThat(m).contains("Teacher t"));
    }

    @Test
    void reportsWrongMeetingCountAndBrokenDoubleClass() {
        Timetable timetable = new Timetable(List.of(
                meeting("a", 0, 0), meeting("lab", 0, 1), meeting("lab", 1, 1)));

        List<String> violations = checker.check(timetable);
        assertThat(violations).anyMatch(v -> v.startsWith("b/x has 0 meetings"));
        assertThat(violations).anyMatch(v -> v.contains("double class"));
    }

    @Test
    void reportsMeetingOutsideAvailability() {
        Timetable timetable = new Timetable(List.of(
                meeting("a", 3, 0), meeting("b", 0, 1), meeting("lab", 1, 0), meeting("lab", 1, 1)));

        assertThat(checker.check(timetable)).singleElement().satisfies(m -> assertThat(m).contains("availability"));
    }
}
