package com.classsched.classsched_api.solver.search;

import static com.classsched.classsched_api.solver.InputBuilder.input;
import static com.classsched.classsched_api.solver.InputBuilder.slot;
import static com.classsched.classsched_api.solver.InputBuilder.slots;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import com.classsched.classsched_api.model.TimetableInput;
import com.classsched.classsched_api.model.WorkloadInput;
import com.classsched.classsched_api.solver.InputBuilder;
import com.classsched.classsched_api.solver.conflict.ConflictResolver;
import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.domain.SlotDomain;
import com.classsched.classsched_api.solver.domain.Timetable;
import com.classsched.classsched_api.solver.facts.FactStoreBuilder;
import com.classsched.classsched_api.solver.facts.UnitKey;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

class AssignmentEngineTest {

    private final SlotDomain domain = SlotDomain.standard();

    private ResolvedProblem resolve(TimetableInput input) {
        return new ConflictResolver().resolve(new FactStoreBuilder(domain).build(input));
    }

    private Timetable first(ResolvedProblem problem) {
        SearchOutcome outcome = new AssignmentEngine(problem).findFirst(SearchBudget.unlimited());
        assertThat(outcome.best()).isPresent();
        return problem.toTimetable(outcome.best().get().getOpenMasks());
    }

    @Test
    void sameTeacherUnitsGoToDifferentSlots() {
        ResolvedProblem problem = resolve(input()
                .course("a", 1).course("b", 1)
                .teacher("t", slot(0, 0), slot(1, 0))
                .workload("a", "x", "t").workload("b", "x", "t")
                .build());

        Timetable timetable = first(problem);

        long a = timetable.maskOf(UnitKey.of("a", "x"));
        long b = timetable.maskOf(UnitKey.of("b", "x"));
        assertThat(a & b).isZero();
        assertThat(domain.slotsOf(a | b)).containsExactly(domain.of(0, 0), domain.of(1, 0));
    }

    @Test
    void singleSlotTeacherWithTwoUnitsIsInfeasible() {
        ResolvedProblem problem = resolve(input()
                .course("a", 1).course("b", 1)
                .teacher("t", slot(0, 0))
                .workload("a", "x", "t").workload("b", "x", "t")
                .build());

        SearchOutcome outcome = new AssignmentEngine(problem).findFirst(SearchBudget.unlimited());

        assertThat(outcome.isInfeasible()).isTrue();
        assertThat(outcome.getDiagnostics()).anyMatch(d -> d.contains("Teacher t"));
    }

    @Test
    void doubleCourseTakesConsecutiveMondayPeriods() {
        ResolvedProblem problem = resolve(input()
                .course("lab", 2, true, true, 1)
                .teacher("t", slot(0, 0), slot(0, 1))
                .workload("lab", "x", "t")
                .build());

        Timetable timetable = first(problem);

        assertThat(domain.slotsOf(timetable.maskOf(UnitKey.of("lab", "x"))))
                .containsExactly(domain.of(0, 0), domain.of(0, 1));
    }

    @Test
    void doubleCourseNeverSplitsAcrossDays() {
        ResolvedProblem problem = resolve(input()
                .course("lab", 2, true, true, 1)
                .teacher("t", slot(0, 1), slot(1, 2), slot(2, 0), slot(2, 1))
                .workload("lab", "x", "t")
                .build());

        SearchOutcome all = new AssignmentEngine(problem).enumerate(SearchObjective.none(), 10, SearchBudget.unlimited());

        assertThat(all.isExhaustive()).isTrue();
        assertThat(all.getSolutions()).singleElement()
                .satisfies(s -> assertThat(domain.slotsOf(s.getOpenMasks()[0]))
                        .containsExactly(domain.of(2, 0), domain.of(2, 1)));
    }

    @Test
    void fixedMeetingsAreKeptAndBlockSharedTeachers() {
        ResolvedProblem problem = resolve(input()
                .course("a", 2).course("b", 1)
                .teacher("t", slot(0, 0), slot(0, 1), slot(1, 0))
                .workload(new WorkloadInput(List.of("a"), List.of("t"), "x", null, slots(slot(0, 0)), null))
                .workload("b", "x", "t")
                .build());

        Timetable timetable = first(problem);

        assertThat(timetable.fixedMaskOf(UnitKey.of("a", "x"))).isEqualTo(domain.of(0, 0).bit());
        assertThat(Long.bitCount(timetable.maskOf(UnitKey.of("a", "x")))).isEqualTo(2);
        assertThat(timetable.maskOf(UnitKey.of("b", "x")) & domain.of(0, 0).bit()).isZero();
        assertThat(new HardConstraintChecker(problem).check(timetable)).isEmpty();
    }

    @Test
    void clashingFixedMeetingsAreDiagnosed() {
        ResolvedProblem problem = resolve(input()
                .course("a", 1).course("b", 1)
                .teacher("t")
                .workload(new WorkloadInput(List.of("a"), List.of("t"), "x", null, slots(slot(2, 2)), null))
                .workload(new WorkloadInput(List.of("b"), List.of("t"), "x", null, slots(slot(2, 2)), null))
                .build());

        SearchOutcome outcome = new AssignmentEngine(problem).findFirst(SearchBudget.unlimited());

        assertThat(outcome.isInfeasible()).isTrue();
        assertThat(outcome.getDiagnostics()).anyMatch(d -> d.contains("clash"));
    }

    @Test
    void emptyAvailabilityIsDiagnosed() {
        ResolvedProblem problem = resolve(input()
                .course("a", 3)
                .teacher("t", slot(0, 4), slot(1, 4), slot(2, 4))
                .workload("a", "x", "t")
                .build());

        SearchOutcome outcome = new AssignmentEngine(problem).findFirst(SearchBudget.unlimited());

        assertThat(outcome.isInfeasible()).isTrue();
        assertThat(outcome.getDiagnostics()).singleElement(InstanceOfAssertFactories.STRING)
                .contains("morning", "afternoon");
    }

    @Test
    void everyTimetableSatisfiesTheHardConstraints() {
        ResolvedProblem problem = resolve(department());

        SearchOutcome outcome = new AssignmentEngine(problem).enumerate(SearchObjective.none(), 25, SearchBudget.unlimited());

        assertThat(outcome.getSolutions()).hasSize(25);
        HardConstraintChecker checker = new HardConstraintChecker(problem);
        Set<String> distinct = new HashSet<>();
        for (SearchSolution solution : outcome.getSolutions()) {
            Timetable timetable = problem.toTimetable(solution.getOpenMasks());
            assertThat(checker.check(timetable)).isEmpty();
            distinct.add(timetable.serialize());
        }
        assertThat(distinct).hasSize(25);
    }

    @Test
    void enumerationIsStatelessBetweenCalls() {
        ResolvedProblem problem = resolve(department());
        AssignmentEngine engine = new AssignmentEngine(problem);

        SearchOutcome once = engine.enumerate(SearchObjective.none(), 5, SearchBudget.unlimited());
        SearchOutcome twice = engine.enumerate(SearchObjective.none(), 5, SearchBudget.unlimited());

        for (int i = 0; i < 5; i++) {
            assertThat(twice.getSolutions().get(i).getOpenMasks()).isEqualTo(once.getSolutions().get(i).getOpenMasks());
        }
    }

    @Test
    void branchAndBoundFindsTheCheapestSlots() {
        ResolvedProblem problem = resolve(input()
                .course("a", 1).course("b", 1).course("c", 1)
                .teacher("t")
                .workload("a", "x", "t").workload("b", "x", "t").workload("c", "x", "t")
                .build());

        SearchOutcome outcome = new AssignmentEngine(problem).optimize(slotIdCost(), SearchBudget.unlimited(), 1);

        assertThat(outcome.isExhaustive()).isTrue();
        assertThat(outcome.best().get().getScore().softScore(0)).isEqualTo(-3L);
    }

    @Test
    void parallelWorkersAgreeWithSequentialSearch() {
        ResolvedProblem problem = resolve(department());
        AssignmentEngine engine = new AssignmentEngine(problem);

        SearchSolution sequential = engine.optimize(slotIdCost(), SearchBudget.unlimited(), 1).best().get();
        SearchSolution parallel = engine.optimize(slotIdCost(), SearchBudget.unlimited(), 4).best().get();

        assertThat(parallel.getScore()).isEqualTo(sequential.getScore());
        assertThat(parallel.getOpenMasks()).isEqualTo(sequential.getOpenMasks());
        assertThat(parallel.getBranch()).isEqualTo(sequential.getBranch());
    }

    @Test
    void exhaustedBudgetLeavesSearchIncomplete() {
        ResolvedProblem problem = resolve(department());

        SearchOutcome outcome = new AssignmentEngine(problem).optimize(slotIdCost(), SearchBudget.of(null, 1), 2);

        assertThat(outcome.isExhaustive()).isFalse();
        assertThat(outcome.isInfeasible()).isFalse();
    }

    @Test
    void doubleGroupsAdmitOnlyAdjacentPairs() {
        ResolvedProblem problem = resolve(input()
                .course("lab", 2, false, true, 0)
                .teacher("t")
                .workload("lab", "x", "t")
                .build());

        long[] candidates = SearchSpace.combinations(problem.group(0), problem.group(0).legalMask(), domain);

        // morning and afternoon: periods 0-3, three adjacent pairs a day
        assertThat(candidates).hasSize(15);
        for (long mask : candidates) {
            assertThat(mask).isEqualTo(3L << Long.numberOfTrailingZeros(mask));
        }
    }

    @Test
    void enumerationReachingExactlyTheLimitIsExhaustive() {
        ResolvedProblem problem = resolve(input()
                .course("a", 1).course("b", 1)
                .teacher("t", slot(0, 0), slot(1, 0))
                .workload("a", "x", "t").workload("b", "x", "t")
                .build());
        AssignmentEngine engine = new AssignmentEngine(problem);

        SearchOutcome all = engine.enumerate(SearchObjective.none(), 2, SearchBudget.unlimited());
        SearchOutcome some = engine.enumerate(SearchObjective.none(), 1, SearchBudget.unlimited());

        assertThat(all.getSolutions()).hasSize(2);
        assertThat(all.isExhaustive()).isTrue();
        assertThat(some.getSolutions()).hasSize(1);
        assertThat(some.isExhaustive()).isFalse();
    }

    @Test
    void severalBestTimetablesAreRankedAndIndependentOfWorkers() {
        ResolvedProblem problem = resolve(department());
        AssignmentEngine engine = new AssignmentEngine(problem);

        SearchOutcome sequential = engine.optimize(slotIdCost(), SearchBudget.unlimited(), 1, 4);
        SearchOutcome parallel = engine.optimize(slotIdCost(), SearchBudget.unlimited(), 4, 4);

        assertThat(sequential.isExhaustive()).isTrue();
        assertThat(sequential.getSolutions()).hasSize(4);
        for (int i = 0; i < 4; i++) {
            assertThat(parallel.getSolutions().get(i).getOpenMasks())
                    .isEqualTo(sequential.getSolutions().get(i).getOpenMasks());
            if (i > 0) {
                assertThat(sequential.getSolutions().get(i).getScore())
                        .isLessThanOrEqualTo(sequential.getSolutions().get(i - 1).getScore());
            }
        }
        assertThat(sequential.best().get().getScore())
                .isEqualTo(engine.optimize(slotIdCost(), SearchBudget.unlimited(), 1).best().get().getScore());
    }

    @Test
    void tooManyCombinationsLeaveTheSearchIncomplete() {
        ResolvedProblem problem = resolve(input()
                .course("a", 7)
                .teacher("t")
                .workload(new WorkloadInput(List.of("a"), List.of("t"), "x", List.of("morning", "afternoon", "night"),
                        null, null))
                .build());

        SearchOutcome outcome = new AssignmentEngine(problem).findFirst(SearchBudget.unlimited());

        assertThat(outcome.isExhaustive()).isFalse();
        assertThat(outcome.isInfeasible()).isFalse();
        assertThat(outcome.getDiagnostics()).singleElement(InstanceOfAssertFactories.STRING)
                .contains("2035800", "candidate slot combinations");
    }

    // Six units, three teachers, one joint pair and a night-only course
    private static TimetableInput department() {
        return InputBuilder.input()
                .course("mac0110", 2).course("mac0105", 2).course("mac0329", 2)
                .course("mae0121", 2).course("mat0111", 3).course("mac0499", 1)
                .teacher("ana").teacher("bia", slot(0, 0), slot(0, 1), slot(1, 0), slot(1, 1), slot(2, 2), slot(3, 2))
                .teacher("caio")
                .workload(new WorkloadInput(List.of("mac0110", "mac0105"), List.of("ana"), "bcc", null, null, null))
                .workload("mac0329", "bcc", "ana")
                .workload("mae0121", "bcc", "bia")
                .workload(new WorkloadInput(List.of("mat0111"), List.of("bia", "caio"), "bcc", null, null, null))
                .workload(new WorkloadInput(List.of("mac0499"), List.of("caio"), "bcc", List.of("night"), null, null))
                .build();
    }

    private static SearchObjective slotIdCost() {
        BendableLongScore zero = BendableLongScore.of(new long[1], new long[1]);
        return new SearchObjective() {
            @Override
            public BendableLongScore zero() {
                return zero;
            }

            @Override
            public BendableLongScore local(int group, long openMask) {
                long cost = 0;
                for (long rest = openMask; rest != 0L; rest &= rest - 1) {
                    cost += Long.numberOfTrailingZeros(rest);
                }
                return BendableLongScore.of(new long[1], new long[] {-cost});
            }

            @Override
            public BendableLongScore pair(int group, long openMask, int other, long otherOpenMask) {
                return zero;
            }

            @Override
            public int[] pairNeighbours(int group) {
                return new int[0];
            }
        };
    }
}
