package com.classsched.classsched_api.dto;

import java.util.List;
import java.util.stream.Collectors;

import com.classsched.classsched_api.solver.conflict.Conflict;
import com.classsched.classsched_api.solver.domain.ClassMeeting;
import com.classsched.classsched_api.solver.facts.UnitKey;
import com.classsched.classsched_api.solver.optimizer.LayerCost;
import com.classsched.classsched_api.solver.optimizer.RankedTimetable;
import com.classsched.classsched_api.solver.optimizer.ScheduleResult;
import com.classsched.classsched_api.solver.optimizer.SearchStatistics;
import com.classsched.classsched_api.solver.optimizer.SolveStatus;
import com.classsched.classsched_api.solver.rules.SoftRule;
import com.classsched.classsched_api.solver.rules.Violation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private String problemId;
    private String preset;
    private SolveStatus status;
    private String score;
    private long totalCost;
    private List<MeetingView> meetings;
    private List<ViolationView> violations;
    private List<LayerView> layers;
    private List<ConflictView> conflicts;
    private List<String> diagnostics;
    private SearchStatistics statistics;
    // Runners-up when more than one timetable was requested, best first
    private List<AlternativeView> alternatives;

    public static ScheduleResponse from(String problemId, ScheduleResult result) {
        ScheduleResponse response = new ScheduleResponse();
        response.setProblemId(problemId);
        response.setPreset(result.getPresetName());
        response.setStatus(result.getStatus());
        response.setDiagnostics(result.getDiagnostics());
        response.setStatistics(result.getStatistics());
        response.setLayers(result.getLayerCosts().stream().map(LayerView::of).collect(Collectors.toList()));
        response.setConflicts(result.getConflicts().stream().map(ConflictView::of).collect(Collectors.toList()));
        if (result.getRanked().size() > 1) {
            response.setAlternatives(result.getRanked().subList(1, result.getRanked().size()).stream()
                    .map(AlternativeView::of).collect(Collectors.toList()));
        }
        if (result.hasTimetable()) {
            response.setScore(result.getEvaluation().getScore().toString());
            response.setTotalCost(result.getEvaluation().totalCost());
            response.setMeetings(result.getTimetable().getMeetings().stream()
                    .map(MeetingView::of).collect(Collectors.toList()));
            response.setViolations(result.getEvaluation().getViolations().stream()
                    .map(ViolationView::of).collect(Collectors.toList()));
        } else {
            response.setMeetings(List.of());
            response.setViolations(List.of());
        }
        return response;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AlternativeView {
        private int rank;
        private String score;
        private long totalCost;
        private List<MeetingView> meetings;
        private List<ViolationView> violations;

        static AlternativeView of(RankedTimetable ranked) {
            return new AlternativeView(ranked.getRank(), ranked.getEvaluation().getScore().toString(),
                    ranked.getEvaluation().totalCost(),
                    ranked.getTimetable().getMeetings().stream().map(MeetingView::of).collect(Collectors.toList()),
                    ranked.getEvaluation().getViolations().stream().map(ViolationView::of).collect(Collectors.toList()));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MeetingView {
        private String courseId;
        private String groupId;
        private int weekday;
        private String dayOfWeek;
        private int period;
        private String partOfDay;
        private boolean fixed;

        static MeetingView of(ClassMeeting meeting) {
            return new MeetingView(meeting.getUnit().getCourseId(), meeting.getUnit().getGroupId(),
                    meeting.getSlot().getWeekday(), meeting.getSlot().getDayOfWeek().name(),
                    meeting.getSlot().getPeriod(), meeting.getSlot().getPartOfDay().toString(), meeting.isFixed());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ViolationView {
        private String rule;
        private List<String> units;
        private String teacherId;
        private Integer weekday;
        private Integer period;
        private long weight;
        private String detail;

        static ViolationView of(Violation violation) {
            return new ViolationView(violation.getRule().getRuleName(),
                    violation.getUnits().stream().map(UnitKey::toString).collect(Collectors.toList()),
                    violation.getTeacherId(),
                    violation.getSlot() == null ? null : violation.getSlot().getWeekday(),
                    violation.getSlot() == null ? null : violation.getSlot().getPeriod(),
                    violation.getWeight(), violation.getDetail());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LayerView {
        private int layer;
        private int priority;
        private List<String> rules;
        private long cost;

        static LayerView of(LayerCost layer) {
            return new LayerView(layer.getLayer(), layer.getPriority(),
                    layer.getRules().stream().map(SoftRule::getRuleName).collect(Collectors.toList()),
                    layer.getCost());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConflictView {
        private String first;
        private String second;
        private int weekday;
        private int period;

        static ConflictView of(Conflict conflict) {
            return new ConflictView(conflict.getPair().getFirst().toString(), conflict.getPair().getSecond().toString(),
                    conflict.getSlot().getWeekday(), conflict.getSlot().getPeriod());
        }
    }
}
