package com.classsched.classsched_api.controller;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.classsched.classsched_api.config.PresetResolver;
import com.classsched.classsched_api.dto.JobResponse;
import com.classsched.classsched_api.dto.ScheduleResponse;
import com.classsched.classsched_api.dto.SolveRequest;
import com.classsched.classsched_api.service.SchedulingService;
import com.classsched.classsched_api.solver.optimizer.ScheduleResult;
import com.classsched.classsched_api.solver.rules.SoftRule;

import ai.timefold.solver.core.api.solver.SolverStatus;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final SchedulingService schedulingService;
    private final PresetResolver presetResolver;

    public ScheduleController(SchedulingService schedulingService, PresetResolver presetResolver) {
        this.schedulingService = schedulingService;
        this.presetResolver = presetResolver;
    }

    @PostMapping("/solve")
    public ResponseEntity<ScheduleResponse> solve(@RequestBody SolveRequest request) {
        logger.info(">>> Received /solve request with preset '{}'.", request.getPreset());
        ScheduleResult result = schedulingService.solve(request);
        logger.info(">>> /solve finished with status {}", result.getStatus());
        return ResponseEntity.ok(ScheduleResponse.from(null, result));
    }

    @PostMapping("/jobs")
    public ResponseEntity<Map<String, String>> submit(@RequestBody SolveRequest request) {
        logger.info(">>> Received job submission with preset '{}'.", request.getPreset());
        String problemId = schedulingService.submit(request);
        logger.info(">>> Submitted job with problemId: {}", problemId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "message", "Scheduling process started.",
                "problemId", problemId));
    }

    @GetMapping("/status/{problemId}")
    public ResponseEntity<Map<String, String>> getSolverStatus(@PathVariable String problemId) {
        logger.debug(">>> Received status check request for problemId: {}", problemId);
        SolverStatus status = schedulingService.getSolverStatus(problemId);
        return ResponseEntity.ok(Map.of("problemId", problemId, "status", status.name()));
    }

    @GetMapping("/jobs/{problemId}")
    public ResponseEntity<JobResponse> getJob(@PathVariable String problemId) {
        logger.debug(">>> Received result request for problemId: {}", problemId);
        SolverStatus status = schedulingService.getSolverStatus(problemId);
        ScheduleResponse result = schedulingService.getResult(problemId)
                .map(r -> ScheduleResponse.from(problemId, r))
                .orElse(null);
        String error = schedulingService.getFailure(problemId).orElse(null);
        return ResponseEntity.ok(new JobResponse(problemId, status.name(), result, error));
    }

    @GetMapping("/rules")
    public ResponseEntity<Map<String, Object>> listRules() {
        List<Map<String, Object>> rules = new ArrayList<>();
        for (SoftRule rule : SoftRule.values()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("name", rule.getRuleName());
            view.put("pairwise", rule.isPairwise());
            view.put("description", rule.getDescription());
            rules.add(view);
        }
        return ResponseEntity.ok(Map.of(
                "rules", rules,
                "presets", presetResolver.presetNames(),
                "defaultPreset", presetResolver.defaultPresetName()));
    }
}
