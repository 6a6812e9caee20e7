package com.classsched.classsched_api.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Root endpoint to provide API information
 */
@RestController
public class RootController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "service", "classsched-api",
            "status", "running",
            "version", "0.0.1",
            "endpoints", Map.of(
                "health", "/api/health",
                "solve", "/api/schedules/solve",
                "jobs", "/api/schedules/jobs, /api/schedules/jobs/{problemId}, /api/schedules/status/{problemId}",
                "rules", "/api/schedules/rules"
            ),
            "message", "ClassSched API is running. Use /api/health for health check."
        ));
    }
}
