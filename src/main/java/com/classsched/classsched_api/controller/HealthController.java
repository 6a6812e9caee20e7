package com.classsched.classsched_api.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.classsched.classsched_api.config.PresetResolver;

/**
 * Liveness plus the scheduler configuration the service started with.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final PresetResolver presetResolver;

    public HealthController(PresetResolver presetResolver) {
        this.presetResolver = presetResolver;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "classsched-api");

        Map<String, Object> scheduler = new HashMap<>();
        scheduler.put("presets", presetResolver.presetNames());
        scheduler.put("defaultPreset", presetResolver.defaultPresetName());
        scheduler.put("processors", Runtime.getRuntime().availableProcessors());
        health.put("scheduler", scheduler);

        return ResponseEntity.ok(health);
    }
}
