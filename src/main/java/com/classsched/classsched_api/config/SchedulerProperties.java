package com.classsched.classsched_api.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.classsched.classsched_api.solver.optimizer.OptimizationStrategy;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Binds the {@code scheduler.*} section of application.yml. Rule keys may be
 * written in kebab case ({@code non-morning-class}) or snake case.
 */
@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private String defaultPreset = "default";

    // 0 = one worker per available processor
    private int threads = 0;

    // Asynchronous jobs solved at the same time
    private int jobThreads = 2;

    // Finished jobs whose results stay available for polling
    private int retainedJobs = 100;

    private Map<String, PresetProperties> presets = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    public static class PresetProperties {
        private Map<String, RuleProperties> rules = new LinkedHashMap<>();
        private Duration maxTime;
        private Integer maxCandidates;
        private Long maxNodes;
        private OptimizationStrategy strategy;
        private Integer threads;
        private Integer numSchedules;
    }

    @Data
    @NoArgsConstructor
    public static class RuleProperties {
        private Boolean enabled;
        private Long weight;
        private Integer priority;
        private Integer threshold;
        private List<String> curricula;

        public RuleProperties(Boolean enabled, Long weight, Integer priority) {
            this.enabled = enabled;
            this.weight = weight;
            this.priority = priority;
        }
    }
}
