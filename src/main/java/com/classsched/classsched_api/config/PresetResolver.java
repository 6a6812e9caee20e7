package com.classsched.classsched_api.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.classsched.classsched_api.config.SchedulerProperties.PresetProperties;
import com.classsched.classsched_api.config.SchedulerProperties.RuleProperties;
import com.classsched.classsched_api.dto.SolveRequest;
import com.classsched.classsched_api.exception.ConfigurationException;
import com.classsched.classsched_api.solver.optimizer.OptimizationStrategy;
import com.classsched.classsched_api.solver.optimizer.SearchSettings;
import com.classsched.classsched_api.solver.optimizer.SolverPreset;
import com.classsched.classsched_api.solver.rules.LayeredRules;
import com.classsched.classsched_api.solver.rules.RuleSetting;
import com.classsched.classsched_api.solver.rules.SoftRule;

/**
 * Turns a named preset plus request overrides into a validated
 * {@link SolverPreset}. Every configuration error is raised here, before
 * any search starts.
 */
@Component
public class PresetResolver {

    private static final Logger logger = LoggerFactory.getLogger(PresetResolver.class);

    private static final long DEFAULT_WEIGHT = 1L;
    private static final int MAX_SPACING_THRESHOLD = 4;

    private final SchedulerProperties properties;

    public PresetResolver(SchedulerProperties properties) {
        this.properties = properties;
    }

    public Set<String> presetNames() {
        return properties.getPresets().keySet();
    }

    public String defaultPresetName() {
        return properties.getDefaultPreset();
    }

    public SolverPreset resolve(String presetName) {
        SolveRequest request = new SolveRequest();
        request.setPreset(presetName);
        return resolve(request);
    }

    public SolverPreset resolve(SolveRequest request) {
        String name = request.getPreset() == null || request.getPreset().isBlank()
                ? properties.getDefaultPreset()
                : request.getPreset().trim();
        PresetProperties preset = properties.getPresets().get(name);
        if (preset == null) {
            throw new ConfigurationException("Unknown preset '" + name + "'. Known presets: " + presetNames());
        }

        Map<SoftRule, RuleProperties> merged = new EnumMap<>(SoftRule.class);
        mergeRules(merged, preset.getRules(), "preset '" + name + "'");
        if (request.getRules() != null) {
            mergeRules(merged, request.getRules(), "request");
        }
        List<RuleSetting> settings = new ArrayList<>();
        merged.forEach((rule, props) -> {
            RuleSetting setting = toSetting(rule, props);
            if (setting != null) {
                settings.add(setting);
            }
        });

        SearchSettings search = searchSettings(preset, request);
        SolverPreset resolved = new SolverPreset(name, new LayeredRules(settings), search);
        logger.info("Resolved preset '{}': {} enabled rules in {} layers, {}",
                name, settings.size(), resolved.getRules().layerCount(), search);
        return resolved;
    }

    private void mergeRules(Map<SoftRule, RuleProperties> merged, Map<String, RuleProperties> source, String origin) {
        source.forEach((ruleName, props) -> {
            SoftRule rule = SoftRule.fromName(ruleName)
                    .orElseThrow(() -> new ConfigurationException("Unknown soft rule '" + ruleName + "' in " + origin
                            + ". Known rules: " + knownRules()));
            if (props == null) {
                return;
            }
            RuleProperties target = merged.computeIfAbsent(rule, r -> new RuleProperties());
            if (props.getEnabled() != null) target.setEnabled(props.getEnabled());
            if (props.getWeight() != null) target.setWeight(props.getWeight());
            if (props.getPriority() != null) target.setPriority(props.getPriority());
            if (props.getThreshold() != null) target.setThreshold(props.getThreshold());
            if (props.getCurricula() != null) target.setCurricula(props.getCurricula());
        });
    }

    // Null when the rule is disabled
    private RuleSetting toSetting(SoftRule rule, RuleProperties props) {
        if (Boolean.FALSE.equals(props.getEnabled())) {
            return null;
        }
        long weight = props.getWeight() == null ? DEFAULT_WEIGHT : props.getWeight();
        if (weight < 0) {
            throw new ConfigurationException("Rule " + rule + " has negative weight " + weight);
        }
        if (props.getPriority() == null) {
            throw new ConfigurationException("Rule " + rule + " is enabled but has no priority");
        }
        if (props.getPriority() < 0) {
            throw new ConfigurationException("Rule " + rule + " has negative priority " + props.getPriority());
        }
        int threshold = RuleSetting.DEFAULT_SPACING_THRESHOLD;
        if (props.getThreshold() != null) {
            threshold = props.getThreshold();
            if (threshold < 0 || threshold > MAX_SPACING_THRESHOLD) {
                throw new ConfigurationException("Rule " + rule + " threshold must be between 0 and "
                        + MAX_SPACING_THRESHOLD + ", got " + threshold);
            }
        }
        Set<String> curricula = RuleSetting.DEFAULT_SCIENCE_CURRICULA;
        if (props.getCurricula() != null) {
            curricula = props.getCurricula().stream()
                    .map(c -> c.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
        return new RuleSetting(rule, weight, props.getPriority(), threshold, Set.copyOf(curricula));
    }

    private SearchSettings searchSettings(PresetProperties preset, SolveRequest request) {
        Duration maxTime = preset.getMaxTime() == null ? SearchSettings.DEFAULT_MAX_TIME : preset.getMaxTime();
        if (request.getMaxTimeSeconds() != null) {
            maxTime = Duration.ofSeconds(request.getMaxTimeSeconds());
        }
        if (maxTime.isZero() || maxTime.isNegative()) {
            throw new ConfigurationException("max-time must be positive, got " + maxTime);
        }

        int maxCandidates = firstNonNull(request.getMaxCandidates(), preset.getMaxCandidates(),
                SearchSettings.DEFAULT_MAX_CANDIDATES);
        if (maxCandidates <= 0) {
            throw new ConfigurationException("max-candidates must be positive, got " + maxCandidates);
        }

        long maxNodes = firstNonNull(request.getMaxNodes(), preset.getMaxNodes(), 0L);
        if (maxNodes < 0) {
            throw new ConfigurationException("max-nodes must not be negative, got " + maxNodes);
        }

        int threads = firstNonNull(request.getThreads(), preset.getThreads(), properties.getThreads());
        if (threads < 0) {
            throw new ConfigurationException("threads must not be negative, got " + threads);
        }
        if (threads == 0) {
            threads = Runtime.getRuntime().availableProcessors();
        }

        int numSchedules = firstNonNull(request.getNumSchedules(), preset.getNumSchedules(), 1);
        if (numSchedules <= 0) {
            throw new ConfigurationException("num-schedules must be positive, got " + numSchedules);
        }

        OptimizationStrategy strategy = firstNonNull(request.getStrategy(), preset.getStrategy(),
                OptimizationStrategy.BRANCH_AND_BOUND);
        return new SearchSettings(strategy, maxTime, maxCandidates, maxNodes, threads, numSchedules);
    }

    private static <T> T firstNonNull(T first, T second, T fallback) {
        if (first != null) return first;
        if (second != null) return second;
        return fallback;
    }

    private static List<String> knownRules() {
        List<String> names = new ArrayList<>();
        for (SoftRule rule : SoftRule.values()) {
            names.add(rule.getRuleName());
        }
        return names;
    }
}
