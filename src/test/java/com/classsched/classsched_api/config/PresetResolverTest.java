package com.classsched.classsched_api.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.classsched.classsched_api.config.SchedulerProperties.PresetProperties;
import com.classsched.classsched_api.config.SchedulerProperties.RuleProperties;
import com.classsched.classsched_api.dto.SolveRequest;
import com.classsched.classsched_api.exception.ConfigurationException;
import com.classsched.classsched_api.solver.optimizer.OptimizationStrategy;
import com.classsched.classsched_api.solver.optimizer.SolverPreset;
import com.classsched.classsched_api.solver.rules.RuleSetting;
import com.classsched.classsched_api.solver.rules.SoftRule;

class PresetResolverTest {

    private SchedulerProperties properties;
    private PresetResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.setThreads(3);
        PresetProperties preset = new PresetProperties();
        preset.setMaxTime(Duration.ofSeconds(12));
        preset.getRules().put("non-morning-class", new RuleProperties(true, 1L, 0));
        preset.getRules().put("teacher_preference", new RuleProperties(null, 10L, 3));
        RuleProperties spacing = new RuleProperties(false, 2L, 1);
        spacing.setThreshold(2);
        preset.getRules().put("maximum-spacing", spacing);
        properties.getPresets().put("default", preset);
        resolver = new PresetResolver(properties);
    }

    private static SolveRequest request() {
        return new SolveRequest();
    }

    @Test
    void resolvesDefaultPreset() {
        SolverPreset preset = resolver.resolve(request());

        assertThat(preset.getName()).isEqualTo("default");
        assertThat(preset.getRules().getSettings()).extracting(RuleSetting::getRule)
                .containsExactly(SoftRule.TEACHER_PREFERENCE, SoftRule.NON_MORNING_CLASS);
        assertThat(preset.getRules().getPriorities()).containsExactly(3, 0);
        assertThat(preset.getSearch().getMaxTime()).isEqualTo(Duration.ofSeconds(12));
        assertThat(preset.getSearch().getThreads()).isEqualTo(3);
        assertThat(preset.getSearch().getStrategy()).isEqualTo(OptimizationStrategy.BRANCH_AND_BOUND);
        assertThat(preset.getSearch().getNumSchedules()).isEqualTo(1);
    }

    @Test
    void numberOfSchedulesComesFromPresetThenRequest() {
        properties.getPresets().get("default").setNumSchedules(4);
        assertThat(resolver.resolve(request()).getSearch().getNumSchedules()).isEqualTo(4);

        SolveRequest request = request();
        request.setNumSchedules(2);
        assertThat(resolver.resolve(request).getSearch().getNumSchedules()).isEqualTo(2);

        SolveRequest none = request();
        none.setNumSchedules(0);
        assertThatThrownBy(() -> resolver.resolve(none))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("num-schedules");
    }

    @Test
    void requestOverridesRulesAndBudget() {
        SolveRequest request = request();
        RuleProperties enableSpacing = new RuleProperties();
        enableSpacing.setEnabled(true);
        request.setRules(Map.of(
                "maximum_spacing", enableSpacing,
                "non_morning_class", new RuleProperties(false, null, null)));
        request.setMaxTimeSeconds(2L);
        request.setStrategy(OptimizationStrategy.CANDIDATE_POOL);
        request.setMaxCandidates(7);

        SolverPreset preset = resolver.resolve(request);

        assertThat(preset.getRules().getSettings()).extracting(RuleSetting::getRule)
                .containsExactly(SoftRule.TEACHER_PREFERENCE, SoftRule.MAXIMUM_SPACING);
        assertThat(preset.getRules().setting(SoftRule.MAXIMUM_SPACING).get().getThreshold()).isEqualTo(2);
        assertThat(preset.getSearch().getMaxTime()).isEqualTo(Duration.ofSeconds(2));
        assertThat(preset.getSearch().getStrategy()).isEqualTo(OptimizationStrategy.CANDIDATE_POOL);
        assertThat(preset.getSearch().getMaxCandidates()).isEqualTo(7);
    }

    @Test
    void curriculaAreNormalized() {
        SolveRequest request = request();
        RuleProperties science = new RuleProperties(true, 1L, 1);
        science.setCurricula(List.of(" Physics ", "STATISTICS"));
        request.setRules(Map.of("science-statistics-conflict", science));

        SolverPreset preset = resolver.resolve(request);

        assertThat(preset.getRules().setting(SoftRule.SCIENCE_STATISTICS_CONFLICT).get().getCurricula())
                .containsExactlyInAnyOrder("physics", "statistics");
    }

    @Test
    void rejectsUnknownPreset() {
        assertThatThrownBy(() -> resolver.resolve("nightly"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nightly");
    }

    @Test
    void rejectsUnknownRule() {
        SolveRequest request = request();
        request.setRules(Map.of("lunch-break", new RuleProperties(true, 1L, 1)));

        assertThatThrownBy(() -> resolver.resolve(request))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("lunch-break");
    }

    @Test
    void rejectsInvalidRuleValues() {
        assertRejected("curriculum-conflict", new RuleProperties(true, -1L, 1), "negative weight");
        assertRejected("curriculum-conflict", new RuleProperties(true, 1L, null), "no priority");
        assertRejected("curriculum-conflict", new RuleProperties(true, 1L, -2), "negative priority");
        RuleProperties spacing = new RuleProperties(true, 1L, 1);
        spacing.setThreshold(5);
        assertRejected("maximum-spacing", spacing, "threshold");
    }

    @Test
    void rejectsNonPositiveBudget() {
        SolveRequest request = request();
        request.setMaxTimeSeconds(0L);
        assertThatThrownBy(() -> resolver.resolve(request)).isInstanceOf(ConfigurationException.class);

        SolveRequest candidates = request();
        candidates.setMaxCandidates(0);
        assertThatThrownBy(() -> resolver.resolve(candidates)).isInstanceOf(ConfigurationException.class);

        SolveRequest nodes = request();
        nodes.setMaxNodes(-5L);
        assertThatThrownBy(() -> resolver.resolve(nodes)).isInstanceOf(ConfigurationException.class);
    }

    private void assertRejected(String rule, RuleProperties props, String message) {
        SolveRequest request = request();
        request.setRules(Map.of(rule, props));
        assertThatThrownBy(() -> resolver.resolve(request))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(message);
    }
}
