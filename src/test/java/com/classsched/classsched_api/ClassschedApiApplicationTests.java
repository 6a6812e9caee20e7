package com.classsched.classsched_api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.classsched.classsched_api.config.PresetResolver;
import com.classsched.classsched_api.solver.optimizer.OptimizationStrategy;
import com.classsched.classsched_api.solver.optimizer.SolverPreset;
import com.classsched.classsched_api.solver.rules.SoftRule;

@SpringBootTest
class ClassschedApiApplicationTests {

    @Autowired
    private PresetResolver presetResolver;

    @Test
    void contextLoadsWithConfiguredPresets() {
        assertThat(presetResolver.presetNames()).contains("default", "quick", "feasibility");

        SolverPreset preset = presetResolver.resolve("default");
        assertThat(preset.getRules().getSettings()).hasSize(SoftRule.values().length);
        assertThat(preset.getRules().getPriorities()).containsExactly(3, 2, 1, 0);

        SolverPreset quick = presetResolver.resolve("quick");
        assertThat(quick.getSearch().getStrategy()).isEqualTo(OptimizationStrategy.CANDIDATE_POOL);
        assertThat(quick.getSearch().getNumSchedules()).isEqualTo(3);
        assertThat(presetResolver.resolve("feasibility").getRules().isEmpty()).isTrue();
    }
}
