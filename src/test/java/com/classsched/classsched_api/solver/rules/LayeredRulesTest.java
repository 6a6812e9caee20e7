package com.classsched.classsched_api.solver.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

class LayeredRulesTest {

    private final LayeredRules rules = new LayeredRules(List.of(
            RuleSetting.of(SoftRule.NON_MORNING_CLASS, 1, 0),
            RuleSetting.of(SoftRule.TEACHER_PREFERENCE, 10, 5),
            RuleSetting.of(SoftRule.CURRICULUM_CONFLICT, 3, 5),
            RuleSetting.of(SoftRule.MAXIMUM_SPACING, 2, 2)));

    @Test
    void layersAreDistinctPrioritiesHighestFirst() {
        assertThat(rules.getPriorities()).containsExactly(5, 2, 0);
        assertThat(rules.layerOf(SoftRule.TEACHER_PREFERENCE)).isZero();
        assertThat(rules.layerOf(SoftRule.CURRICULUM_CONFLICT)).isZero();
        assertThat(rules.layerOf(SoftRule.NON_MORNING_CLASS)).isEqualTo(2);
        assertThat(rules.rulesInLayer(0)).containsExactly(SoftRule.CURRICULUM_CONFLICT, SoftRule.TEACHER_PREFERENCE);
    }

    @Test
    void higherLayerDominatesLowerLayers() {
        BendableLongScore cheapTop = rules.toScore(new long[] {1, 100, 100});
        BendableLongScore expensiveTop = rules.toScore(new long[] {2, 0, 0});
        assertThat(cheapTop).isGreaterThan(expensiveTop);
        assertThat(rules.toCosts(cheapTop)).containsExactly(1, 100, 100);
    }

    @Test
    void noRulesStillScoresOnOneLevel() {
        LayeredRules none = LayeredRules.none();
        assertThat(none.isEmpty()).isTrue();
        assertThat(none.softLevels()).isEqualTo(1);
        assertThat(none.zeroScore()).isEqualTo(none.toScore(new long[0]));
    }

    @Test
    void ruleNamesAcceptSnakeAndKebabCase() {
        assertThat(SoftRule.fromName("maximum_spacing")).contains(SoftRule.MAXIMUM_SPACING);
        assertThat(SoftRule.fromName("Undergrad-Friday-Afternoon")).contains(SoftRule.UNDERGRAD_FRIDAY_AFTERNOON);
        assertThat(SoftRule.fromName("lunch_break")).isEmpty();
    }

    @Test
    void ruleCannotBeConfiguredTwice() {
        assertThatThrownBy(() -> new LayeredRules(List.of(
                RuleSetting.of(SoftRule.NON_MORNING_CLASS, 1, 0),
                RuleSetting.of(SoftRule.NON_MORNING_CLASS, 2, 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
