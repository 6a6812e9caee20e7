package com.classsched.classsched_api.solver.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

import ai.timefold.solver.core.api.score.buildin.bendablelong.BendableLongScore;

/**
 * Enabled soft rules grouped into priority layers. Layer 0 holds the highest
 * priority and is compared first.
 *
 * <p>Costs are expressed as a {@link BendableLongScore} with a single hard
 * level and one soft level per layer; soft levels hold negated costs so that a
 * higher score is a better timetable. With no enabled rule the score still has
 * one (always zero) soft level.
 */
public final class LayeredRules {

    private final List<RuleSetting> settings;
    private final List<Integer> priorities;
    private final Map<SoftRule, RuleSetting> byRule;

    public LayeredRules(List<RuleSetting> settings) {
        List<RuleSetting> sorted = new ArrayList<>(settings);
        sorted.sort(Comparator.comparingInt(RuleSetting::getPriority).reversed()
                .thenComparing(RuleSetting::getRule));
        this.settings = Collections.unmodifiableList(sorted);

        TreeSet<Integer> distinct = new TreeSet<>(Comparator.reverseOrder());
        Map<SoftRule, RuleSetting> map = new EnumMap<>(SoftRule.class);
        for (RuleSetting setting : sorted) {
            distinct.add(setting.getPriority());
            if (map.put(setting.getRule(), setting) != null) {
                throw new IllegalArgumentException("Rule " + setting.getRule() + " configured twice");
            }
        }
        this.priorities = List.copyOf(distinct);
        this.byRule = Collections.unmodifiableMap(map);
    }

    public static LayeredRules none() {
        return new LayeredRules(List.of());
    }

    /** Enabled rules, highest priority first. */
    public List<RuleSetting> getSettings() { return settings; }

    /** Distinct priorities, highest first; index = layer. */
    public List<Integer> getPriorities() { return priorities; }

    public boolean isEmpty() {
        return settings.isEmpty();
    }

    public Optional<RuleSetting> setting(SoftRule rule) {
        return Optional.ofNullable(byRule.get(rule));
    }

    public boolean hasPairwiseRules() {
        return settings.stream().anyMatch(s -> s.getRule().isPairwise());
    }

    public int layerOf(SoftRule rule) {
        RuleSetting setting = byRule.get(rule);
        if (setting == null) {
            throw new IllegalArgumentException("Rule " + rule + " is not enabled");
        }
        return priorities.indexOf(setting.getPriority());
    }

    public List<SoftRule> rulesInLayer(int layer) {
        int priority = priorities.get(layer);
        return settings.stream()
                .filter(s -> s.getPriority() == priority)
                .map(RuleSetting::getRule)
                .collect(Collectors.toList());
    }

    public int layerCount() {
        return priorities.size();
    }

    public int softLevels() {
        return Math.max(1, priorities.size());
    }

    public BendableLongScore zeroScore() {
        return BendableLongScore.of(new long[1], new long[softLevels()]);
    }

    /** Score of a cost vector indexed by layer. */
    public BendableLongScore toScore(long[] layerCosts) {
        long[] soft = new long[softLevels()];
        for (int i = 0; i < layerCosts.length; i++) {
            soft[i] = -layerCosts[i];
        }
        return BendableLongScore.of(new long[1], soft);
    }

    /** Cost vector (positive penalties per layer) of a score built by this instance. */
    public long[] toCosts(BendableLongScore score) {
        long[] costs = new long[layerCount()];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = -score.softScore(i);
        }
        return costs;
    }
}
