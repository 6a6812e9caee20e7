package com.classsched.classsched_api.solver.rules;

import java.util.Arrays;
import java.util.Optional;

/**
 * The bundled soft constraints. A rule is either local to one unit or looks
 * at pairs of units; the search uses that split to bound partial timetables.
 */
public enum SoftRule {

    NON_MORNING_CLASS("non_morning_class", false,
            "Penalizes every meeting outside the morning."),
    CURRICULUM_CONFLICT("curriculum_conflict", true,
            "Penalizes two units of a common curriculum meeting in the same slot."),
    DIFFERENT_PARTS_OF_DAY("different_parts_of_day", false,
            "Penalizes a unit whose meetings fall in more than one part of the day."),
    UNDERGRAD_FRIDAY_AFTERNOON("undergrad_friday_afternoon", false,
            "Penalizes non-fixed undergraduate meetings on Friday after the morning."),
    TEACHER_PREFERENCE("teacher_preference", false,
            "Penalizes meetings outside a lecturer's preferred slots."),
    MAXIMUM_SPACING("maximum_spacing", false,
            "Penalizes pairs of meetings of one unit more than a threshold of weekdays apart."),
    SCIENCE_STATISTICS_CONFLICT("science_statistics_conflict", true,
            "Penalizes conflicts between science/statistics units and required units from the second semester on.");

    private final String ruleName;
    private final boolean pairwise;
    private final String description;

    SoftRule(String ruleName, boolean pairwise, String description) {
        this.ruleName = ruleName;
        this.pairwise = pairwise;
        this.description = description;
    }

    public String getRuleName() { return ruleName; }
    public boolean isPairwise() { return pairwise; }
    public String getDescription() { return description; }

    public static Optional<SoftRule> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().replace('-', '_');
        return Arrays.stream(values())
                .filter(rule -> rule.ruleName.equalsIgnoreCase(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return ruleName;
    }
}
