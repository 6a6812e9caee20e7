package com.classsched.classsched_api.solver.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Coarse part of the day a period belongs to. Two periods per part.
 */
public enum PartOfDay {
    MORNING,
    AFTERNOON,
    NIGHT;

    public static PartOfDay ofPeriod(int period) {
        if (period < 0 || period > 5) {
            throw new IllegalArgumentException("Period out of range: " + period);
        }
        return values()[period / 2];
    }

    /**
     * Parses a part-of-day label. "integral" expands to morning and afternoon.
     */
    public static Set<PartOfDay> parse(String label) {
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "morning":
            case "m":
                return EnumSet.of(MORNING);
            case "afternoon":
            case "a":
            case "t":
                return EnumSet.of(AFTERNOON);
            case "night":
            case "n":
                return EnumSet.of(NIGHT);
            case "integral":
            case "i":
                return EnumSet.of(MORNING, AFTERNOON);
            default:
                throw new IllegalArgumentException("Invalid part of the day: " + label);
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
