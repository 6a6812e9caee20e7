package com.classsched.classsched_api.solver.facts;

import java.util.Objects;

/**
 * A lecturer with the slots they can teach in and the subset they prefer.
 */
public final class Teacher {

    private final String id;
    private final long availableMask;
    private final long preferredMask;

    public Teacher(String id, long availableMask, long preferredMask) {
        this.id = id;
        this.availableMask = availableMask;
        this.preferredMask = preferredMask & availableMask;
    }

    public String getId() { return id; }
    public long getAvailableMask() { return availableMask; }
    public long getPreferredMask() { return preferredMask; }

    public boolean hasPreferences() {
        return preferredMask != 0L;
    }

    /** Number of available slots. */
    public int availability() {
        return Long.bitCount(availableMask);
    }

    @Override
    public String toString() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((Teacher) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
