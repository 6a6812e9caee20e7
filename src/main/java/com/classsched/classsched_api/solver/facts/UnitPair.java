package com.classsched.classsched_api.solver.facts;

import lombok.Value;

/**
 * Unordered pair of distinct units kept in canonical order (smaller key
 * first), so that a relation between two units is reported once.
 */
@Value
public class UnitPair implements Comparable<UnitPair> {

    UnitKey first;
    UnitKey second;

    public static UnitPair of(UnitKey a, UnitKey b) {
        if (a.equals(b)) {
            throw new IllegalArgumentException("A unit cannot be paired with itself: " + a);
        }
        return a.compareTo(b) < 0 ? new UnitPair(a, b) : new UnitPair(b, a);
    }

    public boolean contains(UnitKey key) {
        return first.equals(key) || second.equals(key);
    }

    @Override
    public int compareTo(UnitPair other) {
        int cmp = first.compareTo(other.first);
        return cmp != 0 ? cmp : second.compareTo(other.second);
    }

    @Override
    public String toString() {
        return first + " & " + second;
    }
}
