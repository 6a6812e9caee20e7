package com.classsched.classsched_api.solver.domain;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * One (weekday, period) cell of the weekly grid. The id doubles as the bit
 * position used by slot masks.
 */
public final class Timeslot implements Comparable<Timeslot> {

    private final int id;
    private final DayOfWeek dayOfWeek;
    private final int period;
    private final PartOfDay partOfDay;

    Timeslot(int id, DayOfWeek dayOfWeek, int period) {
        this.id = id;
        this.dayOfWeek = dayOfWeek;
        this.period = period;
        this.partOfDay = PartOfDay.ofPeriod(period);
    }

    public int getId() { return id; }
    public DayOfWeek getDayOfWeek() { return dayOfWeek; }
    /** Zero-based weekday, Monday = 0. */
    public int getWeekday() { return dayOfWeek.getValue() - 1; }
    public int getPeriod() { return period; }
    public PartOfDay getPartOfDay() { return partOfDay; }

    public long bit() {
        return 1L << id;
    }

    @Override
    public int compareTo(Timeslot other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return dayOfWeek + " " + period;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Timeslot timeslot = (Timeslot) o;
        return id == timeslot.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
