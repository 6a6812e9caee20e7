package com.classsched.classsched_api.solver.domain;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The finite weekly grid every other component works on: five weekdays times
 * six periods. Built once and shared read-only, so it is safe across search
 * workers.
 *
 * <p>Sets of slots are handled as {@code long} bitmasks where bit {@code i}
 * stands for the timeslot with id {@code i}.
 */
public final class SlotDomain {

    public static final int PERIODS_PER_DAY = 6;

    private static final List<DayOfWeek> WEEKDAYS = List.of(
            DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);

    private final List<Timeslot> timeslots;
    private final long fullMask;

    private SlotDomain() {
        List<Timeslot> slots = new ArrayList<>();
        int id = 0;
        for (DayOfWeek day : WEEKDAYS) {
            for (int period = 0; period < PERIODS_PER_DAY; period++) {
                slots.add(new Timeslot(id++, day, period));
            }
        }
        this.timeslots = Collections.unmodifiableList(slots);
        this.fullMask = (1L << slots.size()) - 1;
    }

    public static SlotDomain standard() {
        return new SlotDomain();
    }

    public List<DayOfWeek> getWeekdays() { return WEEKDAYS; }
    public List<Timeslot> getTimeslots() { return timeslots; }
    public int size() { return timeslots.size(); }
    public long fullMask() { return fullMask; }

    public Timeslot get(int id) {
        return timeslots.get(id);
    }

    /**
     * @param weekday zero-based weekday, Monday = 0
     */
    public Timeslot of(int weekday, int period) {
        if (weekday < 0 || weekday >= WEEKDAYS.size()) {
            throw new IllegalArgumentException("Weekday out of range: " + weekday);
        }
        if (period < 0 || period >= PERIODS_PER_DAY) {
            throw new IllegalArgumentException("Period out of range: " + period);
        }
        return timeslots.get(weekday * PERIODS_PER_DAY + period);
    }

    public Timeslot of(DayOfWeek day, int period) {
        int weekday = WEEKDAYS.indexOf(day);
        if (weekday < 0) {
            throw new IllegalArgumentException("No classes are scheduled on " + day);
        }
        return of(weekday, period);
    }

    public long mask(Collection<Timeslot> slots) {
        long mask = 0L;
        for (Timeslot slot : slots) {
            mask |= slot.bit();
        }
        return mask;
    }

    public List<Timeslot> slotsOf(long mask) {
        List<Timeslot> slots = new ArrayList<>(Long.bitCount(mask));
        long rest = mask;
        while (rest != 0) {
            int id = Long.numberOfTrailingZeros(rest);
            slots.add(timeslots.get(id));
            rest &= rest - 1;
        }
        return slots;
    }

    public long weekdayMask(int weekday) {
        long dayBits = (1L << PERIODS_PER_DAY) - 1;
        return dayBits << (weekday * PERIODS_PER_DAY);
    }

    public long partOfDayMask(Set<PartOfDay> parts) {
        long mask = 0L;
        for (Timeslot slot : timeslots) {
            if (parts.contains(slot.getPartOfDay())) {
                mask |= slot.bit();
            }
        }
        return mask;
    }
}
