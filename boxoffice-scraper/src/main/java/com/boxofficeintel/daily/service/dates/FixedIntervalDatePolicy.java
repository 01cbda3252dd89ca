package com.boxofficeintel.daily.service.dates;

import java.time.LocalDate;
import java.time.Period;
import java.util.List;

/**
 * Every N days from the range start: 7 for weekly sampling, 14 for biweekly.
 * Coarse sampling leaves the opening and weekly windows of most movies incomplete.
 */
public class FixedIntervalDatePolicy implements DateSelectionPolicy {

    private final int intervalDays;

    public FixedIntervalDatePolicy(int intervalDays) {
        if (intervalDays < 1) {
            throw new IllegalArgumentException("intervalDays must be positive, got " + intervalDays);
        }
        this.intervalDays = intervalDays;
    }

    @Override
    public List<LocalDate> select(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) return List.of();
        return start.datesUntil(end.plusDays(1), Period.ofDays(intervalDays)).toList();
    }

    @Override
    public String name() {
        return "every-" + intervalDays + "-days";
    }
}
