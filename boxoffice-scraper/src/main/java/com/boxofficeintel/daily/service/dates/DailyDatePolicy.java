package com.boxofficeintel.daily.service.dates;

import java.time.LocalDate;
import java.util.List;

/** Every calendar date. */
public class DailyDatePolicy implements DateSelectionPolicy {

    @Override
    public List<LocalDate> select(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) return List.of();
        return start.datesUntil(end.plusDays(1)).toList();
    }

    @Override
    public String name() {
        return "daily";
    }
}
