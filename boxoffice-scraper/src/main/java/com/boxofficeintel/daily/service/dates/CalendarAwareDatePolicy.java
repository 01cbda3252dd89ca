package com.boxofficeintel.daily.service.dates;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Fridays, when most wide releases open, plus the US holidays that attract off-cycle releases:
 * New Year's Day, Valentine's Day, Easter Sunday, Memorial Day, Independence Day,
 * Thanksgiving and Christmas.
 */
public class CalendarAwareDatePolicy implements DateSelectionPolicy {

    @Override
    public List<LocalDate> select(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) return List.of();

        TreeSet<LocalDate> dates = new TreeSet<>();
        LocalDate friday = start.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
        while (!friday.isAfter(end)) {
            dates.add(friday);
            friday = friday.plusWeeks(1);
        }
        for (int year = start.getYear(); year <= end.getYear(); year++) {
            for (LocalDate holiday : holidays(year)) {
                if (!holiday.isBefore(start) && !holiday.isAfter(end)) {
                    dates.add(holiday);
                }
            }
        }
        return new ArrayList<>(dates);
    }

    @Override
    public String name() {
        return "calendar-aware";
    }

    static List<LocalDate> holidays(int year) {
        return List.of(
                LocalDate.of(year, Month.JANUARY, 1),
                LocalDate.of(year, Month.FEBRUARY, 14),
                easterSunday(year),
                LocalDate.of(year, Month.MAY, 31).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)),
                LocalDate.of(year, Month.JULY, 4),
                LocalDate.of(year, Month.NOVEMBER, 1).with(TemporalAdjusters.dayOfWeekInMonth(4, DayOfWeek.THURSDAY)),
                LocalDate.of(year, Month.DECEMBER, 25));
    }

    /** Anonymous Gregorian computus. */
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
