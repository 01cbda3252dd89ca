package com.boxofficeintel.daily.service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Columns of a date page's result table.
 *
 * Header text is folded to lower-case letters, digits and '%' before lookup, so
 * "%± YD" becomes "%yd" and cannot collide with the "LW" rank column.
 * The positions are the layout the pages used before headers were reliable.
 */
public enum ReportColumn {

    RANK(0, "rank"),
    RELEASE(2, "release", "title", "movie", "releasetitle"),
    DAILY_GROSS(3, "daily", "dailygross", "gross"),
    YESTERDAY_CHANGE(4, "%yd", "ydchange", "%ydchange"),
    LAST_WEEK_CHANGE(5, "%lw", "lwchange", "%lwchange"),
    THEATERS(6, "theaters", "theatres", "theatercount"),
    PER_THEATER_AVG(7, "avg", "average", "pertheater", "pertheateravg"),
    TO_DATE(8, "todate", "total", "totalgross", "cumulative"),
    DAYS(9, "days", "daysinrelease"),
    DISTRIBUTOR(10, "distributor");

    private final int legacyPosition;
    private final List<String> aliases;

    ReportColumn(int legacyPosition, String... aliases) {
        this.legacyPosition = legacyPosition;
        this.aliases = List.of(aliases);
    }

    public static String foldHeader(String header) {
        if (header == null) return "";
        return header.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9%]", "");
    }

    /**
     * Maps header cells to columns. Unknown headers are ignored; the first cell matching a
     * column wins if a page ever repeats one.
     */
    public static Map<ReportColumn, Integer> fromHeaders(List<String> headers) {
        Map<ReportColumn, Integer> positions = new EnumMap<>(ReportColumn.class);
        for (int i = 0; i < headers.size(); i++) {
            String folded = foldHeader(headers.get(i));
            for (ReportColumn column : values()) {
                if (column.aliases.contains(folded)) {
                    positions.putIfAbsent(column, i);
                    break;
                }
            }
        }
        return positions;
    }

    public static Map<ReportColumn, Integer> legacyLayout() {
        Map<ReportColumn, Integer> positions = new EnumMap<>(ReportColumn.class);
        for (ReportColumn column : values()) {
            positions.put(column, column.legacyPosition);
        }
        return positions;
    }
}
