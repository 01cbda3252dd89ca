package com.boxofficeintel.daily.model;

import com.boxofficeintel.daily.util.TitleNormalizer;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One movie's row from a single date page of the reporting source.
 *
 * Schema notes:
 *  - only date, sourceTitle and dailyGross are mandatory; every other column may be absent
 *    from a given page layout and is kept as null rather than zero
 *  - sourceUrl is the canonical release link (absolute, no query string)
 *  - records are immutable once stored; the key is (date, recordKey())
 */
@Value
@Builder(toBuilder = true)
public class DailyRecord {

    private static final String TITLE_KEY_PREFIX = "title:";

    // ── Identity ────────────────────────────────────────────────────────────
    LocalDate date;
    String sourceTitle;
    String sourceUrl;

    // ── Revenue ─────────────────────────────────────────────────────────────
    Long dailyGross;

    /** Percent change vs. the previous day, e.g. -42.5 */
    Double yesterdayPctChange;

    /** Percent change vs. the same weekday one week earlier */
    Double lastWeekPctChange;

    Long cumulativeGross;

    // ── Distribution ────────────────────────────────────────────────────────
    Integer theaterCount;
    Double perTheaterAvg;
    Integer daysInRelease;

    // ── Listing metadata ────────────────────────────────────────────────────
    Integer rank;
    String distributor;

    /**
     * Stable per-date key: the release url when the page linked one, the folded title otherwise.
     */
    public String recordKey() {
        if (sourceUrl != null && !sourceUrl.isBlank()) {
            return sourceUrl;
        }
        return TITLE_KEY_PREFIX + TitleNormalizer.normalize(sourceTitle);
    }

    /**
     * Release date implied by the page: report date minus days in release.
     * Falls back to the report date when the days column was missing.
     */
    public LocalDate estimatedReleaseDate() {
        return daysInRelease == null ? date : date.minusDays(daysInRelease);
    }
}
