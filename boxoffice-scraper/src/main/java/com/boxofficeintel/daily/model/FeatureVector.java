package com.boxofficeintel.daily.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Early-run trajectory of one movie, one row of the feature table.
 *
 * Every numeric field is nullable: a field whose defining window was not fully observed is null,
 * never zero. observedDays and hasWeek2Data let consumers filter on coverage directly.
 */
@Value
@Builder
public class FeatureVector {

    String movieId;
    String canonicalTitle;

    // ── Theater distribution ────────────────────────────────────────────────
    Integer openingTheaters;
    Integer peakTheaters;
    Double meanTheaters;
    Integer minTheaters;
    Double theaterExpansionRatio;
    Double theaterStdDev;
    Double week1MeanTheaters;

    // ── Revenue momentum ────────────────────────────────────────────────────
    Long openingDayGross;
    Long peakDailyGross;
    Double meanDailyGross;
    Double dailyGrossStdDev;

    // ── Per-theater performance ─────────────────────────────────────────────
    Double openingPerTheater;
    Double peakPerTheater;
    Double meanPerTheater;
    Double perTheaterStdDev;
    Double perTheaterSlope;

    // ── Day-to-day dynamics ─────────────────────────────────────────────────
    Double meanYesterdayChange;
    Double yesterdayChangeStdDev;
    Double meanLastWeekChange;
    Double lastWeekChangeStdDev;
    Double maxDailyGain;
    Double maxDailyDrop;

    // ── Opening window (offsets 0–2) ────────────────────────────────────────
    Long opening3DayGross;
    Double opening3DayPerTheater;

    // ── Weekly (offsets 0–6 and 7–13) ───────────────────────────────────────
    Double week1MeanGross;
    Double week2MeanGross;
    Double week2Week1Ratio;

    // ── Run shape ───────────────────────────────────────────────────────────
    Double frontLoadingRatio;
    Long lastCumulativeGross;
    Integer maxDaysInRelease;

    // ── Coverage ────────────────────────────────────────────────────────────
    int observedDays;
    boolean hasWeek2Data;

    /**
     * Column name → value in feature-table order. Shared by every sink so that the database
     * table and the CSV export never drift apart.
     */
    public Map<String, Object> asColumnMap() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("movie_id", movieId);
        columns.put("canonical_title", canonicalTitle);
        columns.put("opening_theaters", openingTheaters);
        columns.put("peak_theaters", peakTheaters);
        columns.put("mean_theaters", meanTheaters);
        columns.put("min_theaters", minTheaters);
        columns.put("theater_expansion_ratio", theaterExpansionRatio);
        columns.put("theater_std_dev", theaterStdDev);
        columns.put("week1_mean_theaters", week1MeanTheaters);
        columns.put("opening_day_gross", openingDayGross);
        columns.put("peak_daily_gross", peakDailyGross);
        columns.put("mean_daily_gross", meanDailyGross);
        columns.put("daily_gross_std_dev", dailyGrossStdDev);
        columns.put("opening_per_theater", openingPerTheater);
        columns.put("peak_per_theater", peakPerTheater);
        columns.put("mean_per_theater", meanPerTheater);
        columns.put("per_theater_std_dev", perTheaterStdDev);
        columns.put("per_theater_slope", perTheaterSlope);
        columns.put("mean_yesterday_change", meanYesterdayChange);
        columns.put("yesterday_change_std_dev", yesterdayChangeStdDev);
        columns.put("mean_last_week_change", meanLastWeekChange);
        columns.put("last_week_change_std_dev", lastWeekChangeStdDev);
        columns.put("max_daily_gain", maxDailyGain);
        columns.put("max_daily_drop", maxDailyDrop);
        columns.put("opening_3day_gross", opening3DayGross);
        columns.put("opening_3day_per_theater", opening3DayPerTheater);
        columns.put("week1_mean_gross", week1MeanGross);
        columns.put("week2_mean_gross", week2MeanGross);
        columns.put("week2_week1_ratio", week2Week1Ratio);
        columns.put("front_loading_ratio", frontLoadingRatio);
        columns.put("last_cumulative_gross", lastCumulativeGross);
        columns.put("max_days_in_release", maxDaysInRelease);
        columns.put("observed_days", observedDays);
        columns.put("has_week2_data", hasWeek2Data);
        return Collections.unmodifiableMap(columns);
    }
}
