package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.model.DailyRecord;
import com.boxofficeintel.daily.model.FeatureVector;
import com.boxofficeintel.daily.model.MovieIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Turns one movie's matched daily records into its feature vector.
 *
 * Records are re-indexed to day offsets from the catalog release date (offset 0 = release day),
 * or from the first observed record when the catalog has no date. Window features need every
 * offset of their window; a gap nulls the feature rather than shrinking the window.
 *
 * Windows:
 *   opening  0–2    opening3DayGross, opening3DayPerTheater
 *   week 1   0–6    week1MeanGross, week1MeanTheaters, frontLoadingRatio
 *   week 2   7–13   week2MeanGross, week2Week1Ratio, hasWeek2Data
 */
@Component
@Slf4j
public class MovieFeatureAggregator {

    static final int OPENING_LAST_OFFSET = 2;
    static final int WEEK1_LAST_OFFSET = 6;
    static final int WEEK2_FIRST_OFFSET = 7;
    static final int WEEK2_LAST_OFFSET = 13;

    public FeatureVector aggregate(MovieIdentity movie, List<DailyRecord> records) {
        NavigableMap<Integer, DailyRecord> byOffset = indexByOffset(movie, records);
        List<DailyRecord> observed = new ArrayList<>(byOffset.values());
        DailyRecord opening = byOffset.get(0);

        // Theater distribution
        List<Integer> theaters = values(observed, DailyRecord::getTheaterCount);
        Integer openingTheaters = opening == null ? null : opening.getTheaterCount();
        Integer peakTheaters = theaters.stream().max(Integer::compare).orElse(null);
        Integer minTheaters = theaters.stream().min(Integer::compare).orElse(null);
        Double expansionRatio = (peakTheaters != null && openingTheaters != null && openingTheaters > 0)
                ? peakTheaters / (double) openingTheaters
                : null;

        // Revenue
        List<Long> grosses = values(observed, DailyRecord::getDailyGross);
        Long peakGross = grosses.stream().max(Long::compare).orElse(null);

        // Per-theater
        List<Integer> perTheaterOffsets = new ArrayList<>();
        List<Double> perTheater = new ArrayList<>();
        byOffset.forEach((offset, record) -> {
            Double value = perTheater(record);
            if (value != null) {
                perTheaterOffsets.add(offset);
                perTheater.add(value);
            }
        });

        // Day-to-day
        List<Double> yesterday = values(observed, DailyRecord::getYesterdayPctChange);
        List<Double> lastWeek = values(observed, DailyRecord::getLastWeekPctChange);
        List<Double> gains = yesterday.stream().filter(v -> v > 0).toList();
        List<Double> drops = yesterday.stream().filter(v -> v < 0).toList();

        // Windows
        List<DailyRecord> openingWindow = completeWindow(byOffset, 0, OPENING_LAST_OFFSET);
        List<DailyRecord> week1 = completeWindow(byOffset, 0, WEEK1_LAST_OFFSET);
        List<DailyRecord> week2 = completeWindow(byOffset, WEEK2_FIRST_OFFSET, WEEK2_LAST_OFFSET);

        Long opening3Day = openingWindow == null ? null : sumGross(openingWindow);
        Double opening3DayPerTheater = null;
        if (openingWindow != null) {
            Double windowTheaters = meanIfComplete(openingWindow, DailyRecord::getTheaterCount);
            if (windowTheaters != null && windowTheaters > 0) {
                opening3DayPerTheater = opening3Day / windowTheaters;
            }
        }

        Double week1Mean = week1 == null ? null : SeriesStats.mean(values(week1, DailyRecord::getDailyGross));
        Double week1Theaters = week1 == null ? null : meanIfComplete(week1, DailyRecord::getTheaterCount);
        Double week2Mean = week2 == null ? null : SeriesStats.mean(values(week2, DailyRecord::getDailyGross));
        Double weekRatio = (week1Mean != null && week1Mean > 0 && week2Mean != null) ? week2Mean / week1Mean : null;

        Long lastCumulative = observed.isEmpty() ? null : observed.get(observed.size() - 1).getCumulativeGross();
        Double frontLoading = (week1 != null && opening3Day != null && lastCumulative != null && lastCumulative > 0)
                ? opening3Day / (double) lastCumulative
                : null;

        return FeatureVector.builder()
                .movieId(movie.getMovieId())
                .canonicalTitle(movie.getCanonicalTitle())
                .openingTheaters(openingTheaters)
                .peakTheaters(peakTheaters)
                .meanTheaters(SeriesStats.mean(theaters))
                .minTheaters(minTheaters)
                .theaterExpansionRatio(expansionRatio)
                .theaterStdDev(SeriesStats.sampleStdDev(theaters))
                .week1MeanTheaters(week1Theaters)
                .openingDayGross(opening == null ? null : opening.getDailyGross())
                .peakDailyGross(peakGross)
                .meanDailyGross(SeriesStats.mean(grosses))
                .dailyGrossStdDev(SeriesStats.sampleStdDev(grosses))
                .openingPerTheater(opening == null ? null : perTheater(opening))
                .peakPerTheater(SeriesStats.max(perTheater))
                .meanPerTheater(SeriesStats.mean(perTheater))
                .perTheaterStdDev(SeriesStats.sampleStdDev(perTheater))
                .perTheaterSlope(SeriesStats.slope(perTheaterOffsets, perTheater))
                .meanYesterdayChange(SeriesStats.mean(yesterday))
                .yesterdayChangeStdDev(SeriesStats.sampleStdDev(yesterday))
                .meanLastWeekChange(SeriesStats.mean(lastWeek))
                .lastWeekChangeStdDev(SeriesStats.sampleStdDev(lastWeek))
                .maxDailyGain(SeriesStats.max(gains))
                .maxDailyDrop(SeriesStats.min(drops))
                .opening3DayGross(opening3Day)
                .opening3DayPerTheater(opening3DayPerTheater)
                .week1MeanGross(week1Mean)
                .week2MeanGross(week2Mean)
                .week2Week1Ratio(weekRatio)
                .frontLoadingRatio(frontLoading)
                .lastCumulativeGross(lastCumulative)
                .maxDaysInRelease(values(observed, DailyRecord::getDaysInRelease).stream()
                        .max(Integer::compare).orElse(null))
                .observedDays(observed.size())
                .hasWeek2Data(week2 != null)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private NavigableMap<Integer, DailyRecord> indexByOffset(MovieIdentity movie, List<DailyRecord> records) {
        List<DailyRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(DailyRecord::getDate).thenComparing(DailyRecord::recordKey));

        NavigableMap<Integer, DailyRecord> byOffset = new TreeMap<>();
        if (sorted.isEmpty()) return byOffset;

        LocalDate anchor = movie.getReleaseDate() != null ? movie.getReleaseDate() : sorted.get(0).getDate();
        int beforeRelease = 0;
        for (DailyRecord record : sorted) {
            long offset = ChronoUnit.DAYS.between(anchor, record.getDate());
            if (offset < 0) {
                beforeRelease++;
                continue;
            }
            DailyRecord previous = byOffset.putIfAbsent((int) offset, record);
            if (previous != null) {
                log.debug("Movie {} has two records on {}; keeping {}",
                        movie.getMovieId(), record.getDate(), previous.recordKey());
            }
        }
        if (beforeRelease > 0) {
            log.debug("Movie {}: ignored {} records dated before release {}", movie.getMovieId(), beforeRelease, anchor);
        }
        return byOffset;
    }

    /** Records for every offset in [from, to], or null if any offset is missing. */
    private List<DailyRecord> completeWindow(NavigableMap<Integer, DailyRecord> byOffset, int from, int to) {
        List<DailyRecord> window = new ArrayList<>();
        for (int offset = from; offset <= to; offset++) {
            DailyRecord record = byOffset.get(offset);
            if (record == null) return null;
            window.add(record);
        }
        return window;
    }

    private Double meanIfComplete(List<DailyRecord> window, Function<DailyRecord, Integer> field) {
        List<Integer> values = values(window, field);
        return values.size() == window.size() ? SeriesStats.mean(values) : null;
    }

    private long sumGross(List<DailyRecord> window) {
        long sum = 0L;
        for (DailyRecord record : window) sum += record.getDailyGross();
        return sum;
    }

    /** Reported average, or gross over theaters when the page lacked the column. */
    private Double perTheater(DailyRecord record) {
        if (record.getPerTheaterAvg() != null) return record.getPerTheaterAvg();
        Long gross = record.getDailyGross();
        Integer theaters = record.getTheaterCount();
        if (gross == null || theaters == null || theaters <= 0) return null;
        return gross / (double) theaters;
    }

    private static <T> List<T> values(List<DailyRecord> records, Function<DailyRecord, T> field) {
        return records.stream().map(field).filter(Objects::nonNull).toList();
    }
}
