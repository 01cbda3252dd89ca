package com.boxofficeintel.daily.model;

import java.time.LocalDate;

/**
 * Outcome of resolving one daily record against a catalog snapshot.
 * Recomputed on every aggregation pass, never stored.
 */
public record MatchResult(
        LocalDate recordDate,
        String recordKey,
        MovieIdentity movie,
        MatchConfidence confidence,
        String method
) {

    public static final String METHOD_URL = "url";
    public static final String METHOD_TITLE_WINDOW = "title-window";
    public static final String METHOD_AMBIGUOUS = "ambiguous-resolved";
    public static final String METHOD_NO_CANDIDATE = "no-candidate";
    public static final String METHOD_OUTSIDE_WINDOW = "title-outside-window";

    public static MatchResult unmatched(DailyRecord record, String method) {
        return new MatchResult(record.getDate(), record.recordKey(), null, MatchConfidence.UNMATCHED, method);
    }

    public static MatchResult matched(DailyRecord record, MovieIdentity movie,
                                      MatchConfidence confidence, String method) {
        return new MatchResult(record.getDate(), record.recordKey(), movie, confidence, method);
    }

    public String movieId() {
        return movie == null ? null : movie.getMovieId();
    }

    public boolean isMatched() {
        return confidence != MatchConfidence.UNMATCHED;
    }
}
