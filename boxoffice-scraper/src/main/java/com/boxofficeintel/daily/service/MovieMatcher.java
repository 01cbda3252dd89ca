package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.DailyRecord;
import com.boxofficeintel.daily.model.MatchConfidence;
import com.boxofficeintel.daily.model.MatchResult;
import com.boxofficeintel.daily.model.MovieIdentity;
import com.boxofficeintel.daily.util.TitleNormalizer;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves a daily record to a catalog movie.
 *
 * Order of resolution:
 *  1. release url equal to a catalog url             → EXACT
 *  2. one title match released near the estimate     → FUZZY
 *  3. several such matches, closest release wins     → FUZZY, "ambiguous-resolved"
 *  4. nothing                                        → UNMATCHED
 *
 * The estimate is the report date minus days in release. Output depends only on the record,
 * the catalog and the configured window; there is no state, so replays give identical results.
 */
@Component
public class MovieMatcher {

    private final int releaseWindowDays;

    public MovieMatcher(BoxOfficeProperties properties) {
        this.releaseWindowDays = Math.max(0, properties.getMatching().getReleaseWindowDays());
    }

    public MatchResult match(DailyRecord record, MovieCatalog catalog) {
        String url = record.getSourceUrl();
        if (url != null && !url.isBlank()) {
            MovieIdentity exact = catalog.byUrl(url);
            if (exact != null) {
                return MatchResult.matched(record, exact, MatchConfidence.EXACT, MatchResult.METHOD_URL);
            }
        }

        List<MovieIdentity> titleMatches = catalog.listCandidates(TitleNormalizer.normalize(record.getSourceTitle()));
        if (titleMatches.isEmpty()) {
            return MatchResult.unmatched(record, MatchResult.METHOD_NO_CANDIDATE);
        }

        LocalDate estimate = record.estimatedReleaseDate();
        List<MovieIdentity> inWindow = titleMatches.stream()
                .filter(m -> m.getReleaseDate() != null)
                .filter(m -> distanceDays(m.getReleaseDate(), estimate) <= releaseWindowDays)
                .sorted(Comparator
                        .comparingLong((MovieIdentity m) -> distanceDays(m.getReleaseDate(), estimate))
                        .thenComparing(MovieIdentity::getMovieId))
                .toList();

        if (inWindow.isEmpty()) {
            return MatchResult.unmatched(record, MatchResult.METHOD_OUTSIDE_WINDOW);
        }
        String method = inWindow.size() == 1 ? MatchResult.METHOD_TITLE_WINDOW : MatchResult.METHOD_AMBIGUOUS;
        return MatchResult.matched(record, inWindow.get(0), MatchConfidence.FUZZY, method);
    }

    private static long distanceDays(LocalDate a, LocalDate b) {
        return Math.abs(ChronoUnit.DAYS.between(a, b));
    }
}
