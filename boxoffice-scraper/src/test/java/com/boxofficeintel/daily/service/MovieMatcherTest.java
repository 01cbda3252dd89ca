package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.DailyRecord;
import com.boxofficeintel.daily.model.MatchConfidence;
import com.boxofficeintel.daily.model.MatchResult;
import com.boxofficeintel.daily.model.MovieIdentity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MovieMatcherTest {

    private static final LocalDate JAN_5 = LocalDate.of(2025, 1, 5);

    private final MovieMatcher matcher = new MovieMatcher(new BoxOfficeProperties());

    @Test
    void exactUrlMatchWinsOverTitle() {
        MovieIdentity byUrl = movie("m-2", "Something Else", "https://www.boxofficemojo.com/release/rl1/", null);
        MovieIdentity byTitle = movie("m-1", "Nosferatu", null, LocalDate.of(2024, 12, 25));
        CatalogSnapshot catalog = CatalogSnapshot.of(List.of(byUrl, byTitle));

        MatchResult result = matcher.match(record("Nosferatu", "https://www.boxofficemojo.com/release/rl1/", 11), catalog);

        assertThat(result.confidence()).isEqualTo(MatchConfidence.EXACT);
        assertThat(result.method()).isEqualTo(MatchResult.METHOD_URL);
        assertThat(result.movieId()).isEqualTo("m-2");
    }

    @Test
    void titleWithinReleaseWindowIsFuzzyMatch() {
        CatalogSnapshot catalog = CatalogSnapshot.of(List.of(
                movie("m-1", "Nosferatu", null, LocalDate.of(2024, 12, 25))));

        // 2025-01-05 minus 11 days = 2024-12-25
        MatchResult result = matcher.match(record("NOSFERATU!", null, 11), catalog);

        assertThat(result.confidence()).isEqualTo(MatchConfidence.FUZZY);
        assertThat(result.method()).isEqualTo(MatchResult.METHOD_TITLE_WINDOW);
        assertThat(result.movieId()).isEqualTo("m-1");
    }

    @Test
    void sameTitleReleasedMonthsApartResolvesToCloserRelease() {
        CatalogSnapshot catalog = CatalogSnapshot.of(List.of(
                movie("m-june", "The Return", null, LocalDate.of(2025, 6, 10)),
                movie("m-jan", "The Return", null, LocalDate.of(2025, 1, 3))));

        // estimated release 2025-01-04
        MatchResult result = matcher.match(record("The Return", null, 1), catalog);

        assertThat(result.movieId()).isEqualTo("m-jan");
        assertThat(result.confidence()).isEqualTo(MatchConfidence.FUZZY);
    }

    @Test
    void severalCandidatesInWindowAreResolvedByClosestRelease() {
        BoxOfficeProperties properties = new BoxOfficeProperties();
        properties.getMatching().setReleaseWindowDays(200);
        MovieMatcher wide = new MovieMatcher(properties);
        CatalogSnapshot catalog = CatalogSnapshot.of(List.of(
                movie("m-june", "The Return", null, LocalDate.of(2025, 6, 10)),
                movie("m-jan", "The Return", null, LocalDate.of(2025, 1, 3))));

        MatchResult result = wide.match(record("The Return", null, 1), catalog);

        assertThat(result.movieId()).isEqualTo("m-jan");
        assertThat(result.method()).isEqualTo(MatchResult.METHOD_AMBIGUOUS);
    }

    @Test
    void equalDistanceIsBrokenByLowestMovieId() {
        CatalogSnapshot catalog = CatalogSnapshot.of(List.of(
                movie("m-b", "Twin", null, LocalDate.of(2025, 1, 6)),
                movie("m-a", "Twin", null, LocalDate.of(2025, 1, 2))));

        MatchResult result = matcher.match(record("Twin", null, 1), catalog);

        assertThat(result.movieId()).isEqualTo("m-a");
        assertThat(result.method()).isEqualTo(MatchResult.METHOD_AMBIGUOUS);
    }

    @Test
    void titleOutsideWindowIsUnmatched() {
        CatalogSnapshot catalog = CatalogSnapshot.of(List.of(
                movie("m-1", "Nosferatu", null, LocalDate.of(1922, 3, 4)),
                movie("m-2", "Nosferatu", null, null)));

        MatchResult result = matcher.match(record("Nosferatu", null, 11), catalog);

        assertThat(result.isMatched()).isFalse();
        assertThat(result.movie()).isNull();
        assertThat(result.method()).isEqualTo(MatchResult.METHOD_OUTSIDE_WINDOW);
    }

    @Test
    void unknownTitleIsUnmatched() {
        MatchResult result = matcher.match(record("Unknown Film", "https://x/release/rl9/", 3),
                CatalogSnapshot.of(List.of()));

        assertThat(result.confidence()).isEqualTo(MatchConfidence.UNMATCHED);
        assertThat(result.method()).isEqualTo(MatchResult.METHOD_NO_CANDIDATE);
        assertThat(result.recordKey()).isEqualTo("https://x/release/rl9/");
    }

    @Test
    void missingDaysInReleaseUsesReportDateAsEstimate() {
        CatalogSnapshot catalog = CatalogSnapshot.of(List.of(
                movie("m-1", "Late Entry", null, LocalDate.of(2024, 12, 28))));

        MatchResult result = matcher.match(record("Late Entry", null, null), catalog);

        assertThat(result.movieId()).isEqualTo("m-1");
    }

    @Test
    void resultDoesNotDependOnCatalogOrder() {
        List<MovieIdentity> movies = new ArrayList<>(List.of(
                movie("m-3", "Twin", null, LocalDate.of(2025, 1, 6)),
                movie("m-1", "Twin", null, LocalDate.of(2025, 1, 2)),
                movie("m-2", "Twin", null, LocalDate.of(2025, 1, 8))));
        DailyRecord record = record("Twin", null, 1);

        MatchResult first = matcher.match(record, CatalogSnapshot.of(movies));
        Collections.reverse(movies);
        MatchResult second = matcher.match(record, CatalogSnapshot.of(movies));

        assertThat(second).isEqualTo(first);
    }

    private static DailyRecord record(String title, String url, Integer daysInRelease) {
        return DailyRecord.builder()
                .date(JAN_5)
                .sourceTitle(title)
                .sourceUrl(url)
                .dailyGross(1_000_000L)
                .daysInRelease(daysInRelease)
                .build();
    }

    private static MovieIdentity movie(String id, String title, String url, LocalDate releaseDate) {
        return MovieIdentity.builder()
                .movieId(id)
                .canonicalTitle(title)
                .sourceUrl(url)
                .releaseDate(releaseDate)
                .build();
    }
}
