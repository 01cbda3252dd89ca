package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.model.MovieIdentity;
import com.boxofficeintel.daily.util.TitleNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory catalog taken at the start of an aggregation pass.
 *
 * Candidate lists are sorted by movie id so callers see the same order no matter how the
 * export file was ordered.
 */
@Slf4j
public final class CatalogSnapshot implements MovieCatalog {

    private final Map<String, List<MovieIdentity>> byTitle;
    private final Map<String, MovieIdentity> byUrl;
    private final int size;

    private CatalogSnapshot(Map<String, List<MovieIdentity>> byTitle, Map<String, MovieIdentity> byUrl, int size) {
        this.byTitle = byTitle;
        this.byUrl = byUrl;
        this.size = size;
    }

    public static CatalogSnapshot of(Collection<MovieIdentity> movies) {
        List<MovieIdentity> sorted = new ArrayList<>(movies);
        sorted.sort(Comparator.comparing(MovieIdentity::getMovieId));

        Map<String, List<MovieIdentity>> byTitle = new HashMap<>();
        Map<String, MovieIdentity> byUrl = new HashMap<>();
        for (MovieIdentity movie : sorted) {
            byTitle.computeIfAbsent(TitleNormalizer.normalize(movie.getCanonicalTitle()), k -> new ArrayList<>())
                    .add(movie);
            if (movie.getSourceUrl() != null && !movie.getSourceUrl().isBlank()) {
                MovieIdentity previous = byUrl.putIfAbsent(movie.getSourceUrl(), movie);
                if (previous != null) {
                    log.warn("Catalog url {} claimed by {} and {}; keeping {}",
                            movie.getSourceUrl(), previous.getMovieId(), movie.getMovieId(), previous.getMovieId());
                }
            }
        }
        byTitle.replaceAll((k, v) -> List.copyOf(v));
        return new CatalogSnapshot(Map.copyOf(byTitle), Map.copyOf(byUrl), sorted.size());
    }

    @Override
    public List<MovieIdentity> listCandidates(String normalizedTitle) {
        return byTitle.getOrDefault(normalizedTitle, List.of());
    }

    @Override
    public MovieIdentity byUrl(String url) {
        return url == null ? null : byUrl.get(url);
    }

    public int size() {
        return size;
    }
}
