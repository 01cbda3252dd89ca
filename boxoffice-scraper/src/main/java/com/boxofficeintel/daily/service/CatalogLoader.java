package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.CatalogEntry;
import com.boxofficeintel.daily.model.MovieIdentity;
import com.boxofficeintel.daily.util.SourceUrls;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the catalog export of the metadata collectors into a CatalogSnapshot.
 *
 * Expected file: a JSON array of {"movie_id", "title", "bom_url", "release_date"}.
 * Entries without an id or title are skipped; a bad release date only loses the date.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CatalogLoader {

    private final ObjectMapper objectMapper;
    private final BoxOfficeProperties properties;

    public CatalogSnapshot load() {
        return load(Paths.get(properties.getCatalog().getPath()));
    }

    public CatalogSnapshot load(Path path) {
        if (!Files.exists(path)) {
            log.warn("Catalog file {} not found; every record will be unmatched", path);
            return CatalogSnapshot.of(List.of());
        }
        try {
            CatalogEntry[] entries = objectMapper.readValue(path.toFile(), CatalogEntry[].class);
            URI base = SourceUrls.origin(properties.getSource().getDateUrlTemplate());
            List<MovieIdentity> movies = new ArrayList<>();
            int skipped = 0;
            for (CatalogEntry entry : entries) {
                MovieIdentity movie = map(entry, base);
                if (movie == null) {
                    skipped++;
                    continue;
                }
                movies.add(movie);
            }
            log.info("Loaded catalog {}: {} movies, {} entries skipped", path, movies.size(), skipped);
            return CatalogSnapshot.of(movies);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read catalog " + path, e);
        }
    }

    /**
     * @param base origin relative catalog urls are resolved against, may be null
     */
    MovieIdentity map(CatalogEntry entry, URI base) {
        if (entry == null || isBlank(entry.getMovieId()) || isBlank(entry.getTitle())) {
            return null;
        }
        return MovieIdentity.builder()
                .movieId(entry.getMovieId().trim())
                .canonicalTitle(entry.getTitle().trim())
                .sourceUrl(SourceUrls.canonical(entry.getBomUrl(), base))
                .releaseDate(parseReleaseDate(entry.getReleaseDate()))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private LocalDate parseReleaseDate(String value) {
        if (isBlank(value)) return null;
        String date = value.trim();
        if (date.length() > 10) date = date.substring(0, 10);
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            log.warn("Could not parse catalog release date: {}", value);
            return null;
        }
    }

    private boolean isBlank(String val) {
        return val == null || val.isBlank();
    }
}
