package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.config.BoxOfficeProperties;
import com.boxofficeintel.daily.model.MovieIdentity;
import com.boxofficeintel.daily.util.TitleNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogLoaderTest {

    @TempDir
    Path tempDir;

    private final CatalogLoader loader = new CatalogLoader(new ObjectMapper(), new BoxOfficeProperties());

    @Test
    void loadsExportAndSkipsEntriesWithoutIdOrTitle() throws Exception {
        CatalogSnapshot catalog = loader.load(fixture());

        assertThat(catalog.size()).isEqualTo(4);

        MovieIdentity nosferatu = catalog.byUrl("https://www.boxofficemojo.com/release/rl1111/");
        assertThat(nosferatu).isNotNull();
        assertThat(nosferatu.getMovieId()).isEqualTo("tmdb-426063");
        assertThat(nosferatu.getReleaseDate()).isEqualTo(LocalDate.of(2024, 12, 25));
    }

    @Test
    void releaseDateWithTimePartIsTruncatedAndBadDateIsDropped() throws Exception {
        CatalogSnapshot catalog = loader.load(fixture());

        assertThat(catalog.listCandidates(TitleNormalizer.normalize("Wicked")))
                .singleElement()
                .satisfies(m -> assertThat(m.getReleaseDate()).isEqualTo(LocalDate.of(2024, 11, 22)));
        assertThat(catalog.listCandidates(TitleNormalizer.normalize("Undated Feature")))
                .singleElement()
                .satisfies(m -> assertThat(m.getReleaseDate()).isNull());
    }

    @Test
    void catalogUrlsTakeTheParsersCanonicalForm() throws Exception {
        Path export = tempDir.resolve("relative.json");
        Files.writeString(export, """
                [
                  {"movie_id": "tmdb-1", "title": "Relative", "bom_url": "/release/rl5555/?ref_=catalog"},
                  {"movie_id": "tmdb-2", "title": "Shouting", "bom_url": "HTTPS://WWW.BOXOFFICEMOJO.COM/release/rl6666/#cast"}
                ]
                """);

        CatalogSnapshot catalog = loader.load(export);

        assertThat(catalog.byUrl("https://www.boxofficemojo.com/release/rl5555/"))
                .extracting(MovieIdentity::getMovieId).isEqualTo("tmdb-1");
        assertThat(catalog.byUrl("https://www.boxofficemojo.com/release/rl6666/"))
                .extracting(MovieIdentity::getMovieId).isEqualTo("tmdb-2");
    }

    @Test
    void missingFileGivesEmptyCatalog() {
        CatalogSnapshot catalog = loader.load(tempDir.resolve("absent.json"));

        assertThat(catalog.size()).isZero();
        assertThat(catalog.listCandidates("anything")).isEmpty();
    }

    @Test
    void unreadableFileFails() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");

        assertThatThrownBy(() -> loader.load(broken)).isInstanceOf(UncheckedIOException.class);
    }

    private static Path fixture() throws URISyntaxException {
        return Paths.get(CatalogLoaderTest.class.getResource("/fixtures/catalog.json").toURI());
    }
}
