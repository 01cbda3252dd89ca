package com.boxofficeintel.daily.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class SourceUrlsTest {

    private static final URI BASE = URI.create("https://www.boxofficemojo.com/");
    private static final String RELEASE = "https://www.boxofficemojo.com/release/rl1111/";

    @Test
    void dropsQueryAndFragment() {
        assertThat(SourceUrls.canonical(RELEASE + "?ref_=bo_da_table_1#top", null)).isEqualTo(RELEASE);
    }

    @Test
    void resolvesRelativeLinksAgainstBase() {
        assertThat(SourceUrls.canonical("/release/rl1111/?ref_=x", BASE)).isEqualTo(RELEASE);
        assertThat(SourceUrls.canonical("release/rl1111/", BASE)).isEqualTo(RELEASE);
    }

    @Test
    void lowerCasesSchemeAndHostOnly() {
        assertThat(SourceUrls.canonical("  HTTPS://WWW.BoxOfficeMojo.com/release/rl1111/ ", null)).isEqualTo(RELEASE);
        assertThat(SourceUrls.canonical("https://www.boxofficemojo.com/release/RL1111/", null))
                .isEqualTo("https://www.boxofficemojo.com/release/RL1111/");
    }

    @Test
    void relativeLinkWithoutBaseKeepsItsPath() {
        assertThat(SourceUrls.canonical("/release/rl1111/?ref_=x", null)).isEqualTo("/release/rl1111/");
    }

    @Test
    void invalidUrlIsOnlyCutAtQuery() {
        assertThat(SourceUrls.canonical("https://host/a b|c?x=1", null)).isEqualTo("https://host/a b|c");
    }

    @Test
    void blankUrlIsNull() {
        assertThat(SourceUrls.canonical(null, BASE)).isNull();
        assertThat(SourceUrls.canonical("  ", BASE)).isNull();
    }

    @Test
    void originOfDateTemplate() {
        assertThat(SourceUrls.origin("https://www.boxofficemojo.com/date/{date}/")).isEqualTo(BASE);
        assertThat(SourceUrls.origin("not a url")).isNull();
        assertThat(SourceUrls.origin(null)).isNull();
    }
}
