package com.boxofficeintel.daily.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TitleNormalizerTest {

    @Test
    void foldsCasePunctuationAndDiacritics() {
        assertThat(TitleNormalizer.normalize("Pokémon: Detective Pikachu")).isEqualTo("pokemondetectivepikachu");
        assertThat(TitleNormalizer.normalize("Mission: Impossible – Dead Reckoning"))
                .isEqualTo(TitleNormalizer.normalize("mission impossible dead reckoning"));
    }

    @Test
    void keepsDigitsSoSequelsStayDistinct() {
        assertThat(TitleNormalizer.normalize("Sonic the Hedgehog 3"))
                .isNotEqualTo(TitleNormalizer.normalize("Sonic the Hedgehog 2"));
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(TitleNormalizer.normalize(null)).isEmpty();
    }
}
