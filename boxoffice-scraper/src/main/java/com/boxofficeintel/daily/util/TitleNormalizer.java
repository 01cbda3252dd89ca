package com.boxofficeintel.daily.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Title folding shared by record keys and the matcher.
 *
 * "Spider-Man: Across the Spider-Verse" → "spidermanacrossthespiderverse"
 */
public final class TitleNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TitleNormalizer() {
    }

    public static String normalize(String title) {
        if (title == null) return "";
        String decomposed = Normalizer.normalize(title, Normalizer.Form.NFKD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        return NON_ALPHANUMERIC.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
