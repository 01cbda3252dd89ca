package com.boxofficeintel.daily.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonical form of release links, shared by the page parser and the catalog loader so that
 * both sides of a url match compare equal.
 *
 * "/release/rl123/?ref_=bo_da_table_1" against "https://www.boxofficemojo.com/"
 *   → "https://www.boxofficemojo.com/release/rl123/"
 */
public final class SourceUrls {

    private SourceUrls() {
    }

    /**
     * Resolves url against base (when it is relative and a base is given), lower-cases scheme
     * and host, and drops query string and fragment. A url that is not a valid URI comes back
     * trimmed and cut at the first '?' or '#'.
     *
     * @param base absolute base, may be null
     * @return null for a blank url
     */
    public static String canonical(String url, URI base) {
        if (url == null || url.isBlank()) return null;
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (!uri.isAbsolute() && base != null) {
                uri = base.resolve(uri);
            }
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getPath();
            if (!uri.isAbsolute()) {
                return new URI(null, null, path, null, null).toString();
            }
            return new URI(lower(uri.getScheme()), lower(uri.getAuthority()), path, null, null).toString();
        } catch (URISyntaxException e) {
            return cutQuery(trimmed);
        }
    }

    /**
     * Scheme and authority of a url template such as "https://host/date/{date}/", or null when
     * the template is not a usable absolute url.
     */
    public static URI origin(String template) {
        if (template == null || template.isBlank()) return null;
        try {
            URI uri = new URI(template.trim().replace("{date}", "date"));
            if (!uri.isAbsolute() || uri.getAuthority() == null) return null;
            return new URI(lower(uri.getScheme()), lower(uri.getAuthority()), "/", null, null);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String cutQuery(String url) {
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) cut = Math.min(cut, query);
        if (fragment >= 0) cut = Math.min(cut, fragment);
        return url.substring(0, cut);
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
