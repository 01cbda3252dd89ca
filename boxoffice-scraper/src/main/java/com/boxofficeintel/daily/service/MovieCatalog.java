package com.boxofficeintel.daily.service;

import com.boxofficeintel.daily.model.MovieIdentity;

import java.util.List;

/**
 * Read-only view of the movie catalog maintained by the metadata collectors.
 */
public interface MovieCatalog {

    /**
     * @param normalizedTitle title folded with TitleNormalizer
     * @return entries whose folded title equals the argument, possibly empty, never null
     */
    List<MovieIdentity> listCandidates(String normalizedTitle);

    /**
     * @return the entry whose source url equals the argument, or null
     */
    MovieIdentity byUrl(String url);
}
