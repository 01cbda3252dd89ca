package com.boxofficeintel.daily.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Canonical catalog entry a daily record is joined to. Read-only inside the pipeline.
 */
@Value
@Builder
public class MovieIdentity {

    String movieId;
    String canonicalTitle;

    /** Release page on the reporting source, when the catalog exporter resolved one */
    String sourceUrl;

    /** Null when the catalog has no release date; offsets then start at the first record */
    LocalDate releaseDate;
}
