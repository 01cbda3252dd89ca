package com.boxofficeintel.daily.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching one element of the catalog export written by the TMDB collector.
 * Kept separate from MovieIdentity to isolate the exporter's field names.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogEntry {

    @JsonProperty("movie_id")
    private String movieId;

    private String title;

    @JsonProperty("bom_url")
    private String bomUrl;

    /** ISO date, sometimes with a time part or blank */
    @JsonProperty("release_date")
    private String releaseDate;
}
