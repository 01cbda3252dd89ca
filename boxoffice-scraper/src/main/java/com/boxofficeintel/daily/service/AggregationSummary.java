package com.boxofficeintel.daily.service;

/**
 * Counts from one matching + aggregation pass.
 */
public record AggregationSummary(
        int records,
        int exactMatches,
        int fuzzyMatches,
        int ambiguousResolved,
        int unmatched,
        int movies
) {
}
