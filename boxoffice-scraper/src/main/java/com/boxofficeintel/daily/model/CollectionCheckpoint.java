package com.boxofficeintel.daily.model;

import java.time.LocalDate;

/**
 * Collection progress, read once at the start of a run and written after every finished date.
 * It is a resume cursor and failure counter only: whether a date still needs fetching is decided
 * by that date's own status in the store, so earlier ranges can be backfilled.
 *
 * @param lastCompletedDate        latest date that was stored or explicitly skipped, null before the first
 * @param consecutiveFailureCount  dates in a row that ended in a fetch error
 */
public record CollectionCheckpoint(LocalDate lastCompletedDate, int consecutiveFailureCount) {

    public static CollectionCheckpoint initial() {
        return new CollectionCheckpoint(null, 0);
    }

    public CollectionCheckpoint afterSuccess(LocalDate date) {
        return new CollectionCheckpoint(later(date), 0);
    }

    public CollectionCheckpoint afterSkip(LocalDate date) {
        return new CollectionCheckpoint(later(date), consecutiveFailureCount + 1);
    }

    private LocalDate later(LocalDate date) {
        if (lastCompletedDate == null || date.isAfter(lastCompletedDate)) return date;
        return lastCompletedDate;
    }
}
