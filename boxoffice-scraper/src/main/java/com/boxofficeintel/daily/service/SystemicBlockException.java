package com.boxofficeintel.daily.service;

import java.time.LocalDate;

/**
 * Too many dates in a row failed: the source is blocking us rather than flaking.
 */
public class SystemicBlockException extends FatalCollectionException {

    private final LocalDate failedDate;
    private final int consecutiveFailures;

    public SystemicBlockException(LocalDate failedDate, int consecutiveFailures, int threshold) {
        super("Circuit breaker open at " + failedDate + ": " + consecutiveFailures
                + " consecutive failed dates (threshold " + threshold + ")");
        this.failedDate = failedDate;
        this.consecutiveFailures = consecutiveFailures;
    }

    public LocalDate getFailedDate() {
        return failedDate;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
