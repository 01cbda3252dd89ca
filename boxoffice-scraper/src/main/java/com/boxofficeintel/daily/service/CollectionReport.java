package com.boxofficeintel.daily.service;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one collection run.
 *
 * @param aggregation null unless the run completed and the aggregation pass ran
 */
public record CollectionReport(
        String runId,
        LocalDate rangeStart,
        LocalDate rangeEnd,
        CollectionState outcome,
        int datesSelected,
        int datesAlreadyCollected,
        int datesStored,
        int recordsStored,
        int rejectedRows,
        List<LocalDate> skippedDates,
        AggregationSummary aggregation,
        String errorMessage) {

    public CollectionReport {
        skippedDates = List.copyOf(skippedDates);
    }

    public int datesSkipped() {
        return skippedDates.size();
    }
}
