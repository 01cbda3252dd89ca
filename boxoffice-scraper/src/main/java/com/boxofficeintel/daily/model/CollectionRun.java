package com.boxofficeintel.daily.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Tracks each collection run for observability.
 * Stored in the collection_runs table.
 */
@Data
@Builder
public class CollectionRun {

    private String runId;           // UUID
    private String trigger;         // startup | schedule | manual | retry-skipped
    private LocalDate rangeStart;
    private LocalDate rangeEnd;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | COLLECTED | CANCELLED | HALTED | FAILED
    private int datesStored;
    private int datesSkipped;
    private int recordsStored;
    private int moviesAggregated;
    private int unmatchedRecords;
    private String errorMessage;    // null unless HALTED / FAILED
}
