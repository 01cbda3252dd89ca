package com.boxofficeintel.daily.service;

/**
 * Per-date states (PENDING, FETCHING, STORED, SKIPPED) and run outcomes (COLLECTED, CANCELLED, HALTED).
 */
public enum CollectionState {
    PENDING,
    FETCHING,
    STORED,
    SKIPPED,
    COLLECTED,
    CANCELLED,
    HALTED
}
