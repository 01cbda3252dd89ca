package com.boxofficeintel.daily.model;

public enum MatchConfidence {
    EXACT, FUZZY, UNMATCHED
}
