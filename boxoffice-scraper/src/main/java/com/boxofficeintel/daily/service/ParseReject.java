package com.boxofficeintel.daily.service;

import java.time.LocalDate;

/**
 * A table row dropped by the parser.
 *
 * @param rowIndex zero-based index among the data rows of the table
 * @param title    whatever title text the row carried, possibly blank
 */
public record ParseReject(LocalDate date, int rowIndex, String title, Reason reason) {

    public enum Reason {
        MISSING_TITLE, MISSING_GROSS
    }
}
