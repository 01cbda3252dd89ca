package com.boxofficeintel.daily.service;

/**
 * The page as a whole was unusable, e.g. the result table was missing.
 */
public class ReportParseException extends Exception {

    public ReportParseException(String message) {
        super(message);
    }
}
