package com.boxofficeintel.daily.service;

import java.time.LocalDate;

/**
 * Either the parsed page for a date or the error that ended its retries.
 */
public record FetchResult(LocalDate date, ParsedReport report, FetchError error) {

    public static FetchResult success(LocalDate date, ParsedReport report) {
        return new FetchResult(date, report, null);
    }

    public static FetchResult failure(FetchError error) {
        return new FetchResult(error.date(), null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
