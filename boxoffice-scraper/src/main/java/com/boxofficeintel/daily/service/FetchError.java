package com.boxofficeintel.daily.service;

import java.time.LocalDate;

/**
 * A date whose page could not be retrieved after all attempts. Not fatal to the run.
 */
public record FetchError(LocalDate date, int attempts, String reason) {
}
