package com.boxofficeintel.daily.service;

/**
 * A single attempt failed in a way that may succeed on retry: I/O error, non-2xx status,
 * or a page without the expected result table.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
