package com.boxofficeintel.daily.service;

/**
 * Ends a collection run. Everything stored before it, checkpoint included, stays valid.
 */
public abstract class FatalCollectionException extends RuntimeException {

    protected FatalCollectionException(String message) {
        super(message);
    }

    protected FatalCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
