package com.boxofficeintel.daily.service;

/**
 * The stored checkpoint cannot be trusted. Set boxoffice.collection.resume-from to restart
 * from an explicit date.
 */
public class CheckpointCorruptionException extends FatalCollectionException {

    public CheckpointCorruptionException(String message) {
        super(message);
    }

    public CheckpointCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
