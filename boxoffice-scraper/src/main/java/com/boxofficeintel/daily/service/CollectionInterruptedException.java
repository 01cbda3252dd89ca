package com.boxofficeintel.daily.service;

/**
 * The collecting thread was interrupted, usually by shutdown. The date in flight is not recorded.
 */
public class CollectionInterruptedException extends FatalCollectionException {

    public CollectionInterruptedException(String message) {
        super(message);
    }

    public CollectionInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
