package com.pocketai.catalog.service;

/**
 * The system author could not be resolved. Aborts a sync run before any
 * record is written.
 */
public class AttributionException extends IllegalStateException {

    public AttributionException(String message) {
        super(message);
    }

    public AttributionException(String message, Throwable cause) {
        super(message, cause);
    }
}
