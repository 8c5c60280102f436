package com.pocketai.catalog.repo;

/**
 * A write was rejected by a uniqueness or other integrity constraint.
 */
public class DuplicateRecordException extends CatalogStoreException {

    public DuplicateRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
