package com.pocketai.catalog.repo;

/**
 * A catalog store operation failed. Subclasses identify the conditions the
 * sync engine treats specially.
 */
public class CatalogStoreException extends RuntimeException {

    public CatalogStoreException(String message) {
        super(message);
    }

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
