package com.pocketai.catalog.repo;

public class RecordNotFoundException extends CatalogStoreException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
