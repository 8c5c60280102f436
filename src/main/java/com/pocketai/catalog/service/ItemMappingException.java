package com.pocketai.catalog.service;

/**
 * A hub descriptor cannot be turned into a valid catalog record. Skips the
 * item; never aborts a run.
 */
public class ItemMappingException extends IllegalArgumentException {

    public ItemMappingException(String message) {
        super(message);
    }
}
