package com.pocketai.catalog.repo;

/**
 * Creating a user failed because its username or email is already taken.
 */
public class PrincipalConflictException extends CatalogStoreException {

    public PrincipalConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
