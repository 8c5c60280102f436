package com.pocketai.catalog.repo;

import java.util.Optional;

import com.pocketai.catalog.model.AuthorReference;
import com.pocketai.catalog.model.UserAccount;

/**
 * Persistence operations used by the sync engine. Record writes go through a
 * {@link CatalogSession}, one per synced item; principal operations run in
 * their own transactions.
 */
public interface CatalogStore {

    /**
     * Open a session with an active transaction.
     */
    CatalogSession openSession();

    Optional<AuthorReference> findPrincipalByName(String username);

    /**
     * Persist a new user and commit.
     *
     * @throws PrincipalConflictException when the username or email is taken
     */
    AuthorReference createPrincipal(UserAccount principal);
}
