package com.pocketai.catalog.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Lightweight handle on a {@link UserAccount}, usable as the author of a
 * catalog record without carrying a managed entity across transactions.
 */
public final class AuthorReference {

    private final UUID id;
    private final String username;

    public AuthorReference(UUID id, String username) {
        this.id = Objects.requireNonNull(id, "id");
        this.username = username;
    }

    public static AuthorReference of(UserAccount account) {
        return new AuthorReference(account.getId(), account.getUsername());
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuthorReference other)) {
            return false;
        }
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return username + "(" + id + ")";
    }
}
