package com.pocketai.catalog.service;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pocketai.catalog.model.AuthorReference;
import com.pocketai.catalog.model.UserAccount;
import com.pocketai.catalog.repo.CatalogStore;
import com.pocketai.catalog.repo.CatalogStoreException;
import com.pocketai.catalog.repo.PrincipalConflictException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Get-or-create of the reserved user every synced model is attributed to.
 */
@ApplicationScoped
public class SystemAuthorResolver {

    private static final Logger log = LoggerFactory.getLogger(SystemAuthorResolver.class);

    public static final String SYSTEM_USERNAME = "hf_sync_system";
    public static final String SYSTEM_EMAIL = "system@pocket-ai.local";

    private CatalogStore store;

    protected SystemAuthorResolver() {
    }

    @Inject
    public SystemAuthorResolver(CatalogStore store) {
        this.store = store;
    }

    /**
     * Look up the system user, creating it on first use. A concurrent run
     * creating it first is not an error: the conflict is answered by reading
     * the winner's row.
     *
     * @throws AttributionException when the user can neither be found nor
     *         created
     */
    public AuthorReference resolveSystemAuthor() {
        try {
            Optional<AuthorReference> existing = store.findPrincipalByName(SYSTEM_USERNAME);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                AuthorReference created = store.createPrincipal(newSystemUser());
                log.info("Created system user: {}", created.getId());
                return created;
            } catch (PrincipalConflictException e) {
                log.info("System user was created concurrently; re-reading it");
                return store.findPrincipalByName(SYSTEM_USERNAME)
                        .orElseThrow(() -> new AttributionException(
                                "Reserved identity for '" + SYSTEM_USERNAME + "' is held by conflicting data", e));
            }
        } catch (CatalogStoreException e) {
            throw new AttributionException("Unable to resolve system user: " + e.getMessage(), e);
        }
    }

    private static UserAccount newSystemUser() {
        UserAccount user = new UserAccount();
        user.setUsername(SYSTEM_USERNAME);
        user.setEmail(SYSTEM_EMAIL);
        user.setDeveloper(true);
        user.setHfUsername(null);
        return user;
    }
}
