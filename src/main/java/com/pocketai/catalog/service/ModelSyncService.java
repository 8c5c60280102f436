package com.pocketai.catalog.service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pocketai.catalog.config.SyncSettings;
import com.pocketai.catalog.hub.CatalogUnavailableException;
import com.pocketai.catalog.hub.HubCatalogClient;
import com.pocketai.catalog.hub.HubModelDescriptor;
import com.pocketai.catalog.model.AuthorReference;
import com.pocketai.catalog.model.CatalogModel;
import com.pocketai.catalog.repo.CatalogSession;
import com.pocketai.catalog.repo.CatalogStore;
import com.pocketai.catalog.repo.DuplicateRecordException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Syncs hub models into the local catalog. One call to {@link #runSync} is one
 * run: fetch the listing, resolve the system author, then create or update
 * each model in its own transaction. A failing model is rolled back and
 * counted as skipped; it never aborts the run.
 */
@ApplicationScoped
public class ModelSyncService {

    private static final Logger log = LoggerFactory.getLogger(ModelSyncService.class);

    private HubCatalogClient catalogClient;
    private CatalogStore store;
    private SystemAuthorResolver authorResolver;
    private SyncSettings settings;
    private ModelReconciler reconciler;
    private Clock clock;

    protected ModelSyncService() {
    }

    @Inject
    public ModelSyncService(HubCatalogClient catalogClient, CatalogStore store,
            SystemAuthorResolver authorResolver, SyncSettings settings) {
        this(catalogClient, store, authorResolver, settings, Clock.systemUTC());
    }

    public ModelSyncService(HubCatalogClient catalogClient, CatalogStore store,
            SystemAuthorResolver authorResolver, SyncSettings settings, Clock clock) {
        this.catalogClient = catalogClient;
        this.store = store;
        this.authorResolver = authorResolver;
        this.settings = settings;
        this.reconciler = new ModelReconciler(settings.getHubBaseUrl());
        this.clock = clock;
    }

    /**
     * Run with the configured filter and fetch limit.
     */
    public SyncRunSummary runSync() throws CatalogUnavailableException {
        return runSync(settings.getFilterLabel(), settings.getFetchLimit());
    }

    /**
     * @throws CatalogUnavailableException when the hub listing cannot be
     *         fetched; nothing has been written
     * @throws AttributionException when the system author cannot be resolved;
     *         no record has been written
     */
    public SyncRunSummary runSync(String filterLabel, int limit) throws CatalogUnavailableException {
        if (filterLabel == null || filterLabel.isBlank()) {
            throw new IllegalArgumentException("filterLabel is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }

        SyncRunSummary.Tally tally = new SyncRunSummary.Tally(filterLabel, limit, clock.instant());
        log.info("Starting model hub sync (filter='{}', limit={})", filterLabel, limit);

        List<HubModelDescriptor> descriptors;
        try {
            descriptors = catalogClient.listItems(filterLabel, limit);
        } catch (CatalogUnavailableException e) {
            log.error("Model hub sync aborted, listing unavailable ({}): {}", e.getReason(), e.getMessage());
            throw e;
        }
        if (descriptors.size() > limit) {
            descriptors = descriptors.subList(0, limit);
        }
        tally.fetched(descriptors.size());

        AuthorReference author;
        try {
            author = authorResolver.resolveSystemAuthor();
        } catch (AttributionException e) {
            log.error("Model hub sync aborted, no system author: {}", e.getMessage());
            throw e;
        }

        for (HubModelDescriptor descriptor : descriptors) {
            syncOne(descriptor, author, tally);
        }

        SyncRunSummary summary = tally.finish(clock.instant());
        log.info("Model hub sync completed - {} in {} ms", summary, summary.getDuration().toMillis());
        return summary;
    }

    private void syncOne(HubModelDescriptor descriptor, AuthorReference author, SyncRunSummary.Tally tally) {
        String externalId = descriptor.getExternalId();
        try (CatalogSession session = store.openSession()) {
            try {
                Optional<CatalogModel> existing = session.findByExternalId(externalId);
                CatalogMutation mutation = reconciler.reconcile(descriptor, existing.orElse(null), author, now());
                mutation.applyTo(session);
                session.commit();
                if (mutation.getKind() == CatalogMutation.Kind.CREATE) {
                    tally.created();
                    log.debug("Created model: {}", externalId);
                } else {
                    tally.updated();
                    log.debug("Updated model: {}", externalId);
                }
            } catch (RuntimeException e) {
                try {
                    session.rollback();
                } catch (RuntimeException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
        } catch (ItemMappingException e) {
            skip(tally, externalId, SkippedItem.Cause.MAPPING, e);
        } catch (DuplicateRecordException e) {
            skip(tally, externalId, SkippedItem.Cause.CONFLICT, e);
        } catch (RuntimeException e) {
            skip(tally, externalId, SkippedItem.Cause.STORE, e);
        }
    }

    private void skip(SyncRunSummary.Tally tally, String externalId, SkippedItem.Cause cause, RuntimeException e) {
        String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        tally.skipped(new SkippedItem(externalId, cause, reason));
        if (cause == SkippedItem.Cause.STORE) {
            log.warn("Skipped model {} ({}): {}", externalId, cause, reason, e);
        } else {
            log.warn("Skipped model {} ({}): {}", externalId, cause, reason);
        }
    }

    private OffsetDateTime now() {
        Instant instant = clock.instant();
        return instant.atOffset(ZoneOffset.UTC);
    }
}
