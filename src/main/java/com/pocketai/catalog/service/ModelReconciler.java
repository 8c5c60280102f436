package com.pocketai.catalog.service;

import java.time.OffsetDateTime;

import com.pocketai.catalog.hub.HubModelDescriptor;
import com.pocketai.catalog.model.AuthorReference;
import com.pocketai.catalog.model.CatalogModel;
import com.pocketai.catalog.model.ModelCategory;
import com.pocketai.catalog.model.ModelMetadata;
import com.pocketai.catalog.model.NewModelRecord;

/**
 * Decides what a hub model means for the local catalog. Compares two
 * snapshots and describes the write; performs no I/O.
 */
public class ModelReconciler {

    static final ModelCategory SYNCED_CATEGORY = ModelCategory.UTILITY;

    private final String hubBaseUrl;

    public ModelReconciler(String hubBaseUrl) {
        this.hubBaseUrl = hubBaseUrl;
    }

    /**
     * @param descriptor the hub model
     * @param existing the record currently holding the descriptor's external
     *        id, or {@code null}
     * @param author the system author new records are attributed to
     * @param now timestamp for created/updated fields
     * @throws ItemMappingException when the descriptor cannot produce a valid
     *         record
     */
    public CatalogMutation reconcile(HubModelDescriptor descriptor, CatalogModel existing,
            AuthorReference author, OffsetDateTime now) {
        String externalId = descriptor.getExternalId() == null ? "" : descriptor.getExternalId().trim();
        if (externalId.isEmpty()) {
            throw new ItemMappingException("Hub model has no external id");
        }

        ModelMetadata metadata = new ModelMetadata(
                ModelFieldMapper.mapDescription(descriptor.getDescription(), externalId),
                ModelFieldMapper.mapTags(descriptor.getTags()),
                ModelFieldMapper.mapTask(descriptor.getTask()),
                ModelFieldMapper.mapLicense(descriptor.getLicense()),
                ModelFieldMapper.originUrl(descriptor, hubBaseUrl));

        // an existing record is always updated, even when nothing changed
        if (existing != null) {
            return CatalogMutation.update(externalId, existing.getId(), metadata, now);
        }

        String name = ModelFieldMapper.displayNameFor(descriptor);
        String slug = ModelFieldMapper.deriveSlug(name, externalId);
        NewModelRecord record = new NewModelRecord(name, slug, externalId, SYNCED_CATEGORY, metadata, author, now);
        return CatalogMutation.create(record);
    }
}
