package com.pocketai.catalog.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Everything needed to insert a synced {@link CatalogModel}. The internal id
 * is assigned by the store.
 */
public final class NewModelRecord {

    private final String name;
    private final String slug;
    private final String externalId;
    private final ModelCategory category;
    private final ModelMetadata metadata;
    private final AuthorReference author;
    private final OffsetDateTime createdAt;

    public NewModelRecord(String name, String slug, String externalId, ModelCategory category,
            ModelMetadata metadata, AuthorReference author, OffsetDateTime createdAt) {
        this.name = Objects.requireNonNull(name, "name");
        this.slug = Objects.requireNonNull(slug, "slug");
        this.externalId = Objects.requireNonNull(externalId, "externalId");
        this.category = Objects.requireNonNull(category, "category");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.author = Objects.requireNonNull(author, "author");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String getName() {
        return name;
    }

    public String getSlug() {
        return slug;
    }

    public String getExternalId() {
        return externalId;
    }

    public ModelCategory getCategory() {
        return category;
    }

    public ModelMetadata getMetadata() {
        return metadata;
    }

    public AuthorReference getAuthor() {
        return author;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
