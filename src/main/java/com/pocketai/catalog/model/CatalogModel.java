package com.pocketai.catalog.model;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A model listed in the local catalog. Records synced from the hub carry a
 * non-null {@code hfModelId}; manually published ones do not.
 */
@Entity
@Table(name = "ml_models")
public class CatalogModel {
    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String slug;

    @Column(name = "description")
    private String description;

    @Convert(converter = ModelCategoryConverter.class)
    @Column(nullable = false, length = 32)
    private ModelCategory category;

    @Convert(converter = LicenseKindConverter.class)
    @Column(name = "license_type", nullable = false, length = 64)
    private LicenseKind licenseKind;

    private String task;

    @Column(name = "origin_repo_url", length = 1024)
    private String originRepoUrl;

    @Column(name = "hf_model_id", unique = true)
    private String hfModelId;

    @Column(name = "is_verified_official", nullable = false)
    private boolean verifiedOfficial;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false, updatable = false)
    private UserAccount author;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ml_model_tags", joinColumns = @JoinColumn(name = "model_id"))
    @Column(name = "tag", nullable = false)
    private Set<String> tags = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (category == null) category = ModelCategory.UTILITY;
        if (licenseKind == null) licenseKind = LicenseKind.UNKNOWN;
        if (createdAt == null) createdAt = OffsetDateTime.now();
        if (updatedAt == null) updatedAt = createdAt;
    }

    /**
     * Overwrite the hub-owned metadata fields. Identity, slug, author, category
     * and creation time are never touched here.
     */
    public void applyMetadata(ModelMetadata metadata, OffsetDateTime at) {
        this.description = metadata.getDescription();
        this.tags.clear();
        this.tags.addAll(metadata.getTags());
        this.task = metadata.getTask();
        this.licenseKind = metadata.getLicenseKind();
        this.originRepoUrl = metadata.getOriginUrl();
        this.updatedAt = at;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String n) { this.name = n; }
    public String getSlug() { return slug; }
    public void setSlug(String s) { this.slug = s; }
    public String getDescription() { return description; }
    public void setDescription(String d) { this.description = d; }
    public ModelCategory getCategory() { return category; }
    public void setCategory(ModelCategory c) { this.category = c; }
    public LicenseKind getLicenseKind() { return licenseKind; }
    public void setLicenseKind(LicenseKind l) { this.licenseKind = l; }
    public String getTask() { return task; }
    public void setTask(String t) { this.task = t; }
    public String getOriginRepoUrl() { return originRepoUrl; }
    public void setOriginRepoUrl(String u) { this.originRepoUrl = u; }
    public String getHfModelId() { return hfModelId; }
    public void setHfModelId(String h) { this.hfModelId = h; }
    public boolean isVerifiedOfficial() { return verifiedOfficial; }
    public void setVerifiedOfficial(boolean v) { this.verifiedOfficial = v; }
    public UserAccount getAuthor() { return author; }
    public void setAuthor(UserAccount a) { this.author = a; }
    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> t) { this.tags = t == null ? new LinkedHashSet<>() : new LinkedHashSet<>(t); }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime t) { this.createdAt = t; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime t) { this.updatedAt = t; }
}
