package com.pocketai.catalog.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The hub-owned, mutable part of a {@link CatalogModel}: everything a sync run
 * is allowed to overwrite on an existing record.
 */
public final class ModelMetadata {

    private final String description;
    private final Set<String> tags;
    private final String task;
    private final LicenseKind licenseKind;
    private final String originUrl;

    public ModelMetadata(String description, Set<String> tags, String task, LicenseKind licenseKind, String originUrl) {
        this.description = description;
        this.tags = tags == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.task = task;
        this.licenseKind = Objects.requireNonNull(licenseKind, "licenseKind");
        this.originUrl = originUrl;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getTags() {
        return tags;
    }

    public String getTask() {
        return task;
    }

    public LicenseKind getLicenseKind() {
        return licenseKind;
    }

    public String getOriginUrl() {
        return originUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModelMetadata other)) {
            return false;
        }
        return Objects.equals(description, other.description)
                && tags.equals(other.tags)
                && Objects.equals(task, other.task)
                && licenseKind == other.licenseKind
                && Objects.equals(originUrl, other.originUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, tags, task, licenseKind, originUrl);
    }

    @Override
    public String toString() {
        return "ModelMetadata{license=" + licenseKind + ", task=" + task + ", tags=" + tags + "}";
    }
}
