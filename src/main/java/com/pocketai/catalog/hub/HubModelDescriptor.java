package com.pocketai.catalog.hub;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One model as listed by the hub, already typed and defaulted by
 * {@link HubModelParser}. Never persisted as-is.
 */
public final class HubModelDescriptor {

    private final String externalId;
    private final String displayName;
    private final String description;
    private final List<String> tags;
    private final String task;
    private final String license;
    private final String url;
    private final String sha;
    private final boolean privateModel;

    private HubModelDescriptor(Builder b) {
        this.externalId = Objects.requireNonNull(b.externalId, "externalId");
        this.displayName = b.displayName == null ? "" : b.displayName;
        this.description = b.description == null ? "" : b.description;
        this.tags = b.tags == null ? Collections.emptyList() : List.copyOf(b.tags);
        this.task = b.task;
        this.license = b.license == null ? "unknown" : b.license;
        this.url = b.url;
        this.sha = b.sha;
        this.privateModel = b.privateModel;
    }

    public static Builder builder(String externalId) {
        return new Builder(externalId);
    }

    public String getExternalId() {
        return externalId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    public String getTask() {
        return task;
    }

    public String getLicense() {
        return license;
    }

    public String getUrl() {
        return url;
    }

    public String getSha() {
        return sha;
    }

    public boolean isPrivateModel() {
        return privateModel;
    }

    @Override
    public String toString() {
        return "HubModelDescriptor{" + externalId + ", license=" + license + ", task=" + task + "}";
    }

    public static final class Builder {
        private final String externalId;
        private String displayName;
        private String description;
        private List<String> tags;
        private String task;
        private String license;
        private String url;
        private String sha;
        private boolean privateModel;

        private Builder(String externalId) {
            this.externalId = externalId;
        }

        public Builder displayName(String v) { this.displayName = v; return this; }
        public Builder description(String v) { this.description = v; return this; }
        public Builder tags(List<String> v) { this.tags = v; return this; }
        public Builder task(String v) { this.task = v; return this; }
        public Builder license(String v) { this.license = v; return this; }
        public Builder url(String v) { this.url = v; return this; }
        public Builder sha(String v) { this.sha = v; return this; }
        public Builder privateModel(boolean v) { this.privateModel = v; return this; }

        public HubModelDescriptor build() {
            return new HubModelDescriptor(this);
        }
    }
}
