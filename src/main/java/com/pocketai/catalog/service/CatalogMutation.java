package com.pocketai.catalog.service;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.pocketai.catalog.model.ModelMetadata;
import com.pocketai.catalog.model.NewModelRecord;
import com.pocketai.catalog.repo.CatalogSession;

/**
 * The write a {@link ModelReconciler} decided on for one hub model: insert a
 * new record, or overwrite the metadata of an existing one.
 */
public final class CatalogMutation {

    public enum Kind {
        CREATE,
        UPDATE
    }

    private final Kind kind;
    private final String externalId;
    private final NewModelRecord newRecord;
    private final UUID recordId;
    private final ModelMetadata metadata;
    private final OffsetDateTime at;

    private CatalogMutation(Kind kind, String externalId, NewModelRecord newRecord, UUID recordId,
            ModelMetadata metadata, OffsetDateTime at) {
        this.kind = kind;
        this.externalId = externalId;
        this.newRecord = newRecord;
        this.recordId = recordId;
        this.metadata = metadata;
        this.at = at;
    }

    public static CatalogMutation create(NewModelRecord record) {
        Objects.requireNonNull(record, "record");
        return new CatalogMutation(Kind.CREATE, record.getExternalId(), record, null,
                record.getMetadata(), record.getCreatedAt());
    }

    public static CatalogMutation update(String externalId, UUID recordId, ModelMetadata metadata, OffsetDateTime at) {
        return new CatalogMutation(Kind.UPDATE, externalId, null,
                Objects.requireNonNull(recordId, "recordId"), Objects.requireNonNull(metadata, "metadata"),
                Objects.requireNonNull(at, "at"));
    }

    /**
     * Apply this mutation inside the given session. Does not commit.
     */
    public void applyTo(CatalogSession session) {
        switch (kind) {
            case CREATE:
                session.insert(newRecord);
                break;
            case UPDATE:
                session.updateMetadata(recordId, metadata, at);
                break;
            default:
                throw new IllegalStateException("Unhandled mutation kind " + kind);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public String getExternalId() {
        return externalId;
    }

    /** Only set for {@link Kind#CREATE}. */
    public NewModelRecord getNewRecord() {
        return newRecord;
    }

    /** Only set for {@link Kind#UPDATE}. */
    public UUID getRecordId() {
        return recordId;
    }

    public ModelMetadata getMetadata() {
        return metadata;
    }

    public OffsetDateTime getAt() {
        return at;
    }
}
