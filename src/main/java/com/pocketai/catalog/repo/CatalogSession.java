package com.pocketai.catalog.repo;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.pocketai.catalog.model.CatalogModel;
import com.pocketai.catalog.model.ModelMetadata;
import com.pocketai.catalog.model.NewModelRecord;

/**
 * One transaction against the catalog. Closing a session that was neither
 * committed nor rolled back rolls it back.
 */
public interface CatalogSession extends AutoCloseable {

    Optional<CatalogModel> findByExternalId(String externalId);

    /**
     * @return the id assigned to the new record
     * @throws DuplicateRecordException when the external id or slug is taken
     */
    UUID insert(NewModelRecord record);

    /**
     * @throws RecordNotFoundException when no record has the given id
     */
    void updateMetadata(UUID id, ModelMetadata metadata, OffsetDateTime updatedAt);

    /**
     * @throws DuplicateRecordException when a constraint fails at commit time
     */
    void commit();

    void rollback();

    @Override
    void close();
}
