package com.pocketai.catalog.repo;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.pocketai.catalog.model.CatalogModel;
import com.pocketai.catalog.model.ModelMetadata;
import com.pocketai.catalog.model.NewModelRecord;
import com.pocketai.catalog.model.UserAccount;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.PersistenceException;

/**
 * {@link CatalogSession} over one {@link EntityManager} and its resource-local
 * transaction, begun on construction.
 */
class JpaCatalogSession implements CatalogSession {

    private final EntityManager em;
    private final EntityTransaction tx;

    JpaCatalogSession(EntityManager em) {
        this.em = em;
        this.tx = em.getTransaction();
        tx.begin();
    }

    @Override
    public Optional<CatalogModel> findByExternalId(String externalId) {
        try {
            return em.createQuery("SELECT m FROM CatalogModel m WHERE m.hfModelId = :id", CatalogModel.class)
                    .setParameter("id", externalId)
                    .setMaxResults(1)
                    .getResultList()
                    .stream()
                    .findFirst();
        } catch (PersistenceException e) {
            throw new CatalogStoreException("Lookup of '" + externalId + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public UUID insert(NewModelRecord record) {
        CatalogModel model = new CatalogModel();
        model.setName(record.getName());
        model.setSlug(record.getSlug());
        model.setHfModelId(record.getExternalId());
        model.setCategory(record.getCategory());
        model.setVerifiedOfficial(false);
        model.setAuthor(em.getReference(UserAccount.class, record.getAuthor().getId()));
        model.setCreatedAt(record.getCreatedAt());
        model.applyMetadata(record.getMetadata(), record.getCreatedAt());
        try {
            em.persist(model);
            em.flush();
        } catch (PersistenceException e) {
            throw translate("Insert of '" + record.getExternalId() + "'", e);
        }
        return model.getId();
    }

    @Override
    public void updateMetadata(UUID id, ModelMetadata metadata, OffsetDateTime updatedAt) {
        try {
            CatalogModel model = em.find(CatalogModel.class, id);
            if (model == null) {
                throw new RecordNotFoundException("No catalog record with id " + id);
            }
            model.applyMetadata(metadata, updatedAt);
            em.flush();
        } catch (PersistenceException e) {
            throw translate("Update of record " + id, e);
        }
    }

    @Override
    public void commit() {
        try {
            tx.commit();
        } catch (PersistenceException e) {
            throw translate("Commit", e);
        }
    }

    @Override
    public void rollback() {
        if (tx.isActive()) {
            tx.rollback();
        }
    }

    @Override
    public void close() {
        try {
            rollback();
        } finally {
            em.close();
        }
    }

    private static CatalogStoreException translate(String operation, PersistenceException e) {
        if (JpaCatalogStore.isConstraintViolation(e)) {
            return new DuplicateRecordException(operation + " violates a catalog constraint: " + rootMessage(e), e);
        }
        return new CatalogStoreException(operation + " failed: " + rootMessage(e), e);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
