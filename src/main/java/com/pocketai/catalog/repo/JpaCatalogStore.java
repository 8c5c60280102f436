package com.pocketai.catalog.repo;

import java.sql.SQLException;
import java.util.Optional;

import org.hibernate.exception.ConstraintViolationException;

import com.pocketai.catalog.model.AuthorReference;
import com.pocketai.catalog.model.UserAccount;
import com.pocketai.catalog.startup.AppDataSourceHolder;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.PersistenceException;

@ApplicationScoped
public class JpaCatalogStore implements CatalogStore {

    private AppDataSourceHolder holder;

    protected JpaCatalogStore() {
    }

    @Inject
    public JpaCatalogStore(AppDataSourceHolder holder) {
        this.holder = holder;
    }

    @Override
    public CatalogSession openSession() {
        EntityManager em = emf().createEntityManager();
        try {
            return new JpaCatalogSession(em);
        } catch (RuntimeException e) {
            em.close();
            throw new CatalogStoreException("Unable to start catalog transaction: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<AuthorReference> findPrincipalByName(String username) {
        EntityManager em = emf().createEntityManager();
        try {
            return em.createQuery("SELECT u FROM UserAccount u WHERE u.username = :u", UserAccount.class)
                    .setParameter("u", username)
                    .setMaxResults(1)
                    .getResultList()
                    .stream()
                    .findFirst()
                    .map(AuthorReference::of);
        } catch (PersistenceException e) {
            throw new CatalogStoreException("Failed to look up user '" + username + "': " + e.getMessage(), e);
        } finally {
            em.close();
        }
    }

    @Override
    public AuthorReference createPrincipal(UserAccount principal) {
        EntityManager em = emf().createEntityManager();
        EntityTransaction tx = em.getTransaction();
        try {
            tx.begin();
            em.persist(principal);
            tx.commit();
            return AuthorReference.of(principal);
        } catch (PersistenceException e) {
            if (isConstraintViolation(e)) {
                throw new PrincipalConflictException("User '" + principal.getUsername() + "' conflicts with an existing user", e);
            }
            throw new CatalogStoreException("Failed to create user '" + principal.getUsername() + "': " + e.getMessage(), e);
        } finally {
            if (tx.isActive()) tx.rollback();
            em.close();
        }
    }

    private EntityManagerFactory emf() {
        EntityManagerFactory emf = holder.getEmf();
        if (emf == null) throw new IllegalStateException("DB not configured");
        return emf;
    }

    /**
     * True when the failure, or anything in its cause chain, is an integrity
     * constraint violation (SQLSTATE class 23).
     */
    static boolean isConstraintViolation(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException) {
                return true;
            }
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("23")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
