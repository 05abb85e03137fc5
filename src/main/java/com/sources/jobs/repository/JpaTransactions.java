package com.sources.jobs.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Runs a unit of work inside a resource-local transaction: begin, commit on success,
 * rollback on any runtime failure. The entity manager is closed afterwards, so entities
 * returned from the work are detached.
 */
public class JpaTransactions {

    private static final Logger log = LoggerFactory.getLogger(JpaTransactions.class);

    private final EntityManagerFactory entityManagerFactory;

    public JpaTransactions(EntityManagerFactory entityManagerFactory) {
        this.entityManagerFactory = Objects.requireNonNull(entityManagerFactory, "entityManagerFactory cannot be null");
    }

    public <T> T inTransaction(Function<EntityManager, T> work) {
        EntityManager entityManager = entityManagerFactory.createEntityManager();
        EntityTransaction transaction = entityManager.getTransaction();
        try {
            transaction.begin();
            T result = work.apply(entityManager);
            transaction.commit();
            return result;
        } catch (RuntimeException e) {
            if (transaction.isActive()) {
                try {
                    transaction.rollback();
                } catch (RuntimeException rollbackFailure) {
                    log.error("Rollback failed after: {}", e.getMessage(), rollbackFailure);
                    e.addSuppressed(rollbackFailure);
                }
            }
            throw e;
        } finally {
            entityManager.close();
        }
    }
}
