package com.sources.jobs.repository;

import com.sources.jobs.model.MetaData;

import java.util.Objects;

/**
 * JPA implementation of the MetaDataRepository.
 */
public class JpaMetaDataRepository implements MetaDataRepository {

    /** Name of the {@code AppMetaData} row that opts an application type into create retries. */
    public static final String RETRY_CREATE = "retry_create";

    private final JpaTransactions transactions;

    public JpaMetaDataRepository(JpaTransactions transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions cannot be null");
    }

    @Override
    public boolean applicationOptedIntoRetry(long applicationTypeId) {
        Long count = transactions.inTransaction(entityManager -> entityManager.createQuery(
                        "SELECT COUNT(m) FROM MetaData m " +
                        "WHERE m.applicationTypeId = :applicationTypeId AND m.type = :type AND m.name = :name",
                        Long.class)
                .setParameter("applicationTypeId", applicationTypeId)
                .setParameter("type", MetaData.APP_META_DATA)
                .setParameter("name", RETRY_CREATE)
                .getSingleResult());
        return count != null && count > 0;
    }
}
