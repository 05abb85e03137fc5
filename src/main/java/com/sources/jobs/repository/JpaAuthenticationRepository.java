package com.sources.jobs.repository;

import com.sources.jobs.model.Authentication;
import com.sources.jobs.model.ResourceKind;

import java.util.List;
import java.util.Objects;

/**
 * JPA implementation of the AuthenticationRepository.
 */
public class JpaAuthenticationRepository implements AuthenticationRepository {

    private final JpaTransactions transactions;

    public JpaAuthenticationRepository(JpaTransactions transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions cannot be null");
    }

    @Override
    public List<Authentication> listForApplication(long tenantId, long applicationId) {
        return transactions.inTransaction(entityManager -> CascadeDeletes.authentications(
                entityManager, tenantId, ResourceKind.APPLICATION.resourceType(), List.of(applicationId)));
    }
}
