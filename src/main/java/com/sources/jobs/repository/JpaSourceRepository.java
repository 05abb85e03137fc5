package com.sources.jobs.repository;

import com.sources.jobs.model.Application;
import com.sources.jobs.model.ApplicationAuthentication;
import com.sources.jobs.model.Authentication;
import com.sources.jobs.model.DeletedResources;
import com.sources.jobs.model.ResourceKind;
import com.sources.jobs.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JPA implementation of the SourceRepository.
 */
public class JpaSourceRepository implements SourceRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaSourceRepository.class);

    private final JpaTransactions transactions;

    public JpaSourceRepository(JpaTransactions transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions cannot be null");
    }

    @Override
    public DeletedResources deleteCascade(long tenantId, long sourceId) {
        return transactions.inTransaction(entityManager -> {
            Source source = entityManager.createQuery(
                            "SELECT s FROM Source s WHERE s.id = :id AND s.tenant.id = :tenantId", Source.class)
                    .setParameter("id", sourceId)
                    .setParameter("tenantId", tenantId)
                    .getResultList()
                    .stream()
                    .findFirst()
                    .orElseThrow(() -> new ResourceNotFoundException("Source", tenantId, sourceId));

            List<Application> applications = entityManager.createQuery(
                            "SELECT a FROM Application a WHERE a.source.id = :sourceId AND a.tenant.id = :tenantId ORDER BY a.id",
                            Application.class)
                    .setParameter("sourceId", sourceId)
                    .setParameter("tenantId", tenantId)
                    .getResultList();
            List<Long> applicationIds = applications.stream().map(Application::getId).toList();

            List<ApplicationAuthentication> applicationAuthentications =
                    CascadeDeletes.applicationAuthentications(entityManager, applicationIds);

            List<Authentication> authentications = new ArrayList<>(CascadeDeletes.authentications(
                    entityManager, tenantId, ResourceKind.APPLICATION.resourceType(), applicationIds));
            authentications.addAll(CascadeDeletes.authentications(
                    entityManager, tenantId, ResourceKind.SOURCE.resourceType(), List.of(sourceId)));

            DeletedResources deleted = CascadeDeletes.remove(entityManager, applicationAuthentications,
                    authentications, applications, source);
            log.debug("Deleted source {} with {} applications, {} application authentications and {} authentications",
                    sourceId, applications.size(), applicationAuthentications.size(), authentications.size());
            return deleted;
        });
    }
}
