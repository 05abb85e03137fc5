package com.sources.jobs.repository;

import com.sources.jobs.model.Application;
import com.sources.jobs.model.ApplicationAuthentication;
import com.sources.jobs.model.Authentication;
import com.sources.jobs.model.AvailabilityStatus;
import com.sources.jobs.model.DeletedResources;
import com.sources.jobs.model.RetryCandidate;
import com.sources.jobs.model.ResourceKind;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JPA implementation of the ApplicationRepository.
 */
public class JpaApplicationRepository implements ApplicationRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaApplicationRepository.class);

    private final JpaTransactions transactions;

    public JpaApplicationRepository(JpaTransactions transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions cannot be null");
    }

    @Override
    public List<RetryCandidate> claimRetryCandidates(int retryMax, LocalDateTime createdAfter) {
        return transactions.inTransaction(entityManager -> {
            // Availability is flipped by an external consumer, so winners can only be pinned here.
            int pinned = entityManager.createQuery(
                            "UPDATE Application a SET a.retryCounter = :retryMax " +
                            "WHERE a.availabilityStatus = :available AND a.retryCounter < :retryMax")
                    .setParameter("retryMax", retryMax)
                    .setParameter("available", AvailabilityStatus.AVAILABLE)
                    .executeUpdate();
            log.info("Pinned retry counter of {} applications that became available since last run", pinned);

            List<Object[]> rows = entityManager.createQuery(
                            "SELECT a.id, a.applicationTypeId, a.tenant.id FROM Application a " +
                            "WHERE (a.availabilityStatus IS NULL OR a.availabilityStatus <> :available) " +
                            "AND a.createdAt > :createdAfter " +
                            "AND a.retryCounter < :retryMax " +
                            "ORDER BY a.id",
                            Object[].class)
                    .setParameter("available", AvailabilityStatus.AVAILABLE)
                    .setParameter("createdAfter", createdAfter)
                    .setParameter("retryMax", retryMax)
                    .getResultList();
            if (rows.isEmpty()) {
                log.info("No retryable applications found.");
                return List.<RetryCandidate>of();
            }

            List<RetryCandidate> candidates = new ArrayList<>(rows.size());
            List<Long> ids = new ArrayList<>(rows.size());
            for (Object[] row : rows) {
                long id = ((Number) row[0]).longValue();
                candidates.add(new RetryCandidate(id, ((Number) row[1]).longValue(), ((Number) row[2]).longValue()));
                ids.add(id);
            }

            int bumped = entityManager.createQuery(
                            "UPDATE Application a SET a.retryCounter = a.retryCounter + 1 WHERE a.id IN :ids")
                    .setParameter("ids", ids)
                    .executeUpdate();
            log.info("Found {} applications that need to be retried, incremented {} retry counters", candidates.size(), bumped);
            return candidates;
        });
    }

    @Override
    public Optional<Application> findWithRelations(long tenantId, long applicationId) {
        return transactions.inTransaction(entityManager -> entityManager.createQuery(
                        "SELECT DISTINCT a FROM Application a " +
                        "JOIN FETCH a.source " +
                        "JOIN FETCH a.tenant " +
                        "LEFT JOIN FETCH a.applicationAuthentications aa " +
                        "LEFT JOIN FETCH aa.authentication " +
                        "WHERE a.id = :id AND a.tenant.id = :tenantId",
                        Application.class)
                .setParameter("id", applicationId)
                .setParameter("tenantId", tenantId)
                .getResultList()
                .stream()
                .findFirst());
    }

    @Override
    public List<Long> listIdsForSource(long tenantId, long sourceId) {
        return transactions.inTransaction(entityManager -> entityManager.createQuery(
                        "SELECT a.id FROM Application a WHERE a.source.id = :sourceId AND a.tenant.id = :tenantId ORDER BY a.id",
                        Long.class)
                .setParameter("sourceId", sourceId)
                .setParameter("tenantId", tenantId)
                .getResultList());
    }

    @Override
    public DeletedResources deleteCascade(long tenantId, long applicationId) {
        return transactions.inTransaction(entityManager -> {
            Application application = findForTenant(entityManager, tenantId, applicationId)
                    .orElseThrow(() -> new ResourceNotFoundException("Application", tenantId, applicationId));

            List<Long> ids = List.of(applicationId);
            List<ApplicationAuthentication> applicationAuthentications =
                    CascadeDeletes.applicationAuthentications(entityManager, ids);
            List<Authentication> authentications = CascadeDeletes.authentications(
                    entityManager, tenantId, ResourceKind.APPLICATION.resourceType(), ids);

            DeletedResources deleted = CascadeDeletes.remove(entityManager, applicationAuthentications,
                    authentications, List.of(application), null);
            log.debug("Deleted application {} with {} application authentications and {} authentications",
                    applicationId, applicationAuthentications.size(), authentications.size());
            return deleted;
        });
    }

    private Optional<Application> findForTenant(EntityManager entityManager, long tenantId, long applicationId) {
        return entityManager.createQuery(
                        "SELECT a FROM Application a WHERE a.id = :id AND a.tenant.id = :tenantId", Application.class)
                .setParameter("id", applicationId)
                .setParameter("tenantId", tenantId)
                .getResultList()
                .stream()
                .findFirst();
    }
}
