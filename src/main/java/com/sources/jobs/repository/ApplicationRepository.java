package com.sources.jobs.repository;

import com.sources.jobs.model.Application;
import com.sources.jobs.model.DeletedResources;
import com.sources.jobs.model.RetryCandidate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the {@link Application} rows the job subsystem touches.
 * Implementations throw {@link jakarta.persistence.PersistenceException} on store failures.
 */
public interface ApplicationRepository {

    /**
     * Runs the transactional part of one reconciliation tick, atomically:
     * <ol>
     *     <li>pins {@code retry_counter} to {@code retryMax} for every available application below it;</li>
     *     <li>selects applications that are not available, were created after {@code createdAfter}
     *     and have {@code retry_counter < retryMax};</li>
     *     <li>increments {@code retry_counter} by one for exactly the selected rows.</li>
     * </ol>
     *
     * @param retryMax     The retry ceiling.
     * @param createdAfter Only applications created after this instant are selected.
     * @return The selected applications; empty if nothing needs a retry.
     */
    List<RetryCandidate> claimRetryCandidates(int retryMax, LocalDateTime createdAfter);

    /**
     * Loads an application with its Source, Tenant and ApplicationAuthentications initialized.
     */
    Optional<Application> findWithRelations(long tenantId, long applicationId);

    /**
     * Lists the ids of the applications attached to a source, oldest first.
     */
    List<Long> listIdsForSource(long tenantId, long sourceId);

    /**
     * Deletes an application, its application authentications and the authentications that
     * point at it, in one transaction.
     *
     * @throws ResourceNotFoundException if the application does not exist for the tenant.
     */
    DeletedResources deleteCascade(long tenantId, long applicationId);
}
