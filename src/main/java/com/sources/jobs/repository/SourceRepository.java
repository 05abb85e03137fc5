package com.sources.jobs.repository;

import com.sources.jobs.model.DeletedResources;

/**
 * Repository for {@link com.sources.jobs.model.Source} rows.
 */
public interface SourceRepository {

    /**
     * Deletes a source together with its applications, their application authentications and every
     * authentication that points at the source or one of its applications, in one transaction.
     *
     * @throws ResourceNotFoundException if the source does not exist for the tenant.
     */
    DeletedResources deleteCascade(long tenantId, long sourceId);
}
