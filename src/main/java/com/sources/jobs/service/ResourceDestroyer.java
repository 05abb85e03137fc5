package com.sources.jobs.service;

import com.sources.jobs.JobException;
import com.sources.jobs.model.ForwardableHeader;
import com.sources.jobs.model.ResourceKind;

import java.util.List;

/**
 * Deletes a resource and everything that depends on it.
 */
public interface ResourceDestroyer {

    /**
     * Deletes the resource with its dependents in one transaction, then announces every deleted
     * row with a {@code <ResourceType>.destroy} event carrying {@code headers}.
     *
     * @throws JobException if the deletion failed and was rolled back.
     */
    void deleteCascade(long tenantId, ResourceKind kind, long id, List<ForwardableHeader> headers) throws JobException;
}
