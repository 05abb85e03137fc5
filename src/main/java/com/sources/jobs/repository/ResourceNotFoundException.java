package com.sources.jobs.repository;

import jakarta.persistence.PersistenceException;

/**
 * Raised when a tenant-scoped lookup finds no row.
 */
public class ResourceNotFoundException extends PersistenceException {

    private static final long serialVersionUID = 1L;

    public ResourceNotFoundException(String resourceType, long tenantId, long id) {
        super(resourceType + " " + id + " not found for tenant " + tenantId);
    }
}
