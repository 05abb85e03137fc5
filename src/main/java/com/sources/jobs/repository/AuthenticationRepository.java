package com.sources.jobs.repository;

import com.sources.jobs.model.Authentication;

import java.util.List;

/**
 * Read access to {@link Authentication} rows.
 */
public interface AuthenticationRepository {

    /**
     * Lists the authentications whose polymorphic owner is the given application.
     */
    List<Authentication> listForApplication(long tenantId, long applicationId);
}
