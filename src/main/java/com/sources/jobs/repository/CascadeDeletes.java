package com.sources.jobs.repository;

import com.sources.jobs.model.Application;
import com.sources.jobs.model.ApplicationAuthentication;
import com.sources.jobs.model.Authentication;
import com.sources.jobs.model.DeletedResources;
import com.sources.jobs.model.Source;
import jakarta.persistence.EntityManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Queries shared by the application and source cascade deletes. Must run inside a transaction.
 */
final class CascadeDeletes {

    private CascadeDeletes() {
    }

    static List<ApplicationAuthentication> applicationAuthentications(EntityManager entityManager,
                                                                      Collection<Long> applicationIds) {
        if (applicationIds.isEmpty()) {
            return new ArrayList<>();
        }
        return entityManager.createQuery(
                        "SELECT aa FROM ApplicationAuthentication aa WHERE aa.application.id IN :ids ORDER BY aa.id",
                        ApplicationAuthentication.class)
                .setParameter("ids", applicationIds)
                .getResultList();
    }

    static List<Authentication> authentications(EntityManager entityManager, long tenantId,
                                                String resourceType, Collection<Long> resourceIds) {
        if (resourceIds.isEmpty()) {
            return new ArrayList<>();
        }
        return entityManager.createQuery(
                        "SELECT au FROM Authentication au " +
                        "WHERE au.tenant.id = :tenantId AND au.resourceType = :resourceType AND au.resourceId IN :ids " +
                        "ORDER BY au.id",
                        Authentication.class)
                .setParameter("tenantId", tenantId)
                .setParameter("resourceType", resourceType)
                .setParameter("ids", resourceIds)
                .getResultList();
    }

    /**
     * Removes children before parents: join rows, authentications, applications, then the source.
     */
    static DeletedResources remove(EntityManager entityManager,
                                   List<ApplicationAuthentication> applicationAuthentications,
                                   List<Authentication> authentications,
                                   List<Application> applications,
                                   Source source) {
        applicationAuthentications.forEach(entityManager::remove);
        authentications.forEach(entityManager::remove);
        applications.forEach(entityManager::remove);
        if (source != null) {
            entityManager.remove(source);
        }
        entityManager.flush();
        return new DeletedResources(applicationAuthentications, authentications, applications, source);
    }
}
