package com.sources.jobs.service.impl;

import com.sources.jobs.JobException;
import com.sources.jobs.client.EventSendException;
import com.sources.jobs.client.EventSender;
import com.sources.jobs.jobs.JobPersistenceException;
import com.sources.jobs.model.ApplicationAuthentication;
import com.sources.jobs.model.Application;
import com.sources.jobs.model.Authentication;
import com.sources.jobs.model.DeletedResources;
import com.sources.jobs.model.ForwardableHeader;
import com.sources.jobs.model.ResourceKind;
import com.sources.jobs.repository.ApplicationRepository;
import com.sources.jobs.repository.ResourceNotFoundException;
import com.sources.jobs.repository.SourceRepository;
import com.sources.jobs.service.ResourceDestroyer;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Deletes through the repositories, then announces the deleted rows. Events are raised only after
 * the delete committed, and a failed event never undoes the delete.
 */
public class CascadeResourceDestroyer implements ResourceDestroyer {

    private static final Logger log = LoggerFactory.getLogger(CascadeResourceDestroyer.class);

    private final SourceRepository sources;
    private final ApplicationRepository applications;
    private final EventSender eventSender;

    public CascadeResourceDestroyer(SourceRepository sources, ApplicationRepository applications, EventSender eventSender) {
        this.sources = Objects.requireNonNull(sources, "sources cannot be null");
        this.applications = Objects.requireNonNull(applications, "applications cannot be null");
        this.eventSender = Objects.requireNonNull(eventSender, "eventSender cannot be null");
    }

    @Override
    public void deleteCascade(long tenantId, ResourceKind kind, long id, List<ForwardableHeader> headers)
            throws JobException {
        DeletedResources deleted;
        try {
            deleted = switch (kind) {
                case SOURCE -> sources.deleteCascade(tenantId, id);
                case APPLICATION -> applications.deleteCascade(tenantId, id);
            };
        } catch (ResourceNotFoundException e) {
            log.info("{} {} of tenant {} is already gone, nothing to delete", kind.resourceType(), id, tenantId);
            return;
        } catch (PersistenceException e) {
            throw new JobPersistenceException("Failed to delete " + kind.resourceType() + " " + id, e);
        }

        for (ApplicationAuthentication applicationAuthentication : deleted.applicationAuthentications()) {
            raise("ApplicationAuthentication.destroy", applicationAuthentication, headers);
        }
        for (Authentication authentication : deleted.authentications()) {
            raise("Authentication.destroy", authentication, headers);
        }
        for (Application application : deleted.applications()) {
            raise("Application.destroy", application, headers);
        }
        if (deleted.source() != null) {
            raise("Source.destroy", deleted.source(), headers);
        }
        log.info("Deleted {} {} of tenant {}", kind.resourceType(), id, tenantId);
    }

    private void raise(String eventType, Object resource, List<ForwardableHeader> headers) {
        try {
            eventSender.raiseEvent(eventType, resource, headers);
        } catch (EventSendException | RuntimeException e) {
            log.warn("Failed to raise {} for {}: {}", eventType, resource, e.toString());
        }
    }
}
