package com.sources.jobs.jobs;

import com.sources.jobs.JobContext;
import com.sources.jobs.client.EventSendException;
import com.sources.jobs.client.EventSender;
import com.sources.jobs.model.Application;
import com.sources.jobs.model.ApplicationAuthentication;
import com.sources.jobs.model.Authentication;
import com.sources.jobs.model.ForwardableHeader;
import com.sources.jobs.model.RetryCandidate;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Re-raises the create events of one application so downstream consumers get another chance to
 * finish provisioning it. Every step is best effort: failures are logged and the resend moves on.
 */
public class CreateEventResender {

    private static final Logger log = LoggerFactory.getLogger(CreateEventResender.class);

    private final JobContext context;

    public CreateEventResender(JobContext context) {
        this.context = Objects.requireNonNull(context, "context cannot be null");
    }

    /**
     * Resends the candidate's create events. Never throws, so it can run as a bare executor task.
     */
    public void resend(RetryCandidate candidate) {
        try {
            resendEvents(candidate);
        } catch (RuntimeException e) {
            log.error("Create event resend for application {} failed", candidate.applicationId(), e);
        }
    }

    private void resendEvents(RetryCandidate candidate) {
        long applicationId = candidate.applicationId();

        boolean optedIn;
        try {
            optedIn = context.metaData().applicationOptedIntoRetry(candidate.applicationTypeId());
        } catch (PersistenceException e) {
            log.warn("Failed to look up retry opt-in for application type {}: {}",
                    candidate.applicationTypeId(), e.getMessage());
            return;
        }
        if (!optedIn) {
            log.debug("Application type {} did not opt into create retries, skipping application {}",
                    candidate.applicationTypeId(), applicationId);
            return;
        }

        Application application;
        List<Authentication> authentications;
        try {
            Optional<Application> found = context.applications().findWithRelations(candidate.tenantId(), applicationId);
            if (found.isEmpty()) {
                log.warn("Application {} vanished before its create events could be resent", applicationId);
                return;
            }
            application = found.get();
            authentications = context.authentications().listForApplication(candidate.tenantId(), applicationId);
        } catch (PersistenceException e) {
            log.warn("Failed to load application {} for create event resend: {}", applicationId, e.getMessage());
            return;
        }

        List<ForwardableHeader> headers = application.getTenant().forwardableHeaders();
        EventSender eventSender = context.eventSender();
        raise(eventSender, "Source.create", application.getSource(), headers);
        raise(eventSender, "Application.create", application, headers);
        for (Authentication authentication : authentications) {
            raise(eventSender, "Authentication.create", authentication, headers);
        }
        for (ApplicationAuthentication applicationAuthentication : application.getApplicationAuthentications()) {
            raise(eventSender, "ApplicationAuthentication.create", applicationAuthentication, headers);
        }
        log.info("Resent create events for application {}", applicationId);
    }

    private void raise(EventSender eventSender, String eventType, Object resource, List<ForwardableHeader> headers) {
        try {
            eventSender.raiseEvent(eventType, resource, headers);
        } catch (EventSendException | RuntimeException e) {
            log.warn("Failed to raise {} for {}: {}", eventType, resource, e.toString());
        }
    }
}
