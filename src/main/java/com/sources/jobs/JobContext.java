package com.sources.jobs;

import com.sources.jobs.client.EventSender;
import com.sources.jobs.client.SuperkeyClient;
import com.sources.jobs.queue.JobQueue;
import com.sources.jobs.repository.ApplicationRepository;
import com.sources.jobs.repository.AuthenticationRepository;
import com.sources.jobs.repository.MetaDataRepository;
import com.sources.jobs.service.ResourceDestroyer;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * The collaborators a {@link Job} may use while running. Built once at startup and shared by
 * every job the worker executes; jobs never hold on to it.
 *
 * Collaborators that were not configured fail with {@link IllegalStateException} on access.
 */
public final class JobContext {

    private final JobQueue jobQueue;
    private final SuperkeyClient superkeyClient;
    private final ResourceDestroyer resourceDestroyer;
    private final ApplicationRepository applications;
    private final AuthenticationRepository authentications;
    private final MetaDataRepository metaData;
    private final EventSender eventSender;
    private final Executor resendExecutor;
    private final Clock clock;

    private JobContext(Builder builder) {
        this.jobQueue = builder.jobQueue;
        this.superkeyClient = builder.superkeyClient;
        this.resourceDestroyer = builder.resourceDestroyer;
        this.applications = builder.applications;
        this.authentications = builder.authentications;
        this.metaData = builder.metaData;
        this.eventSender = builder.eventSender;
        this.resendExecutor = builder.resendExecutor;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Queue used by jobs that schedule follow-up jobs. */
    public JobQueue jobQueue() {
        return require(jobQueue, "jobQueue");
    }

    public SuperkeyClient superkeyClient() {
        return require(superkeyClient, "superkeyClient");
    }

    public ResourceDestroyer resourceDestroyer() {
        return require(resourceDestroyer, "resourceDestroyer");
    }

    public ApplicationRepository applications() {
        return require(applications, "applications");
    }

    public AuthenticationRepository authentications() {
        return require(authentications, "authentications");
    }

    public MetaDataRepository metaData() {
        return require(metaData, "metaData");
    }

    public EventSender eventSender() {
        return require(eventSender, "eventSender");
    }

    /** Executor for best-effort notification work that must not block the calling job. */
    public Executor resendExecutor() {
        return resendExecutor;
    }

    public Clock clock() {
        return clock;
    }

    private static <T> T require(T collaborator, String name) {
        if (collaborator == null) {
            throw new IllegalStateException("JobContext has no " + name + " configured");
        }
        return collaborator;
    }

    public static final class Builder {

        private JobQueue jobQueue;
        private SuperkeyClient superkeyClient;
        private ResourceDestroyer resourceDestroyer;
        private ApplicationRepository applications;
        private AuthenticationRepository authentications;
        private MetaDataRepository metaData;
        private EventSender eventSender;
        private Executor resendExecutor = Runnable::run;
        private Clock clock = Clock.systemDefaultZone();

        private Builder() {
        }

        public Builder jobQueue(JobQueue jobQueue) {
            this.jobQueue = jobQueue;
            return this;
        }

        public Builder superkeyClient(SuperkeyClient superkeyClient) {
            this.superkeyClient = superkeyClient;
            return this;
        }

        public Builder resourceDestroyer(ResourceDestroyer resourceDestroyer) {
            this.resourceDestroyer = resourceDestroyer;
            return this;
        }

        public Builder applications(ApplicationRepository applications) {
            this.applications = applications;
            return this;
        }

        public Builder authentications(AuthenticationRepository authentications) {
            this.authentications = authentications;
            return this;
        }

        public Builder metaData(MetaDataRepository metaData) {
            this.metaData = metaData;
            return this;
        }

        public Builder eventSender(EventSender eventSender) {
            this.eventSender = eventSender;
            return this;
        }

        public Builder resendExecutor(Executor resendExecutor) {
            this.resendExecutor = Objects.requireNonNull(resendExecutor, "resendExecutor cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public JobContext build() {
            return new JobContext(this);
        }
    }
}
