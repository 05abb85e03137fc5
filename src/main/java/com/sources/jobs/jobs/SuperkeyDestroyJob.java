package com.sources.jobs.jobs;

import com.sources.jobs.FatalJobException;
import com.sources.jobs.Job;
import com.sources.jobs.JobContext;
import com.sources.jobs.JobException;
import com.sources.jobs.JobJson;
import com.sources.jobs.model.ForwardableHeader;
import com.sources.jobs.model.ResourceKind;
import com.sources.jobs.model.ResourceRef;
import com.sources.jobs.queue.JobQueueException;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase A of deleting a superkey-managed resource: asks the provisioning backend to release what it
 * created, then schedules the local row deletion as an {@link AsyncDestroyJob}.
 * <p>
 * For a source every application is torn down first, one after the other. The source's own
 * {@link AsyncDestroyJob} is enqueued even when some applications failed, and the failures are then
 * reported together as a {@link CascadeDestroyException}.
 *
 * @param headers  Tenant headers forwarded to the destroy events.
 * @param identity The {@code x-rh-identity} the provisioning request is made with.
 * @param tenant   Tenant id.
 * @param model    {@code "source"} or {@code "application"}, any case.
 * @param id       Id of the resource.
 */
public record SuperkeyDestroyJob(List<ForwardableHeader> headers,
                                 String identity,
                                 long tenant,
                                 String model,
                                 long id) implements Job {

    private static final Logger log = LoggerFactory.getLogger(SuperkeyDestroyJob.class);

    public static final String NAME = "SuperkeyDestroyJob";

    /** Grace period before local rows are deleted, so the provisioning backend can finish first. */
    public static final int DESTROY_WAIT_SECONDS = 15;

    public SuperkeyDestroyJob {
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public static SuperkeyDestroyJob forSource(List<ForwardableHeader> headers, String identity, long tenant, long sourceId) {
        return new SuperkeyDestroyJob(headers, identity, tenant, ResourceKind.SOURCE.model(), sourceId);
    }

    public static SuperkeyDestroyJob forApplication(List<ForwardableHeader> headers, String identity, long tenant,
                                                    long applicationId) {
        return new SuperkeyDestroyJob(headers, identity, tenant, ResourceKind.APPLICATION.model(), applicationId);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration delay() {
        return Duration.ZERO;
    }

    @Override
    public Map<String, Object> arguments() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("tenant", tenant);
        arguments.put("model", model);
        arguments.put("id", id);
        return arguments;
    }

    @Override
    public void run(JobContext context) throws JobException {
        ResourceKind kind = ResourceKind.fromModel(model);
        switch (kind) {
            case APPLICATION -> destroyApplication(context, id);
            case SOURCE -> destroySource(context);
            default -> throw new FatalJobException("Unsupported resource model: " + model);
        }
    }

    private void destroySource(JobContext context) throws JobException {
        List<Long> applicationIds;
        try {
            applicationIds = context.applications().listIdsForSource(tenant, id);
        } catch (PersistenceException e) {
            throw new JobPersistenceException("Failed to list applications of source " + id, e);
        }

        List<Exception> failures = new ArrayList<>();
        for (Long applicationId : applicationIds) {
            try {
                destroyApplication(context, applicationId);
            } catch (JobException | JobQueueException e) {
                log.warn("Failed to tear down application {} of source {}: {}", applicationId, id, e.getMessage());
                failures.add(e);
            }
        }

        context.jobQueue().offer(new AsyncDestroyJob(headers, tenant, DESTROY_WAIT_SECONDS,
                ResourceKind.SOURCE.model(), id));
        log.info("Scheduled removal of source {} after tearing down {} applications", id, applicationIds.size());

        if (!failures.isEmpty()) {
            throw new CascadeDestroyException("Failed to tear down applications of source " + id, failures);
        }
    }

    private void destroyApplication(JobContext context, long applicationId) throws JobException {
        context.superkeyClient().sendDeleteRequest(identity,
                new ResourceRef(tenant, ResourceKind.APPLICATION, applicationId));
        context.jobQueue().offer(new AsyncDestroyJob(headers, tenant, DESTROY_WAIT_SECONDS,
                ResourceKind.APPLICATION.model(), applicationId));
        log.debug("Sent superkey delete request for application {}", applicationId);
    }

    @Override
    public byte[] serialize() {
        return JobJson.toBytes(this);
    }
}
