package com.sources.jobs.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sources.jobs.Job;
import com.sources.jobs.JobContext;
import com.sources.jobs.JobException;
import com.sources.jobs.JobJson;
import com.sources.jobs.model.ForwardableHeader;
import com.sources.jobs.model.ResourceKind;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase B of a destroy: deletes the resource and everything hanging off it, after waiting
 * {@code waitSeconds}.
 */
public record AsyncDestroyJob(List<ForwardableHeader> headers,
                              long tenant,
                              @JsonProperty("wait_seconds") int waitSeconds,
                              String model,
                              long id) implements Job {

    public static final String NAME = "AsyncDestroyJob";

    public AsyncDestroyJob {
        headers = headers == null ? List.of() : List.copyOf(headers);
        if (waitSeconds < 0) {
            throw new IllegalArgumentException("waitSeconds cannot be negative");
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration delay() {
        return Duration.ofSeconds(waitSeconds);
    }

    @Override
    public Map<String, Object> arguments() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("tenant", tenant);
        arguments.put("model", model);
        arguments.put("id", id);
        arguments.put("wait_seconds", waitSeconds);
        return arguments;
    }

    @Override
    public void run(JobContext context) throws JobException {
        ResourceKind kind = ResourceKind.fromModel(model);
        context.resourceDestroyer().deleteCascade(tenant, kind, id, headers);
    }

    @Override
    public byte[] serialize() {
        return JobJson.toBytes(this);
    }
}
