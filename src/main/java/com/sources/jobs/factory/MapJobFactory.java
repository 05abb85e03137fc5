package com.sources.jobs.factory;

import com.sources.jobs.FatalJobException;
import com.sources.jobs.Job;
import com.sources.jobs.JobJson;
import com.sources.jobs.jobs.AsyncDestroyJob;
import com.sources.jobs.jobs.SuperkeyDestroyJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A simple implementation of {@link JobFactory} using a Map of deserializers keyed by job name.
 * Jobs should be registered during application startup.
 */
public class MapJobFactory implements JobFactory {

    private static final Logger log = LoggerFactory.getLogger(MapJobFactory.class);

    private final Map<String, JobDeserializer> registry = new ConcurrentHashMap<>();

    /**
     * Creates a factory that knows every job a producer may put on the queue.
     * {@code RetryCreateJob} is scheduled in-process only and is deliberately absent.
     */
    public static MapJobFactory withDefaultJobs() {
        MapJobFactory factory = new MapJobFactory();
        factory.register(SuperkeyDestroyJob.NAME, raw -> JobJson.MAPPER.readValue(raw, SuperkeyDestroyJob.class));
        factory.register(AsyncDestroyJob.NAME, raw -> JobJson.MAPPER.readValue(raw, AsyncDestroyJob.class));
        return factory;
    }

    /**
     * Registers the deserializer for a job name. Registering a name twice replaces the previous entry.
     *
     * @param jobName      The unique job name.
     * @param deserializer Rebuilds the job from its payload.
     */
    public void register(String jobName, JobDeserializer deserializer) {
        if (jobName == null || jobName.trim().isEmpty()) {
            throw new IllegalArgumentException("jobName cannot be blank");
        }
        if (deserializer == null) {
            throw new IllegalArgumentException("deserializer cannot be null");
        }
        log.info("Registering job deserializer for '{}'", jobName);
        registry.put(jobName, deserializer);
    }

    public Set<String> registeredNames() {
        return Set.copyOf(registry.keySet());
    }

    @Override
    public Job create(String jobName, byte[] raw) throws FatalJobException {
        JobDeserializer deserializer = jobName == null ? null : registry.get(jobName);
        if (deserializer == null) {
            throw new FatalJobException("Unknown job name: " + jobName);
        }
        if (raw == null) {
            throw new FatalJobException("Missing payload for job " + jobName);
        }
        Job job;
        try {
            job = deserializer.deserialize(raw);
        } catch (IOException e) {
            throw new FatalJobException("Failed to decode payload of job " + jobName + ": " + e.getMessage(), e);
        }
        if (job == null) {
            throw new FatalJobException("Deserializer for job " + jobName + " returned no job");
        }
        return job;
    }
}
