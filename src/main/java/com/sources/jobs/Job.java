package com.sources.jobs;

import java.time.Duration;
import java.util.Map;

/**
 * Represents a unit of background work that can be queued, delayed and executed.
 * Implementations carry only the data they need; collaborators are handed in through
 * the {@link JobContext} when the job runs, so a job can always be rebuilt from
 * its serialized form.
 */
public interface Job {

    /**
     * Stable type discriminator, used as the {@code JobName} of the dispatch envelope.
     */
    String name();

    /**
     * How long to wait before executing. {@link Duration#ZERO} means "run as soon as dequeued".
     */
    Duration delay();

    /**
     * Arguments for logging purposes only.
     */
    Map<String, Object> arguments();

    /**
     * Executes the job logic.
     *
     * @param context The collaborators available to the job.
     * @throws JobException if the job execution fails.
     */
    void run(JobContext context) throws JobException;

    /**
     * Serializes the job into JSON bytes for a durable queue.
     */
    byte[] serialize();
}
