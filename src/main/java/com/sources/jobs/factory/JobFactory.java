package com.sources.jobs.factory;

import com.sources.jobs.FatalJobException;
import com.sources.jobs.Job;

/**
 * Factory responsible for rebuilding a {@link Job} from the name and payload carried by a
 * dispatch envelope.
 *
 * Implementations could use a Map, service discovery, or other mechanisms.
 */
public interface JobFactory {

    /**
     * Rebuilds the job registered under {@code jobName} from its serialized payload.
     *
     * @param jobName The job's stable name (e.g., "SuperkeyDestroyJob", "AsyncDestroyJob").
     * @param raw     The payload produced by {@link Job#serialize()}.
     * @return The reconstructed job, never {@code null}.
     * @throws FatalJobException if no job is registered under the name or the payload cannot be decoded.
     */
    Job create(String jobName, byte[] raw) throws FatalJobException;
}
