package com.sources.jobs.jobs;

import com.sources.jobs.JobException;

/**
 * A store transaction the job depends on failed and was rolled back.
 */
public class JobPersistenceException extends JobException {

    private static final long serialVersionUID = 1L;

    public JobPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
