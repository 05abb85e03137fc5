package com.sources.jobs.client;

import com.sources.jobs.JobException;

/**
 * A provisioning-backend call failed. Transient: the job fails but may be submitted again.
 */
public class SuperkeyRequestException extends JobException {

    private static final long serialVersionUID = 1L;

    public SuperkeyRequestException(String message) {
        super(message);
    }

    public SuperkeyRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
