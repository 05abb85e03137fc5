package com.sources.jobs.queue;

/**
 * The job queue could not be reached or has been closed.
 */
public class JobQueueException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public JobQueueException(String message) {
        super(message);
    }

    public JobQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
