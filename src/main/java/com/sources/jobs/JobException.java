package com.sources.jobs;

/**
 * Raised when a job fails to run. The worker logs it and moves on; nothing is retried.
 */
public class JobException extends Exception {

    private static final long serialVersionUID = 1L;

    public JobException(String message) {
        super(message);
    }

    public JobException(String message, Throwable cause) {
        super(message, cause);
    }
}
