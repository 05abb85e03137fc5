package com.sources.jobs;

/**
 * A job that can never succeed: an unknown job name in the envelope, an undecodable payload
 * or an unknown resource kind. The job is dropped after logging.
 */
public class FatalJobException extends JobException {

    private static final long serialVersionUID = 1L;

    public FatalJobException(String message) {
        super(message);
    }

    public FatalJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
