package com.sources.jobs.client;

/**
 * An event could not be published. Callers treat notifications as best effort and only log it.
 */
public class EventSendException extends Exception {

    private static final long serialVersionUID = 1L;

    public EventSendException(String message) {
        super(message);
    }

    public EventSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
