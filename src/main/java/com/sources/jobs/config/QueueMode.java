package com.sources.jobs.config;

import java.util.Locale;

/**
 * Where dispatched jobs are kept until a worker takes them.
 */
public enum QueueMode {
    /** Durable Redis list shared by every worker process. */
    REDIS,
    /** Process-local queue, lost on restart. */
    MEMORY;

    public static QueueMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Queue mode cannot be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown queue mode '" + value + "', expected redis or memory", e);
        }
    }
}
