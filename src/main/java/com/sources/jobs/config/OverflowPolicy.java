package com.sources.jobs.config;

import java.util.Locale;

/**
 * What the worker does when it already holds as many jobs in memory as it may.
 */
public enum OverflowPolicy {
    /** Stop taking jobs from the queue until one finishes. */
    BLOCK,
    /** Evict the oldest job that has not started to make room for the new one. */
    DROP_OLDEST,
    /** Drop the job just taken from the queue. */
    REJECT;

    /**
     * Parses {@code block}, {@code drop-oldest} / {@code drop_oldest} or {@code reject}, ignoring case.
     */
    public static OverflowPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Overflow policy cannot be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown overflow policy '" + value + "', expected block, drop-oldest or reject", e);
        }
    }
}
