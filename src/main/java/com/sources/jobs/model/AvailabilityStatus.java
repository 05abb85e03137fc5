package com.sources.jobs.model;

import java.util.Locale;

/**
 * Health state of a resource, written by the asynchronous availability-check consumers.
 */
public enum AvailabilityStatus {
    /**
     * Last availability check passed.
     */
    AVAILABLE("available"),
    /**
     * An availability check is running.
     */
    IN_PROGRESS("in_progress"),
    /**
     * Some of the resource's dependents are available.
     */
    PARTIALLY_AVAILABLE("partially_available"),
    /**
     * Last availability check failed, or no check result has been received yet.
     */
    UNAVAILABLE("unavailable");

    private final String value;

    AvailabilityStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AvailabilityStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AvailabilityStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown availability status: " + value);
    }
}
