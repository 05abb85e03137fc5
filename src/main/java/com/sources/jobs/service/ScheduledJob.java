package com.sources.jobs.service;

import com.sources.jobs.Job;

import java.time.Duration;
import java.util.Objects;

/**
 * A job the worker runs over and over, waiting {@code interval} between the end of one run and
 * the start of the next.
 */
public record ScheduledJob(Duration interval, Job job) {

    public ScheduledJob {
        Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(job, "job cannot be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }
}
