package com.sources.jobs.service.impl;

import com.sources.jobs.Job;

import java.time.Duration;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A job waiting in the worker's {@link java.util.concurrent.DelayQueue} until its delay has elapsed.
 * Jobs due at the same instant leave in arrival order.
 */
final class DelayedJob implements Delayed {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Job job;
    private final long dueAtNanos;
    private final long sequence;

    DelayedJob(Job job, Duration delay) {
        this.job = job;
        this.dueAtNanos = System.nanoTime() + Math.max(0L, delay.toNanos());
        this.sequence = SEQUENCE.getAndIncrement();
    }

    Job job() {
        return job;
    }

    /** Arrival order; lower is older. */
    long sequence() {
        return sequence;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(dueAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
        if (other == this) {
            return 0;
        }
        if (other instanceof DelayedJob that) {
            int byDue = Long.compare(dueAtNanos - that.dueAtNanos, 0L);
            return byDue != 0 ? byDue : Long.compare(sequence, that.sequence);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
    }
}
