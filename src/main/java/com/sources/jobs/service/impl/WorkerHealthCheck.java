package com.sources.jobs.service.impl;

import com.sources.jobs.queue.JobQueue;
import com.sources.jobs.queue.JobQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pings the job queue on a fixed rate and reports the worker healthy while the last successful
 * ping is recent enough. {@code staleAfter} must exceed the ping interval, otherwise the check
 * reads unhealthy just before each ping lands.
 */
public class WorkerHealthCheck {

    private static final Logger log = LoggerFactory.getLogger(WorkerHealthCheck.class);

    private final JobQueue jobQueue;
    private final ScheduledExecutorService schedulerExecutor;
    private final Duration pingInterval;
    private final Duration staleAfter;
    private final Clock clock;

    private volatile Instant lastSuccessfulPing;
    private ScheduledFuture<?> scheduledTask;

    public WorkerHealthCheck(JobQueue jobQueue,
                             ScheduledExecutorService schedulerExecutor,
                             Duration pingInterval,
                             Duration staleAfter,
                             Clock clock) {
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval cannot be null");
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        if (staleAfter.compareTo(pingInterval) <= 0) {
            throw new IllegalArgumentException("staleAfter (" + staleAfter
                    + ") must be longer than pingInterval (" + pingInterval + ")");
        }
    }

    public synchronized void start() {
        if (scheduledTask != null) {
            return;
        }
        scheduledTask = schedulerExecutor.scheduleAtFixedRate(
                this::ping, 0L, pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
    }

    /**
     * Pings the queue once, recording the time on success.
     */
    public void ping() {
        try {
            jobQueue.ping();
            lastSuccessfulPing = clock.instant();
        } catch (JobQueueException e) {
            log.warn("Failed to hit the job queue: {}", e.getMessage());
        }
    }

    public boolean isHealthy() {
        Instant last = lastSuccessfulPing;
        return last != null && !last.isBefore(clock.instant().minus(staleAfter));
    }

    public Instant getLastSuccessfulPing() {
        return lastSuccessfulPing;
    }
}
