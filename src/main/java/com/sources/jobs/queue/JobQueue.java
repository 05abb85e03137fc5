package com.sources.jobs.queue;

import com.sources.jobs.Job;

import java.time.Duration;
import java.util.Optional;

/**
 * The channel between job producers and the worker. One instance is created at startup and
 * handed to everything that enqueues or consumes jobs.
 */
public interface JobQueue extends AutoCloseable {

    /**
     * Appends a job to the tail of the queue.
     *
     * @throws JobQueueException if the queue is closed or its backing store is unreachable.
     */
    void offer(Job job);

    /**
     * Takes the job at the head of the queue, waiting up to {@code timeout} for one to arrive.
     *
     * @return The job, or empty if none arrived in time or the message could not be decoded.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    Optional<Job> poll(Duration timeout) throws InterruptedException;

    /**
     * Checks that the backing store is reachable.
     *
     * @throws JobQueueException if it is not.
     */
    void ping();

    @Override
    void close();
}
