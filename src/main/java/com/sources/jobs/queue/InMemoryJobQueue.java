package com.sources.jobs.queue;

import com.sources.jobs.Job;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Process-local FIFO queue. Jobs are kept as objects, never serialized, and are lost on restart.
 */
public class InMemoryJobQueue implements JobQueue {

    private final BlockingQueue<Job> jobs = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    @Override
    public void offer(Job job) {
        Objects.requireNonNull(job, "job cannot be null");
        if (closed) {
            throw new JobQueueException("Queue is closed, cannot accept " + job.name());
        }
        jobs.add(job);
    }

    @Override
    public Optional<Job> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(jobs.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void ping() {
        if (closed) {
            throw new JobQueueException("Queue is closed");
        }
    }

    public int size() {
        return jobs.size();
    }

    @Override
    public void close() {
        closed = true;
    }
}
