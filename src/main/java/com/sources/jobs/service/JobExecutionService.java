package com.sources.jobs.service;

import com.sources.jobs.Job;

/**
 * Service interface for dispatching jobs to the background worker.
 */
public interface JobExecutionService {

    /**
     * Puts a job on the configured queue. The worker honors the job's delay once it takes the job.
     *
     * @param job The job to dispatch.
     * @throws com.sources.jobs.queue.JobQueueException if the queue rejects the job.
     */
    void enqueue(Job job);

    /**
     * Runs a job on the calling thread, bypassing the queue: waits out its delay, then runs it.
     * Failures are logged, never thrown.
     *
     * @param job The job to run.
     * @throws InterruptedException if interrupted while waiting out the delay.
     */
    void runNow(Job job) throws InterruptedException;
}
