/**
 * Job queues: the {@link com.sources.jobs.queue.JobRequest} envelope, a durable Redis list and a
 * process-local queue.
 */
package com.sources.jobs.queue;
