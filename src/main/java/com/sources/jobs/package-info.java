/**
 * Provides the core abstractions of the background job subsystem: the {@link com.sources.jobs.Job}
 * contract, the {@link com.sources.jobs.JobContext} handed to running jobs, and the job error taxonomy.
 * Queues, the worker, the scheduler and the concrete jobs live in the sub-packages.
 */
package com.sources.jobs;
