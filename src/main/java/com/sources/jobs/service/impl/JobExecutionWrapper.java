package com.sources.jobs.service.impl;

import com.sources.jobs.FatalJobException;
import com.sources.jobs.Job;
import com.sources.jobs.JobContext;
import com.sources.jobs.JobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A Runnable responsible for executing a single job on a worker thread and logging how it ended.
 * A failed job is reported and forgotten: nothing is retried, backed off or dead-lettered.
 */
public class JobExecutionWrapper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobExecutionWrapper.class);

    private final Job job;
    private final JobContext context;

    public JobExecutionWrapper(Job job, JobContext context) {
        this.job = Objects.requireNonNull(job, "job cannot be null");
        this.context = Objects.requireNonNull(context, "context cannot be null");
    }

    public Job getJob() {
        return job;
    }

    @Override
    public void run() {
        log.info("Running job {} with {}", job.name(), job.arguments());
        long started = System.nanoTime();
        try {
            job.run(context);
            log.info("Finished job {} with {} in {} ms", job.name(), job.arguments(),
                    (System.nanoTime() - started) / 1_000_000);
        } catch (FatalJobException e) {
            log.error("Job {} with {} can never succeed, dropped: {}", job.name(), job.arguments(), e.getMessage(), e);
        } catch (JobException e) {
            log.warn("Error running job {} with {}: {}", job.name(), job.arguments(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure running job {} with {}: {}", job.name(), job.arguments(), e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "JobExecutionWrapper{" + job.name() + '}';
    }
}
