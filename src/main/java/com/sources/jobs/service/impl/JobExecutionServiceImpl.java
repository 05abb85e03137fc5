package com.sources.jobs.service.impl;

import com.sources.jobs.Job;
import com.sources.jobs.JobContext;
import com.sources.jobs.queue.JobQueue;
import com.sources.jobs.service.JobExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of the JobExecutionService, backed by one {@link JobQueue}.
 */
public class JobExecutionServiceImpl implements JobExecutionService {

    private static final Logger log = LoggerFactory.getLogger(JobExecutionServiceImpl.class);

    private final JobQueue jobQueue;
    private final JobContext context;

    public JobExecutionServiceImpl(JobQueue jobQueue, JobContext context) {
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue cannot be null");
        this.context = Objects.requireNonNull(context, "context cannot be null");
    }

    @Override
    public void enqueue(Job job) {
        Objects.requireNonNull(job, "job cannot be null");
        log.info("Enqueuing job {} with {}", job.name(), job.arguments());
        jobQueue.offer(job);
    }

    @Override
    public void runNow(Job job) throws InterruptedException {
        Objects.requireNonNull(job, "job cannot be null");
        Duration delay = job.delay();
        if (!delay.isZero() && !delay.isNegative()) {
            log.debug("Waiting {} before running job {}", delay, job.name());
            Thread.sleep(delay.toMillis());
        }
        new JobExecutionWrapper(job, context).run();
    }
}
