package com.sources.jobs.service.impl;

import com.sources.jobs.JobContext;
import com.sources.jobs.client.EventSender;
import com.sources.jobs.client.SuperkeyClient;
import com.sources.jobs.config.JobsConfig;
import com.sources.jobs.config.QueueMode;
import com.sources.jobs.factory.MapJobFactory;
import com.sources.jobs.queue.InMemoryJobQueue;
import com.sources.jobs.queue.JobQueue;
import com.sources.jobs.queue.RedisJobQueue;
import com.sources.jobs.repository.JpaApplicationRepository;
import com.sources.jobs.repository.JpaAuthenticationRepository;
import com.sources.jobs.repository.JpaMetaDataRepository;
import com.sources.jobs.repository.JpaSourceRepository;
import com.sources.jobs.repository.JpaTransactions;
import com.sources.jobs.service.JobExecutionService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.persistence.EntityManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the job subsystem from configuration and owns its threads: the queue consumer and pool,
 * the scheduled jobs, the health check and the resend executor.
 */
public class BackgroundWorker {

    private static final Logger log = LoggerFactory.getLogger(BackgroundWorker.class);

    private static final int RESEND_BACKLOG = 1000;

    private final JobsConfig config;
    private final JobQueue jobQueue;
    private final JobContext context;
    private final JobExecutionService jobExecutionService;
    private final JobWorker jobWorker;
    private final ScheduledJobRunner scheduledJobRunner;
    private final WorkerHealthCheck healthCheck;
    private final ScheduledExecutorService schedulerExecutor;
    private final ThreadPoolExecutor resendExecutor;

    public BackgroundWorker(JobsConfig config,
                            JobQueue jobQueue,
                            EntityManagerFactory entityManagerFactory,
                            SuperkeyClient superkeyClient,
                            EventSender eventSender,
                            Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue cannot be null");
        Objects.requireNonNull(entityManagerFactory, "entityManagerFactory cannot be null");
        Objects.requireNonNull(superkeyClient, "superkeyClient cannot be null");
        Objects.requireNonNull(eventSender, "eventSender cannot be null");
        Objects.requireNonNull(clock, "clock cannot be null");

        JpaTransactions transactions = new JpaTransactions(entityManagerFactory);
        JpaApplicationRepository applications = new JpaApplicationRepository(transactions);
        this.resendExecutor = new ThreadPoolExecutor(
                config.resendConcurrency(),
                config.resendConcurrency(),
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(RESEND_BACKLOG),
                WorkerThreads.named("job-resend-"));
        this.context = JobContext.builder()
                .jobQueue(jobQueue)
                .superkeyClient(superkeyClient)
                .resourceDestroyer(new CascadeResourceDestroyer(
                        new JpaSourceRepository(transactions), applications, eventSender))
                .applications(applications)
                .authentications(new JpaAuthenticationRepository(transactions))
                .metaData(new JpaMetaDataRepository(transactions))
                .eventSender(eventSender)
                .resendExecutor(resendExecutor)
                .clock(clock)
                .build();

        this.jobExecutionService = new JobExecutionServiceImpl(jobQueue, context);
        this.jobWorker = new JobWorker(jobQueue, context, config.workerPoolSize(), config.workerQueueCapacity(),
                config.overflowPolicy(), config.pollTimeout());
        this.schedulerExecutor = Executors.newScheduledThreadPool(2, WorkerThreads.named("job-scheduler-"));
        this.scheduledJobRunner = new ScheduledJobRunner(jobExecutionService, schedulerExecutor,
                ScheduledJobRunner.defaultSchedule(config));
        this.healthCheck = new WorkerHealthCheck(jobQueue, schedulerExecutor, config.healthPingInterval(),
                config.healthStaleAfter(), clock);
    }

    /**
     * Builds the worker with the queue selected by {@code jobs.queue.mode}.
     */
    public static BackgroundWorker create(JobsConfig config,
                                          EntityManagerFactory entityManagerFactory,
                                          SuperkeyClient superkeyClient,
                                          EventSender eventSender) {
        JobQueue jobQueue = config.queueMode() == QueueMode.REDIS
                ? RedisJobQueue.connect(config, MapJobFactory.withDefaultJobs())
                : new InMemoryJobQueue();
        return new BackgroundWorker(config, jobQueue, entityManagerFactory, superkeyClient, eventSender,
                Clock.systemDefaultZone());
    }

    @PostConstruct
    public void start() {
        log.info("Starting background worker on {} queue '{}'", config.queueMode(), config.queueName());
        healthCheck.start();
        jobWorker.start();
        scheduledJobRunner.start();
    }

    @PreDestroy
    public void stop() {
        long timeoutSeconds = config.shutdownTimeoutSeconds();
        scheduledJobRunner.stop();
        healthCheck.stop();
        jobWorker.stop(timeoutSeconds);
        WorkerThreads.shutdown("Scheduler Executor", schedulerExecutor, timeoutSeconds);
        WorkerThreads.shutdown("Resend Executor", resendExecutor, timeoutSeconds);
        jobQueue.close();
        log.info("Background worker stopped.");
    }

    /** Dispatcher for producers running in the same process. */
    public JobExecutionService getJobExecutionService() {
        return jobExecutionService;
    }

    public WorkerHealthCheck getHealthCheck() {
        return healthCheck;
    }

    public JobContext getContext() {
        return context;
    }
}
