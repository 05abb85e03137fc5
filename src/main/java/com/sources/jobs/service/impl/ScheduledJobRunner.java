package com.sources.jobs.service.impl;

import com.sources.jobs.config.JobsConfig;
import com.sources.jobs.jobs.RetryCreateJob;
import com.sources.jobs.service.JobExecutionService;
import com.sources.jobs.service.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs every {@link ScheduledJob} forever: wait the interval, run the job through
 * {@link JobExecutionService#runNow}, repeat. The next wait starts when the run ends, so the
 * cadence drifts by the job's runtime. A failing run never stops later runs.
 */
public class ScheduledJobRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobRunner.class);

    private final JobExecutionService jobExecutionService;
    private final ScheduledExecutorService schedulerExecutor;
    private final List<ScheduledJob> schedule;
    private final List<ScheduledFuture<?>> scheduledTasks = new ArrayList<>();

    public ScheduledJobRunner(JobExecutionService jobExecutionService,
                              ScheduledExecutorService schedulerExecutor,
                              List<ScheduledJob> schedule) {
        this.jobExecutionService = Objects.requireNonNull(jobExecutionService, "jobExecutionService cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.schedule = List.copyOf(Objects.requireNonNull(schedule, "schedule cannot be null"));
    }

    /**
     * The jobs every worker runs on a schedule: create-retry reconciliation.
     */
    public static List<ScheduledJob> defaultSchedule(JobsConfig config) {
        return List.of(new ScheduledJob(config.reconcileInterval(), new RetryCreateJob(config.reconcileAgeLimit())));
    }

    @PostConstruct
    public synchronized void start() {
        if (schedulerExecutor.isShutdown() || schedulerExecutor.isTerminated()) {
            log.error("Cannot start ScheduledJobRunner: schedulerExecutor is shut down or terminated.");
            return;
        }
        log.info("Running {} scheduled jobs", schedule.size());
        for (ScheduledJob scheduledJob : schedule) {
            long intervalMillis = scheduledJob.interval().toMillis();
            scheduledTasks.add(schedulerExecutor.scheduleWithFixedDelay(
                    () -> runOnce(scheduledJob), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS));
            log.info("Running job {} on interval {}", scheduledJob.job().name(), scheduledJob.interval());
        }
    }

    @PreDestroy
    public synchronized void stop() {
        log.info("Stopping ScheduledJobRunner...");
        scheduledTasks.forEach(task -> task.cancel(false));
        scheduledTasks.clear();
    }

    public List<ScheduledJob> getSchedule() {
        return schedule;
    }

    void runOnce(ScheduledJob scheduledJob) {
        try {
            jobExecutionService.runNow(scheduledJob.job());
        } catch (InterruptedException e) {
            log.debug("Scheduled job {} interrupted", scheduledJob.job().name());
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every later run.
            log.error("Error during scheduled run of {}: {}", scheduledJob.job().name(), e.getMessage(), e);
        }
    }
}
