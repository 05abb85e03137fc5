package com.sources.jobs.service.impl;

import com.sources.jobs.Job;
import com.sources.jobs.JobContext;
import com.sources.jobs.config.OverflowPolicy;
import com.sources.jobs.queue.JobQueue;
import com.sources.jobs.queue.JobQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Consumes jobs from a {@link JobQueue} and runs them on a bounded pool.
 * <p>
 * A consumer thread takes one job at a time from the queue and parks it in a {@link DelayQueue}.
 * A timer thread hands each job to the pool once its delay has elapsed, so waiting jobs never hold
 * a pool thread.
 * <p>
 * At most {@code poolSize + queueCapacity} jobs are held in memory at once, counting delayed,
 * waiting and running jobs. At that limit the {@link OverflowPolicy} applies to the consumer:
 * {@code BLOCK} stops polling until a job finishes, {@code REJECT} drops the job just taken and
 * {@code DROP_OLDEST} evicts the oldest job that has not started yet.
 */
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private static final Duration QUEUE_FAILURE_BACKOFF = Duration.ofSeconds(1);

    private final JobQueue jobQueue;
    private final JobContext context;
    private final Duration pollTimeout;
    private final OverflowPolicy overflowPolicy;
    private final DelayQueue<DelayedJob> delayed = new DelayQueue<>();
    private final Semaphore inMemory;
    private final ThreadPoolExecutor executor;

    private volatile boolean running;
    private Thread consumerThread;
    private Thread timerThread;

    public JobWorker(JobQueue jobQueue,
                     JobContext context,
                     int poolSize,
                     int queueCapacity,
                     OverflowPolicy overflowPolicy,
                     Duration pollTimeout) {
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue cannot be null");
        this.context = Objects.requireNonNull(context, "context cannot be null");
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy cannot be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout cannot be null");
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.inMemory = new Semaphore(poolSize + queueCapacity);
        this.executor = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                WorkerThreads.named("job-worker-"),
                waitForSpace());
        // waitForSpace puts straight into the work queue, which needs live threads to drain it.
        this.executor.prestartAllCoreThreads();
        log.info("JobWorker initialized with poolSize={}, queueCapacity={}, overflowPolicy={}",
                poolSize, queueCapacity, overflowPolicy);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("JobWorker cannot be restarted after stop");
        }
        running = true;
        consumerThread = WorkerThreads.daemon(this::consumeLoop, "job-consumer");
        timerThread = WorkerThreads.daemon(this::timerLoop, "job-timer");
        consumerThread.start();
        timerThread.start();
        log.info("JobWorker started.");
    }

    /**
     * Stops taking jobs, drops the ones still waiting out their delay and waits up to
     * {@code timeoutSeconds} for running jobs before interrupting them.
     */
    public synchronized void stop(long timeoutSeconds) {
        if (!running) {
            return;
        }
        running = false;
        consumerThread.interrupt();
        timerThread.interrupt();
        joinQuietly(consumerThread, timeoutSeconds);
        joinQuietly(timerThread, timeoutSeconds);
        int dropped = delayed.size();
        delayed.clear();
        if (dropped > 0) {
            log.warn("Dropped {} delayed jobs that were not yet due.", dropped);
        }
        WorkerThreads.shutdown("Job Executor", executor, timeoutSeconds);
    }

    public boolean isRunning() {
        return running;
    }

    /** Jobs taken from the queue that are still waiting out their delay. */
    public int delayedCount() {
        return delayed.size();
    }

    /** Jobs due and waiting for a free pool thread. */
    public int backlog() {
        return executor.getQueue().size();
    }

    /** Room left before the overflow policy applies. */
    public int availableCapacity() {
        return inMemory.availablePermits();
    }

    private void consumeLoop() {
        while (running) {
            try {
                if (overflowPolicy == OverflowPolicy.BLOCK) {
                    inMemory.acquire();
                    takeReserved();
                } else {
                    jobQueue.poll(pollTimeout).ifPresent(this::admit);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (JobQueueException e) {
                log.warn("Failed to take a job from the queue: {}", e.getMessage());
                if (!sleep(QUEUE_FAILURE_BACKOFF)) {
                    break;
                }
            }
        }
        log.debug("Job consumer stopped.");
    }

    private void takeReserved() throws InterruptedException {
        Optional<Job> job;
        try {
            job = jobQueue.poll(pollTimeout);
        } catch (InterruptedException | RuntimeException e) {
            inMemory.release();
            throw e;
        }
        if (job.isPresent()) {
            schedule(job.get());
        } else {
            inMemory.release();
        }
    }

    private void admit(Job job) {
        if (inMemory.tryAcquire()) {
            schedule(job);
            return;
        }
        if (overflowPolicy == OverflowPolicy.DROP_OLDEST && evictOldest()) {
            // the evicted job's slot passes to this one
            schedule(job);
            return;
        }
        log.warn("Worker full, dropped job {} with {}", job.name(), job.arguments());
    }

    private boolean evictOldest() {
        Runnable waiting = executor.getQueue().poll();
        if (waiting != null) {
            log.warn("Worker full, dropped oldest waiting {}", waiting);
            return true;
        }
        DelayedJob oldest = null;
        for (DelayedJob candidate : delayed) {
            if (oldest == null || candidate.sequence() < oldest.sequence()) {
                oldest = candidate;
            }
        }
        if (oldest != null && delayed.remove(oldest)) {
            log.warn("Worker full, dropped oldest delayed job {} with {}",
                    oldest.job().name(), oldest.job().arguments());
            return true;
        }
        return false;
    }

    private void schedule(Job job) {
        log.debug("Received job {} with {}, delay {}", job.name(), job.arguments(), job.delay());
        delayed.put(new DelayedJob(job, job.delay()));
    }

    private void timerLoop() {
        while (running) {
            try {
                dispatch(delayed.take().job());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Job timer stopped.");
    }

    private void dispatch(Job job) {
        try {
            executor.execute(new Admitted(new JobExecutionWrapper(job, context)));
        } catch (RejectedExecutionException e) {
            inMemory.release();
            log.warn("Dropped job {} with {}: {}", job.name(), job.arguments(), e.getMessage());
        }
    }

    /**
     * A job finishing frees its slot just before its thread is free, so a due job can briefly find
     * the work queue full. It waits for the thread instead of being dropped.
     */
    private static RejectedExecutionHandler waitForSpace() {
        return (task, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("worker is shutting down");
            }
            try {
                pool.getQueue().put(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RejectedExecutionException("interrupted while waiting for a free worker", e);
            }
        };
    }

    /** Frees the job's in-memory slot once it has run. */
    private final class Admitted implements Runnable {

        private final JobExecutionWrapper wrapper;

        private Admitted(JobExecutionWrapper wrapper) {
            this.wrapper = wrapper;
        }

        @Override
        public void run() {
            try {
                wrapper.run();
            } finally {
                inMemory.release();
            }
        }

        @Override
        public String toString() {
            Job job = wrapper.getJob();
            return "job " + job.name() + " with " + job.arguments();
        }
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void joinQuietly(Thread thread, long timeoutSeconds) {
        try {
            thread.join(TimeUnit.SECONDS.toMillis(timeoutSeconds));
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for {} to stop.", thread.getName());
            Thread.currentThread().interrupt();
        }
    }
}
