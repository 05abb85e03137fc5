package com.sources.jobs.service.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread naming and shutdown helpers shared by the worker's executors.
 */
final class WorkerThreads {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreads.class);

    private WorkerThreads() {
    }

    /** Daemon threads, so a worker that was never stopped does not keep the JVM alive. */
    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> daemon(runnable, prefix + counter.incrementAndGet());
    }

    static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }

    /**
     * Stops accepting work, waits up to {@code timeoutSeconds} for running tasks, then interrupts them.
     */
    static void shutdown(String name, ExecutorService executor, long timeoutSeconds) {
        log.info("Shutting down {}...", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate in {} seconds.", name, timeoutSeconds);
                List<Runnable> droppedTasks = executor.shutdownNow();
                log.warn("Forcefully shutting down {}. {} tasks were dropped.", name, droppedTasks.size());
                if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("{} did not terminate even after forceful shutdown.", name);
                }
            } else {
                log.info("{} terminated gracefully.", name);
            }
        } catch (InterruptedException ie) {
            log.warn("{} shutdown interrupted. Forcing shutdown now.", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
