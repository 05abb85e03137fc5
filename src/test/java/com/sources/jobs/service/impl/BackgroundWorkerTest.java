package com.sources.jobs.service.impl;

import com.sources.jobs.RecordingJob;
import com.sources.jobs.client.EventSender;
import com.sources.jobs.client.SuperkeyClient;
import com.sources.jobs.config.JobsConfig;
import com.sources.jobs.queue.InMemoryJobQueue;
import com.sources.jobs.queue.JobQueueException;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class BackgroundWorkerTest {

    @Mock
    private EntityManagerFactory entityManagerFactory;

    @Mock
    private SuperkeyClient superkeyClient;

    @Mock
    private EventSender eventSender;

    @Test
    void runsEnqueuedJobsAndReportsHealthUntilStopped() throws Exception {
        JobsConfig config = JobsConfig.load(Map.of(
                "jobs.queue.mode", "memory",
                "jobs.worker.poll-timeout", "PT0.05S",
                "jobs.reconcile.interval", "PT1H",
                "jobs.shutdown.timeout-seconds", "2"));
        InMemoryJobQueue queue = new InMemoryJobQueue();
        BackgroundWorker worker = new BackgroundWorker(config, queue, entityManagerFactory, superkeyClient,
                eventSender, Clock.systemDefaultZone());

        worker.start();
        try {
            RecordingJob job = RecordingJob.immediate("hello");
            worker.getJobExecutionService().enqueue(job);

            assertThat(job.awaitFinished(5_000)).isTrue();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!worker.getHealthCheck().isHealthy() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(worker.getHealthCheck().isHealthy()).isTrue();
            assertThat(worker.getContext().jobQueue()).isSameAs(queue);
        } finally {
            worker.stop();
        }

        assertThatThrownBy(queue::ping).isInstanceOf(JobQueueException.class);
    }
}
