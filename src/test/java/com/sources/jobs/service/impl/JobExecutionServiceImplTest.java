package com.sources.jobs.service.impl;

import com.sources.jobs.JobContext;
import com.sources.jobs.RecordingJob;
import com.sources.jobs.queue.InMemoryJobQueue;
import com.sources.jobs.queue.JobQueueException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobExecutionServiceImplTest {

    private final InMemoryJobQueue queue = new InMemoryJobQueue();
    private final JobExecutionServiceImpl service = new JobExecutionServiceImpl(queue, JobContext.builder().build());

    @Test
    void enqueuePutsTheJobOnTheQueue() throws Exception {
        RecordingJob job = RecordingJob.immediate("queued");

        service.enqueue(job);

        assertThat(queue.poll(Duration.ZERO)).containsSame(job);
        assertThat(job.runs()).isZero();
    }

    @Test
    void enqueuePropagatesQueueFailures() {
        queue.close();

        assertThatThrownBy(() -> service.enqueue(RecordingJob.immediate("late")))
                .isInstanceOf(JobQueueException.class);
    }

    @Test
    void runNowWaitsOutTheDelayOnTheCallingThread() throws Exception {
        RecordingJob job = new RecordingJob("now", Duration.ofMillis(100));

        long started = System.nanoTime();
        service.runNow(job);

        assertThat(job.runs()).isEqualTo(1);
        assertThat(job.lastRunNanos() - started).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    void runNowLogsFailuresInsteadOfThrowing() throws Exception {
        RecordingJob job = RecordingJob.immediate("boom").failingWith(new IllegalStateException("boom"));

        service.runNow(job);

        assertThat(job.runs()).isEqualTo(1);
    }
}
