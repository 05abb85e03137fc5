package com.sources.jobs.service.impl;

import com.sources.jobs.JobContext;
import com.sources.jobs.RecordingJob;
import com.sources.jobs.config.OverflowPolicy;
import com.sources.jobs.queue.InMemoryJobQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class JobWorkerTest {

    private final InMemoryJobQueue queue = new InMemoryJobQueue();
    private JobWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop(5);
        }
    }

    private JobWorker start(int poolSize, int queueCapacity, OverflowPolicy policy) {
        worker = new JobWorker(queue, JobContext.builder().build(), poolSize, queueCapacity, policy, Duration.ofMillis(50));
        worker.start();
        return worker;
    }

    @Test
    void runsJobOnlyAfterItsDelay() throws Exception {
        start(2, 10, OverflowPolicy.BLOCK);
        RecordingJob delayed = new RecordingJob("delayed", Duration.ofMillis(300));

        long offered = System.nanoTime();
        queue.offer(delayed);

        assertThat(delayed.awaitFinished(5_000)).isTrue();
        assertThat(delayed.lastRunNanos() - offered).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(300));
    }

    @Test
    void delayedJobDoesNotHoldUpLaterImmediateJobs() throws Exception {
        start(1, 10, OverflowPolicy.BLOCK);
        RecordingJob slow = new RecordingJob("slow", Duration.ofSeconds(2));
        RecordingJob fast = RecordingJob.immediate("fast");

        queue.offer(slow);
        queue.offer(fast);

        assertThat(fast.awaitFinished(1_000)).isTrue();
        assertThat(slow.runs()).isZero();
        assertThat(worker.delayedCount()).isEqualTo(1);
    }

    @Test
    void runsJobsConcurrentlyUpToThePoolSize() throws Exception {
        start(2, 10, OverflowPolicy.BLOCK);
        CountDownLatch gate = new CountDownLatch(1);
        RecordingJob first = RecordingJob.immediate("first").blockingOn(gate);
        RecordingJob second = RecordingJob.immediate("second").blockingOn(gate);

        queue.offer(first);
        queue.offer(second);

        assertThat(first.awaitStarted(2_000)).isTrue();
        assertThat(second.awaitStarted(2_000)).isTrue();
        gate.countDown();
    }

    @Test
    void blockPolicyStopsTakingJobsWhileTheWorkerIsFull() throws Exception {
        start(1, 1, OverflowPolicy.BLOCK);
        CountDownLatch gate = new CountDownLatch(1);
        RecordingJob running = RecordingJob.immediate("running").blockingOn(gate);
        queue.offer(running);
        assertThat(running.awaitStarted(2_000)).isTrue();

        List<RecordingJob> pending = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            RecordingJob job = new RecordingJob("pending-" + i, Duration.ofMillis(10));
            pending.add(job);
            queue.offer(job);
        }
        waitUntil(() -> worker.delayedCount() + worker.backlog() == 1);
        Thread.sleep(300);

        assertThat(queue.size()).isEqualTo(9);
        assertThat(worker.delayedCount() + worker.backlog()).isEqualTo(1);
        assertThat(worker.availableCapacity()).isZero();

        gate.countDown();
        for (RecordingJob job : pending) {
            assertThat(job.awaitFinished(5_000)).isTrue();
        }
        assertThat(queue.size()).isZero();
    }

    @Test
    void dropOldestPolicyEvictsDelayedJobsWhenNothingIsWaiting() throws Exception {
        start(1, 1, OverflowPolicy.DROP_OLDEST);
        CountDownLatch gate = new CountDownLatch(1);
        RecordingJob running = RecordingJob.immediate("running").blockingOn(gate);
        RecordingJob later = new RecordingJob("later", Duration.ofMinutes(1));
        RecordingJob newest = RecordingJob.immediate("newest");

        queue.offer(running);
        assertThat(running.awaitStarted(2_000)).isTrue();
        queue.offer(later);
        waitUntil(() -> worker.delayedCount() == 1);
        queue.offer(newest);
        waitUntil(() -> queue.size() == 0 && worker.backlog() == 1);

        assertThat(worker.delayedCount()).isZero();
        gate.countDown();
        assertThat(newest.awaitFinished(2_000)).isTrue();
        assertThat(later.runs()).isZero();
    }

    @Test
    void rejectPolicyDropsJobsThatDoNotFit() throws Exception {
        start(1, 1, OverflowPolicy.REJECT);
        CountDownLatch gate = new CountDownLatch(1);
        RecordingJob running = RecordingJob.immediate("running").blockingOn(gate);
        RecordingJob waiting = RecordingJob.immediate("waiting");
        RecordingJob overflow = RecordingJob.immediate("overflow");

        queue.offer(running);
        assertThat(running.awaitStarted(2_000)).isTrue();
        queue.offer(waiting);
        waitUntil(() -> worker.backlog() == 1);
        queue.offer(overflow);
        waitUntil(() -> queue.size() == 0 && worker.delayedCount() == 0);
        Thread.sleep(100);

        gate.countDown();
        assertThat(waiting.awaitFinished(2_000)).isTrue();
        assertThat(overflow.runs()).isZero();
    }

    @Test
    void dropOldestPolicyEvictsTheLongestWaitingJob() throws Exception {
        start(1, 1, OverflowPolicy.DROP_OLDEST);
        CountDownLatch gate = new CountDownLatch(1);
        RecordingJob running = RecordingJob.immediate("running").blockingOn(gate);
        RecordingJob evicted = RecordingJob.immediate("evicted");
        RecordingJob newest = RecordingJob.immediate("newest");

        queue.offer(running);
        assertThat(running.awaitStarted(2_000)).isTrue();
        queue.offer(evicted);
        waitUntil(() -> worker.backlog() == 1);
        queue.offer(newest);
        waitUntil(() -> queue.size() == 0 && worker.delayedCount() == 0);
        Thread.sleep(100);

        gate.countDown();
        assertThat(newest.awaitFinished(2_000)).isTrue();
        assertThat(evicted.runs()).isZero();
    }

    @Test
    void failingJobDoesNotStopTheWorker() throws Exception {
        start(1, 10, OverflowPolicy.BLOCK);
        RecordingJob failing = RecordingJob.immediate("failing").failingWith(new IllegalStateException("boom"));
        RecordingJob next = RecordingJob.immediate("next");

        queue.offer(failing);
        queue.offer(next);

        assertThat(next.awaitFinished(2_000)).isTrue();
        assertThat(failing.runs()).isEqualTo(1);
    }

    @Test
    void stopDropsJobsStillWaitingOutTheirDelay() throws Exception {
        start(1, 10, OverflowPolicy.BLOCK);
        RecordingJob later = new RecordingJob("later", Duration.ofMinutes(1));
        queue.offer(later);
        waitUntil(() -> worker.delayedCount() == 1);

        worker.stop(1);

        assertThat(worker.isRunning()).isFalse();
        assertThat(worker.delayedCount()).isZero();
        assertThat(later.runs()).isZero();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }
}
