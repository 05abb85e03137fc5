package com.sources.jobs.queue;

import com.sources.jobs.jobs.AsyncDestroyJob;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobQueueTest {

    private final InMemoryJobQueue queue = new InMemoryJobQueue();

    @Test
    void pollsInArrivalOrder() throws Exception {
        AsyncDestroyJob first = new AsyncDestroyJob(List.of(), 1L, 0, "application", 1L);
        AsyncDestroyJob second = new AsyncDestroyJob(List.of(), 1L, 0, "application", 2L);
        queue.offer(first);
        queue.offer(second);

        assertThat(queue.poll(Duration.ofMillis(10))).containsSame(first);
        assertThat(queue.poll(Duration.ofMillis(10))).containsSame(second);
    }

    @Test
    void pollTimesOutEmpty() throws Exception {
        assertThat(queue.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void closedQueueRejectsOffersAndFailsPing() {
        queue.ping();
        queue.close();

        assertThatThrownBy(() -> queue.offer(new AsyncDestroyJob(List.of(), 1L, 0, "source", 1L)))
                .isInstanceOf(JobQueueException.class);
        assertThatThrownBy(queue::ping).isInstanceOf(JobQueueException.class);
    }
}
