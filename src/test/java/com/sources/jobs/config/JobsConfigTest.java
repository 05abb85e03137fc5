package com.sources.jobs.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobsConfigTest {

    @Test
    void defaultsComeFromTheBundledProperties() {
        JobsConfig config = JobsConfig.load();

        assertThat(config.queueMode()).isEqualTo(QueueMode.REDIS);
        assertThat(config.queueName()).isEqualTo("sources_api_jobs");
        assertThat(config.redisHost()).isEqualTo("localhost");
        assertThat(config.redisPort()).isEqualTo(6379);
        assertThat(config.redisPassword()).isEmpty();
        assertThat(config.workerPoolSize()).isEqualTo(4);
        assertThat(config.workerQueueCapacity()).isEqualTo(100);
        assertThat(config.overflowPolicy()).isEqualTo(OverflowPolicy.BLOCK);
        assertThat(config.reconcileInterval()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.reconcileAgeLimit()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.healthPingInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.healthStaleAfter()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.shutdownTimeoutSeconds()).isEqualTo(30);
    }

    @Test
    void overridesTakePrecedence() {
        JobsConfig config = JobsConfig.load(Map.of(
                "jobs.queue.mode", "MEMORY",
                "jobs.worker.pool-size", "8",
                "jobs.worker.overflow-policy", "drop-oldest",
                "jobs.reconcile.interval", "PT10S",
                "jobs.redis.password", "secret"));

        assertThat(config.queueMode()).isEqualTo(QueueMode.MEMORY);
        assertThat(config.workerPoolSize()).isEqualTo(8);
        assertThat(config.overflowPolicy()).isEqualTo(OverflowPolicy.DROP_OLDEST);
        assertThat(config.reconcileInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.redisPassword()).contains("secret");
        assertThat(config.toString()).doesNotContain("secret");
    }

    @Test
    void rejectsUnknownOverflowPolicy() {
        assertThatThrownBy(() -> JobsConfig.load(Map.of("jobs.worker.overflow-policy", "spill")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spill");
    }

    @Test
    void rejectsUnknownQueueMode() {
        assertThatThrownBy(() -> JobsConfig.load(Map.of("jobs.queue.mode", "kafka")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMalformedAndNonPositiveDurations() {
        assertThatThrownBy(() -> JobsConfig.load(Map.of("jobs.reconcile.interval", "2 minutes")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jobs.reconcile.interval");
        assertThatThrownBy(() -> JobsConfig.load(Map.of("jobs.health.stale-after", "PT0S")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
    }

    @Test
    void rejectsNonPositiveCounts() {
        assertThatThrownBy(() -> JobsConfig.load(Map.of("jobs.worker.pool-size", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jobs.worker.pool-size");
        assertThatThrownBy(() -> JobsConfig.load(Map.of("jobs.worker.queue-capacity", "lots")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be an integer");
    }
}
