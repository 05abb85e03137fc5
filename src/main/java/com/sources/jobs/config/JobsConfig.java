package com.sources.jobs.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of the background worker, read once at startup from MicroProfile Config
 * ({@code META-INF/microprofile-config.properties}, system properties, environment).
 * Durations are ISO-8601 ({@code PT2M}). Invalid values fail fast with {@link IllegalArgumentException}.
 */
public final class JobsConfig {

    private static final Logger log = LoggerFactory.getLogger(JobsConfig.class);

    public static final String DEFAULT_QUEUE_NAME = "sources_api_jobs";

    private final QueueMode queueMode;
    private final String queueName;
    private final String redisHost;
    private final int redisPort;
    private final String redisPassword;
    private final int workerPoolSize;
    private final int workerQueueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final Duration pollTimeout;
    private final Duration reconcileInterval;
    private final Duration reconcileAgeLimit;
    private final int resendConcurrency;
    private final Duration healthPingInterval;
    private final Duration healthStaleAfter;
    private final long shutdownTimeoutSeconds;

    JobsConfig(Config config) {
        this.queueMode = QueueMode.parse(string(config, "jobs.queue.mode", "redis"));
        this.queueName = string(config, "jobs.queue.name", DEFAULT_QUEUE_NAME);
        this.redisHost = string(config, "jobs.redis.host", "localhost");
        this.redisPort = positiveInt(config, "jobs.redis.port", 6379);
        this.redisPassword = config.getOptionalValue("jobs.redis.password", String.class)
                .filter(value -> !value.isBlank())
                .orElse(null);
        this.workerPoolSize = positiveInt(config, "jobs.worker.pool-size", 4);
        this.workerQueueCapacity = positiveInt(config, "jobs.worker.queue-capacity", 100);
        this.overflowPolicy = OverflowPolicy.parse(string(config, "jobs.worker.overflow-policy", "block"));
        this.pollTimeout = positiveDuration(config, "jobs.worker.poll-timeout", Duration.ofSeconds(5));
        this.reconcileInterval = positiveDuration(config, "jobs.reconcile.interval", Duration.ofMinutes(2));
        this.reconcileAgeLimit = positiveDuration(config, "jobs.reconcile.age-limit", Duration.ofMinutes(30));
        this.resendConcurrency = positiveInt(config, "jobs.reconcile.resend-concurrency", 4);
        this.healthPingInterval = positiveDuration(config, "jobs.health.ping-interval", Duration.ofSeconds(30));
        this.healthStaleAfter = positiveDuration(config, "jobs.health.stale-after", Duration.ofSeconds(45));
        this.shutdownTimeoutSeconds = positiveInt(config, "jobs.shutdown.timeout-seconds", 30);
    }

    /**
     * Reads the configuration from the default MicroProfile Config sources.
     */
    public static JobsConfig load() {
        return load(Map.of());
    }

    /**
     * Reads the configuration from the default sources, with {@code overrides} taking precedence.
     */
    public static JobsConfig load(Map<String, String> overrides) {
        Objects.requireNonNull(overrides, "overrides cannot be null");
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDefaultInterceptors();
        if (!overrides.isEmpty()) {
            builder.withSources(new PropertiesConfigSource(overrides, "overrides", 500));
        }
        JobsConfig jobsConfig = new JobsConfig(builder.build());
        log.info("Loaded jobs configuration: {}", jobsConfig);
        return jobsConfig;
    }

    private static String string(Config config, String key, String defaultValue) {
        return config.getOptionalValue(key, String.class)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .orElse(defaultValue);
    }

    private static int positiveInt(Config config, String key, int defaultValue) {
        int value = typed(config, key, Integer.class, "an integer").orElse(defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return value;
    }

    private static Duration positiveDuration(Config config, String key, Duration defaultValue) {
        Duration value = typed(config, key, Duration.class, "an ISO-8601 duration").orElse(defaultValue);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return value;
    }

    private static <T> Optional<T> typed(Config config, String key, Class<T> type, String expected) {
        try {
            return config.getOptionalValue(key, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + " must be " + expected + ": " + e.getMessage(), e);
        }
    }

    public QueueMode queueMode() {
        return queueMode;
    }

    public String queueName() {
        return queueName;
    }

    public String redisHost() {
        return redisHost;
    }

    public int redisPort() {
        return redisPort;
    }

    public Optional<String> redisPassword() {
        return Optional.ofNullable(redisPassword);
    }

    public int workerPoolSize() {
        return workerPoolSize;
    }

    public int workerQueueCapacity() {
        return workerQueueCapacity;
    }

    public OverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    public Duration pollTimeout() {
        return pollTimeout;
    }

    public Duration reconcileInterval() {
        return reconcileInterval;
    }

    public Duration reconcileAgeLimit() {
        return reconcileAgeLimit;
    }

    public int resendConcurrency() {
        return resendConcurrency;
    }

    public Duration healthPingInterval() {
        return healthPingInterval;
    }

    public Duration healthStaleAfter() {
        return healthStaleAfter;
    }

    public long shutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    @Override
    public String toString() {
        // no password
        return "JobsConfig{" +
                "queueMode=" + queueMode +
                ", queueName='" + queueName + '\'' +
                ", redis=" + redisHost + ':' + redisPort +
                ", workerPoolSize=" + workerPoolSize +
                ", workerQueueCapacity=" + workerQueueCapacity +
                ", overflowPolicy=" + overflowPolicy +
                ", pollTimeout=" + pollTimeout +
                ", reconcileInterval=" + reconcileInterval +
                ", reconcileAgeLimit=" + reconcileAgeLimit +
                ", resendConcurrency=" + resendConcurrency +
                ", healthPingInterval=" + healthPingInterval +
                ", healthStaleAfter=" + healthStaleAfter +
                ", shutdownTimeoutSeconds=" + shutdownTimeoutSeconds +
                '}';
    }
}
