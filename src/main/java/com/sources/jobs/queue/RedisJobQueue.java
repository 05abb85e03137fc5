package com.sources.jobs.queue;

import com.sources.jobs.FatalJobException;
import com.sources.jobs.Job;
import com.sources.jobs.config.JobsConfig;
import com.sources.jobs.factory.JobFactory;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable queue on a Redis list: producers {@code RPUSH} a {@link JobRequest}, the worker {@code BLPOP}s it.
 * Popping uses its own connection so a blocked consumer never stalls producers or health pings.
 * A message is removed from Redis when popped; if the process dies before the job runs, it is lost.
 */
public class RedisJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisJobQueue.class);

    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(10);

    private final RedisCommands<String, String> producer;
    private final RedisCommands<String, String> consumer;
    private final String queueName;
    private final JobFactory jobFactory;
    private final AutoCloseable resources;

    public RedisJobQueue(RedisCommands<String, String> producer,
                         RedisCommands<String, String> consumer,
                         String queueName,
                         JobFactory jobFactory,
                         AutoCloseable resources) {
        this.producer = Objects.requireNonNull(producer, "producer cannot be null");
        this.consumer = Objects.requireNonNull(consumer, "consumer cannot be null");
        this.queueName = Objects.requireNonNull(queueName, "queueName cannot be null");
        this.jobFactory = Objects.requireNonNull(jobFactory, "jobFactory cannot be null");
        this.resources = resources;
    }

    /**
     * Opens the producer and consumer connections described by the configuration.
     */
    public static RedisJobQueue connect(JobsConfig config, JobFactory jobFactory) {
        RedisURI.Builder builder = RedisURI.builder()
                .withHost(config.redisHost())
                .withPort(config.redisPort());
        config.redisPassword().ifPresent(password -> builder.withPassword(password.toCharArray()));
        RedisClient client = RedisClient.create(builder.build());
        StatefulRedisConnection<String, String> producerConnection = client.connect();
        producerConnection.setTimeout(COMMAND_TIMEOUT);
        StatefulRedisConnection<String, String> consumerConnection = client.connect();
        // BLPOP holds the connection for the whole poll timeout.
        consumerConnection.setTimeout(config.pollTimeout().plus(COMMAND_TIMEOUT));
        log.info("Connected job queue '{}' to redis {}:{}", config.queueName(), config.redisHost(), config.redisPort());
        return new RedisJobQueue(producerConnection.sync(), consumerConnection.sync(), config.queueName(), jobFactory,
                () -> {
                    consumerConnection.close();
                    producerConnection.close();
                    client.shutdown();
                });
    }

    @Override
    public void offer(Job job) {
        Objects.requireNonNull(job, "job cannot be null");
        String message = new String(JobRequest.of(job).toBytes(), StandardCharsets.UTF_8);
        try {
            producer.rpush(queueName, message);
        } catch (RedisException e) {
            throw new JobQueueException("Failed to push " + job.name() + " onto " + queueName, e);
        }
    }

    @Override
    public Optional<Job> poll(Duration timeout) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }
        KeyValue<String, String> popped;
        try {
            popped = consumer.blpop(Math.max(1L, timeout.toSeconds()), queueName);
        } catch (RedisException e) {
            throw new JobQueueException("Failed to pop from " + queueName, e);
        }
        if (popped == null || !popped.hasValue()) {
            return Optional.empty();
        }
        return decode(popped.getValue());
    }

    private Optional<Job> decode(String message) {
        JobRequest request;
        try {
            request = JobRequest.fromBytes(message.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Dropping undecodable message from {}: {}", queueName, e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(jobFactory.create(request.jobName(), request.jobRaw()));
        } catch (FatalJobException e) {
            log.warn("Dropping job {} from {}: {}", request.jobName(), queueName, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void ping() {
        try {
            String reply = producer.ping();
            if (!"PONG".equalsIgnoreCase(reply)) {
                throw new JobQueueException("Unexpected ping reply from redis: " + reply);
            }
        } catch (RedisException e) {
            throw new JobQueueException("Redis ping failed", e);
        }
    }

    @Override
    public void close() {
        if (resources == null) {
            return;
        }
        try {
            resources.close();
        } catch (Exception e) {
            log.warn("Failed to close redis connections of {}: {}", queueName, e.getMessage(), e);
        }
    }
}
