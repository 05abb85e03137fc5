package com.sources.jobs.jobs;

import com.sources.jobs.Job;
import com.sources.jobs.JobContext;
import com.sources.jobs.JobException;
import com.sources.jobs.model.RetryCandidate;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

/**
 * Periodic reconciliation of applications whose creation never completed. Each run claims the
 * applications still worth retrying in one transaction, and only after that transaction committed
 * re-sends their create events to the application types that opted in.
 * <p>
 * Runs only from the in-process scheduler, so it is never serialized.
 */
public class RetryCreateJob implements Job {

    private static final Logger log = LoggerFactory.getLogger(RetryCreateJob.class);

    public static final String NAME = "RetryCreateJob";

    /** Number of reconciliation passes an application gets before it is left alone. */
    public static final int RETRY_MAX = 5;

    public static final Duration DEFAULT_AGE_LIMIT = Duration.ofMinutes(30);

    private final Duration ageLimit;

    public RetryCreateJob() {
        this(DEFAULT_AGE_LIMIT);
    }

    public RetryCreateJob(Duration ageLimit) {
        this.ageLimit = Objects.requireNonNull(ageLimit, "ageLimit cannot be null");
        if (ageLimit.isNegative() || ageLimit.isZero()) {
            throw new IllegalArgumentException("ageLimit must be positive");
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration delay() {
        return Duration.ZERO;
    }

    @Override
    public Map<String, Object> arguments() {
        return Map.of("retry_max", RETRY_MAX, "age_limit", ageLimit.toString());
    }

    public Duration getAgeLimit() {
        return ageLimit;
    }

    @Override
    public void run(JobContext context) throws JobException {
        LocalDateTime createdAfter = LocalDateTime.now(context.clock()).minus(ageLimit);

        List<RetryCandidate> candidates;
        try {
            candidates = context.applications().claimRetryCandidates(RETRY_MAX, createdAfter);
        } catch (PersistenceException e) {
            throw new JobPersistenceException("Failed to claim applications for create retry", e);
        }
        if (candidates.isEmpty()) {
            return;
        }

        CreateEventResender resender = new CreateEventResender(context);
        for (RetryCandidate candidate : candidates) {
            try {
                context.resendExecutor().execute(() -> resender.resend(candidate));
            } catch (RejectedExecutionException e) {
                log.warn("Could not schedule create event resend for application {}: {}",
                        candidate.applicationId(), e.getMessage());
            }
        }
        log.info("Dispatched create event resends for {} applications", candidates.size());
    }

    @Override
    public byte[] serialize() {
        throw new UnsupportedOperationException(NAME + " runs from the scheduler only and is never queued");
    }

    @Override
    public String toString() {
        return "RetryCreateJob{ageLimit=" + ageLimit + '}';
    }
}
