package com.sources.jobs.model;

/**
 * The projection of an application selected by a reconciliation tick.
 */
public record RetryCandidate(long applicationId, long applicationTypeId, long tenantId) {
}
