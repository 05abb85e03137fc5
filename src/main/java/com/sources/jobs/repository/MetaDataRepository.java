package com.sources.jobs.repository;

/**
 * Lookups against the per-application-type {@link com.sources.jobs.model.MetaData} table.
 */
public interface MetaDataRepository {

    /**
     * Whether applications of this type opted into having their create events re-sent by the
     * reconciliation job.
     */
    boolean applicationOptedIntoRetry(long applicationTypeId);
}
