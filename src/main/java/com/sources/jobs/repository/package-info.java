/**
 * Data access for the rows the job subsystem reads and deletes. Interfaces such as
 * {@link com.sources.jobs.repository.ApplicationRepository} are implemented on a resource-local
 * JPA {@link jakarta.persistence.EntityManagerFactory} through
 * {@link com.sources.jobs.repository.JpaTransactions}.
 */
package com.sources.jobs.repository;
