/**
 * Service interfaces of the job subsystem: dispatching, scheduled jobs and cascade deletion.
 * Implementations live in {@code service.impl}.
 */
package com.sources.jobs.service;
