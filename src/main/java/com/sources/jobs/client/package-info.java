/**
 * Boundaries to services outside this subsystem: the provisioning backend and the event bus.
 */
package com.sources.jobs.client;
