/**
 * Name-keyed registry that turns dispatch envelopes back into {@link com.sources.jobs.Job} instances.
 */
package com.sources.jobs.factory;
