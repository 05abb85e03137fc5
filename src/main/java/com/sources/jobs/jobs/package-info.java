/**
 * The concrete jobs: the two phases of a superkey destroy and the create-retry reconciliation.
 */
package com.sources.jobs.jobs;
