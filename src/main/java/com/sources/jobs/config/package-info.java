/**
 * Worker settings and the enums they parse into.
 */
package com.sources.jobs.config;
