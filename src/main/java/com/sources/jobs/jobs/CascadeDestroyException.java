package com.sources.jobs.jobs;

import com.sources.jobs.JobException;

import java.util.List;

/**
 * One or more applications of a source could not be torn down. Every per-application failure is
 * kept, in order, and also attached as a suppressed exception so it shows up in stack traces.
 */
public class CascadeDestroyException extends JobException {

    private static final long serialVersionUID = 1L;

    private final transient List<Exception> failures;

    public CascadeDestroyException(String message, List<? extends Exception> failures) {
        super(message + " (" + failures.size() + " failed)");
        this.failures = List.copyOf(failures);
        this.failures.forEach(this::addSuppressed);
    }

    public List<Exception> getFailures() {
        return failures;
    }

    public int getFailureCount() {
        return failures.size();
    }
}
