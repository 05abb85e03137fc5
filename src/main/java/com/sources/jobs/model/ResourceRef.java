package com.sources.jobs.model;

import java.util.Objects;

/**
 * A tenant-scoped reference to a Source or Application.
 */
public record ResourceRef(long tenantId, ResourceKind kind, long id) {

    public ResourceRef {
        Objects.requireNonNull(kind, "kind cannot be null");
    }
}
