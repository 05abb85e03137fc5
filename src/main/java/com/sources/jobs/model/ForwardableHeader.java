package com.sources.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A request header forwarded with every event raised on behalf of a tenant
 * ({@code x-rh-identity}, {@code x-rh-sources-org-id}, ...).
 */
public record ForwardableHeader(@JsonProperty("key") String key, @JsonProperty("value") String value) {

    public static final String IDENTITY = "x-rh-identity";
    public static final String ACCOUNT_NUMBER = "x-rh-sources-account-number";
    public static final String ORG_ID = "x-rh-sources-org-id";

    public ForwardableHeader {
        Objects.requireNonNull(key, "key cannot be null");
    }
}
