package com.sources.jobs.client;

import com.sources.jobs.model.ResourceRef;

/**
 * Client for the provisioning backend ("superkey") that owns the cloud-side resources of
 * superkey-managed sources.
 */
public interface SuperkeyClient {

    /**
     * Asks the provisioning backend to tear down what it created for the referenced resource.
     *
     * @param identity The identity header value the request is sent on behalf of.
     * @param ref      The resource being destroyed.
     * @throws SuperkeyRequestException if the request could not be delivered or was refused.
     */
    void sendDeleteRequest(String identity, ResourceRef ref) throws SuperkeyRequestException;
}
