package com.sources.jobs.model;

import java.util.List;

/**
 * Everything removed by one cascade delete, in the order destroy events should be announced.
 * {@code source} is {@code null} when only an application was deleted.
 */
public record DeletedResources(List<ApplicationAuthentication> applicationAuthentications,
                               List<Authentication> authentications,
                               List<Application> applications,
                               Source source) {

    public DeletedResources {
        applicationAuthentications = List.copyOf(applicationAuthentications);
        authentications = List.copyOf(authentications);
        applications = List.copyOf(applications);
    }
}
