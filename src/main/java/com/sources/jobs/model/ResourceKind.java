package com.sources.jobs.model;

import com.sources.jobs.FatalJobException;

import java.util.Locale;

/**
 * The resource types the destroy workflow knows how to tear down.
 */
public enum ResourceKind {
    SOURCE("source", "Source"),
    APPLICATION("application", "Application");

    private final String model;
    private final String resourceType;

    ResourceKind(String model, String resourceType) {
        this.model = model;
        this.resourceType = resourceType;
    }

    /**
     * The lowercase discriminator carried in job payloads ({@code "source"}, {@code "application"}).
     */
    public String model() {
        return model;
    }

    /**
     * The resource type name used for polymorphic references and event names.
     */
    public String resourceType() {
        return resourceType;
    }

    /**
     * Resolves a job payload's model string, ignoring case.
     *
     * @throws FatalJobException if the model is not a supported kind.
     */
    public static ResourceKind fromModel(String model) throws FatalJobException {
        if (model != null) {
            String normalized = model.toLowerCase(Locale.ROOT);
            for (ResourceKind kind : values()) {
                if (kind.model.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new FatalJobException("Unsupported resource model: " + model);
    }
}
