package io.stackwarden.orchestrator.domain;

import java.util.Objects;

/**
 * Identity of the deployment target a plan is built for.
 */
public record EnvironmentContext(String organizationId, String environmentId) {
    public EnvironmentContext {
        Objects.requireNonNull(environmentId, "environmentId");
        if (environmentId.isBlank()) {
            throw new IllegalArgumentException("environmentId must not be blank");
        }
        organizationId = organizationId == null || organizationId.isBlank() ? "default" : organizationId;
    }

    public StackKey stack(String stackName) {
        return new StackKey(environmentId, stackName);
    }
}
