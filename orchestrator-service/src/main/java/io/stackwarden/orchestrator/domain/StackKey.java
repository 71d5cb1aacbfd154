package io.stackwarden.orchestrator.domain;

import java.util.Objects;

public record StackKey(String environmentId, String stackName) {
    public StackKey {
        Objects.requireNonNull(environmentId, "environmentId");
        Objects.requireNonNull(stackName, "stackName");
        if (environmentId.isBlank() || stackName.isBlank()) {
            throw new IllegalArgumentException("environmentId and stackName must not be blank");
        }
    }

    @Override
    public String toString() {
        return environmentId + "/" + stackName;
    }
}
