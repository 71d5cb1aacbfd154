package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkDefinition(boolean external, String resolvedName) {
    public NetworkDefinition {
        Objects.requireNonNull(resolvedName, "resolvedName");
        if (resolvedName.isBlank()) {
            throw new IllegalArgumentException("resolvedName must not be blank");
        }
    }
}
