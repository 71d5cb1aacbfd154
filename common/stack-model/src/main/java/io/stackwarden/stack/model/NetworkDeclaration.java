package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Network as declared by a stack description. External networks already exist on the host and
 * are referenced by {@code externalName} (or the logical name when absent).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkDeclaration(boolean external, String externalName) {

    public static NetworkDeclaration managed() {
        return new NetworkDeclaration(false, null);
    }

    public static NetworkDeclaration external(String externalName) {
        return new NetworkDeclaration(true, externalName);
    }
}
