package io.stackwarden.stack.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one lifecycle run. {@code deployedContexts} lists, in execution order, only the
 * contexts whose step completed.
 */
public record DeploymentResult(boolean success,
                               String stackVersion,
                               List<String> deployedContexts,
                               List<String> errors,
                               List<String> warnings,
                               Instant completedAt) {
    public DeploymentResult {
        deployedContexts = deployedContexts == null ? List.of() : List.copyOf(deployedContexts);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        completedAt = Objects.requireNonNull(completedAt, "completedAt");
    }

    public static DeploymentResult failure(String stackVersion, String error, Instant completedAt) {
        return new DeploymentResult(false, stackVersion, List.of(), List.of(error), List.of(), completedAt);
    }

    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
