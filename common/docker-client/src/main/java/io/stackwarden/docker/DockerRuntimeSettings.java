package io.stackwarden.docker;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry and timeout behaviour of {@link DockerContainerClient}. Only transient failures are retried.
 */
public record DockerRuntimeSettings(int maxAttempts, Duration retryBackoff, Duration pullTimeout) {

    public DockerRuntimeSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        Objects.requireNonNull(pullTimeout, "pullTimeout");
    }

    public static DockerRuntimeSettings defaults() {
        return new DockerRuntimeSettings(3, Duration.ofSeconds(1), Duration.ofMinutes(10));
    }
}
