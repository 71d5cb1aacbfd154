package io.stackwarden.orchestrator.domain;

import java.util.Objects;

/**
 * Observed health of one service container.
 */
public record ServiceHealth(String name,
                            String containerId,
                            String containerName,
                            HealthStatus status,
                            int restartCount,
                            String reason) {
    public ServiceHealth {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
    }

    public static ServiceHealth missing(String name, String containerName) {
        return new ServiceHealth(name, null, containerName, HealthStatus.UNHEALTHY, 0, "container missing");
    }
}
