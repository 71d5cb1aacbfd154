package io.stackwarden.orchestrator.domain;

import java.util.List;

/**
 * Health of the stack's own service containers.
 */
public record SelfHealth(List<ServiceHealth> services) {
    public SelfHealth {
        services = services == null ? List.of() : List.copyOf(services);
    }

    public HealthStatus status() {
        return HealthStatus.worstOf(services.stream().map(ServiceHealth::status).toList());
    }

    public long healthyCount() {
        return services.stream().filter(service -> service.status() == HealthStatus.HEALTHY).count();
    }
}
