package io.stackwarden.orchestrator.domain;

import java.util.List;
import java.util.Objects;

/**
 * Health of infrastructure a stack depends on (databases, caches, external endpoints).
 */
public record InfraHealth(List<Component> components) {
    public InfraHealth {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public HealthStatus status() {
        return HealthStatus.worstOf(components.stream().map(Component::status).toList());
    }

    public record Component(String name, HealthStatus status, String detail) {
        public Component {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(status, "status");
        }
    }
}
