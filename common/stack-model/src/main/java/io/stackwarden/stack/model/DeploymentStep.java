package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One container to realize, in plan order. {@code networks} carries resolved (runtime) network
 * names; the first entry is the container's primary network.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeploymentStep(String contextName,
                             String image,
                             String version,
                             String containerName,
                             boolean internal,
                             Map<String, String> env,
                             List<String> ports,
                             Map<String, String> volumes,
                             List<String> dependsOn,
                             int order,
                             List<String> networks,
                             boolean ignoreDuringMaintenance,
                             EndpointHealthCheck healthCheck,
                             ServiceLifecycle lifecycle) {
    public DeploymentStep {
        if (contextName == null || contextName.isBlank()) {
            throw new IllegalArgumentException("contextName must not be blank");
        }
        if (containerName == null || containerName.isBlank()) {
            throw new IllegalArgumentException("containerName must not be blank");
        }
        if (order < 0) {
            throw new IllegalArgumentException("order must not be negative");
        }
        env = env == null || env.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        ports = ports == null ? List.of() : List.copyOf(ports);
        volumes = volumes == null || volumes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(volumes));
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        networks = networks == null ? List.of() : List.copyOf(networks);
        lifecycle = lifecycle == null ? ServiceLifecycle.SERVICE : lifecycle;
    }

    public boolean init() {
        return lifecycle == ServiceLifecycle.INIT;
    }

    public ImageReference imageReference() {
        return ImageReference.parse(image, version);
    }
}
