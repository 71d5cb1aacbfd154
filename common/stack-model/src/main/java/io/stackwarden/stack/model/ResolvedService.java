package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One service of a resolved stack description. Variables are already substituted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolvedService(@NotBlank String name,
                              @NotBlank String image,
                              String version,
                              String containerName,
                              boolean internal,
                              Map<String, String> env,
                              List<String> ports,
                              Map<String, String> volumes,
                              List<String> dependsOn,
                              List<String> networks,
                              boolean ignoreDuringMaintenance,
                              @Valid EndpointHealthCheck healthCheck,
                              ServiceLifecycle lifecycle) {
    public ResolvedService {
        name = requireNonBlank(name, "name");
        image = requireNonBlank(image, "image");
        env = env == null || env.isEmpty() ? Map.of() : copyOrdered(env);
        ports = ports == null || ports.isEmpty() ? List.of() : List.copyOf(ports);
        volumes = volumes == null || volumes.isEmpty() ? Map.of() : copyOrdered(volumes);
        dependsOn = dependsOn == null || dependsOn.isEmpty() ? List.of() : List.copyOf(dependsOn);
        networks = networks == null || networks.isEmpty() ? List.of() : List.copyOf(networks);
        lifecycle = lifecycle == null ? ServiceLifecycle.SERVICE : lifecycle;
    }

    public boolean init() {
        return lifecycle == ServiceLifecycle.INIT;
    }

    public static Builder builder(String name, String image) {
        return new Builder(name, image);
    }

    private static Map<String, String> copyOrdered(Map<String, String> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    public static final class Builder {
        private final String name;
        private final String image;
        private String version;
        private String containerName;
        private boolean internal;
        private final Map<String, String> env = new LinkedHashMap<>();
        private final List<String> ports = new ArrayList<>();
        private final Map<String, String> volumes = new LinkedHashMap<>();
        private final List<String> dependsOn = new ArrayList<>();
        private final List<String> networks = new ArrayList<>();
        private boolean ignoreDuringMaintenance;
        private EndpointHealthCheck healthCheck;
        private ServiceLifecycle lifecycle = ServiceLifecycle.SERVICE;

        private Builder(String name, String image) {
            this.name = Objects.requireNonNull(name, "name");
            this.image = Objects.requireNonNull(image, "image");
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder containerName(String containerName) {
            this.containerName = containerName;
            return this;
        }

        public Builder internal(boolean internal) {
            this.internal = internal;
            return this;
        }

        public Builder env(String key, String value) {
            this.env.put(key, value);
            return this;
        }

        public Builder port(String mapping) {
            this.ports.add(mapping);
            return this;
        }

        public Builder volume(String source, String target) {
            this.volumes.put(source, target);
            return this;
        }

        public Builder dependsOn(String... services) {
            this.dependsOn.addAll(List.of(services));
            return this;
        }

        public Builder networks(String... names) {
            this.networks.addAll(List.of(names));
            return this;
        }

        public Builder ignoreDuringMaintenance(boolean ignore) {
            this.ignoreDuringMaintenance = ignore;
            return this;
        }

        public Builder healthCheck(EndpointHealthCheck healthCheck) {
            this.healthCheck = healthCheck;
            return this;
        }

        public Builder lifecycle(ServiceLifecycle lifecycle) {
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder init() {
            return lifecycle(ServiceLifecycle.INIT);
        }

        public ResolvedService build() {
            return new ResolvedService(name, image, version, containerName, internal, env, ports, volumes,
                dependsOn, networks, ignoreDuringMaintenance, healthCheck, lifecycle);
        }
    }
}
