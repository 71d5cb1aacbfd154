package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Stack description as handed over by the manifest resolver: every variable substituted, every
 * service fully described. Nothing in here has been validated against the dependency graph yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolvedStack(@NotBlank String stackName,
                            @NotBlank String stackVersion,
                            String stackIdentity,
                            @Valid List<ResolvedService> services,
                            Map<String, NetworkDeclaration> networks,
                            Map<String, String> variables,
                            String ingressService,
                            boolean rollbackDisabled,
                            @Valid MaintenanceObserverDefinition maintenanceObserver) {
    public ResolvedStack {
        if (stackName == null || stackName.isBlank()) {
            throw new IllegalArgumentException("stackName must not be blank");
        }
        if (stackVersion == null || stackVersion.isBlank()) {
            throw new IllegalArgumentException("stackVersion must not be blank");
        }
        services = services == null ? List.of() : List.copyOf(services);
        networks = networks == null || networks.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(networks));
        variables = variables == null || variables.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        ingressService = ingressService == null || ingressService.isBlank() ? null : ingressService;
    }

    public ResolvedStack(String stackName,
                         String stackVersion,
                         String stackIdentity,
                         List<ResolvedService> services,
                         Map<String, NetworkDeclaration> networks,
                         Map<String, String> variables,
                         String ingressService,
                         boolean rollbackDisabled) {
        this(stackName, stackVersion, stackIdentity, services, networks, variables, ingressService,
            rollbackDisabled, null);
    }

    public ResolvedStack(String stackName, String stackVersion, List<ResolvedService> services) {
        this(stackName, stackVersion, null, services, null, null, null, false, null);
    }

    /**
     * Identity used to scope container and network names; defaults to the sanitized stack name.
     */
    public String effectiveIdentity() {
        String identity = stackIdentity == null || stackIdentity.isBlank() ? stackName : stackIdentity;
        return DockerNames.sanitize(identity);
    }

    public Optional<String> ingress() {
        return Optional.ofNullable(ingressService);
    }

    public ResolvedStack withVersion(String version) {
        return new ResolvedStack(stackName, version, stackIdentity, services, networks, variables,
            ingressService, rollbackDisabled, maintenanceObserver);
    }
}
