package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fully resolved, ordered set of actions realizing one stack version in one environment.
 * Steps are sorted by a dense {@code order} (0..n-1) and every dependency precedes its dependent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeploymentPlan(String stackVersion,
                             String environmentId,
                             String stackName,
                             Map<String, NetworkDefinition> networks,
                             List<DeploymentStep> steps,
                             Map<String, String> globalEnv,
                             MaintenanceObserverDefinition maintenanceObserver) {
    public DeploymentPlan {
        if (stackName == null || stackName.isBlank()) {
            throw new IllegalArgumentException("stackName must not be blank");
        }
        if (environmentId == null || environmentId.isBlank()) {
            throw new IllegalArgumentException("environmentId must not be blank");
        }
        networks = networks == null || networks.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(networks));
        steps = steps == null ? List.of() : List.copyOf(steps);
        globalEnv = globalEnv == null || globalEnv.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(globalEnv));
        checkOrdering(steps);
    }

    public DeploymentPlan(String stackVersion,
                          String environmentId,
                          String stackName,
                          Map<String, NetworkDefinition> networks,
                          List<DeploymentStep> steps,
                          Map<String, String> globalEnv) {
        this(stackVersion, environmentId, stackName, networks, steps, globalEnv, null);
    }

    public Optional<MaintenanceObserverDefinition> observer() {
        return Optional.ofNullable(maintenanceObserver);
    }

    public Optional<DeploymentStep> step(String contextName) {
        return steps.stream().filter(step -> step.contextName().equals(contextName)).findFirst();
    }

    public List<String> containerNames() {
        return steps.stream().map(DeploymentStep::containerName).toList();
    }

    private static void checkOrdering(List<DeploymentStep> steps) {
        Map<String, Integer> orderByName = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            DeploymentStep step = steps.get(i);
            if (step.order() != i) {
                throw new IllegalArgumentException(
                    "step '" + step.contextName() + "' has order " + step.order() + " but position " + i);
            }
            if (orderByName.put(step.contextName(), i) != null) {
                throw new IllegalArgumentException("duplicate step '" + step.contextName() + "'");
            }
            if (step.init() && i > 0 && !steps.get(i - 1).init()) {
                throw new IllegalArgumentException(
                    "init step '" + step.contextName() + "' must come before every regular step");
            }
        }
        for (DeploymentStep step : steps) {
            for (String dependency : step.dependsOn()) {
                Integer dependencyOrder = orderByName.get(dependency);
                if (dependencyOrder == null || dependencyOrder >= step.order()) {
                    throw new IllegalArgumentException(
                        "step '" + step.contextName() + "' must come after its dependency '" + dependency + "'");
                }
            }
        }
    }
}
