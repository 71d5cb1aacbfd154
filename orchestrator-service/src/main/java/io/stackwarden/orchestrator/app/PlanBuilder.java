package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.EnvironmentContext;
import io.stackwarden.orchestrator.domain.PlanValidationException;
import io.stackwarden.orchestrator.domain.ReasonCode;
import io.stackwarden.stack.model.DeploymentPlan;
import io.stackwarden.stack.model.DeploymentStep;
import io.stackwarden.stack.model.DockerNames;
import io.stackwarden.stack.model.NetworkDeclaration;
import io.stackwarden.stack.model.NetworkDefinition;
import io.stackwarden.stack.model.ResolvedService;
import io.stackwarden.stack.model.ResolvedStack;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a resolved stack description into an ordered {@link DeploymentPlan}.
 * <p>
 * All structural validation happens here, before anything touches the container runtime. Services
 * are ordered with Kahn's algorithm; ties are broken by service name so the same description
 * always yields the same plan. Init containers win every tie, so they all run before the first
 * regular service; they may therefore only depend on other init containers. The ingress service
 * is taken out of the sort and scheduled last.
 */
public class PlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    static final String ENV_ORG_ID = "STACKWARDEN_ORG_ID";
    static final String ENV_STACK_NAME = "STACKWARDEN_STACK_NAME";
    static final String ENV_STACK_VERSION = "STACKWARDEN_STACK_VERSION";
    static final String ENV_ENVIRONMENT_ID = "STACKWARDEN_ENVIRONMENT_ID";

    private final NetworkResolver networkResolver;

    public PlanBuilder(NetworkResolver networkResolver) {
        this.networkResolver = Objects.requireNonNull(networkResolver, "networkResolver");
    }

    public DeploymentPlan build(ResolvedStack stack, EnvironmentContext environment) {
        Objects.requireNonNull(stack, "stack");
        Objects.requireNonNull(environment, "environment");
        Map<String, ResolvedService> services = indexServices(stack);
        String ingress = requireIngress(stack, services);
        requireDeclaredDependencies(services);
        requireDeclaredNetworks(stack, services);
        requireInitContainersFirst(services, ingress);
        List<String> order = sort(services, ingress);

        String identity = stack.effectiveIdentity();
        Map<String, NetworkDefinition> networks = new TreeMap<>(networkResolver.resolve(stack));
        Map<String, String> globalEnv = globalEnv(stack, environment);
        List<DeploymentStep> steps = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            ResolvedService service = services.get(order.get(i));
            steps.add(toStep(service, i, identity, networks, globalEnv));
        }
        DeploymentPlan plan = new DeploymentPlan(stack.stackVersion(), environment.environmentId(),
            stack.stackName(), networks, steps, globalEnv, stack.maintenanceObserver());
        log.debug("Built plan for stack {} {} in environment {}: {}", stack.stackName(), stack.stackVersion(),
            environment.environmentId(), order);
        return plan;
    }

    private Map<String, ResolvedService> indexServices(ResolvedStack stack) {
        Map<String, ResolvedService> services = new LinkedHashMap<>();
        Set<String> duplicates = new TreeSet<>();
        for (ResolvedService service : stack.services()) {
            if (services.putIfAbsent(service.name(), service) != null) {
                duplicates.add(service.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new PlanValidationException(ReasonCode.DUPLICATE_SERVICE,
                "Stack " + stack.stackName() + " declares services more than once: " + duplicates,
                List.copyOf(duplicates));
        }
        return services;
    }

    private String requireIngress(ResolvedStack stack, Map<String, ResolvedService> services) {
        String ingress = stack.ingressService();
        if (ingress != null && !services.containsKey(ingress)) {
            throw new PlanValidationException(ReasonCode.INGRESS_NOT_FOUND,
                "Ingress service '" + ingress + "' is not declared in stack " + stack.stackName(), List.of(ingress));
        }
        return ingress;
    }

    private void requireDeclaredDependencies(Map<String, ResolvedService> services) {
        List<String> problems = new ArrayList<>();
        Set<String> offenders = new TreeSet<>();
        for (ResolvedService service : services.values()) {
            for (String dependency : service.dependsOn()) {
                if (!services.containsKey(dependency)) {
                    problems.add("'" + service.name() + "' depends on undeclared service '" + dependency + "'");
                    offenders.add(service.name());
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new PlanValidationException(ReasonCode.DEPENDENCY_MISSING, String.join("; ", problems),
                List.copyOf(offenders));
        }
    }

    private void requireDeclaredNetworks(ResolvedStack stack, Map<String, ResolvedService> services) {
        if (stack.networks().isEmpty()) {
            return;
        }
        List<String> problems = new ArrayList<>();
        Set<String> offenders = new TreeSet<>();
        for (ResolvedService service : services.values()) {
            for (String network : service.networks()) {
                if (!stack.networks().containsKey(network)) {
                    problems.add("'" + service.name() + "' joins undeclared network '" + network + "'");
                    offenders.add(service.name());
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new PlanValidationException(ReasonCode.NETWORK_NOT_DECLARED, String.join("; ", problems),
                List.copyOf(offenders));
        }
    }

    private void requireInitContainersFirst(Map<String, ResolvedService> services, String ingress) {
        List<String> problems = new ArrayList<>();
        Set<String> offenders = new TreeSet<>();
        for (ResolvedService service : services.values()) {
            if (!service.init()) {
                continue;
            }
            if (service.name().equals(ingress)) {
                problems.add("ingress service '" + ingress + "' cannot be an init container");
                offenders.add(ingress);
            }
            for (String dependency : service.dependsOn()) {
                if (!services.get(dependency).init()) {
                    problems.add("init container '" + service.name() + "' depends on regular service '"
                        + dependency + "'");
                    offenders.add(service.name());
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new PlanValidationException(ReasonCode.INIT_ORDER_VIOLATION, String.join("; ", problems),
                List.copyOf(offenders));
        }
    }

    private List<String> sort(Map<String, ResolvedService> services, String ingress) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        Set<String> dependOnIngress = new TreeSet<>();
        for (ResolvedService service : services.values()) {
            if (service.name().equals(ingress)) {
                if (service.dependsOn().contains(ingress)) {
                    dependOnIngress.add(ingress);
                }
                continue;
            }
            inDegree.putIfAbsent(service.name(), 0);
            for (String dependency : new LinkedHashSet<>(service.dependsOn())) {
                if (dependency.equals(ingress)) {
                    dependOnIngress.add(service.name());
                    continue;
                }
                inDegree.merge(service.name(), 1, Integer::sum);
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(service.name());
            }
        }
        if (!dependOnIngress.isEmpty()) {
            Set<String> involved = new TreeSet<>(dependOnIngress);
            involved.add(ingress);
            throw new PlanValidationException(ReasonCode.DEPENDENCY_CYCLE,
                "Ingress service '" + ingress + "' is always deployed last but " + dependOnIngress + " depend on it",
                List.copyOf(involved));
        }

        Comparator<String> initFirst = Comparator
            .comparing((String name) -> !services.get(name).init())
            .thenComparing(Comparator.naturalOrder());
        PriorityQueue<String> ready = new PriorityQueue<>(initFirst);
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });
        List<String> order = new ArrayList<>(services.size());
        while (!ready.isEmpty()) {
            String next = ready.poll();
            order.add(next);
            for (String dependent : dependents.getOrDefault(next, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() < inDegree.size()) {
            Set<String> unsorted = new TreeSet<>(inDegree.keySet());
            order.forEach(unsorted::remove);
            throw new PlanValidationException(ReasonCode.DEPENDENCY_CYCLE,
                "Dependency cycle between services " + unsorted, List.copyOf(unsorted));
        }
        if (ingress != null) {
            order.add(ingress);
        }
        return order;
    }

    private Map<String, String> globalEnv(ResolvedStack stack, EnvironmentContext environment) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(ENV_ORG_ID, environment.organizationId());
        env.put(ENV_STACK_NAME, stack.stackName());
        env.put(ENV_STACK_VERSION, stack.stackVersion());
        env.put(ENV_ENVIRONMENT_ID, environment.environmentId());
        env.putAll(stack.variables());
        return env;
    }

    private DeploymentStep toStep(ResolvedService service,
                                  int order,
                                  String identity,
                                  Map<String, NetworkDefinition> networks,
                                  Map<String, String> globalEnv) {
        Map<String, String> env = new LinkedHashMap<>(globalEnv);
        env.putAll(service.env());

        List<String> stepNetworks = new ArrayList<>();
        if (service.networks().isEmpty()) {
            NetworkDefinition fallback = networks.computeIfAbsent(NetworkResolver.DEFAULT_NETWORK,
                key -> networkResolver.defaultNetwork(identity));
            stepNetworks.add(fallback.resolvedName());
        } else {
            for (String network : service.networks()) {
                NetworkDefinition definition = networks.computeIfAbsent(network,
                    key -> networkResolver.resolve(identity, key, NetworkDeclaration.managed()));
                stepNetworks.add(definition.resolvedName());
            }
        }

        Map<String, String> volumes = new LinkedHashMap<>();
        service.volumes().forEach((source, target) -> volumes.put(scopeVolume(identity, source), target));

        String containerName = service.containerName() == null || service.containerName().isBlank()
            ? DockerNames.containerName(identity, service.name())
            : service.containerName();

        return new DeploymentStep(service.name(), service.image(), service.version(), containerName,
            service.internal(), env, service.ports(), volumes, service.dependsOn(), order, stepNetworks,
            service.ignoreDuringMaintenance(), service.healthCheck(), service.lifecycle());
    }

    /**
     * Named volumes are scoped by stack identity; host paths are used as given.
     */
    private static String scopeVolume(String identity, String source) {
        if (source.startsWith("/") || source.startsWith(".") || source.startsWith("~")) {
            return source;
        }
        return DockerNames.volumeName(identity, source);
    }
}
