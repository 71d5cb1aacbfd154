package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.HealthSnapshot;
import io.stackwarden.orchestrator.domain.HealthStatus;
import io.stackwarden.orchestrator.domain.InfraHealth;
import io.stackwarden.orchestrator.domain.OperationMode;
import io.stackwarden.orchestrator.domain.SelfHealth;
import io.stackwarden.orchestrator.domain.ServiceHealth;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.runtime.container.ContainerDetails;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.runtime.ports.ContainerRuntime;
import io.stackwarden.stack.model.DeploymentStep;
import io.stackwarden.stack.model.StackLabels;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures point-in-time health of a stack from its containers. Read-only: it never changes
 * containers or stack state.
 */
public class HealthAggregator {
    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    static final String RUNTIME_COMPONENT = "container-runtime";

    private final ContainerRuntime runtime;
    private final EndpointProbe probe;
    private final Clock clock;

    public HealthAggregator(ContainerRuntime runtime, EndpointProbe probe, Clock clock) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public HealthSnapshot capture(StackRuntimeRecord record) {
        List<ContainerSummary> containers;
        try {
            containers = runtime.listContainers(StackContainers.selector(record.key()));
        } catch (ContainerRuntimeException e) {
            log.warn("Unable to list containers of stack {}: {}", record.key(), e.getMessage());
            InfraHealth infra = new InfraHealth(List.of(
                new InfraHealth.Component(RUNTIME_COMPONENT, HealthStatus.UNKNOWN, e.getMessage())));
            return HealthSnapshot.capture(record, clock.now(), new SelfHealth(List.of()), null, infra);
        }
        InfraHealth infra = new InfraHealth(List.of(
            new InfraHealth.Component(RUNTIME_COMPONENT, HealthStatus.HEALTHY, null)));
        SelfHealth self = new SelfHealth(services(record, containers));
        HealthSnapshot snapshot = HealthSnapshot.capture(record, clock.now(), self, null, infra);
        log.debug("Stack {} is {} ({} of {} services healthy)", record.key(), snapshot.overall(),
            self.healthyCount(), self.services().size());
        return snapshot;
    }

    private List<ServiceHealth> services(StackRuntimeRecord record, List<ContainerSummary> containers) {
        Map<String, ContainerSummary> byContext = new LinkedHashMap<>();
        for (ContainerSummary container : containers) {
            String context = container.label(StackLabels.CONTEXT);
            byContext.put(context == null ? container.name() : context, container);
        }
        List<ServiceHealth> services = new ArrayList<>();
        if (record.currentPlan().isEmpty()) {
            byContext.forEach((context, container) -> services.add(service(record, context, container, null)));
            return services;
        }
        for (DeploymentStep step : record.currentPlan().get().steps()) {
            ContainerSummary container = byContext.get(step.contextName());
            if (container == null) {
                services.add(ServiceHealth.missing(step.contextName(), step.containerName()));
            } else {
                services.add(service(record, step.contextName(), container, step));
            }
        }
        return services;
    }

    private ServiceHealth service(StackRuntimeRecord record, String context, ContainerSummary container,
                                  DeploymentStep step) {
        int restarts = 0;
        String dockerHealth = container.healthStatus();
        ContainerDetails details = null;
        try {
            details = runtime.inspectContainer(container.id());
            restarts = details.restartCount();
            if (details.healthStatus() != null) {
                dockerHealth = details.healthStatus();
            }
        } catch (ContainerRuntimeException e) {
            log.debug("Unable to inspect {}: {}", container.name(), e.getMessage());
        }

        if ((step != null && step.init()) || StackContainers.initContainer(container.labels())) {
            return initContainer(context, container, details, restarts);
        }

        if (!container.running() && plannedStop(record.mode())) {
            return new ServiceHealth(context, container.id(), container.name(), HealthStatus.DEGRADED, restarts,
                record.mode() == OperationMode.MAINTENANCE ? "stopped for maintenance" : "stack stopped");
        }

        HealthStatus status;
        String reason;
        if (dockerHealth != null && !"none".equals(dockerHealth)) {
            switch (dockerHealth) {
                case "healthy" -> {
                    status = HealthStatus.HEALTHY;
                    reason = null;
                }
                case "unhealthy" -> {
                    status = HealthStatus.UNHEALTHY;
                    reason = "health check failing";
                }
                case "starting" -> {
                    status = HealthStatus.DEGRADED;
                    reason = "health check starting";
                }
                default -> {
                    status = fromState(container.state());
                    reason = reasonForState(container.state());
                }
            }
        } else {
            status = fromState(container.state());
            reason = reasonForState(container.state());
        }

        if (container.running() && step != null && step.healthCheck() != null) {
            EndpointProbe.Result probed = probe.probe(step.containerName(), step.healthCheck());
            if (probed.status() != HealthStatus.HEALTHY) {
                status = status.combineWith(probed.status());
                reason = probed.detail() == null ? "endpoint reported " + probed.status() : probed.detail();
            }
        }
        return new ServiceHealth(context, container.id(), container.name(), status, restarts, reason);
    }

    /**
     * Init containers are healthy once they exited with code 0; any other exit is a failure.
     */
    private static ServiceHealth initContainer(String context, ContainerSummary container, ContainerDetails details,
                                               int restarts) {
        HealthStatus status;
        String reason;
        if (container.running()) {
            status = HealthStatus.DEGRADED;
            reason = "init container still running";
        } else if (details == null) {
            status = HealthStatus.UNKNOWN;
            reason = "init container state unavailable";
        } else if (details.completedSuccessfully()) {
            status = HealthStatus.HEALTHY;
            reason = null;
        } else {
            status = HealthStatus.UNHEALTHY;
            reason = details.exitCode() == null
                ? "init container " + details.state()
                : "init container exited with code " + details.exitCode();
        }
        return new ServiceHealth(context, container.id(), container.name(), status, restarts, reason);
    }

    private static boolean plannedStop(OperationMode mode) {
        return mode == OperationMode.MAINTENANCE || mode == OperationMode.STOPPED;
    }

    static HealthStatus fromState(String state) {
        return switch (state) {
            case "running" -> HealthStatus.HEALTHY;
            case "restarting", "paused" -> HealthStatus.DEGRADED;
            case "exited", "dead" -> HealthStatus.UNHEALTHY;
            default -> HealthStatus.UNKNOWN;
        };
    }

    private static String reasonForState(String state) {
        return switch (state) {
            case "running" -> null;
            case "restarting" -> "container restarting";
            case "paused" -> "container paused";
            case "exited" -> "container exited";
            case "dead" -> "container dead";
            case "created" -> "container created but not started";
            default -> "container state " + state;
        };
    }
}
