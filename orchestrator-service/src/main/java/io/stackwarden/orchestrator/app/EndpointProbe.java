package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.HealthStatus;
import io.stackwarden.stack.model.EndpointHealthCheck;

/**
 * Probes a service's HTTP health endpoint.
 */
public interface EndpointProbe {

    /**
     * @param host host name the service answers on, usually its container name
     */
    Result probe(String host, EndpointHealthCheck check);

    record Result(HealthStatus status, String detail) {
    }

    static EndpointProbe disabled() {
        return (host, check) -> new Result(HealthStatus.HEALTHY, null);
    }
}
