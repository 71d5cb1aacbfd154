package io.stackwarden.orchestrator.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Health of the message bus a stack talks through.
 */
public record BusHealth(HealthStatus status, String transport, String criticalError, Instant lastPingAt) {
    public BusHealth {
        Objects.requireNonNull(status, "status");
    }
}
