package io.stackwarden.orchestrator.domain;

import java.util.Collection;

/**
 * Health of a component or stack, ordered by severity: combining two statuses keeps the worse one.
 */
public enum HealthStatus {
    HEALTHY(0),
    DEGRADED(1),
    UNHEALTHY(2),
    UNKNOWN(3);

    private final int severity;

    HealthStatus(int severity) {
        this.severity = severity;
    }

    public HealthStatus combineWith(HealthStatus other) {
        if (other == null) {
            return this;
        }
        return severity >= other.severity ? this : other;
    }

    /**
     * Worst status of the given ones, or {@link #UNKNOWN} when there are none.
     */
    public static HealthStatus worstOf(Collection<HealthStatus> statuses) {
        HealthStatus worst = null;
        for (HealthStatus status : statuses) {
            worst = worst == null ? status : worst.combineWith(status);
        }
        return worst == null ? UNKNOWN : worst;
    }

    /**
     * Minimum status implied by a mode: planned disruption is degraded, a failed stack is unhealthy.
     */
    public static HealthStatus minimumFor(OperationMode mode) {
        return switch (mode) {
            case NORMAL -> HEALTHY;
            case MIGRATING, MAINTENANCE, STOPPED -> DEGRADED;
            case FAILED -> UNHEALTHY;
        };
    }
}
