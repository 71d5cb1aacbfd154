package io.stackwarden.orchestrator.domain;

import java.util.List;

/**
 * Latest health of every known stack in one environment.
 */
public record EnvironmentHealthSummary(String environmentId,
                                       HealthStatus overall,
                                       int totalStacks,
                                       int healthy,
                                       int degraded,
                                       int unhealthy,
                                       int unknown,
                                       List<HealthSnapshot> stacks) {
    public EnvironmentHealthSummary {
        stacks = stacks == null ? List.of() : List.copyOf(stacks);
    }

    public static EnvironmentHealthSummary of(String environmentId, List<HealthSnapshot> snapshots) {
        int healthy = count(snapshots, HealthStatus.HEALTHY);
        int degraded = count(snapshots, HealthStatus.DEGRADED);
        int unhealthy = count(snapshots, HealthStatus.UNHEALTHY);
        int unknown = count(snapshots, HealthStatus.UNKNOWN);
        HealthStatus overall;
        if (snapshots.isEmpty() || unknown == snapshots.size()) {
            overall = HealthStatus.UNKNOWN;
        } else if (unhealthy > 0) {
            overall = HealthStatus.UNHEALTHY;
        } else if (degraded > 0 || unknown > 0) {
            overall = HealthStatus.DEGRADED;
        } else {
            overall = HealthStatus.HEALTHY;
        }
        return new EnvironmentHealthSummary(environmentId, overall, snapshots.size(), healthy, degraded, unhealthy,
            unknown, snapshots);
    }

    private static int count(List<HealthSnapshot> snapshots, HealthStatus status) {
        return (int) snapshots.stream().filter(snapshot -> snapshot.overall() == status).count();
    }
}
