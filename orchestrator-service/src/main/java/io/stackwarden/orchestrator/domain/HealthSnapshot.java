package io.stackwarden.orchestrator.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time health of one stack. Never mutated once captured.
 */
public record HealthSnapshot(String organizationId,
                             String environmentId,
                             String stackName,
                             Instant capturedAt,
                             HealthStatus overall,
                             OperationMode mode,
                             String currentVersion,
                             String targetVersion,
                             BusHealth bus,
                             InfraHealth infra,
                             SelfHealth self) {
    public HealthSnapshot {
        Objects.requireNonNull(environmentId, "environmentId");
        Objects.requireNonNull(stackName, "stackName");
        Objects.requireNonNull(capturedAt, "capturedAt");
        Objects.requireNonNull(overall, "overall");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(self, "self");
    }

    public static HealthSnapshot capture(StackRuntimeRecord record,
                                         Instant capturedAt,
                                         SelfHealth self,
                                         BusHealth bus,
                                         InfraHealth infra) {
        List<HealthSource> sources = new ArrayList<>();
        sources.add(new HealthSource.SelfSource(self));
        if (bus != null) {
            sources.add(new HealthSource.BusSource(bus));
        }
        if (infra != null) {
            sources.add(new HealthSource.InfraSource(infra));
        }
        HealthStatus overall = HealthSource.overall(record.mode(), sources);
        return new HealthSnapshot(record.organizationId(), record.key().environmentId(), record.key().stackName(),
            capturedAt, overall, record.mode(), record.currentVersion().orElse(null),
            record.targetVersion().orElse(null), bus, infra, self);
    }

    public StackKey key() {
        return new StackKey(environmentId, stackName);
    }

    public String statusMessage() {
        if (mode == OperationMode.MAINTENANCE) {
            return "Maintenance mode";
        }
        if (overall == HealthStatus.UNHEALTHY) {
            return "Unhealthy: " + (self.services().size() - self.healthyCount()) + " service(s) down";
        }
        if (overall == HealthStatus.DEGRADED) {
            return "Some services degraded";
        }
        if (overall == HealthStatus.UNKNOWN) {
            return "Health could not be determined";
        }
        return "All systems operational";
    }
}
