package io.stackwarden.orchestrator.domain;

import java.util.List;

/**
 * The closed set of health inputs a snapshot is aggregated from.
 */
public sealed interface HealthSource permits HealthSource.SelfSource, HealthSource.BusSource, HealthSource.InfraSource {

    record SelfSource(SelfHealth health) implements HealthSource {
    }

    record BusSource(BusHealth health) implements HealthSource {
    }

    record InfraSource(InfraHealth health) implements HealthSource {
    }

    static HealthStatus statusOf(HealthSource source) {
        if (source instanceof SelfSource self) {
            return self.health().status();
        }
        if (source instanceof BusSource bus) {
            return bus.health().status();
        }
        if (source instanceof InfraSource infra) {
            return infra.health().status();
        }
        throw new IllegalArgumentException("Unsupported health source " + source);
    }

    /**
     * Overall status: the worse of the mode's minimum and the worst source.
     */
    static HealthStatus overall(OperationMode mode, List<HealthSource> sources) {
        HealthStatus components = HealthStatus.worstOf(sources.stream().map(HealthSource::statusOf).toList());
        return HealthStatus.minimumFor(mode).combineWith(components);
    }
}
