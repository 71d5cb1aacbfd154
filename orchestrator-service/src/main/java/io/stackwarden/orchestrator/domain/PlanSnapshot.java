package io.stackwarden.orchestrator.domain;

import io.stackwarden.stack.model.DeploymentPlan;
import java.time.Instant;
import java.util.Objects;

/**
 * The single prior plan retained for rolling back a failed upgrade.
 */
public record PlanSnapshot(DeploymentPlan plan, Instant capturedAt) {
    public PlanSnapshot {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(capturedAt, "capturedAt");
    }

    public String version() {
        return plan.stackVersion();
    }
}
