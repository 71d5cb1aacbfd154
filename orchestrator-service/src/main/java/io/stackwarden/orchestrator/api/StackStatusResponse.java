package io.stackwarden.orchestrator.api;

import io.stackwarden.orchestrator.domain.DeploymentStatus;
import io.stackwarden.orchestrator.domain.MigrationStatus;
import io.stackwarden.orchestrator.domain.OperationMode;
import io.stackwarden.orchestrator.domain.PlanSnapshot;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.orchestrator.domain.TransitionKind;
import java.time.Instant;
import java.util.List;

public record StackStatusResponse(String environmentId,
                                  String stackName,
                                  OperationMode mode,
                                  DeploymentStatus deploymentStatus,
                                  MigrationStatus migrationStatus,
                                  TransitionKind lastTransition,
                                  String currentVersion,
                                  String targetVersion,
                                  String snapshotVersion,
                                  boolean rollbackAvailable,
                                  List<String> stoppedContainers,
                                  String lastError,
                                  Instant updatedAt) {

    static StackStatusResponse from(StackRuntimeRecord record) {
        return new StackStatusResponse(record.key().environmentId(), record.key().stackName(), record.mode(),
            record.deploymentStatus(), record.migrationStatus(), record.lastTransition(),
            record.currentVersion().orElse(null), record.targetVersion().orElse(null),
            record.snapshot().map(PlanSnapshot::version).orElse(null), record.rollbackAvailable(),
            record.stoppedContainers(), record.lastError().orElse(null), record.updatedAt());
    }
}
