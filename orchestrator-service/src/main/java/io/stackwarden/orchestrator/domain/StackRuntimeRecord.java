package io.stackwarden.orchestrator.domain;

import io.stackwarden.stack.model.DeploymentPlan;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted runtime state of one stack. Instances are immutable; every transition stores a new
 * record built with {@link #toBuilder()}.
 */
public final class StackRuntimeRecord {
    private final StackKey key;
    private final String organizationId;
    private final OperationMode mode;
    private final DeploymentStatus deploymentStatus;
    private final MigrationStatus migrationStatus;
    private final TransitionKind lastTransition;
    private final String currentVersion;
    private final String targetVersion;
    private final DeploymentPlan currentPlan;
    private final PlanSnapshot snapshot;
    private final List<String> stoppedContainers;
    private final boolean rollbackDisabled;
    private final String lastError;
    private final Instant updatedAt;

    private StackRuntimeRecord(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key");
        this.organizationId = builder.organizationId;
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.deploymentStatus = Objects.requireNonNull(builder.deploymentStatus, "deploymentStatus");
        this.migrationStatus = Objects.requireNonNull(builder.migrationStatus, "migrationStatus");
        this.lastTransition = Objects.requireNonNull(builder.lastTransition, "lastTransition");
        this.currentVersion = builder.currentVersion;
        this.targetVersion = builder.targetVersion;
        this.currentPlan = builder.currentPlan;
        this.snapshot = builder.snapshot;
        this.stoppedContainers = builder.stoppedContainers == null ? List.of() : List.copyOf(builder.stoppedContainers);
        this.rollbackDisabled = builder.rollbackDisabled;
        this.lastError = builder.lastError;
        this.updatedAt = Objects.requireNonNull(builder.updatedAt, "updatedAt");
    }

    /**
     * State of a stack that has never been deployed.
     */
    public static StackRuntimeRecord initial(StackKey key, String organizationId, Instant now) {
        return new Builder(key)
            .organizationId(organizationId)
            .mode(OperationMode.NORMAL)
            .deploymentStatus(DeploymentStatus.IDLE)
            .migrationStatus(MigrationStatus.NONE)
            .lastTransition(TransitionKind.NONE)
            .updatedAt(now)
            .build();
    }

    public StackKey key() {
        return key;
    }

    public String organizationId() {
        return organizationId;
    }

    public OperationMode mode() {
        return mode;
    }

    public DeploymentStatus deploymentStatus() {
        return deploymentStatus;
    }

    public MigrationStatus migrationStatus() {
        return migrationStatus;
    }

    public TransitionKind lastTransition() {
        return lastTransition;
    }

    public Optional<String> currentVersion() {
        return Optional.ofNullable(currentVersion);
    }

    public Optional<String> targetVersion() {
        return Optional.ofNullable(targetVersion);
    }

    public Optional<DeploymentPlan> currentPlan() {
        return Optional.ofNullable(currentPlan);
    }

    public Optional<PlanSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    public List<String> stoppedContainers() {
        return stoppedContainers;
    }

    public boolean rollbackDisabled() {
        return rollbackDisabled;
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean deployed() {
        return currentPlan != null;
    }

    /**
     * Rollback needs a failed upgrade, a retained snapshot and a stack that allows it.
     */
    public boolean rollbackAvailable() {
        return mode == OperationMode.FAILED
            && lastTransition.rollbackEligible()
            && snapshot != null
            && !rollbackDisabled;
    }

    public Builder toBuilder() {
        return new Builder(key)
            .organizationId(organizationId)
            .mode(mode)
            .deploymentStatus(deploymentStatus)
            .migrationStatus(migrationStatus)
            .lastTransition(lastTransition)
            .currentVersion(currentVersion)
            .targetVersion(targetVersion)
            .currentPlan(currentPlan)
            .snapshot(snapshot)
            .stoppedContainers(stoppedContainers)
            .rollbackDisabled(rollbackDisabled)
            .lastError(lastError)
            .updatedAt(updatedAt);
    }

    @Override
    public String toString() {
        return "StackRuntimeRecord{" + key + ", mode=" + mode + ", status=" + deploymentStatus
            + ", migration=" + migrationStatus + ", version=" + currentVersion + ", target=" + targetVersion
            + ", snapshot=" + (snapshot == null ? "none" : snapshot.version()) + '}';
    }

    public static final class Builder {
        private final StackKey key;
        private String organizationId;
        private OperationMode mode;
        private DeploymentStatus deploymentStatus;
        private MigrationStatus migrationStatus;
        private TransitionKind lastTransition;
        private String currentVersion;
        private String targetVersion;
        private DeploymentPlan currentPlan;
        private PlanSnapshot snapshot;
        private List<String> stoppedContainers;
        private boolean rollbackDisabled;
        private String lastError;
        private Instant updatedAt;

        private Builder(StackKey key) {
            this.key = key;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder mode(OperationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder deploymentStatus(DeploymentStatus deploymentStatus) {
            this.deploymentStatus = deploymentStatus;
            return this;
        }

        public Builder migrationStatus(MigrationStatus migrationStatus) {
            this.migrationStatus = migrationStatus;
            return this;
        }

        public Builder lastTransition(TransitionKind lastTransition) {
            this.lastTransition = lastTransition;
            return this;
        }

        public Builder currentVersion(String currentVersion) {
            this.currentVersion = currentVersion;
            return this;
        }

        public Builder targetVersion(String targetVersion) {
            this.targetVersion = targetVersion;
            return this;
        }

        public Builder currentPlan(DeploymentPlan currentPlan) {
            this.currentPlan = currentPlan;
            return this;
        }

        public Builder snapshot(PlanSnapshot snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        public Builder stoppedContainers(List<String> stoppedContainers) {
            this.stoppedContainers = stoppedContainers;
            return this;
        }

        public Builder rollbackDisabled(boolean rollbackDisabled) {
            this.rollbackDisabled = rollbackDisabled;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public StackRuntimeRecord build() {
            return new StackRuntimeRecord(this);
        }
    }
}
