package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.DeploymentStatus;
import io.stackwarden.orchestrator.domain.InvalidTransitionException;
import io.stackwarden.orchestrator.domain.MigrationStatus;
import io.stackwarden.orchestrator.domain.OperationKind;
import io.stackwarden.orchestrator.domain.OperationMode;
import io.stackwarden.orchestrator.domain.PlanSnapshot;
import io.stackwarden.orchestrator.domain.ProgressEvent;
import io.stackwarden.orchestrator.domain.ProgressOutcome;
import io.stackwarden.orchestrator.domain.ProgressPhase;
import io.stackwarden.orchestrator.domain.ReasonCode;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackNotFoundException;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.orchestrator.domain.StackStateStore;
import io.stackwarden.orchestrator.domain.TransitionKind;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.runtime.ports.ContainerRuntime;
import io.stackwarden.stack.model.DeploymentPlan;
import io.stackwarden.stack.model.DeploymentResult;
import io.stackwarden.stack.model.SemanticVersion;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole owner of stack mode transitions.
 * <p>
 * {@code begin*} methods and {@link #checkAllowed} validate synchronously and are called while the
 * caller holds the environment lock, before any side effect. The container-level operations
 * (maintenance, stop, start, recover) run on the operation executor and record their outcome in
 * the stack's runtime record.
 */
public class OperationModeController {
    private static final Logger log = LoggerFactory.getLogger(OperationModeController.class);

    private final StackStateStore store;
    private final ContainerRuntime runtime;
    private final Clock clock;
    private final Duration stopTimeout;

    public OperationModeController(StackStateStore store, ContainerRuntime runtime, Clock clock, Duration stopTimeout) {
        this.store = Objects.requireNonNull(store, "store");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    }

    public StackRuntimeRecord require(StackKey key) {
        return store.find(key).orElseThrow(() -> StackNotFoundException.stack(key));
    }

    public Optional<StackRuntimeRecord> find(StackKey key) {
        return store.find(key);
    }

    /**
     * Puts back the record a {@code begin*} call replaced, for commands that never got to run.
     * An absent {@code previous} means the stack was unknown before and is forgotten again.
     */
    void restore(StackKey key, Optional<StackRuntimeRecord> previous) {
        if (previous.isPresent()) {
            store.save(previous.get());
            log.info("Stack {} restored to {} after its command was not started", key, previous.get().mode());
        } else {
            store.remove(key);
            log.info("Stack {} forgotten again after its first command was not started", key);
        }
    }

    /**
     * Rejects {@code kind} on the stack's current state without changing it.
     */
    public StackRuntimeRecord checkAllowed(OperationKind kind, StackKey key) {
        StackRuntimeRecord record = require(key);
        OperationMode mode = record.mode();
        boolean allowed = switch (kind) {
            case ENTER_MAINTENANCE, STOP -> mode == OperationMode.NORMAL && record.deployed();
            case EXIT_MAINTENANCE -> mode == OperationMode.MAINTENANCE;
            case START -> mode == OperationMode.STOPPED;
            case RECOVER -> mode == OperationMode.FAILED;
            case REMOVE -> mode != OperationMode.MIGRATING;
            default -> throw new IllegalArgumentException(kind + " is not a mode-only operation");
        };
        if (!allowed) {
            throw InvalidTransitionException.of(key, mode, kind.label());
        }
        return record;
    }

    /**
     * Starts a first deployment or an operator redeploy of a failed stack.
     */
    public StackRuntimeRecord beginDeploy(StackKey key, String organizationId, String version, boolean rollbackDisabled) {
        StackRuntimeRecord record = store.find(key)
            .orElseGet(() -> StackRuntimeRecord.initial(key, organizationId, clock.now()));
        if (!record.mode().canTransitionTo(OperationMode.MIGRATING)) {
            throw InvalidTransitionException.of(key, record.mode(), "deploy");
        }
        StackRuntimeRecord next = record.toBuilder()
            .organizationId(organizationId)
            .mode(OperationMode.MIGRATING)
            .deploymentStatus(DeploymentStatus.DEPLOYING)
            .migrationStatus(MigrationStatus.RUNNING)
            .lastTransition(TransitionKind.DEPLOY)
            .targetVersion(version)
            .rollbackDisabled(rollbackDisabled)
            .lastError(null)
            .updatedAt(clock.now())
            .build();
        return save(next, "deploy " + version);
    }

    /**
     * Retains the current plan as the rollback snapshot unless the target is a downgrade.
     */
    public StackRuntimeRecord beginUpgrade(StackKey key, String targetVersion, boolean rollbackDisabled) {
        StackRuntimeRecord record = require(key);
        if (record.mode() != OperationMode.NORMAL) {
            throw InvalidTransitionException.of(key, record.mode(), "upgrade");
        }
        DeploymentPlan current = record.currentPlan()
            .orElseThrow(() -> new InvalidTransitionException("Stack " + key + " has never been deployed"));
        boolean downgrade = SemanticVersion.isDowngrade(current.stackVersion(), targetVersion);
        PlanSnapshot snapshot = downgrade ? null : new PlanSnapshot(current, clock.now());
        if (downgrade) {
            log.info("Stack {} moves from {} down to {}; no rollback snapshot is kept", key,
                current.stackVersion(), targetVersion);
        }
        StackRuntimeRecord next = record.toBuilder()
            .mode(OperationMode.MIGRATING)
            .deploymentStatus(DeploymentStatus.UPGRADING)
            .migrationStatus(MigrationStatus.RUNNING)
            .lastTransition(downgrade ? TransitionKind.DOWNGRADE : TransitionKind.UPGRADE)
            .targetVersion(targetVersion)
            .snapshot(snapshot)
            .rollbackDisabled(rollbackDisabled)
            .lastError(null)
            .updatedAt(clock.now())
            .build();
        return save(next, (downgrade ? "downgrade " : "upgrade ") + current.stackVersion() + " -> " + targetVersion);
    }

    /**
     * Moves a failed upgrade into rollback and returns the plan to restore.
     */
    public DeploymentPlan beginRollback(StackKey key) {
        StackRuntimeRecord record = require(key);
        if (!record.rollbackAvailable()) {
            throw new InvalidTransitionException(ReasonCode.ROLLBACK_UNAVAILABLE,
                "Rollback of stack " + key + " is not available (mode " + record.mode() + ", last transition "
                    + record.lastTransition() + ", snapshot " + record.snapshot().map(PlanSnapshot::version)
                    .orElse("none") + (record.rollbackDisabled() ? ", disabled" : "") + ")");
        }
        PlanSnapshot snapshot = record.snapshot().orElseThrow();
        StackRuntimeRecord next = record.toBuilder()
            .mode(OperationMode.MIGRATING)
            .deploymentStatus(DeploymentStatus.ROLLING_BACK)
            .migrationStatus(MigrationStatus.RUNNING)
            .lastTransition(TransitionKind.ROLLBACK)
            .targetVersion(snapshot.version())
            .lastError(null)
            .updatedAt(clock.now())
            .build();
        save(next, "rollback to " + snapshot.version());
        return snapshot.plan();
    }

    public StackRuntimeRecord completeSuccess(StackKey key, DeploymentPlan plan) {
        StackRuntimeRecord next = require(key).toBuilder()
            .mode(OperationMode.NORMAL)
            .deploymentStatus(DeploymentStatus.IDLE)
            .migrationStatus(MigrationStatus.SUCCEEDED)
            .currentVersion(plan.stackVersion())
            .currentPlan(plan)
            .targetVersion(null)
            .snapshot(null)
            .stoppedContainers(List.of())
            .lastError(null)
            .updatedAt(clock.now())
            .build();
        return save(next, "completed at " + plan.stackVersion());
    }

    /**
     * Marks the running transition failed; a retained snapshot stays for rollback.
     */
    public StackRuntimeRecord completeFailure(StackKey key, String error) {
        StackRuntimeRecord next = require(key).toBuilder()
            .mode(OperationMode.FAILED)
            .deploymentStatus(DeploymentStatus.FAILED)
            .migrationStatus(MigrationStatus.FAILED)
            .lastError(error)
            .updatedAt(clock.now())
            .build();
        log.error("Stack {} failed: {}", key, error);
        return save(next, "failed");
    }

    void failIfKnown(StackKey key, String error) {
        if (store.find(key).isPresent()) {
            completeFailure(key, error);
        }
    }

    public DeploymentResult enterMaintenance(StackKey key, DeploymentProgressListener listener) {
        return stopContainers(key, true, OperationMode.MAINTENANCE, TransitionKind.MAINTENANCE, listener);
    }

    public DeploymentResult exitMaintenance(StackKey key, DeploymentProgressListener listener) {
        return startRecorded(key, listener);
    }

    public DeploymentResult stop(StackKey key, DeploymentProgressListener listener) {
        return stopContainers(key, false, OperationMode.STOPPED, TransitionKind.STOP, listener);
    }

    public DeploymentResult start(StackKey key, DeploymentProgressListener listener) {
        return startRecorded(key, listener);
    }

    /**
     * Operator acknowledgement of a failure: back to {@code NORMAL}, restarting anything a failed
     * maintenance or stop left behind.
     */
    public DeploymentResult recover(StackKey key, DeploymentProgressListener listener) {
        log.info("Recovering stack {} from FAILED", key);
        return startRecorded(key, listener);
    }

    public void remove(StackKey key) {
        store.remove(key);
        log.info("Stack {} forgotten", key);
    }

    private DeploymentResult stopContainers(StackKey key,
                                            boolean honourIgnore,
                                            OperationMode target,
                                            TransitionKind kind,
                                            DeploymentProgressListener listener) {
        StackRuntimeRecord record = require(key);
        String version = record.currentVersion().orElse(null);
        List<String> stopped = new ArrayList<>();
        try {
            for (ContainerSummary container : runtime.listContainers(StackContainers.selector(key))) {
                if (!container.running() || StackContainers.initContainer(container.labels())) {
                    continue;
                }
                if (honourIgnore && StackContainers.ignoredDuringMaintenance(container.labels())) {
                    log.debug("Keeping {} running during maintenance of {}", container.name(), key);
                    continue;
                }
                runtime.stopContainer(container.id(), stopTimeout);
                stopped.add(container.name());
                emit(listener, container.name(), ProgressPhase.STOP, ProgressOutcome.SUCCEEDED,
                    "Stopped " + container.name());
            }
        } catch (ContainerRuntimeException e) {
            String error = "stopping containers failed: " + e.getMessage();
            emit(listener, key.stackName(), ProgressPhase.STOP, ProgressOutcome.FAILED, e.getMessage());
            save(record.toBuilder()
                .mode(OperationMode.FAILED)
                .deploymentStatus(DeploymentStatus.FAILED)
                .lastTransition(kind)
                .stoppedContainers(stopped)
                .lastError(error)
                .updatedAt(clock.now())
                .build(), "failed while entering " + target);
            return new DeploymentResult(false, version, List.of(), List.of(error), List.of(), clock.now());
        }
        save(record.toBuilder()
            .mode(target)
            .deploymentStatus(DeploymentStatus.IDLE)
            .lastTransition(kind)
            .stoppedContainers(stopped)
            .lastError(null)
            .updatedAt(clock.now())
            .build(), "stopped " + stopped);
        return new DeploymentResult(true, version, stopped, List.of(), List.of(), clock.now());
    }

    private DeploymentResult startRecorded(StackKey key, DeploymentProgressListener listener) {
        StackRuntimeRecord record = require(key);
        String version = record.currentVersion().orElse(null);
        List<String> started = new ArrayList<>();
        List<String> remaining = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (String container : record.stoppedContainers()) {
            try {
                runtime.startContainer(container);
                started.add(container);
                emit(listener, container, ProgressPhase.START, ProgressOutcome.SUCCEEDED, "Started " + container);
            } catch (ContainerRuntimeException e) {
                remaining.add(container);
                errors.add(container + ": " + e.getMessage());
                emit(listener, container, ProgressPhase.START, ProgressOutcome.FAILED, e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            save(record.toBuilder()
                .mode(OperationMode.FAILED)
                .deploymentStatus(DeploymentStatus.FAILED)
                .stoppedContainers(remaining)
                .lastError("restarting containers failed: " + String.join("; ", errors))
                .updatedAt(clock.now())
                .build(), "failed to restart " + remaining);
            return new DeploymentResult(false, version, started, errors, List.of(), clock.now());
        }
        save(record.toBuilder()
            .mode(OperationMode.NORMAL)
            .deploymentStatus(DeploymentStatus.IDLE)
            .stoppedContainers(List.of())
            .lastError(null)
            .updatedAt(clock.now())
            .build(), "restarted " + started);
        return new DeploymentResult(true, version, started, List.of(), List.of(), clock.now());
    }

    private StackRuntimeRecord save(StackRuntimeRecord record, String what) {
        store.save(record);
        log.info("Stack {} is {} ({}): {}", record.key(), record.mode(), record.deploymentStatus(), what);
        return record;
    }

    private void emit(DeploymentProgressListener listener,
                      String step,
                      ProgressPhase phase,
                      ProgressOutcome outcome,
                      String message) {
        if (listener != null) {
            listener.onProgress(new ProgressEvent(step, phase, outcome, message, clock.now()));
        }
    }
}
