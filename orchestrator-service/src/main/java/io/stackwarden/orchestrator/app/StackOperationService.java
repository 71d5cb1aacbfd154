package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.EnvironmentContext;
import io.stackwarden.orchestrator.domain.HealthHistory;
import io.stackwarden.orchestrator.domain.OperationInProgressException;
import io.stackwarden.orchestrator.domain.OperationJournal;
import io.stackwarden.orchestrator.domain.OperationKind;
import io.stackwarden.orchestrator.domain.OperationRecord;
import io.stackwarden.orchestrator.domain.OperationStatus;
import io.stackwarden.orchestrator.domain.ReasonCode;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.DeploymentPlan;
import io.stackwarden.stack.model.DeploymentResult;
import io.stackwarden.stack.model.ResolvedStack;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every lifecycle command.
 * <p>
 * A command is validated and its environment locked on the caller's thread, so structural and
 * state errors as well as a busy environment are reported synchronously. The work itself runs on
 * the operation executor; its progress and result are recorded in the {@link OperationJournal}.
 * The environment lock is held until the work finishes.
 */
public class StackOperationService {
    private static final Logger log = LoggerFactory.getLogger(StackOperationService.class);

    public static final String ORCHESTRATOR_STACK = "stackwarden-orchestrator";

    private final PlanBuilder planBuilder;
    private final LifecycleExecutor lifecycleExecutor;
    private final StackRemover remover;
    private final OperationModeController modes;
    private final SelfReplacementCoordinator selfReplacement;
    private final String systemEnvironmentId;
    private final EnvironmentLockRegistry locks;
    private final OperationJournal journal;
    private final HealthHistory healthHistory;
    private final Executor executor;
    private final Clock clock;
    private final Supplier<String> operationIds;
    private final Map<String, OperationCancellation> running = new ConcurrentHashMap<>();

    public StackOperationService(PlanBuilder planBuilder,
                                 LifecycleExecutor lifecycleExecutor,
                                 StackRemover remover,
                                 OperationModeController modes,
                                 SelfReplacementCoordinator selfReplacement,
                                 String systemEnvironmentId,
                                 EnvironmentLockRegistry locks,
                                 OperationJournal journal,
                                 HealthHistory healthHistory,
                                 Executor executor,
                                 Clock clock) {
        this(planBuilder, lifecycleExecutor, remover, modes, selfReplacement, systemEnvironmentId, locks, journal,
            healthHistory, executor, clock, () -> UUID.randomUUID().toString());
    }

    StackOperationService(PlanBuilder planBuilder,
                          LifecycleExecutor lifecycleExecutor,
                          StackRemover remover,
                          OperationModeController modes,
                          SelfReplacementCoordinator selfReplacement,
                          String systemEnvironmentId,
                          EnvironmentLockRegistry locks,
                          OperationJournal journal,
                          HealthHistory healthHistory,
                          Executor executor,
                          Clock clock,
                          Supplier<String> operationIds) {
        this.planBuilder = Objects.requireNonNull(planBuilder, "planBuilder");
        this.lifecycleExecutor = Objects.requireNonNull(lifecycleExecutor, "lifecycleExecutor");
        this.remover = Objects.requireNonNull(remover, "remover");
        this.modes = Objects.requireNonNull(modes, "modes");
        this.selfReplacement = Objects.requireNonNull(selfReplacement, "selfReplacement");
        this.systemEnvironmentId = Objects.requireNonNull(systemEnvironmentId, "systemEnvironmentId");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.healthHistory = Objects.requireNonNull(healthHistory, "healthHistory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.operationIds = Objects.requireNonNull(operationIds, "operationIds");
    }

    public OperationHandle deploy(ResolvedStack stack, EnvironmentContext environment) {
        DeploymentPlan plan = planBuilder.build(stack, environment);
        StackKey key = environment.stack(stack.stackName());
        return launch(key, OperationKind.DEPLOY,
            () -> modes.beginDeploy(key, environment.organizationId(), plan.stackVersion(), stack.rollbackDisabled()),
            (listener, token) -> lifecycleExecutor.execute(plan, listener, token),
            result -> finishMigration(key, plan, result));
    }

    public OperationHandle upgrade(EnvironmentContext environment, String targetVersion, ResolvedStack stack) {
        Objects.requireNonNull(targetVersion, "targetVersion");
        ResolvedStack target = targetVersion.equals(stack.stackVersion()) ? stack : stack.withVersion(targetVersion);
        DeploymentPlan plan = planBuilder.build(target, environment);
        StackKey key = environment.stack(stack.stackName());
        return launch(key, OperationKind.UPGRADE,
            () -> modes.beginUpgrade(key, targetVersion, stack.rollbackDisabled()),
            (listener, token) -> lifecycleExecutor.execute(plan, listener, token),
            result -> finishMigration(key, plan, result));
    }

    public OperationHandle rollback(StackKey key) {
        AtomicReference<DeploymentPlan> snapshot = new AtomicReference<>();
        return launch(key, OperationKind.ROLLBACK,
            () -> snapshot.set(modes.beginRollback(key)),
            (listener, token) -> lifecycleExecutor.execute(snapshot.get(), listener, token),
            result -> finishMigration(key, snapshot.get(), result));
    }

    public OperationHandle enterMaintenance(StackKey key) {
        return modeOperation(key, OperationKind.ENTER_MAINTENANCE,
            (listener, token) -> modes.enterMaintenance(key, listener));
    }

    public OperationHandle exitMaintenance(StackKey key) {
        return modeOperation(key, OperationKind.EXIT_MAINTENANCE,
            (listener, token) -> modes.exitMaintenance(key, listener));
    }

    public OperationHandle stop(StackKey key) {
        return modeOperation(key, OperationKind.STOP, (listener, token) -> modes.stop(key, listener));
    }

    public OperationHandle start(StackKey key) {
        return modeOperation(key, OperationKind.START, (listener, token) -> modes.start(key, listener));
    }

    public OperationHandle recover(StackKey key) {
        return modeOperation(key, OperationKind.RECOVER, (listener, token) -> modes.recover(key, listener));
    }

    public OperationHandle remove(StackKey key) {
        AtomicReference<String> version = new AtomicReference<>();
        return launch(key, OperationKind.REMOVE,
            () -> version.set(modes.checkAllowed(OperationKind.REMOVE, key).currentVersion().orElse(null)),
            (listener, token) -> remover.remove(key, version.get(), listener),
            result -> {
                if (result.success()) {
                    modes.remove(key);
                    healthHistory.forget(key);
                } else {
                    modes.completeFailure(key, result.firstError());
                }
            });
    }

    /**
     * Replaces the orchestrator's own container with {@code targetVersion}. Serialized with other
     * operations through the system environment's lock.
     */
    public OperationHandle selfReplace(String targetVersion) {
        if (targetVersion == null || targetVersion.isBlank()) {
            throw new IllegalArgumentException("targetVersion must not be blank");
        }
        StackKey key = new StackKey(systemEnvironmentId, ORCHESTRATOR_STACK);
        return launch(key, OperationKind.SELF_REPLACE, () -> {
        }, (listener, token) -> {
            SelfReplacementResult outcome = selfReplacement.replace(targetVersion);
            return outcome.accepted()
                ? new DeploymentResult(true, targetVersion, List.of(outcome.replacementName()), List.of(),
                    List.of(outcome.message()), clock.now())
                : DeploymentResult.failure(targetVersion, outcome.message(), clock.now());
        }, result -> {
        });
    }

    /**
     * Requests cancellation of a running operation; steps already started run to completion.
     *
     * @return whether the operation was still running
     */
    public boolean cancel(String operationId) {
        OperationCancellation token = running.get(operationId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested for operation {}", operationId);
        return true;
    }

    public Optional<OperationRecord> operation(String operationId) {
        return journal.find(operationId);
    }

    public List<OperationRecord> operations(StackKey key) {
        return journal.forStack(key);
    }

    public StackRuntimeRecord status(StackKey key) {
        return modes.require(key);
    }

    private OperationHandle modeOperation(StackKey key, OperationKind kind, Work work) {
        return launch(key, kind, () -> modes.checkAllowed(kind, key), work, result -> {
        });
    }

    private void finishMigration(StackKey key, DeploymentPlan plan, DeploymentResult result) {
        if (result.success()) {
            modes.completeSuccess(key, plan);
        } else {
            modes.completeFailure(key, result.firstError());
        }
    }

    private OperationHandle launch(StackKey key,
                                   OperationKind kind,
                                   Runnable begin,
                                   Work work,
                                   Consumer<DeploymentResult> completion) {
        EnvironmentLockRegistry.Lease lease = locks.acquire(key.environmentId(), kind.label() + " of " + key);
        Optional<StackRuntimeRecord> before;
        try {
            before = modes.find(key);
            begin.run();
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
        String operationId = operationIds.get();
        OperationCancellation token = new OperationCancellation();
        journal.start(OperationRecord.started(operationId, key, kind, clock.now()));
        running.put(operationId, token);
        log.info("Accepted {} of {} as operation {}", kind.label(), key, operationId);
        try {
            executor.execute(() -> run(operationId, key, kind, token, work, completion, lease));
        } catch (RejectedExecutionException e) {
            log.warn("Operation executor rejected {} of {}; nothing was changed: {}", kind.label(), key,
                e.getMessage());
            running.remove(operationId);
            journal.discard(operationId);
            try {
                if (!before.equals(modes.find(key))) {
                    modes.restore(key, before);
                }
            } finally {
                lease.close();
            }
            throw new OperationInProgressException(key.environmentId(), "a saturated operation executor");
        }
        return new OperationHandle(operationId, key, true);
    }

    private void run(String operationId,
                     StackKey key,
                     OperationKind kind,
                     OperationCancellation token,
                     Work work,
                     Consumer<DeploymentResult> completion,
                     EnvironmentLockRegistry.Lease lease) {
        try {
            DeploymentResult result;
            boolean crashed = false;
            try {
                result = work.execute(event -> journal.append(operationId, event), token);
            } catch (RuntimeException e) {
                log.error("Operation {} ({} of {}) crashed", operationId, kind.label(), key, e);
                result = DeploymentResult.failure(null, kind.label() + " failed: " + e.getMessage(), clock.now());
                crashed = true;
            }
            record(operationId, key, result, completion, crashed, token);
        } finally {
            running.remove(operationId);
            lease.close();
        }
    }

    private void record(String operationId,
                        StackKey key,
                        DeploymentResult result,
                        Consumer<DeploymentResult> completion,
                        boolean crashed,
                        OperationCancellation token) {
        try {
            if (crashed) {
                modes.failIfKnown(key, result.firstError());
            } else {
                completion.accept(result);
            }
        } catch (RuntimeException e) {
            log.error("Unable to record outcome of operation {} on {}", operationId, key, e);
        }
        OperationStatus status;
        ReasonCode reason;
        if (result.success()) {
            status = OperationStatus.SUCCEEDED;
            reason = null;
        } else if (token.isCancelled()) {
            status = OperationStatus.CANCELLED;
            reason = ReasonCode.CANCELLED;
        } else {
            status = OperationStatus.FAILED;
            reason = ReasonCode.RUNTIME_FAILURE;
        }
        journal.complete(operationId, status, result, reason, clock.now());
        log.info("Operation {} on {} finished {}", operationId, key, status);
    }

    @FunctionalInterface
    private interface Work {
        DeploymentResult execute(DeploymentProgressListener listener, OperationCancellation token);
    }
}
