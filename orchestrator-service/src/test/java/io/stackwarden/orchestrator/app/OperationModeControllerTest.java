package io.stackwarden.orchestrator.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stackwarden.orchestrator.domain.DeploymentStatus;
import io.stackwarden.orchestrator.domain.EnvironmentContext;
import io.stackwarden.orchestrator.domain.InvalidTransitionException;
import io.stackwarden.orchestrator.domain.OperationKind;
import io.stackwarden.orchestrator.domain.OperationMode;
import io.stackwarden.orchestrator.domain.ReasonCode;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackNotFoundException;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.orchestrator.domain.TransitionKind;
import io.stackwarden.orchestrator.infra.InMemoryStackStateStore;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.DeploymentPlan;
import io.stackwarden.stack.model.DeploymentResult;
import io.stackwarden.stack.model.StackLabels;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OperationModeControllerTest {

    private static final EnvironmentContext STAGING = new EnvironmentContext("acme", "staging");
    private static final StackKey SHOP = STAGING.stack("shop");

    private final PlanBuilder planBuilder = new PlanBuilder(new NetworkResolver());
    private InMemoryStackStateStore store;
    private RecordingContainerRuntime runtime;
    private OperationModeController controller;

    @BeforeEach
    void setUp() {
        store = new InMemoryStackStateStore();
        runtime = new RecordingContainerRuntime();
        controller = new OperationModeController(store, runtime, Clock.fixed(Instant.parse("2026-03-01T10:00:00Z")),
            Duration.ofSeconds(5));
    }

    private DeploymentPlan plan(String version) {
        return planBuilder.build(Stacks.shop(version), STAGING);
    }

    private void deployed(String version) {
        controller.beginDeploy(SHOP, "acme", version, false);
        controller.completeSuccess(SHOP, plan(version));
    }

    private void failedUpgrade(String from, String to, boolean rollbackDisabled) {
        deployed(from);
        controller.beginUpgrade(SHOP, to, rollbackDisabled);
        controller.completeFailure(SHOP, "api: create failed");
    }

    private static Map<String, String> labels(String context, boolean ignore) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(StackLabels.STACK, "shop");
        labels.put(StackLabels.ENVIRONMENT, "staging");
        labels.put(StackLabels.CONTEXT, context);
        if (ignore) {
            labels.put(StackLabels.MAINTENANCE, StackLabels.MAINTENANCE_IGNORE);
        }
        return labels;
    }

    private void runningShop() {
        runtime.withContainer("shop_db", "running", labels("db", true))
            .withContainer("shop_api", "running", labels("api", false))
            .withContainer("shop_gateway", "running", labels("gateway", false))
            .withContainer("blog_web", "running", Map.of(StackLabels.STACK, "blog", StackLabels.ENVIRONMENT, "staging"));
    }

    @Test
    void firstDeploymentMovesThroughMigratingToNormal() {
        StackRuntimeRecord migrating = controller.beginDeploy(SHOP, "acme", "1.0.0", false);

        assertEquals(OperationMode.MIGRATING, migrating.mode());
        assertEquals(DeploymentStatus.DEPLOYING, migrating.deploymentStatus());
        assertThat(migrating.targetVersion()).contains("1.0.0");

        StackRuntimeRecord normal = controller.completeSuccess(SHOP, plan("1.0.0"));

        assertEquals(OperationMode.NORMAL, normal.mode());
        assertThat(normal.currentVersion()).contains("1.0.0");
        assertThat(normal.targetVersion()).isEmpty();
        assertTrue(normal.deployed());
    }

    @Test
    void rejectsDeployWhileMigrating() {
        controller.beginDeploy(SHOP, "acme", "1.0.0", false);

        assertThatThrownBy(() -> controller.beginDeploy(SHOP, "acme", "1.0.0", false))
            .isInstanceOfSatisfying(InvalidTransitionException.class,
                e -> assertEquals(ReasonCode.INVALID_TRANSITION, e.reason()));
    }

    @Test
    void upgradeRetainsTheCurrentPlanAsSnapshot() {
        deployed("1.0.0");

        StackRuntimeRecord upgrading = controller.beginUpgrade(SHOP, "1.1.0", false);

        assertEquals(TransitionKind.UPGRADE, upgrading.lastTransition());
        assertEquals(DeploymentStatus.UPGRADING, upgrading.deploymentStatus());
        assertThat(upgrading.snapshot()).hasValueSatisfying(snapshot -> assertEquals("1.0.0", snapshot.version()));
    }

    @Test
    void upgradeRequiresADeployedStack() {
        controller.beginDeploy(SHOP, "acme", "1.0.0", false);
        controller.completeFailure(SHOP, "boom");

        assertThatThrownBy(() -> controller.beginUpgrade(SHOP, "1.1.0", false))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("FAILED");
    }

    @Test
    void rollbackIsAvailableAfterAFailedUpgrade() {
        failedUpgrade("1.0.0", "1.1.0", false);

        assertTrue(controller.require(SHOP).rollbackAvailable());
        DeploymentPlan restore = controller.beginRollback(SHOP);

        assertEquals("1.0.0", restore.stackVersion());
        StackRuntimeRecord record = controller.require(SHOP);
        assertEquals(OperationMode.MIGRATING, record.mode());
        assertEquals(DeploymentStatus.ROLLING_BACK, record.deploymentStatus());
        assertEquals(TransitionKind.ROLLBACK, record.lastTransition());
        assertThat(record.targetVersion()).contains("1.0.0");
    }

    @Test
    void failedRollbackCanBeRetried() {
        failedUpgrade("1.0.0", "1.1.0", false);
        controller.beginRollback(SHOP);
        controller.completeFailure(SHOP, "db: pull failed");

        assertTrue(controller.require(SHOP).rollbackAvailable());
        assertEquals("1.0.0", controller.beginRollback(SHOP).stackVersion());
    }

    @Test
    void rollbackIsRejectedAfterASuccessfulUpgrade() {
        deployed("1.0.0");
        controller.beginUpgrade(SHOP, "1.1.0", false);
        controller.completeSuccess(SHOP, plan("1.1.0"));

        assertThat(controller.require(SHOP).snapshot()).isEmpty();
        assertRollbackUnavailable();
    }

    @Test
    void rollbackIsRejectedAfterAFailedDowngrade() {
        failedUpgrade("1.1.0", "1.0.0", false);

        StackRuntimeRecord record = controller.require(SHOP);
        assertEquals(TransitionKind.DOWNGRADE, record.lastTransition());
        assertThat(record.snapshot()).isEmpty();
        assertRollbackUnavailable();
    }

    @Test
    void rollbackIsRejectedWhenTheStackDisablesIt() {
        failedUpgrade("1.0.0", "1.1.0", true);

        assertThat(controller.require(SHOP).snapshot()).isPresent();
        assertRollbackUnavailable();
    }

    @Test
    void rollbackIsRejectedAfterAFailedFirstDeployment() {
        controller.beginDeploy(SHOP, "acme", "1.0.0", false);
        controller.completeFailure(SHOP, "db: create failed");

        assertRollbackUnavailable();
    }

    private void assertRollbackUnavailable() {
        assertFalse(controller.require(SHOP).rollbackAvailable());
        assertThatThrownBy(() -> controller.beginRollback(SHOP))
            .isInstanceOfSatisfying(InvalidTransitionException.class,
                e -> assertEquals(ReasonCode.ROLLBACK_UNAVAILABLE, e.reason()));
    }

    @Test
    void maintenanceStopsOnlyContainersNotMarkedToKeepRunning() {
        deployed("1.0.0");
        runningShop();

        DeploymentResult entered = controller.enterMaintenance(SHOP, DeploymentProgressListener.noop());

        assertTrue(entered.success());
        assertThat(runtime.targets("stop")).containsExactly("shop_api", "shop_gateway");
        assertEquals("running", runtime.container("shop_db").orElseThrow().state);
        assertEquals("running", runtime.container("blog_web").orElseThrow().state);
        StackRuntimeRecord record = controller.require(SHOP);
        assertEquals(OperationMode.MAINTENANCE, record.mode());
        assertThat(record.stoppedContainers()).containsExactly("shop_api", "shop_gateway");

        DeploymentResult exited = controller.exitMaintenance(SHOP, DeploymentProgressListener.noop());

        assertTrue(exited.success());
        assertThat(runtime.targets("start")).containsExactly("shop_api", "shop_gateway");
        assertEquals(OperationMode.NORMAL, controller.require(SHOP).mode());
        assertThat(controller.require(SHOP).stoppedContainers()).isEmpty();
    }

    @Test
    void stopTakesDownEveryContainerAndStartBringsThemBack() {
        deployed("1.0.0");
        runningShop();

        controller.checkAllowed(OperationKind.STOP, SHOP);
        controller.stop(SHOP, DeploymentProgressListener.noop());

        assertThat(runtime.targets("stop")).containsExactly("shop_db", "shop_api", "shop_gateway");
        assertEquals(OperationMode.STOPPED, controller.require(SHOP).mode());

        controller.checkAllowed(OperationKind.START, SHOP);
        controller.start(SHOP, DeploymentProgressListener.noop());

        assertThat(runtime.targets("start")).containsExactly("shop_db", "shop_api", "shop_gateway");
        assertEquals(OperationMode.NORMAL, controller.require(SHOP).mode());
    }

    @Test
    void failedStopIsRecoveredByRestartingWhatWasStopped() {
        deployed("1.0.0");
        runningShop();
        runtime.failOn("stop", "shop_api");

        DeploymentResult result = controller.stop(SHOP, DeploymentProgressListener.noop());

        assertFalse(result.success());
        StackRuntimeRecord failed = controller.require(SHOP);
        assertEquals(OperationMode.FAILED, failed.mode());
        assertThat(failed.stoppedContainers()).containsExactly("shop_db");
        assertThat(failed.lastError()).hasValueSatisfying(error -> assertThat(error).contains("stop of shop_api"));

        controller.checkAllowed(OperationKind.RECOVER, SHOP);
        DeploymentResult recovered = controller.recover(SHOP, DeploymentProgressListener.noop());

        assertTrue(recovered.success());
        assertThat(runtime.targets("start")).containsExactly("shop_db");
        assertEquals(OperationMode.NORMAL, controller.require(SHOP).mode());
    }

    @Test
    void rejectsModeOperationsFromTheWrongMode() {
        deployed("1.0.0");

        assertThatThrownBy(() -> controller.checkAllowed(OperationKind.EXIT_MAINTENANCE, SHOP))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessage("Cannot exit maintenance stack staging/shop while it is NORMAL");
        assertThatThrownBy(() -> controller.checkAllowed(OperationKind.START, SHOP))
            .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> controller.checkAllowed(OperationKind.RECOVER, SHOP))
            .isInstanceOf(InvalidTransitionException.class);

        controller.beginUpgrade(SHOP, "1.1.0", false);

        assertThatThrownBy(() -> controller.checkAllowed(OperationKind.REMOVE, SHOP))
            .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> controller.checkAllowed(OperationKind.ENTER_MAINTENANCE, SHOP))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void unknownStacksAreReportedAsNotFound() {
        assertThatThrownBy(() -> controller.checkAllowed(OperationKind.STOP, STAGING.stack("blog")))
            .isInstanceOfSatisfying(StackNotFoundException.class,
                e -> assertEquals(ReasonCode.STACK_NOT_FOUND, e.reason()));
    }

    @Test
    void removeForgetsTheStack() {
        deployed("1.0.0");

        controller.remove(SHOP);

        assertThat(store.find(SHOP)).isEmpty();
    }
}
