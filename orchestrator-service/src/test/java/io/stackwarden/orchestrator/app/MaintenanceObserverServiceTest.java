package io.stackwarden.orchestrator.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.stackwarden.orchestrator.domain.ObserverResult;
import io.stackwarden.orchestrator.domain.OperationInProgressException;
import io.stackwarden.orchestrator.domain.OperationMode;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackNotFoundException;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.orchestrator.infra.InMemoryStackStateStore;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.DeploymentPlan;
import io.stackwarden.stack.model.FileObserverSettings;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MaintenanceObserverServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final StackKey SHOP = new StackKey("staging", "shop");
    private static final Duration POLL = Duration.ofSeconds(30);
    private static final MaintenanceObserverDefinition FLAG = new MaintenanceObserverDefinition(POLL, "on", "off",
        new FileObserverSettings("/srv/flags/shop", FileObserverSettings.Mode.CONTENT, null));

    @Mock
    StackOperationService operations;

    private final AtomicReference<Instant> now = new AtomicReference<>(NOW);
    private final AtomicReference<String> observed = new AtomicReference<>("off");
    private final AtomicInteger reads = new AtomicInteger();
    private final AtomicInteger created = new AtomicInteger();
    private final Clock clock = new Clock() {
        @Override
        public long currentTimeMillis() {
            return now.get().toEpochMilli();
        }

        @Override
        public Instant now() {
            return now.get();
        }
    };
    private InMemoryStackStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStackStateStore();
    }

    private MaintenanceObserverService service(boolean enabled) {
        MaintenanceObserverFactory factory = definition -> {
            created.incrementAndGet();
            return new AbstractMaintenanceObserver(definition, clock) {
                @Override
                protected String readValue() throws IOException {
                    reads.incrementAndGet();
                    String value = observed.get();
                    if (value == null) {
                        throw new IOException("flag file unreadable");
                    }
                    return value;
                }
            };
        };
        return new MaintenanceObserverService(store, operations, factory, clock, enabled);
    }

    private void deployed(OperationMode mode, MaintenanceObserverDefinition observer) {
        DeploymentPlan plan = new DeploymentPlan("1.0.0", "staging", "shop", null, null, null, observer);
        store.save(StackRuntimeRecord.initial(SHOP, "acme", NOW).toBuilder()
            .mode(mode)
            .currentVersion("1.0.0")
            .currentPlan(plan)
            .build());
    }

    @Test
    void maintenanceValueMovesNormalStackIntoMaintenance() {
        deployed(OperationMode.NORMAL, FLAG);
        observed.set("ON");

        service(true).tick();

        verify(operations).enterMaintenance(SHOP);
        verify(operations, never()).exitMaintenance(SHOP);
    }

    @Test
    void normalValueBringsStackBackFromMaintenance() {
        deployed(OperationMode.MAINTENANCE, FLAG);
        observed.set("off");

        service(true).tick();

        verify(operations).exitMaintenance(SHOP);
    }

    @Test
    void matchingModeNeedsNoCommand() {
        deployed(OperationMode.NORMAL, FLAG);
        observed.set("off");
        MaintenanceObserverService service = service(true);

        service.tick();

        verifyNoInteractions(operations);
        assertThat(service.lastResult(SHOP)).hasValueSatisfying(result -> assertEquals("off", result.observedValue()));
    }

    @Test
    void unexpectedValueLeavesTheModeAlone() {
        deployed(OperationMode.MAINTENANCE, FLAG);
        observed.set("maybe");
        MaintenanceObserverService service = service(true);

        service.tick();

        verifyNoInteractions(operations);
        assertThat(service.lastResult(SHOP)).hasValueSatisfying(
            result -> assertEquals("Unexpected value: maybe", result.error()));
    }

    @Test
    void unreadableSourceLeavesTheModeAlone() {
        deployed(OperationMode.NORMAL, FLAG);
        observed.set(null);
        MaintenanceObserverService service = service(true);

        service.tick();

        verifyNoInteractions(operations);
        assertThat(service.lastResult(SHOP)).hasValueSatisfying(
            result -> assertThat(result.error()).contains("flag file unreadable"));
    }

    @Test
    void observerIsReadOncePerPollInterval() {
        deployed(OperationMode.NORMAL, FLAG);
        MaintenanceObserverService service = service(true);

        service.tick();
        now.set(NOW.plusSeconds(10));
        service.tick();
        assertEquals(1, reads.get());

        now.set(NOW.plus(POLL));
        service.tick();
        assertEquals(2, reads.get());
        assertEquals(1, created.get());
    }

    @Test
    void busyEnvironmentIsRetriedOnTheNextPoll() {
        deployed(OperationMode.NORMAL, FLAG);
        observed.set("on");
        when(operations.enterMaintenance(SHOP)).thenThrow(new OperationInProgressException("staging", "deploy"));
        MaintenanceObserverService service = service(true);

        service.tick();
        now.set(NOW.plus(POLL));
        service.tick();

        verify(operations, times(2)).enterMaintenance(SHOP);
    }

    @Test
    void changedObserverDefinitionIsRebuilt() {
        deployed(OperationMode.NORMAL, FLAG);
        MaintenanceObserverService service = service(true);
        service.tick();

        deployed(OperationMode.NORMAL, new MaintenanceObserverDefinition(POLL, "closed", null, FLAG.settings()));
        service.tick();

        assertEquals(2, created.get());
        assertEquals(2, reads.get());
    }

    @Test
    void removedObserverForgetsItsLastResult() {
        deployed(OperationMode.NORMAL, FLAG);
        MaintenanceObserverService service = service(true);
        service.tick();
        assertThat(service.lastResult(SHOP)).isPresent();

        deployed(OperationMode.NORMAL, null);
        service.tick();

        assertThat(service.lastResult(SHOP)).isEmpty();
    }

    @Test
    void disabledObserversNeverRun() {
        deployed(OperationMode.NORMAL, FLAG);
        observed.set("on");

        service(false).tick();

        assertEquals(0, reads.get());
        verifyNoInteractions(operations);
    }

    @Test
    void checkRunsImmediatelyRegardlessOfPollInterval() {
        deployed(OperationMode.NORMAL, FLAG);
        MaintenanceObserverService service = service(true);
        service.tick();
        observed.set("on");

        ObserverResult result = service.check(SHOP).orElseThrow();

        assertTrue(result.maintenanceRequired());
        assertEquals(2, reads.get());
        verify(operations).enterMaintenance(SHOP);
    }

    @Test
    void checkWithoutObserverIsEmpty() {
        deployed(OperationMode.NORMAL, null);

        assertThat(service(true).check(SHOP)).isEmpty();
        assertThatThrownBy(() -> service(true).check(new StackKey("staging", "blog")))
            .isInstanceOf(StackNotFoundException.class);
    }
}
