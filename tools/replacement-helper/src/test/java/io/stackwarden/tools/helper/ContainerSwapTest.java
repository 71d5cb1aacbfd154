package io.stackwarden.tools.helper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.stackwarden.runtime.container.ContainerDetails;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.container.RuntimeErrorCode;
import io.stackwarden.runtime.ports.ContainerRuntime;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContainerSwapTest {

    private static final String OLD = "stackwarden";
    private static final String NEW = "stackwarden-replacement";
    private static final String PREVIOUS = "stackwarden-previous";
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    @Mock
    ContainerRuntime runtime;

    private static ContainerDetails container(String name, String state) {
        return new ContainerDetails(name + "-id", name, "ghcr.io/acme/stackwarden:2.0.0", state,
            "running".equals(state), null, 0, null, null, null, null, null, null, null, null, null);
    }

    private ContainerSwap swap(Duration stopGrace) {
        return new ContainerSwap(runtime, new SwapSettings(stopGrace, STOP_TIMEOUT, Duration.ofMillis(3), Duration.ZERO));
    }

    @Test
    void stopsOldStartsReplacementAndDropsPrevious() {
        when(runtime.inspectContainer(NEW)).thenReturn(container(NEW, "created"));
        when(runtime.inspectContainer(OLD)).thenReturn(container(OLD, "running"));

        SwapOutcome outcome = swap(Duration.ZERO).swap(OLD, NEW);

        assertThat(outcome).isEqualTo(SwapOutcome.SWAPPED);
        assertThat(outcome.exitCode()).isZero();
        InOrder order = inOrder(runtime);
        order.verify(runtime).stopContainer(OLD, STOP_TIMEOUT);
        order.verify(runtime).renameContainer(OLD, PREVIOUS);
        order.verify(runtime).renameContainer(NEW, OLD);
        order.verify(runtime).startContainer(OLD);
        order.verify(runtime).removeContainer(PREVIOUS, true);
    }

    @Test
    void doesNotStopAnOldContainerThatExitsOnItsOwn() {
        when(runtime.inspectContainer(NEW)).thenReturn(container(NEW, "created"));
        when(runtime.inspectContainer(OLD)).thenReturn(container(OLD, "running"), container(OLD, "exited"),
            container(OLD, "running"));

        SwapOutcome outcome = swap(Duration.ofMillis(5)).swap(OLD, NEW);

        assertThat(outcome).isEqualTo(SwapOutcome.SWAPPED);
        verify(runtime, never()).stopContainer(anyString(), any());
    }

    @Test
    void removesLeftoverPreviousContainerFirst() {
        when(runtime.inspectContainer(NEW)).thenReturn(container(NEW, "created"));
        when(runtime.inspectContainer(OLD)).thenReturn(container(OLD, "running"));
        when(runtime.findContainer(PREVIOUS)).thenReturn(Optional.of(
            new ContainerSummary("stale", PREVIOUS, "ghcr.io/acme/stackwarden:1.0.0", "exited", "Exited (0)", Map.of())));

        swap(Duration.ZERO).swap(OLD, NEW);

        InOrder order = inOrder(runtime);
        order.verify(runtime).removeContainer(PREVIOUS, true);
        order.verify(runtime).renameContainer(OLD, PREVIOUS);
    }

    @Test
    void restoresPreviousWhenReplacementExits() {
        when(runtime.inspectContainer(NEW)).thenReturn(container(NEW, "created"));
        when(runtime.inspectContainer(OLD)).thenReturn(container(OLD, "running"), container(OLD, "running"),
            container(OLD, "exited"));

        SwapOutcome outcome = swap(Duration.ZERO).swap(OLD, NEW);

        assertThat(outcome).isEqualTo(SwapOutcome.RESTORED);
        assertThat(outcome.exitCode()).isEqualTo(1);
        InOrder order = inOrder(runtime);
        order.verify(runtime).renameContainer(NEW, OLD);
        order.verify(runtime).startContainer(OLD);
        order.verify(runtime).stopContainer(OLD, STOP_TIMEOUT);
        order.verify(runtime).renameContainer(OLD, NEW);
        order.verify(runtime).renameContainer(PREVIOUS, OLD);
        order.verify(runtime).startContainer(OLD);
        verify(runtime, never()).removeContainer(anyString(), anyBoolean());
    }

    @Test
    void reportsFailedRestore() {
        when(runtime.inspectContainer(NEW)).thenReturn(container(NEW, "created"));
        when(runtime.inspectContainer(OLD)).thenReturn(container(OLD, "running"), container(OLD, "running"),
            container(OLD, "dead"));
        lenient().doThrow(new ContainerRuntimeException(RuntimeErrorCode.CONFLICT, "rename", "name in use"))
            .when(runtime).renameContainer(PREVIOUS, OLD);

        SwapOutcome outcome = swap(Duration.ZERO).swap(OLD, NEW);

        assertThat(outcome).isEqualTo(SwapOutcome.RESTORE_FAILED);
        assertThat(outcome.exitCode()).isEqualTo(2);
    }

    @Test
    void missingReplacementLeavesOldRunning() {
        when(runtime.inspectContainer(NEW))
            .thenThrow(new ContainerRuntimeException(RuntimeErrorCode.NOT_FOUND, "inspect", "No such container"));

        SwapOutcome outcome = swap(Duration.ZERO).swap(OLD, NEW);

        assertThat(outcome).isEqualTo(SwapOutcome.RESTORED);
        verify(runtime, never()).renameContainer(anyString(), anyString());
        verify(runtime, never()).stopContainer(anyString(), any());
        verify(runtime).startContainer(OLD);
    }

    @Test
    void startsReplacementWhenOldContainerIsGone() {
        when(runtime.inspectContainer(NEW)).thenReturn(container(NEW, "created"));
        when(runtime.inspectContainer(OLD))
            .thenThrow(new ContainerRuntimeException(RuntimeErrorCode.NOT_FOUND, "inspect", "No such container"))
            .thenReturn(container(OLD, "running"));

        SwapOutcome outcome = swap(Duration.ZERO).swap(OLD, NEW);

        assertThat(outcome).isEqualTo(SwapOutcome.SWAPPED);
        verify(runtime).renameContainer(NEW, OLD);
        verify(runtime, never()).renameContainer(OLD, PREVIOUS);
        verify(runtime, never()).removeContainer(anyString(), anyBoolean());
        verify(runtime, times(1)).startContainer(OLD);
    }
}
